package work.lumen.kernel.lex;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lumen.kernel.error.LexicalException;

/**
 * Maximal-munch tokenizer driven by a {@link LexemeTable}.
 *
 * <p>At each offset the longest registered lexeme and the longest fallback match are compared and
 * the longer one wins; a registered lexeme wins a tie. Lexemes made only of word characters must
 * end on a word boundary. Skip-role matches are consumed but never emitted.
 */
public final class Tokenizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(Tokenizer.class);

    private final LexemeTable table;

    public Tokenizer(LexemeTable table) {
        this.table = Objects.requireNonNull(table, "table");
    }

    public List<Token> tokenize(String source) {
        Objects.requireNonNull(source, "source");
        var tokens = new ArrayList<Token>();
        int offset = 0;
        while (offset < source.length()) {
            var registered = matchRegistered(source, offset);
            int registeredLength = registered == null ? 0 : registered.lexeme().length();

            FallbackRule fallback = null;
            int fallbackLength = 0;
            for (var rule : table.fallbacks()) {
                int length = rule.match(source, offset);
                if (length > fallbackLength) {
                    fallback = rule;
                    fallbackLength = length;
                }
            }

            int length;
            LexemeRole role;
            if (registered != null && registeredLength >= fallbackLength) {
                length = registeredLength;
                role = registered.role();
            } else if (fallback != null) {
                length = fallbackLength;
                role = fallback.role();
            } else {
                throw new LexicalException(
                    "Unexpected character '" + source.charAt(offset) + "' at " + SourcePosition.of(source, offset),
                    Span.of(offset, offset + 1)
                );
            }
            if (role != LexemeRole.SKIP) {
                tokens.add(new Token(source.substring(offset, offset + length), Span.of(offset, offset + length), role));
            }
            offset += length;
        }
        LOGGER.debug("Tokenized {} chars into {} tokens", source.length(), tokens.size());
        return tokens;
    }

    private LexemeTable.Entry matchRegistered(String source, int offset) {
        for (var entry : table.entries()) {
            if (!source.startsWith(entry.lexeme(), offset)) {
                continue;
            }
            int end = offset + entry.lexeme().length();
            if (entry.isWord() && end < source.length() && FallbackRules.isIdentifierPart(source.charAt(end))) {
                continue;
            }
            return entry;
        }
        return null;
    }
}
