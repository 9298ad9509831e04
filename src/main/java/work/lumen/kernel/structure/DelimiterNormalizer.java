package work.lumen.kernel.structure;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import work.lumen.kernel.error.ParseException;
import work.lumen.kernel.lex.LexemeRole;
import work.lumen.kernel.lex.Token;

/**
 * Validates that delimiter pairs are balanced and properly nested; tokens pass through unchanged.
 */
public final class DelimiterNormalizer implements StructuralNormalizer {
    private final Map<String, String> pairs;
    private final Map<String, String> reverse = new HashMap<>();

    public DelimiterNormalizer(Map<String, String> pairs) {
        this.pairs = Map.copyOf(pairs);
        pairs.forEach((open, close) -> reverse.put(close, open));
    }

    @Override
    public List<Token> normalize(String source, List<Token> tokens) {
        Deque<Token> open = new ArrayDeque<>();
        for (var token : tokens) {
            if (token.role() == LexemeRole.STRING) {
                continue;
            }
            if (pairs.containsKey(token.lexeme())) {
                open.push(token);
            } else if (reverse.containsKey(token.lexeme())) {
                if (open.isEmpty()) {
                    throw new ParseException("Unmatched '" + token.lexeme() + "'", token.span());
                }
                var opener = open.pop();
                var expected = pairs.get(opener.lexeme());
                if (!expected.equals(token.lexeme())) {
                    throw new ParseException(
                        "Expected '" + expected + "' to close '" + opener.lexeme() + "' but found '" + token.lexeme() + "'",
                        token.span()
                    );
                }
            }
        }
        if (!open.isEmpty()) {
            var unclosed = open.peek();
            throw new ParseException("Unclosed '" + unclosed.lexeme() + "'", unclosed.span());
        }
        return tokens;
    }
}
