package work.lumen.kernel.parse;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import work.lumen.kernel.error.ParseException;
import work.lumen.kernel.lex.LexemeRole;
import work.lumen.kernel.lex.SourcePosition;
import work.lumen.kernel.lex.Token;

/**
 * Cursor over a normalized token list. Reading past the last token yields a zero-width end token
 * positioned at the end of the source.
 */
public final class TokenStream {
    public static final String END = "<end>";

    private final List<Token> tokens;
    private final String source;
    private final Token end;
    private int position;

    public TokenStream(List<Token> tokens, String source) {
        this.tokens = List.copyOf(tokens);
        this.source = Objects.requireNonNull(source, "source");
        this.end = Token.marker(END, source.length());
    }

    public String source() {
        return source;
    }

    public Token peek() {
        return peek(0);
    }

    public Token peek(int ahead) {
        int index = position + ahead;
        return index < tokens.size() ? tokens.get(index) : end;
    }

    /** The most recently consumed token, or {@code null} at the start of the stream. */
    public Token previous() {
        return position == 0 ? null : tokens.get(position - 1);
    }

    public Token advance() {
        var token = peek();
        if (position < tokens.size()) {
            position++;
        }
        return token;
    }

    public boolean atEnd() {
        return position >= tokens.size();
    }

    public boolean check(String lexeme) {
        return !atEnd() && peek().is(lexeme);
    }

    public boolean check(LexemeRole role) {
        return !atEnd() && peek().role() == role;
    }

    public boolean match(String lexeme) {
        if (check(lexeme)) {
            position++;
            return true;
        }
        return false;
    }

    public Token expect(String lexeme) {
        if (!check(lexeme)) {
            throw unexpected("'" + lexeme + "'");
        }
        return advance();
    }

    public Token expect(LexemeRole role, String description) {
        if (!check(role)) {
            throw unexpected(description);
        }
        return advance();
    }

    /** Skips any run of the given lexemes (statement terminators, newline markers). */
    public void skip(Set<String> lexemes) {
        while (!atEnd() && lexemes.contains(peek().lexeme())) {
            position++;
        }
    }

    public int position() {
        return position;
    }

    public void reset(int mark) {
        if (mark < 0 || mark > tokens.size()) {
            throw new IllegalArgumentException("Invalid token position " + mark);
        }
        this.position = mark;
    }

    public ParseException unexpected(String expected) {
        var token = peek();
        if (atEnd()) {
            return new ParseException("Unexpected end of input, expected " + expected, token.span());
        }
        return new ParseException(
            "Expected " + expected + " but found '" + token.lexeme() + "' at " + SourcePosition.of(source, token.span().start()),
            token.span()
        );
    }

    public ParseException error(String message) {
        return new ParseException(message, peek().span());
    }
}
