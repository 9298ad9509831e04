package work.lumen.kernel.lex;

import java.util.Objects;

public record Token(String lexeme, Span span, LexemeRole role) {
    public Token {
        Objects.requireNonNull(lexeme, "lexeme");
        Objects.requireNonNull(span, "span");
        Objects.requireNonNull(role, "role");
    }

    public static Token marker(String lexeme, int offset) {
        return new Token(lexeme, Span.at(offset), LexemeRole.MARKER);
    }

    public boolean is(String candidate) {
        return lexeme.equals(candidate);
    }

    public boolean isMarker() {
        return role == LexemeRole.MARKER;
    }

    @Override
    public String toString() {
        return role.name().toLowerCase() + "('" + lexeme + "')@" + span;
    }
}
