package work.lumen.kernel.registry;

import java.util.Objects;
import work.lumen.kernel.error.ConfigurationException;

/**
 * One slot of a statement pattern. Literal kinds carry a lexeme, the others carry the field name
 * the parsed piece is stored under.
 *
 * <p>Textual form used by schema files: {@code expr:cond}, {@code expr?:value}, {@code block:body},
 * {@code ident:name}, {@code params:params}, {@code =:} (required literal {@code :}) and
 * {@code ?else} (optional literal; when absent the rest of the pattern is skipped) and
 * {@code &elif} (optional literal that starts another application of the same statement, stored in
 * the next block field).
 */
public record PatternElement(Kind kind, String lexeme, String field) {
    public PatternElement {
        Objects.requireNonNull(kind, "kind");
        if (kind.literal() && (lexeme == null || lexeme.isEmpty())) {
            throw new ConfigurationException("Literal pattern element needs a lexeme");
        }
        if (!kind.literal() && (field == null || field.isBlank())) {
            throw new ConfigurationException(kind + " pattern element needs a field name");
        }
    }

    public static PatternElement expression(String field) {
        return new PatternElement(Kind.EXPRESSION, null, field);
    }

    public static PatternElement optionalExpression(String field) {
        return new PatternElement(Kind.OPTIONAL_EXPRESSION, null, field);
    }

    public static PatternElement block(String field) {
        return new PatternElement(Kind.BLOCK, null, field);
    }

    public static PatternElement identifier(String field) {
        return new PatternElement(Kind.IDENTIFIER, null, field);
    }

    public static PatternElement parameters(String field) {
        return new PatternElement(Kind.PARAMETERS, null, field);
    }

    public static PatternElement literal(String lexeme) {
        return new PatternElement(Kind.LITERAL, lexeme, null);
    }

    public static PatternElement optionalLiteral(String lexeme) {
        return new PatternElement(Kind.OPTIONAL_LITERAL, lexeme, null);
    }

    public static PatternElement chain(String lexeme) {
        return new PatternElement(Kind.CHAIN, lexeme, null);
    }

    public static PatternElement parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ConfigurationException("Empty pattern element");
        }
        var text = raw.trim();
        if (text.startsWith("=") && text.length() > 1) {
            return literal(text.substring(1));
        }
        if (text.startsWith("?") && text.length() > 1) {
            return optionalLiteral(text.substring(1));
        }
        if (text.startsWith("&") && text.length() > 1) {
            return chain(text.substring(1));
        }
        int colon = text.indexOf(':');
        if (colon <= 0 || colon == text.length() - 1) {
            throw new ConfigurationException("Malformed pattern element '" + raw + "'");
        }
        var kind = text.substring(0, colon);
        var field = text.substring(colon + 1);
        return switch (kind) {
            case "expr" -> expression(field);
            case "expr?" -> optionalExpression(field);
            case "block" -> block(field);
            case "ident" -> identifier(field);
            case "params" -> parameters(field);
            default -> throw new ConfigurationException("Unknown pattern element kind '" + kind + "' in '" + raw + "'");
        };
    }

    public enum Kind {
        EXPRESSION,
        OPTIONAL_EXPRESSION,
        BLOCK,
        IDENTIFIER,
        PARAMETERS,
        LITERAL,
        OPTIONAL_LITERAL,
        CHAIN;

        public boolean literal() {
            return this == LITERAL || this == OPTIONAL_LITERAL || this == CHAIN;
        }
    }
}
