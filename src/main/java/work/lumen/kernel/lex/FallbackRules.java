package work.lumen.kernel.lex;

import work.lumen.kernel.error.LexicalException;

/**
 * Stock fallback rules shared by the built-in languages.
 */
public final class FallbackRules {
    private FallbackRules() {}

    public static FallbackRule identifier() {
        return new Rule("identifier", LexemeRole.IDENTIFIER) {
            @Override
            public int match(String source, int offset) {
                if (!isIdentifierStart(source.charAt(offset))) {
                    return 0;
                }
                int end = offset + 1;
                while (end < source.length() && isIdentifierPart(source.charAt(end))) {
                    end++;
                }
                return end - offset;
            }
        };
    }

    /** Decimal integers with an optional fractional part ({@code 42}, {@code 3.14}). */
    public static FallbackRule number() {
        return new Rule("number", LexemeRole.NUMBER) {
            @Override
            public int match(String source, int offset) {
                int end = digits(source, offset);
                if (end == offset) {
                    return 0;
                }
                if (end + 1 < source.length() && source.charAt(end) == '.' && Character.isDigit(source.charAt(end + 1))) {
                    end = digits(source, end + 1);
                }
                return end - offset;
            }
        };
    }

    public static FallbackRule quoted(char quote) {
        return new Rule("string", LexemeRole.STRING) {
            @Override
            public int match(String source, int offset) {
                if (source.charAt(offset) != quote) {
                    return 0;
                }
                int i = offset + 1;
                while (i < source.length()) {
                    char c = source.charAt(i);
                    if (c == '\\') {
                        i += 2;
                        continue;
                    }
                    if (c == quote) {
                        return i + 1 - offset;
                    }
                    if (c == '\n') {
                        break;
                    }
                    i++;
                }
                throw new LexicalException("Unterminated string literal", Span.of(offset, Math.min(i, source.length())));
            }
        };
    }

    /** Skips from {@code prefix} to the end of the line. */
    public static FallbackRule lineComment(String prefix) {
        return new Rule("comment", LexemeRole.SKIP) {
            @Override
            public int match(String source, int offset) {
                if (!source.startsWith(prefix, offset)) {
                    return 0;
                }
                int end = source.indexOf('\n', offset);
                return (end < 0 ? source.length() : end) - offset;
            }
        };
    }

    public static FallbackRule whitespace() {
        return new Rule("whitespace", LexemeRole.SKIP) {
            @Override
            public int match(String source, int offset) {
                int end = offset;
                while (end < source.length() && Character.isWhitespace(source.charAt(end))) {
                    end++;
                }
                return end - offset;
            }
        };
    }

    static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static int digits(String source, int offset) {
        int end = offset;
        while (end < source.length() && Character.isDigit(source.charAt(end))) {
            end++;
        }
        return end;
    }

    private abstract static class Rule implements FallbackRule {
        private final String name;
        private final LexemeRole role;

        Rule(String name, LexemeRole role) {
            this.name = name;
            this.role = role;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public LexemeRole role() {
            return role;
        }

        @Override
        public String toString() {
            return "fallback:" + name;
        }
    }
}
