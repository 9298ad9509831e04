package work.lumen.kernel.lex;

/**
 * Pattern-based lexeme class tried when no registered literal lexeme matches (identifiers,
 * numbers, strings, comments, whitespace).
 */
public interface FallbackRule {
    String name();

    LexemeRole role();

    /**
     * @return the number of characters matched at {@code offset}, or {@code 0} when the rule does not apply
     */
    int match(String source, int offset);
}
