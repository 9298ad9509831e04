package work.lumen.kernel.lex;

public enum LexemeRole {
    KEYWORD,
    OPERATOR,
    DELIMITER,
    SKIP,
    IDENTIFIER,
    NUMBER,
    STRING,
    /** Synthesized by a structural normalizer (indent/dedent/newline). */
    MARKER
}
