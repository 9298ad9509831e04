package work.lumen.kernel.walk;

import work.lumen.kernel.lex.Token;

/**
 * Parses a term that starts with {@code token} (literal, variable, grouping, unary operator...).
 */
public interface PrefixHandler {
    boolean matches(Token token);

    /** Called with {@code token} already consumed. */
    ExecNode parse(TreeParser parser, Token token);
}
