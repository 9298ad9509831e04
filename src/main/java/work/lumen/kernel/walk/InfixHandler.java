package work.lumen.kernel.walk;

import work.lumen.kernel.lex.Token;
import work.lumen.kernel.registry.Associativity;

/**
 * Parses a construct that continues an already parsed left operand (binary operators, calls).
 */
public interface InfixHandler {
    boolean matches(Token token);

    int precedence(Token operator);

    Associativity associativity(Token operator);

    /** Called with {@code operator} already consumed; use {@link TreeParser#parseOperand} for the right side. */
    ExecNode parse(TreeParser parser, ExecNode left, Token operator);
}
