package work.lumen.kernel.error;

import work.lumen.kernel.lex.Span;

/**
 * Raised by a value system when well-typed operands have no result, such as a division by zero.
 */
public final class ArithmeticFaultException extends KernelException {
    public ArithmeticFaultException(String message) {
        super("arithmetic_error", message, null);
    }

    public ArithmeticFaultException(String message, Span span) {
        super("arithmetic_error", message, span);
    }
}
