package work.lumen.kernel.error;

import work.lumen.kernel.lex.Span;

/**
 * Raised when an operation receives values it cannot handle, or a call receives the wrong
 * number of arguments.
 */
public final class RuntimeTypeException extends KernelException {
    public RuntimeTypeException(String message) {
        super("runtime_type_error", message, null);
    }

    public RuntimeTypeException(String message, Span span) {
        super("runtime_type_error", message, span);
    }

    public static RuntimeTypeException arity(String function, int expected, int actual, Span span) {
        return new RuntimeTypeException(
            "Function '" + function + "' expects " + expected + " argument(s) but got " + actual,
            span
        );
    }
}
