package work.lumen.kernel.error;

import work.lumen.kernel.lex.Span;

public final class ScopeException extends KernelException {
    public ScopeException(String code, String message, Span span) {
        super(code, message, span);
    }

    public static ScopeException undefined(String name, Span span) {
        return new ScopeException("undefined_variable", "Undefined variable '" + name + "'", span);
    }

    public static ScopeException undefinedFunction(String name, Span span) {
        return new ScopeException("undefined_function", "Undefined function '" + name + "'", span);
    }

    public static ScopeException outsideLoop(String signal, Span span) {
        return new ScopeException("signal_outside_loop", "'" + signal + "' used outside of a loop", span);
    }
}
