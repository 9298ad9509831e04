package work.lumen.kernel.error;

import work.lumen.kernel.lex.Span;

/**
 * Recoverable replacement for {@link StackOverflowError}, raised at a call boundary or at the
 * top-level statement that overflowed.
 */
public final class StackExhaustionException extends KernelException {
    private final int depth;

    public StackExhaustionException(String function, int depth, Span span) {
        super("stack_exhausted", "Call stack exhausted in '" + function + "' at depth " + depth, span);
        this.depth = depth;
    }

    /** Overflow outside any call, e.g. in a deeply nested expression. */
    public StackExhaustionException(Span span) {
        super("stack_exhausted", "Evaluation stack exhausted by deeply nested code", span);
        this.depth = 0;
    }

    public int depth() {
        return depth;
    }
}
