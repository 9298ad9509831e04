package work.lumen.kernel.runtime;

/**
 * Per-run execution switches.
 *
 * @param memoization  cache results of functions the language marks as memoizable
 * @param maxCallDepth nesting limit after which a call fails with a stack exhaustion error
 */
public record ExecutionOptions(boolean memoization, int maxCallDepth) {
    public static final int DEFAULT_MAX_CALL_DEPTH = 512;

    public ExecutionOptions {
        if (maxCallDepth < 1) {
            throw new IllegalArgumentException("maxCallDepth must be positive");
        }
    }

    public static ExecutionOptions defaults() {
        return new ExecutionOptions(false, DEFAULT_MAX_CALL_DEPTH);
    }

    public ExecutionOptions withMemoization(boolean enabled) {
        return new ExecutionOptions(enabled, maxCallDepth);
    }

    public ExecutionOptions withMaxCallDepth(int depth) {
        return new ExecutionOptions(memoization, depth);
    }
}
