package work.lumen.kernel.runtime;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import work.lumen.kernel.error.StackExhaustionException;
import work.lumen.kernel.extern.ExternDispatcher;
import work.lumen.kernel.lex.Span;

/**
 * State owned by a single run: the environment, the extern dispatcher, execution options and the
 * cancellation/deadline checks. Never shared between runs.
 */
public final class ExecutionContext {
    private final Environment environment = new Environment();
    private final ExternDispatcher dispatcher;
    private final Value unit;
    private final ExecutionOptions options;
    private final CancellationToken cancellationToken;
    private final Instant deadline;
    private final Map<String, Value> memo = new HashMap<>();
    private int callDepth;

    public ExecutionContext(ExternDispatcher dispatcher, Value unit) {
        this(dispatcher, unit, ExecutionOptions.defaults(), new CancellationToken(), Optional.empty());
    }

    public ExecutionContext(
        ExternDispatcher dispatcher,
        Value unit,
        ExecutionOptions options,
        CancellationToken token,
        Optional<Duration> timeout
    ) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.unit = Objects.requireNonNull(unit, "unit");
        this.options = options == null ? ExecutionOptions.defaults() : options;
        this.cancellationToken = token == null ? new CancellationToken() : token;
        this.deadline = timeout == null || timeout.isEmpty() || timeout.get().isZero()
            ? null
            : Instant.now().plus(timeout.get());
    }

    public Environment environment() {
        return environment;
    }

    public ExternDispatcher dispatcher() {
        return dispatcher;
    }

    public Value unit() {
        return unit;
    }

    public ExecutionOptions options() {
        return options;
    }

    public int callDepth() {
        return callDepth;
    }

    public void ensureNotCancelled() {
        if (cancellationToken.isCancelled()) {
            throw new KernelCancellationException("Execution cancelled");
        }
        if (deadline != null && Instant.now().isAfter(deadline)) {
            throw new KernelCancellationException("Execution timed out");
        }
    }

    public void cancel() {
        cancellationToken.cancel();
    }

    void enterCall(String function, Span span) {
        if (callDepth >= options.maxCallDepth()) {
            throw new StackExhaustionException(function, callDepth, span);
        }
        callDepth++;
    }

    void exitCall() {
        if (callDepth > 0) {
            callDepth--;
        }
    }

    Optional<Value> memoized(String function, List<Value> args) {
        return Optional.ofNullable(memo.get(memoKey(function, args)));
    }

    void remember(String function, List<Value> args, Value result) {
        memo.put(memoKey(function, args), result);
    }

    private static String memoKey(String function, List<Value> args) {
        return args.stream().map(Value::debugDisplay).collect(Collectors.joining(",", function + "(", ")"));
    }

    public static final class CancellationToken {
        private volatile boolean cancelled = false;

        public void cancel() {
            this.cancelled = true;
        }

        public boolean isCancelled() {
            return cancelled;
        }
    }

    public static final class KernelCancellationException extends RuntimeException {
        public KernelCancellationException(String message) {
            super(message);
        }
    }
}
