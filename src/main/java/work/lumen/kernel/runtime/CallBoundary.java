package work.lumen.kernel.runtime;

import java.util.List;
import work.lumen.kernel.error.RuntimeTypeException;
import work.lumen.kernel.error.ScopeException;
import work.lumen.kernel.error.StackExhaustionException;
import work.lumen.kernel.flow.Outcome;
import work.lumen.kernel.lex.Span;

/**
 * Invocation of a user-defined function, shared by both execution strategies.
 *
 * <p>The body runs in a fresh guarded frame with the parameters bound. A returned value is
 * consumed here; {@code break}/{@code continue} escaping the body is a scope error. Running out of
 * Java stack becomes a recoverable {@link StackExhaustionException}.
 */
public final class CallBoundary {
    private CallBoundary() {}

    @FunctionalInterface
    public interface BodyExecutor<B> {
        Outcome execute(B body, ExecutionContext ctx);
    }

    public static <B> Value invoke(
        ExecutionContext ctx,
        FunctionDef<B> function,
        List<Value> args,
        Span callSite,
        BodyExecutor<B> executor
    ) {
        if (args.size() != function.arity()) {
            throw RuntimeTypeException.arity(function.name(), function.arity(), args.size(), callSite);
        }
        ctx.ensureNotCancelled();
        boolean memoize = function.memoizable() && ctx.options().memoization();
        if (memoize) {
            var cached = ctx.memoized(function.name(), args);
            if (cached.isPresent()) {
                return cached.get().copy();
            }
        }

        ctx.enterCall(function.name(), callSite);
        Value result;
        try (var scope = ctx.environment().openScope()) {
            for (int i = 0; i < args.size(); i++) {
                ctx.environment().bind(function.params().get(i), args.get(i).copy());
            }
            var outcome = executor.execute(function.body(), ctx);
            result = switch (outcome.signal()) {
                case BREAK -> throw ScopeException.outsideLoop("break", callSite);
                case CONTINUE -> throw ScopeException.outsideLoop("continue", callSite);
                case RETURN -> outcome.value();
                case NONE -> ctx.unit();
            };
        } catch (StackOverflowError overflow) {
            throw new StackExhaustionException(function.name(), ctx.callDepth(), callSite);
        } finally {
            ctx.exitCall();
        }

        if (memoize) {
            ctx.remember(function.name(), args, result);
        }
        return result;
    }
}
