package work.lumen.kernel.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import work.lumen.kernel.demo.NoneValue;
import work.lumen.kernel.demo.NumberValue;
import work.lumen.kernel.error.RuntimeTypeException;
import work.lumen.kernel.error.ScopeException;
import work.lumen.kernel.error.StackExhaustionException;
import work.lumen.kernel.extern.CapabilityRegistry;
import work.lumen.kernel.flow.Outcome;
import work.lumen.kernel.lex.Span;

class CallBoundaryTest {
    private static final Span SITE = Span.of(0, 4);

    private static ExecutionContext context(ExecutionOptions options) {
        return new ExecutionContext(
            new CapabilityRegistry(),
            NoneValue.INSTANCE,
            options,
            new ExecutionContext.CancellationToken(),
            Optional.empty()
        );
    }

    private static FunctionDef<String> function(String name, List<String> params, boolean memoizable) {
        return new FunctionDef<>(name, params, "body", memoizable, SITE);
    }

    @Test
    void bindsParametersInFreshFrameAndConsumesReturn() {
        var ctx = context(ExecutionOptions.defaults());
        var result = CallBoundary.invoke(ctx, function("id", List.of("n"), false), List.of(new NumberValue(7)), SITE,
            (body, c) -> {
                assertEquals(2, c.environment().depth());
                return Outcome.returning(c.environment().get("n"));
            });
        assertEquals(new NumberValue(7), result);
        assertEquals(1, ctx.environment().depth());
        assertEquals(0, ctx.callDepth());
    }

    @Test
    void fallingOffTheEndYieldsUnit() {
        var ctx = context(ExecutionOptions.defaults());
        var result = CallBoundary.invoke(ctx, function("noop", List.of(), false), List.of(), SITE,
            (body, c) -> Outcome.normal(new NumberValue(1)));
        assertEquals(NoneValue.INSTANCE, result);
    }

    @Test
    void breakEscapingTheBodyIsScopeError() {
        var ctx = context(ExecutionOptions.defaults());
        var error = assertThrows(ScopeException.class, () ->
            CallBoundary.invoke(ctx, function("f", List.of(), false), List.of(), SITE,
                (body, c) -> Outcome.breaking(c.unit())));
        assertEquals("signal_outside_loop", error.code());
        assertEquals(1, ctx.environment().depth());
    }

    @Test
    void arityMismatchIsReported() {
        var ctx = context(ExecutionOptions.defaults());
        var error = assertThrows(RuntimeTypeException.class, () ->
            CallBoundary.invoke(ctx, function("f", List.of("a", "b"), false), List.of(new NumberValue(1)), SITE,
                (body, c) -> Outcome.normal(c.unit())));
        assertEquals(SITE, error.span());
    }

    @Test
    void exceedingCallDepthIsRecoverable() {
        var ctx = context(ExecutionOptions.defaults().withMaxCallDepth(8));
        var recurse = function("loop", List.of(), false);
        CallBoundary.BodyExecutor<String> executor = new CallBoundary.BodyExecutor<>() {
            @Override
            public Outcome execute(String body, ExecutionContext c) {
                return Outcome.returning(CallBoundary.invoke(c, recurse, List.of(), SITE, this));
            }
        };
        var error = assertThrows(StackExhaustionException.class, () ->
            CallBoundary.invoke(ctx, recurse, List.of(), SITE, executor));
        assertEquals("stack_exhausted", error.code());
        assertEquals(1, ctx.environment().depth());
        assertEquals(0, ctx.callDepth());
    }

    @Test
    void memoizesOnlyWhenEnabled() {
        var calls = new AtomicInteger();
        CallBoundary.BodyExecutor<String> counting = (body, c) -> Outcome.returning(new NumberValue(calls.incrementAndGet()));
        var fib = function("fib", List.of("n"), true);

        var plain = context(ExecutionOptions.defaults());
        CallBoundary.invoke(plain, fib, List.of(new NumberValue(3)), SITE, counting);
        CallBoundary.invoke(plain, fib, List.of(new NumberValue(3)), SITE, counting);
        assertEquals(2, calls.get());

        var memo = context(ExecutionOptions.defaults().withMemoization(true));
        var first = CallBoundary.invoke(memo, fib, List.of(new NumberValue(3)), SITE, counting);
        var second = CallBoundary.invoke(memo, fib, List.of(new NumberValue(3)), SITE, counting);
        assertEquals(3, calls.get());
        assertEquals(first, second);
    }

    @Test
    void cancelledContextRefusesCalls() {
        var ctx = context(ExecutionOptions.defaults());
        ctx.cancel();
        assertThrows(ExecutionContext.KernelCancellationException.class, () ->
            CallBoundary.invoke(ctx, function("f", List.of(), false), List.of(), SITE, (body, c) -> Outcome.normal(c.unit())));
    }
}
