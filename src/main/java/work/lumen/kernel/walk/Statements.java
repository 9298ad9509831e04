package work.lumen.kernel.walk;

import java.util.Iterator;
import java.util.List;
import work.lumen.kernel.flow.FlowSignal;
import work.lumen.kernel.flow.Outcome;
import work.lumen.kernel.runtime.ExecutionContext;
import work.lumen.kernel.runtime.Value;

/**
 * Kernel-side execution helpers that statement nodes compose: sequences, guarded scopes and loops.
 */
public final class Statements {
    private Statements() {}

    /** Runs statements in order, stopping at the first signal. Yields the last statement's value. */
    public static Outcome sequence(List<ExecNode> statements, ExecutionContext ctx) {
        Value last = ctx.unit();
        for (var statement : statements) {
            var outcome = statement.execute(ctx);
            if (!outcome.isNormal()) {
                return outcome;
            }
            last = outcome.value();
        }
        return Outcome.normal(last);
    }

    /** {@link #sequence} inside a fresh frame that is popped on every exit path. */
    public static Outcome scoped(List<ExecNode> statements, ExecutionContext ctx) {
        try (var scope = ctx.environment().openScope()) {
            return sequence(statements, ctx);
        }
    }

    /**
     * Pre-tested loop; a {@code null} condition repeats until a break. Each iteration runs in its own
     * frame; {@code break} and {@code continue} are consumed here, {@code return} propagates.
     */
    public static Outcome loop(ExecNode condition, List<ExecNode> body, ExecutionContext ctx) {
        while (true) {
            ctx.ensureNotCancelled();
            if (condition != null && !condition.evaluate(ctx).truthy()) {
                break;
            }
            var outcome = scoped(body, ctx);
            if (outcome.signal() == FlowSignal.BREAK) {
                break;
            }
            if (outcome.signal() == FlowSignal.RETURN) {
                return outcome;
            }
        }
        return Outcome.normal(ctx.unit());
    }

    /** Runs {@code body} once per element, each time in a fresh frame binding {@code variable}. */
    public static Outcome each(String variable, Iterator<Value> elements, List<ExecNode> body, ExecutionContext ctx) {
        while (elements.hasNext()) {
            ctx.ensureNotCancelled();
            Outcome outcome;
            try (var scope = ctx.environment().openScope()) {
                ctx.environment().bind(variable, elements.next().copy());
                outcome = sequence(body, ctx);
            }
            if (outcome.signal() == FlowSignal.BREAK) {
                break;
            }
            if (outcome.signal() == FlowSignal.RETURN) {
                return outcome;
            }
        }
        return Outcome.normal(ctx.unit());
    }
}
