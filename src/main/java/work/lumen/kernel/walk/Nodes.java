package work.lumen.kernel.walk;

import java.util.ArrayList;
import java.util.List;
import work.lumen.kernel.error.KernelException;
import work.lumen.kernel.error.ScopeException;
import work.lumen.kernel.lex.Span;
import work.lumen.kernel.registry.ShortCircuit;
import work.lumen.kernel.runtime.CallBoundary;
import work.lumen.kernel.runtime.ExecutionContext;
import work.lumen.kernel.runtime.FunctionTable;
import work.lumen.kernel.runtime.Value;
import work.lumen.kernel.runtime.ValueSystem;

/**
 * Language-neutral expression nodes. Operator meaning always comes from the {@link ValueSystem}.
 */
public final class Nodes {
    private Nodes() {}

    public record Literal(Value value, Span span) implements ExecNode {
        @Override
        public Value evaluate(ExecutionContext ctx) {
            return value.copy();
        }
    }

    public record Variable(String name, Span span) implements ExecNode {
        @Override
        public Value evaluate(ExecutionContext ctx) {
            return ctx.environment().get(name, span);
        }
    }

    public record Binary(String operator, ExecNode left, ExecNode right, ValueSystem values, Span span) implements ExecNode {
        @Override
        public Value evaluate(ExecutionContext ctx) {
            var lhs = left.evaluate(ctx);
            var rhs = right.evaluate(ctx);
            try {
                return values.apply(operator, List.of(lhs, rhs));
            } catch (KernelException ex) {
                throw ex.withSpanIfMissing(span);
            }
        }
    }

    /** Binary operator that may skip its right operand. */
    public record ShortCircuitBinary(
        String operator,
        ShortCircuit mode,
        ExecNode left,
        ExecNode right,
        ValueSystem values,
        Span span
    ) implements ExecNode {
        @Override
        public Value evaluate(ExecutionContext ctx) {
            var lhs = left.evaluate(ctx);
            try {
                if (mode.decides(lhs.truthy())) {
                    return lhs;
                }
                return values.apply(operator, List.of(lhs, right.evaluate(ctx)));
            } catch (KernelException ex) {
                throw ex.withSpanIfMissing(span);
            }
        }
    }

    public record Prefix(String operator, ExecNode operand, ValueSystem values, Span span) implements ExecNode {
        @Override
        public Value evaluate(ExecutionContext ctx) {
            var value = operand.evaluate(ctx);
            try {
                return values.apply(operator, List.of(value));
            } catch (KernelException ex) {
                throw ex.withSpanIfMissing(span);
            }
        }
    }

    /**
     * Call of a program function by name. The lookup happens at run time, so definitions are
     * hoisted; capabilities are only reachable through {@link Extern}.
     */
    public record Call(String name, List<ExecNode> args, FunctionTable<List<ExecNode>> functions, Span span) implements ExecNode {
        @Override
        public Value evaluate(ExecutionContext ctx) {
            var values = evaluateAll(args, ctx);
            var function = functions.lookup(name).orElseThrow(() -> ScopeException.undefinedFunction(name, span));
            try {
                return CallBoundary.invoke(ctx, function, values, span, Statements::sequence);
            } catch (KernelException ex) {
                throw ex.withSpanIfMissing(span);
            }
        }
    }

    public record Extern(String selector, List<ExecNode> args, Span span) implements ExecNode {
        @Override
        public Value evaluate(ExecutionContext ctx) {
            var values = evaluateAll(args, ctx);
            try {
                return ctx.dispatcher().invoke(selector, values);
            } catch (KernelException ex) {
                throw ex.withSpanIfMissing(span);
            }
        }
    }

    static List<Value> evaluateAll(List<ExecNode> nodes, ExecutionContext ctx) {
        var values = new ArrayList<Value>(nodes.size());
        for (var node : nodes) {
            values.add(node.evaluate(ctx));
        }
        return values;
    }
}
