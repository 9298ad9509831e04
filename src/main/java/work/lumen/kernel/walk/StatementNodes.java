package work.lumen.kernel.walk;

import java.util.List;
import work.lumen.kernel.flow.Outcome;
import work.lumen.kernel.lex.Span;
import work.lumen.kernel.runtime.ExecutionContext;
import work.lumen.kernel.runtime.Value;

/**
 * Language-neutral statement nodes.
 */
public final class StatementNodes {
    private StatementNodes() {}

    /** Creates (or shadows) the binding in the current frame. */
    public record Bind(String name, ExecNode value, Span span) implements ExecNode {
        @Override
        public Value evaluate(ExecutionContext ctx) {
            return execute(ctx).value();
        }

        @Override
        public Outcome execute(ExecutionContext ctx) {
            ctx.environment().bind(name, value.evaluate(ctx));
            return Outcome.normal(ctx.unit());
        }
    }

    /** Updates the nearest existing binding, or creates one in the current frame. */
    public record Assign(String name, ExecNode value, Span span) implements ExecNode {
        @Override
        public Value evaluate(ExecutionContext ctx) {
            return execute(ctx).value();
        }

        @Override
        public Outcome execute(ExecutionContext ctx) {
            ctx.environment().set(name, value.evaluate(ctx));
            return Outcome.normal(ctx.unit());
        }
    }

    /** {@code otherwise} is empty when there is no else branch. */
    public record Branch(ExecNode condition, List<ExecNode> then, List<ExecNode> otherwise, Span span) implements ExecNode {
        public Branch {
            then = List.copyOf(then);
            otherwise = otherwise == null ? List.of() : List.copyOf(otherwise);
        }

        @Override
        public Value evaluate(ExecutionContext ctx) {
            return execute(ctx).value();
        }

        @Override
        public Outcome execute(ExecutionContext ctx) {
            if (condition.evaluate(ctx).truthy()) {
                return Statements.scoped(then, ctx);
            }
            return otherwise.isEmpty() ? Outcome.normal(ctx.unit()) : Statements.scoped(otherwise, ctx);
        }
    }

    public record While(ExecNode condition, List<ExecNode> body, Span span) implements ExecNode {
        public While {
            body = List.copyOf(body);
        }

        @Override
        public Value evaluate(ExecutionContext ctx) {
            return execute(ctx).value();
        }

        @Override
        public Outcome execute(ExecutionContext ctx) {
            return Statements.loop(condition, body, ctx);
        }
    }

    /** Unconditional loop left only through {@code break} or {@code return}. */
    public record Repeat(List<ExecNode> body, Span span) implements ExecNode {
        public Repeat {
            body = List.copyOf(body);
        }

        @Override
        public Value evaluate(ExecutionContext ctx) {
            return execute(ctx).value();
        }

        @Override
        public Outcome execute(ExecutionContext ctx) {
            return Statements.loop(null, body, ctx);
        }
    }

    public record ForEach(String variable, ExecNode iterable, List<ExecNode> body, Span span) implements ExecNode {
        public ForEach {
            body = List.copyOf(body);
        }

        @Override
        public Value evaluate(ExecutionContext ctx) {
            return execute(ctx).value();
        }

        @Override
        public Outcome execute(ExecutionContext ctx) {
            return Statements.each(variable, iterable.evaluate(ctx).iterate(), body, ctx);
        }
    }

    /** {@code value} is {@code null} for a bare return. */
    public record Return(ExecNode value, Span span) implements ExecNode {
        @Override
        public Value evaluate(ExecutionContext ctx) {
            return execute(ctx).value();
        }

        @Override
        public Outcome execute(ExecutionContext ctx) {
            return Outcome.returning(value == null ? ctx.unit() : value.evaluate(ctx));
        }
    }

    public record Break(Span span) implements ExecNode {
        @Override
        public Value evaluate(ExecutionContext ctx) {
            return ctx.unit();
        }

        @Override
        public Outcome execute(ExecutionContext ctx) {
            return Outcome.breaking(ctx.unit());
        }
    }

    public record Continue(Span span) implements ExecNode {
        @Override
        public Value evaluate(ExecutionContext ctx) {
            return ctx.unit();
        }

        @Override
        public Outcome execute(ExecutionContext ctx) {
            return Outcome.continuing(ctx.unit());
        }
    }

    public record ExpressionStatement(ExecNode expression, Span span) implements ExecNode {
        @Override
        public Value evaluate(ExecutionContext ctx) {
            return expression.evaluate(ctx);
        }
    }

    /** Placeholder left where a function was defined; the definition itself lives in the function table. */
    public record FunctionDeclaration(String name, Span span) implements ExecNode {
        @Override
        public Value evaluate(ExecutionContext ctx) {
            return ctx.unit();
        }
    }
}
