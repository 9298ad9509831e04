package work.lumen.kernel.instruction;

import java.util.ArrayList;
import java.util.List;
import work.lumen.kernel.error.KernelException;
import work.lumen.kernel.error.ScopeException;
import work.lumen.kernel.error.StackExhaustionException;
import work.lumen.kernel.flow.FlowSignal;
import work.lumen.kernel.flow.Outcome;
import work.lumen.kernel.instruction.Instruction.Assign;
import work.lumen.kernel.instruction.Instruction.Branch;
import work.lumen.kernel.instruction.Instruction.Invoke;
import work.lumen.kernel.instruction.Instruction.Operate;
import work.lumen.kernel.instruction.Instruction.Scope;
import work.lumen.kernel.instruction.Instruction.Sequence;
import work.lumen.kernel.instruction.Instruction.Transfer;
import work.lumen.kernel.registry.SchemaRegistry;
import work.lumen.kernel.registry.ShortCircuit;
import work.lumen.kernel.runtime.CallBoundary;
import work.lumen.kernel.runtime.Cursor;
import work.lumen.kernel.runtime.ExecutionContext;
import work.lumen.kernel.runtime.FunctionTable;
import work.lumen.kernel.runtime.Value;
import work.lumen.kernel.runtime.ValueSystem;

/**
 * Executes canonical instructions with a single dispatch over {@link Instruction.Tag}.
 */
public final class InstructionExecutor {
    private final SchemaRegistry schema;
    private final ValueSystem values;
    private final FunctionTable<Instruction> functions;

    public InstructionExecutor(SchemaRegistry schema, ValueSystem values, FunctionTable<Instruction> functions) {
        this.schema = schema;
        this.values = values;
        this.functions = functions;
    }

    /**
     * Runs top-level statements, checking for cancellation between them. A top-level return ends
     * the program; a top-level break/continue is a scope error.
     */
    public Value run(Sequence root, ExecutionContext ctx) {
        Value last = ctx.unit();
        for (var statement : root.body()) {
            ctx.ensureNotCancelled();
            Outcome outcome;
            try {
                outcome = execute(statement, ctx);
            } catch (StackOverflowError overflow) {
                throw new StackExhaustionException(statement.span());
            }
            switch (outcome.signal()) {
                case RETURN -> {
                    return outcome.value();
                }
                case BREAK -> throw ScopeException.outsideLoop("break", statement.span());
                case CONTINUE -> throw ScopeException.outsideLoop("continue", statement.span());
                default -> last = outcome.value();
            }
        }
        return last;
    }

    public Outcome execute(Instruction instruction, ExecutionContext ctx) {
        return switch (instruction.tag()) {
            case SEQUENCE -> sequence((Sequence) instruction, ctx);
            case SCOPE -> scope((Scope) instruction, ctx);
            case BRANCH -> branch((Branch) instruction, ctx);
            case ASSIGN -> assign((Assign) instruction, ctx);
            case INVOKE -> Outcome.normal(invoke((Invoke) instruction, ctx));
            case OPERATE -> Outcome.normal(operate((Operate) instruction, ctx));
            case TRANSFER -> transfer((Transfer) instruction, ctx);
        };
    }

    private Value evaluate(Instruction instruction, ExecutionContext ctx) {
        return execute(instruction, ctx).value();
    }

    private Outcome sequence(Sequence sequence, ExecutionContext ctx) {
        Value last = ctx.unit();
        for (var statement : sequence.body()) {
            var outcome = execute(statement, ctx);
            if (!outcome.isNormal()) {
                return outcome;
            }
            last = outcome.value();
        }
        return Outcome.normal(last);
    }

    private Outcome branch(Branch branch, ExecutionContext ctx) {
        if (evaluate(branch.condition(), ctx).truthy()) {
            return execute(branch.then(), ctx);
        }
        return branch.otherwise() == null ? Outcome.normal(ctx.unit()) : execute(branch.otherwise(), ctx);
    }

    private Outcome assign(Assign assign, ExecutionContext ctx) {
        var value = evaluate(assign.value(), ctx);
        if (assign.mode() == Assign.Mode.BIND) {
            ctx.environment().bind(assign.name(), value);
        } else {
            ctx.environment().set(assign.name(), value);
        }
        return Outcome.normal(ctx.unit());
    }

    private Outcome transfer(Transfer transfer, ExecutionContext ctx) {
        return switch (transfer.kind()) {
            case BREAK -> Outcome.breaking(ctx.unit());
            case CONTINUE -> Outcome.continuing(ctx.unit());
            case RETURN -> Outcome.returning(transfer.value() == null ? ctx.unit() : evaluate(transfer.value(), ctx));
        };
    }

    private Outcome scope(Scope scope, ExecutionContext ctx) {
        if (!scope.repeating()) {
            try (var frame = ctx.environment().openScope()) {
                return execute(scope.body(), ctx);
            }
        }
        while (true) {
            ctx.ensureNotCancelled();
            Outcome outcome;
            try (var frame = ctx.environment().openScope()) {
                outcome = execute(scope.body(), ctx);
            }
            if (outcome.signal() == FlowSignal.BREAK) {
                return Outcome.normal(ctx.unit());
            }
            if (outcome.signal() == FlowSignal.RETURN) {
                return outcome;
            }
        }
    }

    private Value invoke(Invoke invoke, ExecutionContext ctx) {
        var args = new ArrayList<Value>(invoke.args().size());
        for (var arg : invoke.args()) {
            args.add(evaluate(arg, ctx));
        }
        try {
            if (invoke.extern()) {
                return ctx.dispatcher().invoke(invoke.selector(), args);
            }
            var function = functions.lookup(invoke.selector())
                .orElseThrow(() -> ScopeException.undefinedFunction(invoke.selector(), invoke.span()));
            return CallBoundary.invoke(ctx, function, args, invoke.span(), this::execute);
        } catch (KernelException ex) {
            throw ex.withSpanIfMissing(invoke.span());
        }
    }

    private Value operate(Operate operate, ExecutionContext ctx) {
        if (Operate.CONST.equals(operate.operator())) {
            return operate.constant().copy();
        }
        if (Operate.LOAD.equals(operate.operator())) {
            return ctx.environment().get(operate.immediate(), operate.span());
        }
        try {
            if (Operate.ITER.equals(operate.operator())) {
                return new Cursor(evaluate(operate.operands().get(0), ctx).iterate());
            }
            if (Operate.NEXT.equals(operate.operator())) {
                return ctx.environment().get(operate.immediate(), operate.span()).downcast(Cursor.class, "for").next();
            }
            List<Value> operands = new ArrayList<>(operate.operands().size());
            if (operate.operands().size() == 2) {
                var mode = schema.binaryOperator(operate.operator()).map(info -> info.shortCircuit()).orElse(ShortCircuit.NONE);
                var left = evaluate(operate.operands().get(0), ctx);
                if (mode != ShortCircuit.NONE && mode.decides(left.truthy())) {
                    return left;
                }
                operands.add(left);
                operands.add(evaluate(operate.operands().get(1), ctx));
            } else {
                for (var operand : operate.operands()) {
                    operands.add(evaluate(operand, ctx));
                }
            }
            return values.apply(operate.operator(), operands);
        } catch (KernelException ex) {
            throw ex.withSpanIfMissing(operate.span());
        }
    }
}
