package work.lumen.kernel.walk;

import java.util.List;
import work.lumen.kernel.runtime.Executable;
import work.lumen.kernel.runtime.ExecutionContext;
import work.lumen.kernel.runtime.FunctionTable;
import work.lumen.kernel.runtime.Value;

/**
 * Parsed tree-walking program: top-level statements plus the functions it defines.
 */
public record Program(List<ExecNode> statements, FunctionTable<List<ExecNode>> functions) implements Executable {
    public Program {
        statements = List.copyOf(statements);
    }

    @Override
    public Value run(ExecutionContext ctx) {
        return TreeWalkingInterpreter.run(this, ctx);
    }

    @Override
    public String describe() {
        var builder = new StringBuilder();
        for (var statement : statements) {
            builder.append(statement.getClass().getSimpleName()).append(' ').append(statement.span()).append('\n');
        }
        functions.entries().forEach((name, fn) ->
            builder.append("fn ").append(name).append(fn.params()).append(' ').append(fn.body().size()).append(" statement(s)\n"));
        return builder.toString();
    }
}
