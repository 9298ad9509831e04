package work.lumen.kernel.walk;

import work.lumen.kernel.error.ScopeException;
import work.lumen.kernel.error.StackExhaustionException;
import work.lumen.kernel.flow.Outcome;
import work.lumen.kernel.runtime.ExecutionContext;
import work.lumen.kernel.runtime.Value;

/**
 * Runs a {@link Program} statement by statement, checking for cancellation in between.
 * A top-level {@code return} ends the program; a top-level {@code break}/{@code continue} is a
 * scope error.
 */
public final class TreeWalkingInterpreter {
    private TreeWalkingInterpreter() {}

    public static Value run(Program program, ExecutionContext ctx) {
        Value last = ctx.unit();
        for (var statement : program.statements()) {
            ctx.ensureNotCancelled();
            var outcome = execute(statement, ctx);
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

    private static Outcome execute(ExecNode statement, ExecutionContext ctx) {
        try {
            return statement.execute(ctx);
        } catch (StackOverflowError overflow) {
            throw new StackExhaustionException(statement.span());
        }
    }
}
