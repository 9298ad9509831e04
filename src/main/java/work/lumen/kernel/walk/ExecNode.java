package work.lumen.kernel.walk;

import work.lumen.kernel.flow.Outcome;
import work.lumen.kernel.lex.Span;
import work.lumen.kernel.runtime.ExecutionContext;
import work.lumen.kernel.runtime.Value;

/**
 * Executable tree node. Expressions implement {@link #evaluate}; statements override
 * {@link #execute} to report control signals.
 */
public interface ExecNode {
    Value evaluate(ExecutionContext ctx);

    default Outcome execute(ExecutionContext ctx) {
        return Outcome.normal(evaluate(ctx));
    }

    Span span();
}
