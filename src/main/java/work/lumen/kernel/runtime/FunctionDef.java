package work.lumen.kernel.runtime;

import java.util.List;
import java.util.Objects;
import work.lumen.kernel.lex.Span;

/**
 * User-defined function, generic over the body representation ({@code ExecNode} list or
 * instruction).
 */
public record FunctionDef<B>(String name, List<String> params, B body, boolean memoizable, Span span) {
    public FunctionDef {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(body, "body");
        params = params == null ? List.of() : List.copyOf(params);
    }

    public int arity() {
        return params.size();
    }
}
