package work.lumen.kernel.error;

import java.util.List;
import work.lumen.kernel.lex.Span;

/**
 * Raised when an extern selector is malformed or none of the backends it names provides the
 * requested capability. The message always names the backends that were tried.
 */
public final class ExternResolutionException extends KernelException {
    private final String selector;
    private final List<String> backends;

    public ExternResolutionException(String selector, List<String> backends, String message) {
        this(selector, backends, message, null);
    }

    public ExternResolutionException(String selector, List<String> backends, String message, Span span) {
        super("extern_resolution_error", message, span);
        this.selector = selector;
        this.backends = backends == null ? List.of() : List.copyOf(backends);
    }

    public String selector() {
        return selector;
    }

    public List<String> backends() {
        return backends;
    }
}
