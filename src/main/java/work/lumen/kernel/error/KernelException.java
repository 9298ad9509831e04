package work.lumen.kernel.error;

import work.lumen.kernel.lex.Span;

/**
 * Base of every error raised by the kernel. Carries a stable snake_case code and, when known,
 * the source span the error points at.
 */
public class KernelException extends RuntimeException {
    private final String code;
    private Span span;

    public KernelException(String code, String message, Span span) {
        super(message);
        this.code = code;
        this.span = span;
    }

    public KernelException(String code, String message, Span span, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.span = span;
    }

    public String code() {
        return code;
    }

    /** May be {@code null} when the failure has no source location (e.g. schema registration). */
    public Span span() {
        return span;
    }

    /** Attaches the span of the construct being executed unless a more precise one is known. */
    public KernelException withSpanIfMissing(Span fallback) {
        if (span == null) {
            span = fallback;
        }
        return this;
    }
}
