package work.lumen.kernel.lex;

/**
 * Half-open range {@code [start, end)} of character offsets into the source text.
 */
public record Span(int start, int end) {
    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    public static Span of(int start, int end) {
        return new Span(start, end);
    }

    /** Zero-width span used for synthesized tokens. */
    public static Span at(int offset) {
        return new Span(offset, offset);
    }

    public int length() {
        return end - start;
    }

    public String extract(String source) {
        return source.substring(start, end);
    }

    public Span merge(Span other) {
        if (other == null) {
            return this;
        }
        return new Span(Math.min(start, other.start), Math.max(end, other.end));
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
