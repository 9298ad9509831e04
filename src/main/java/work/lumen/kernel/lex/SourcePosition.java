package work.lumen.kernel.lex;

/**
 * 1-based line/column derived from an offset. Only used for diagnostics; spans stay authoritative.
 */
public record SourcePosition(int line, int column) {
    public static SourcePosition of(String source, int offset) {
        int limit = Math.min(Math.max(offset, 0), source.length());
        int line = 1;
        int column = 1;
        for (int i = 0; i < limit; i++) {
            if (source.charAt(i) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        return new SourcePosition(line, column);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
