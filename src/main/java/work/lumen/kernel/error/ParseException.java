package work.lumen.kernel.error;

import work.lumen.kernel.lex.Span;

public final class ParseException extends KernelException {
    public ParseException(String message, Span span) {
        super("parse_error", message, span);
    }

    public static ParseException tooDeep(Span span) {
        return new ParseException("Program is nested too deeply to parse", span);
    }
}
