package work.lumen.kernel.error;

import java.util.LinkedHashMap;
import java.util.Map;
import work.lumen.kernel.lex.SourcePosition;
import work.lumen.kernel.runtime.ExecutionContext.KernelCancellationException;

/**
 * Turns any failure into the {@code code/message/location} map reported by run results.
 */
public final class KernelErrors {
    private KernelErrors() {}

    public static Map<String, Object> normalize(Throwable error, String source) {
        if (error instanceof KernelException ke) {
            var map = toMap(ke.code(), messageOf(ke));
            if (ke.span() != null) {
                map.put("span", Map.of("start", ke.span().start(), "end", ke.span().end()));
                if (source != null) {
                    map.put("location", SourcePosition.of(source, ke.span().start()).toString());
                }
            }
            return map;
        }
        if (error instanceof KernelCancellationException) {
            return toMap("cancelled", messageOf(error));
        }
        if (error == null) {
            return toMap("unexpected_error", "Unexpected error");
        }
        return toMap("unexpected_error", messageOf(error));
    }

    private static String messageOf(Throwable error) {
        var message = error.getMessage();
        return message != null && !message.isBlank() ? message : error.getClass().getSimpleName();
    }

    private static Map<String, Object> toMap(String code, String message) {
        var map = new LinkedHashMap<String, Object>();
        map.put("code", code);
        map.put("message", message);
        return map;
    }
}
