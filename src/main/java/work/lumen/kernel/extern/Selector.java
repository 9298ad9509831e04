package work.lumen.kernel.extern;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import work.lumen.kernel.error.ExternResolutionException;

/**
 * Parsed extern selector: {@code backend1|backend2:capability}, or a bare {@code capability}
 * (no backends named).
 */
public record Selector(String raw, List<String> backends, String capability) {
    private static final Pattern NAME = Pattern.compile("[A-Za-z0-9_]+");

    public Selector {
        backends = List.copyOf(backends);
    }

    public static Selector parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ExternResolutionException(raw, List.of(), "Extern selector must not be empty");
        }
        int colon = raw.indexOf(':');
        if (colon < 0) {
            return new Selector(raw, List.of(), requireName(raw, raw));
        }
        if (raw.indexOf(':', colon + 1) >= 0) {
            throw new ExternResolutionException(raw, List.of(), "Malformed extern selector '" + raw + "': more than one ':'");
        }
        var backends = new ArrayList<String>();
        for (var backend : raw.substring(0, colon).split("\\|", -1)) {
            backends.add(requireName(raw, backend));
        }
        return new Selector(raw, backends, requireName(raw, raw.substring(colon + 1)));
    }

    public boolean isBare() {
        return backends.isEmpty();
    }

    private static String requireName(String raw, String name) {
        if (!NAME.matcher(name).matches()) {
            throw new ExternResolutionException(
                raw, List.of(), "Malformed extern selector '" + raw + "': invalid name '" + name + "'"
            );
        }
        return name;
    }

    @Override
    public String toString() {
        return raw;
    }
}
