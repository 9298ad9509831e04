package work.lumen.kernel.registry;

import java.util.Locale;
import work.lumen.kernel.error.ConfigurationException;

/**
 * How a language marks blocks: explicit delimiter pairs, or indentation turned into markers.
 */
public enum BlockLayout {
    BRACES,
    INDENTATION;

    public static BlockLayout from(String value) {
        if (value == null || value.isBlank()) {
            return BRACES;
        }
        try {
            return BlockLayout.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException("Unsupported block layout: " + value);
        }
    }
}
