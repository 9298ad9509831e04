package work.lumen.kernel.registry;

import java.util.Locale;
import work.lumen.kernel.error.ConfigurationException;

public enum Associativity {
    LEFT,
    RIGHT,
    /** Chaining two operators of this precedence without grouping is a parse error. */
    NONE;

    public static Associativity from(String value) {
        if (value == null || value.isBlank()) {
            return LEFT;
        }
        try {
            return Associativity.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException("Unsupported associativity: " + value);
        }
    }
}
