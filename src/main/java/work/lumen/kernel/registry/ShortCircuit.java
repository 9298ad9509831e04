package work.lumen.kernel.registry;

import java.util.Locale;
import work.lumen.kernel.error.ConfigurationException;

/**
 * Whether a binary operator may skip its right operand, and on which left-hand truth value.
 */
public enum ShortCircuit {
    NONE,
    WHEN_FALSE,
    WHEN_TRUE;

    public static ShortCircuit from(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        try {
            return ShortCircuit.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException("Unsupported short_circuit mode: " + value);
        }
    }

    /** @return {@code true} when the left operand alone decides the result */
    public boolean decides(boolean left) {
        return (this == WHEN_FALSE && !left) || (this == WHEN_TRUE && left);
    }
}
