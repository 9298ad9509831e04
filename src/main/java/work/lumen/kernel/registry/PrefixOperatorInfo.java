package work.lumen.kernel.registry;

import java.util.Objects;
import work.lumen.kernel.error.ConfigurationException;

public record PrefixOperatorInfo(String lexeme, int precedence) {
    public PrefixOperatorInfo {
        Objects.requireNonNull(lexeme, "lexeme");
        if (precedence < 1) {
            throw new ConfigurationException("Prefix operator '" + lexeme + "' needs a precedence >= 1, got " + precedence);
        }
    }
}
