package work.lumen.kernel.registry;

import java.util.Objects;
import work.lumen.kernel.error.ConfigurationException;

/**
 * Binary operator entry. Higher precedence binds tighter; precedence starts at 1.
 */
public record OperatorInfo(String lexeme, int precedence, Associativity associativity, ShortCircuit shortCircuit) {
    public OperatorInfo {
        Objects.requireNonNull(lexeme, "lexeme");
        Objects.requireNonNull(associativity, "associativity");
        shortCircuit = shortCircuit == null ? ShortCircuit.NONE : shortCircuit;
        if (precedence < 1) {
            throw new ConfigurationException("Operator '" + lexeme + "' needs a precedence >= 1, got " + precedence);
        }
    }

    public OperatorInfo(String lexeme, int precedence, Associativity associativity) {
        this(lexeme, precedence, associativity, ShortCircuit.NONE);
    }
}
