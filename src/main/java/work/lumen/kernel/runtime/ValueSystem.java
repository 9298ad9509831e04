package work.lumen.kernel.runtime;

import java.util.List;
import java.util.Optional;
import work.lumen.kernel.lex.Token;

/**
 * Language-supplied meaning of literals and operators.
 */
public interface ValueSystem {
    /** Value produced by statements and calls that yield nothing. */
    Value unit();

    /** Interprets a literal token, or returns empty when the token is not a literal. */
    Optional<Value> literal(Token token);

    /**
     * Applies an operator. Binary operators receive two operands, prefix operators one.
     *
     * @throws work.lumen.kernel.error.RuntimeTypeException when the operands do not fit the operator
     */
    Value apply(String operator, List<Value> operands);
}
