package work.lumen.kernel.runtime;

import java.util.Iterator;
import work.lumen.kernel.error.RuntimeTypeException;

/**
 * Capability interface every language value implements. The kernel only copies, compares,
 * displays and tests values for truth; everything else belongs to the language's
 * {@link ValueSystem}.
 */
public interface Value {
    Value copy();

    String display();

    /** Representation that reads back as the same literal (strings are quoted). */
    default String debugDisplay() {
        return display();
    }

    boolean sameAs(Value other);

    default String typeName() {
        return getClass().getSimpleName();
    }

    default boolean truthy() {
        throw new RuntimeTypeException("Value of type " + typeName() + " cannot be used as a condition");
    }

    /** Elements visited by a {@code for} loop. */
    default Iterator<Value> iterate() {
        throw new RuntimeTypeException("Value of type " + typeName() + " is not iterable");
    }

    default <T extends Value> T downcast(Class<T> type, String operation) {
        if (type.isInstance(this)) {
            return type.cast(this);
        }
        throw new RuntimeTypeException(
            "Operation '" + operation + "' expects " + type.getSimpleName() + " but got " + typeName()
        );
    }
}
