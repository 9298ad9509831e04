package work.lumen.kernel.runtime;

import java.util.Iterator;
import java.util.Objects;

/**
 * Position inside an iterable value while a {@code for} loop walks it. Truthy while elements
 * remain. Never visible to programs.
 */
public final class Cursor implements Value {
    private final Iterator<Value> elements;

    public Cursor(Iterator<Value> elements) {
        this.elements = Objects.requireNonNull(elements, "elements");
    }

    public Value next() {
        return elements.next().copy();
    }

    @Override
    public boolean truthy() {
        return elements.hasNext();
    }

    @Override
    public Value copy() {
        return this;
    }

    @Override
    public String display() {
        return "<cursor>";
    }

    @Override
    public boolean sameAs(Value other) {
        return other == this;
    }

    @Override
    public String typeName() {
        return "cursor";
    }
}
