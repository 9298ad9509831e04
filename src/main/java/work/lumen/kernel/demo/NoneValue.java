package work.lumen.kernel.demo;

import work.lumen.kernel.runtime.Value;

/**
 * Unit value of the demo languages.
 */
public record NoneValue() implements Value {
    public static final NoneValue INSTANCE = new NoneValue();

    @Override
    public Value copy() {
        return this;
    }

    @Override
    public String display() {
        return "none";
    }

    @Override
    public boolean sameAs(Value other) {
        return other instanceof NoneValue;
    }

    @Override
    public boolean truthy() {
        return false;
    }

    @Override
    public String typeName() {
        return "none";
    }
}
