package work.lumen.kernel.demo;

import work.lumen.kernel.runtime.Value;

public record BoolValue(boolean value) implements Value {
    public static final BoolValue TRUE = new BoolValue(true);
    public static final BoolValue FALSE = new BoolValue(false);

    public static BoolValue of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public Value copy() {
        return this;
    }

    @Override
    public String display() {
        return Boolean.toString(value);
    }

    @Override
    public boolean sameAs(Value other) {
        return other instanceof BoolValue bool && bool.value == value;
    }

    @Override
    public boolean truthy() {
        return value;
    }

    @Override
    public String typeName() {
        return "bool";
    }
}
