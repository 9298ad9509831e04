package work.lumen.kernel.demo;

import work.lumen.kernel.runtime.Value;

public record NumberValue(double value) implements Value {
    @Override
    public Value copy() {
        return this;
    }

    /** Whole numbers print without a fractional part. */
    @Override
    public String display() {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    @Override
    public boolean sameAs(Value other) {
        return other instanceof NumberValue number && number.value == value;
    }

    @Override
    public String typeName() {
        return "number";
    }
}
