package work.lumen.kernel.demo;

import java.util.Objects;
import work.lumen.kernel.runtime.Value;

public record TextValue(String value) implements Value {
    public TextValue {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public Value copy() {
        return this;
    }

    @Override
    public String display() {
        return value;
    }

    @Override
    public String debugDisplay() {
        return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n").replace("\t", "\\t") + '"';
    }

    @Override
    public boolean sameAs(Value other) {
        return other instanceof TextValue text && text.value.equals(value);
    }

    @Override
    public String typeName() {
        return "string";
    }
}
