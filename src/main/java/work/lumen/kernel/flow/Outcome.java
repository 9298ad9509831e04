package work.lumen.kernel.flow;

import java.util.Objects;
import work.lumen.kernel.runtime.Value;

/**
 * Result of executing a statement: a value plus the signal it raised. For {@link FlowSignal#RETURN}
 * the value is the returned value.
 */
public record Outcome(Value value, FlowSignal signal) {
    public Outcome {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(signal, "signal");
    }

    public static Outcome normal(Value value) {
        return new Outcome(value, FlowSignal.NONE);
    }

    public static Outcome breaking(Value unit) {
        return new Outcome(unit, FlowSignal.BREAK);
    }

    public static Outcome continuing(Value unit) {
        return new Outcome(unit, FlowSignal.CONTINUE);
    }

    public static Outcome returning(Value value) {
        return new Outcome(value, FlowSignal.RETURN);
    }

    public boolean isNormal() {
        return signal == FlowSignal.NONE;
    }
}
