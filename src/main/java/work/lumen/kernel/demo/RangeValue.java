package work.lumen.kernel.demo;

import java.util.Iterator;
import java.util.NoSuchElementException;
import work.lumen.kernel.runtime.Value;

/**
 * Half-open range of whole numbers, written {@code start..end}.
 */
public record RangeValue(long start, long end) implements Value {
    @Override
    public Value copy() {
        return this;
    }

    @Override
    public String display() {
        return start + ".." + end;
    }

    @Override
    public boolean sameAs(Value other) {
        return other instanceof RangeValue range && range.start == start && range.end == end;
    }

    @Override
    public String typeName() {
        return "range";
    }

    @Override
    public Iterator<Value> iterate() {
        return new Iterator<>() {
            private long next = start;

            @Override
            public boolean hasNext() {
                return next < end;
            }

            @Override
            public Value next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return new NumberValue(next++);
            }
        };
    }
}
