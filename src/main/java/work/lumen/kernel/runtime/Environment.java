package work.lumen.kernel.runtime;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lumen.kernel.error.ScopeException;
import work.lumen.kernel.lex.Span;

/**
 * Stack of variable frames. The bottom (global) frame is never popped.
 *
 * <p>Frames are only pushed through {@link #openScope()}; the returned guard restores the depth on
 * close, so every exit path of a {@code try}-with-resources block (normal, signal or exception)
 * leaves the environment as it found it.
 */
public final class Environment {
    private final Deque<Map<String, Value>> frames = new ArrayDeque<>();

    public Environment() {
        frames.push(new LinkedHashMap<>());
    }

    public ScopeGuard openScope() {
        var guard = new ScopeGuard(frames.size());
        frames.push(new LinkedHashMap<>());
        return guard;
    }

    public int depth() {
        return frames.size();
    }

    public Value get(String name) {
        return get(name, null);
    }

    public Value get(String name, Span span) {
        for (var frame : frames) {
            var value = frame.get(name);
            if (value != null) {
                return value;
            }
        }
        throw ScopeException.undefined(name, span);
    }

    public boolean isDefined(String name) {
        for (var frame : frames) {
            if (frame.containsKey(name)) {
                return true;
            }
        }
        return false;
    }

    /** Updates the innermost existing binding, or creates one in the current frame. */
    public void set(String name, Value value) {
        for (var frame : frames) {
            if (frame.containsKey(name)) {
                frame.put(name, value);
                return;
            }
        }
        frames.peek().put(name, value);
    }

    /** Always binds in the current frame, shadowing outer bindings of the same name. */
    public void bind(String name, Value value) {
        frames.peek().put(name, value);
    }

    /** Innermost-first copy of the frames, rendered for diagnostics. */
    public List<Map<String, String>> snapshot() {
        var result = new ArrayList<Map<String, String>>(frames.size());
        Iterator<Map<String, Value>> it = frames.iterator();
        while (it.hasNext()) {
            var rendered = new LinkedHashMap<String, String>();
            it.next().forEach((key, value) -> rendered.put(key, value.debugDisplay()));
            result.add(rendered);
        }
        return result;
    }

    /**
     * Pops the frame it pushed. Closing twice is a no-op; closing while a scope opened later is
     * still open is an {@link IllegalStateException}.
     */
    public final class ScopeGuard implements AutoCloseable {
        private final int restoreDepth;
        private boolean closed;

        private ScopeGuard(int restoreDepth) {
            this.restoreDepth = restoreDepth;
        }

        public int depth() {
            return restoreDepth + 1;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            if (frames.size() != restoreDepth + 1) {
                throw new IllegalStateException(
                    "Scope at depth " + depth() + " closed out of order (environment depth is " + frames.size() + ")"
                );
            }
            frames.pop();
            closed = true;
        }
    }
}
