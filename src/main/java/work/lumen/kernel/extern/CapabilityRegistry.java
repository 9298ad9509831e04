package work.lumen.kernel.extern;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lumen.kernel.error.ConfigurationException;
import work.lumen.kernel.error.ExternResolutionException;
import work.lumen.kernel.runtime.Value;

/**
 * Extern dispatcher backed by capabilities registered per backend.
 *
 * <p>A selector naming backends tries exactly those backends, left to right, and fails when none of
 * them provides the capability; another backend is never substituted. A bare selector uses the
 * first backend (in registration order) that provides the capability.
 */
public final class CapabilityRegistry implements ExternDispatcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(CapabilityRegistry.class);

    private final Map<String, Map<String, Capability>> backends = new LinkedHashMap<>();

    public CapabilityRegistry register(String backend, String capability, Capability implementation) {
        try {
            Selector.parse(backend + ":" + capability);
        } catch (ExternResolutionException ex) {
            throw new ConfigurationException("Invalid capability name: " + ex.getMessage(), ex);
        }
        Objects.requireNonNull(implementation, "implementation");
        var provided = backends.computeIfAbsent(backend, key -> new LinkedHashMap<>());
        if (provided.containsKey(capability)) {
            throw new ConfigurationException("Capability '" + backend + ":" + capability + "' is already registered");
        }
        provided.put(capability, implementation);
        return this;
    }

    public Set<String> backends() {
        return Collections.unmodifiableSet(backends.keySet());
    }

    public boolean provides(String backend, String capability) {
        var provided = backends.get(backend);
        return provided != null && provided.containsKey(capability);
    }

    @Override
    public Value invoke(String selector, List<Value> args) {
        var resolved = resolve(Selector.parse(selector));
        return resolved.implementation().invoke(args);
    }

    public Resolution resolve(Selector selector) {
        if (selector.isBare()) {
            for (var entry : backends.entrySet()) {
                var implementation = entry.getValue().get(selector.capability());
                if (implementation != null) {
                    LOGGER.debug("Resolved extern '{}' to backend '{}'", selector, entry.getKey());
                    return new Resolution(entry.getKey(), selector.capability(), implementation);
                }
            }
            throw new ExternResolutionException(
                selector.raw(), List.of(), "No backend provides capability '" + selector.capability() + "'"
            );
        }
        var reasons = new ArrayList<String>();
        for (var backend : selector.backends()) {
            var provided = backends.get(backend);
            if (provided == null) {
                reasons.add("backend '" + backend + "' is not registered");
                continue;
            }
            var implementation = provided.get(selector.capability());
            if (implementation == null) {
                reasons.add("backend '" + backend + "' does not provide '" + selector.capability() + "'");
                continue;
            }
            LOGGER.debug("Resolved extern '{}' to backend '{}'", selector, backend);
            return new Resolution(backend, selector.capability(), implementation);
        }
        throw new ExternResolutionException(
            selector.raw(),
            selector.backends(),
            "Cannot resolve extern '" + selector.raw() + "': " + String.join("; ", reasons)
        );
    }

    public record Resolution(String backend, String capability, Capability implementation) {}
}
