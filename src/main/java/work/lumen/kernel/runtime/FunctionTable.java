package work.lumen.kernel.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Functions defined by one program. Filled while parsing, so calls may precede definitions; a later
 * definition with the same name replaces the earlier one.
 */
public final class FunctionTable<B> {
    private static final Logger LOGGER = LoggerFactory.getLogger(FunctionTable.class);

    private final Map<String, FunctionDef<B>> functions = new LinkedHashMap<>();

    public FunctionTable<B> define(FunctionDef<B> function) {
        var previous = functions.put(function.name(), function);
        if (previous != null) {
            LOGGER.debug("Function '{}' redefined", function.name());
        }
        return this;
    }

    public Optional<FunctionDef<B>> lookup(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    public boolean contains(String name) {
        return functions.containsKey(name);
    }

    public Map<String, FunctionDef<B>> entries() {
        return Collections.unmodifiableMap(functions);
    }
}
