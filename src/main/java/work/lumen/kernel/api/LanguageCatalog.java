package work.lumen.kernel.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import work.lumen.kernel.demo.DemoValueSystem;
import work.lumen.kernel.demo.lumen.LumenLanguage;
import work.lumen.kernel.error.ConfigurationException;
import work.lumen.kernel.instruction.SchemaLanguage;
import work.lumen.kernel.registry.SchemaLoader;
import work.lumen.kernel.runtime.LanguageDefinition;

/**
 * Languages a runner can select by name. Definitions are built lazily, once per catalog.
 */
public final class LanguageCatalog {
    private final Map<String, Supplier<LanguageDefinition>> factories = new LinkedHashMap<>();
    private final Map<String, LanguageDefinition> loaded = new LinkedHashMap<>();

    public static LanguageCatalog standard() {
        return new LanguageCatalog()
            .register(LumenLanguage.NAME, LumenLanguage::create)
            .register("mini_rust", () -> schemaLanguage("languages/mini_rust.toml"))
            .register("mini_python", () -> schemaLanguage("languages/mini_python.yaml"));
    }

    public LanguageCatalog register(String name, Supplier<LanguageDefinition> factory) {
        if (factories.putIfAbsent(name, factory) != null) {
            throw new ConfigurationException("Language '" + name + "' is already registered");
        }
        return this;
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(factories.keySet());
    }

    public synchronized LanguageDefinition get(String name) {
        var cached = loaded.get(name);
        if (cached != null) {
            return cached;
        }
        var factory = factories.get(name);
        if (factory == null) {
            throw new ConfigurationException("Unknown language '" + name + "'; available: " + String.join(", ", factories.keySet()));
        }
        var language = factory.get();
        loaded.put(name, language);
        return language;
    }

    private static LanguageDefinition schemaLanguage(String resource) {
        return new SchemaLanguage(SchemaLoader.fromResource(resource), new DemoValueSystem());
    }
}
