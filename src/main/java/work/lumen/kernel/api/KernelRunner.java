package work.lumen.kernel.api;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lumen.kernel.demo.DemoCapabilities;
import work.lumen.kernel.error.KernelErrors;
import work.lumen.kernel.error.StackExhaustionException;
import work.lumen.kernel.extern.CapabilityRegistry;
import work.lumen.kernel.runtime.ExecutionContext;

/**
 * Public entry point for embedding the kernel. Every run gets a fresh execution context; a failed
 * run is reported in its {@link RunResult} and never affects the next one.
 */
public final class KernelRunner {
    private static final Logger LOGGER = LoggerFactory.getLogger(KernelRunner.class);

    private final LanguageCatalog catalog;

    public KernelRunner() {
        this(LanguageCatalog.standard());
    }

    public KernelRunner(LanguageCatalog catalog) {
        this.catalog = catalog;
    }

    public RunResult run(RunConfiguration configuration) {
        var started = Instant.now();
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("source", configuration.source().display());
        metadata.put("language", configuration.language());
        metadata.put("logLevel", configuration.logLevel().name());
        String source = null;
        try {
            source = configuration.source().read();
            var language = catalog.get(configuration.language());
            metadata.put("strategy", language.strategy().name().toLowerCase());
            LOGGER.info("Running {} with language '{}'", configuration.source().display(), language.name());

            var program = language.compile(source);
            if (configuration.dumpInstructions()) {
                metadata.put("instructions", program.describe());
            }
            var capabilities = DemoCapabilities.register(new CapabilityRegistry(), configuration.output());
            var ctx = new ExecutionContext(
                capabilities,
                language.values().unit(),
                configuration.options(),
                new ExecutionContext.CancellationToken(),
                configuration.timeout()
            );
            var value = program.run(ctx);

            metadata.put("result", value.display());
            metadata.put("status", "ok");
            LOGGER.info("Finished {} in {}", configuration.source().display(), Duration.between(started, Instant.now()));
            return RunResult.success(metadata, started);
        } catch (StackOverflowError overflow) {
            return failed(new StackExhaustionException(null), source, metadata, configuration, started);
        } catch (Exception ex) {
            return failed(ex, source, metadata, configuration, started);
        }
    }

    private static RunResult failed(
        Throwable ex,
        String source,
        Map<String, Object> metadata,
        RunConfiguration configuration,
        Instant started
    ) {
        var error = KernelErrors.normalize(ex, source);
        LOGGER.info("Run of {} failed: {}", configuration.source().display(), error.get("message"));
        if (Boolean.getBoolean("lumen.debug")) {
            ex.printStackTrace();
        }
        return RunResult.failure(error, metadata, started);
    }
}
