package work.lumen.kernel.support;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import work.lumen.kernel.demo.DemoCapabilities;
import work.lumen.kernel.extern.CapabilityRegistry;
import work.lumen.kernel.runtime.ExecutionContext;
import work.lumen.kernel.runtime.ExecutionOptions;
import work.lumen.kernel.runtime.LanguageDefinition;
import work.lumen.kernel.runtime.Value;

/**
 * Shared helpers for kernel test suites: a context wired to the demo capabilities with captured
 * output, and access to the program fixtures under {@code src/test/resources/programs}.
 */
public final class KernelTestSupport {
    private KernelTestSupport() {}

    public static Harness harness() {
        return new Harness(ExecutionOptions.defaults());
    }

    public static Harness harness(ExecutionOptions options) {
        return new Harness(options);
    }

    public static String fixture(String name) {
        try (InputStream in = KernelTestSupport.class.getClassLoader().getResourceAsStream("programs/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("Missing test fixture programs/" + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to read fixture " + name, ex);
        }
    }

    /** Demo capabilities printing into a buffer. */
    public static final class Harness {
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        private final CapabilityRegistry capabilities = DemoCapabilities.register(new CapabilityRegistry(), out);
        private final ExecutionOptions options;

        private Harness(ExecutionOptions options) {
            this.options = options;
        }

        public CapabilityRegistry capabilities() {
            return capabilities;
        }

        public PrintStream out() {
            return out;
        }

        public ExecutionContext context(LanguageDefinition language) {
            return new ExecutionContext(
                capabilities,
                language.values().unit(),
                options,
                new ExecutionContext.CancellationToken(),
                Optional.empty()
            );
        }

        /** Registers {@code env:depth}, recording the environment depth of {@code ctx} on every call. */
        public List<Integer> recordDepths(ExecutionContext ctx) {
            List<Integer> depths = new ArrayList<>();
            capabilities.register("env", "depth", args -> {
                depths.add(ctx.environment().depth());
                return ctx.unit();
            });
            return depths;
        }

        public Value run(LanguageDefinition language, String source) {
            return language.compile(source).run(context(language));
        }

        public String output() {
            return buffer.toString(StandardCharsets.UTF_8);
        }

        public List<String> lines() {
            var text = output().replace("\r\n", "\n");
            if (text.isEmpty()) {
                return List.of();
            }
            return Arrays.asList(text.split("\n"));
        }
    }
}
