package work.lumen.kernel.api;

import java.io.PrintStream;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import work.lumen.kernel.runtime.ExecutionOptions;

/**
 * Immutable configuration of a single program run.
 */
public record RunConfiguration(
    SourceTarget source,
    String language,
    Optional<Duration> timeout,
    LogLevel logLevel,
    ExecutionOptions options,
    PrintStream output,
    boolean dumpInstructions
) {
    public RunConfiguration {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(language, "language");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(logLevel, "logLevel");
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(output, "output");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private SourceTarget source;
        private String language;
        private Optional<Duration> timeout = Optional.empty();
        private LogLevel logLevel = LogLevel.FATAL;
        private ExecutionOptions options = ExecutionOptions.defaults();
        private PrintStream output = System.out;
        private boolean dumpInstructions;

        public Builder source(SourceTarget source) {
            this.source = source;
            return this;
        }

        public Builder language(String language) {
            this.language = language;
            return this;
        }

        public Builder timeout(Optional<Duration> timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public Builder options(ExecutionOptions options) {
            this.options = options;
            return this;
        }

        public Builder memoize(boolean memoize) {
            this.options = options.withMemoization(memoize);
            return this;
        }

        public Builder output(PrintStream output) {
            this.output = output;
            return this;
        }

        public Builder dumpInstructions(boolean dumpInstructions) {
            this.dumpInstructions = dumpInstructions;
            return this;
        }

        public RunConfiguration build() {
            return new RunConfiguration(source, language, timeout, logLevel, options, output, dumpInstructions);
        }
    }
}
