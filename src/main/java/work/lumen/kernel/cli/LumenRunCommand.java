package work.lumen.kernel.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lumen.kernel.api.KernelRunner;
import work.lumen.kernel.api.LanguageCatalog;
import work.lumen.kernel.api.LogLevel;
import work.lumen.kernel.api.RunConfiguration;
import work.lumen.kernel.api.RunResult;
import work.lumen.kernel.api.SourceTarget;
import work.lumen.kernel.logging.LoggingConfigurator;
import work.lumen.kernel.shared.DurationParser;

@CommandLine.Command(
    name = "lumen-run",
    description = "Run programs written in a language hosted by the kernel.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class LumenRunCommand implements Callable<Integer> {
    private final LanguageCatalog catalog;

    @CommandLine.Option(
        names = {"-l", "--language"},
        required = true,
        description = "Language of the programs (lumen|mini_rust|mini_python)."
    )
    private String language;

    @CommandLine.Option(
        names = "--inline",
        paramLabel = "CODE",
        description = "Program text to run instead of files.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String inline;

    @CommandLine.Parameters(paramLabel = "FILE", arity = "0..*", description = "Program files, run one after the other.")
    private List<Path> files = new ArrayList<>();

    @CommandLine.Option(
        names = "--timeout",
        description = "Execution timeout per program (e.g. 500ms, 30s, 2m).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String timeoutRaw;

    @CommandLine.Option(
        names = "--log-level",
        description = "Kernel log threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Option(names = "--memoize", description = "Cache results of functions the language marks as memoizable.")
    private boolean memoize;

    @CommandLine.Option(names = "--dump-instructions", description = "Print the executable form of each program.")
    private boolean dumpInstructions;

    @CommandLine.Option(names = "--json", description = "Print each run result as JSON.")
    private boolean json;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    LumenRunCommand() {
        this(LanguageCatalog.standard());
    }

    LumenRunCommand(LanguageCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public Integer call() {
        var targets = targets();
        var logLevel = LogLevel.from(logLevelRaw);
        LoggingConfigurator.apply(logLevel);
        var timeout = DurationParser.parse(timeoutRaw);
        // unknown languages fail before any program runs
        catalog.get(language);

        var runner = new KernelRunner(catalog);
        int exitCode = 0;
        for (var target : targets) {
            var configuration = RunConfiguration.builder()
                .source(target)
                .language(language)
                .timeout(timeout)
                .logLevel(logLevel)
                .memoize(memoize)
                .output(System.out)
                .dumpInstructions(dumpInstructions)
                .build();
            var result = runner.run(configuration);
            report(result);
            exitCode = Math.max(exitCode, result.status().exitCode());
        }
        return exitCode;
    }

    private List<SourceTarget> targets() {
        var targets = new ArrayList<SourceTarget>();
        if (inline != null) {
            targets.add(SourceTarget.forInline(inline));
        }
        files.forEach(file -> targets.add(SourceTarget.forFile(file)));
        if (targets.isEmpty()) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Provide --inline code or at least one program file.");
        }
        return targets;
    }

    private void report(RunResult result) {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();
        if (json) {
            out.println(result.toPrettyJson());
            out.flush();
            return;
        }
        var instructions = result.metadata().get("instructions");
        if (instructions != null) {
            out.println(instructions);
            out.flush();
        }
        if (!result.succeeded() && result.metadata().get("error") instanceof Map<?, ?> error) {
            var location = error.get("location");
            err.println(spec.commandLine().getColorScheme().errorText(
                result.metadata().get("source") + (location != null ? ":" + location : "") + ": "
                    + error.get("code") + ": " + error.get("message")
            ));
            err.flush();
        }
    }
}
