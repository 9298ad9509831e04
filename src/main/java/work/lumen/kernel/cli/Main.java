package work.lumen.kernel.cli;

import picocli.CommandLine;
import work.lumen.kernel.api.LanguageCatalog;

/**
 * Entry point of {@code lumen-run}. Exits with 0 when every program succeeded, 1 when a program
 * failed or the run could not start, and 2 on usage errors.
 */
public final class Main {
    private Main() {}

    public static void main(String[] args) {
        System.exit(commandLine(LanguageCatalog.standard()).execute(args));
    }

    static CommandLine commandLine(LanguageCatalog catalog) {
        return new CommandLine(new LumenRunCommand(catalog))
            .setExecutionExceptionHandler(new ShortErrorHandler())
            .setUsageHelpAutoWidth(true);
    }
}
