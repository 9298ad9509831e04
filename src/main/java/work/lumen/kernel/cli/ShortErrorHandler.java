package work.lumen.kernel.cli;

import picocli.CommandLine;
import work.lumen.kernel.api.RunResult;
import work.lumen.kernel.error.KernelErrors;

/**
 * Reports exceptions escaping {@link LumenRunCommand}, such as a language that cannot be loaded,
 * as a single {@code lumen-run: code: message} line. {@code -Dlumen.debug=true} adds the stack trace.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final String PREFIX = "lumen-run: ";

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        var error = KernelErrors.normalize(ex, null);
        commandLine.getErr().println(commandLine.getColorScheme().errorText(
            PREFIX + error.get("code") + ": " + error.get("message")
        ));
        if (Boolean.getBoolean("lumen.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        return RunResult.Status.FAILURE.exitCode();
    }
}
