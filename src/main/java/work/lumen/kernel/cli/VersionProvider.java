package work.lumen.kernel.cli;

import java.util.Optional;
import picocli.CommandLine;
import work.lumen.kernel.api.LanguageCatalog;

/** Kernel version plus the languages the standard catalog hosts. */
final class VersionProvider implements CommandLine.IVersionProvider {
    static final String UNRELEASED = "0.0.0-dev";

    @Override
    public String[] getVersion() {
        var version = Optional.ofNullable(VersionProvider.class.getPackage().getImplementationVersion()).orElse(UNRELEASED);
        return new String[] {
            "lumen-run " + version,
            "languages: " + String.join(", ", LanguageCatalog.standard().names()),
            "JVM: " + System.getProperty("java.version") + " (" + System.getProperty("java.vendor") + ")"
        };
    }
}
