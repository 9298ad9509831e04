package work.lumen.kernel.api;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Program source: a file on disk or inline text given on the command line.
 */
public record SourceTarget(Optional<Path> file, Optional<String> inline) {
    public SourceTarget {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(inline, "inline");
        if (file.isEmpty() == inline.isEmpty()) {
            throw new IllegalArgumentException("Exactly one of file or inline source must be present.");
        }
    }

    public static SourceTarget forFile(Path path) {
        return new SourceTarget(Optional.of(path), Optional.empty());
    }

    public static SourceTarget forInline(String code) {
        return new SourceTarget(Optional.empty(), Optional.of(code));
    }

    public boolean isInline() {
        return inline.isPresent();
    }

    public String read() throws IOException {
        if (inline.isPresent()) {
            return inline.get();
        }
        return Files.readString(file.orElseThrow());
    }

    public String display() {
        return file.map(Path::toString).orElse("<inline>");
    }
}
