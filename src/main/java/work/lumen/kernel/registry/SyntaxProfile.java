package work.lumen.kernel.registry;

import java.util.Objects;
import java.util.Set;
import work.lumen.kernel.parse.BlockSyntax;

/**
 * Structural lexemes of a schema language. For {@link BlockLayout#INDENTATION} the block markers
 * and {@code newline} are synthesized marker names rather than source lexemes.
 */
public record SyntaxProfile(
    BlockLayout layout,
    String blockOpen,
    String blockClose,
    String newline,
    Set<String> terminators,
    String assignment,
    String callOpen,
    String callClose,
    String separator,
    String externKeyword
) {
    public SyntaxProfile {
        Objects.requireNonNull(layout, "layout");
        Objects.requireNonNull(blockOpen, "blockOpen");
        Objects.requireNonNull(blockClose, "blockClose");
        Objects.requireNonNull(assignment, "assignment");
        Objects.requireNonNull(callOpen, "callOpen");
        Objects.requireNonNull(callClose, "callClose");
        Objects.requireNonNull(separator, "separator");
        terminators = terminators == null ? Set.of() : Set.copyOf(terminators);
    }

    public boolean isTerminator(String lexeme) {
        return terminators.contains(lexeme);
    }

    public BlockSyntax blockSyntax() {
        return new BlockSyntax(blockOpen, blockClose, terminators);
    }
}
