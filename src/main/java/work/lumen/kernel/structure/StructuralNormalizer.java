package work.lumen.kernel.structure;

import java.util.List;
import work.lumen.kernel.lex.Token;

/**
 * Post-tokenization pass that makes block structure explicit (or validates it) before parsing.
 */
@FunctionalInterface
public interface StructuralNormalizer {
    List<Token> normalize(String source, List<Token> tokens);

    static StructuralNormalizer identity() {
        return (source, tokens) -> tokens;
    }
}
