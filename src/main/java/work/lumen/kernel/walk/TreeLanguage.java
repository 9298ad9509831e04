package work.lumen.kernel.walk;

import java.util.Objects;
import work.lumen.kernel.lex.LexemeTable;
import work.lumen.kernel.lex.Tokenizer;
import work.lumen.kernel.parse.BlockSyntax;
import work.lumen.kernel.runtime.ExecutionStrategy;
import work.lumen.kernel.runtime.LanguageDefinition;
import work.lumen.kernel.runtime.ValueSystem;
import work.lumen.kernel.structure.StructuralNormalizer;

/**
 * Tree-walking language: lexemes, structural pass, handlers and value system.
 */
public record TreeLanguage(
    String name,
    LexemeTable lexemes,
    StructuralNormalizer normalizer,
    HandlerRegistry handlers,
    BlockSyntax blocks,
    ValueSystem values
) implements LanguageDefinition {
    public TreeLanguage {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(lexemes, "lexemes");
        Objects.requireNonNull(normalizer, "normalizer");
        Objects.requireNonNull(handlers, "handlers");
        Objects.requireNonNull(blocks, "blocks");
        Objects.requireNonNull(values, "values");
    }

    @Override
    public ExecutionStrategy strategy() {
        return ExecutionStrategy.TREE_WALKING;
    }

    @Override
    public Program compile(String source) {
        var tokens = normalizer.normalize(source, new Tokenizer(lexemes).tokenize(source));
        return new TreeParser(this, tokens, source).parseProgram();
    }
}
