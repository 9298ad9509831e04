package work.lumen.kernel.instruction;

import java.util.Objects;
import work.lumen.kernel.lex.Tokenizer;
import work.lumen.kernel.registry.SchemaRegistry;
import work.lumen.kernel.runtime.ExecutionStrategy;
import work.lumen.kernel.runtime.LanguageDefinition;
import work.lumen.kernel.runtime.ValueSystem;

/**
 * Language described entirely by a {@link SchemaRegistry}, executed as canonical instructions.
 */
public record SchemaLanguage(SchemaRegistry schema, ValueSystem values) implements LanguageDefinition {
    public SchemaLanguage {
        Objects.requireNonNull(schema, "schema");
        Objects.requireNonNull(values, "values");
    }

    @Override
    public String name() {
        return schema.name();
    }

    @Override
    public ExecutionStrategy strategy() {
        return ExecutionStrategy.CANONICAL_INSTRUCTIONS;
    }

    public Tokenizer tokenizer() {
        return new Tokenizer(schema.lexemes());
    }

    @Override
    public CompiledProgram compile(String source) {
        var tokens = schema.normalizer().normalize(source, tokenizer().tokenize(source));
        var reduction = new InstructionReducer(schema, values, tokens, source).reduce();
        return new CompiledProgram(this, reduction.root(), reduction.functions());
    }
}
