package work.lumen.kernel.instruction;

import work.lumen.kernel.instruction.Instruction.Sequence;
import work.lumen.kernel.runtime.Executable;
import work.lumen.kernel.runtime.ExecutionContext;
import work.lumen.kernel.runtime.FunctionTable;
import work.lumen.kernel.runtime.Value;

/**
 * Instruction tree of a schema language program plus the functions it defines.
 */
public record CompiledProgram(SchemaLanguage language, Sequence root, FunctionTable<Instruction> functions) implements Executable {
    @Override
    public Value run(ExecutionContext ctx) {
        return new InstructionExecutor(language.schema(), language.values(), functions).run(root, ctx);
    }

    @Override
    public String describe() {
        return new InstructionCodec(language).writeProgram(this);
    }
}
