package work.lumen.kernel.runtime;

/**
 * A language hosted by the kernel: its name, the strategy it executes with, its value system and
 * the front end that turns source text into an {@link Executable}.
 */
public interface LanguageDefinition {
    String name();

    ExecutionStrategy strategy();

    ValueSystem values();

    /**
     * @throws work.lumen.kernel.error.LexicalException on unrecognized input
     * @throws work.lumen.kernel.error.ParseException on malformed structure
     */
    Executable compile(String source);
}
