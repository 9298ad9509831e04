package work.lumen.kernel.runtime;

/**
 * Parsed program ready to run against a fresh {@link ExecutionContext}.
 */
public interface Executable {
    /** Runs the program and returns the value of its last top-level statement. */
    Value run(ExecutionContext ctx);

    /** Human or machine readable rendering of the executable form, for diagnostics. */
    String describe();
}
