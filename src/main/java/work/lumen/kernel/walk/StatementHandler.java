package work.lumen.kernel.walk;

import work.lumen.kernel.parse.TokenStream;

public interface StatementHandler {
    /** Decides from the upcoming tokens, without consuming them. */
    boolean matches(TokenStream tokens);

    ExecNode parse(TreeParser parser);
}
