package work.lumen.kernel.error;

import work.lumen.kernel.lex.Span;

/**
 * Raised by the tokenizer when no lexeme or fallback rule matches the input.
 */
public final class LexicalException extends KernelException {
    public LexicalException(String message, Span span) {
        super("lexical_error", message, span);
    }
}
