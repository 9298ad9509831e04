package work.lumen.kernel.error;

/**
 * Raised while a language is being registered: conflicting lexeme roles, ambiguous statement
 * patterns, invalid operator entries or unreadable schema documents.
 */
public final class ConfigurationException extends KernelException {
    public ConfigurationException(String message) {
        super("configuration_error", message, null);
    }

    public ConfigurationException(String message, Throwable cause) {
        super("configuration_error", message, null, cause);
    }
}
