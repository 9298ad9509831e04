package work.lumen.kernel.registry;

import java.util.Locale;
import java.util.Set;
import work.lumen.kernel.error.ConfigurationException;

/**
 * What a statement pattern reduces to, together with the pattern fields the reduction reads.
 */
public enum CanonicalAction {
    BRANCH(Set.of("cond", "then")),
    LOOP(Set.of("cond", "body")),
    UNTIL(Set.of("cond", "body")),
    FOR(Set.of("var", "iterable", "body")),
    REPEAT(Set.of("body")),
    BIND(Set.of("name", "value")),
    ASSIGN(Set.of("name", "value")),
    RETURN(Set.of()),
    BREAK(Set.of()),
    CONTINUE(Set.of()),
    FUNCTION(Set.of("name", "params", "body")),
    INVOKE(Set.of("value")),
    EXPRESSION(Set.of("value"));

    private final Set<String> requiredFields;

    CanonicalAction(Set<String> requiredFields) {
        this.requiredFields = requiredFields;
    }

    public Set<String> requiredFields() {
        return requiredFields;
    }

    public static CanonicalAction from(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Statement pattern is missing an action");
        }
        try {
            return CanonicalAction.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException("Unknown canonical action: " + value);
        }
    }
}
