package work.lumen.kernel.registry;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import work.lumen.kernel.error.ConfigurationException;

/**
 * Declarative statement shape: a leading keyword, the elements that follow it, and the canonical
 * action the statement reduces to. {@code selector} is only used by {@link CanonicalAction#INVOKE}.
 */
public record StatementPattern(String keyword, List<PatternElement> elements, CanonicalAction action, String selector) {
    public StatementPattern {
        Objects.requireNonNull(keyword, "keyword");
        Objects.requireNonNull(action, "action");
        elements = elements == null ? List.of() : List.copyOf(elements);
        Set<String> fields = new HashSet<>();
        for (var element : elements) {
            if (element.field() != null && !fields.add(element.field())) {
                throw new ConfigurationException("Statement '" + keyword + "' declares field '" + element.field() + "' twice");
            }
        }
        for (int i = 0; i < elements.size(); i++) {
            if (elements.get(i).kind() == PatternElement.Kind.CHAIN
                && elements.subList(i + 1, elements.size()).stream().noneMatch(e -> e.kind() == PatternElement.Kind.BLOCK)) {
                throw new ConfigurationException(
                    "Statement '" + keyword + "' chains on '" + elements.get(i).lexeme() + "' but has no block after it"
                );
            }
        }
        for (var required : action.requiredFields()) {
            if (!fields.contains(required)) {
                throw new ConfigurationException(
                    "Statement '" + keyword + "' (" + action + ") is missing required field '" + required + "'"
                );
            }
        }
        if (action == CanonicalAction.INVOKE && (selector == null || selector.isBlank())) {
            throw new ConfigurationException("Statement '" + keyword + "' invokes an extern but has no selector");
        }
    }

    public StatementPattern(String keyword, List<PatternElement> elements, CanonicalAction action) {
        this(keyword, elements, action, null);
    }
}
