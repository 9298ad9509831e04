package work.lumen.kernel.lex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import work.lumen.kernel.error.ConfigurationException;

/**
 * Immutable set of literal lexemes, kept sorted by descending length, plus the ordered fallback
 * rules. Built once per language and shared read-only by every tokenization.
 */
public final class LexemeTable {
    private static final Comparator<Entry> LONGEST_FIRST = Comparator
        .comparingInt((Entry e) -> e.lexeme().length()).reversed()
        .thenComparing(Entry::lexeme);

    private final List<Entry> entries;
    private final Map<String, LexemeRole> roles;
    private final List<FallbackRule> fallbacks;

    private LexemeTable(Map<String, LexemeRole> roles, List<FallbackRule> fallbacks) {
        var sorted = new ArrayList<Entry>();
        roles.forEach((lexeme, role) -> sorted.add(new Entry(lexeme, role)));
        sorted.sort(LONGEST_FIRST);
        this.entries = Collections.unmodifiableList(sorted);
        this.roles = Collections.unmodifiableMap(new LinkedHashMap<>(roles));
        this.fallbacks = List.copyOf(fallbacks);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Entry> entries() {
        return entries;
    }

    public List<FallbackRule> fallbacks() {
        return fallbacks;
    }

    public Optional<LexemeRole> roleOf(String lexeme) {
        return Optional.ofNullable(roles.get(lexeme));
    }

    public boolean contains(String lexeme) {
        return roles.containsKey(lexeme);
    }

    public record Entry(String lexeme, LexemeRole role) {
        boolean isWord() {
            for (int i = 0; i < lexeme.length(); i++) {
                if (!FallbackRules.isIdentifierPart(lexeme.charAt(i))) {
                    return false;
                }
            }
            return true;
        }
    }

    public static final class Builder {
        private final Map<String, LexemeRole> roles = new LinkedHashMap<>();
        private final List<FallbackRule> fallbacks = new ArrayList<>();

        /**
         * Registers a literal lexeme. Registering the same lexeme again with the same role is a no-op;
         * a different role is a configuration error.
         */
        public Builder add(String lexeme, LexemeRole role) {
            if (lexeme == null || lexeme.isEmpty()) {
                throw new ConfigurationException("Lexeme must not be empty");
            }
            if (role == null || role == LexemeRole.MARKER) {
                throw new ConfigurationException("Lexeme '" + lexeme + "' needs an explicit role other than MARKER");
            }
            var existing = roles.get(lexeme);
            if (existing != null && existing != role) {
                throw new ConfigurationException(
                    "Lexeme '" + lexeme + "' already registered as " + existing + ", cannot re-register as " + role
                );
            }
            roles.put(lexeme, role);
            return this;
        }

        /** Registers the lexeme only when it is not known yet; returns the effective role. */
        public LexemeRole addIfAbsent(String lexeme, LexemeRole role) {
            var existing = roles.get(lexeme);
            if (existing != null) {
                return existing;
            }
            add(lexeme, role);
            return role;
        }

        public Builder fallback(FallbackRule rule) {
            fallbacks.add(rule);
            return this;
        }

        public boolean contains(String lexeme) {
            return roles.containsKey(lexeme);
        }

        public Optional<LexemeRole> roleOf(String lexeme) {
            return Optional.ofNullable(roles.get(lexeme));
        }

        public LexemeTable build() {
            return new LexemeTable(roles, fallbacks);
        }
    }
}
