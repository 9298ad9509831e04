package work.lumen.kernel.registry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import work.lumen.kernel.error.ConfigurationException;
import work.lumen.kernel.lex.FallbackRule;
import work.lumen.kernel.lex.LexemeRole;
import work.lumen.kernel.lex.LexemeTable;
import work.lumen.kernel.structure.DelimiterNormalizer;
import work.lumen.kernel.structure.IndentationNormalizer;
import work.lumen.kernel.structure.StructuralNormalizer;

/**
 * Declarative description of a language: lexemes, operators, statement patterns and structural
 * lexemes. Collected through a {@link Builder}, immutable once built, and then shared read-only.
 *
 * <p>Every conflict is reported while registering, never while parsing.
 */
public final class SchemaRegistry {
    private final String name;
    private final LexemeTable lexemes;
    private final Map<String, OperatorInfo> binaryOperators;
    private final Map<String, PrefixOperatorInfo> prefixOperators;
    private final Map<String, StatementPattern> statements;
    private final SyntaxProfile syntax;
    private final Set<String> memoizable;

    private SchemaRegistry(Builder builder, SyntaxProfile syntax) {
        this.name = builder.name;
        this.lexemes = builder.lexemes.build();
        this.binaryOperators = Collections.unmodifiableMap(new LinkedHashMap<>(builder.binaryOperators));
        this.prefixOperators = Collections.unmodifiableMap(new LinkedHashMap<>(builder.prefixOperators));
        this.statements = Collections.unmodifiableMap(new LinkedHashMap<>(builder.statements));
        this.syntax = syntax;
        this.memoizable = Set.copyOf(builder.memoizable);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public LexemeTable lexemes() {
        return lexemes;
    }

    public SyntaxProfile syntax() {
        return syntax;
    }

    public Optional<OperatorInfo> binaryOperator(String lexeme) {
        return Optional.ofNullable(binaryOperators.get(lexeme));
    }

    public Optional<PrefixOperatorInfo> prefixOperator(String lexeme) {
        return Optional.ofNullable(prefixOperators.get(lexeme));
    }

    public Optional<StatementPattern> statement(String keyword) {
        return Optional.ofNullable(statements.get(keyword));
    }

    public Map<String, OperatorInfo> binaryOperators() {
        return binaryOperators;
    }

    public Map<String, StatementPattern> statements() {
        return statements;
    }

    public boolean isMemoizable(String function) {
        return memoizable.contains(function);
    }

    /** Bracket pairs that group or call, plus the block pair when blocks use delimiters. */
    public Map<String, String> bracketPairs() {
        var pairs = new LinkedHashMap<String, String>();
        pairs.put(syntax.callOpen(), syntax.callClose());
        if (syntax.layout() == BlockLayout.BRACES) {
            pairs.put(syntax.blockOpen(), syntax.blockClose());
        }
        return pairs;
    }

    public StructuralNormalizer normalizer() {
        if (syntax.layout() == BlockLayout.INDENTATION) {
            return new IndentationNormalizer(syntax.blockOpen(), syntax.blockClose(), syntax.newline(), bracketPairs());
        }
        return new DelimiterNormalizer(bracketPairs());
    }

    @Override
    public String toString() {
        return "SchemaRegistry[" + name + "]";
    }

    public static final class Builder {
        private static final Set<String> RESERVED_OPERATORS = Set.of("const", "load", "iter", "next");

        private final String name;
        private final LexemeTable.Builder lexemes = LexemeTable.builder();
        private final Map<String, OperatorInfo> binaryOperators = new LinkedHashMap<>();
        private final Map<String, PrefixOperatorInfo> prefixOperators = new LinkedHashMap<>();
        private final Map<String, StatementPattern> statements = new LinkedHashMap<>();
        private final Set<String> memoizable = new LinkedHashSet<>();
        private final Set<String> terminators = new LinkedHashSet<>();
        private BlockLayout layout;
        private String blockOpen;
        private String blockClose;
        private String newline;
        private String assignment = "=";
        private String callOpen = "(";
        private String callClose = ")";
        private String separator = ",";
        private String externKeyword;
        private boolean built;

        private Builder(String name) {
            if (name == null || name.isBlank()) {
                throw new ConfigurationException("Language name must not be blank");
            }
            this.name = name;
        }

        public Builder lexeme(String lexeme, LexemeRole role) {
            ensureOpen();
            lexemes.add(lexeme, role);
            return this;
        }

        public Builder skip(String lexeme) {
            return lexeme(lexeme, LexemeRole.SKIP);
        }

        public Builder fallback(FallbackRule rule) {
            ensureOpen();
            lexemes.fallback(Objects.requireNonNull(rule, "rule"));
            return this;
        }

        public Builder binaryOperator(String lexeme, int precedence, Associativity associativity) {
            return binaryOperator(lexeme, precedence, associativity, ShortCircuit.NONE);
        }

        public Builder binaryOperator(String lexeme, int precedence, Associativity associativity, ShortCircuit shortCircuit) {
            ensureOpen();
            var info = new OperatorInfo(lexeme, precedence, associativity, shortCircuit);
            requireNotReserved(lexeme);
            requireNotStatement(lexeme);
            var existing = binaryOperators.get(lexeme);
            if (existing != null && !existing.equals(info)) {
                throw new ConfigurationException("Operator '" + lexeme + "' already registered as " + existing);
            }
            requireUsable(lexeme, lexemes.addIfAbsent(lexeme, roleFor(lexeme, LexemeRole.OPERATOR)));
            binaryOperators.put(lexeme, info);
            return this;
        }

        public Builder prefixOperator(String lexeme, int precedence) {
            ensureOpen();
            var info = new PrefixOperatorInfo(lexeme, precedence);
            requireNotReserved(lexeme);
            requireNotStatement(lexeme);
            var existing = prefixOperators.get(lexeme);
            if (existing != null && !existing.equals(info)) {
                throw new ConfigurationException("Prefix operator '" + lexeme + "' already registered as " + existing);
            }
            requireUsable(lexeme, lexemes.addIfAbsent(lexeme, roleFor(lexeme, LexemeRole.OPERATOR)));
            prefixOperators.put(lexeme, info);
            return this;
        }

        public Builder statement(StatementPattern pattern) {
            ensureOpen();
            if (statements.containsKey(pattern.keyword())) {
                throw new ConfigurationException(
                    "Ambiguous statement patterns: keyword '" + pattern.keyword() + "' registered twice"
                );
            }
            if (binaryOperators.containsKey(pattern.keyword()) || prefixOperators.containsKey(pattern.keyword())) {
                throw new ConfigurationException("Keyword '" + pattern.keyword() + "' is already an operator");
            }
            lexemes.add(pattern.keyword(), LexemeRole.KEYWORD);
            for (var element : pattern.elements()) {
                if (element.kind().literal()) {
                    requireUsable(element.lexeme(), lexemes.addIfAbsent(element.lexeme(), roleFor(element.lexeme(), LexemeRole.DELIMITER)));
                }
            }
            statements.put(pattern.keyword(), pattern);
            return this;
        }

        /** Blocks delimited by explicit lexemes such as braces. */
        public Builder blocks(String open, String close) {
            ensureOpen();
            this.layout = BlockLayout.BRACES;
            this.blockOpen = open;
            this.blockClose = close;
            this.newline = null;
            return this;
        }

        /** Blocks derived from indentation; the three markers are synthesized, never lexed. */
        public Builder indentation(String indent, String dedent, String newline) {
            ensureOpen();
            this.layout = BlockLayout.INDENTATION;
            this.blockOpen = indent;
            this.blockClose = dedent;
            this.newline = newline;
            return this;
        }

        public Builder terminators(String... lexemes) {
            ensureOpen();
            terminators.addAll(List.of(lexemes));
            return this;
        }

        public Builder assignment(String lexeme) {
            ensureOpen();
            this.assignment = lexeme;
            return this;
        }

        public Builder calls(String open, String close, String separator) {
            ensureOpen();
            this.callOpen = open;
            this.callClose = close;
            this.separator = separator;
            return this;
        }

        public Builder externKeyword(String keyword) {
            ensureOpen();
            this.externKeyword = keyword;
            return this;
        }

        public Builder memoizable(String... functions) {
            ensureOpen();
            memoizable.addAll(List.of(functions));
            return this;
        }

        public SchemaRegistry build() {
            ensureOpen();
            if (layout == null || isBlank(blockOpen) || isBlank(blockClose)) {
                throw new ConfigurationException("Language '" + name + "' does not declare its block delimiters");
            }
            if (layout == BlockLayout.INDENTATION && isBlank(newline)) {
                throw new ConfigurationException("Language '" + name + "' uses indentation but declares no newline marker");
            }
            if (blockOpen.equals(blockClose) || callOpen.equals(callClose)) {
                throw new ConfigurationException("Language '" + name + "' uses the same lexeme to open and close a pair");
            }
            var structural = new LinkedHashMap<String, LexemeRole>();
            if (layout == BlockLayout.BRACES) {
                structural.put(blockOpen, LexemeRole.DELIMITER);
                structural.put(blockClose, LexemeRole.DELIMITER);
            }
            for (var lexeme : List.of(callOpen, callClose, separator)) {
                structural.putIfAbsent(lexeme, LexemeRole.DELIMITER);
            }
            structural.putIfAbsent(assignment, LexemeRole.OPERATOR);
            for (var terminator : terminators) {
                structural.putIfAbsent(terminator, LexemeRole.DELIMITER);
            }
            // validate everything first so a rejected build leaves the builder untouched
            structural.keySet().forEach(lexeme -> requireUsable(lexeme, lexemes.roleOf(lexeme).orElse(LexemeRole.DELIMITER)));
            if (externKeyword != null) {
                var existing = lexemes.roleOf(externKeyword);
                if (existing.isPresent() && existing.get() != LexemeRole.KEYWORD) {
                    throw new ConfigurationException(
                        "Extern keyword '" + externKeyword + "' is already registered as " + existing.get()
                    );
                }
            }
            structural.forEach(lexemes::addIfAbsent);
            if (externKeyword != null) {
                lexemes.add(externKeyword, LexemeRole.KEYWORD);
            }
            var effectiveTerminators = new LinkedHashSet<>(terminators);
            if (layout == BlockLayout.INDENTATION) {
                effectiveTerminators.add(newline);
            }
            var syntax = new SyntaxProfile(
                layout,
                blockOpen,
                blockClose,
                newline,
                effectiveTerminators,
                assignment,
                callOpen,
                callClose,
                separator,
                externKeyword
            );
            built = true;
            return new SchemaRegistry(this, syntax);
        }

        private void ensureOpen() {
            if (built) {
                throw new ConfigurationException("Language '" + name + "' is already built; registries are write-once");
            }
        }

        private static void requireNotReserved(String lexeme) {
            if (RESERVED_OPERATORS.contains(lexeme)) {
                throw new ConfigurationException("Operator name '" + lexeme + "' is reserved by the instruction set");
            }
        }

        private void requireNotStatement(String lexeme) {
            if (statements.containsKey(lexeme)) {
                throw new ConfigurationException("Operator '" + lexeme + "' is already a statement keyword");
            }
        }

        private static LexemeRole roleFor(String lexeme, LexemeRole symbolic) {
            return Character.isLetter(lexeme.charAt(0)) ? LexemeRole.KEYWORD : symbolic;
        }

        private static void requireUsable(String lexeme, LexemeRole role) {
            if (role == LexemeRole.SKIP) {
                throw new ConfigurationException("Lexeme '" + lexeme + "' is registered as skip and cannot be used structurally");
            }
        }

        private static boolean isBlank(String value) {
            return value == null || value.isBlank();
        }
    }
}
