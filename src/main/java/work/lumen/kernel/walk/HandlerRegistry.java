package work.lumen.kernel.walk;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import work.lumen.kernel.lex.Token;
import work.lumen.kernel.parse.TokenStream;

/**
 * Ordered handler lists of a tree-walking language. The first registered handler that matches
 * wins. Immutable once built.
 */
public final class HandlerRegistry {
    private final List<PrefixHandler> prefix;
    private final List<InfixHandler> infix;
    private final List<StatementHandler> statements;

    private HandlerRegistry(Builder builder) {
        this.prefix = List.copyOf(builder.prefix);
        this.infix = List.copyOf(builder.infix);
        this.statements = List.copyOf(builder.statements);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<PrefixHandler> prefixFor(Token token) {
        return prefix.stream().filter(handler -> handler.matches(token)).findFirst();
    }

    public Optional<InfixHandler> infixFor(Token token) {
        return infix.stream().filter(handler -> handler.matches(token)).findFirst();
    }

    public Optional<StatementHandler> statementFor(TokenStream tokens) {
        return statements.stream().filter(handler -> handler.matches(tokens)).findFirst();
    }

    public static final class Builder {
        private final List<PrefixHandler> prefix = new ArrayList<>();
        private final List<InfixHandler> infix = new ArrayList<>();
        private final List<StatementHandler> statements = new ArrayList<>();

        public Builder prefix(PrefixHandler handler) {
            prefix.add(handler);
            return this;
        }

        public Builder infix(InfixHandler handler) {
            infix.add(handler);
            return this;
        }

        public Builder statement(StatementHandler handler) {
            statements.add(handler);
            return this;
        }

        public HandlerRegistry build() {
            return new HandlerRegistry(this);
        }
    }
}
