package work.lumen.kernel.parse;

import java.util.Objects;
import java.util.Optional;
import work.lumen.kernel.error.ParseException;
import work.lumen.kernel.lex.Token;
import work.lumen.kernel.registry.Associativity;

/**
 * Generic precedence-climbing engine shared by both execution strategies. It knows nothing about
 * what the operators mean: the {@link Grammar} supplies prefix terms and infix rules, and decides
 * what node type {@code N} to build.
 */
public final class PrecedenceClimber<N> {
    /** Threshold that accepts every operator; used at statement level and inside grouping. */
    public static final int LOWEST = 1;

    private final Grammar<N> grammar;
    private final TokenStream tokens;

    public PrecedenceClimber(Grammar<N> grammar, TokenStream tokens) {
        this.grammar = Objects.requireNonNull(grammar, "grammar");
        this.tokens = Objects.requireNonNull(tokens, "tokens");
    }

    public TokenStream tokens() {
        return tokens;
    }

    public N parseExpression() {
        return parseExpression(LOWEST);
    }

    /**
     * Parses a prefix term, then keeps folding infix rules whose precedence is at least
     * {@code minPrecedence}.
     */
    public N parseExpression(int minPrecedence) {
        N left = grammar.parsePrefix(tokens, this);
        int chainedNonAssociative = -1;
        while (!tokens.atEnd()) {
            var operator = tokens.peek();
            var rule = grammar.infixAt(operator).orElse(null);
            if (rule == null || rule.precedence() < minPrecedence) {
                break;
            }
            if (rule.associativity() == Associativity.NONE && rule.precedence() == chainedNonAssociative) {
                throw new ParseException(
                    "Operator '" + operator.lexeme() + "' is non-associative and cannot be chained",
                    operator.span()
                );
            }
            tokens.advance();
            left = rule.parse(tokens, left, operator, this);
            chainedNonAssociative = rule.associativity() == Associativity.NONE ? rule.precedence() : -1;
        }
        return left;
    }

    /** Right operand of {@code rule}: same level for right-associative rules, one above otherwise. */
    public N parseOperand(InfixRule<N> rule) {
        int next = rule.associativity() == Associativity.RIGHT ? rule.precedence() : rule.precedence() + 1;
        return parseExpression(next);
    }

    public interface Grammar<N> {
        N parsePrefix(TokenStream tokens, PrecedenceClimber<N> climber);

        Optional<InfixRule<N>> infixAt(Token token);
    }

    public interface InfixRule<N> {
        int precedence();

        Associativity associativity();

        /** Called with the operator token already consumed. */
        N parse(TokenStream tokens, N left, Token operator, PrecedenceClimber<N> climber);
    }
}
