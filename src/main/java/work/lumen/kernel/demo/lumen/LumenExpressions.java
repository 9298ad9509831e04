package work.lumen.kernel.demo.lumen;

import java.util.List;
import java.util.Map;
import work.lumen.kernel.error.ExternResolutionException;
import work.lumen.kernel.extern.Selector;
import work.lumen.kernel.lex.LexemeRole;
import work.lumen.kernel.lex.Token;
import work.lumen.kernel.registry.Associativity;
import work.lumen.kernel.registry.OperatorInfo;
import work.lumen.kernel.registry.ShortCircuit;
import work.lumen.kernel.runtime.ValueSystem;
import work.lumen.kernel.walk.ExecNode;
import work.lumen.kernel.walk.InfixHandler;
import work.lumen.kernel.walk.Nodes;
import work.lumen.kernel.walk.PrefixHandler;
import work.lumen.kernel.walk.TreeParser;

/**
 * Expression handlers of the Lumen demo language.
 */
final class LumenExpressions {
    private LumenExpressions() {}

    static final class LiteralHandler implements PrefixHandler {
        private final ValueSystem values;

        LiteralHandler(ValueSystem values) {
            this.values = values;
        }

        @Override
        public boolean matches(Token token) {
            return values.literal(token).isPresent();
        }

        @Override
        public ExecNode parse(TreeParser parser, Token token) {
            return new Nodes.Literal(values.literal(token).orElseThrow(), token.span());
        }
    }

    /** A variable read, or a call when the name is followed by an argument list. */
    static final class IdentifierHandler implements PrefixHandler {
        @Override
        public boolean matches(Token token) {
            return token.role() == LexemeRole.IDENTIFIER;
        }

        @Override
        public ExecNode parse(TreeParser parser, Token token) {
            var tokens = parser.tokens();
            if (tokens.match("(")) {
                var args = parser.parseArguments(",", ")");
                var end = args.isEmpty() ? token.span() : args.get(args.size() - 1).span();
                return new Nodes.Call(token.lexeme(), args, parser.functions(), token.span().merge(end));
            }
            return new Nodes.Variable(token.lexeme(), token.span());
        }
    }

    static final class GroupingHandler implements PrefixHandler {
        @Override
        public boolean matches(Token token) {
            return token.is("(");
        }

        @Override
        public ExecNode parse(TreeParser parser, Token token) {
            var inner = parser.parseExpression();
            parser.tokens().expect(")");
            return inner;
        }
    }

    static final class UnaryHandler implements PrefixHandler {
        private final Map<String, Integer> precedences;

        UnaryHandler(Map<String, Integer> precedences) {
            this.precedences = Map.copyOf(precedences);
        }

        @Override
        public boolean matches(Token token) {
            return token.role() != LexemeRole.STRING && precedences.containsKey(token.lexeme());
        }

        @Override
        public ExecNode parse(TreeParser parser, Token token) {
            var operand = parser.parseExpression(precedences.get(token.lexeme()));
            return new Nodes.Prefix(token.lexeme(), operand, parser.values(), token.span().merge(operand.span()));
        }
    }

    /** {@code extern("backend:capability", args...)}; the selector is checked while parsing. */
    static final class ExternHandler implements PrefixHandler {
        @Override
        public boolean matches(Token token) {
            return token.is("extern") && token.role() == LexemeRole.KEYWORD;
        }

        @Override
        public ExecNode parse(TreeParser parser, Token token) {
            var tokens = parser.tokens();
            tokens.expect("(");
            var selectorToken = tokens.expect(LexemeRole.STRING, "an extern selector string");
            var selector = selectorToken.lexeme().substring(1, selectorToken.lexeme().length() - 1);
            try {
                Selector.parse(selector);
            } catch (ExternResolutionException ex) {
                throw ex.withSpanIfMissing(selectorToken.span());
            }
            List<ExecNode> args = List.of();
            if (tokens.match(",")) {
                args = parser.parseArguments(",", ")");
            } else {
                tokens.expect(")");
            }
            var end = args.isEmpty() ? selectorToken.span() : args.get(args.size() - 1).span();
            return new Nodes.Extern(selector, args, token.span().merge(end));
        }
    }

    static final class BinaryHandler implements InfixHandler {
        private final Map<String, OperatorInfo> operators;

        BinaryHandler(Map<String, OperatorInfo> operators) {
            this.operators = Map.copyOf(operators);
        }

        @Override
        public boolean matches(Token token) {
            return token.role() != LexemeRole.STRING && operators.containsKey(token.lexeme());
        }

        @Override
        public int precedence(Token operator) {
            return operators.get(operator.lexeme()).precedence();
        }

        @Override
        public Associativity associativity(Token operator) {
            return operators.get(operator.lexeme()).associativity();
        }

        @Override
        public ExecNode parse(TreeParser parser, ExecNode left, Token operator) {
            var info = operators.get(operator.lexeme());
            var right = parser.parseOperand(this, operator);
            var span = left.span().merge(right.span());
            if (info.shortCircuit() != ShortCircuit.NONE) {
                return new Nodes.ShortCircuitBinary(operator.lexeme(), info.shortCircuit(), left, right, parser.values(), span);
            }
            return new Nodes.Binary(operator.lexeme(), left, right, parser.values(), span);
        }
    }
}
