package work.lumen.kernel.demo.lumen;

import java.util.ArrayList;
import java.util.List;
import work.lumen.kernel.lex.LexemeRole;
import work.lumen.kernel.lex.Span;
import work.lumen.kernel.parse.TokenStream;
import work.lumen.kernel.runtime.FunctionDef;
import work.lumen.kernel.walk.ExecNode;
import work.lumen.kernel.walk.Nodes;
import work.lumen.kernel.walk.StatementHandler;
import work.lumen.kernel.walk.StatementNodes;
import work.lumen.kernel.walk.TreeParser;

/**
 * Statement handlers of the Lumen demo language.
 */
final class LumenStatements {
    private LumenStatements() {}

    /** Matches statements introduced by a keyword. */
    abstract static class KeywordHandler implements StatementHandler {
        private final String keyword;

        KeywordHandler(String keyword) {
            this.keyword = keyword;
        }

        @Override
        public boolean matches(TokenStream tokens) {
            return tokens.check(keyword) && tokens.peek().role() == LexemeRole.KEYWORD;
        }

        @Override
        public ExecNode parse(TreeParser parser) {
            var start = parser.tokens().advance().span();
            return parseRest(parser, start);
        }

        abstract ExecNode parseRest(TreeParser parser, Span start);
    }

    /** {@code let name = expr} binds in the current frame. */
    static final class LetHandler extends KeywordHandler {
        LetHandler() {
            super("let");
        }

        @Override
        ExecNode parseRest(TreeParser parser, Span start) {
            var name = parser.tokens().expect(LexemeRole.IDENTIFIER, "a variable name");
            parser.tokens().expect("=");
            var value = parser.parseExpression();
            return new StatementNodes.Bind(name.lexeme(), value, start.merge(value.span()));
        }
    }

    /** {@code name = expr} updates the nearest binding. */
    static final class AssignmentHandler implements StatementHandler {
        @Override
        public boolean matches(TokenStream tokens) {
            return tokens.check(LexemeRole.IDENTIFIER) && tokens.peek(1).is("=");
        }

        @Override
        public ExecNode parse(TreeParser parser) {
            var name = parser.tokens().advance();
            parser.tokens().expect("=");
            var value = parser.parseExpression();
            return new StatementNodes.Assign(name.lexeme(), value, name.span().merge(value.span()));
        }
    }

    static final class IfHandler extends KeywordHandler {
        IfHandler() {
            super("if");
        }

        @Override
        ExecNode parseRest(TreeParser parser, Span start) {
            var condition = parser.parseExpression();
            var then = parser.parseBlock();
            List<ExecNode> otherwise = List.of();
            var tokens = parser.tokens();
            if (tokens.check("else")) {
                tokens.advance();
                otherwise = tokens.check("if") ? List.of(parser.parseStatement()) : parser.parseBlock();
            }
            return new StatementNodes.Branch(condition, then, otherwise, start.merge(lastSpan(otherwise.isEmpty() ? then : otherwise, condition.span())));
        }
    }

    static final class WhileHandler extends KeywordHandler {
        WhileHandler() {
            super("while");
        }

        @Override
        ExecNode parseRest(TreeParser parser, Span start) {
            var condition = parser.parseExpression();
            var body = parser.parseBlock();
            return new StatementNodes.While(condition, body, start.merge(lastSpan(body, condition.span())));
        }
    }

    /** {@code for name in expr} followed by a block. */
    static final class ForHandler extends KeywordHandler {
        ForHandler() {
            super("for");
        }

        @Override
        ExecNode parseRest(TreeParser parser, Span start) {
            var name = parser.tokens().expect(LexemeRole.IDENTIFIER, "a loop variable");
            parser.tokens().expect("in");
            var iterable = parser.parseExpression();
            var body = parser.parseBlock();
            return new StatementNodes.ForEach(name.lexeme(), iterable, body, start.merge(lastSpan(body, iterable.span())));
        }
    }

    static final class LoopHandler extends KeywordHandler {
        LoopHandler() {
            super("loop");
        }

        @Override
        ExecNode parseRest(TreeParser parser, Span start) {
            var body = parser.parseBlock();
            return new StatementNodes.Repeat(body, start.merge(lastSpan(body, start)));
        }
    }

    /** {@code fn name(a, b)} followed by a block; registered in the program's function table. */
    static final class FunctionHandler extends KeywordHandler {
        FunctionHandler() {
            super("fn");
        }

        @Override
        ExecNode parseRest(TreeParser parser, Span start) {
            var tokens = parser.tokens();
            var name = tokens.expect(LexemeRole.IDENTIFIER, "a function name");
            tokens.expect("(");
            var params = new ArrayList<String>();
            if (!tokens.match(")")) {
                do {
                    params.add(tokens.expect(LexemeRole.IDENTIFIER, "a parameter name").lexeme());
                } while (tokens.match(","));
                tokens.expect(")");
            }
            var body = parser.parseBlock();
            var span = start.merge(lastSpan(body, name.span()));
            parser.defineFunction(new FunctionDef<>(name.lexeme(), params, body, false, span));
            return new StatementNodes.FunctionDeclaration(name.lexeme(), span);
        }
    }

    static final class ReturnHandler extends KeywordHandler {
        ReturnHandler() {
            super("return");
        }

        @Override
        ExecNode parseRest(TreeParser parser, Span start) {
            if (parser.blocks().atStatementEnd(parser.tokens())) {
                return new StatementNodes.Return(null, start);
            }
            var value = parser.parseExpression();
            return new StatementNodes.Return(value, start.merge(value.span()));
        }
    }

    static final class BreakHandler extends KeywordHandler {
        BreakHandler() {
            super("break");
        }

        @Override
        ExecNode parseRest(TreeParser parser, Span start) {
            return new StatementNodes.Break(start);
        }
    }

    static final class ContinueHandler extends KeywordHandler {
        ContinueHandler() {
            super("continue");
        }

        @Override
        ExecNode parseRest(TreeParser parser, Span start) {
            return new StatementNodes.Continue(start);
        }
    }

    /** {@code print expr} goes through the {@code host:print} capability. */
    static final class PrintHandler extends KeywordHandler {
        PrintHandler() {
            super("print");
        }

        @Override
        ExecNode parseRest(TreeParser parser, Span start) {
            var value = parser.parseExpression();
            var span = start.merge(value.span());
            return new StatementNodes.ExpressionStatement(new Nodes.Extern("host:print", List.of(value), span), span);
        }
    }

    private static Span lastSpan(List<ExecNode> nodes, Span fallback) {
        return nodes.isEmpty() ? fallback : nodes.get(nodes.size() - 1).span();
    }
}
