package work.lumen.kernel.walk;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lumen.kernel.error.ParseException;
import work.lumen.kernel.lex.Token;
import work.lumen.kernel.parse.BlockSyntax;
import work.lumen.kernel.parse.PrecedenceClimber;
import work.lumen.kernel.parse.TokenStream;
import work.lumen.kernel.registry.Associativity;
import work.lumen.kernel.runtime.FunctionDef;
import work.lumen.kernel.runtime.FunctionTable;
import work.lumen.kernel.runtime.ValueSystem;

/**
 * Pratt parser for tree-walking languages. Handlers call back into it for sub-expressions, blocks
 * and function definitions; it owns the per-program function table.
 */
public final class TreeParser implements PrecedenceClimber.Grammar<ExecNode> {
    private static final Logger LOGGER = LoggerFactory.getLogger(TreeParser.class);

    private final TreeLanguage language;
    private final TokenStream tokens;
    private final PrecedenceClimber<ExecNode> climber;
    private final FunctionTable<List<ExecNode>> functions = new FunctionTable<>();

    public TreeParser(TreeLanguage language, List<Token> tokens, String source) {
        this.language = language;
        this.tokens = new TokenStream(tokens, source);
        this.climber = new PrecedenceClimber<>(this, this.tokens);
    }

    public TokenStream tokens() {
        return tokens;
    }

    public ValueSystem values() {
        return language.values();
    }

    public BlockSyntax blocks() {
        return language.blocks();
    }

    public FunctionTable<List<ExecNode>> functions() {
        return functions;
    }

    public Program parseProgram() {
        List<ExecNode> statements;
        try {
            statements = language.blocks().parseAll(tokens, this::parseStatement);
        } catch (StackOverflowError overflow) {
            throw ParseException.tooDeep(tokens.peek().span());
        }
        LOGGER.debug("Parsed {} top-level statements, {} functions", statements.size(), functions.entries().size());
        return new Program(statements, functions);
    }

    public ExecNode parseStatement() {
        var handler = language.handlers().statementFor(tokens);
        if (handler.isPresent()) {
            return handler.get().parse(this);
        }
        var expression = parseExpression();
        return new StatementNodes.ExpressionStatement(expression, expression.span());
    }

    public List<ExecNode> parseBlock() {
        return language.blocks().parseBlock(tokens, this::parseStatement);
    }

    public ExecNode parseExpression() {
        return climber.parseExpression();
    }

    public ExecNode parseExpression(int minPrecedence) {
        return climber.parseExpression(minPrecedence);
    }

    /** Right operand for an infix handler, honouring its precedence and associativity. */
    public ExecNode parseOperand(InfixHandler handler, Token operator) {
        return climber.parseOperand(new Rule(handler, operator));
    }

    /** Comma separated expressions up to {@code close}; the opener must already be consumed. */
    public List<ExecNode> parseArguments(String separator, String close) {
        var args = new ArrayList<ExecNode>();
        if (tokens.match(close)) {
            return args;
        }
        do {
            args.add(parseExpression());
        } while (tokens.match(separator));
        tokens.expect(close);
        return args;
    }

    public void defineFunction(FunctionDef<List<ExecNode>> function) {
        functions.define(function);
    }

    @Override
    public ExecNode parsePrefix(TokenStream stream, PrecedenceClimber<ExecNode> ignored) {
        var token = stream.peek();
        var handler = stream.atEnd() ? Optional.<PrefixHandler>empty() : language.handlers().prefixFor(token);
        if (handler.isEmpty()) {
            throw stream.unexpected("an expression");
        }
        stream.advance();
        return handler.get().parse(this, token);
    }

    @Override
    public Optional<PrecedenceClimber.InfixRule<ExecNode>> infixAt(Token token) {
        return language.handlers().infixFor(token).map(handler -> new Rule(handler, token));
    }

    private final class Rule implements PrecedenceClimber.InfixRule<ExecNode> {
        private final InfixHandler handler;
        private final Token operator;

        Rule(InfixHandler handler, Token operator) {
            this.handler = handler;
            this.operator = operator;
        }

        @Override
        public int precedence() {
            return handler.precedence(operator);
        }

        @Override
        public Associativity associativity() {
            return handler.associativity(operator);
        }

        @Override
        public ExecNode parse(TokenStream stream, ExecNode left, Token token, PrecedenceClimber<ExecNode> ignored) {
            return handler.parse(TreeParser.this, left, token);
        }
    }
}
