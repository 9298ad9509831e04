package work.lumen.kernel.instruction;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lumen.kernel.error.ExternResolutionException;
import work.lumen.kernel.error.ParseException;
import work.lumen.kernel.extern.Selector;
import work.lumen.kernel.instruction.Instruction.Assign;
import work.lumen.kernel.instruction.Instruction.Branch;
import work.lumen.kernel.instruction.Instruction.Invoke;
import work.lumen.kernel.instruction.Instruction.Operate;
import work.lumen.kernel.instruction.Instruction.Scope;
import work.lumen.kernel.instruction.Instruction.Sequence;
import work.lumen.kernel.instruction.Instruction.Transfer;
import work.lumen.kernel.lex.LexemeRole;
import work.lumen.kernel.lex.Span;
import work.lumen.kernel.lex.Token;
import work.lumen.kernel.parse.BlockSyntax;
import work.lumen.kernel.parse.PrecedenceClimber;
import work.lumen.kernel.parse.TokenStream;
import work.lumen.kernel.registry.Associativity;
import work.lumen.kernel.registry.OperatorInfo;
import work.lumen.kernel.registry.PatternElement;
import work.lumen.kernel.registry.SchemaRegistry;
import work.lumen.kernel.registry.StatementPattern;
import work.lumen.kernel.registry.SyntaxProfile;
import work.lumen.kernel.runtime.FunctionDef;
import work.lumen.kernel.runtime.FunctionTable;
import work.lumen.kernel.runtime.ValueSystem;

/**
 * Reduces a normalized token stream to canonical instructions by following the statement patterns
 * of a {@link SchemaRegistry}.
 *
 * <p>Besides the registered patterns it understands assignment ({@code name = expr}) and bare
 * expression statements. Loops become repeating scopes:
 * {@code while c body} is {@code Scope[repeating](Branch(c, body, Transfer(BREAK)))} and
 * {@code until c body} is {@code Scope[repeating](Branch(c, Transfer(BREAK), body))},
 * {@code loop body} is {@code Scope[repeating](body)}. A {@code for v in e body} binds a hidden
 * cursor in an outer scope and repeats {@code Branch(cursor, [bind v = next(cursor); body], Transfer(BREAK))}.
 */
public final class InstructionReducer implements PrecedenceClimber.Grammar<Instruction> {
    private static final Logger LOGGER = LoggerFactory.getLogger(InstructionReducer.class);

    private final SchemaRegistry schema;
    private final SyntaxProfile syntax;
    private final BlockSyntax blocks;
    private final ValueSystem values;
    private final TokenStream tokens;
    private final PrecedenceClimber<Instruction> climber;
    private final FunctionTable<Instruction> functions = new FunctionTable<>();

    public InstructionReducer(SchemaRegistry schema, ValueSystem values, List<Token> tokens, String source) {
        this.schema = schema;
        this.syntax = schema.syntax();
        this.blocks = syntax.blockSyntax();
        this.values = values;
        this.tokens = new TokenStream(tokens, source);
        this.climber = new PrecedenceClimber<>(this, this.tokens);
    }

    public Reduction reduce() {
        List<Instruction> statements;
        try {
            statements = blocks.parseAll(tokens, this::statement);
        } catch (StackOverflowError overflow) {
            throw ParseException.tooDeep(tokens.peek().span());
        }
        var span = statements.isEmpty()
            ? Span.at(0)
            : statements.get(0).span().merge(statements.get(statements.size() - 1).span());
        LOGGER.debug("Reduced {} top-level statements, {} functions", statements.size(), functions.entries().size());
        return new Reduction(new Sequence(statements, span), functions);
    }

    public record Reduction(Sequence root, FunctionTable<Instruction> functions) {}

    Instruction statement() {
        var token = tokens.peek();
        if (token.role() == LexemeRole.KEYWORD) {
            var pattern = schema.statement(token.lexeme());
            if (pattern.isPresent()) {
                return applyPattern(pattern.get());
            }
        }
        if (token.role() == LexemeRole.IDENTIFIER && tokens.peek(1).is(syntax.assignment())) {
            tokens.advance();
            tokens.advance();
            var value = expression();
            return new Assign(token.lexeme(), value, Assign.Mode.SET, token.span().merge(value.span()));
        }
        return expression();
    }

    private Instruction applyPattern(StatementPattern pattern) {
        var keyword = tokens.advance();
        var fields = new HashMap<String, Object>();
        Span span = keyword.span();
        var elements = pattern.elements();
        for (int i = 0; i < elements.size(); i++) {
            var element = elements.get(i);
            if (element.kind() == PatternElement.Kind.CHAIN) {
                int mark = tokens.position();
                tokens.skip(syntax.terminators());
                if (tokens.check(element.lexeme())) {
                    var chained = applyPattern(pattern);
                    fields.put(nextBlockField(elements, i), new Sequence(List.of(chained), chained.span()));
                    span = span.merge(chained.span());
                    break;
                }
                tokens.reset(mark);
                continue;
            }
            if (element.kind() == PatternElement.Kind.OPTIONAL_LITERAL) {
                int mark = tokens.position();
                tokens.skip(syntax.terminators());
                if (!tokens.match(element.lexeme())) {
                    // absent: the remaining elements are optional too
                    tokens.reset(mark);
                    break;
                }
                if (tokens.check(pattern.keyword())) {
                    var chained = applyPattern(pattern);
                    fields.put(nextBlockField(elements, i), new Sequence(List.of(chained), chained.span()));
                    span = span.merge(chained.span());
                    break;
                }
                continue;
            }
            span = span.merge(reduceElement(element, fields, span));
        }
        return build(pattern, fields, span);
    }

    private Span reduceElement(PatternElement element, Map<String, Object> fields, Span span) {
        switch (element.kind()) {
            case LITERAL -> {
                return tokens.expect(element.lexeme()).span();
            }
            case EXPRESSION -> {
                var value = expression();
                fields.put(element.field(), value);
                return value.span();
            }
            case OPTIONAL_EXPRESSION -> {
                if (blocks.atStatementEnd(tokens)) {
                    return span;
                }
                var value = expression();
                fields.put(element.field(), value);
                return value.span();
            }
            case BLOCK -> {
                var block = block();
                fields.put(element.field(), block);
                return block.span();
            }
            case IDENTIFIER -> {
                var name = tokens.expect(LexemeRole.IDENTIFIER, "an identifier");
                fields.put(element.field(), name.lexeme());
                return name.span();
            }
            case PARAMETERS -> {
                fields.put(element.field(), parameters());
                return span;
            }
            default -> throw new IllegalStateException("Unhandled pattern element " + element.kind());
        }
    }

    @SuppressWarnings("unchecked")
    private Instruction build(StatementPattern pattern, Map<String, Object> fields, Span span) {
        var cond = (Instruction) fields.get("cond");
        var body = (Instruction) fields.get("body");
        var value = (Instruction) fields.get("value");
        var name = (String) fields.get("name");
        return switch (pattern.action()) {
            case BRANCH -> {
                var otherwise = (Instruction) fields.get("else");
                yield new Branch(cond, scope((Instruction) fields.get("then")), otherwise == null ? null : scope(otherwise), span);
            }
            case LOOP -> new Scope(new Branch(cond, body, new Transfer(Transfer.Kind.BREAK, null, span), span), true, span);
            case UNTIL -> new Scope(new Branch(cond, new Transfer(Transfer.Kind.BREAK, null, span), body, span), true, span);
            case FOR -> forLoop((String) fields.get("var"), (Instruction) fields.get("iterable"), body, span);
            case REPEAT -> new Scope(body, true, span);
            case BIND -> new Assign(name, value, Assign.Mode.BIND, span);
            case ASSIGN -> new Assign(name, value, Assign.Mode.SET, span);
            case RETURN -> new Transfer(Transfer.Kind.RETURN, value, span);
            case BREAK -> new Transfer(Transfer.Kind.BREAK, null, span);
            case CONTINUE -> new Transfer(Transfer.Kind.CONTINUE, null, span);
            case FUNCTION -> {
                var params = (List<String>) fields.get("params");
                functions.define(new FunctionDef<>(name, params, body, schema.isMemoizable(name), span));
                yield new Sequence(List.of(), span);
            }
            case INVOKE -> Invoke.capability(pattern.selector(), List.of(value), span);
            case EXPRESSION -> value;
        };
    }

    private static Instruction forLoop(String variable, Instruction iterable, Instruction body, Span span) {
        // '#' cannot start an identifier, so the cursor never clashes with a program variable
        var cursor = "#for@" + span.start();
        var step = new Sequence(List.of(new Assign(variable, Operate.advance(cursor, span), Assign.Mode.BIND, span), body), span);
        var loop = new Scope(new Branch(Operate.load(cursor, span), step, new Transfer(Transfer.Kind.BREAK, null, span), span), true, span);
        var start = new Assign(cursor, Operate.iterate(iterable, iterable.span()), Assign.Mode.BIND, span);
        return new Scope(new Sequence(List.of(start, loop), span), false, span);
    }

    private static Scope scope(Instruction body) {
        return new Scope(body, false, body.span());
    }

    private static String nextBlockField(List<PatternElement> elements, int from) {
        for (int j = from + 1; j < elements.size(); j++) {
            if (elements.get(j).kind() == PatternElement.Kind.BLOCK) {
                return elements.get(j).field();
            }
        }
        throw new IllegalStateException("Pattern literal is not followed by a block");
    }

    private Sequence block() {
        var open = tokens.peek();
        var body = blocks.parseBlock(tokens, this::statement);
        var close = body.isEmpty() ? open.span() : body.get(body.size() - 1).span();
        return new Sequence(body, open.span().merge(close));
    }

    private List<String> parameters() {
        tokens.expect(syntax.callOpen());
        var names = new ArrayList<String>();
        if (tokens.match(syntax.callClose())) {
            return names;
        }
        do {
            names.add(tokens.expect(LexemeRole.IDENTIFIER, "a parameter name").lexeme());
        } while (tokens.match(syntax.separator()));
        tokens.expect(syntax.callClose());
        return names;
    }

    private Instruction expression() {
        return climber.parseExpression();
    }

    private List<Instruction> arguments() {
        var args = new ArrayList<Instruction>();
        if (tokens.match(syntax.callClose())) {
            return args;
        }
        do {
            args.add(expression());
        } while (tokens.match(syntax.separator()));
        tokens.expect(syntax.callClose());
        return args;
    }

    @Override
    public Instruction parsePrefix(TokenStream stream, PrecedenceClimber<Instruction> ignored) {
        if (stream.atEnd()) {
            throw stream.unexpected("an expression");
        }
        var token = stream.peek();
        if (token.isMarker() || token.role() == LexemeRole.SKIP) {
            throw stream.unexpected("an expression");
        }
        stream.advance();
        var lexeme = token.lexeme();

        if (token.role() != LexemeRole.STRING) {
            var prefix = schema.prefixOperator(lexeme);
            if (prefix.isPresent()) {
                var operand = climber.parseExpression(prefix.get().precedence());
                return Operate.apply(lexeme, List.of(operand), token.span().merge(operand.span()));
            }
            if (lexeme.equals(syntax.callOpen())) {
                var inner = climber.parseExpression(PrecedenceClimber.LOWEST);
                stream.expect(syntax.callClose());
                return inner;
            }
            if (lexeme.equals(syntax.externKeyword())) {
                return externCall(token);
            }
        }
        var literal = values.literal(token);
        if (literal.isPresent()) {
            return Operate.constant(lexeme, literal.get(), token.span());
        }
        if (token.role() == LexemeRole.IDENTIFIER) {
            if (stream.match(syntax.callOpen())) {
                var args = arguments();
                return Invoke.function(lexeme, args, token.span().merge(lastSpan(args, token.span())));
            }
            return Operate.load(lexeme, token.span());
        }
        throw new ParseException("Expected an expression but found '" + lexeme + "'", token.span());
    }

    private Instruction externCall(Token keyword) {
        tokens.expect(syntax.callOpen());
        var selectorToken = tokens.expect(LexemeRole.STRING, "an extern selector string");
        var raw = selectorToken.lexeme().substring(1, selectorToken.lexeme().length() - 1);
        try {
            Selector.parse(raw);
        } catch (ExternResolutionException ex) {
            throw ex.withSpanIfMissing(selectorToken.span());
        }
        List<Instruction> args = List.of();
        if (tokens.match(syntax.separator())) {
            args = arguments();
        } else {
            tokens.expect(syntax.callClose());
        }
        return Invoke.capability(raw, args, keyword.span().merge(lastSpan(args, selectorToken.span())));
    }

    @Override
    public Optional<PrecedenceClimber.InfixRule<Instruction>> infixAt(Token token) {
        if (token.role() == LexemeRole.STRING || token.isMarker()) {
            return Optional.empty();
        }
        return schema.binaryOperator(token.lexeme()).map(BinaryRule::new);
    }

    private static Span lastSpan(List<Instruction> instructions, Span fallback) {
        return instructions.isEmpty() ? fallback : instructions.get(instructions.size() - 1).span();
    }

    private static final class BinaryRule implements PrecedenceClimber.InfixRule<Instruction> {
        private final OperatorInfo info;

        BinaryRule(OperatorInfo info) {
            this.info = info;
        }

        @Override
        public int precedence() {
            return info.precedence();
        }

        @Override
        public Associativity associativity() {
            return info.associativity();
        }

        @Override
        public Instruction parse(TokenStream tokens, Instruction left, Token operator, PrecedenceClimber<Instruction> climber) {
            var right = climber.parseOperand(this);
            return Operate.apply(operator.lexeme(), List.of(left, right), left.span().merge(right.span()));
        }
    }
}
