package work.lumen.kernel.demo.lumen;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import work.lumen.kernel.demo.DemoValueSystem;
import work.lumen.kernel.lex.FallbackRules;
import work.lumen.kernel.lex.LexemeRole;
import work.lumen.kernel.lex.LexemeTable;
import work.lumen.kernel.parse.BlockSyntax;
import work.lumen.kernel.registry.Associativity;
import work.lumen.kernel.registry.OperatorInfo;
import work.lumen.kernel.registry.ShortCircuit;
import work.lumen.kernel.structure.IndentationNormalizer;
import work.lumen.kernel.walk.HandlerRegistry;
import work.lumen.kernel.walk.TreeLanguage;

/**
 * Indentation-based demo language executed by the tree-walking strategy.
 *
 * <pre>
 * fn countdown(n)
 *     while n > 0
 *         print n
 *         n = n - 1
 * countdown(3)
 * for i in 0..3
 *     print i
 * </pre>
 */
public final class LumenLanguage {
    public static final String NAME = "lumen";
    public static final String INDENT = "<indent>";
    public static final String DEDENT = "<dedent>";
    public static final String NEWLINE = "<newline>";

    private static final List<String> KEYWORDS = List.of(
        "let", "if", "else", "while", "for", "in", "loop", "fn", "return", "break", "continue", "print",
        "true", "false", "none", "and", "or", "not", "extern"
    );

    private LumenLanguage() {}

    public static TreeLanguage create() {
        var values = new DemoValueSystem();
        var operators = operators();

        var lexemes = LexemeTable.builder();
        KEYWORDS.forEach(keyword -> lexemes.add(keyword, LexemeRole.KEYWORD));
        for (var lexeme : operators.keySet()) {
            lexemes.addIfAbsent(lexeme, LexemeRole.OPERATOR);
        }
        lexemes.add("=", LexemeRole.OPERATOR);
        lexemes.add("(", LexemeRole.DELIMITER).add(")", LexemeRole.DELIMITER).add(",", LexemeRole.DELIMITER);
        lexemes.fallback(FallbackRules.whitespace())
            .fallback(FallbackRules.lineComment("#"))
            .fallback(FallbackRules.identifier())
            .fallback(FallbackRules.number())
            .fallback(FallbackRules.quoted('"'));

        var handlers = HandlerRegistry.builder()
            .prefix(new LumenExpressions.LiteralHandler(values))
            .prefix(new LumenExpressions.ExternHandler())
            .prefix(new LumenExpressions.IdentifierHandler())
            .prefix(new LumenExpressions.GroupingHandler())
            .prefix(new LumenExpressions.UnaryHandler(Map.of("-", 7, "not", 3)))
            .infix(new LumenExpressions.BinaryHandler(operators))
            .statement(new LumenStatements.LetHandler())
            .statement(new LumenStatements.IfHandler())
            .statement(new LumenStatements.WhileHandler())
            .statement(new LumenStatements.ForHandler())
            .statement(new LumenStatements.LoopHandler())
            .statement(new LumenStatements.FunctionHandler())
            .statement(new LumenStatements.ReturnHandler())
            .statement(new LumenStatements.BreakHandler())
            .statement(new LumenStatements.ContinueHandler())
            .statement(new LumenStatements.PrintHandler())
            .statement(new LumenStatements.AssignmentHandler())
            .build();

        return new TreeLanguage(
            NAME,
            lexemes.build(),
            new IndentationNormalizer(INDENT, DEDENT, NEWLINE, Map.of("(", ")")),
            handlers,
            new BlockSyntax(INDENT, DEDENT, Set.of(NEWLINE)),
            values
        );
    }

    private static Map<String, OperatorInfo> operators() {
        var operators = new LinkedHashMap<String, OperatorInfo>();
        operators.put("or", new OperatorInfo("or", 1, Associativity.LEFT, ShortCircuit.WHEN_TRUE));
        operators.put("and", new OperatorInfo("and", 2, Associativity.LEFT, ShortCircuit.WHEN_FALSE));
        for (var comparison : List.of("==", "!=", "<", ">", "<=", ">=", "..")) {
            operators.put(comparison, new OperatorInfo(comparison, 4, Associativity.NONE));
        }
        operators.put("+", new OperatorInfo("+", 5, Associativity.LEFT));
        operators.put("-", new OperatorInfo("-", 5, Associativity.LEFT));
        operators.put("*", new OperatorInfo("*", 6, Associativity.LEFT));
        operators.put("/", new OperatorInfo("/", 6, Associativity.LEFT));
        operators.put("%", new OperatorInfo("%", 6, Associativity.LEFT));
        operators.put("^", new OperatorInfo("^", 8, Associativity.RIGHT));
        return operators;
    }
}
