package work.lumen.kernel.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Block delimiters (braces or indentation markers) and statement terminators.
 *
 * <p>A statement must be followed by a terminator, the close of the enclosing block or the end of
 * input, unless it ended with a block of its own.
 */
public record BlockSyntax(String open, String close, Set<String> terminators) {
    public BlockSyntax {
        terminators = terminators == null ? Set.of() : Set.copyOf(terminators);
    }

    public <S> List<S> parseBlock(TokenStream tokens, Supplier<S> statement) {
        tokens.skip(terminators);
        tokens.expect(open);
        var statements = new ArrayList<S>();
        while (true) {
            tokens.skip(terminators);
            if (tokens.check(close)) {
                break;
            }
            if (tokens.atEnd()) {
                throw tokens.unexpected("'" + close + "'");
            }
            statements.add(statement.get());
            endStatement(tokens);
        }
        tokens.expect(close);
        return statements;
    }

    /** Parses statements up to the end of input. */
    public <S> List<S> parseAll(TokenStream tokens, Supplier<S> statement) {
        var statements = new ArrayList<S>();
        tokens.skip(terminators);
        while (!tokens.atEnd()) {
            if (tokens.check(close)) {
                throw tokens.unexpected("a statement");
            }
            statements.add(statement.get());
            endStatement(tokens);
            tokens.skip(terminators);
        }
        return statements;
    }

    public boolean atStatementEnd(TokenStream tokens) {
        return tokens.atEnd() || tokens.check(close) || terminators.contains(tokens.peek().lexeme());
    }

    private void endStatement(TokenStream tokens) {
        if (atStatementEnd(tokens)) {
            return;
        }
        var previous = tokens.previous();
        if (previous != null && previous.is(close)) {
            return;
        }
        throw tokens.unexpected(describeTerminators());
    }

    private String describeTerminators() {
        var expected = new StringBuilder();
        for (var terminator : terminators) {
            expected.append("'").append(terminator).append("' or ");
        }
        return expected.append("the end of the statement").toString();
    }
}
