package work.lumen.kernel.structure;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import work.lumen.kernel.error.ParseException;
import work.lumen.kernel.lex.Span;
import work.lumen.kernel.lex.Token;

/**
 * Converts indentation into explicit block markers.
 *
 * <p>Every logical line is followed by a newline marker. A deeper line is preceded by an indent
 * marker; a shallower one by one dedent marker per closed level, and it must land exactly on a
 * level that was opened before. Lines that start while a bracket is still open continue the
 * previous logical line. Open levels are closed at end of input.
 */
public final class IndentationNormalizer implements StructuralNormalizer {
    private final String indent;
    private final String dedent;
    private final String newline;
    private final Set<String> openers;
    private final Set<String> closers;

    public IndentationNormalizer(String indent, String dedent, String newline, Map<String, String> brackets) {
        this.indent = Objects.requireNonNull(indent, "indent");
        this.dedent = Objects.requireNonNull(dedent, "dedent");
        this.newline = Objects.requireNonNull(newline, "newline");
        this.openers = Set.copyOf(brackets.keySet());
        this.closers = Set.copyOf(brackets.values());
    }

    @Override
    public List<Token> normalize(String source, List<Token> tokens) {
        var out = new ArrayList<Token>(tokens.size() + tokens.size() / 2);
        if (tokens.isEmpty()) {
            return out;
        }
        int[] lineStarts = lineStarts(source);
        Deque<Integer> levels = new ArrayDeque<>();
        int bracketDepth = 0;
        int previousLine = -1;
        Token previous = null;

        for (var token : tokens) {
            int line = lineOf(lineStarts, token.span().start());
            if (line != previousLine && bracketDepth == 0) {
                int column = indentation(source, lineStarts[line], token);
                if (previous == null) {
                    levels.push(column);
                } else {
                    out.add(Token.marker(newline, previous.span().end()));
                    int current = levels.peek();
                    if (column > current) {
                        levels.push(column);
                        out.add(Token.marker(indent, token.span().start()));
                    } else if (column < current) {
                        while (levels.size() > 1 && levels.peek() > column) {
                            levels.pop();
                            out.add(Token.marker(dedent, token.span().start()));
                        }
                        if (levels.peek() != column) {
                            throw new ParseException(
                                "Dedent does not match any outer indentation level",
                                Span.of(lineStarts[line], token.span().start())
                            );
                        }
                    }
                }
            }
            if (openers.contains(token.lexeme())) {
                bracketDepth++;
            } else if (closers.contains(token.lexeme()) && bracketDepth > 0) {
                bracketDepth--;
            }
            out.add(token);
            previous = token;
            previousLine = line;
        }

        out.add(Token.marker(newline, previous.span().end()));
        while (levels.size() > 1) {
            levels.pop();
            out.add(Token.marker(dedent, source.length()));
        }
        return out;
    }

    private static int indentation(String source, int lineStart, Token token) {
        for (int i = lineStart; i < token.span().start(); i++) {
            if (source.charAt(i) == '\t') {
                throw new ParseException("Tabs are not allowed in indentation", Span.of(i, i + 1));
            }
        }
        return token.span().start() - lineStart;
    }

    private static int[] lineStarts(String source) {
        var starts = new ArrayList<Integer>();
        starts.add(0);
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }

    private static int lineOf(int[] lineStarts, int offset) {
        int index = Arrays.binarySearch(lineStarts, offset);
        return index >= 0 ? index : -index - 2;
    }
}
