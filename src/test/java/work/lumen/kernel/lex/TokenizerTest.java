package work.lumen.kernel.lex;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import work.lumen.kernel.error.LexicalException;

class TokenizerTest {
    private static LexemeTable table() {
        return LexemeTable.builder()
            .add("=", LexemeRole.OPERATOR)
            .add("==", LexemeRole.OPERATOR)
            .add("<", LexemeRole.OPERATOR)
            .add("<=", LexemeRole.OPERATOR)
            .add("(", LexemeRole.DELIMITER)
            .add(")", LexemeRole.DELIMITER)
            .add("if", LexemeRole.KEYWORD)
            .fallback(FallbackRules.whitespace())
            .fallback(FallbackRules.lineComment("#"))
            .fallback(FallbackRules.identifier())
            .fallback(FallbackRules.number())
            .fallback(FallbackRules.quoted('"'))
            .build();
    }

    private static List<String> lexemes(String source) {
        return new Tokenizer(table()).tokenize(source).stream().map(Token::lexeme).collect(Collectors.toList());
    }

    @Test
    void doubleEqualsIsOneToken() {
        var tokens = new Tokenizer(table()).tokenize("a == b");
        assertEquals(3, tokens.size());
        assertEquals("==", tokens.get(1).lexeme());
        assertEquals(LexemeRole.OPERATOR, tokens.get(1).role());
        assertEquals(Span.of(2, 4), tokens.get(1).span());
    }

    @Test
    void prefersLongestOperator() {
        assertEquals(List.of("x", "<=", "1", "=", "y"), lexemes("x<=1=y"));
    }

    @Test
    void keywordNeedsWordBoundary() {
        var tokens = new Tokenizer(table()).tokenize("if iffy");
        assertEquals(LexemeRole.KEYWORD, tokens.get(0).role());
        assertEquals("iffy", tokens.get(1).lexeme());
        assertEquals(LexemeRole.IDENTIFIER, tokens.get(1).role());
    }

    @Test
    void dropsWhitespaceAndComments() {
        assertEquals(List.of("x", "=", "1", "y"), lexemes("x = 1 # trailing comment\ny"));
    }

    @Test
    void keepsStringsWhole() {
        var tokens = new Tokenizer(table()).tokenize("\"a == \\\"b\\\"\" 3.25");
        assertEquals(2, tokens.size());
        assertEquals(LexemeRole.STRING, tokens.get(0).role());
        assertEquals("3.25", tokens.get(1).lexeme());
        assertEquals(LexemeRole.NUMBER, tokens.get(1).role());
    }

    @Test
    void spansAreHalfOpenCharOffsets() {
        var source = "foo(12)";
        for (var token : new Tokenizer(table()).tokenize(source)) {
            assertEquals(token.lexeme(), token.span().extract(source));
        }
    }

    @Test
    void rejectsUnknownCharacters() {
        var error = assertThrows(LexicalException.class, () -> new Tokenizer(table()).tokenize("x = $"));
        assertEquals("lexical_error", error.code());
        assertEquals(Span.of(4, 5), error.span());
    }

    @Test
    void rejectsUnterminatedString() {
        assertThrows(LexicalException.class, () -> new Tokenizer(table()).tokenize("\"open"));
    }
}
