package work.lumen.kernel.structure;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import work.lumen.kernel.error.ParseException;
import work.lumen.kernel.lex.FallbackRules;
import work.lumen.kernel.lex.LexemeRole;
import work.lumen.kernel.lex.LexemeTable;
import work.lumen.kernel.lex.Tokenizer;

class IndentationNormalizerTest {
    private static final LexemeTable TABLE = LexemeTable.builder()
        .add("(", LexemeRole.DELIMITER)
        .add(")", LexemeRole.DELIMITER)
        .add(",", LexemeRole.DELIMITER)
        .fallback(FallbackRules.whitespace())
        .fallback(FallbackRules.lineComment("#"))
        .fallback(FallbackRules.identifier())
        .build();

    private static List<String> normalize(String source) {
        var normalizer = new IndentationNormalizer("INDENT", "DEDENT", "NL", Map.of("(", ")"));
        return normalizer.normalize(source, new Tokenizer(TABLE).tokenize(source)).stream()
            .map(token -> token.lexeme())
            .collect(Collectors.toList());
    }

    @Test
    void emitsBlockMarkers() {
        var source = "a\n  b\n  c\nd\n";
        assertEquals(List.of("a", "NL", "INDENT", "b", "NL", "c", "NL", "DEDENT", "d", "NL"), normalize(source));
    }

    @Test
    void closesAllLevelsAtEnd() {
        var source = "a\n  b\n    c";
        assertEquals(
            List.of("a", "NL", "INDENT", "b", "NL", "INDENT", "c", "NL", "DEDENT", "DEDENT"),
            normalize(source)
        );
    }

    @Test
    void ignoresBlankAndCommentLines() {
        var source = "a\n\n   # note\n  b\n";
        assertEquals(List.of("a", "NL", "INDENT", "b", "NL", "DEDENT"), normalize(source));
    }

    @Test
    void bracketsContinueTheLine() {
        var source = "f(a,\n      b)\nc";
        assertEquals(List.of("f", "(", "a", ",", "b", ")", "NL", "c", "NL"), normalize(source));
    }

    @Test
    void rejectsInconsistentDedent() {
        var source = "a\n    b\n  c\n";
        var error = assertThrows(ParseException.class, () -> normalize(source));
        assertEquals("parse_error", error.code());
    }

    @Test
    void rejectsTabs() {
        assertThrows(ParseException.class, () -> normalize("a\n\tb\n"));
    }

    @Test
    void emptyInputStaysEmpty() {
        assertEquals(List.of(), normalize("  \n# only a comment\n"));
    }
}
