package work.lumen.kernel.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lumen.kernel.error.ConfigurationException;

class SchemaLoaderTest {
    @Test
    void loadsBundledTomlLanguage() {
        var schema = SchemaLoader.fromResource("languages/mini_rust.toml");
        assertEquals("mini_rust", schema.name());
        assertEquals(BlockLayout.BRACES, schema.syntax().layout());
        assertEquals(Associativity.RIGHT, schema.binaryOperator("^").orElseThrow().associativity());
        assertEquals(ShortCircuit.WHEN_TRUE, schema.binaryOperator("||").orElseThrow().shortCircuit());
        assertEquals(CanonicalAction.UNTIL, schema.statement("until").orElseThrow().action());
        assertEquals("extern", schema.syntax().externKeyword());
        assertTrue(schema.isMemoizable("fib"));
    }

    @Test
    void loadsBundledYamlLanguage() {
        var schema = SchemaLoader.fromResource("languages/mini_python.yaml");
        assertEquals("mini_python", schema.name());
        assertEquals(BlockLayout.INDENTATION, schema.syntax().layout());
        assertEquals("host:print", schema.statement("print").orElseThrow().selector());
        assertEquals(3, schema.prefixOperator("not").orElseThrow().precedence());
    }

    @Test
    void loadsFromPath(@TempDir Path dir) throws Exception {
        var file = dir.resolve("tiny.toml");
        Files.writeString(file, String.join("\n",
            "name = \"tiny\"",
            "[syntax]",
            "block_open = \"{\"",
            "block_close = \"}\"",
            "[[operators]]",
            "lexeme = \"+\"",
            "precedence = 1"
        ));
        var schema = SchemaLoader.load(file);
        assertEquals("tiny", schema.name());
        assertEquals(Associativity.LEFT, schema.binaryOperator("+").orElseThrow().associativity());
    }

    @Test
    void reportsInvalidToml() {
        assertThrows(ConfigurationException.class, () -> SchemaLoader.fromToml("name = ", "broken.toml"));
    }

    @Test
    void reportsUnknownAction() {
        var yaml = String.join("\n",
            "name: odd",
            "syntax: { block_open: '{', block_close: '}' }",
            "statements:",
            "  - { keyword: loop, action: forever, pattern: ['block:body'] }"
        );
        var error = assertThrows(ConfigurationException.class, () -> SchemaLoader.fromYaml(yaml, "odd.yaml"));
        assertTrue(error.getMessage().contains("forever"));
    }

    @Test
    void rejectsFractionalPrecedence() {
        var toml = String.join("\n",
            "name = \"odd\"",
            "[syntax]",
            "block_open = \"{\"",
            "block_close = \"}\"",
            "[[operators]]",
            "lexeme = \"+\"",
            "precedence = 2.5"
        );
        var error = assertThrows(ConfigurationException.class, () -> SchemaLoader.fromToml(toml, "odd.toml"));
        assertTrue(error.getMessage().contains("precedence"));
    }

    @Test
    void reportsMissingSyntaxTable() {
        assertThrows(ConfigurationException.class, () -> SchemaLoader.fromYaml("name: bare", "bare.yaml"));
    }

    @Test
    void reportsMissingResource() {
        assertThrows(ConfigurationException.class, () -> SchemaLoader.fromResource("languages/missing.json"));
    }
}
