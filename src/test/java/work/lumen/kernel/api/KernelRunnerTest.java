package work.lumen.kernel.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;
import work.lumen.kernel.error.ConfigurationException;

class KernelRunnerTest {
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    private RunConfiguration.Builder inline(String language, String code) {
        return RunConfiguration.builder()
            .source(SourceTarget.forInline(code))
            .language(language)
            .output(out);
    }

    @Test
    void runsProgramFile() {
        var path = Path.of("src", "test", "resources", "programs", "counter.lumen").toAbsolutePath();
        var config = RunConfiguration.builder()
            .source(SourceTarget.forFile(path))
            .language("lumen")
            .logLevel(LogLevel.INFO)
            .output(out)
            .build();

        var result = new KernelRunner().run(config);
        assertEquals(RunResult.Status.SUCCESS, result.status());
        assertEquals("tree_walking", result.metadata().get("strategy"));
        assertEquals("0\n1\n2\n", buffer.toString(StandardCharsets.UTF_8).replace("\r\n", "\n"));
    }

    @Test
    void reportsLastValue() {
        var result = new KernelRunner().run(inline("mini_rust", "let x = 6; x * 7").build());
        assertTrue(result.succeeded());
        assertEquals("42", result.metadata().get("result"));
        assertEquals("canonical_instructions", result.metadata().get("strategy"));
    }

    @Test
    void failureCarriesNormalizedError() {
        var result = new KernelRunner().run(inline("lumen", "x = 1\ny = x +\n").build());
        assertEquals(RunResult.Status.FAILURE, result.status());
        assertEquals(1, result.status().exitCode());
        assertEquals("parse_error", result.errorCode());
        var error = (Map<?, ?>) result.metadata().get("error");
        assertTrue(String.valueOf(error.get("location")).startsWith("2:"), String.valueOf(error.get("location")));
    }

    @Test
    void failedRunDoesNotAffectTheNext() {
        var runner = new KernelRunner();
        var failed = runner.run(inline("lumen", "let total = 1\nprint(missing)\n").build());
        assertEquals("undefined_variable", failed.errorCode());

        var next = runner.run(inline("lumen", "print(1 + 1)\n").build());
        assertTrue(next.succeeded());
        assertNull(next.errorCode());
        assertEquals("2\n", buffer.toString(StandardCharsets.UTF_8).replace("\r\n", "\n"));
    }

    @Test
    void deeplyNestedSourceFailsCleanly() {
        var runner = new KernelRunner();
        var depth = 200_000;
        for (var language : new String[] {"lumen", "mini_rust"}) {
            var code = "(".repeat(depth) + "1" + ")".repeat(depth);
            var result = runner.run(inline(language, code).build());
            assertEquals(RunResult.Status.FAILURE, result.status());
            assertTrue(Set.of("parse_error", "stack_exhausted").contains(result.errorCode()), result.errorCode());
        }
        assertTrue(runner.run(inline("mini_rust", "1 + 1").build()).succeeded());
    }

    @Test
    void unknownLanguageIsConfigurationError() {
        var result = new KernelRunner().run(inline("cobol", "DISPLAY 1").build());
        assertEquals("configuration_error", result.errorCode());
    }

    @Test
    void timeoutCancelsRun() {
        var config = inline("mini_python", "while true:\n    x = 1\n")
            .timeout(Optional.of(Duration.ofMillis(50)))
            .build();
        var result = new KernelRunner().run(config);
        assertEquals("cancelled", result.errorCode());
    }

    @Test
    void dumpsInstructionsOnRequest() {
        var result = new KernelRunner().run(inline("mini_rust", "print(1);").dumpInstructions(true).build());
        assertTrue(String.valueOf(result.metadata().get("instructions")).contains("\"tag\" : \"invoke\""));
        assertTrue(result.toPrettyJson().contains("\"status\" : \"success\""));
    }

    @Test
    void catalogRejectsDuplicateLanguages() {
        var catalog = LanguageCatalog.standard();
        assertTrue(catalog.names().contains("mini_python"));
        assertThrows(ConfigurationException.class, () -> catalog.register("lumen", () -> catalog.get("lumen")));
    }

    @Test
    void sourceTargetNeedsExactlyOneSource() {
        assertThrows(IllegalArgumentException.class, () -> new SourceTarget(Optional.empty(), Optional.empty()));
        assertEquals("<inline>", SourceTarget.forInline("1").display());
    }
}
