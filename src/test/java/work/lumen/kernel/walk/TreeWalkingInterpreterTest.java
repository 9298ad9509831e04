package work.lumen.kernel.walk;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.lumen.kernel.demo.NumberValue;
import work.lumen.kernel.demo.lumen.LumenLanguage;
import work.lumen.kernel.error.ArithmeticFaultException;
import work.lumen.kernel.error.ExternResolutionException;
import work.lumen.kernel.error.ParseException;
import work.lumen.kernel.error.RuntimeTypeException;
import work.lumen.kernel.error.ScopeException;
import work.lumen.kernel.error.StackExhaustionException;
import work.lumen.kernel.extern.CapabilityRegistry;
import work.lumen.kernel.runtime.ExecutionContext;
import work.lumen.kernel.runtime.ExecutionOptions;
import work.lumen.kernel.support.KernelTestSupport;

class TreeWalkingInterpreterTest {
    private static final TreeLanguage LUMEN = LumenLanguage.create();

    private static String lines(String... lines) {
        return String.join("\n", lines) + "\n";
    }

    @Test
    void countsToThree() {
        var harness = KernelTestSupport.harness();
        harness.run(LUMEN, KernelTestSupport.fixture("counter.lumen"));
        assertEquals(List.of("0", "1", "2"), harness.lines());
    }

    @Test
    void honoursOperatorPrecedence() {
        var harness = KernelTestSupport.harness();
        assertEquals(new NumberValue(7), harness.run(LUMEN, "1 + 2 * 3"));
        assertEquals(new NumberValue(9), harness.run(LUMEN, "(1 + 2) * 3"));
        assertEquals(new NumberValue(512), harness.run(LUMEN, "2 ^ 3 ^ 2"));
        assertEquals(new NumberValue(-8), harness.run(LUMEN, "-2 ^ 3"));
    }

    @Test
    void repeatedCallsLeaveNoResidue() {
        var harness = KernelTestSupport.harness();
        var program = LUMEN.compile(lines(
            "fn scan(n)",
            "    let i = 0",
            "    while true",
            "        i = i + 1",
            "        if i == n",
            "            return i * 10",
            "    return -1",
            "let first = scan(3)",
            "extern(\"env:depth\")",
            "let second = scan(3)",
            "extern(\"env:depth\")"
        ));
        var ctx = harness.context(LUMEN);
        var depths = harness.recordDepths(ctx);
        program.run(ctx);
        assertEquals(List.of(1, 1), depths);
        assertEquals(new NumberValue(30), ctx.environment().get("first"));
        assertEquals(ctx.environment().get("first"), ctx.environment().get("second"));
        assertEquals(1, ctx.environment().depth());
        assertEquals(0, ctx.callDepth());
    }

    @Test
    void failingCallRestoresEnvironment() {
        var harness = KernelTestSupport.harness();
        var ctx = harness.context(LUMEN);
        var program = LUMEN.compile(lines(
            "fn risky(n)",
            "    let i = 0",
            "    while true",
            "        i = i + 1",
            "        if i == n",
            "            return 1 / 0",
            "risky(2)"
        ));
        var error = assertThrows(ArithmeticFaultException.class, () -> program.run(ctx));
        assertEquals("Division by zero", error.getMessage());
        assertEquals("arithmetic_error", error.code());
        assertEquals(1, ctx.environment().depth());
        assertEquals(0, ctx.callDepth());
        assertThrows(ArithmeticFaultException.class, () -> program.run(ctx));
        assertEquals(1, ctx.environment().depth());
    }

    @Test
    void loopLocalsDoNotLeak() {
        var harness = KernelTestSupport.harness();
        var error = assertThrows(ScopeException.class, () -> harness.run(LUMEN, lines(
            "let flag = true",
            "while flag",
            "    let temp = 1",
            "    flag = false",
            "print(temp)"
        )));
        assertEquals("undefined_variable", error.code());
    }

    @Test
    void bindShadowsWhileAssignmentUpdates() {
        var harness = KernelTestSupport.harness();
        harness.run(LUMEN, lines(
            "let x = 1",
            "if true",
            "    let x = 2",
            "print(x)",
            "if true",
            "    x = 3",
            "print(x)"
        ));
        assertEquals(List.of("1", "3"), harness.lines());
    }

    @Test
    void breakStaysInsideItsLoop() {
        var harness = KernelTestSupport.harness();
        harness.run(LUMEN, lines(
            "fn first_over(limit)",
            "    let i = 0",
            "    while true",
            "        i = i + 1",
            "        if i > limit",
            "            break",
            "    return i",
            "print(first_over(2))",
            "print(\"after\")"
        ));
        assertEquals(List.of("3", "after"), harness.lines());
    }

    @Test
    void continueSkipsRestOfIteration() {
        var harness = KernelTestSupport.harness();
        var result = harness.run(LUMEN, lines(
            "let i = 0",
            "let total = 0",
            "while i < 5",
            "    i = i + 1",
            "    if i % 2 == 0",
            "        continue",
            "    total = total + i",
            "total"
        ));
        assertEquals(new NumberValue(9), result);
    }

    @Test
    void breakOutsideLoopIsScopeError() {
        var harness = KernelTestSupport.harness();
        var topLevel = assertThrows(ScopeException.class, () -> harness.run(LUMEN, "break"));
        assertEquals("signal_outside_loop", topLevel.code());

        var inFunction = assertThrows(ScopeException.class, () -> harness.run(LUMEN, lines(
            "fn bad()",
            "    continue",
            "bad()"
        )));
        assertEquals("signal_outside_loop", inFunction.code());
    }

    @Test
    void topLevelReturnEndsProgram() {
        var harness = KernelTestSupport.harness();
        var result = harness.run(LUMEN, lines("print(1)", "return 42", "print(2)"));
        assertEquals(new NumberValue(42), result);
        assertEquals(List.of("1"), harness.lines());
    }

    @Test
    void elseIfChains() {
        var harness = KernelTestSupport.harness();
        harness.run(LUMEN, KernelTestSupport.fixture("signs.lumen"));
        assertEquals(List.of("neg", "zero", "pos"), harness.lines());
    }

    @Test
    void recursionAndHoisting() {
        var harness = KernelTestSupport.harness();
        var result = harness.run(LUMEN, lines(
            "print(double(4))",
            "fn double(x)",
            "    return x * 2",
            "fn fact(n)",
            "    if n <= 1",
            "        return 1",
            "    return n * fact(n - 1)",
            "fact(10)"
        ));
        assertEquals(List.of("8"), harness.lines());
        assertEquals(new NumberValue(3628800), result);
    }

    @Test
    void runawayRecursionIsRecoverable() {
        var harness = KernelTestSupport.harness(ExecutionOptions.defaults().withMaxCallDepth(64));
        var ctx = harness.context(LUMEN);
        var program = LUMEN.compile(lines(
            "fn down(n)",
            "    return down(n + 1)",
            "down(0)"
        ));
        var error = assertThrows(StackExhaustionException.class, () -> program.run(ctx));
        assertEquals("stack_exhausted", error.code());
        assertEquals(1, ctx.environment().depth());
        assertEquals(new NumberValue(5), LUMEN.compile("2 + 3").run(ctx));
    }

    @Test
    void externSelectorsAreHonoured() {
        var harness = KernelTestSupport.harness();
        harness.run(LUMEN, "extern(\"debug:print\", \"hi\")");
        assertEquals(List.of("[debug] \"hi\""), harness.lines());

        var error = assertThrows(ExternResolutionException.class, () ->
            harness.run(LUMEN, "extern(\"backendX:print\", 1)"));
        assertTrue(error.getMessage().contains("backendX"));
        assertEquals(List.of("[debug] \"hi\""), harness.lines());
    }

    @Test
    void bareCallsNeverReachCapabilities() {
        var harness = KernelTestSupport.harness();
        var error = assertThrows(ScopeException.class, () -> harness.run(LUMEN, "sqrt(9)"));
        assertEquals("undefined_function", error.code());
        assertEquals(new NumberValue(3), harness.run(LUMEN, "extern(\"sqrt\", 9)"));
    }

    @Test
    void userFunctionCannotReplaceCapability() {
        var harness = KernelTestSupport.harness();
        harness.run(LUMEN, lines(
            "fn sqrt(x)",
            "    return 0",
            "print(extern(\"sqrt\", 16))",
            "print(sqrt(16))"
        ));
        assertEquals(List.of("4", "0"), harness.lines());
    }

    @Test
    void externSelectorMustBeStringLiteral() {
        var error = assertThrows(ParseException.class, () -> LUMEN.compile("let s = \"math:sqrt\"\nextern(s, 9)"));
        assertEquals("parse_error", error.code());
    }

    @Test
    void statementsNeedSeparators() {
        assertThrows(ParseException.class, () -> LUMEN.compile("let x = 1 let y = 2"));
        assertThrows(ParseException.class, () -> LUMEN.compile("x = 1 y = 2"));
    }

    @Test
    void conditionsMustBeBooleans() {
        var harness = KernelTestSupport.harness();
        assertThrows(RuntimeTypeException.class, () -> harness.run(LUMEN, lines("if 1", "    print(1)")));
    }

    @Test
    void timeoutStopsEndlessLoop() {
        var ctx = new ExecutionContext(
            new CapabilityRegistry(),
            LUMEN.values().unit(),
            ExecutionOptions.defaults(),
            new ExecutionContext.CancellationToken(),
            Optional.of(Duration.ofMillis(50))
        );
        var program = LUMEN.compile(lines("let x = 0", "while true", "    x = x + 1"));
        assertThrows(ExecutionContext.KernelCancellationException.class, () -> program.run(ctx));
        assertEquals(1, ctx.environment().depth());
    }

    @Test
    void forWalksRangeWithFreshBindingPerPass() {
        var harness = KernelTestSupport.harness();
        var ctx = harness.context(LUMEN);
        LUMEN.compile(lines(
            "let total = 0",
            "for i in 0..6",
            "    if i == 4",
            "        break",
            "    let doubled = i * 2",
            "    total = total + doubled"
        )).run(ctx);
        assertEquals(new NumberValue(12), ctx.environment().get("total"));
        assertEquals(1, ctx.environment().depth());
        var error = assertThrows(ScopeException.class, () -> LUMEN.compile("print(i)").run(ctx));
        assertEquals("undefined_variable", error.code());
    }

    @Test
    void loopRepeatsUntilBreak() {
        var harness = KernelTestSupport.harness();
        var result = harness.run(LUMEN, lines(
            "let n = 0",
            "loop",
            "    n = n + 3",
            "    if n > 10",
            "        break",
            "n"
        ));
        assertEquals(new NumberValue(12), result);
    }

    @Test
    void rangesNeedWholeNumbers() {
        var harness = KernelTestSupport.harness();
        assertThrows(RuntimeTypeException.class, () -> harness.run(LUMEN, lines("for i in 0..2.5", "    print(i)")));
        assertThrows(RuntimeTypeException.class, () -> harness.run(LUMEN, lines("for c in \"abc\"", "    print(c)")));
    }
}
