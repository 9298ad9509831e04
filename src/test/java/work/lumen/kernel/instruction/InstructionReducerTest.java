package work.lumen.kernel.instruction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lumen.kernel.demo.DemoValueSystem;
import work.lumen.kernel.demo.NumberValue;
import work.lumen.kernel.error.ExternResolutionException;
import work.lumen.kernel.error.ParseException;
import work.lumen.kernel.instruction.Instruction.Assign;
import work.lumen.kernel.instruction.Instruction.Branch;
import work.lumen.kernel.instruction.Instruction.Invoke;
import work.lumen.kernel.instruction.Instruction.Operate;
import work.lumen.kernel.instruction.Instruction.Scope;
import work.lumen.kernel.instruction.Instruction.Sequence;
import work.lumen.kernel.instruction.Instruction.Transfer;
import work.lumen.kernel.registry.SchemaLoader;

class InstructionReducerTest {
    private static final SchemaLanguage RUST =
        new SchemaLanguage(SchemaLoader.fromResource("languages/mini_rust.toml"), new DemoValueSystem());
    private static final SchemaLanguage PYTHON =
        new SchemaLanguage(SchemaLoader.fromResource("languages/mini_python.yaml"), new DemoValueSystem());

    private static List<Instruction> reduce(SchemaLanguage language, String source) {
        return language.compile(source).root().body();
    }

    @Test
    void whileBecomesRepeatingScope() {
        var loop = assertInstanceOf(Scope.class, reduce(PYTHON, "while x < 3:\n    x = x + 1\n").get(0));
        assertTrue(loop.repeating());
        var branch = assertInstanceOf(Branch.class, loop.body());
        assertEquals("<", ((Operate) branch.condition()).operator());
        assertInstanceOf(Sequence.class, branch.then());
        assertEquals(Transfer.Kind.BREAK, assertInstanceOf(Transfer.class, branch.otherwise()).kind());
    }

    @Test
    void untilBreaksWhenConditionHolds() {
        var loop = assertInstanceOf(Scope.class, reduce(RUST, "until done { step(); }").get(0));
        var branch = assertInstanceOf(Branch.class, loop.body());
        assertEquals(Transfer.Kind.BREAK, assertInstanceOf(Transfer.class, branch.then()).kind());
        assertInstanceOf(Sequence.class, branch.otherwise());
    }

    @Test
    void branchesRunInTheirOwnScope() {
        var branch = assertInstanceOf(Branch.class, reduce(RUST, "if a { b = 1; } else { b = 2; }").get(0));
        assertFalse(assertInstanceOf(Scope.class, branch.then()).repeating());
        assertInstanceOf(Scope.class, branch.otherwise());

        var bare = assertInstanceOf(Branch.class, reduce(RUST, "if a { b = 1; }").get(0));
        assertNull(bare.otherwise());
    }

    @Test
    void elseIfNestsAnotherBranch() {
        var branch = assertInstanceOf(Branch.class, reduce(RUST, "if a { x = 1; } else if b { x = 2; } else { x = 3; }").get(0));
        var otherwise = assertInstanceOf(Scope.class, branch.otherwise());
        var chained = assertInstanceOf(Sequence.class, otherwise.body());
        var inner = assertInstanceOf(Branch.class, chained.body().get(0));
        assertInstanceOf(Scope.class, inner.otherwise());
    }

    @Test
    void distinguishesBindFromSet() {
        var statements = reduce(RUST, "let x = 1; x = 2;");
        assertEquals(Assign.Mode.BIND, ((Assign) statements.get(0)).mode());
        assertEquals(Assign.Mode.SET, ((Assign) statements.get(1)).mode());
    }

    @Test
    void constantsCarryTheirLiteralText() {
        var sum = assertInstanceOf(Operate.class, reduce(RUST, "1 + 2.5").get(0));
        assertEquals("+", sum.operator());
        var right = (Operate) sum.operands().get(1);
        assertEquals(Operate.CONST, right.operator());
        assertEquals("2.5", right.immediate());
        assertEquals(new NumberValue(2.5), right.constant());
    }

    @Test
    void invokePatternUsesItsSelector() {
        var invoke = assertInstanceOf(Invoke.class, reduce(PYTHON, "print(1)\n").get(0));
        assertEquals("host:print", invoke.selector());
        assertTrue(invoke.extern());
    }

    @Test
    void bareCallsAndExternCallsStayDistinct() {
        var call = assertInstanceOf(Invoke.class, reduce(RUST, "sqrt(9)").get(0));
        assertFalse(call.extern());
        assertEquals("sqrt", call.selector());
        var extern = assertInstanceOf(Invoke.class, reduce(RUST, "extern(\"math:sqrt\", 9)").get(0));
        assertTrue(extern.extern());
        assertEquals("math:sqrt", extern.selector());
    }

    @Test
    void forBindsHiddenCursorOutsideTheLoop() {
        var outer = assertInstanceOf(Scope.class, reduce(RUST, "for i in 0..3 { x = i; }").get(0));
        assertFalse(outer.repeating());
        var setup = assertInstanceOf(Sequence.class, outer.body()).body();
        var cursor = assertInstanceOf(Assign.class, setup.get(0));
        assertEquals(Assign.Mode.BIND, cursor.mode());
        assertTrue(cursor.name().startsWith("#"));
        var range = assertInstanceOf(Operate.class, cursor.value());
        assertEquals(Operate.ITER, range.operator());
        assertEquals("..", ((Operate) range.operands().get(0)).operator());

        var loop = assertInstanceOf(Scope.class, setup.get(1));
        assertTrue(loop.repeating());
        var branch = assertInstanceOf(Branch.class, loop.body());
        assertEquals(cursor.name(), ((Operate) branch.condition()).immediate());
        var step = assertInstanceOf(Assign.class, assertInstanceOf(Sequence.class, branch.then()).body().get(0));
        assertEquals("i", step.name());
        assertEquals(Operate.NEXT, ((Operate) step.value()).operator());
        assertEquals(Transfer.Kind.BREAK, assertInstanceOf(Transfer.class, branch.otherwise()).kind());
    }

    @Test
    void loopIsBareRepeatingScope() {
        var loop = assertInstanceOf(Scope.class, reduce(RUST, "loop { break; }").get(0));
        assertTrue(loop.repeating());
        assertInstanceOf(Sequence.class, loop.body());
    }

    @Test
    void elifNestsAnotherBranch() {
        var source = "if a:\n    x = 1\nelif b:\n    x = 2\nelse:\n    x = 3\n";
        var branch = assertInstanceOf(Branch.class, reduce(PYTHON, source).get(0));
        var chained = assertInstanceOf(Sequence.class, assertInstanceOf(Scope.class, branch.otherwise()).body());
        var inner = assertInstanceOf(Branch.class, chained.body().get(0));
        assertEquals("b", ((Operate) inner.condition()).immediate());
        assertInstanceOf(Scope.class, inner.otherwise());
    }

    @Test
    void strayElifIsParseError() {
        assertThrows(ParseException.class, () -> PYTHON.compile("x = 1\nelif x:\n    x = 2\n"));
    }

    @Test
    void functionsGoToTheProgramTable() {
        var program = RUST.compile("fn twice(a) { return a * 2; } twice(4)");
        assertTrue(program.functions().contains("twice"));
        assertEquals(List.of("a"), program.functions().lookup("twice").orElseThrow().params());
        assertTrue(((Sequence) program.root().body().get(0)).body().isEmpty());
        assertFalse(program.functions().lookup("twice").orElseThrow().memoizable());
    }

    @Test
    void malformedExternSelectorFailsAtParseTime() {
        assertThrows(ExternResolutionException.class, () -> RUST.compile("extern(\"a::b\", 1)"));
    }

    @Test
    void externSelectorMustBeStringLiteral() {
        assertThrows(ParseException.class, () -> RUST.compile("let name = \"math:sqrt\"; extern(name, 9);"));
        assertThrows(ParseException.class, () -> PYTHON.compile("extern(sqrt, 9)\n"));
    }

    @Test
    void missingBlockIsParseError() {
        var error = assertThrows(ParseException.class, () -> RUST.compile("while x < 3 x = 1;"));
        assertEquals("parse_error", error.code());
    }

    @Test
    void unbalancedBracesAreRejected() {
        assertThrows(ParseException.class, () -> RUST.compile("while true { x = 1;"));
    }
}
