package work.lumen.kernel.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lumen.kernel.error.ConfigurationException;

class PatternElementTest {
    @Test
    void parsesTextualForms() {
        assertEquals(PatternElement.expression("cond"), PatternElement.parse("expr:cond"));
        assertEquals(PatternElement.optionalExpression("value"), PatternElement.parse("expr?:value"));
        assertEquals(PatternElement.block("body"), PatternElement.parse("block:body"));
        assertEquals(PatternElement.identifier("name"), PatternElement.parse("ident:name"));
        assertEquals(PatternElement.parameters("params"), PatternElement.parse("params:params"));
        assertEquals(PatternElement.literal(":"), PatternElement.parse("=:"));
        assertEquals(PatternElement.literal("="), PatternElement.parse("=="));
        assertEquals(PatternElement.optionalLiteral("else"), PatternElement.parse("?else"));
        assertEquals(PatternElement.chain("elif"), PatternElement.parse("&elif"));
    }

    @Test
    void chainNeedsAFollowingBlock() {
        var error = assertThrows(ConfigurationException.class, () -> new StatementPattern(
            "if",
            List.of(PatternElement.expression("cond"), PatternElement.block("then"), PatternElement.chain("elif")),
            CanonicalAction.BRANCH
        ));
        assertTrue(error.getMessage().contains("elif"));
    }

    @Test
    void rejectsUnknownKinds() {
        assertThrows(ConfigurationException.class, () -> PatternElement.parse("stmt:body"));
        assertThrows(ConfigurationException.class, () -> PatternElement.parse("expr:"));
        assertThrows(ConfigurationException.class, () -> PatternElement.parse(" "));
    }
}
