package work.lumen.kernel.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DurationParserTest {
    @Test
    void parsesUnits() {
        assertEquals(Optional.of(Duration.ofMillis(250)), DurationParser.parse("250ms"));
        assertEquals(Optional.of(Duration.ofSeconds(30)), DurationParser.parse("30s"));
        assertEquals(Optional.of(Duration.ofMinutes(2)), DurationParser.parse("2m"));
        assertEquals(Optional.of(Duration.ofHours(1)), DurationParser.parse(" 1H "));
    }

    @Test
    void parsesMillisecondsByDefault() {
        assertEquals(Optional.of(Duration.ofMillis(1500)), DurationParser.parse("1500"));
        assertEquals(Optional.of(Duration.ZERO), DurationParser.parse("0"));
    }

    @Test
    void blankMeansNoTimeout() {
        assertTrue(DurationParser.parse(null).isEmpty());
        assertTrue(DurationParser.parse("  ").isEmpty());
    }

    @Test
    void rejectsGarbage() {
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("soon"));
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("-5s"));
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("99999999999999999999"));
    }
}
