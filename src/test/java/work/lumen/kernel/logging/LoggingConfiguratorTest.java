package work.lumen.kernel.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ch.qos.logback.classic.Level;
import org.junit.jupiter.api.Test;
import work.lumen.kernel.api.LogLevel;

class LoggingConfiguratorTest {
    @Test
    void fatalMapsToError() {
        assertEquals(Level.ERROR, LoggingConfigurator.toLogback(LogLevel.FATAL));
        assertEquals(Level.DEBUG, LoggingConfigurator.toLogback(LogLevel.from("debug")));
    }
}
