package work.lcod.dispatch.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class DispatchConfigurationTest {
    @Test
    void defaultsPollEveryHundredMillisOnPipes() {
        var config = DispatchConfiguration.defaults();
        assertEquals(Duration.ofMillis(100), config.pollInterval());
        assertEquals('|', config.pipeDelimiter());
        assertEquals("command-queue", config.threadName());
        assertTrue(config.workerThreads() >= 2);
    }

    @Test
    void builderRoundTripsThroughToBuilder() {
        var config = DispatchConfiguration.builder()
            .pollInterval(Duration.ofMillis(5))
            .workerThreads(1)
            .pipeDelimiter('>')
            .threadName("custom")
            .build();
        assertEquals(config, config.toBuilder().build());
    }

    @Test
    void rejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> DispatchConfiguration.builder().pollInterval(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class, () -> DispatchConfiguration.builder().workerThreads(0).build());
        assertThrows(IllegalArgumentException.class, () -> DispatchConfiguration.builder().pipeDelimiter(' ').build());
        assertThrows(IllegalArgumentException.class, () -> DispatchConfiguration.builder().threadName(" ").build());
        assertThrows(NullPointerException.class, () -> DispatchConfiguration.builder().pollInterval(null).build());
    }

    @Test
    void logLevelsParseLeniently() {
        assertEquals(LogLevel.WARN, LogLevel.from(null));
        assertEquals(LogLevel.DEBUG, LogLevel.from(" debug "));
        assertEquals(LogLevel.ERROR, LogLevel.from("fatal"));
        assertThrows(IllegalArgumentException.class, () -> LogLevel.from("loud"));
    }
}
