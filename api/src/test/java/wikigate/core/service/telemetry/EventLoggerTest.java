package wikigate.core.service.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import wikigate.core.model.telemetry.LogLevel;
import wikigate.support.MutableClock;

@DisplayName("EventLogger")
class EventLoggerTest {

    private MutableClock clock;
    private EventLogger logger;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T12:00:00Z");
        logger = new EventLogger(3, clock);
    }

    @Test
    @DisplayName("should retain events with level, context and request id")
    void shouldRetainEvents() {
        logger.warn("Endpoint slow", Map.of("endpoint", "https://en.wikipedia.org"), "req-1");

        var event = logger.getLogs(null, null).get(0);
        assertEquals(LogLevel.WARN, event.level());
        assertEquals("Endpoint slow", event.message());
        assertEquals("https://en.wikipedia.org", event.context().get("endpoint"));
        assertEquals("req-1", event.requestId());
        assertEquals(clock.instant(), event.timestamp());
    }

    @Test
    @DisplayName("should filter by level")
    void shouldFilterByLevel() {
        logger.info("a", Map.of(), null);
        logger.error("b", Map.of(), null);
        logger.debug("c", null, null);

        var errors = logger.getLogs(LogLevel.ERROR, null);

        assertEquals(1, errors.size());
        assertEquals("b", errors.get(0).message());
        assertTrue(logger.getLogs(LogLevel.DEBUG, null).get(0).context().isEmpty());
    }

    @Test
    @DisplayName("should filter by timestamp")
    void shouldFilterBySince() {
        logger.error("old", Map.of(), null);
        clock.advance(Duration.ofHours(2));
        logger.error("new", Map.of(), null);

        var recent = logger.getLogs(LogLevel.ERROR, clock.instant().minus(Duration.ofHours(1)));

        assertEquals(1, recent.size());
        assertEquals("new", recent.get(0).message());
    }

    @Test
    @DisplayName("should drop the oldest events beyond capacity")
    void shouldBoundBuffer() {
        for (int i = 0; i < 5; i++) {
            logger.info("event " + i, Map.of(), null);
        }

        var logs = logger.getLogs(null, null);
        assertEquals(3, logs.size());
        assertEquals("event 2", logs.get(0).message());
    }
}
