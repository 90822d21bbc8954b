package de.entwicklertraining.api.resilient.logging;

import org.junit.jupiter.api.Test;
import org.slf4j.Marker;
import org.slf4j.event.KeyValuePair;
import org.slf4j.event.Level;
import org.slf4j.event.LoggingEvent;
import org.slf4j.helpers.LegacyAbstractLogger;
import org.slf4j.spi.LoggingEventAware;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class Slf4jRequestEventLoggerTest {

    /**
     * Captures fluent logging events with their key/value pairs.
     */
    private static final class CapturingLogger extends LegacyAbstractLogger implements LoggingEventAware {
        private final Level threshold;
        private final List<LoggingEvent> events = new ArrayList<>();

        CapturingLogger(Level threshold) {
            this.name = "capturing";
            this.threshold = threshold;
        }

        @Override
        public void log(LoggingEvent event) {
            events.add(event);
        }

        private boolean enabled(Level level) {
            return level.toInt() >= threshold.toInt();
        }

        @Override
        public boolean isTraceEnabled() {
            return enabled(Level.TRACE);
        }

        @Override
        public boolean isDebugEnabled() {
            return enabled(Level.DEBUG);
        }

        @Override
        public boolean isInfoEnabled() {
            return enabled(Level.INFO);
        }

        @Override
        public boolean isWarnEnabled() {
            return enabled(Level.WARN);
        }

        @Override
        public boolean isErrorEnabled() {
            return enabled(Level.ERROR);
        }

        @Override
        protected String getFullyQualifiedCallerName() {
            return null;
        }

        @Override
        protected void handleNormalizedLoggingCall(Level level, Marker marker, String messagePattern,
                                                   Object[] arguments, Throwable throwable) {
            fail("fluent API expected, got plain call: " + messagePattern);
        }
    }

    @Test
    void testContextIsAttachedAsKeyValuePairs() {
        CapturingLogger logger = new CapturingLogger(Level.DEBUG);
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("url", "https://api.example.com/v1/quotes");
        context.put("attempt", 2);

        new Slf4jRequestEventLogger(logger).log(Level.INFO, "Retry attempt", context);

        assertEquals(1, logger.events.size());
        LoggingEvent event = logger.events.get(0);
        assertEquals(Level.INFO, event.getLevel());
        assertEquals("Retry attempt", event.getMessage());
        List<KeyValuePair> pairs = event.getKeyValuePairs();
        assertEquals(2, pairs.size());
        assertEquals("url", pairs.get(0).key);
        assertEquals(2, pairs.get(1).value);
    }

    @Test
    void testDisabledLevelIsSkipped() {
        CapturingLogger logger = new CapturingLogger(Level.INFO);

        new Slf4jRequestEventLogger(logger).log(Level.DEBUG, "Backing off", Map.of("delay_ms", 300L));

        assertTrue(logger.events.isEmpty());
    }

    @Test
    void testNoopLoggerAcceptsEvents() {
        assertDoesNotThrow(() -> RequestEventLogger.noop().log(Level.ERROR, "Network failure", Map.of()));
    }
}
