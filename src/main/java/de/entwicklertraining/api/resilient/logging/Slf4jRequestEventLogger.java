package de.entwicklertraining.api.resilient.logging;

import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.slf4j.spi.LoggingEventBuilder;

/**
 * Default {@link RequestEventLogger} writing events through SLF4J, with the context attached
 * as key/value pairs.
 */
public final class Slf4jRequestEventLogger implements RequestEventLogger {

    private final Logger logger;

    /**
     * Logs to the {@code de.entwicklertraining.api.resilient.ApiClient} logger.
     */
    public Slf4jRequestEventLogger() {
        this(LoggerFactory.getLogger("de.entwicklertraining.api.resilient.ApiClient"));
    }

    /**
     * @param component Name of the SLF4J logger to write to, e.g. the adapter using the client
     */
    public Slf4jRequestEventLogger(String component) {
        this(LoggerFactory.getLogger(component));
    }

    /**
     * @param logger The SLF4J logger to write to
     */
    public Slf4jRequestEventLogger(Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    @Override
    public void log(Level level, String message, Map<String, Object> context) {
        if (!logger.isEnabledForLevel(level)) {
            return;
        }
        LoggingEventBuilder event = logger.atLevel(level);
        for (Map.Entry<String, Object> entry : context.entrySet()) {
            event = event.addKeyValue(entry.getKey(), entry.getValue());
        }
        event.log(message);
    }
}
