package de.entwicklertraining.api.resilient.logging;

import java.util.Map;
import org.slf4j.event.Level;

/**
 * Sink for the events emitted while a logical request runs: request start, each retry,
 * honored {@code Retry-After} waits and network failures.
 * <p>
 * Delivery is best-effort. The client guards every call, so an implementation that throws
 * does not fail the request; implementations should still avoid blocking.
 */
@FunctionalInterface
public interface RequestEventLogger {

    /**
     * @param level The severity
     * @param message A short, constant event message such as {@code "Retry attempt"}
     * @param context Key/value pairs describing the event; iteration order is preserved
     */
    void log(Level level, String message, Map<String, Object> context);

    /**
     * @return A logger that drops every event
     */
    static RequestEventLogger noop() {
        return (level, message, context) -> { };
    }
}
