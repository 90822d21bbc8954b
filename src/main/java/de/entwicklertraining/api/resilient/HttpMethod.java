package de.entwicklertraining.api.resilient;

import java.util.Locale;

/**
 * HTTP methods the client is able to issue.
 * <p>
 * Which of them a client actually executes is controlled by
 * {@link ApiClientSettings#getAllowedMethods()}. GET, HEAD and OPTIONS are safe to repeat;
 * the remaining methods are only retried because the call sites using this client are
 * idempotent, which is the caller's responsibility.
 */
public enum HttpMethod {
    GET(true),
    HEAD(true),
    OPTIONS(true),
    POST(false),
    PUT(false),
    PATCH(false),
    DELETE(false),
    TRACE(false);

    private final boolean safe;

    HttpMethod(boolean safe) {
        this.safe = safe;
    }

    /**
     * Returns whether the method is free of side effects on the server.
     *
     * @return true for GET, HEAD and OPTIONS
     */
    public boolean isSafe() {
        return safe;
    }

    /**
     * Parses a method name case-insensitively.
     *
     * @param name The method name, e.g. "get" or "POST"
     * @return The matching method
     * @throws IllegalArgumentException if the name is not one of the supported methods
     */
    public static HttpMethod of(String name) {
        if (name == null) {
            throw new IllegalArgumentException("HTTP method cannot be null");
        }
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
