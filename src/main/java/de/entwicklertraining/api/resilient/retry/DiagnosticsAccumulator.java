package de.entwicklertraining.api.resilient.retry;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Collects what went wrong across the attempts of one logical call, so that an exhausted call
 * can report the last status, a bounded body snippet, the number of attempts and the last error
 * in a single message.
 */
public final class DiagnosticsAccumulator {

    /** Maximum number of body characters kept before truncation. */
    public static final int MAX_SNIPPET_LENGTH = 1024;

    static final String TRUNCATION_MARKER = "...[truncated]";

    private Integer lastStatus;
    private String lastBodySnippet;
    private int attempts;
    private Throwable lastError;

    /**
     * Counts an attempt that is about to be issued.
     */
    public void recordAttempt() {
        attempts++;
    }

    /**
     * Remembers an unsuccessful response.
     *
     * @param status The HTTP status
     * @param body The full response body
     */
    public void recordStatus(int status, String body) {
        this.lastStatus = status;
        this.lastBodySnippet = snippet(body);
    }

    /**
     * Remembers a failure of the current attempt.
     *
     * @param error The error
     */
    public void recordError(Throwable error) {
        this.lastError = error;
    }

    public OptionalInt getLastStatus() {
        return lastStatus == null ? OptionalInt.empty() : OptionalInt.of(lastStatus);
    }

    public Optional<String> getLastBodySnippet() {
        return Optional.ofNullable(lastBodySnippet);
    }

    public int getAttempts() {
        return attempts;
    }

    public Optional<Throwable> getLastError() {
        return Optional.ofNullable(lastError);
    }

    /**
     * Composes the diagnostic message, e.g.
     * {@code status=503, body="busy", attempts=3, last_err="java.net.ConnectException: refused"}.
     * Absent fields are left out; double quotes inside values become single quotes.
     *
     * @return The message
     */
    public String describe() {
        List<String> parts = new ArrayList<>(4);
        if (lastStatus != null) {
            parts.add("status=" + lastStatus);
        }
        if (lastBodySnippet != null) {
            parts.add("body=\"" + lastBodySnippet.replace('"', '\'') + "\"");
        }
        parts.add("attempts=" + attempts);
        if (lastError != null) {
            parts.add("last_err=\"" + lastError.toString().replace('"', '\'') + "\"");
        }
        return String.join(", ", parts);
    }

    /**
     * Bounds a body to {@link #MAX_SNIPPET_LENGTH} characters.
     *
     * @param body The body, may be null
     * @return The body, or its prefix followed by {@code ...[truncated]}
     */
    public static String snippet(String body) {
        if (body == null) {
            return "";
        }
        if (body.length() <= MAX_SNIPPET_LENGTH) {
            return body;
        }
        return body.substring(0, MAX_SNIPPET_LENGTH) + TRUNCATION_MARKER;
    }
}
