package de.entwicklertraining.api.resilient.transport;

import java.net.http.HttpHeaders;
import java.util.Map;
import java.util.Objects;

/**
 * The outcome of one completed HTTP attempt: status, headers and the full body text.
 * The body is read from the wire exactly once by the transport and kept here for
 * classification, decoding and diagnostics.
 *
 * @param status The HTTP status code
 * @param headers The response headers
 * @param body The response body, never null (empty when the server sent none)
 */
public record AttemptResult(int status, HttpHeaders headers, String body) {

    public AttemptResult {
        Objects.requireNonNull(headers, "headers");
        body = body == null ? "" : body;
    }

    /**
     * Creates a result with no headers.
     *
     * @param status The HTTP status code
     * @param body The response body
     * @return A new attempt result
     */
    public static AttemptResult of(int status, String body) {
        return new AttemptResult(status, HttpHeaders.of(Map.of(), (name, value) -> true), body);
    }

    /**
     * @return true if the status is in the 2xx range
     */
    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }
}
