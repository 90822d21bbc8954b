package de.entwicklertraining.api.resilient.transport;

import java.io.IOException;

/**
 * Issues one HTTP request and returns its status, headers and body.
 * <p>
 * Implementations own connection handling and TLS. They must not retry on their own;
 * retrying is the job of {@link de.entwicklertraining.api.resilient.ApiClient}.
 * A per-attempt timeout must be reported as {@link java.net.http.HttpTimeoutException}
 * so that the client can tell it apart from other network failures.
 */
@FunctionalInterface
public interface HttpTransport {

    /**
     * Sends the request and reads the complete response body.
     *
     * @param request The request to send
     * @return The completed attempt
     * @throws IOException on connection, DNS or timeout failures
     * @throws InterruptedException if the calling thread was interrupted while waiting
     */
    AttemptResult send(TransportRequest request) throws IOException, InterruptedException;
}
