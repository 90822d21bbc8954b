package de.entwicklertraining.api.resilient.transport;

import de.entwicklertraining.api.resilient.HttpMethod;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A single wire-level request handed to an {@link HttpTransport}. A new instance is built
 * for every attempt so that nothing is reused between attempts.
 *
 * @param method The HTTP method
 * @param uri The absolute target URI
 * @param headers Headers to send, already merged (global headers first, request headers last)
 * @param body The serialized JSON body, if any
 * @param timeout Upper bound for this single attempt, if any
 */
public record TransportRequest(HttpMethod method,
                               URI uri,
                               Map<String, String> headers,
                               Optional<String> body,
                               Optional<Duration> timeout) {

    public TransportRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(uri, "uri");
        headers = Map.copyOf(headers);
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(timeout, "timeout");
    }
}
