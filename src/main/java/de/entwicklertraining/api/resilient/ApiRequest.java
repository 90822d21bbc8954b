package de.entwicklertraining.api.resilient;

import de.entwicklertraining.api.resilient.json.JsonBodies;
import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One logical request: method, absolute URL, headers and an optional JSON body.
 * <p>
 * A request is immutable and may be executed any number of times; every attempt builds a
 * fresh wire request from it.
 * <p>
 * Example usage:
 * <pre>
 * ApiRequest request = ApiRequest.builder(HttpMethod.POST, "https://api.example.com/v1/orders")
 *     .header("X-Client", "adapter")
 *     .jsonBody(Map.of("symbol", "AAPL", "qty", 10))
 *     .build();
 * </pre>
 */
public final class ApiRequest {

    private final HttpMethod method;
    private final URI uri;
    private final Map<String, String> headers;
    private final Object body;

    private ApiRequest(Builder builder) {
        this.method = builder.method;
        this.uri = builder.uri;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.body = builder.body;
    }

    /**
     * Creates a builder for a request.
     *
     * @param method The HTTP method
     * @param url The absolute URL including query parameters
     * @return A new builder
     * @throws IllegalArgumentException if the URL is not a valid absolute URI
     */
    public static Builder builder(HttpMethod method, String url) {
        return new Builder(method, toUri(url));
    }

    /**
     * Creates a builder for a request.
     *
     * @param method The HTTP method
     * @param uri The absolute URI
     * @return A new builder
     */
    public static Builder builder(HttpMethod method, URI uri) {
        return new Builder(method, uri);
    }

    public HttpMethod getMethod() {
        return method;
    }

    public URI getUri() {
        return uri;
    }

    /**
     * Gets an unmodifiable view of the request headers in insertion order.
     *
     * @return The headers
     */
    public Map<String, String> getHeaders() {
        return headers;
    }

    /**
     * @return The body object as given to the builder, if any
     */
    public Optional<Object> getBody() {
        return Optional.ofNullable(body);
    }

    /**
     * Serializes the body with {@link JsonBodies#serialize(Object)}.
     *
     * @return The JSON text, or empty for requests without a body
     */
    public Optional<String> getSerializedBody() {
        return body == null ? Optional.empty() : Optional.of(JsonBodies.serialize(body));
    }

    @Override
    public String toString() {
        return method + " " + uri;
    }

    private static URI toUri(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("URL cannot be null or empty");
        }
        URI uri = URI.create(url.trim());
        if (!uri.isAbsolute()) {
            throw new IllegalArgumentException("URL must be absolute: " + url);
        }
        return uri;
    }

    /**
     * A builder for {@link ApiRequest}.
     */
    public static final class Builder {
        private final HttpMethod method;
        private final URI uri;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private Object body;

        private Builder(HttpMethod method, URI uri) {
            this.method = Objects.requireNonNull(method, "method");
            this.uri = Objects.requireNonNull(uri, "uri");
        }

        /**
         * Adds or replaces a request header. Request headers override global headers of the same name.
         *
         * @param name The header name
         * @param value The header value
         * @return This builder for method chaining
         */
        public Builder header(String name, String value) {
            Objects.requireNonNull(name, "header name");
            Objects.requireNonNull(value, "header value");
            headers.put(name, value);
            return this;
        }

        /**
         * Adds or replaces several request headers.
         *
         * @param headers Map of header names to values
         * @return This builder for method chaining
         */
        public Builder headers(Map<String, String> headers) {
            headers.forEach(this::header);
            return this;
        }

        /**
         * Sets the JSON body. See {@link JsonBodies#serialize(Object)} for the accepted types.
         *
         * @param body The body, or null for none
         * @return This builder for method chaining
         */
        public Builder jsonBody(Object body) {
            this.body = body;
            return this;
        }

        /**
         * @return The request
         */
        public ApiRequest build() {
            return new ApiRequest(this);
        }
    }
}
