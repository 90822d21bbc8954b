package de.entwicklertraining.api.resilient;

import java.net.http.HttpRequest;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Configuration for HTTP transport layer concerns: headers sent with every request and
 * modifiers applied to each {@link HttpRequest.Builder}.
 * <p>
 * Global headers are merged into every attempt by {@link ApiClient}; request-specific headers
 * take precedence. Request modifiers are applied by
 * {@link de.entwicklertraining.api.resilient.transport.JdkHttpTransport}.
 * <p>
 * Example usage:
 * <pre>
 * ApiHttpConfiguration httpConfig = ApiHttpConfiguration.builder()
 *     .bearerToken("your-token")
 *     .header("User-Agent", "market-data-adapter/1.0")
 *     .requestModifier(builder -&gt; builder.header("X-Request-ID", UUID.randomUUID().toString()))
 *     .build();
 * </pre>
 */
public class ApiHttpConfiguration {
    /** Global headers to be added to all requests */
    private final Map<String, String> globalHeaders;

    /** Request modifiers to be applied to all HTTP requests */
    private final List<Consumer<HttpRequest.Builder>> requestModifiers;

    /**
     * Creates a new instance with empty configuration.
     */
    public ApiHttpConfiguration() {
        this.globalHeaders = Map.of();
        this.requestModifiers = List.of();
    }

    private ApiHttpConfiguration(Builder builder) {
        this.globalHeaders = Collections.unmodifiableMap(new LinkedHashMap<>(builder.globalHeaders));
        this.requestModifiers = List.copyOf(builder.requestModifiers);
    }

    /**
     * Creates a new Builder instance for constructing ApiHttpConfiguration.
     *
     * @return A new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a new Builder pre-populated with the current configuration.
     *
     * @return A new Builder instance with current settings
     */
    public Builder toBuilder() {
        return new Builder()
                .headers(this.globalHeaders)
                .requestModifiers(this.requestModifiers);
    }

    /**
     * Gets the global headers that will be added to all requests.
     *
     * @return An unmodifiable map of global headers
     */
    public Map<String, String> getGlobalHeaders() {
        return globalHeaders;
    }

    /**
     * Gets the request modifiers that will be applied to all HTTP requests.
     *
     * @return An unmodifiable list of request modifiers
     */
    public List<Consumer<HttpRequest.Builder>> getRequestModifiers() {
        return requestModifiers;
    }

    /**
     * A builder for creating {@link ApiHttpConfiguration} instances with a fluent API.
     */
    public static class Builder {
        private final Map<String, String> globalHeaders = new LinkedHashMap<>();
        private final List<Consumer<HttpRequest.Builder>> requestModifiers = new ArrayList<>();

        /**
         * Creates a new Builder instance.
         */
        public Builder() {}

        /**
         * Adds a global header that will be included in all requests.
         *
         * @param name The header name
         * @param value The header value
         * @return This builder for method chaining
         */
        public Builder header(String name, String value) {
            this.globalHeaders.put(name, value);
            return this;
        }

        /**
         * Adds multiple global headers that will be included in all requests.
         *
         * @param headers Map of header names to values
         * @return This builder for method chaining
         */
        public Builder headers(Map<String, String> headers) {
            this.globalHeaders.putAll(headers);
            return this;
        }

        /**
         * Sends an {@code Authorization: Bearer ...} header with every request.
         *
         * @param token The bearer token
         * @return This builder for method chaining
         */
        public Builder bearerToken(String token) {
            return header("Authorization", "Bearer " + token);
        }

        /**
         * Adds a request modifier that will be applied to all HTTP requests.
         *
         * @param modifier Consumer that receives and can modify the HttpRequest.Builder
         * @return This builder for method chaining
         */
        public Builder requestModifier(Consumer<HttpRequest.Builder> modifier) {
            this.requestModifiers.add(modifier);
            return this;
        }

        /**
         * Adds multiple request modifiers that will be applied to all HTTP requests.
         *
         * @param modifiers List of consumers that receive and can modify the HttpRequest.Builder
         * @return This builder for method chaining
         */
        public Builder requestModifiers(List<Consumer<HttpRequest.Builder>> modifiers) {
            this.requestModifiers.addAll(modifiers);
            return this;
        }

        /**
         * Builds a new {@link ApiHttpConfiguration} instance with the configured settings.
         *
         * @return A new {@link ApiHttpConfiguration} instance
         */
        public ApiHttpConfiguration build() {
            return new ApiHttpConfiguration(this);
        }
    }
}
