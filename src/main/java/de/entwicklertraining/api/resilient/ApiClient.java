package de.entwicklertraining.api.resilient;

import de.entwicklertraining.api.resilient.concurrency.ConcurrencyGate;
import de.entwicklertraining.api.resilient.concurrency.ConcurrencyGate.Permit;
import de.entwicklertraining.api.resilient.json.ResponseDecoder;
import de.entwicklertraining.api.resilient.json.ResponseDecoders;
import de.entwicklertraining.api.resilient.logging.RequestEventLogger;
import de.entwicklertraining.api.resilient.logging.Slf4jRequestEventLogger;
import de.entwicklertraining.api.resilient.retry.BackoffPolicy;
import de.entwicklertraining.api.resilient.retry.DiagnosticsAccumulator;
import de.entwicklertraining.api.resilient.retry.ResponseClassifier;
import de.entwicklertraining.api.resilient.retry.RetryAfterParser;
import de.entwicklertraining.api.resilient.retry.RetryDecision;
import de.entwicklertraining.api.resilient.transport.AttemptResult;
import de.entwicklertraining.api.resilient.transport.HttpTransport;
import de.entwicklertraining.api.resilient.transport.JdkHttpTransport;
import de.entwicklertraining.api.resilient.transport.TransportRequest;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.json.JSONException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

/**
 * Resilient HTTP client executing logical requests with bounded concurrency, retries,
 * exponential backoff and {@code Retry-After} compliance.
 *
 * <p>One call of {@link #execute(ApiRequest, ResponseDecoder)} runs through these states:
 * <ol>
 *   <li>A method outside {@link ApiClientSettings#getAllowedMethods()} is rejected with an
 *       {@link InternalException} before any permit is taken or any byte is sent.</li>
 *   <li>A permit is acquired from the {@link ConcurrencyGate}.</li>
 *   <li>An attempt is sent through the {@link HttpTransport}; its body is read exactly once.</li>
 *   <li>The {@link ResponseClassifier} decides to accept, to sleep and retry, or to stop.</li>
 *   <li>The permit is released on every exit path.</li>
 * </ol>
 *
 * <p>Outcomes have two layers. Calls that cannot be completed throw an
 * {@link ApiClientException}; calls that completed return an {@link ApiResponse} whose
 * {@link ApiResponse#isSuccess()} must be checked, because a non-2xx status that survived the
 * retry policy is returned, not thrown.
 *
 * <p>The client is thread-safe. Settings are fixed per instance; use
 * {@link #withSettings(ApiClientSettings)} for a call with different settings.
 */
public class ApiClient {
    private static final Logger logger = LoggerFactory.getLogger(ApiClient.class.getName());

    private static final ExecutorService ASYNC_EXECUTOR = Executors.newCachedThreadPool(new ThreadFactory() {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "api-client-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    });

    /** The settings for this API client */
    protected final ApiClientSettings settings;

    /** The HTTP configuration for this API client */
    protected final ApiHttpConfiguration httpConfig;

    private final HttpTransport transport;
    private final RequestEventLogger eventLogger;
    private final RetryAfterParser retryAfterParser;
    private final ConcurrencyGate gate;
    private final AtomicBoolean eventLoggerFailureReported = new AtomicBoolean(false);

    /**
     * Creates a client with {@link ApiClientSettings#defaults()}.
     */
    public ApiClient() {
        this(ApiClientSettings.defaults());
    }

    /**
     * Creates a client using the JDK transport and SLF4J event logging.
     *
     * @param settings The settings to use for this client
     */
    public ApiClient(ApiClientSettings settings) {
        this(settings, new ApiHttpConfiguration());
    }

    /**
     * Creates a client using the JDK transport and SLF4J event logging.
     *
     * @param settings The settings to use for this client
     * @param httpConfig Global headers and request modifiers
     */
    public ApiClient(ApiClientSettings settings, ApiHttpConfiguration httpConfig) {
        this(settings, httpConfig, new JdkHttpTransport(httpConfig), new Slf4jRequestEventLogger());
    }

    /**
     * Creates a client on a custom transport and event logger.
     *
     * @param settings The settings to use for this client
     * @param httpConfig Global headers added to every request
     * @param transport Issues the individual attempts
     * @param eventLogger Receives request events
     */
    public ApiClient(ApiClientSettings settings,
                     ApiHttpConfiguration httpConfig,
                     HttpTransport transport,
                     RequestEventLogger eventLogger) {
        this(settings, httpConfig, transport, eventLogger, new RetryAfterParser());
    }

    /**
     * Creates a client with an explicit {@link RetryAfterParser}, e.g. one bound to a fixed clock.
     *
     * @param settings The settings to use for this client
     * @param httpConfig Global headers added to every request
     * @param transport Issues the individual attempts
     * @param eventLogger Receives request events
     * @param retryAfterParser Parses server wait directives
     */
    protected ApiClient(ApiClientSettings settings,
                        ApiHttpConfiguration httpConfig,
                        HttpTransport transport,
                        RequestEventLogger eventLogger,
                        RetryAfterParser retryAfterParser) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.httpConfig = Objects.requireNonNull(httpConfig, "httpConfig");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.eventLogger = Objects.requireNonNull(eventLogger, "eventLogger");
        this.retryAfterParser = Objects.requireNonNull(retryAfterParser, "retryAfterParser");
        this.gate = settings.getSharedGate().orElseGet(() -> new ConcurrencyGate(settings.getConcurrencyLimit()));
    }

    /**
     * Creates a new, independent client with other settings that shares this client's transport,
     * HTTP configuration and event logger. Unless the new settings name a shared gate, the new
     * client admits requests through its own gate.
     *
     * @param overrides The settings for the new client, typically derived with {@link ApiClientSettings#toBuilder()}
     * @return A new client
     */
    public ApiClient withSettings(ApiClientSettings overrides) {
        return new ApiClient(overrides, httpConfig, transport, eventLogger, retryAfterParser);
    }

    public ApiClientSettings getSettings() {
        return settings;
    }

    /**
     * @return The gate admitting this client's requests, shared or instance-local
     */
    public ConcurrencyGate getConcurrencyGate() {
        return gate;
    }

    // ---------------------------------------
    // Convenience methods
    // ---------------------------------------

    public <T> ApiResponse<T> get(String url, ResponseDecoder<T> decoder) {
        return get(url, Map.of(), decoder);
    }

    public <T> ApiResponse<T> get(String url, Map<String, String> headers, ResponseDecoder<T> decoder) {
        return execute(ApiRequest.builder(HttpMethod.GET, url).headers(headers).build(), decoder);
    }

    /**
     * Sends a HEAD request. The response carries status and headers but never data.
     *
     * @param url The absolute URL
     * @param headers Request headers
     * @return The response
     */
    public ApiResponse<Void> head(String url, Map<String, String> headers) {
        return execute(ApiRequest.builder(HttpMethod.HEAD, url).headers(headers).build(), ResponseDecoders.discard());
    }

    public <T> ApiResponse<T> options(String url, Map<String, String> headers, ResponseDecoder<T> decoder) {
        return execute(ApiRequest.builder(HttpMethod.OPTIONS, url).headers(headers).build(), decoder);
    }

    public <T> ApiResponse<T> trace(String url, Map<String, String> headers, ResponseDecoder<T> decoder) {
        return execute(ApiRequest.builder(HttpMethod.TRACE, url).headers(headers).build(), decoder);
    }

    public <T> ApiResponse<T> delete(String url, Map<String, String> headers, ResponseDecoder<T> decoder) {
        return execute(ApiRequest.builder(HttpMethod.DELETE, url).headers(headers).build(), decoder);
    }

    public <T> ApiResponse<T> post(String url, Object body, ResponseDecoder<T> decoder) {
        return post(url, Map.of(), body, decoder);
    }

    public <T> ApiResponse<T> post(String url, Map<String, String> headers, Object body, ResponseDecoder<T> decoder) {
        return execute(ApiRequest.builder(HttpMethod.POST, url).headers(headers).jsonBody(body).build(), decoder);
    }

    public <T> ApiResponse<T> put(String url, Map<String, String> headers, Object body, ResponseDecoder<T> decoder) {
        return execute(ApiRequest.builder(HttpMethod.PUT, url).headers(headers).jsonBody(body).build(), decoder);
    }

    public <T> ApiResponse<T> patch(String url, Map<String, String> headers, Object body, ResponseDecoder<T> decoder) {
        return execute(ApiRequest.builder(HttpMethod.PATCH, url).headers(headers).jsonBody(body).build(), decoder);
    }

    // ---------------------------------------
    // Execution
    // ---------------------------------------

    /**
     * Executes a logical request with retries on the calling thread.
     *
     * @param request The request
     * @param decoder Decodes the body of a 2xx response
     * @param <T> The decoded type
     * @return The final response; check {@link ApiResponse#isSuccess()}
     * @throws InternalException if the method is not allowed, the gate is closed or the thread is interrupted
     * @throws ApiTimeoutException if an attempt timed out and timeouts are not retried
     * @throws ApiResponseUnusableException if a 2xx body could not be decoded
     * @throws RetriesExhaustedException if network failures used up the retry budget
     */
    public <T> ApiResponse<T> execute(ApiRequest request, ResponseDecoder<T> decoder) {
        return sendRequestWithRetry(request, decoder);
    }

    /**
     * Executes a logical request with retries on a background thread.
     * <p>
     * This is also the way to bound or cancel a whole call, including every retry and sleep:
     * {@code executeAsync(request, decoder).orTimeout(30, TimeUnit.SECONDS)} or
     * {@code future.cancel(true)}. Once the returned future completes exceptionally before the
     * call finished, the worker thread is interrupted: no further attempt is sent and the
     * concurrency permit is returned. The per-attempt timeout in the settings only bounds
     * individual attempts.
     * <p>
     * Only the returned future is watched; timeouts applied to futures derived from it
     * (e.g. via {@code thenApply}) do not stop the call.
     *
     * @param request The request
     * @param decoder Decodes the body of a 2xx response
     * @param <T> The decoded type
     * @return A future completing with the response, or exceptionally with an {@link ApiClientException}
     */
    public <T> CompletableFuture<ApiResponse<T>> executeAsync(ApiRequest request, ResponseDecoder<T> decoder) {
        CompletableFuture<ApiResponse<T>> result = new CompletableFuture<>();
        AtomicBoolean workerFinished = new AtomicBoolean(false);
        Future<?> task = ASYNC_EXECUTOR.submit(() -> {
            try {
                ApiResponse<T> response = sendRequestWithRetry(request, decoder);
                workerFinished.set(true);
                result.complete(response);
            } catch (RuntimeException | Error e) {
                workerFinished.set(true);
                result.completeExceptionally(e);
            }
        });
        result.whenComplete((response, error) -> {
            if (error != null && !workerFinished.get() && !task.isDone()) {
                logger.debug("Async call for {} abandoned by caller, interrupting worker", request);
                task.cancel(true);
            }
        });
        return result;
    }

    /**
     * Runs the attempt loop of one logical request.
     *
     * @param request The request
     * @param decoder Decodes the body of a 2xx response
     * @param <T> The decoded type
     * @return The final response
     */
    protected <T> ApiResponse<T> sendRequestWithRetry(ApiRequest request, ResponseDecoder<T> decoder) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(decoder, "decoder");

        HttpMethod method = request.getMethod();
        URI uri = request.getUri();
        if (!settings.getAllowedMethods().contains(method)) {
            emit(Level.ERROR, "Method not allowed", "method", method, "url", uri);
            throw new InternalException("Method " + method + " not allowed");
        }

        emit(Level.INFO, "Request start", "method", method, "url", uri);

        Optional<String> body = serializeBody(request);
        Map<String, String> headers = mergeHeaders(request);
        int maxAttempts = settings.getMaxAttempts();
        BackoffPolicy backoffPolicy = BackoffPolicy.forSettings(settings);
        ResponseClassifier classifier = new ResponseClassifier(settings, method, backoffPolicy, retryAfterParser);

        ApiRequestExecutionContext context = new ApiRequestExecutionContext(gate.acquire());
        try {
            int attempt = 1;
            while (true) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new InternalException("Interrupted before attempt " + attempt + " of " + method + " " + uri);
                }
                if (attempt > 1) {
                    emit(Level.INFO, "Retry attempt", "url", uri, "attempt", attempt);
                }
                context.getDiagnostics().recordAttempt();

                AttemptResult result;
                try {
                    result = transport.send(new TransportRequest(method, uri, headers, body, settings.getTimeout()));
                } catch (IOException e) {
                    emit(Level.ERROR, "Network failure", "url", uri, "attempt", attempt, "error", e.toString());
                    context.getDiagnostics().recordError(e);

                    RetryDecision decision = classifier.classifyFailure(e, attempt, maxAttempts);
                    if (decision.getAction() == RetryDecision.Action.ABORT) {
                        throw new ApiTimeoutException("Attempt " + attempt + " for " + method + " " + uri
                                + " timed out after " + settings.getTimeout().map(Duration::toMillis).orElse(0L) + "ms", e);
                    }
                    if (decision.isRetry()) {
                        emit(Level.DEBUG, "Backing off", "url", uri, "attempt", attempt, "delay_ms", decision.getDelay().toMillis());
                        sleepBeforeNextAttempt(context, decision.getDelay(), uri);
                        attempt++;
                        continue;
                    }
                    throw new RetriesExhaustedException(context.getDiagnostics(), e);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new InternalException("Interrupted while waiting for " + method + " " + uri, e);
                } catch (IllegalArgumentException e) {
                    throw new InternalException("Request " + method + " " + uri + " could not be built: " + e.getMessage(), e);
                }

                RetryDecision decision = classifier.classify(result, attempt, maxAttempts, context.isExtensionUsed());
                if (decision.getAction() == RetryDecision.Action.ACCEPT) {
                    return decode(result, decoder, uri);
                }
                if (!decision.isRetry()) {
                    return ApiResponse.failure(result.body(), result.status(), result.headers());
                }

                context.getDiagnostics().recordStatus(result.status(), result.body());
                if (decision.getAction() == RetryDecision.Action.RETRY_WITH_SERVER_DELAY) {
                    if (decision.isFinalExtension()) {
                        context.markExtensionUsed();
                    }
                    emit(Level.INFO, "Respecting Retry-After header", "url", uri, "status", result.status(),
                            "retry_after_ms", decision.getDelay().toMillis(), "final_extension", decision.isFinalExtension());
                } else {
                    emit(Level.DEBUG, "Backing off", "url", uri, "status", result.status(),
                            "attempt", attempt, "delay_ms", decision.getDelay().toMillis());
                }
                sleepBeforeNextAttempt(context, decision.getDelay(), uri);
                attempt++;
            }
        } finally {
            context.releasePermit();
        }
    }

    /**
     * Sleeps before the next attempt. Waits shorter than the permit release threshold keep the
     * permit; longer waits hand it back, sleep, and then try for a bounded time to get one again.
     * If that fails the request continues without a permit instead of blocking.
     */
    private void sleepBeforeNextAttempt(ApiRequestExecutionContext context, Duration delay, URI uri) {
        if (delay.compareTo(settings.getPermitReleaseThreshold()) < 0) {
            applySleep(delay);
            return;
        }

        if (context.hasPermit()) {
            context.releasePermit();
            emit(Level.DEBUG, "Permit released for long wait", "url", uri, "delay_ms", delay.toMillis());
        }
        applySleep(delay);

        Optional<Permit> reacquired = gate.tryAcquire(settings.getPermitReacquireTimeout());
        if (reacquired.isPresent()) {
            context.replacePermit(reacquired.get());
        } else {
            emit(Level.DEBUG, "Permit re-acquire timed out", "url", uri,
                    "timeout_ms", settings.getPermitReacquireTimeout().toMillis());
        }
    }

    /**
     * Sleeps for the given delay. Subclasses may override this, e.g. to record delays in tests.
     *
     * @param delay The time to sleep
     * @throws InternalException if the thread is interrupted
     */
    protected void applySleep(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InternalException("Interrupted during backoff", e);
        }
    }

    private <T> ApiResponse<T> decode(AttemptResult result, ResponseDecoder<T> decoder, URI uri) {
        T data;
        try {
            data = decoder.decode(result.body());
        } catch (Exception e) {
            throw new ApiResponseUnusableException("JSON decode failed for " + uri + " (status " + result.status() + "): "
                    + e.getMessage(), result.status(), e);
        }
        return ApiResponse.success(data, result.status(), result.headers());
    }

    private Optional<String> serializeBody(ApiRequest request) {
        try {
            return request.getSerializedBody();
        } catch (JSONException | IllegalArgumentException e) {
            throw new InternalException("Request body of " + request + " is not JSON-serializable: " + e.getMessage(), e);
        }
    }

    private Map<String, String> mergeHeaders(ApiRequest request) {
        Map<String, String> merged = new LinkedHashMap<>(httpConfig.getGlobalHeaders());
        // request headers win, regardless of the case used for the name
        request.getHeaders().forEach((name, value) -> {
            merged.keySet().removeIf(name::equalsIgnoreCase);
            merged.put(name, value);
        });
        return merged;
    }

    private void emit(Level level, String message, Object... keyValues) {
        Map<String, Object> context = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            context.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        try {
            eventLogger.log(level, message, context);
        } catch (RuntimeException e) {
            if (eventLoggerFailureReported.compareAndSet(false, true)) {
                logger.warn("Request event logger failed; further failures of this logger are not reported", e);
            }
        }
    }

    // ---------------------------------------
    // Exceptions
    // ---------------------------------------

    /**
     * Base exception class for all errors that end a logical request.
     * <p>
     * Non-2xx responses are not reported through this hierarchy; they are returned as
     * {@link ApiResponse} with {@code success == false}.
     */
    public static class ApiClientException extends RuntimeException {
        /**
         * @param message The error message
         */
        public ApiClientException(String message) {
            super(message);
        }

        /**
         * @param message The error message
         * @param cause The underlying cause
         */
        public ApiClientException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Thrown when client settings are invalid.
     */
    public static class ConfigurationException extends ApiClientException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Thrown for failures inside the client that are not caused by the remote service: a method
     * outside the allowed set, a closed concurrency gate, an interrupted thread or a request that
     * cannot be built.
     */
    public static class InternalException extends ApiClientException {
        public InternalException(String message) {
            super(message);
        }

        public InternalException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Thrown when a request could not be completed at the HTTP level.
     */
    public static class HttpException extends ApiClientException {
        public HttpException(String message) {
            super(message);
        }

        public HttpException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Thrown when an attempt exceeded the per-attempt timeout and timeouts are not retried.
     */
    public static class ApiTimeoutException extends HttpException {
        public ApiTimeoutException(String message) {
            super(message);
        }

        public ApiTimeoutException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Thrown when a 2xx response body could not be decoded into the requested type.
     * Such a response is not considered transient and is never retried.
     */
    public static class ApiResponseUnusableException extends HttpException {
        private final int status;

        public ApiResponseUnusableException(String message, int status, Throwable cause) {
            super(message, cause);
            this.status = status;
        }

        /**
         * @return The 2xx status of the undecodable response
         */
        public int getStatus() {
            return status;
        }
    }

    /**
     * Thrown when network-level failures ended the request after the retry policy gave up.
     * The message combines the last status seen, the last error body snippet, the number of
     * attempts and the last error; the cause is the last error.
     */
    public static class RetriesExhaustedException extends HttpException {
        private final Integer lastStatus;
        private final String lastBodySnippet;
        private final int attempts;

        public RetriesExhaustedException(DiagnosticsAccumulator diagnostics, Throwable lastError) {
            super(diagnostics.describe(), lastError);
            this.lastStatus = diagnostics.getLastStatus().isPresent() ? diagnostics.getLastStatus().getAsInt() : null;
            this.lastBodySnippet = diagnostics.getLastBodySnippet().orElse(null);
            this.attempts = diagnostics.getAttempts();
        }

        /**
         * @return The last HTTP status observed before the failures, if any attempt got a response
         */
        public OptionalInt getLastStatus() {
            return lastStatus == null ? OptionalInt.empty() : OptionalInt.of(lastStatus);
        }

        public Optional<String> getLastBodySnippet() {
            return Optional.ofNullable(lastBodySnippet);
        }

        public int getAttempts() {
            return attempts;
        }
    }
}
