package de.entwicklertraining.api.resilient;

import java.net.http.HttpHeaders;
import java.util.Objects;
import java.util.Optional;

/**
 * The result of a logical request that completed, successfully or not.
 * <p>
 * Callers have to look at two layers: {@link ApiClient#execute} either throws an
 * {@link ApiClient.ApiClientException} (the call could not be completed at all) or returns an
 * {@code ApiResponse}. The response then tells through {@link #isSuccess()} whether the server
 * answered with 2xx. A non-2xx answer that remained after the retry policy is <em>not</em> an
 * exception: it arrives here with {@code success == false}, its status and the error body,
 * for the adapter to interpret.
 *
 * <pre>
 * ApiResponse&lt;JSONObject&gt; response = client.get(url, ResponseDecoders.jsonObject());
 * if (!response.isSuccess()) {
 *     throw new MarketDataUnavailable(response.getStatus(), response.getErrorBody().orElse(""));
 * }
 * JSONObject quote = response.getData().orElseThrow();
 * </pre>
 *
 * @param <T> The type of the decoded body
 */
public final class ApiResponse<T> {

    private final T data;
    private final String errorBody;
    private final int status;
    private final boolean success;
    private final HttpHeaders headers;

    private ApiResponse(T data, String errorBody, int status, boolean success, HttpHeaders headers) {
        this.data = data;
        this.errorBody = errorBody;
        this.status = status;
        this.success = success;
        this.headers = Objects.requireNonNull(headers, "headers");
    }

    /**
     * Creates a successful response.
     *
     * @param data The decoded body, may be null
     * @param status The 2xx status
     * @param headers The response headers
     * @param <T> The type of the decoded body
     * @return A response with {@code success == true}
     */
    public static <T> ApiResponse<T> success(T data, int status, HttpHeaders headers) {
        return new ApiResponse<>(data, null, status, true, headers);
    }

    /**
     * Creates an unsuccessful response.
     *
     * @param errorBody The response body; empty bodies are stored as absent
     * @param status The non-2xx status
     * @param headers The response headers
     * @param <T> The type a successful body would have had
     * @return A response with {@code success == false}
     */
    public static <T> ApiResponse<T> failure(String errorBody, int status, HttpHeaders headers) {
        String body = errorBody == null || errorBody.isEmpty() ? null : errorBody;
        return new ApiResponse<>(null, body, status, false, headers);
    }

    /**
     * @return The decoded body of a successful response; empty for failures and body-less responses
     */
    public Optional<T> getData() {
        return Optional.ofNullable(data);
    }

    /**
     * @return The raw body of an unsuccessful response, if it had one
     */
    public Optional<String> getErrorBody() {
        return Optional.ofNullable(errorBody);
    }

    public int getStatus() {
        return status;
    }

    /**
     * @return true if the final attempt returned 2xx and its body was decoded
     */
    public boolean isSuccess() {
        return success;
    }

    public HttpHeaders getHeaders() {
        return headers;
    }

    @Override
    public String toString() {
        return "ApiResponse{status=" + status + ", success=" + success
                + (errorBody != null ? ", errorBody=" + errorBody : "") + "}";
    }
}
