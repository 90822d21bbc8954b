package de.entwicklertraining.api.resilient.json;

/**
 * Turns the body of a 2xx response into the caller's target type.
 * <p>
 * Any exception thrown here makes the call fail with
 * {@link de.entwicklertraining.api.resilient.ApiClient.ApiResponseUnusableException}; a body that
 * cannot be decoded is not treated as transient and is never retried.
 * Returning null is allowed and yields a response without data.
 *
 * @param <T> The decoded type
 * @see ResponseDecoders
 */
@FunctionalInterface
public interface ResponseDecoder<T> {

    /**
     * @param body The complete response body
     * @return The decoded value, or null if the body carries none
     * @throws Exception if the body does not match the expected shape
     */
    T decode(String body) throws Exception;
}
