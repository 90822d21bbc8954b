package de.entwicklertraining.api.resilient.json;

import java.util.Objects;
import java.util.function.Function;
import org.json.JSONArray;
import org.json.JSONObject;
import org.json.JSONTokener;

/**
 * Stock {@link ResponseDecoder}s built on org.json.
 * <p>
 * Example:
 * <pre>
 * ResponseDecoder&lt;Quote&gt; quotes = ResponseDecoders.json(o -&gt; new Quote(o.getString("symbol"), o.getDouble("last")));
 * </pre>
 */
public final class ResponseDecoders {

    private ResponseDecoders() {
    }

    /**
     * @return A decoder requiring the body to be a JSON object
     */
    public static ResponseDecoder<JSONObject> jsonObject() {
        return JSONObject::new;
    }

    /**
     * @return A decoder requiring the body to be a JSON array
     */
    public static ResponseDecoder<JSONArray> jsonArray() {
        return JSONArray::new;
    }

    /**
     * Decodes any JSON value: objects, arrays, strings, numbers, booleans or {@code null}.
     * An empty body is rejected.
     *
     * @return A decoder returning {@link JSONObject}, {@link JSONArray}, {@link String},
     *         {@link Number}, {@link Boolean} or {@link JSONObject#NULL}
     */
    public static ResponseDecoder<Object> jsonValue() {
        return body -> {
            JSONTokener tokener = new JSONTokener(body);
            Object value = tokener.nextValue();
            if (tokener.nextClean() != 0) {
                throw tokener.syntaxError("Unexpected content after JSON value");
            }
            return value;
        };
    }

    /**
     * Parses the body as a JSON object and maps it to the caller's type.
     *
     * @param mapper Maps the parsed object; exceptions it throws count as decode failures
     * @param <T> The target type
     * @return The decoder
     */
    public static <T> ResponseDecoder<T> json(Function<JSONObject, T> mapper) {
        Objects.requireNonNull(mapper, "mapper");
        return body -> mapper.apply(new JSONObject(body));
    }

    /**
     * @return A decoder returning the body text unchanged
     */
    public static ResponseDecoder<String> text() {
        return body -> body;
    }

    /**
     * Ignores the body, e.g. for HEAD requests.
     *
     * @return A decoder that always returns null
     */
    public static ResponseDecoder<Void> discard() {
        return body -> null;
    }
}
