package de.entwicklertraining.api.resilient.json;

import java.util.Collection;
import java.util.Map;
import org.json.JSONArray;
import org.json.JSONObject;
import org.json.JSONString;

/**
 * Serializes request bodies to JSON text with org.json.
 */
public final class JsonBodies {

    private JsonBodies() {
    }

    /**
     * Serializes a body.
     * <ul>
     *   <li>{@link JSONObject}, {@link JSONArray} and {@link JSONString} render themselves.</li>
     *   <li>A {@link String} is taken as JSON text that is already serialized and sent as is.</li>
     *   <li>Maps become objects, collections and arrays become arrays.</li>
     *   <li>Numbers and booleans are written as JSON literals.</li>
     *   <li>Any other object is treated as a bean; its getters become object members.</li>
     * </ul>
     *
     * @param body The body, must not be null
     * @return The JSON text
     * @throws org.json.JSONException if the value cannot be represented as JSON
     */
    public static String serialize(Object body) {
        if (body == null) {
            throw new IllegalArgumentException("JSON body cannot be null; omit the body instead");
        }
        if (body instanceof String text) {
            return text;
        }
        if (body instanceof JSONObject || body instanceof JSONArray) {
            return body.toString();
        }
        if (body instanceof JSONString jsonString) {
            return jsonString.toJSONString();
        }
        if (body instanceof Map<?, ?> map) {
            return new JSONObject(map).toString();
        }
        if (body instanceof Collection<?> collection) {
            return new JSONArray(collection).toString();
        }
        if (body.getClass().isArray()) {
            return new JSONArray(body).toString();
        }
        if (body instanceof Number || body instanceof Boolean) {
            return JSONObject.valueToString(body);
        }
        return new JSONObject(body).toString();
    }
}
