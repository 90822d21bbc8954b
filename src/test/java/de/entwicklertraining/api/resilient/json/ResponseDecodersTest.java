package de.entwicklertraining.api.resilient.json;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ResponseDecodersTest {

    private record Quote(String symbol, double last) {
    }

    @Test
    void testJsonObjectAndArray() throws Exception {
        JSONObject object = ResponseDecoders.jsonObject().decode("{\"a\":[1,2]}");
        JSONArray array = ResponseDecoders.jsonArray().decode("[{\"a\":1}]");

        assertEquals(2, object.getJSONArray("a").length());
        assertEquals(1, array.getJSONObject(0).getInt("a"));
    }

    @Test
    void testWrongShapeFails() {
        assertThrows(JSONException.class, () -> ResponseDecoders.jsonObject().decode("[1]"));
        assertThrows(JSONException.class, () -> ResponseDecoders.jsonArray().decode("{}"));
        assertThrows(JSONException.class, () -> ResponseDecoders.jsonObject().decode(""));
    }

    @Test
    void testMappedDecoder() throws Exception {
        ResponseDecoder<Quote> decoder = ResponseDecoders.json(o -> new Quote(o.getString("symbol"), o.getDouble("last")));

        Quote quote = decoder.decode("{\"symbol\":\"MSFT\",\"last\":411.2}");

        assertEquals(new Quote("MSFT", 411.2), quote);
        assertThrows(JSONException.class, () -> decoder.decode("{\"symbol\":\"MSFT\"}"));
    }

    @Test
    void testJsonValueAcceptsScalarsAndRejectsTrailingContent() throws Exception {
        assertEquals(5, ResponseDecoders.jsonValue().decode("5"));
        assertEquals("x", ResponseDecoders.jsonValue().decode("\"x\""));
        assertEquals(JSONObject.NULL, ResponseDecoders.jsonValue().decode("null"));
        assertInstanceOf(JSONArray.class, ResponseDecoders.jsonValue().decode(" [] "));
        assertThrows(JSONException.class, () -> ResponseDecoders.jsonValue().decode("{} {}"));
    }

    @Test
    void testTextAndDiscard() throws Exception {
        assertEquals("plain", ResponseDecoders.text().decode("plain"));
        assertNull(ResponseDecoders.discard().decode("ignored"));
    }
}
