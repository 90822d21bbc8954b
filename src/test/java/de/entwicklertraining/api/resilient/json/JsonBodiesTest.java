package de.entwicklertraining.api.resilient.json;

import org.json.JSONArray;
import org.json.JSONObject;
import org.json.JSONString;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class JsonBodiesTest {

    public static class Order {
        public String getSymbol() {
            return "AAPL";
        }

        public int getQty() {
            return 10;
        }
    }

    @Test
    void testStringsArePassedThrough() {
        assertEquals("{\"raw\":true}", JsonBodies.serialize("{\"raw\":true}"));
    }

    @Test
    void testStructuredValues() {
        assertEquals("{\"a\":1}", JsonBodies.serialize(new JSONObject().put("a", 1)));
        assertEquals("[1,\"x\"]", JsonBodies.serialize(new JSONArray().put(1).put("x")));
        assertEquals("{\"k\":\"v\"}", JsonBodies.serialize(Map.of("k", "v")));
        assertEquals("[\"a\",\"b\"]", JsonBodies.serialize(List.of("a", "b")));
        assertEquals("[1,2]", JsonBodies.serialize(new int[] {1, 2}));
        assertEquals("42", JsonBodies.serialize(42));
        assertEquals("true", JsonBodies.serialize(Boolean.TRUE));
    }

    @Test
    void testJsonStringRendersItself() {
        JSONString custom = () -> "{\"custom\":1}";

        assertEquals("{\"custom\":1}", JsonBodies.serialize(custom));
    }

    @Test
    void testBeanGettersBecomeMembers() {
        JSONObject json = new JSONObject(JsonBodies.serialize(new Order()));

        assertTrue(json.similar(new JSONObject().put("symbol", "AAPL").put("qty", 10)));
    }

    @Test
    void testNullBodyIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> JsonBodies.serialize(null));
    }
}
