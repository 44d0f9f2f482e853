package com.signalrelay.core.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JsonUtilsTest {

    @Test
    void parsesObject() throws JsonProcessingException {
        JsonNode node = JsonUtils.parseTree("{\"type\":\"offer\",\"sdp\":\"v=0\"}");

        assertTrue(node.isObject());
        assertEquals("offer", node.get("type").asText());
    }

    @Test
    void parsesScalarsAsNonObjects() throws JsonProcessingException {
        assertFalse(JsonUtils.parseTree("42").isObject());
        assertFalse(JsonUtils.parseTree("[1,2]").isObject());
    }

    @Test
    void rejectsEmptyInput() {
        assertThrows(JsonProcessingException.class, () -> JsonUtils.parseTree(""));
        assertThrows(JsonProcessingException.class, () -> JsonUtils.parseTree("   "));
    }

    @Test
    void rejectsMalformedAndTrailingContent() {
        assertThrows(JsonProcessingException.class, () -> JsonUtils.parseTree("{type:"));
        assertThrows(JsonProcessingException.class, () -> JsonUtils.parseTree("{\"type\":\"a\"} trailing"));
    }

    @Test
    void utf8LengthCountsEncodedBytes() {
        assertEquals(0, BytesUtils.utf8Length(null));
        assertEquals(3, BytesUtils.utf8Length("abc"));
        assertEquals(2, BytesUtils.utf8Length("é"));
    }
}
