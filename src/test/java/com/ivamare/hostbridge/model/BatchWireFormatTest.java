package com.ivamare.hostbridge.model;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BatchWireFormatTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    @Test
    void callShouldSerializeCommandAsCmd() throws Exception {
        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(new Call("1", "get_version", null)));

        assertEquals("1", json.get("id").asText());
        assertEquals("get_version", json.get("cmd").asText());
        assertTrue(json.get("args").isObject());
        assertEquals(0, json.get("args").size());
    }

    @Test
    void callShouldRejectMissingIdOrCommand() {
        assertThrows(NullPointerException.class, () -> new Call(null, "get_version", Map.of()));
        assertThrows(NullPointerException.class, () -> new Call("1", null, Map.of()));
    }

    @Test
    void callArgsShouldBeImmutable() {
        Call call = new Call("1", "echo", Map.of("value", 1));

        assertThrows(UnsupportedOperationException.class, () -> call.args().put("other", 2));
    }

    @Test
    void batchResultsShouldParseFromHostResponse() throws Exception {
        String response = """
            [
              {"id": "2", "status": "error", "error": "not found"},
              {"id": "1", "status": "ok", "data": {"theme": "dark"}}
            ]
            """;

        List<BatchResult> results = objectMapper.readValue(response, new TypeReference<>() {});

        assertEquals(BatchResult.error("2", "not found"), results.get(0));
        assertEquals(BatchResult.ok("1", Map.of("theme", "dark")), results.get(1));
        assertFalse(results.get(0).isOk());
        assertTrue(results.get(1).isOk());
    }

    @Test
    void batchResultShouldOmitAbsentFields() throws Exception {
        JsonNode json = objectMapper.valueToTree(BatchResult.ok("1", "1.0.0"));

        assertEquals("ok", json.get("status").asText());
        assertFalse(json.has("error"));
        assertFalse(json.has("ok"));
    }
}
