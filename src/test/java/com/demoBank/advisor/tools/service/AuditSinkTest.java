package com.demoBank.advisor.tools.service;

import com.demoBank.advisor.config.ToolGatewaySettings;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AuditSink")
class AuditSinkTest {

    private static AuditSink sink(String backendUrl) {
        ToolGatewaySettings settings = new ToolGatewaySettings("https://tools.example.com", backendUrl, "", true, 4,
                Duration.ofSeconds(5), Duration.ofSeconds(1), 0, Duration.ofMillis(10), false);
        return new AuditSink(settings, new ObjectMapper());
    }

    private static Map<String, Object> payload(String intent) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("intent", intent);
        payload.put("tool_calls", List.of("spend_analytics_v1"));
        payload.put("response_length", 120);
        return payload;
    }

    @Test
    @DisplayName("records locally without a backend and returns a stable fingerprint")
    void localFingerprint() {
        AuditSink sink = sink("");

        String first = sink.write("user-1", "trc_00000001", payload("summary"), null);
        String second = sink.write("user-1", "trc_00000002", payload("summary"), null);

        assertTrue(first.matches("[0-9a-f]{16}"));
        assertEquals(first, second);
        assertNotEquals(first, sink.write("user-1", "trc_00000003", payload("risk"), null));
    }

    @Test
    @DisplayName("a failing backend never breaks the turn")
    void backendFailureIsContained() {
        AuditSink sink = sink("http://127.0.0.1:1/");

        String fingerprint = assertDoesNotThrow(
                () -> sink.write("user-1", "trc_00000001", payload("summary"), "token"));

        assertEquals(sink("").fingerprint(payload("summary")), fingerprint);
    }
}
