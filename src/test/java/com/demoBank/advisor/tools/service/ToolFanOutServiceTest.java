package com.demoBank.advisor.tools.service;

import com.demoBank.advisor.config.ToolGatewaySettings;
import com.demoBank.advisor.tools.exception.ToolInvocationException;
import com.demoBank.advisor.tools.model.FanOutResult;
import com.demoBank.advisor.tools.model.ToolName;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("ToolFanOutService")
class ToolFanOutServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private ToolGatewayClient gatewayClient;
    private ToolNameResolver nameResolver;

    @BeforeEach
    void setUp() {
        gatewayClient = mock(ToolGatewayClient.class);
        nameResolver = mock(ToolNameResolver.class);
        when(nameResolver.resolve(anyString(), any(), anyString())).thenAnswer(invocation -> invocation.getArgument(0));
    }

    private static ToolGatewaySettings settings(String gatewayUrl, boolean useLocalMocks, Duration fanOutTimeout) {
        return new ToolGatewaySettings(gatewayUrl, "", "", true, 4, fanOutTimeout, Duration.ofSeconds(1), 0,
                Duration.ofMillis(10), useLocalMocks);
    }

    private Map<ToolName, ObjectNode> arguments(ToolName... tools) {
        Map<ToolName, ObjectNode> arguments = new LinkedHashMap<>();
        for (ToolName tool : tools) {
            arguments.put(tool, objectMapper.createObjectNode().put("user_id", "user-42"));
        }
        return arguments;
    }

    @Nested
    @DisplayName("remote gateway")
    class RemoteGateway {

        @Test
        @DisplayName("isolates a failing tool and keeps the other outputs")
        void partialFailure() {
            ToolFanOutService service = new ToolFanOutService(settings("https://tools.example.com", false,
                    Duration.ofSeconds(5)), gatewayClient, nameResolver, new LocalToolMocks());
            JsonNode spend = objectMapper.createObjectNode().put("total_spend", 1_000_000);
            JsonNode risk = objectMapper.createObjectNode().put("risk_band", "low");
            when(gatewayClient.callTool(eq("spend_analytics_v1"), any(), any(), anyString())).thenReturn(spend);
            when(gatewayClient.callTool(eq("anomaly_signals_v1"), any(), any(), anyString()))
                    .thenThrow(new ToolInvocationException("http_5xx", "HTTP 503", true));
            when(gatewayClient.callTool(eq("risk_profile_non_investment_v1"), any(), any(), anyString())).thenReturn(risk);

            FanOutResult result = service.execute(arguments(ToolName.SPEND_ANALYTICS, ToolName.ANOMALY_SIGNALS,
                    ToolName.RISK_PROFILE_NON_INVESTMENT), "Bearer token", "trc_fanout01");

            assertEquals(2, result.outputs().size());
            assertEquals(spend, result.outputs().get(ToolName.SPEND_ANALYTICS));
            assertEquals("http_5xx", result.errors().get(ToolName.ANOMALY_SIGNALS).errorKind());
            assertEquals(List.of("tool_error:anomaly_signals_v1"), result.reasonCodes());
        }

        @Test
        @DisplayName("turns a tool that misses the fan-out deadline into a timeout error")
        void timeout() {
            ToolFanOutService service = new ToolFanOutService(settings("https://tools.example.com", false,
                    Duration.ofMillis(200)), gatewayClient, nameResolver, new LocalToolMocks());
            when(gatewayClient.callTool(eq("spend_analytics_v1"), any(), any(), anyString()))
                    .thenReturn(objectMapper.createObjectNode());
            when(gatewayClient.callTool(eq("cashflow_forecast_v1"), any(), any(), anyString())).thenAnswer(invocation -> {
                Thread.sleep(5_000);
                return objectMapper.createObjectNode();
            });

            FanOutResult result = service.execute(arguments(ToolName.SPEND_ANALYTICS, ToolName.CASHFLOW_FORECAST),
                    null, "trc_fanout02");

            assertTrue(result.outputs().containsKey(ToolName.SPEND_ANALYTICS));
            assertEquals("timeout", result.errors().get(ToolName.CASHFLOW_FORECAST).errorKind());
        }

        @Test
        @DisplayName("returns an empty result for an empty bundle")
        void emptyBundle() {
            ToolFanOutService service = new ToolFanOutService(settings("https://tools.example.com", false,
                    Duration.ofSeconds(1)), gatewayClient, nameResolver, new LocalToolMocks());

            FanOutResult result = service.execute(Map.of(), null, "trc_fanout03");

            assertTrue(result.outputs().isEmpty());
            assertTrue(result.errors().isEmpty());
        }
    }

    @Nested
    @DisplayName("local mocks")
    class LocalMocks {

        private ToolFanOutService service;

        @BeforeEach
        void setUp() {
            service = new ToolFanOutService(settings("http://localhost:8000", true, Duration.ofSeconds(5)),
                    gatewayClient, nameResolver, new LocalToolMocks());
        }

        @Test
        @DisplayName("serves canned outputs without touching the gateway")
        void cannedOutputs() {
            FanOutResult result = service.execute(arguments(ToolName.SPEND_ANALYTICS, ToolName.ANOMALY_SIGNALS),
                    null, "trc_mock0001");

            assertEquals(2, result.outputs().size());
            assertEquals("user-42", result.outputs().get(ToolName.SPEND_ANALYTICS).path("user_id").asText());
            assertTrue(result.outputs().get(ToolName.ANOMALY_SIGNALS).path("flags").isArray());
            verify(gatewayClient, never()).callTool(anyString(), any(), any(), anyString());
        }

        @Test
        @DisplayName("the guard mock denies an invest execution request")
        void guardDeniesExecution() {
            ObjectNode args = objectMapper.createObjectNode()
                    .put("user_id", "user-42")
                    .put("intent", "invest")
                    .put("requested_action", "buy");

            FanOutResult result = service.executeSingle(ToolName.SUITABILITY_GUARD, args, null, "trc_mock0002");

            JsonNode output = result.outputs().get(ToolName.SUITABILITY_GUARD);
            assertFalse(output.path("allow").asBoolean());
            assertEquals("deny_execution", output.path("decision").asText());
        }
    }
}
