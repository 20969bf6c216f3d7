package com.demoBank.advisor.tools.service;

import com.demoBank.advisor.config.ToolGatewaySettings;
import com.demoBank.advisor.tools.exception.ToolInvocationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.core.IntervalFunction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.test.web.client.ResponseCreator;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.ExpectedCount.once;
import static org.springframework.test.web.client.ExpectedCount.times;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("ToolGatewayClient")
class ToolGatewayClientTest {

    private static final String ENDPOINT = "http://gateway.test/mcp";
    private static final String TRACE_ID = "trc_gw000001";
    private static final String SPEND_RESULT = """
            {"jsonrpc":"2.0","id":"1","result":{"content":[{"type":"text","text":"{\\"total_spend\\": 1200000}"}]}}
            """;

    private MockRestServiceServer server;
    private ToolGatewayClient client;

    private static ToolGatewaySettings settings(int maxRetries, Duration backoff) {
        return new ToolGatewaySettings("http://gateway.test", "", "", false, 4,
                Duration.ofSeconds(5), Duration.ofSeconds(2), maxRetries, backoff, false);
    }

    private static ResponseCreator connectionRefused() {
        return request -> {
            throw new IOException("Connection refused");
        };
    }

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new ToolGatewayClient(settings(2, Duration.ofMillis(1)), new ObjectMapper(), builder);
    }

    @Nested
    @DisplayName("transient failures")
    class TransientFailures {

        @Test
        @DisplayName("retries a 5xx and returns the output of the next attempt")
        void retriesServerError() {
            server.expect(once(), requestTo(ENDPOINT)).andRespond(withServerError());
            server.expect(once(), requestTo(ENDPOINT))
                    .andRespond(withSuccess(SPEND_RESULT, MediaType.APPLICATION_JSON));

            JsonNode output = client.callTool("finance___spend_analytics_v1", Map.of("user_id", "u-1"), "tok", TRACE_ID);

            assertEquals(1_200_000, output.path("total_spend").asLong());
            server.verify();
        }

        @Test
        @DisplayName("retries a connection error")
        void retriesConnectionError() {
            server.expect(once(), requestTo(ENDPOINT)).andRespond(connectionRefused());
            server.expect(once(), requestTo(ENDPOINT))
                    .andRespond(withSuccess(SPEND_RESULT, MediaType.APPLICATION_JSON));

            JsonNode output = client.callTool("spend_analytics_v1", Map.of(), null, TRACE_ID);

            assertTrue(output.has("total_spend"));
            server.verify();
        }

        @Test
        @DisplayName("stops after retries + 1 attempts and reports the last failure")
        void boundedAttempts() {
            server.expect(times(3), requestTo(ENDPOINT)).andRespond(withServerError());

            ToolInvocationException failure = assertThrows(ToolInvocationException.class,
                    () -> client.callTool("spend_analytics_v1", Map.of(), "tok", TRACE_ID));

            assertEquals("http_5xx", failure.getErrorKind());
            assertTrue(failure.isTransientFailure());
            server.verify();
        }
    }

    @Nested
    @DisplayName("permanent failures")
    class PermanentFailures {

        @Test
        @DisplayName("does not retry a 4xx")
        void noRetryOnClientError() {
            server.expect(once(), requestTo(ENDPOINT)).andRespond(withStatus(HttpStatus.UNPROCESSABLE_ENTITY));

            ToolInvocationException failure = assertThrows(ToolInvocationException.class,
                    () -> client.callTool("spend_analytics_v1", Map.of(), "tok", TRACE_ID));

            assertEquals("http_4xx", failure.getErrorKind());
            assertFalse(failure.isTransientFailure());
            server.verify();
        }

        @Test
        @DisplayName("does not retry a JSON-RPC error")
        void noRetryOnRpcError() {
            server.expect(once(), requestTo(ENDPOINT)).andRespond(withSuccess(
                    "{\"jsonrpc\":\"2.0\",\"id\":\"1\",\"error\":{\"code\":-32602,\"message\":\"Invalid params\"}}",
                    MediaType.APPLICATION_JSON));

            ToolInvocationException failure = assertThrows(ToolInvocationException.class,
                    () -> client.callTool("spend_analytics_v1", Map.of(), "tok", TRACE_ID));

            assertEquals("rpc_error", failure.getErrorKind());
            assertTrue(failure.getMessage().contains("-32602"));
            server.verify();
        }

        @Test
        @DisplayName("rejects text content that is not a JSON object")
        void invalidOutput() {
            server.expect(once(), requestTo(ENDPOINT)).andRespond(withSuccess(
                    "{\"jsonrpc\":\"2.0\",\"id\":\"1\",\"result\":{\"content\":[{\"type\":\"text\",\"text\":\"not json\"}]}}",
                    MediaType.APPLICATION_JSON));

            ToolInvocationException failure = assertThrows(ToolInvocationException.class,
                    () -> client.callTool("spend_analytics_v1", Map.of(), "tok", TRACE_ID));

            assertEquals("invalid_output", failure.getErrorKind());
            server.verify();
        }
    }

    @Test
    @DisplayName("posts with the caller's bearer token")
    void bearerHeader() {
        server.expect(once(), requestTo(ENDPOINT))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer tok-123"))
                .andRespond(withSuccess(SPEND_RESULT, MediaType.APPLICATION_JSON));

        client.callTool("spend_analytics_v1", Map.of(), "tok-123", TRACE_ID);

        server.verify();
    }

    @Test
    @DisplayName("lists the gateway's tool names")
    void listTools() {
        server.expect(once(), requestTo(ENDPOINT)).andRespond(withSuccess(
                "{\"jsonrpc\":\"2.0\",\"id\":\"1\",\"result\":{\"tools\":[{\"name\":\"finance___spend_analytics_v1\"},"
                        + "{\"name\":\"finance___anomaly_signals_v1\"},{\"name\":\"\"}]}}",
                MediaType.APPLICATION_JSON));

        List<String> names = client.listTools("tok", TRACE_ID);

        assertEquals(List.of("finance___spend_analytics_v1", "finance___anomaly_signals_v1"), names);
    }

    @Test
    @DisplayName("doubles the backoff on every retry and allows retries + 1 attempts")
    void backoffPolicy() {
        ToolGatewaySettings settings = settings(2, Duration.ofMillis(200));
        IntervalFunction backoff = ToolGatewayClient.backoff(settings);

        assertEquals(List.of(200L, 400L, 800L), List.of(backoff.apply(1), backoff.apply(2), backoff.apply(3)));
        assertEquals(3, ToolGatewayClient.retryConfig(settings).getMaxAttempts());
    }

    @Test
    @DisplayName("renders bearer tokens once")
    void bearerPrefix() {
        assertEquals("Bearer abc", ToolGatewayClient.bearer("abc"));
        assertEquals("Bearer abc", ToolGatewayClient.bearer("Bearer abc"));
        assertNull(ToolGatewayClient.bearer("  "));
    }
}
