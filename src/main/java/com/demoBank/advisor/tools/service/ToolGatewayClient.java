package com.demoBank.advisor.tools.service;

import com.demoBank.advisor.config.ToolGatewaySettings;
import com.demoBank.advisor.tools.dto.JsonRpcRequest;
import com.demoBank.advisor.tools.dto.JsonRpcResponse;
import com.demoBank.advisor.tools.exception.ToolInvocationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Client for the JSON-RPC tool gateway.
 *
 * Responsibilities:
 * - Send tools/call and tools/list requests with the caller's bearer token
 * - Map transport, HTTP and RPC failures to error kinds
 * - Retry transient failures (connection errors, 5xx) with exponential backoff
 */
@Slf4j
@Service
public class ToolGatewayClient {

    private static final String BEARER_PREFIX = "Bearer ";

    private final ToolGatewaySettings settings;
    private final ObjectMapper objectMapper;
    private final RestClient restClient;
    private final RetryConfig retryConfig;

    @Autowired
    public ToolGatewayClient(ToolGatewaySettings settings, ObjectMapper objectMapper) {
        this(settings, objectMapper, RestClient.builder().requestFactory(requestFactory(settings)));
    }

    ToolGatewayClient(ToolGatewaySettings settings, ObjectMapper objectMapper, RestClient.Builder restClientBuilder) {
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.restClient = restClientBuilder
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
        this.retryConfig = retryConfig(settings);
    }

    private static SimpleClientHttpRequestFactory requestFactory(ToolGatewaySettings settings) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) settings.callTimeout().toMillis());
        requestFactory.setReadTimeout((int) settings.callTimeout().toMillis());
        return requestFactory;
    }

    /**
     * Retries transient failures only (connection errors, 5xx); 4xx, RPC errors and unreadable output fail at once.
     */
    static RetryConfig retryConfig(ToolGatewaySettings settings) {
        return RetryConfig.custom()
                .maxAttempts(settings.maxRetries() + 1)
                .intervalFunction(backoff(settings))
                .retryOnException(e -> e instanceof ToolInvocationException failure && failure.isTransientFailure())
                .build();
    }

    static IntervalFunction backoff(ToolGatewaySettings settings) {
        return IntervalFunction.ofExponentialBackoff(settings.retryBackoff(), 2);
    }

    /**
     * Calls one tool and returns its output object.
     *
     * @param resolvedName gateway-side tool name
     * @param arguments    call arguments
     * @param authToken    caller token, with or without the "Bearer " prefix
     * @param traceId      trace id for logging
     * @return the output object parsed from the first content text
     * @throws ToolInvocationException when the call fails after retries or the output is not a JSON object
     */
    public JsonNode callTool(String resolvedName, Object arguments, String authToken, String traceId) {
        JsonRpcResponse response = callToolRaw(resolvedName, arguments, authToken, traceId);

        String text = response.firstContentText();
        if (text == null || text.isBlank()) {
            throw new ToolInvocationException("invalid_output", "Tool returned no text content: " + resolvedName, false);
        }
        JsonNode output;
        try {
            output = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new ToolInvocationException("invalid_output", "Tool output is not JSON: " + resolvedName, false, e);
        }
        if (output == null || !output.isObject()) {
            throw new ToolInvocationException("invalid_output", "Tool output is not an object: " + resolvedName, false);
        }
        return output;
    }

    /**
     * Calls one tool and returns the raw JSON-RPC response, for tools whose result is not a single JSON object.
     *
     * @throws ToolInvocationException when the call fails after retries
     */
    public JsonRpcResponse callToolRaw(String resolvedName, Object arguments, String authToken, String traceId) {
        return sendWithRetry(JsonRpcRequest.toolsCall(UUID.randomUUID().toString(), resolvedName, arguments),
                authToken, traceId, resolvedName);
    }

    /**
     * Lists the tool names the gateway exposes.
     *
     * @throws ToolInvocationException when the listing fails
     */
    public List<String> listTools(String authToken, String traceId) {
        JsonRpcResponse response = sendWithRetry(
                JsonRpcRequest.toolsList(UUID.randomUUID().toString()), authToken, traceId, "tools/list");

        List<String> names = new ArrayList<>();
        JsonNode tools = response.getResult() == null ? null : response.getResult().path("tools");
        if (tools != null && tools.isArray()) {
            for (JsonNode tool : tools) {
                String name = tool.path("name").asText("");
                if (!name.isBlank()) {
                    names.add(name);
                }
            }
        }
        return names;
    }

    private JsonRpcResponse sendWithRetry(JsonRpcRequest request, String authToken, String traceId, String label) {
        Retry retry = Retry.of("tool-gateway:" + label, retryConfig);
        retry.getEventPublisher().onRetry(event ->
                log.debug("Retrying tool gateway call - traceId: {}, tool: {}, attempt: {}, backoffMs: {}",
                        traceId, label, event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis()));

        AtomicInteger attempts = new AtomicInteger();
        try {
            return Retry.decorateSupplier(retry, () -> {
                attempts.incrementAndGet();
                return send(request, authToken);
            }).get();
        } catch (ToolInvocationException e) {
            log.warn("Tool gateway call failed - traceId: {}, tool: {}, kind: {}, attempts: {}",
                    traceId, label, e.getErrorKind(), attempts.get());
            throw e;
        }
    }

    private JsonRpcResponse send(JsonRpcRequest request, String authToken) {
        String endpoint = settings.mcpEndpoint();
        if (endpoint.isEmpty()) {
            throw new ToolInvocationException("transport", "Tool gateway URL is not configured", false);
        }

        JsonRpcResponse response;
        try {
            RestClient.RequestBodySpec spec = restClient.post().uri(endpoint);
            String bearer = bearer(authToken);
            if (bearer != null) {
                spec = spec.header(HttpHeaders.AUTHORIZATION, bearer);
            }
            response = spec.body(request)
                    .retrieve()
                    .onStatus(status -> status.is5xxServerError(), (req, res) -> {
                        throw new ToolInvocationException("http_5xx",
                                "Tool gateway returned " + res.getStatusCode().value(), true);
                    })
                    .onStatus(status -> status.is4xxClientError(), (req, res) -> {
                        throw new ToolInvocationException("http_4xx",
                                "Tool gateway returned " + res.getStatusCode().value(), false);
                    })
                    .body(JsonRpcResponse.class);
        } catch (ToolInvocationException e) {
            throw e;
        } catch (ResourceAccessException e) {
            throw new ToolInvocationException("transport", "Tool gateway unreachable: " + e.getMessage(), true, e);
        } catch (Exception e) {
            throw new ToolInvocationException("invalid_output", "Tool gateway response unreadable: " + e.getMessage(),
                    false, e);
        }

        if (response == null) {
            throw new ToolInvocationException("invalid_output", "Tool gateway returned an empty body", false);
        }
        if (response.hasError()) {
            throw new ToolInvocationException("rpc_error",
                    "RPC error " + response.getError().getCode() + ": " + response.getError().getMessage(), false);
        }
        return response;
    }

    static String bearer(String authToken) {
        if (authToken == null || authToken.isBlank()) {
            return null;
        }
        String token = authToken.trim();
        return token.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length()) ? token : BEARER_PREFIX + token;
    }
}
