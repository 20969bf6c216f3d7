package com.demoBank.advisor.config;

import java.net.URI;
import java.time.Duration;

/**
 * Tool gateway and backend connection settings.
 *
 * @param gatewayUrl        base URL of the JSON-RPC tool gateway ("/mcp" is appended when missing)
 * @param backendUrl        base URL of the backend that receives audit writes
 * @param kbToolName        explicit knowledge-base tool name; blank means resolve through tools/list
 * @param kbEnabled         whether knowledge-base retrieval is attempted at all
 * @param maxWorkers        upper bound of the fan-out pool
 * @param fanOutTimeout     overall bound for one fan-out
 * @param callTimeout       transport timeout of a single tool call
 * @param maxRetries        retries for transient failures (connection errors, 5xx)
 * @param retryBackoff      first backoff delay, doubled on each retry
 * @param useLocalMocks     serve canned tool outputs when the gateway is local
 */
public record ToolGatewaySettings(
        String gatewayUrl,
        String backendUrl,
        String kbToolName,
        boolean kbEnabled,
        int maxWorkers,
        Duration fanOutTimeout,
        Duration callTimeout,
        int maxRetries,
        Duration retryBackoff,
        boolean useLocalMocks) {

    public ToolGatewaySettings {
        maxWorkers = Math.max(1, maxWorkers);
        maxRetries = Math.max(0, maxRetries);
        if (fanOutTimeout == null) {
            fanOutTimeout = Duration.ofSeconds(60);
        }
        if (callTimeout == null) {
            callTimeout = Duration.ofSeconds(20);
        }
        if (retryBackoff == null) {
            retryBackoff = Duration.ofMillis(200);
        } else if (retryBackoff.toMillis() < 1) {
            retryBackoff = Duration.ofMillis(1);
        }
    }

    public String mcpEndpoint() {
        String base = gatewayUrl == null ? "" : gatewayUrl.trim();
        if (base.isEmpty()) {
            return "";
        }
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base.endsWith("/mcp") ? base : base + "/mcp";
    }

    /**
     * Local mocks only apply to a gateway on the developer machine.
     */
    public boolean localMocksActive() {
        if (!useLocalMocks) {
            return false;
        }
        String host;
        try {
            host = URI.create(gatewayUrl == null ? "" : gatewayUrl.trim()).getHost();
        } catch (IllegalArgumentException e) {
            return false;
        }
        if (host == null) {
            return false;
        }
        return host.equals("localhost") || host.equals("127.0.0.1") || host.endsWith(".local");
    }
}
