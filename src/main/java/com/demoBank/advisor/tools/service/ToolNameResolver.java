package com.demoBank.advisor.tools.service;

import com.demoBank.advisor.tools.exception.ToolInvocationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps canonical tool names to the names the gateway exposes.
 * Gateways may prefix tools with a target name ("target___spend_analytics_v1"); the part after the last
 * "___" is the canonical name. The mapping is loaded once from tools/list and only cached on success.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ToolNameResolver {

    static final String PREFIX_SEPARATOR = "___";

    private final ToolGatewayClient gatewayClient;
    private final Object lock = new Object();
    private volatile Map<String, String> resolvedNames;

    /**
     * Returns the gateway-side name of a tool, or the canonical name itself when the gateway lists no match
     * or the listing fails.
     */
    public String resolve(String canonicalName, String authToken, String traceId) {
        Map<String, String> names = resolvedNames;
        if (names == null) {
            names = load(authToken, traceId);
        }
        return names.getOrDefault(canonicalName, canonicalName);
    }

    private Map<String, String> load(String authToken, String traceId) {
        synchronized (lock) {
            if (resolvedNames != null) {
                return resolvedNames;
            }
            List<String> listed;
            try {
                listed = gatewayClient.listTools(authToken, traceId);
            } catch (ToolInvocationException e) {
                log.warn("Tool listing failed, using canonical names - traceId: {}, kind: {}",
                        traceId, e.getErrorKind());
                return Map.of();
            }
            Map<String, String> names = new HashMap<>();
            for (String name : listed) {
                names.putIfAbsent(canonical(name), name);
            }
            log.info("Resolved tool names - traceId: {}, count: {}", traceId, names.size());
            resolvedNames = Map.copyOf(names);
            return resolvedNames;
        }
    }

    static String canonical(String listedName) {
        int index = listedName.lastIndexOf(PREFIX_SEPARATOR);
        return index < 0 ? listedName : listedName.substring(index + PREFIX_SEPARATOR.length());
    }
}
