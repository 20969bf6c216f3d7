package com.demoBank.advisor.tools.service;

import com.demoBank.advisor.config.ToolGatewaySettings;
import com.demoBank.advisor.tools.dto.JsonRpcResponse;
import com.demoBank.advisor.tools.exception.ToolInvocationException;
import com.demoBank.advisor.tools.model.KnowledgeBaseResult;
import com.demoBank.advisor.tools.model.KnowledgeMatch;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Retrieves service and policy passages from the knowledge-base tool.
 * The tool answers with text items: "Context: ..." and "RAG Sources: [json list]".
 * Any failure yields no matches; retrieval never fails a turn.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KnowledgeBaseClient {

    public static final String KB_TOOL = "retrieve_from_aws_kb";
    private static final String CONTEXT_PREFIX = "Context:";
    private static final String SOURCES_PREFIX = "RAG Sources:";
    private static final int MAX_RESULTS = 3;

    private final ToolGatewaySettings settings;
    private final ToolGatewayClient gatewayClient;
    private final ToolNameResolver nameResolver;
    private final LocalToolMocks localToolMocks;
    private final ObjectMapper objectMapper;

    public KnowledgeBaseResult retrieve(String query, Map<String, String> filters, String authToken, String traceId) {
        if (!settings.kbEnabled()) {
            return KnowledgeBaseResult.empty("KB disabled");
        }

        ObjectNode arguments = objectMapper.createObjectNode();
        arguments.put("query", query == null ? "" : query);
        arguments.set("filters", objectMapper.valueToTree(filters == null ? Map.of() : filters));
        arguments.put("n", MAX_RESULTS);

        try {
            JsonNode content;
            if (settings.localMocksActive()) {
                content = localToolMocks.output(KB_TOOL, arguments).path("content");
            } else {
                JsonRpcResponse response = gatewayClient.callToolRaw(resolveToolName(authToken, traceId),
                        arguments, authToken, traceId);
                content = response.getResult() == null ? null : response.getResult().path("content");
            }
            KnowledgeBaseResult result = parseContent(content);
            log.info("KB retrieval completed - traceId: {}, matches: {}", traceId, result.matches().size());
            return result;
        } catch (ToolInvocationException e) {
            log.warn("KB retrieval failed - traceId: {}, kind: {}, error: {}", traceId, e.getErrorKind(), e.getMessage());
            return KnowledgeBaseResult.empty("KB call failed: " + e.getErrorKind());
        }
    }

    private String resolveToolName(String authToken, String traceId) {
        String configured = settings.kbToolName();
        if (configured != null && !configured.isBlank()) {
            return configured.trim();
        }
        return nameResolver.resolve(KB_TOOL, authToken, traceId);
    }

    KnowledgeBaseResult parseContent(JsonNode content) {
        if (content == null || !content.isArray()) {
            return KnowledgeBaseResult.empty("KB returned no content");
        }
        String context = "";
        JsonNode sources = null;
        for (JsonNode item : content) {
            String text = item.path("text").asText("");
            if (text.startsWith(CONTEXT_PREFIX)) {
                context = text.substring(CONTEXT_PREFIX.length()).trim();
            } else if (text.startsWith(SOURCES_PREFIX)) {
                try {
                    sources = objectMapper.readTree(text.substring(SOURCES_PREFIX.length()).trim());
                } catch (JsonProcessingException e) {
                    log.warn("KB sources are not valid JSON: {}", e.getOriginalMessage());
                }
            }
        }

        List<KnowledgeMatch> matches = new ArrayList<>();
        if (sources != null && sources.isArray()) {
            for (JsonNode source : sources) {
                String id = source.path("id").asText("");
                String citation = firstNonBlank(source.path("fileName").asText(""), id, "KB");
                matches.add(new KnowledgeMatch(id, source.path("snippet").asText(""), citation,
                        source.path("score").asDouble(0.0)));
            }
        }
        return new KnowledgeBaseResult(matches, context);
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return "";
    }
}
