package com.demoBank.advisor.tools.service;

import com.demoBank.advisor.router.model.IntentName;
import com.demoBank.advisor.tools.exception.ToolInvocationException;
import com.demoBank.advisor.tools.model.ToolName;
import com.demoBank.advisor.util.JsonFileLoader;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Canned tool outputs for local development, loaded from {@code mocks/tools/<tool>.json}.
 * Argument fields the real tools echo back (user_id, lookback_days, range, trace_id) are copied onto the output.
 * The suitability mock applies the execution rule of the real guard: an invest request to buy, sell or trade is denied.
 */
@Slf4j
@Service
public class LocalToolMocks {

    private static final String MOCK_PATH = "mocks/tools/%s.json";
    private static final String[] ECHOED_FIELDS = {"user_id", "trace_id", "range", "lookback_days", "lookback_months"};

    private static final Set<String> EXECUTION_ACTIONS = Set.of("buy", "sell", "trade");

    private final Map<String, ObjectNode> cache = new ConcurrentHashMap<>();

    /**
     * Returns the canned output for a tool.
     *
     * @param toolName  canonical tool name
     * @param arguments call arguments
     * @return a fresh copy of the canned output
     * @throws ToolInvocationException if no mock exists for the tool
     */
    public JsonNode output(String toolName, ObjectNode arguments) {
        ObjectNode template = cache.computeIfAbsent(toolName,
                name -> JsonFileLoader.readObject(String.format(MOCK_PATH, name)).orElse(null));
        if (template == null) {
            throw new ToolInvocationException("invalid_output", "No local mock for tool " + toolName, false);
        }

        ObjectNode output = template.deepCopy();
        if (arguments != null) {
            for (String field : ECHOED_FIELDS) {
                if (arguments.hasNonNull(field)) {
                    output.set(field, arguments.get(field));
                }
            }
        }
        if (ToolName.SUITABILITY_GUARD.code().equals(toolName) && arguments != null) {
            applyExecutionRule(output, arguments);
        }
        log.debug("Served local tool mock - tool: {}", toolName);
        return output;
    }

    private static void applyExecutionRule(ObjectNode output, ObjectNode arguments) {
        boolean invest = IntentName.INVEST.code().equals(arguments.path("intent").asText(""));
        if (!invest) {
            return;
        }
        output.put("education_only", true);
        if (EXECUTION_ACTIONS.contains(arguments.path("requested_action").asText(""))) {
            output.put("allow", false);
            output.put("decision", "deny_execution");
            output.putArray("reason_codes").add("execution_blocked").add("education_only_policy");
        } else {
            output.put("decision", "education_only");
            output.putArray("reason_codes").add("education_only_policy");
        }
    }
}
