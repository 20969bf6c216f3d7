package com.demoBank.advisor.tools.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Merged result of one fan-out: outputs and errors keyed by tool.
 * A tool appears in exactly one of the two maps.
 */
public record FanOutResult(Map<ToolName, JsonNode> outputs, Map<ToolName, ToolError> errors) {

    public FanOutResult {
        outputs = outputs == null || outputs.isEmpty()
                ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(outputs));
        errors = errors == null || errors.isEmpty()
                ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(errors));
    }

    public static FanOutResult empty() {
        return new FanOutResult(Map.of(), Map.of());
    }

    /**
     * One {@code tool_error:<name>} reason code per failed tool, in tool order.
     */
    public List<String> reasonCodes() {
        return errors.keySet().stream()
                .sorted()
                .map(tool -> "tool_error:" + tool.code())
                .toList();
    }
}
