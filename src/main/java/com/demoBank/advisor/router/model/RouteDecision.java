package com.demoBank.advisor.router.model;

import com.demoBank.advisor.tools.model.ToolName;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Final routing decision for one turn.
 * A decision that asks for clarification carries no tool bundle.
 */
public record RouteDecision(
        @JsonProperty("mode") RouterMode mode,
        @JsonProperty("policy_version") String policyVersion,
        @JsonProperty("final_intent") IntentName finalIntent,
        @JsonProperty("tool_bundle") List<ToolName> toolBundle,
        @JsonProperty("clarify_needed") boolean clarifyNeeded,
        @JsonProperty("clarifying_question") ClarifyingQuestion clarifyingQuestion,
        @JsonProperty("reason_codes") List<String> reasonCodes,
        @JsonProperty("fallback_used") String fallbackUsed,
        @JsonProperty("source") RouteSource source) {

    public static final String CLARIFY_EXHAUSTED = "clarify_exhausted";

    public RouteDecision {
        toolBundle = toolBundle == null ? List.of() : List.copyOf(toolBundle);
        reasonCodes = reasonCodes == null ? List.of() : List.copyOf(reasonCodes);
        if (clarifyNeeded && !toolBundle.isEmpty()) {
            throw new IllegalArgumentException("A clarifying decision must not carry tools");
        }
    }

    public RouteDecision withMode(RouterMode routerMode) {
        return new RouteDecision(routerMode, policyVersion, finalIntent, toolBundle, clarifyNeeded, clarifyingQuestion,
                reasonCodes, fallbackUsed, source);
    }

    public boolean isClarifyExhausted() {
        return CLARIFY_EXHAUSTED.equals(fallbackUsed);
    }
}
