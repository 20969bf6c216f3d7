package com.demoBank.advisor.response.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A recommended next step with its priority (lower runs first) and parameters.
 */
public record ActionCandidate(
        @JsonProperty("action_id") String actionId,
        @JsonProperty("priority") int priority,
        @JsonProperty("action_type") String actionType,
        @JsonProperty("params") Map<String, Object> params,
        @JsonProperty("supporting_insight_ids") List<String> supportingInsightIds) {

    public ActionCandidate {
        if (priority < 1 || priority > 99) {
            throw new IllegalArgumentException("priority must be in 1..99: " + priority);
        }
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        supportingInsightIds = supportingInsightIds == null ? List.of() : List.copyOf(supportingInsightIds);
    }
}
