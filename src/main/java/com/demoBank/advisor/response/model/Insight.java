package com.demoBank.advisor.response.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A conclusion derived from facts by a fixed rule.
 */
public record Insight(
        @JsonProperty("insight_id") String insightId,
        @JsonProperty("kind") String kind,
        @JsonProperty("severity") Severity severity,
        @JsonProperty("message_seed") String messageSeed,
        @JsonProperty("supporting_fact_ids") List<String> supportingFactIds) {

    public Insight {
        supportingFactIds = supportingFactIds == null ? List.of() : List.copyOf(supportingFactIds);
    }
}
