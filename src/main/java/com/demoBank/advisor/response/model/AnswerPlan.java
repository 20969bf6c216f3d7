package com.demoBank.advisor.response.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Structured answer produced by generation. Every number it shows must be grounded in the advisory context.
 */
public record AnswerPlan(
        @JsonProperty("schema_version") String schemaVersion,
        @JsonProperty("language") String language,
        @JsonProperty("summary_lines") List<String> summaryLines,
        @JsonProperty("key_metrics") List<KeyMetric> keyMetrics,
        @JsonProperty("actions") List<String> actions,
        @JsonProperty("assumptions") List<String> assumptions,
        @JsonProperty("limitations") List<String> limitations,
        @JsonProperty("disclaimer") String disclaimer,
        @JsonProperty("used_fact_ids") List<String> usedFactIds,
        @JsonProperty("used_insight_ids") List<String> usedInsightIds,
        @JsonProperty("used_action_ids") List<String> usedActionIds) {

    public static final String SCHEMA_VERSION = "answer_plan_v2";

    public AnswerPlan {
        summaryLines = summaryLines == null ? List.of() : List.copyOf(summaryLines);
        keyMetrics = keyMetrics == null ? List.of() : List.copyOf(keyMetrics);
        actions = actions == null ? List.of() : List.copyOf(actions);
        assumptions = assumptions == null ? List.of() : List.copyOf(assumptions);
        limitations = limitations == null ? List.of() : List.copyOf(limitations);
        disclaimer = disclaimer == null ? "" : disclaimer;
        usedFactIds = usedFactIds == null ? List.of() : List.copyOf(usedFactIds);
        usedInsightIds = usedInsightIds == null ? List.of() : List.copyOf(usedInsightIds);
        usedActionIds = usedActionIds == null ? List.of() : List.copyOf(usedActionIds);
    }

    public AnswerPlan withUsedFactIds(List<String> factIds) {
        return new AnswerPlan(schemaVersion, language, summaryLines, keyMetrics, actions, assumptions, limitations,
                disclaimer, factIds, usedInsightIds, usedActionIds);
    }
}
