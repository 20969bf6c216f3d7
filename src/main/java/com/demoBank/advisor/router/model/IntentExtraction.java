package com.demoBank.advisor.router.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Structured reading of a prompt: intent, ranked candidates and slots.
 *
 * @param intent             best intent
 * @param subIntent          free-form refinement, may be empty
 * @param confidence         confidence of {@code intent}, in [0, 1]
 * @param domainRelevance    how related the prompt is to personal-finance advisory, in [0, 1]
 * @param top2               exactly two ranked candidates
 * @param slots              structured values; never contains null values
 * @param scenarioConfidence optional confidence that the prompt is a what-if
 * @param reason             short explanation from the extractor
 */
public record IntentExtraction(
        @JsonProperty("intent") IntentName intent,
        @JsonProperty("sub_intent") String subIntent,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("domain_relevance") double domainRelevance,
        @JsonProperty("top2") List<TopIntentScore> top2,
        @JsonProperty("slots") Map<String, Object> slots,
        @JsonProperty("scenario_confidence") Double scenarioConfidence,
        @JsonProperty("reason") String reason) {

    public static final String SCHEMA_VERSION = "intent_extraction_v1";

    public IntentExtraction {
        Objects.requireNonNull(intent, "intent");
        subIntent = subIntent == null ? "" : subIntent;
        reason = reason == null ? "" : reason;
        top2 = top2 == null ? List.of() : List.copyOf(top2);
        Map<String, Object> copy = new LinkedHashMap<>();
        if (slots != null) {
            slots.forEach((key, value) -> {
                if (value != null) {
                    copy.put(key, value);
                }
            });
        }
        slots = Collections.unmodifiableMap(copy);
    }

    /**
     * Score gap between the two ranked candidates; 0 when fewer than two are present.
     */
    public double top2Gap() {
        if (top2.size() < 2) {
            return 0.0;
        }
        return top2.get(0).score() - top2.get(1).score();
    }

    /**
     * Score of the given intent in top2, 0 when absent.
     */
    public double top2Score(IntentName candidate) {
        return top2.stream()
                .filter(item -> item.intent() == candidate)
                .mapToDouble(TopIntentScore::score)
                .findFirst()
                .orElse(0.0);
    }

    public IntentExtraction withIntent(IntentName overridden) {
        return new IntentExtraction(overridden, subIntent, confidence, domainRelevance, top2, slots,
                scenarioConfidence, reason);
    }
}
