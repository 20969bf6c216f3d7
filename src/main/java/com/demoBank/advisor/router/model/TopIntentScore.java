package com.demoBank.advisor.router.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One ranked intent candidate.
 */
public record TopIntentScore(
        @JsonProperty("intent") IntentName intent,
        @JsonProperty("score") double score) {
}
