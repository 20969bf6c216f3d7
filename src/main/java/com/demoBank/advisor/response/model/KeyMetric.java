package com.demoBank.advisor.response.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record KeyMetric(
        @JsonProperty("fact_id") String factId,
        @JsonProperty("label") String label) {
}
