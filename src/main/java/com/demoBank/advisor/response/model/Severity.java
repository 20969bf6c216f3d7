package com.demoBank.advisor.response.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Insight severity; declaration order is the presentation order.
 */
public enum Severity {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String code;

    Severity(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
