package com.demoBank.advisor.encoding.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Admission decision of the encoding gate.
 */
public enum GateDecision {
    PASS("pass"),
    REPAIR("repair"),
    FAIL_FAST("fail_fast");

    private final String code;

    GateDecision(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
