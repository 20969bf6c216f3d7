package com.demoBank.advisor.response.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Which answer is served to the user.
 */
public enum ResponseMode {
    /** Deterministic renderer only, no generation. */
    TEMPLATE("template"),
    /** Generation runs and is recorded, the deterministic render is served. */
    LLM_SHADOW("llm_shadow"),
    /** A validated generated answer is served, otherwise the deterministic render. */
    LLM_ENFORCE("llm_enforce");

    private final String code;

    ResponseMode(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public static ResponseMode fromConfig(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (ResponseMode mode : values()) {
            if (mode.code.equals(normalized)) {
                return mode;
            }
        }
        return LLM_SHADOW;
    }
}
