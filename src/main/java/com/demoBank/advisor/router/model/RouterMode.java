package com.demoBank.advisor.router.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How the router decides.
 * RULE - lexical classifier only.
 * SEMANTIC_SHADOW - extractor runs and is recorded, the rule decision is served.
 * SEMANTIC_ENFORCE - extractor decision is served.
 */
public enum RouterMode {
    RULE("rule"),
    SEMANTIC_SHADOW("semantic_shadow"),
    SEMANTIC_ENFORCE("semantic_enforce");

    private final String code;

    RouterMode(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Parses a configured value; unknown values fall back to SEMANTIC_ENFORCE.
     */
    public static RouterMode fromConfig(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (RouterMode mode : values()) {
            if (mode.code.equals(normalized)) {
                return mode;
            }
        }
        return SEMANTIC_ENFORCE;
    }
}
