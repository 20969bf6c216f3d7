package com.demoBank.advisor.router.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of advisory intents.
 */
public enum IntentName {
    SUMMARY("summary"),
    RISK("risk"),
    PLANNING("planning"),
    SCENARIO("scenario"),
    INVEST("invest"),
    OUT_OF_SCOPE("out_of_scope");

    private final String code;

    IntentName(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public static Optional<IntentName> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (IntentName intent : values()) {
            if (intent.code.equals(normalized)) {
                return Optional.of(intent);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return code;
    }
}
