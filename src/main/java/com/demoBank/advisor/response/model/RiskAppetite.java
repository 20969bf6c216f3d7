package com.demoBank.advisor.response.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Stated risk appetite of the user; drives service action priorities.
 */
public enum RiskAppetite {
    CONSERVATIVE("conservative"),
    MODERATE("moderate"),
    AGGRESSIVE("aggressive"),
    UNKNOWN("unknown");

    private final String code;

    RiskAppetite(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public static RiskAppetite fromCode(Object value) {
        String normalized = value == null ? "" : value.toString().trim().toLowerCase(Locale.ROOT);
        for (RiskAppetite appetite : values()) {
            if (appetite != UNKNOWN && appetite.code.equals(normalized)) {
                return appetite;
            }
        }
        return UNKNOWN;
    }

    /**
     * Policy flag {@code risk_appetite} wins; the {@code slot.risk_appetite} fact is the fallback.
     */
    public static RiskAppetite resolve(Map<String, Object> policyFlags, Optional<Fact> slotFact) {
        RiskAppetite fromFlags = fromCode(policyFlags == null ? null : policyFlags.get("risk_appetite"));
        if (fromFlags != UNKNOWN) {
            return fromFlags;
        }
        return slotFact.map(fact -> fromCode(fact.value())).orElse(UNKNOWN);
    }
}
