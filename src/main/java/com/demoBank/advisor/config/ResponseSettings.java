package com.demoBank.advisor.config;

import com.demoBank.advisor.response.model.ResponseMode;

/**
 * Answer synthesis settings.
 */
public record ResponseSettings(
        ResponseMode mode,
        String promptVersion,
        String schemaVersion,
        String policyVersion,
        String requiredDisclaimer,
        int maxTokens) {

    public static final String DEFAULT_DISCLAIMER = "Educational guidance only. We do not provide investment advice.";

    public ResponseSettings {
        if (mode == null) {
            mode = ResponseMode.LLM_SHADOW;
        }
        if (requiredDisclaimer == null || requiredDisclaimer.isBlank()) {
            requiredDisclaimer = DEFAULT_DISCLAIMER;
        }
        if (maxTokens <= 0) {
            maxTokens = 900;
        }
    }

    public static ResponseSettings defaults() {
        return new ResponseSettings(ResponseMode.LLM_SHADOW, "answer_synth_v2", "answer_plan_v2",
                "advice_policy_v1", DEFAULT_DISCLAIMER, 900);
    }
}
