package com.demoBank.advisor.config;

import com.demoBank.advisor.router.model.RouterMode;

/**
 * Routing thresholds. Injected at startup and immutable for the lifetime of a request.
 */
public record RouterSettings(
        RouterMode mode,
        String policyVersion,
        double intentConfMin,
        double top2GapMin,
        double scenarioConfMin,
        int maxClarifyQuestions,
        int extractorRetries) {

    public RouterSettings {
        if (mode == null) {
            mode = RouterMode.SEMANTIC_ENFORCE;
        }
        if (policyVersion == null || policyVersion.isBlank()) {
            policyVersion = "v1";
        }
        maxClarifyQuestions = Math.max(1, maxClarifyQuestions);
        extractorRetries = Math.max(0, extractorRetries);
    }

    public static RouterSettings defaults() {
        return new RouterSettings(RouterMode.SEMANTIC_ENFORCE, "v1", 0.70, 0.15, 0.75, 2, 1);
    }
}
