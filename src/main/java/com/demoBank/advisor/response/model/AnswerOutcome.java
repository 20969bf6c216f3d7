package com.demoBank.advisor.response.model;

import java.util.List;

/**
 * Result of the generate, validate, repair and retry loop.
 *
 * @param plan        last plan produced, null when no generation produced one
 * @param valid       whether {@code plan} passed grounding validation
 * @param generations number of generations used (0..2)
 * @param repaired    whether the placeholder repair was applied
 * @param errors      validation or synthesis errors of the last attempt; empty when valid
 */
public record AnswerOutcome(AnswerPlan plan, boolean valid, int generations, boolean repaired, List<String> errors) {

    public AnswerOutcome {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
