package com.demoBank.advisor.response.model;

import java.util.List;

/**
 * One generation: the parsed plan (null when parsing or schema checks failed) and its error codes.
 */
public record SynthesisAttempt(AnswerPlan plan, List<String> errors) {

    public SynthesisAttempt {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static SynthesisAttempt failed(List<String> errors) {
        return new SynthesisAttempt(null, errors);
    }

    public boolean hasPlan() {
        return plan != null;
    }
}
