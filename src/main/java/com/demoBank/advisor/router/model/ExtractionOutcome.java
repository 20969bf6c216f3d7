package com.demoBank.advisor.router.model;

import java.util.List;

/**
 * Result of the structured extractor: an extraction or the error codes that explain why there is none.
 *
 * @param extraction    parsed extraction, null on failure
 * @param errors        error codes accumulated over all attempts
 * @param promptVersion extraction prompt version
 * @param attempts      number of inference attempts made
 */
public record ExtractionOutcome(
        IntentExtraction extraction,
        List<String> errors,
        String promptVersion,
        int attempts) {

    public ExtractionOutcome {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean succeeded() {
        return extraction != null;
    }
}
