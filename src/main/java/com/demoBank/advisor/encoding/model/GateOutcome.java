package com.demoBank.advisor.encoding.model;

/**
 * Text that continues through the pipeline, with the decision that produced it.
 */
public record GateOutcome(String text, EncodingDecision decision) {
}
