package com.demoBank.advisor.router.model;

/**
 * What the router produced for one turn.
 *
 * @param decision          decision served for this turn
 * @param extraction        extraction the decision was made from; null when extraction failed
 * @param extractionOutcome raw extractor outcome, null in rule mode
 * @param shadowDecision    semantic decision recorded in shadow mode, null otherwise
 */
public record RoutingResult(
        RouteDecision decision,
        IntentExtraction extraction,
        ExtractionOutcome extractionOutcome,
        RouteDecision shadowDecision) {
}
