package com.demoBank.advisor.router.service;

import com.demoBank.advisor.config.RouterSettings;
import com.demoBank.advisor.router.model.ClarificationState;
import com.demoBank.advisor.router.model.ExtractionOutcome;
import com.demoBank.advisor.router.model.IntentExtraction;
import com.demoBank.advisor.router.model.IntentOverride;
import com.demoBank.advisor.router.model.RouteDecision;
import com.demoBank.advisor.router.model.RouteSource;
import com.demoBank.advisor.router.model.RouterMode;
import com.demoBank.advisor.router.model.RoutingResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Intent router - turns an admitted prompt into a route decision.
 *
 * Responsibilities:
 * - Run the structured extractor (semantic modes) or the keyword classifier (rule mode)
 * - Apply whitelisted lexical overrides before the confidence policy
 * - Record the semantic decision without serving it in shadow mode
 * - Advance or reset the customer's clarification round
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IntentRouter {

    private final RouterSettings settings;
    private final IntentExtractor intentExtractor;
    private final HeuristicOverrideTable overrideTable;
    private final RoutingPolicy routingPolicy;
    private final RuleIntentClassifier ruleClassifier;
    private final ClarificationService clarificationService;

    /**
     * Routes one turn.
     *
     * @param prompt        admitted prompt
     * @param clarification per-customer clarification state, updated in place
     * @param vietnamese    language of any clarifying question
     * @param traceId       trace id for logging
     * @return served decision plus the data it was made from
     */
    public RoutingResult route(String prompt, ClarificationState clarification, boolean vietnamese, String traceId) {
        RouterMode mode = settings.mode();
        log.info("Step ROUTE - traceId: {}, mode: {}, clarifyRound: {}", traceId, mode.code(), clarification.getRound());

        RoutingResult result = switch (mode) {
            case RULE -> {
                IntentExtraction extraction = ruleClassifier.classify(prompt);
                yield new RoutingResult(ruleDecision(mode, extraction), extraction, null, null);
            }
            case SEMANTIC_SHADOW -> {
                RoutingResult semantic = semanticRoute(mode, prompt, clarification.getRound(), vietnamese, traceId);
                IntentExtraction extraction = ruleClassifier.classify(prompt);
                log.info("Shadow routing - traceId: {}, served: {}, semantic: {}", traceId,
                        extraction.intent(), semantic.decision().finalIntent());
                yield new RoutingResult(ruleDecision(mode, extraction), extraction,
                        semantic.extractionOutcome(), semantic.decision());
            }
            case SEMANTIC_ENFORCE -> semanticRoute(mode, prompt, clarification.getRound(), vietnamese, traceId);
        };

        clarificationService.advance(clarification, result.decision());
        RouteDecision decision = result.decision();
        log.info("Route decided - traceId: {}, intent: {}, clarify: {}, tools: {}, reasons: {}", traceId,
                decision.finalIntent(), decision.clarifyNeeded(), decision.toolBundle(), decision.reasonCodes());
        return result;
    }

    private RoutingResult semanticRoute(RouterMode mode, String prompt, int round, boolean vietnamese, String traceId) {
        ExtractionOutcome outcome = intentExtractor.extract(prompt, traceId);
        if (!outcome.succeeded()) {
            log.warn("Intent extraction failed - traceId: {}, attempts: {}, errors: {}",
                    traceId, outcome.attempts(), outcome.errors());
            RouteDecision decision = routingPolicy.extractionFailed(mode, outcome.errors(), round, vietnamese);
            return new RoutingResult(decision, null, outcome, null);
        }

        IntentExtraction extraction = outcome.extraction();
        List<String> leadingReasons = new ArrayList<>();
        Optional<IntentOverride> override = overrideTable.suggest(prompt, extraction);
        if (override.isPresent()) {
            log.info("Intent override - traceId: {}, from: {}, to: {}, rule: {}", traceId,
                    extraction.intent(), override.get().intent(), override.get().name());
            extraction = extraction.withIntent(override.get().intent());
            leadingReasons.add(override.get().reasonCode());
        }

        RouteDecision decision = routingPolicy.decide(mode, extraction, leadingReasons, round, vietnamese);
        return new RoutingResult(decision, extraction, outcome, null);
    }

    private RouteDecision ruleDecision(RouterMode mode, IntentExtraction extraction) {
        return new RouteDecision(mode, settings.policyVersion(), extraction.intent(),
                RoutingPolicy.toolBundleFor(extraction.intent()), false, null, List.of("rule_classifier"),
                null, RouteSource.RULE);
    }
}
