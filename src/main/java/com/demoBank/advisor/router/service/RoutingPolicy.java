package com.demoBank.advisor.router.service;

import com.demoBank.advisor.config.RouterSettings;
import com.demoBank.advisor.router.model.ClarifyingQuestion;
import com.demoBank.advisor.router.model.IntentExtraction;
import com.demoBank.advisor.router.model.IntentName;
import com.demoBank.advisor.router.model.RouteDecision;
import com.demoBank.advisor.router.model.RouteSource;
import com.demoBank.advisor.router.model.RouterMode;
import com.demoBank.advisor.tools.model.ToolName;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Confidence-gated routing policy.
 *
 * Decides the final intent, its tool bundle, or one clarifying question. Once the clarification
 * round counter reaches the configured maximum the policy proceeds with the extracted intent instead of
 * asking again.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoutingPolicy {

    private static final Map<IntentName, List<ToolName>> TOOL_BUNDLES = new EnumMap<>(Map.of(
            IntentName.SUMMARY, List.of(ToolName.SPEND_ANALYTICS, ToolName.CASHFLOW_FORECAST,
                    ToolName.JAR_ALLOCATION_SUGGEST),
            IntentName.RISK, List.of(ToolName.SPEND_ANALYTICS, ToolName.ANOMALY_SIGNALS,
                    ToolName.RISK_PROFILE_NON_INVESTMENT),
            IntentName.PLANNING, List.of(ToolName.SPEND_ANALYTICS, ToolName.CASHFLOW_FORECAST,
                    ToolName.RECURRING_CASHFLOW_DETECT, ToolName.GOAL_FEASIBILITY, ToolName.JAR_ALLOCATION_SUGGEST),
            IntentName.SCENARIO, List.of(ToolName.WHAT_IF_SCENARIO),
            IntentName.INVEST, List.of(ToolName.SUITABILITY_GUARD, ToolName.RISK_PROFILE_NON_INVESTMENT),
            IntentName.OUT_OF_SCOPE, List.of(ToolName.SUITABILITY_GUARD)));

    private static final Set<String> CLARIFY_TRIGGERS = Set.of(
            "low_intent_confidence", "low_top2_gap", "low_scenario_confidence",
            "scenario_horizon_missing", "scenario_delta_missing");

    private static final List<String> SCENARIO_DELTA_SLOTS = List.of(
            "income_delta_pct", "spend_delta_pct", "income_delta_amount_vnd", "spend_delta_amount_vnd", "variants");

    private final RouterSettings settings;
    private final ClarificationService clarificationService;

    /**
     * Tool bundle for an intent; unknown intents get the summary bundle.
     */
    public static List<ToolName> toolBundleFor(IntentName intent) {
        return TOOL_BUNDLES.getOrDefault(intent, TOOL_BUNDLES.get(IntentName.SUMMARY));
    }

    /**
     * Decides the route for a successful extraction.
     *
     * @param mode           router mode recorded on the decision
     * @param extraction     extraction after overrides
     * @param leadingReasons reason codes recorded before the policy ones (overrides)
     * @param clarifyRound   clarifying questions already asked in a row
     * @param vietnamese     language of the clarifying question
     * @return route decision
     */
    public RouteDecision decide(RouterMode mode, IntentExtraction extraction, List<String> leadingReasons,
                                int clarifyRound, boolean vietnamese) {
        List<String> reasonCodes = new ArrayList<>(leadingReasons);

        if (extraction.confidence() < settings.intentConfMin()) {
            reasonCodes.add("low_intent_confidence");
        }
        if (extraction.top2Gap() < settings.top2GapMin()) {
            reasonCodes.add("low_top2_gap");
        }

        if (extraction.intent() == IntentName.SCENARIO) {
            double scenarioConfidence = extraction.scenarioConfidence() != null
                    ? extraction.scenarioConfidence()
                    : extraction.confidence();
            if (scenarioConfidence < settings.scenarioConfMin()) {
                reasonCodes.add("low_scenario_confidence");
            }
            if (isMissingHorizon(extraction.slots().get("horizon_months"))) {
                reasonCodes.add("scenario_horizon_missing");
            }
            boolean hasDelta = SCENARIO_DELTA_SLOTS.stream().anyMatch(key -> extraction.slots().get(key) != null);
            if (!hasDelta) {
                reasonCodes.add("scenario_delta_missing");
            }
        }

        boolean clarifyNeeded = reasonCodes.stream().anyMatch(CLARIFY_TRIGGERS::contains);

        if (clarifyNeeded && clarifyRound >= settings.maxClarifyQuestions()) {
            reasonCodes.add(RouteDecision.CLARIFY_EXHAUSTED);
            log.info("Clarification exhausted - intent: {}, round: {}, reasons: {}",
                    extraction.intent(), clarifyRound, reasonCodes);
            return new RouteDecision(mode, settings.policyVersion(), extraction.intent(),
                    toolBundleFor(extraction.intent()), false, null, reasonCodes,
                    RouteDecision.CLARIFY_EXHAUSTED, RouteSource.SEMANTIC);
        }

        if (clarifyNeeded) {
            ClarifyingQuestion question = clarificationService.buildQuestion(extraction, reasonCodes,
                    settings.maxClarifyQuestions(), vietnamese);
            return new RouteDecision(mode, settings.policyVersion(), extraction.intent(), List.of(), true,
                    question, reasonCodes, null, RouteSource.SEMANTIC);
        }

        return new RouteDecision(mode, settings.policyVersion(), extraction.intent(),
                toolBundleFor(extraction.intent()), false, null, reasonCodes, null, RouteSource.SEMANTIC);
    }

    /**
     * Decision when no extraction could be obtained: never guess, ask instead.
     * Once the round counter is exhausted the turn proceeds as out_of_scope with the guard-only bundle.
     */
    public RouteDecision extractionFailed(RouterMode mode, List<String> errors, int clarifyRound, boolean vietnamese) {
        List<String> reasonCodes = new ArrayList<>();
        reasonCodes.add("intent_extraction_failed");
        reasonCodes.addAll(errors);

        if (clarifyRound >= settings.maxClarifyQuestions()) {
            reasonCodes.add(RouteDecision.CLARIFY_EXHAUSTED);
            return new RouteDecision(mode, settings.policyVersion(), IntentName.OUT_OF_SCOPE,
                    toolBundleFor(IntentName.OUT_OF_SCOPE), false, null, reasonCodes,
                    RouteDecision.CLARIFY_EXHAUSTED, RouteSource.SEMANTIC);
        }

        ClarifyingQuestion question = clarificationService.buildQuestion(null, reasonCodes,
                settings.maxClarifyQuestions(), vietnamese);
        return new RouteDecision(mode, settings.policyVersion(), IntentName.OUT_OF_SCOPE, List.of(), true,
                question, reasonCodes, null, RouteSource.SEMANTIC);
    }

    private static boolean isMissingHorizon(Object horizon) {
        if (horizon == null) {
            return true;
        }
        if (horizon instanceof String text) {
            return text.isEmpty();
        }
        return horizon instanceof Number number && number.doubleValue() == 0.0;
    }
}
