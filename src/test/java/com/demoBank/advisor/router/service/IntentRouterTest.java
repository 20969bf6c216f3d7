package com.demoBank.advisor.router.service;

import com.demoBank.advisor.config.RouterSettings;
import com.demoBank.advisor.router.model.ClarificationState;
import com.demoBank.advisor.router.model.ExtractionOutcome;
import com.demoBank.advisor.router.model.IntentExtraction;
import com.demoBank.advisor.router.model.IntentName;
import com.demoBank.advisor.router.model.RouteDecision;
import com.demoBank.advisor.router.model.RouterMode;
import com.demoBank.advisor.router.model.RoutingResult;
import com.demoBank.advisor.router.model.TopIntentScore;
import com.demoBank.advisor.tools.model.ToolName;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("IntentRouter")
class IntentRouterTest {

    private static final String TRACE_ID = "trc_test0001";

    private IntentExtractor intentExtractor;
    private ClarificationService clarificationService;

    @BeforeEach
    void setUp() {
        intentExtractor = mock(IntentExtractor.class);
        clarificationService = new ClarificationService();
    }

    private IntentRouter router(RouterMode mode) {
        RouterSettings settings = new RouterSettings(mode, "v1", 0.70, 0.15, 0.75, 2, 1);
        return new IntentRouter(settings, intentExtractor, new HeuristicOverrideTable(),
                new RoutingPolicy(settings, clarificationService), new RuleIntentClassifier(), clarificationService);
    }

    private static IntentExtraction extraction(IntentName intent, double confidence, IntentName second,
                                               double secondScore, Map<String, Object> slots) {
        return new IntentExtraction(intent, "", confidence, 0.9,
                List.of(new TopIntentScore(intent, confidence), new TopIntentScore(second, secondScore)),
                slots, null, "test");
    }

    private void extractorReturns(IntentExtraction extraction) {
        when(intentExtractor.extract(anyString(), anyString()))
                .thenReturn(new ExtractionOutcome(extraction, List.of(), "intent_extraction_v1", 1));
    }

    @Nested
    @DisplayName("confident extraction")
    class ConfidentExtraction {

        @Test
        @DisplayName("routes summary with its tool bundle and resets the round")
        void routesSummary() {
            extractorReturns(extraction(IntentName.SUMMARY, 0.92, IntentName.RISK, 0.05, Map.of()));
            ClarificationState state = ClarificationState.builder().pending(true).round(1).maxQuestions(2).build();

            RoutingResult result = router(RouterMode.SEMANTIC_ENFORCE)
                    .route("How did my cashflow look this month?", state, false, TRACE_ID);

            RouteDecision decision = result.decision();
            assertEquals(IntentName.SUMMARY, decision.finalIntent());
            assertFalse(decision.clarifyNeeded());
            assertEquals(List.of(ToolName.SPEND_ANALYTICS, ToolName.CASHFLOW_FORECAST,
                    ToolName.JAR_ALLOCATION_SUGGEST), decision.toolBundle());
            assertEquals(0, state.getRound());
            assertFalse(state.isPending());
        }

        @Test
        @DisplayName("overrides invest to risk on explicit anomaly phrasing")
        void anomalyOverride() {
            extractorReturns(extraction(IntentName.INVEST, 0.81, IntentName.RISK, 0.40, Map.of()));

            RoutingResult result = router(RouterMode.SEMANTIC_ENFORCE)
                    .route("Có giao dịch bất thường nào trong tài khoản của tôi không?",
                            ClarificationState.initial(2), true, TRACE_ID);

            assertEquals(IntentName.RISK, result.decision().finalIntent());
            assertTrue(result.decision().reasonCodes().contains("intent_override:anomaly_to_risk"));
            assertEquals(List.of(ToolName.SPEND_ANALYTICS, ToolName.ANOMALY_SIGNALS,
                    ToolName.RISK_PROFILE_NON_INVESTMENT), result.decision().toolBundle());
        }

        @Test
        @DisplayName("keeps invest with the guard first in the bundle")
        void investBundle() {
            extractorReturns(extraction(IntentName.INVEST, 0.93, IntentName.PLANNING, 0.10, Map.of()));

            RouteDecision decision = router(RouterMode.SEMANTIC_ENFORCE)
                    .route("Should I buy VNM stock today?", ClarificationState.initial(2), false, TRACE_ID)
                    .decision();

            assertEquals(IntentName.INVEST, decision.finalIntent());
            assertEquals(ToolName.SUITABILITY_GUARD, decision.toolBundle().get(0));
        }
    }

    @Nested
    @DisplayName("clarification")
    class Clarification {

        private final Map<String, Object> scenarioSlots = Map.of("horizon_months", 12, "spend_delta_pct", -10);

        @Test
        @DisplayName("asks one question limited to the two close candidates")
        void closeCandidates() {
            extractorReturns(extraction(IntentName.SCENARIO, 0.52, IntentName.PLANNING, 0.49, scenarioSlots));
            ClarificationState state = ClarificationState.initial(2);

            RouteDecision decision = router(RouterMode.SEMANTIC_ENFORCE)
                    .route("What if I cut spending by 10% over 12 months?", state, false, TRACE_ID)
                    .decision();

            assertTrue(decision.clarifyNeeded());
            assertTrue(decision.toolBundle().isEmpty());
            assertTrue(decision.reasonCodes().contains("low_top2_gap"));
            assertNotNull(decision.clarifyingQuestion());
            assertEquals("planning_vs_scenario", decision.clarifyingQuestion().questionId());
            assertEquals(2, decision.clarifyingQuestion().options().size());
            assertEquals(1, state.getRound());
            assertTrue(state.isPending());
        }

        @Test
        @DisplayName("proceeds with the extracted intent once the round counter is exhausted")
        void exhausted() {
            extractorReturns(extraction(IntentName.SCENARIO, 0.52, IntentName.PLANNING, 0.49, scenarioSlots));
            ClarificationState state = ClarificationState.builder().pending(true).round(2).maxQuestions(2).build();

            RouteDecision decision = router(RouterMode.SEMANTIC_ENFORCE)
                    .route("What if I cut spending by 10% over 12 months?", state, false, TRACE_ID)
                    .decision();

            assertFalse(decision.clarifyNeeded());
            assertTrue(decision.isClarifyExhausted());
            assertEquals(IntentName.SCENARIO, decision.finalIntent());
            assertEquals(List.of(ToolName.WHAT_IF_SCENARIO), decision.toolBundle());
            assertNull(decision.clarifyingQuestion());
            assertEquals(2, state.getRound());
            assertFalse(state.isPending());
        }

        @Test
        @DisplayName("never asks again in a conversation that stays ambiguous")
        void staysExhausted() {
            extractorReturns(extraction(IntentName.SCENARIO, 0.52, IntentName.PLANNING, 0.49, scenarioSlots));
            IntentRouter router = router(RouterMode.SEMANTIC_ENFORCE);
            ClarificationState state = ClarificationState.initial(2);

            List<Boolean> asked = new ArrayList<>();
            for (int turn = 0; turn < 6; turn++) {
                asked.add(router.route("What if I cut spending by 10% over 12 months?", state, false, TRACE_ID)
                        .decision().clarifyNeeded());
            }

            assertEquals(List.of(true, true, false, false, false, false), asked);
            assertEquals(2, state.getRound());
        }

        @Test
        @DisplayName("resets the round after a decisive route")
        void resetsAfterDecisiveRoute() {
            ClarificationState state = ClarificationState.builder().pending(false).round(2).maxQuestions(2).build();
            extractorReturns(extraction(IntentName.SUMMARY, 0.92, IntentName.RISK, 0.05, Map.of()));
            IntentRouter router = router(RouterMode.SEMANTIC_ENFORCE);

            router.route("How did my cashflow look this month?", state, false, TRACE_ID);
            assertEquals(0, state.getRound());

            extractorReturns(extraction(IntentName.SCENARIO, 0.52, IntentName.PLANNING, 0.49, scenarioSlots));
            RouteDecision next = router.route("What if I cut spending by 10% over 12 months?", state, false, TRACE_ID)
                    .decision();

            assertTrue(next.clarifyNeeded());
            assertEquals(1, state.getRound());
        }

        @Test
        @DisplayName("asks for the horizon first when scenario slots are missing")
        void horizonFirst() {
            extractorReturns(extraction(IntentName.SCENARIO, 0.90, IntentName.PLANNING, 0.05, Map.of()));

            RouteDecision decision = router(RouterMode.SEMANTIC_ENFORCE)
                    .route("Nếu thu nhập giảm thì sao?", ClarificationState.initial(2), true, TRACE_ID)
                    .decision();

            assertTrue(decision.clarifyNeeded());
            assertEquals("scenario_horizon", decision.clarifyingQuestion().questionId());
            assertEquals(List.of("3 tháng", "6 tháng", "12 tháng"), decision.clarifyingQuestion().options());
        }
    }

    @Nested
    @DisplayName("extraction failure")
    class ExtractionFailure {

        @Test
        @DisplayName("does not guess: out_of_scope with a clarifying question")
        void clarifies() {
            when(intentExtractor.extract(anyString(), anyString())).thenReturn(
                    new ExtractionOutcome(null, List.of("invalid_json", "invalid_json"), "intent_extraction_v1", 2));

            RouteDecision decision = router(RouterMode.SEMANTIC_ENFORCE)
                    .route("hmm", ClarificationState.initial(2), false, TRACE_ID)
                    .decision();

            assertEquals(IntentName.OUT_OF_SCOPE, decision.finalIntent());
            assertTrue(decision.clarifyNeeded());
            assertTrue(decision.toolBundle().isEmpty());
            assertEquals("intent_extraction_failed", decision.reasonCodes().get(0));
            assertEquals("generic_intent", decision.clarifyingQuestion().questionId());
        }

        @Test
        @DisplayName("runs the guard only once clarification is exhausted")
        void exhaustedGuardOnly() {
            when(intentExtractor.extract(anyString(), anyString())).thenReturn(
                    new ExtractionOutcome(null, List.of("model_not_configured"), "intent_extraction_v1", 0));
            ClarificationState state = ClarificationState.builder().pending(true).round(2).maxQuestions(2).build();

            RouteDecision decision = router(RouterMode.SEMANTIC_ENFORCE).route("hmm", state, false, TRACE_ID)
                    .decision();

            assertFalse(decision.clarifyNeeded());
            assertEquals(List.of(ToolName.SUITABILITY_GUARD), decision.toolBundle());
            assertTrue(decision.isClarifyExhausted());
        }
    }

    @Nested
    @DisplayName("modes")
    class Modes {

        @Test
        @DisplayName("rule mode never calls the extractor")
        void ruleMode() {
            RoutingResult result = router(RouterMode.RULE)
                    .route("Tôi muốn lập kế hoạch tiết kiệm mua nhà", ClarificationState.initial(2), true, TRACE_ID);

            assertEquals(IntentName.PLANNING, result.decision().finalIntent());
            assertEquals(List.of("rule_classifier"), result.decision().reasonCodes());
            verify(intentExtractor, never()).extract(anyString(), anyString());
        }

        @Test
        @DisplayName("shadow mode serves the rule decision and records the semantic one")
        void shadowMode() {
            extractorReturns(extraction(IntentName.RISK, 0.88, IntentName.SUMMARY, 0.10, Map.of()));

            RoutingResult result = router(RouterMode.SEMANTIC_SHADOW)
                    .route("Show my spending summary", ClarificationState.initial(2), false, TRACE_ID);

            assertEquals(IntentName.SUMMARY, result.decision().finalIntent());
            assertNotNull(result.shadowDecision());
            assertEquals(IntentName.RISK, result.shadowDecision().finalIntent());
        }
    }
}
