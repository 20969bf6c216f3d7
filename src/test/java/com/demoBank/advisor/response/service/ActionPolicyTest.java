package com.demoBank.advisor.response.service;

import com.demoBank.advisor.response.model.ActionCandidate;
import com.demoBank.advisor.response.model.Insight;
import com.demoBank.advisor.response.model.RiskAppetite;
import com.demoBank.advisor.response.model.Severity;
import com.demoBank.advisor.router.model.IntentName;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("ActionPolicy")
class ActionPolicyTest {

    private final ActionPolicy policy = new ActionPolicy();

    private static Insight insight(String id) {
        return new Insight(id, "test", Severity.MEDIUM, "seed", List.of());
    }

    private static List<String> ids(List<ActionCandidate> actions) {
        return actions.stream().map(ActionCandidate::actionId).toList();
    }

    @Test
    @DisplayName("pads a sparse plan with the two default actions")
    void defaults() {
        List<ActionCandidate> actions = policy.plan(IntentName.SUMMARY, List.of(), RiskAppetite.UNKNOWN, false);

        assertEquals(List.of("review_budget_weekly", "refresh_data_2w"), ids(actions));
    }

    @Test
    @DisplayName("ranks service suggestions by risk appetite")
    void appetiteRanking() {
        List<Insight> insights = List.of(insight("insight.service_savings_option"),
                insight("insight.service_loan_support"));

        List<ActionCandidate> conservative = policy.plan(IntentName.PLANNING, insights, RiskAppetite.CONSERVATIVE, false);
        List<ActionCandidate> aggressive = policy.plan(IntentName.PLANNING, insights, RiskAppetite.AGGRESSIVE, false);

        assertEquals(List.of("service_savings_setup", "service_loan_healthcheck"), ids(conservative));
        assertEquals(List.of("service_loan_healthcheck", "service_savings_setup"), ids(aggressive));
        assertEquals("conservative", conservative.get(0).params().get("risk_appetite"));
    }

    @Test
    @DisplayName("asks for risk appetite first, in the user's language")
    void captureRiskAppetite() {
        List<ActionCandidate> actions = policy.plan(IntentName.PLANNING,
                List.of(insight("insight.risk_preference_unknown"), insight("insight.goal_gap")),
                RiskAppetite.UNKNOWN, true);

        ActionCandidate first = actions.get(0);
        assertEquals("capture_risk_appetite", first.actionId());
        assertEquals("Bạn ưu tiên mức rủi ro nào?", first.params().get("question"));
        assertEquals(List.of("thấp", "vừa", "cao"), first.params().get("options"));
    }

    @Test
    @DisplayName("invest turns always include the education-only guard")
    void investGuard() {
        List<ActionCandidate> actions = policy.plan(IntentName.INVEST, List.of(), RiskAppetite.UNKNOWN, false);

        assertEquals("education_only_guard", actions.get(0).actionId());
        assertEquals(false, actions.get(0).params().get("execution_allowed"));
        assertTrue(ids(actions).contains("review_budget_weekly"));
    }

    @Test
    @DisplayName("cites every present trigger insight and keeps table priorities")
    void triggerSupport() {
        List<ActionCandidate> actions = policy.plan(IntentName.SUMMARY,
                List.of(insight("insight.cashflow_negative"), insight("insight.cashflow_pressure"),
                        insight("insight.spend_anomaly")),
                RiskAppetite.MODERATE, false);

        assertEquals(List.of("stabilize_cashflow", "review_anomaly"), ids(actions));
        assertEquals(List.of("insight.cashflow_pressure", "insight.cashflow_negative"),
                actions.get(0).supportingInsightIds());
        assertEquals(10, actions.get(0).priority());
        assertEquals(20, actions.get(1).priority());
    }

    @Test
    @DisplayName("does not ask for risk appetite on a summary turn")
    void riskAppetiteGate() {
        List<ActionCandidate> actions = policy.plan(IntentName.SUMMARY,
                List.of(insight("insight.risk_preference_unknown")), RiskAppetite.UNKNOWN, false);

        assertFalse(ids(actions).contains("capture_risk_appetite"));
    }
}
