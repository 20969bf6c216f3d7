package com.demoBank.advisor.response.service;

import com.demoBank.advisor.response.model.ActionCandidate;
import com.demoBank.advisor.response.model.Insight;
import com.demoBank.advisor.response.model.RiskAppetite;
import com.demoBank.advisor.router.model.IntentName;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.ToIntFunction;

/**
 * Maps insights to ranked action candidates with an ordered table of rules.
 * Service suggestions are ranked by the user's risk appetite; lower priority values come first.
 */
@Service
public class ActionPolicy {

    private record ServicePriorities(int savings, int cards, int loan, int consult) {}

    private static final Map<RiskAppetite, ServicePriorities> SERVICE_PRIORITIES = new EnumMap<>(Map.of(
            RiskAppetite.CONSERVATIVE, new ServicePriorities(15, 20, 24, 45),
            RiskAppetite.MODERATE, new ServicePriorities(20, 18, 19, 44),
            RiskAppetite.AGGRESSIVE, new ServicePriorities(26, 20, 15, 42),
            RiskAppetite.UNKNOWN, new ServicePriorities(22, 19, 18, 46)));

    private record PlanInputs(IntentName intent, ServicePriorities priorities, String appetite, boolean vietnamese) {}

    /**
     * One row of the action table: fires when any trigger insight is present and the gate holds.
     */
    private record ActionRule(String actionId, String type, List<String> triggers,
                              ToIntFunction<PlanInputs> priority, Function<PlanInputs, Map<String, Object>> params,
                              Predicate<PlanInputs> gate) {

        static ActionRule of(String actionId, String type, List<String> triggers, int priority,
                             Map<String, Object> params) {
            return new ActionRule(actionId, type, triggers, in -> priority, in -> params, in -> true);
        }
    }

    private static final List<ActionRule> RULES = List.of(
            ActionRule.of("stabilize_cashflow", "cashflow_control",
                    List.of("insight.cashflow_pressure", "insight.cashflow_negative"), 10, Map.of("window_days", 14)),
            ActionRule.of("review_anomaly", "anomaly_review",
                    List.of("insight.spend_anomaly"), 20, Map.of("lookback_days", 90)),
            ActionRule.of("buffer_build", "savings_buffer",
                    List.of("insight.savings_capacity"), 20, Map.of("allocation_ratio", 0.2)),
            ActionRule.of("jar_optimize", "allocation_optimize",
                    List.of("insight.jar_focus"), 30, Map.of("method", "top_jar_rebalance")),
            ActionRule.of("goal_replan", "goal_recalibration",
                    List.of("insight.goal_gap"), 25, Map.of("recheck_weeks", 4)),
            ActionRule.of("scenario_monitor", "scenario_tracking",
                    List.of("insight.scenario_upside"), 30, Map.of("monitor_weeks", 2)),
            ActionRule.of("scenario_downside_guard", "scenario_risk_control",
                    List.of("insight.scenario_no_upside"), 18,
                    ordered("review_days", 14, "focus", "reduce_top_spend_bucket")),
            new ActionRule("capture_risk_appetite", "advisor_question",
                    List.of("insight.risk_preference_unknown"), in -> 8,
                    in -> ordered(
                            "question", in.vietnamese() ? "Bạn ưu tiên mức rủi ro nào?" : "Which risk level do you prefer?",
                            "options", in.vietnamese() ? List.of("thấp", "vừa", "cao") : List.of("low", "medium", "high")),
                    in -> InsightRuleTable.needsRiskAppetite(in.intent())),
            new ActionRule("service_loan_healthcheck", "service_suggestion",
                    List.of("insight.service_loan_support"), in -> in.priorities().loan(),
                    in -> serviceParams("loans_credit", List.of("loan_restructure", "installment_conversion"),
                            in.appetite()),
                    in -> true),
            new ActionRule("service_spend_control_setup", "service_suggestion",
                    List.of("insight.service_spend_control"), in -> in.priorities().cards(),
                    in -> serviceParams("cards_payments", List.of("card_spend_cap", "transaction_alert"),
                            in.appetite()),
                    in -> true),
            new ActionRule("service_savings_setup", "service_suggestion",
                    List.of("insight.service_savings_option"), in -> in.priorities().savings(),
                    in -> serviceParams("savings_deposit", List.of("recurring_savings", "term_deposit"),
                            in.appetite()),
                    in -> true),
            new ActionRule("service_needs_consult", "service_suggestion",
                    List.of("insight.service_catalog_available"), in -> in.priorities().consult(),
                    in -> ordered("service_family", "catalog", "cadence_days", 7, "risk_appetite", in.appetite()),
                    in -> true),
            ActionRule.of("education_only_guard", "compliance",
                    List.of("insight.education_only"), 5, Map.of("execution_allowed", false)));

    private static final class Candidates {
        private final Map<String, ActionCandidate> byId = new LinkedHashMap<>();

        void add(String id, int priority, String type, Map<String, Object> params, List<String> insightIds) {
            byId.putIfAbsent(id, new ActionCandidate(id, priority, type, params, insightIds));
        }

        int size() {
            return byId.size();
        }
    }

    /**
     * Builds the ranked action list.
     *
     * @param intent       routed intent
     * @param insights     derived insights
     * @param riskAppetite resolved risk appetite
     * @param vietnamese   whether advisor questions are phrased in Vietnamese
     */
    public List<ActionCandidate> plan(IntentName intent, List<Insight> insights, RiskAppetite riskAppetite,
                                      boolean vietnamese) {
        Set<String> ids = new LinkedHashSet<>();
        insights.forEach(insight -> ids.add(insight.insightId()));
        PlanInputs inputs = new PlanInputs(intent, SERVICE_PRIORITIES.get(riskAppetite), riskAppetite.code(),
                vietnamese);
        Candidates out = new Candidates();

        for (ActionRule rule : RULES) {
            List<String> support = present(ids, rule.triggers());
            if (!support.isEmpty() && rule.gate().test(inputs)) {
                out.add(rule.actionId(), rule.priority().applyAsInt(inputs), rule.type(),
                        rule.params().apply(inputs), support);
            }
        }

        if (out.size() < 2) {
            out.add("review_budget_weekly", 60, "budget_tracking", Map.of("cadence", "weekly"), List.of());
            out.add("refresh_data_2w", 65, "refresh_data", Map.of("cadence", "2w"), List.of());
        }
        if (intent == IntentName.INVEST) {
            out.add("education_only_guard", 5, "compliance", Map.of("execution_allowed", false),
                    present(ids, List.of("insight.education_only")));
        }

        return out.byId.values().stream()
                .sorted(Comparator.comparingInt(ActionCandidate::priority).thenComparing(ActionCandidate::actionId))
                .toList();
    }

    private static Map<String, Object> serviceParams(String family, List<String> examples, String appetite) {
        return ordered("service_family", family, "examples", examples, "risk_appetite", appetite);
    }

    private static Map<String, Object> ordered(Object... keyValues) {
        Map<String, Object> params = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            params.put((String) keyValues[i], keyValues[i + 1]);
        }
        return params;
    }

    private static List<String> present(Set<String> ids, List<String> candidates) {
        List<String> found = new ArrayList<>();
        for (String candidate : candidates) {
            if (ids.contains(candidate)) {
                found.add(candidate);
            }
        }
        return found;
    }
}
