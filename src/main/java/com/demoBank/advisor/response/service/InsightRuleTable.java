package com.demoBank.advisor.response.service;

import com.demoBank.advisor.response.model.Fact;
import com.demoBank.advisor.response.model.Insight;
import com.demoBank.advisor.response.model.Severity;
import com.demoBank.advisor.router.model.IntentName;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Derives insights from facts with an ordered table of rules.
 * The first rule that emits an insight id wins; the result is sorted by severity (high first), then id.
 */
@Service
public class InsightRuleTable {

    private interface InsightRule {
        void apply(IntentName intent, FactSignals signals, Map<String, Object> policyFlags, Emitter emitter);
    }

    private static final class Emitter {
        private final Map<String, Insight> insights = new LinkedHashMap<>();

        void emit(String id, String kind, Severity severity, String seed, Stream<Optional<Fact>> support) {
            if (insights.containsKey(id)) {
                return;
            }
            Set<String> factIds = new LinkedHashSet<>();
            support.forEach(fact -> fact.ifPresent(value -> factIds.add(value.factId())));
            insights.put(id, new Insight(id, kind, severity, seed, new ArrayList<>(factIds)));
        }
    }

    private final List<InsightRule> rules = List.of(
            InsightRuleTable::cashflow,
            InsightRuleTable::spendAnomaly,
            InsightRuleTable::goalGap,
            InsightRuleTable::scenario,
            InsightRuleTable::jarFocus,
            InsightRuleTable::riskPreference,
            InsightRuleTable::serviceCatalog,
            InsightRuleTable::serviceSavings,
            InsightRuleTable::serviceLoan,
            InsightRuleTable::serviceSpendControl,
            InsightRuleTable::educationOnly);

    public List<Insight> derive(IntentName intent, List<Fact> facts, Map<String, Object> policyFlags) {
        Map<String, Object> flags = policyFlags == null ? Map.of() : policyFlags;
        FactSignals signals = FactSignals.of(facts, flags);
        Emitter emitter = new Emitter();
        for (InsightRule rule : rules) {
            rule.apply(intent, signals, flags, emitter);
        }
        return emitter.insights.values().stream()
                .sorted(Comparator.comparing(Insight::severity).thenComparing(Insight::insightId))
                .toList();
    }

    private static void cashflow(IntentName intent, FactSignals s, Map<String, Object> flags, Emitter out) {
        if (s.net().isEmpty()) {
            return;
        }
        double net = s.netValue();
        double runway = s.runwayValue();
        if (net < 0 && s.runway().isPresent() && runway > 0 && runway < 3) {
            out.emit("insight.cashflow_pressure", "cashflow", Severity.HIGH,
                    "Net cashflow is negative and the emergency runway is short.", Stream.of(s.net(), s.runway()));
        } else if (net < 0) {
            out.emit("insight.cashflow_negative", "cashflow", Severity.HIGH,
                    "Net cashflow is negative.", Stream.of(s.net()));
        } else if (net > 0) {
            out.emit("insight.savings_capacity", "planning", Severity.MEDIUM,
                    "Positive net cashflow leaves room to save.", Stream.of(s.net()));
        }
    }

    private static void spendAnomaly(IntentName intent, FactSignals s, Map<String, Object> flags, Emitter out) {
        List<Optional<Fact>> support = anomalySupport(s);
        if (support.isEmpty()) {
            return;
        }
        Severity severity = s.anomalyCountValue() >= 2 ? Severity.HIGH : Severity.MEDIUM;
        out.emit("insight.spend_anomaly", "risk", severity,
                "Spending shows unusual movements.", support.stream());
    }

    private static void goalGap(IntentName intent, FactSignals s, Map<String, Object> flags, Emitter out) {
        if (s.goalInfeasible()) {
            out.emit("insight.goal_gap", "planning", Severity.HIGH,
                    "The goal is not feasible with the current parameters.", Stream.of(s.goalFeasible(), s.goalGap()));
        } else if (s.goalGap().isPresent() && s.goalGapValue() > 0) {
            out.emit("insight.goal_gap", "planning", Severity.MEDIUM,
                    "There is still a gap to reach the financial goal.", Stream.of(s.goalGap()));
        }
    }

    private static void scenario(IntentName intent, FactSignals s, Map<String, Object> flags, Emitter out) {
        if (s.scenarioDelta().isPresent() && s.scenarioDeltaValue() > 0) {
            out.emit("insight.scenario_upside", "scenario", Severity.MEDIUM,
                    "The best scenario improves on the baseline.", Stream.of(s.scenarioDelta()));
        } else if (s.scenarioBestVariant().isPresent()) {
            out.emit("insight.scenario_no_upside", "scenario", Severity.HIGH,
                    "The current scenarios show no clear upside over the baseline.",
                    Stream.of(s.scenarioBestVariant(), s.scenarioDelta()));
        }
    }

    private static void jarFocus(IntentName intent, FactSignals s, Map<String, Object> flags, Emitter out) {
        if (s.jarRatio().isPresent()) {
            out.emit("insight.jar_focus", "planning", Severity.LOW,
                    "A priority allocation bucket is available to tune the budget.", Stream.of(s.jarRatio()));
        }
    }

    private static void riskPreference(IntentName intent, FactSignals s, Map<String, Object> flags, Emitter out) {
        Stream<Optional<Fact>> support = Stream.of(s.riskAppetiteSlot());
        switch (s.riskAppetite()) {
            case CONSERVATIVE -> out.emit("insight.risk_preference_conservative", "profile", Severity.MEDIUM,
                    "The user prioritizes safety and stable cashflow.", support);
            case MODERATE -> out.emit("insight.risk_preference_moderate", "profile", Severity.LOW,
                    "The user balances safety against speed to the goal.", support);
            case AGGRESSIVE -> out.emit("insight.risk_preference_aggressive", "profile", Severity.LOW,
                    "The user accepts higher risk to optimize financial goals.", support);
            case UNKNOWN -> {
                if (needsRiskAppetite(intent)) {
                    out.emit("insight.risk_preference_unknown", "profile", Severity.MEDIUM,
                            "Risk appetite is unknown; ask before personalizing recommendations.", support);
                }
            }
        }
    }

    private static void serviceCatalog(IntentName intent, FactSignals s, Map<String, Object> flags, Emitter out) {
        if (Stream.of(s.serviceSavings(), s.serviceLoans(), s.serviceCards(), s.servicePlaybook())
                .anyMatch(Optional::isPresent)) {
            out.emit("insight.service_catalog_available", "service", Severity.LOW,
                    "Bank service catalog data is available for situational suggestions.",
                    Stream.of(s.serviceSavings(), s.serviceLoans(), s.serviceCards(), s.servicePlaybook()));
        }
    }

    private static void serviceSavings(IntentName intent, FactSignals s, Map<String, Object> flags, Emitter out) {
        boolean positiveNet = s.net().isPresent() && s.netValue() > 0;
        if (s.serviceSavings().isPresent()
                && (positiveNet || intent == IntentName.PLANNING || intent == IntentName.SCENARIO)) {
            out.emit("insight.service_savings_option", "service", Severity.MEDIUM,
                    "Recurring or term savings could strengthen saving discipline.",
                    Stream.of(s.serviceSavings(), positiveNet ? s.net() : Optional.empty()));
        }
    }

    private static void serviceLoan(IntentName intent, FactSignals s, Map<String, Object> flags, Emitter out) {
        boolean negativeNet = s.net().isPresent() && s.netValue() < 0;
        boolean gap = s.goalGap().isPresent() && s.goalGapValue() > 0;
        if (s.serviceLoans().isPresent() && (negativeNet || gap || s.overspendAlert())) {
            out.emit("insight.service_loan_support", "service", Severity.MEDIUM,
                    "Debt restructuring or a goal loan could ease cashflow pressure.",
                    Stream.of(s.serviceLoans(), negativeNet ? s.net() : Optional.empty(),
                            gap ? s.goalGap() : Optional.empty()));
        }
    }

    private static void serviceSpendControl(IntentName intent, FactSignals s, Map<String, Object> flags, Emitter out) {
        List<Optional<Fact>> anomalySupport = anomalySupport(s);
        boolean negativeNet = s.net().isPresent() && s.netValue() < 0;
        if (s.serviceCards().isPresent() && (!anomalySupport.isEmpty() || negativeNet || s.overspendAlert())) {
            out.emit("insight.service_spend_control", "service", Severity.MEDIUM,
                    "Card spend caps and transaction alerts could control the largest spending buckets.",
                    Stream.concat(Stream.of(s.serviceCards()),
                            Stream.concat(anomalySupport.stream(),
                                    Stream.of(s.overspendAlert() ? s.overspend() : Optional.empty()))));
        }
    }

    private static void educationOnly(IntentName intent, FactSignals s, Map<String, Object> flags, Emitter out) {
        if (intent == IntentName.INVEST || Boolean.TRUE.equals(flags.get("education_only"))) {
            out.emit("insight.education_only", "compliance", Severity.HIGH,
                    "Guidance is limited to financial education; no trading instructions.", Stream.empty());
        }
    }

    private static List<Optional<Fact>> anomalySupport(FactSignals s) {
        List<Optional<Fact>> support = new ArrayList<>();
        if (s.anomalyCount().isPresent() && s.anomalyCountValue() >= 1) {
            support.add(s.anomalyCount());
        }
        if (s.volatility().isPresent() && Math.abs(s.volatilityValue()) >= FactSignals.VOLATILITY_ALERT) {
            support.add(s.volatility());
        }
        if (s.overspend().isPresent() && Math.abs(s.overspendValue()) >= FactSignals.OVERSPEND_ALERT) {
            support.add(s.overspend());
        }
        return support;
    }

    static boolean needsRiskAppetite(IntentName intent) {
        return intent == IntentName.PLANNING || intent == IntentName.SCENARIO || intent == IntentName.INVEST;
    }
}
