package com.demoBank.advisor.response.service;

import com.demoBank.advisor.response.model.Fact;
import com.demoBank.advisor.response.model.RiskAppetite;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Facts the insight, action and fallback rules read, looked up once per turn.
 * Numeric reads of absent facts are 0.
 */
record FactSignals(
        Optional<Fact> net,
        Optional<Fact> runway,
        Optional<Fact> anomalyCount,
        Optional<Fact> volatility,
        Optional<Fact> overspend,
        Optional<Fact> goalGap,
        Optional<Fact> goalFeasible,
        Optional<Fact> jarRatio,
        Optional<Fact> scenarioDelta,
        Optional<Fact> scenarioBestVariant,
        Optional<Fact> serviceSavings,
        Optional<Fact> serviceLoans,
        Optional<Fact> serviceCards,
        Optional<Fact> servicePlaybook,
        Optional<Fact> serviceCount,
        Optional<Fact> riskAppetiteSlot,
        RiskAppetite riskAppetite) {

    static final double VOLATILITY_ALERT = 0.35;
    static final double OVERSPEND_ALERT = 0.30;

    static FactSignals of(List<Fact> facts, Map<String, Object> policyFlags) {
        Optional<Fact> appetiteSlot = exact(facts, "slot.risk_appetite");
        return new FactSignals(
                prefix(facts, "spend.net_cashflow."),
                prefix(facts, "risk.runway_months."),
                prefix(facts, "anomaly.flags_count."),
                prefix(facts, "risk.cashflow_volatility."),
                prefix(facts, "risk.overspend_propensity."),
                prefix(facts, "goal.gap_amount"),
                prefix(facts, "goal.feasible"),
                prefix(facts, "jar.top.ratio"),
                prefix(facts, "scenario.best_variant.delta"),
                prefix(facts, "scenario.best_variant.name"),
                exact(facts, "kb.service_category.savings_deposit"),
                exact(facts, "kb.service_category.loans_credit"),
                exact(facts, "kb.service_category.cards_payments"),
                exact(facts, "kb.service_category.service_playbook"),
                exact(facts, "kb.service_category.count"),
                appetiteSlot,
                RiskAppetite.resolve(policyFlags, appetiteSlot));
    }

    double netValue() {
        return value(net);
    }

    double runwayValue() {
        return value(runway);
    }

    double anomalyCountValue() {
        return value(anomalyCount);
    }

    double volatilityValue() {
        return value(volatility);
    }

    double overspendValue() {
        return value(overspend);
    }

    double goalGapValue() {
        return value(goalGap);
    }

    double scenarioDeltaValue() {
        return value(scenarioDelta);
    }

    boolean goalInfeasible() {
        return goalFeasible.map(fact -> Boolean.FALSE.equals(fact.value())).orElse(false);
    }

    boolean overspendAlert() {
        return overspend.isPresent() && overspendValue() >= OVERSPEND_ALERT;
    }

    private static double value(Optional<Fact> fact) {
        return fact.map(Fact::numericValue).orElse(0.0);
    }

    private static Optional<Fact> prefix(List<Fact> facts, String prefix) {
        return facts.stream().filter(fact -> fact.factId().startsWith(prefix)).findFirst();
    }

    private static Optional<Fact> exact(List<Fact> facts, String factId) {
        return facts.stream().filter(fact -> fact.factId().equals(factId)).findFirst();
    }
}
