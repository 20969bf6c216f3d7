package com.demoBank.advisor.tools.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Analytical tools reachable through the tool gateway, keyed by their wire names.
 */
public enum ToolName {
    SPEND_ANALYTICS("spend_analytics_v1"),
    CASHFLOW_FORECAST("cashflow_forecast_v1"),
    JAR_ALLOCATION_SUGGEST("jar_allocation_suggest_v1"),
    ANOMALY_SIGNALS("anomaly_signals_v1"),
    RISK_PROFILE_NON_INVESTMENT("risk_profile_non_investment_v1"),
    RECURRING_CASHFLOW_DETECT("recurring_cashflow_detect_v1"),
    GOAL_FEASIBILITY("goal_feasibility_v1"),
    WHAT_IF_SCENARIO("what_if_scenario_v1"),
    SUITABILITY_GUARD("suitability_guard_v1");

    private final String code;

    ToolName(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public static Optional<ToolName> fromCode(String code) {
        for (ToolName tool : values()) {
            if (tool.code.equals(code)) {
                return Optional.of(tool);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return code;
    }
}
