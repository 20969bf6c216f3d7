package com.demoBank.advisor.tools.service;

import com.demoBank.advisor.router.model.IntentName;
import com.demoBank.advisor.tools.model.ToolName;
import com.demoBank.advisor.util.SlotValues;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.text.Normalizer;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds per-tool call arguments from the routed intent and extracted slots.
 * Numeric arguments are clamped to the ranges the tools accept; absent slots fall back to tool defaults.
 */
@Service
@RequiredArgsConstructor
public class ToolArgumentsBuilder {

    static final int ANOMALY_LOOKBACK_MIN = 30;
    static final int ANOMALY_LOOKBACK_MAX = 365;
    static final int ANOMALY_LOOKBACK_DEFAULT = 90;
    static final int RISK_LOOKBACK_MIN = 60;
    static final int RISK_LOOKBACK_MAX = 720;
    static final int RISK_LOOKBACK_DEFAULT = 180;
    static final int RECURRING_LOOKBACK_MIN = 3;
    static final int RECURRING_LOOKBACK_MAX = 24;
    static final int RECURRING_LOOKBACK_DEFAULT = 6;
    static final int SCENARIO_HORIZON_MIN = 1;
    static final int SCENARIO_HORIZON_MAX = 60;
    static final int SCENARIO_HORIZON_DEFAULT = 12;
    static final int GOAL_HORIZON_MIN = 1;
    static final int GOAL_HORIZON_MAX = 360;

    private static final Pattern ACTION_TERM = Pattern.compile("\\b(buy|sell|trade|mua|bán|đặt lệnh)\\b",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS);
    private static final List<String> DELTA_KEYS = List.of(
            "income_delta_pct", "spend_delta_pct", "income_delta_amount_vnd", "spend_delta_amount_vnd");

    private final ObjectMapper objectMapper;

    /**
     * Inputs shared by every tool call of one turn.
     */
    public record CallContext(String userId, String traceId, String prompt, IntentName intent,
                              Map<String, Object> slots) {
        public CallContext {
            slots = slots == null ? Map.of() : slots;
            prompt = prompt == null ? "" : prompt;
        }
    }

    /**
     * Arguments for every tool of a bundle, in bundle order.
     */
    public Map<ToolName, ObjectNode> build(List<ToolName> bundle, CallContext context) {
        Map<ToolName, ObjectNode> arguments = new EnumMap<>(ToolName.class);
        for (ToolName tool : bundle) {
            arguments.put(tool, argumentsFor(tool, context));
        }
        return arguments;
    }

    public ObjectNode argumentsFor(ToolName tool, CallContext context) {
        ObjectNode args = objectMapper.createObjectNode();
        args.put("user_id", context.userId());
        Map<String, Object> slots = context.slots();

        switch (tool) {
            case SPEND_ANALYTICS -> {
                args.put("range", spendRange(SlotValues.number(slots.get("lookback_days")).orElse(null)));
                args.put("trace_id", context.traceId());
            }
            case CASHFLOW_FORECAST -> args.put("horizon", "weekly_12");
            case ANOMALY_SIGNALS -> args.put("lookback_days", clampedInt(slots.get("lookback_days"),
                    ANOMALY_LOOKBACK_MIN, ANOMALY_LOOKBACK_MAX, ANOMALY_LOOKBACK_DEFAULT));
            case RISK_PROFILE_NON_INVESTMENT -> args.put("lookback_days", clampedInt(slots.get("lookback_days"),
                    RISK_LOOKBACK_MIN, RISK_LOOKBACK_MAX, RISK_LOOKBACK_DEFAULT));
            case RECURRING_CASHFLOW_DETECT -> args.put("lookback_months", clampedInt(slots.get("lookback_months"),
                    RECURRING_LOOKBACK_MIN, RECURRING_LOOKBACK_MAX, RECURRING_LOOKBACK_DEFAULT));
            case JAR_ALLOCATION_SUGGEST -> SlotValues.number(slots.get("monthly_income_vnd"))
                    .filter(value -> value > 0)
                    .ifPresent(value -> args.put("monthly_income_override", value));
            case GOAL_FEASIBILITY -> {
                SlotValues.firstPositive(slots, SlotValues.TARGET_AMOUNT_KEYS)
                        .ifPresent(value -> args.put("target_amount", value));
                SlotValues.firstPositive(slots, SlotValues.HORIZON_KEYS)
                        .ifPresent(value -> args.put("horizon_months",
                                clamp(value, GOAL_HORIZON_MIN, GOAL_HORIZON_MAX)));
            }
            case WHAT_IF_SCENARIO -> {
                args.put("horizon_months", clampedInt(slots.get("horizon_months"),
                        SCENARIO_HORIZON_MIN, SCENARIO_HORIZON_MAX, SCENARIO_HORIZON_DEFAULT));
                args.put("seasonality", true);
                args.put("goal", "maximize_savings");
                args.putObject("base_scenario_overrides");
                ObjectNode overrides = scenarioOverrides(slots);
                if (!overrides.isEmpty()) {
                    ArrayNode variants = args.putArray("variants");
                    ObjectNode variant = variants.addObject();
                    variant.put("name", "user_requested");
                    variant.set("scenario_overrides", overrides);
                }
            }
            case SUITABILITY_GUARD -> {
                args.put("intent", context.intent() == null ? "" : context.intent().code());
                args.put("requested_action", requestedAction(context.prompt()));
                args.put("prompt", context.prompt());
                args.put("trace_id", context.traceId());
            }
        }
        return args;
    }

    /**
     * The trading action named in the prompt (Vietnamese terms mua, bán, đặt lệnh mapped to buy, sell, trade), or "advice".
     */
    public static String requestedAction(String prompt) {
        Matcher matcher = ACTION_TERM.matcher(Normalizer.normalize(prompt == null ? "" : prompt, Normalizer.Form.NFC));
        if (!matcher.find()) {
            return "advice";
        }
        String term = matcher.group(1).toLowerCase(Locale.ROOT);
        return switch (term) {
            case "mua" -> "buy";
            case "bán" -> "sell";
            case "đặt lệnh" -> "trade";
            default -> term;
        };
    }

    static String spendRange(Double days) {
        if (days == null || days <= 45) {
            return "30d";
        }
        return days <= 75 ? "60d" : "90d";
    }

    private ObjectNode scenarioOverrides(Map<String, Object> slots) {
        ObjectNode overrides = objectMapper.createObjectNode();
        for (String key : DELTA_KEYS) {
            Optional<Double> value = SlotValues.number(slots.get(key));
            if (value.isEmpty() || value.get() == 0.0) {
                continue;
            }
            double delta = value.get();
            if (key.endsWith("_pct") && Math.abs(delta) > 1) {
                delta = delta / 100.0;
            }
            overrides.put(key, delta);
        }
        return overrides;
    }

    private static int clampedInt(Object raw, int min, int max, int defaultValue) {
        return SlotValues.number(raw)
                .filter(value -> value > 0)
                .map(value -> clamp(value, min, max))
                .orElse(defaultValue);
    }

    /**
     * Rounds and clamps in long arithmetic; values beyond the int range land on the nearest bound.
     */
    static int clamp(double value, int min, int max) {
        return (int) Math.max(min, Math.min(max, Math.round(value)));
    }
}
