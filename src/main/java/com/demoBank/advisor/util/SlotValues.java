package com.demoBank.advisor.util;

import java.util.Map;
import java.util.Optional;

/**
 * Typed reads over extracted slots, whose values arrive as numbers or numeric strings.
 */
public class SlotValues {

    public static final String[] TARGET_AMOUNT_KEYS = {
            "target_amount_vnd", "target_amount", "goal_target_amount", "savings_goal_vnd", "goal_amount",
            "savings_target_vnd"};
    public static final String[] HORIZON_KEYS = {
            "horizon_months", "goal_horizon_months", "time_horizon_months", "duration_months",
            "saving_horizon_months"};

    private SlotValues() {}

    public static Optional<Double> number(Map<String, Object> slots, String key) {
        return slots == null ? Optional.empty() : number(slots.get(key));
    }

    public static Optional<Double> number(Object raw) {
        if (raw instanceof Number number) {
            double value = number.doubleValue();
            return Double.isFinite(value) ? Optional.of(value) : Optional.empty();
        }
        if (raw instanceof String text && !text.isBlank()) {
            try {
                double value = Double.parseDouble(text.trim().replace(",", ""));
                return Double.isFinite(value) ? Optional.of(value) : Optional.empty();
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * First strictly positive value among the keys.
     */
    public static Optional<Double> firstPositive(Map<String, Object> slots, String... keys) {
        for (String key : keys) {
            Optional<Double> value = number(slots, key).filter(parsed -> parsed > 0);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    public static String text(Map<String, Object> slots, String key) {
        Object raw = slots == null ? null : slots.get(key);
        return raw == null ? "" : raw.toString().trim();
    }
}
