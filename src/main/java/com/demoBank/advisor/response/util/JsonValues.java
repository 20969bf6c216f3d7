package com.demoBank.advisor.response.util;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient readers for tool output fields. A missing, null or unparsable field reads as empty.
 */
public class JsonValues {

    private static final Pattern FIRST_INT = Pattern.compile("\\d+");

    private JsonValues() {}

    public static Optional<Double> number(JsonNode node, String field) {
        if (node == null) {
            return Optional.empty();
        }
        return number(node.get(field));
    }

    public static Optional<Double> number(JsonNode value) {
        if (value == null || value.isNull() || value.isBoolean()) {
            return Optional.empty();
        }
        if (value.isNumber()) {
            return Optional.of(value.asDouble());
        }
        if (value.isTextual()) {
            String text = value.asText().trim().replace(",", "");
            if (text.isEmpty()) {
                return Optional.empty();
            }
            try {
                double parsed = Double.parseDouble(text);
                return Double.isFinite(parsed) ? Optional.of(parsed) : Optional.empty();
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * Integer field; text values such as "180d" read their first digit run.
     */
    public static Optional<Integer> integer(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull() || value.isBoolean()) {
            return Optional.empty();
        }
        if (value.isNumber()) {
            return Optional.of(value.asInt());
        }
        Matcher matcher = FIRST_INT.matcher(value.asText(""));
        return matcher.find() ? Optional.of(Integer.parseInt(matcher.group())) : Optional.empty();
    }

    /**
     * Trimmed text field; empty when missing or blank.
     */
    public static String text(JsonNode node, String field) {
        if (node == null) {
            return "";
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return "";
        }
        return value.asText("").trim();
    }

    /**
     * Non-blank trimmed texts of an array field, in order.
     */
    public static List<String> texts(JsonNode node, String field) {
        List<String> values = new ArrayList<>();
        JsonNode array = node == null ? null : node.get(field);
        if (array == null || !array.isArray()) {
            return values;
        }
        for (JsonNode item : array) {
            String text = item.isValueNode() ? item.asText("").trim() : "";
            if (!text.isEmpty()) {
                values.add(text);
            }
        }
        return values;
    }
}
