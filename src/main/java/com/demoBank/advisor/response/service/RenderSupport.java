package com.demoBank.advisor.response.service;

import com.demoBank.advisor.response.model.AdvisoryContext;
import com.demoBank.advisor.response.model.Fact;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text helpers shared by the plan renderer and the fallback renderer.
 */
class RenderSupport {

    static final String NOT_AVAILABLE = "n/a";

    private static final Pattern SPACE_BEFORE_PUNCTUATION = Pattern.compile("\\s+([,.;!?])");
    private static final Pattern REPEATED_END_PUNCTUATION = Pattern.compile("([.!?]){2,}\\s*$");
    private static final Pattern TRAILING_ID = Pattern.compile("\\(\\s*[a-z0-9_]+\\s*\\)$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern DIGITS = Pattern.compile("(\\d+)");
    private static final List<String> REASON_MARKERS = List.of(
            "lý do cảnh báo", "ly do canh bao", "anomaly reason", "alert reason");
    private static final Map<String, String> VI_RISK_BANDS = Map.of(
            "low", "thấp",
            "medium", "trung bình",
            "moderate", "trung bình",
            "high", "cao",
            "unknown", "chưa xác định");

    private RenderSupport() {}

    static Map<String, Fact> index(AdvisoryContext context) {
        Map<String, Fact> facts = new LinkedHashMap<>();
        context.facts().forEach(fact -> facts.put(fact.factId(), fact));
        return facts;
    }

    /**
     * Replaces every {@code [F:id]} with the fact's value text, or {@code n/a} when the fact is unknown.
     */
    static String bind(String text, Map<String, Fact> facts) {
        Matcher matcher = GroundingValidator.FACT_PLACEHOLDER.matcher(text == null ? "" : text);
        StringBuilder bound = new StringBuilder();
        while (matcher.find()) {
            Fact fact = facts.get(matcher.group(1).trim());
            String value = fact == null || fact.valueText().isBlank() ? NOT_AVAILABLE : fact.valueText().trim();
            matcher.appendReplacement(bound, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(bound);
        String result = SPACE_BEFORE_PUNCTUATION.matcher(bound).replaceAll("$1");
        return REPEATED_END_PUNCTUATION.matcher(result).replaceAll("$1");
    }

    /**
     * Fact value text as shown to the user; Vietnamese answers get localized risk bands and month units.
     */
    static String localizedValue(Fact fact, boolean vi) {
        String text = fact.valueText().trim();
        if (!vi) {
            return text;
        }
        if (fact.factId().startsWith("risk.risk_band.")) {
            String raw = String.valueOf(fact.value()).trim().toLowerCase(Locale.ROOT);
            return VI_RISK_BANDS.getOrDefault(raw, text);
        }
        if (fact.factId().startsWith("risk.runway_months.") && fact.unit().toLowerCase(Locale.ROOT).startsWith("month")) {
            String lower = text.toLowerCase(Locale.ROOT);
            if (!lower.contains("tháng") && !lower.contains("month")) {
                return text + " tháng";
            }
        }
        return text;
    }

    /**
     * Appends a line unless an equivalent one was already added.
     */
    static void appendUnique(List<String> lines, Set<String> seen, String line) {
        String text = line == null ? "" : line.trim();
        if (text.isEmpty()) {
            return;
        }
        String key = dedupeKey(text);
        if (key.isEmpty() || !seen.add(key)) {
            return;
        }
        lines.add(text);
    }

    static String dedupeKey(String text) {
        String normalized = text.trim();
        while (normalized.startsWith("-")) {
            normalized = normalized.substring(1);
        }
        normalized = normalized.trim().toLowerCase(Locale.ROOT);
        normalized = TRAILING_ID.matcher(normalized).replaceAll("").trim();
        normalized = WHITESPACE.matcher(normalized).replaceAll(" ");

        int colon = normalized.indexOf(':');
        if (colon >= 0) {
            String left = normalized.substring(0, colon).trim();
            String right = normalized.substring(colon + 1).trim();
            if (REASON_MARKERS.stream().anyMatch(left::contains)) {
                Matcher digits = DIGITS.matcher(left);
                normalized = "anomaly_reason_" + (digits.find() ? digits.group(1) : "x") + ":" + right;
            }
        }
        int end = normalized.length();
        while (end > 0 && (normalized.charAt(end - 1) == '.' || normalized.charAt(end - 1) == ' ')) {
            end--;
        }
        return normalized.substring(0, end);
    }
}
