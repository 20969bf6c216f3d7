package com.demoBank.advisor.response.service;

import com.demoBank.advisor.response.model.ActionCandidate;
import com.demoBank.advisor.response.model.AdvisoryContext;
import com.demoBank.advisor.response.model.AnswerPlan;
import com.demoBank.advisor.response.model.Fact;
import com.demoBank.advisor.response.model.Insight;
import com.demoBank.advisor.response.model.KeyMetric;
import com.demoBank.advisor.router.model.IntentName;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Checks that an answer plan only shows what the advisory context grounds.
 *
 * Responsibilities:
 * - Every declared id (facts, insights, actions, metrics, placeholders) exists in the context
 * - Every fact referenced by a metric or a placeholder is declared as used
 * - Every numeric token in the prose is traceable to a fact, an action parameter or the user prompt
 * - The disclaimer is present and education-only answers carry no execution advice
 *
 * Errors are returned sorted and distinct; an empty list means the plan is grounded.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GroundingValidator {

    public static final String PLACEHOLDER_NOT_DECLARED = "placeholder_fact_not_declared_used";

    static final Pattern FACT_PLACEHOLDER = Pattern.compile("\\[F:([a-zA-Z0-9._-]+)\\]");
    private static final Pattern NUMERIC_TOKEN = Pattern.compile("[-+]?\\d[\\d,.]*%?");
    private static final Pattern LIST_MARKER = Pattern.compile("(?m)^\\s*\\d+[.)]\\s+");
    private static final Pattern EXECUTION_TERM = Pattern.compile(
            "\\b(buy|sell|trade|execute|short|long|mua|bán|đặt lệnh)\\b",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS);
    private static final String TOKEN_TRIM = ".,;:()[]{}";
    private static final int SAMPLE_SIZE = 5;

    private final ObjectMapper objectMapper;

    /**
     * Validates a plan against its context.
     *
     * @param plan                generated plan
     * @param context             advisory context the plan must be grounded in
     * @param promptNumericTokens numeric tokens of the user prompt, allowed verbatim
     * @return sorted distinct error codes, with {@code <rule>_sample:} entries listing offending values
     */
    public List<String> validate(AnswerPlan plan, AdvisoryContext context, Set<String> promptNumericTokens) {
        Set<String> errors = new TreeSet<>();

        Set<String> factIds = context.facts().stream().map(Fact::factId).collect(Collectors.toSet());
        Set<String> insightIds = context.insights().stream().map(Insight::insightId).collect(Collectors.toSet());
        Set<String> actionIds = context.actions().stream().map(ActionCandidate::actionId).collect(Collectors.toSet());
        Set<String> usedFactIds = new LinkedHashSet<>(plan.usedFactIds());

        if (!factIds.containsAll(plan.usedFactIds())) {
            errors.add("unknown_used_fact_ids");
        }
        if (!insightIds.containsAll(plan.usedInsightIds())) {
            errors.add("unknown_used_insight_ids");
        }
        if (!actionIds.containsAll(plan.usedActionIds())) {
            errors.add("unknown_used_action_ids");
        }
        for (KeyMetric metric : plan.keyMetrics()) {
            if (!factIds.contains(metric.factId())) {
                errors.add("unknown_metric_fact_id");
            }
            if (!usedFactIds.contains(metric.factId())) {
                errors.add("metric_fact_not_declared_used");
            }
        }

        List<String> sections = textSections(plan);
        Set<String> placeholders = new TreeSet<>();
        sections.forEach(section -> placeholders.addAll(placeholderIds(section)));

        List<String> unknownPlaceholders = placeholders.stream().filter(id -> !factIds.contains(id)).toList();
        if (!unknownPlaceholders.isEmpty()) {
            errors.add("unknown_fact_placeholders");
            errors.add("unknown_fact_placeholders_sample:" + sample(unknownPlaceholders));
        }
        List<String> undeclared = placeholders.stream().filter(id -> !usedFactIds.contains(id)).toList();
        if (!undeclared.isEmpty()) {
            errors.add(PLACEHOLDER_NOT_DECLARED);
            errors.add(PLACEHOLDER_NOT_DECLARED + "_sample:" + sample(undeclared));
        }

        Set<String> shown = new TreeSet<>();
        for (String section : sections) {
            String cleaned = LIST_MARKER.matcher(FACT_PLACEHOLDER.matcher(section).replaceAll(" ")).replaceAll("");
            shown.addAll(numericTokens(cleaned));
        }
        Set<String> allowed = allowedTokens(context, promptNumericTokens);
        List<String> ungrounded = shown.stream()
                .filter(token -> !allowed.contains(token))
                .filter(token -> !isSoftToken(token))
                .toList();
        if (!ungrounded.isEmpty()) {
            errors.add("ungrounded_numeric_tokens");
            errors.add("ungrounded_numeric_tokens_sample:" + sample(ungrounded));
        }

        if (plan.disclaimer().isBlank()) {
            errors.add("disclaimer_missing");
        }

        boolean educationOnly = context.isEducationOnly() || context.intent() == IntentName.INVEST;
        if (educationOnly && EXECUTION_TERM.matcher(Normalizer.normalize(String.join(" ", sections),
                Normalizer.Form.NFC)).find()) {
            errors.add("education_only_policy_violation");
        }
        return new ArrayList<>(errors);
    }

    /**
     * Rule names of an error list, without the {@code _sample:} detail entries.
     */
    public static List<String> ruleNames(List<String> errors) {
        return errors.stream().filter(error -> !error.contains("_sample:")).distinct().toList();
    }

    /**
     * Numeric tokens of a text, trimmed of surrounding punctuation.
     */
    public static Set<String> numericTokens(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        if (text == null) {
            return tokens;
        }
        Matcher matcher = NUMERIC_TOKEN.matcher(text);
        while (matcher.find()) {
            String token = trim(matcher.group());
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    static Set<String> placeholderIds(String text) {
        Set<String> ids = new LinkedHashSet<>();
        Matcher matcher = FACT_PLACEHOLDER.matcher(text == null ? "" : text);
        while (matcher.find()) {
            ids.add(matcher.group(1).trim());
        }
        return ids;
    }

    static List<String> textSections(AnswerPlan plan) {
        return Stream.of(plan.summaryLines(), plan.actions(), plan.assumptions(), plan.limitations())
                .flatMap(List::stream)
                .toList();
    }

    private Set<String> allowedTokens(AdvisoryContext context, Set<String> promptNumericTokens) {
        Set<String> allowed = new LinkedHashSet<>();
        if (promptNumericTokens != null) {
            promptNumericTokens.stream().map(String::trim).filter(token -> !token.isEmpty()).forEach(allowed::add);
        }
        for (Fact fact : context.facts()) {
            allowed.addAll(numericTokens(fact.valueText()));
            allowed.addAll(numericTokens(fact.timeframe()));
            allowed.addAll(numericTokens(plainValue(fact.value())));
        }
        for (ActionCandidate action : context.actions()) {
            try {
                allowed.addAll(numericTokens(objectMapper.writeValueAsString(action.params())));
            } catch (JsonProcessingException e) {
                log.debug("Action params not serializable - action: {}, error: {}", action.actionId(), e.getMessage());
                allowed.addAll(numericTokens(String.valueOf(action.params())));
            }
        }
        return allowed;
    }

    /**
     * Soft tolerance for cadence and ordinal numbers: percentages up to 25 and integers up to 31.
     */
    static boolean isSoftToken(String token) {
        boolean percent = token.endsWith("%");
        String normalized = (percent ? token.substring(0, token.length() - 1) : token).replace(",", "");
        double value;
        try {
            value = Double.parseDouble(normalized);
        } catch (NumberFormatException e) {
            return false;
        }
        double absolute = Math.abs(value);
        if (percent) {
            return absolute <= 25;
        }
        return absolute == Math.floor(absolute) && absolute <= 31;
    }

    private static String plainValue(Object value) {
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            if (Double.isFinite(number)) {
                return BigDecimal.valueOf(number).stripTrailingZeros().toPlainString();
            }
        }
        return String.valueOf(value);
    }

    private static String trim(String raw) {
        int start = 0;
        int end = raw.length();
        while (start < end && TOKEN_TRIM.indexOf(raw.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && TOKEN_TRIM.indexOf(raw.charAt(end - 1)) >= 0) {
            end--;
        }
        return raw.substring(start, end);
    }

    private static String sample(List<String> values) {
        return values.stream().limit(SAMPLE_SIZE).collect(Collectors.joining(","));
    }
}
