package com.demoBank.advisor.response.service;

import com.demoBank.advisor.config.ResponseSettings;
import com.demoBank.advisor.inference.service.GroqApiClient;
import com.demoBank.advisor.response.model.AdvisoryContext;
import com.demoBank.advisor.response.model.AnswerPlan;
import com.demoBank.advisor.response.model.SynthesisAttempt;
import com.demoBank.advisor.response.prompt.AnswerSynthesisPrompt;
import com.demoBank.advisor.util.LenientJsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Generates one answer plan from the advisory context.
 *
 * Responsibilities:
 * - Render the synthesis prompt, optionally with corrective feedback
 * - Call the model once and parse its output leniently
 * - Check the answer_plan_v2 contract before handing the plan to validation
 *
 * Failures come back as error codes in the attempt, never as exceptions.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnswerSynthesizer {

    static final int SUMMARY_MIN = 3;
    static final int SUMMARY_MAX = 5;
    static final int ACTIONS_MIN = 2;
    static final int ACTIONS_MAX = 4;

    private static final Set<String> ALLOWED_FIELDS = Set.of(
            "schema_version", "language", "summary_lines", "key_metrics", "actions", "assumptions",
            "limitations", "disclaimer", "used_fact_ids", "used_insight_ids", "used_action_ids");
    private static final List<String> STRING_LIST_FIELDS = List.of(
            "summary_lines", "actions", "assumptions", "limitations",
            "used_fact_ids", "used_insight_ids", "used_action_ids");

    private final GroqApiClient groqApiClient;
    private final ResponseSettings settings;
    private final ObjectMapper objectMapper;

    /**
     * Runs one generation.
     *
     * @param userPrompt         prompt after the encoding gate
     * @param context            advisory context the answer must be grounded in
     * @param correctiveFeedback violated rules of the previous attempt, or blank for the first attempt
     * @param traceId            trace id for logging
     */
    public SynthesisAttempt synthesize(String userPrompt, AdvisoryContext context, String correctiveFeedback,
                                       String traceId) {
        if (!groqApiClient.isConfigured()) {
            return SynthesisAttempt.failed(List.of("model_not_configured"));
        }

        String contextJson;
        try {
            contextJson = objectMapper.writeValueAsString(context);
        } catch (JsonProcessingException e) {
            log.warn("Advisory context serialization failed - traceId: {}, error: {}", traceId, e.getMessage());
            return SynthesisAttempt.failed(List.of("inference_error:" + e.getClass().getSimpleName()));
        }
        String prompt = AnswerSynthesisPrompt.build(userPrompt, context.intent().code(),
                settings.requiredDisclaimer(), contextJson, correctiveFeedback);

        String rawText;
        try {
            rawText = groqApiClient.complete(prompt, settings.maxTokens());
        } catch (Exception e) {
            log.warn("Answer synthesis call failed - traceId: {}, error: {}", traceId, e.getMessage());
            return SynthesisAttempt.failed(List.of("inference_error:" + e.getClass().getSimpleName()));
        }

        Optional<ObjectNode> parsed = LenientJsonParser.parseObject(rawText);
        if (parsed.isEmpty()) {
            log.warn("Answer synthesis returned no JSON object - traceId: {}", traceId);
            return SynthesisAttempt.failed(List.of("answer_invalid_json"));
        }

        List<String> schemaErrors = validate(parsed.get());
        if (!schemaErrors.isEmpty()) {
            log.warn("Answer plan failed schema checks - traceId: {}, errors: {}", traceId, schemaErrors);
            List<String> errors = new ArrayList<>();
            errors.add("answer_invalid_schema");
            schemaErrors.stream().limit(3).map(message -> "schema:" + message).forEach(errors::add);
            return SynthesisAttempt.failed(errors);
        }

        AnswerPlan plan;
        try {
            plan = objectMapper.treeToValue(parsed.get(), AnswerPlan.class);
        } catch (JsonProcessingException e) {
            log.warn("Answer plan mapping failed - traceId: {}, error: {}", traceId, e.getMessage());
            return SynthesisAttempt.failed(List.of("answer_invalid_schema", "schema:" + e.getOriginalMessage()));
        }
        log.info("Answer synthesized - traceId: {}, summaryLines: {}, actions: {}, usedFacts: {}",
                traceId, plan.summaryLines().size(), plan.actions().size(), plan.usedFactIds().size());
        return new SynthesisAttempt(plan, List.of());
    }

    List<String> validate(ObjectNode payload) {
        List<String> errors = new ArrayList<>();
        for (String field : ALLOWED_FIELDS) {
            if (!payload.has(field)) {
                errors.add("$: '" + field + "' is a required property");
            }
        }
        payload.fieldNames().forEachRemaining(field -> {
            if (!ALLOWED_FIELDS.contains(field)) {
                errors.add("$: additional property '" + field + "' is not allowed");
            }
        });
        if (payload.has("schema_version") && !AnswerPlan.SCHEMA_VERSION.equals(payload.get("schema_version").asText())) {
            errors.add("schema_version: must be '" + AnswerPlan.SCHEMA_VERSION + "'");
        }
        String language = payload.path("language").asText("");
        if (payload.has("language") && !language.equals("vi") && !language.equals("en")) {
            errors.add("language: must be 'vi' or 'en'");
        }
        if (payload.has("disclaimer") && !payload.get("disclaimer").isTextual()) {
            errors.add("disclaimer: must be a string");
        }
        for (String field : STRING_LIST_FIELDS) {
            JsonNode node = payload.get(field);
            if (node != null && !isStringList(node)) {
                errors.add(field + ": must be an array of strings");
            }
        }
        checkLines(payload.get("summary_lines"), "summary_lines", SUMMARY_MIN, SUMMARY_MAX, errors);
        checkLines(payload.get("actions"), "actions", ACTIONS_MIN, ACTIONS_MAX, errors);

        JsonNode metrics = payload.get("key_metrics");
        if (metrics != null) {
            if (!metrics.isArray()) {
                errors.add("key_metrics: must be an array");
            } else {
                for (int i = 0; i < metrics.size(); i++) {
                    JsonNode metric = metrics.get(i);
                    if (!metric.isObject() || !metric.path("fact_id").isTextual() || !metric.path("label").isTextual()
                            || metric.size() != 2) {
                        errors.add("key_metrics." + i + ": must be {fact_id, label}");
                    }
                }
            }
        }
        return errors;
    }

    private static void checkLines(JsonNode node, String field, int min, int max, List<String> errors) {
        if (node == null || !isStringList(node)) {
            return;
        }
        if (node.size() < min || node.size() > max) {
            errors.add(field + ": must contain " + min + " to " + max + " items");
        }
        for (JsonNode line : node) {
            if (line.asText().isBlank()) {
                errors.add(field + ": items must not be blank");
                return;
            }
        }
    }

    private static boolean isStringList(JsonNode node) {
        if (!node.isArray()) {
            return false;
        }
        for (JsonNode item : node) {
            if (!item.isTextual()) {
                return false;
            }
        }
        return true;
    }
}
