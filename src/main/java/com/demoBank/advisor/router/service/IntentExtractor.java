package com.demoBank.advisor.router.service;

import com.demoBank.advisor.config.RouterSettings;
import com.demoBank.advisor.inference.service.GroqApiClient;
import com.demoBank.advisor.router.model.ExtractionOutcome;
import com.demoBank.advisor.router.model.IntentExtraction;
import com.demoBank.advisor.router.model.IntentName;
import com.demoBank.advisor.router.model.TopIntentScore;
import com.demoBank.advisor.router.prompt.IntentExtractionPrompt;
import com.demoBank.advisor.util.LenientJsonParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Structured intent extractor.
 *
 * Responsibilities:
 * - Ask the model for one JSON object with intent, ranked candidates, slots and confidences
 * - Parse leniently, then sanitize (derive domain relevance, drop null slots)
 * - Validate the contract and retry a bounded number of times (resilience4j Retry on an empty result)
 *
 * Failures are reported as error codes, never thrown.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IntentExtractor {

    private static final int MAX_TOKENS = 400;
    private static final Set<String> ALLOWED_FIELDS = Set.of(
            "schema_version", "intent", "sub_intent", "confidence", "domain_relevance",
            "top2", "slots", "scenario_confidence", "reason");
    private static final List<String> REQUIRED_FIELDS = List.of(
            "schema_version", "intent", "confidence", "top2", "slots", "reason");

    private final GroqApiClient groqApiClient;
    private final RouterSettings settings;
    private final ObjectMapper objectMapper;

    /**
     * Extracts intent and slots from a prompt.
     *
     * @param prompt  prompt after the encoding gate
     * @param traceId trace id for logging
     * @return outcome with an extraction, or the error codes of every failed attempt
     */
    public ExtractionOutcome extract(String prompt, String traceId) {
        List<String> errors = new ArrayList<>();
        if (!groqApiClient.isConfigured()) {
            errors.add("model_not_configured");
            return new ExtractionOutcome(null, errors, IntentExtractionPrompt.PROMPT_VERSION, 0);
        }

        String promptText = IntentExtractionPrompt.build(prompt);
        Retry retry = Retry.of("intent-extractor", RetryConfig.<IntentExtraction>custom()
                .maxAttempts(settings.extractorRetries() + 1)
                .waitDuration(Duration.ZERO)
                .retryOnResult(Objects::isNull)
                .build());
        AtomicInteger attempts = new AtomicInteger();

        IntentExtraction extraction = Retry.decorateSupplier(retry,
                () -> attempt(promptText, attempts.incrementAndGet(), errors, traceId)).get();
        if (extraction == null) {
            log.warn("Intent extraction exhausted retries - traceId: {}, attempts: {}, errors: {}",
                    traceId, attempts.get(), errors);
            return new ExtractionOutcome(null, errors, IntentExtractionPrompt.PROMPT_VERSION, attempts.get());
        }

        log.info("Intent extracted - traceId: {}, intent: {}, confidence: {}, top2Gap: {}, attempt: {}",
                traceId, extraction.intent(), String.format("%.2f", extraction.confidence()),
                String.format("%.2f", extraction.top2Gap()), attempts.get());
        return new ExtractionOutcome(extraction, errors, IntentExtractionPrompt.PROMPT_VERSION, attempts.get());
    }

    /**
     * One inference attempt. Returns null and records error codes when the output is unusable.
     */
    private IntentExtraction attempt(String promptText, int attempt, List<String> errors, String traceId) {
        String rawText;
        try {
            rawText = groqApiClient.complete(promptText, MAX_TOKENS);
        } catch (Exception e) {
            errors.add("inference_error:" + e.getClass().getSimpleName());
            log.warn("Intent extraction call failed - traceId: {}, attempt: {}, error: {}",
                    traceId, attempt, e.getMessage());
            return null;
        }

        Optional<ObjectNode> parsed = LenientJsonParser.parseObject(rawText);
        if (parsed.isEmpty()) {
            errors.add("invalid_json");
            log.warn("Intent extraction returned no JSON object - traceId: {}, attempt: {}", traceId, attempt);
            return null;
        }

        ObjectNode payload = sanitize(parsed.get());
        List<String> schemaErrors = validate(payload);
        if (!schemaErrors.isEmpty()) {
            errors.add("invalid_schema");
            schemaErrors.stream().limit(3).map(message -> "schema:" + message).forEach(errors::add);
            log.warn("Intent extraction failed validation - traceId: {}, attempt: {}, errors: {}",
                    traceId, attempt, schemaErrors);
            return null;
        }
        return toExtraction(payload);
    }

    ObjectNode sanitize(ObjectNode source) {
        ObjectNode normalized = source.deepCopy();
        if (isMissingOrNull(normalized, "sub_intent")) {
            normalized.put("sub_intent", "");
        }
        if (isMissingOrNull(normalized, "reason")) {
            normalized.put("reason", "");
        }
        if (normalized.has("scenario_confidence") && normalized.get("scenario_confidence").isNull()) {
            normalized.remove("scenario_confidence");
        }

        JsonNode domainRelevance = normalized.get("domain_relevance");
        if (domainRelevance != null && domainRelevance.isNumber()) {
            normalized.put("domain_relevance", clamp01(domainRelevance.asDouble()));
        } else {
            normalized.put("domain_relevance", deriveDomainRelevance(normalized));
        }

        JsonNode slots = normalized.get("slots");
        if (slots != null && slots.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = slots.fields();
            while (fields.hasNext()) {
                if (fields.next().getValue().isNull()) {
                    fields.remove();
                }
            }
        }
        return normalized;
    }

    private double deriveDomainRelevance(ObjectNode payload) {
        double outOfScopeScore = 0.0;
        JsonNode top2 = payload.get("top2");
        if (top2 != null && top2.isArray()) {
            for (JsonNode item : top2) {
                if (!item.isObject() || !"out_of_scope".equals(item.path("intent").asText("").trim())) {
                    continue;
                }
                if (item.path("score").isNumber()) {
                    outOfScopeScore = clamp01(item.get("score").asDouble());
                    break;
                }
            }
        }
        if (outOfScopeScore > 0) {
            return 1.0 - outOfScopeScore;
        }
        if ("out_of_scope".equals(payload.path("intent").asText(""))) {
            return 0.2;
        }
        JsonNode confidence = payload.get("confidence");
        if (confidence != null && confidence.isNumber()) {
            return clamp01(confidence.asDouble());
        }
        return 0.5;
    }

    List<String> validate(ObjectNode payload) {
        List<String> errors = new ArrayList<>();
        for (String field : REQUIRED_FIELDS) {
            if (!payload.has(field)) {
                errors.add("$: '" + field + "' is a required property");
            }
        }
        payload.fieldNames().forEachRemaining(field -> {
            if (!ALLOWED_FIELDS.contains(field)) {
                errors.add("$: additional property '" + field + "' is not allowed");
            }
        });
        if (payload.has("schema_version") && !IntentExtraction.SCHEMA_VERSION.equals(payload.get("schema_version").asText())) {
            errors.add("schema_version: must be '" + IntentExtraction.SCHEMA_VERSION + "'");
        }
        if (payload.has("intent") && intentOf(payload.get("intent")).isEmpty()) {
            errors.add("intent: '" + payload.get("intent").asText() + "' is not a known intent");
        }
        checkScore(payload, "confidence", errors);
        checkScore(payload, "domain_relevance", errors);
        checkScore(payload, "scenario_confidence", errors);
        if (payload.has("sub_intent") && !payload.get("sub_intent").isTextual()) {
            errors.add("sub_intent: must be a string");
        }
        if (payload.has("reason") && !payload.get("reason").isTextual()) {
            errors.add("reason: must be a string");
        }
        if (payload.has("slots") && !payload.get("slots").isObject()) {
            errors.add("slots: must be an object");
        }
        JsonNode top2 = payload.get("top2");
        if (top2 != null) {
            if (!top2.isArray() || top2.size() != 2) {
                errors.add("top2: must contain exactly 2 candidates");
            } else {
                for (int i = 0; i < 2; i++) {
                    JsonNode item = top2.get(i);
                    if (!item.isObject() || intentOf(item.get("intent")).isEmpty()) {
                        errors.add("top2." + i + ": unknown intent");
                        continue;
                    }
                    JsonNode score = item.get("score");
                    if (score == null || !score.isNumber() || score.asDouble() < 0.0 || score.asDouble() > 1.0) {
                        errors.add("top2." + i + ".score: must be a number in [0, 1]");
                    }
                    if (item.size() != 2) {
                        errors.add("top2." + i + ": additional properties are not allowed");
                    }
                }
            }
        }
        return errors;
    }

    private IntentExtraction toExtraction(ObjectNode payload) {
        List<TopIntentScore> top2 = new ArrayList<>();
        for (JsonNode item : payload.get("top2")) {
            top2.add(new TopIntentScore(intentOf(item.get("intent")).orElseThrow(), item.get("score").asDouble()));
        }
        Map<String, Object> slots = new LinkedHashMap<>();
        payload.get("slots").fields().forEachRemaining(entry ->
                slots.put(entry.getKey(), objectMapper.convertValue(entry.getValue(), Object.class)));
        JsonNode scenarioConfidence = payload.get("scenario_confidence");
        return new IntentExtraction(
                intentOf(payload.get("intent")).orElseThrow(),
                payload.path("sub_intent").asText(""),
                payload.get("confidence").asDouble(),
                payload.get("domain_relevance").asDouble(),
                top2,
                slots,
                scenarioConfidence != null ? scenarioConfidence.asDouble() : null,
                payload.path("reason").asText(""));
    }

    private static void checkScore(ObjectNode payload, String field, List<String> errors) {
        if (!payload.has(field)) {
            return;
        }
        JsonNode value = payload.get(field);
        if (!value.isNumber() || value.asDouble() < 0.0 || value.asDouble() > 1.0) {
            errors.add(field + ": must be a number in [0, 1]");
        }
    }

    private static Optional<IntentName> intentOf(JsonNode node) {
        if (node == null || !node.isTextual()) {
            return Optional.empty();
        }
        return IntentName.fromCode(node.asText());
    }

    private static boolean isMissingOrNull(ObjectNode node, String field) {
        return !node.has(field) || node.get(field).isNull();
    }

    private static double clamp01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
