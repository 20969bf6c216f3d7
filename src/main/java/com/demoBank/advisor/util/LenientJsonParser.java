package com.demoBank.advisor.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts one JSON object from free-form model output.
 * Tolerates a byte-order mark, typographic quotes, a leading "json:" label, markdown fences,
 * prose around the object and trailing commas.
 */
public class LenientJsonParser {

    private static final ObjectMapper objectMapper = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .build();

    private static final Pattern JSON_LABEL = Pattern.compile("^\\s*json\\s*[:\\-]?\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern FENCED_OBJECT = Pattern.compile("```(?:json)?\\s*(\\{.*\\})\\s*```",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private LenientJsonParser() {}

    /**
     * Parses the first JSON object found in the text.
     *
     * @param rawText model output, may be null
     * @return the object, or empty when no candidate parses to an object
     */
    public static Optional<ObjectNode> parseObject(String rawText) {
        String text = normalize(rawText);
        if (text.isEmpty()) {
            return Optional.empty();
        }

        Optional<ObjectNode> direct = loadCandidate(text);
        if (direct.isPresent()) {
            return direct;
        }

        Matcher fenced = FENCED_OBJECT.matcher(text);
        if (fenced.find()) {
            Optional<ObjectNode> parsed = loadCandidate(fenced.group(1));
            if (parsed.isPresent()) {
                return parsed;
            }
        }

        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return Optional.empty();
        }
        return loadCandidate(text.substring(start, end + 1));
    }

    private static String normalize(String text) {
        String normalized = text == null ? "" : text.strip();
        while (normalized.startsWith("\uFEFF")) {
            normalized = normalized.substring(1);
        }
        normalized = normalized
                .replace('\u201C', '"')
                .replace('\u201D', '"')
                .replace('\u2018', '\'')
                .replace('\u2019', '\'');
        normalized = JSON_LABEL.matcher(normalized).replaceFirst("");
        return normalized.strip();
    }

    private static Optional<ObjectNode> loadCandidate(String text) {
        String candidate = normalize(text);
        if (candidate.isEmpty()) {
            return Optional.empty();
        }
        try {
            return asObject(objectMapper.readTree(candidate));
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    private static Optional<ObjectNode> asObject(JsonNode parsed) {
        if (parsed == null) {
            return Optional.empty();
        }
        if (parsed.isObject()) {
            return Optional.of((ObjectNode) parsed);
        }
        if (parsed.isArray() && !parsed.isEmpty() && parsed.get(0).isObject()) {
            return Optional.of((ObjectNode) parsed.get(0));
        }
        if (parsed.isTextual()) {
            try {
                JsonNode nested = objectMapper.readTree(parsed.asText());
                if (nested != null && nested.isObject()) {
                    return Optional.of((ObjectNode) nested);
                }
            } catch (JsonProcessingException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
