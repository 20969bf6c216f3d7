package com.demoBank.advisor.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

/**
 * Reads JSON objects bundled on the classpath.
 */
@Slf4j
public class JsonFileLoader {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private JsonFileLoader() {}

    /**
     * Reads a classpath resource holding one JSON object.
     *
     * @param resourcePath classpath location, e.g. "mocks/tools/spend_analytics_v1.json"
     * @return the object, or empty when the resource is missing, unreadable or not an object
     */
    public static Optional<ObjectNode> readObject(String resourcePath) {
        try (InputStream in = JsonFileLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (in == null) {
                return Optional.empty();
            }
            JsonNode node = objectMapper.readTree(in);
            return node != null && node.isObject() ? Optional.of((ObjectNode) node) : Optional.empty();
        } catch (IOException e) {
            log.warn("Unreadable JSON resource: {}", resourcePath, e);
            return Optional.empty();
        }
    }
}
