package com.demoBank.advisor.util;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("LenientJsonParser")
class LenientJsonParserTest {

    @Test
    @DisplayName("parses a plain object")
    void plainObject() {
        Optional<ObjectNode> parsed = LenientJsonParser.parseObject("{\"intent\": \"summary\"}");

        assertTrue(parsed.isPresent());
        assertEquals("summary", parsed.get().path("intent").asText());
    }

    @Test
    @DisplayName("unwraps a markdown fence surrounded by prose")
    void fencedObject() {
        String raw = "Here is the result:\n```json\n{\"intent\": \"risk\", \"confidence\": 0.8}\n```\nThanks.";

        Optional<ObjectNode> parsed = LenientJsonParser.parseObject(raw);

        assertTrue(parsed.isPresent());
        assertEquals(0.8, parsed.get().path("confidence").asDouble());
    }

    @Test
    @DisplayName("tolerates a BOM, a json label and trailing commas")
    void bomLabelAndTrailingComma() {
        String raw = "\uFEFFjson: {\"top2\": [\"summary\", \"risk\",], \"reason\": \"ok\",}";

        Optional<ObjectNode> parsed = LenientJsonParser.parseObject(raw);

        assertTrue(parsed.isPresent());
        assertEquals(2, parsed.get().path("top2").size());
    }

    @Test
    @DisplayName("leaves comma-bracket sequences inside strings untouched")
    void commaInsideString() {
        String raw = "{\"reason\": \"matched {a, b,} and [x,]\", \"slots\": {\"note\": \"ends with ,]\",},}";

        Optional<ObjectNode> parsed = LenientJsonParser.parseObject(raw);

        assertTrue(parsed.isPresent());
        assertEquals("matched {a, b,} and [x,]", parsed.get().path("reason").asText());
        assertEquals("ends with ,]", parsed.get().path("slots").path("note").asText());
    }

    @Test
    @DisplayName("replaces typographic quotes")
    void typographicQuotes() {
        Optional<ObjectNode> parsed = LenientJsonParser.parseObject("{“intent”: “planning”}");

        assertTrue(parsed.isPresent());
        assertEquals("planning", parsed.get().path("intent").asText());
    }

    @Test
    @DisplayName("returns empty for text without an object")
    void noObject() {
        assertTrue(LenientJsonParser.parseObject("I cannot answer that.").isEmpty());
        assertTrue(LenientJsonParser.parseObject(null).isEmpty());
        assertTrue(LenientJsonParser.parseObject("[1, 2, 3]").isEmpty());
    }
}
