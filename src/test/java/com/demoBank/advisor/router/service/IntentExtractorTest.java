package com.demoBank.advisor.router.service;

import com.demoBank.advisor.config.RouterSettings;
import com.demoBank.advisor.inference.exception.InferenceException;
import com.demoBank.advisor.inference.service.GroqApiClient;
import com.demoBank.advisor.router.model.ExtractionOutcome;
import com.demoBank.advisor.router.model.IntentName;
import com.demoBank.advisor.router.model.RouteDecision;
import com.demoBank.advisor.router.model.RouterMode;
import com.demoBank.advisor.tools.model.ToolName;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("IntentExtractor")
class IntentExtractorTest {

    private static final String TRACE_ID = "trc_ext00001";
    private static final String VALID = """
            {"schema_version": "intent_extraction_v1", "intent": "summary", "sub_intent": "",
             "confidence": 0.91, "top2": [{"intent": "summary", "score": 0.91}, {"intent": "risk", "score": 0.06}],
             "slots": {"lookback_days": 30}, "reason": "cashflow overview"}
            """;
    private static final String WRONG_SCHEMA = """
            {"schema_version": "intent_extraction_v1", "intent": "shopping", "confidence": 1.7,
             "top2": [{"intent": "summary", "score": 0.5}], "slots": {}, "reason": "", "mood": "happy"}
            """;

    private GroqApiClient groqApiClient;
    private RouterSettings settings;
    private IntentExtractor extractor;

    @BeforeEach
    void setUp() {
        groqApiClient = mock(GroqApiClient.class);
        when(groqApiClient.isConfigured()).thenReturn(true);
        settings = new RouterSettings(RouterMode.SEMANTIC_ENFORCE, "v1", 0.70, 0.15, 0.75, 2, 2);
        extractor = new IntentExtractor(groqApiClient, settings, new ObjectMapper());
    }

    @Nested
    @DisplayName("bounded attempts")
    class BoundedAttempts {

        @Test
        @DisplayName("gives up after retries + 1 schema-invalid answers")
        void schemaInvalidExhausts() {
            when(groqApiClient.complete(anyString(), anyInt())).thenReturn(WRONG_SCHEMA);

            ExtractionOutcome outcome = extractor.extract("???", TRACE_ID);

            assertFalse(outcome.succeeded());
            assertEquals(3, outcome.attempts());
            assertEquals(3, Collections.frequency(outcome.errors(), "invalid_schema"));
            assertTrue(outcome.errors().stream().anyMatch(error -> error.startsWith("schema:")));
            verify(groqApiClient, times(3)).complete(anyString(), anyInt());
        }

        @Test
        @DisplayName("stops at the first valid answer and keeps earlier errors")
        void recoversOnRetry() {
            when(groqApiClient.complete(anyString(), anyInt()))
                    .thenReturn("Sure! Here is the JSON you asked for.")
                    .thenReturn("```json\n" + VALID + "\n```");

            ExtractionOutcome outcome = extractor.extract("How is my cashflow?", TRACE_ID);

            assertTrue(outcome.succeeded());
            assertEquals(2, outcome.attempts());
            assertEquals(List.of("invalid_json"), outcome.errors());
            assertEquals(IntentName.SUMMARY, outcome.extraction().intent());
            verify(groqApiClient, times(2)).complete(anyString(), anyInt());
        }

        @Test
        @DisplayName("records inference failures by exception type")
        void inferenceFailures() {
            when(groqApiClient.complete(anyString(), anyInt())).thenThrow(new InferenceException("read timed out"));

            ExtractionOutcome outcome = extractor.extract("How is my cashflow?", TRACE_ID);

            assertFalse(outcome.succeeded());
            assertEquals(3, outcome.attempts());
            assertEquals(List.of("inference_error:InferenceException", "inference_error:InferenceException",
                    "inference_error:InferenceException"), outcome.errors());
        }

        @Test
        @DisplayName("makes no call when the model is not configured")
        void notConfigured() {
            when(groqApiClient.isConfigured()).thenReturn(false);

            ExtractionOutcome outcome = extractor.extract("How is my cashflow?", TRACE_ID);

            assertEquals(0, outcome.attempts());
            assertEquals(List.of("model_not_configured"), outcome.errors());
            verify(groqApiClient, never()).complete(anyString(), anyInt());
        }
    }

    @Test
    @DisplayName("an exhausted extraction routes out_of_scope with a question and no tools")
    void failedExtractionRoute() {
        when(groqApiClient.complete(anyString(), anyInt())).thenReturn(WRONG_SCHEMA);
        ExtractionOutcome outcome = extractor.extract("???", TRACE_ID);

        RouteDecision decision = new RoutingPolicy(settings, new ClarificationService())
                .extractionFailed(RouterMode.SEMANTIC_ENFORCE, outcome.errors(), 0, false);

        assertEquals(IntentName.OUT_OF_SCOPE, decision.finalIntent());
        assertTrue(decision.clarifyNeeded());
        assertTrue(decision.toolBundle().isEmpty());
        assertEquals("intent_extraction_failed", decision.reasonCodes().get(0));
        assertTrue(decision.reasonCodes().contains("invalid_schema"));

        RouteDecision exhausted = new RoutingPolicy(settings, new ClarificationService())
                .extractionFailed(RouterMode.SEMANTIC_ENFORCE, outcome.errors(), 2, false);
        assertEquals(List.of(ToolName.SUITABILITY_GUARD), exhausted.toolBundle());
    }

    @Test
    @DisplayName("derives domain relevance and drops null slots")
    void sanitize() throws Exception {
        ObjectNode payload = (ObjectNode) new ObjectMapper().readTree("""
                {"intent": "risk", "confidence": 0.8, "slots": {"lookback_days": null, "x": 1},
                 "top2": [{"intent": "risk", "score": 0.7}, {"intent": "out_of_scope", "score": 0.25}]}
                """);

        ObjectNode sanitized = extractor.sanitize(payload);

        assertEquals(0.75, sanitized.get("domain_relevance").asDouble(), 1e-9);
        assertFalse(sanitized.get("slots").has("lookback_days"));
        assertEquals("", sanitized.get("reason").asText());
    }
}
