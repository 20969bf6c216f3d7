package com.demoBank.advisor.guard.service;

import com.demoBank.advisor.config.ResponseSettings;
import com.demoBank.advisor.guard.model.GuardVerdict;
import com.demoBank.advisor.router.model.IntentName;
import com.demoBank.advisor.tools.model.FanOutResult;
import com.demoBank.advisor.tools.model.ToolError;
import com.demoBank.advisor.tools.model.ToolName;
import com.demoBank.advisor.tools.service.ToolArgumentsBuilder;
import com.demoBank.advisor.tools.service.ToolFanOutService;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("SuitabilityGuard")
class SuitabilityGuardTest {

    private static final String TOKEN = "Bearer token";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ToolFanOutService fanOutService;
    private SuitabilityGuard guard;

    @BeforeEach
    void setUp() {
        fanOutService = mock(ToolFanOutService.class);
        guard = new SuitabilityGuard(fanOutService, new ToolArgumentsBuilder(objectMapper), ResponseSettings.defaults());
    }

    private static ToolArgumentsBuilder.CallContext call(IntentName intent, String prompt) {
        return new ToolArgumentsBuilder.CallContext("user-1", "trc_00000001", prompt, intent, Map.of());
    }

    private void guardReturns(String json) throws Exception {
        ObjectNode output = (ObjectNode) objectMapper.readTree(json);
        when(fanOutService.executeSingle(eq(ToolName.SUITABILITY_GUARD), any(), eq(TOKEN), anyString()))
                .thenReturn(new FanOutResult(Map.of(ToolName.SUITABILITY_GUARD, output), Map.of()));
    }

    private void guardFails(String kind) {
        when(fanOutService.executeSingle(eq(ToolName.SUITABILITY_GUARD), any(), eq(TOKEN), anyString()))
                .thenReturn(new FanOutResult(Map.of(), Map.of(ToolName.SUITABILITY_GUARD, new ToolError(kind, "down"))));
    }

    @Test
    @DisplayName("bundles without the guard are not checked")
    void notInvoked() {
        GuardVerdict verdict = guard.check(List.of(ToolName.SPEND_ANALYTICS), call(IntentName.SUMMARY, "Summary"),
                TOKEN, false);

        assertFalse(verdict.isInvoked());
        assertFalse(verdict.isDenied());
        assertEquals("not_invoked", verdict.getDecision());
        assertEquals(ResponseSettings.DEFAULT_DISCLAIMER, verdict.getRequiredDisclaimer());
        verifyNoInteractions(fanOutService);
    }

    @Nested
    @DisplayName("Guard decisions")
    class Decisions {

        @Test
        @DisplayName("allow lets the request through")
        void allow() throws Exception {
            guardReturns("{\"allow\": true, \"decision\": \"allow\"}");

            GuardVerdict verdict = guard.check(List.of(ToolName.SUITABILITY_GUARD, ToolName.SPEND_ANALYTICS),
                    call(IntentName.PLANNING, "Plan my savings"), TOKEN, false);

            assertTrue(verdict.isInvoked());
            assertFalse(verdict.isDenied());
            assertFalse(verdict.isEducationOnly());
            assertNull(verdict.getRefusalMessage());
            assertTrue(verdict.getReasonCodes().isEmpty());
        }

        @Test
        @DisplayName("invest is always education-only")
        void investEducationOnly() throws Exception {
            guardReturns("{\"allow\": true, \"decision\": \"education_only\"}");

            GuardVerdict verdict = guard.check(List.of(ToolName.SUITABILITY_GUARD),
                    call(IntentName.INVEST, "How do index funds work?"), TOKEN, false);

            assertFalse(verdict.isDenied());
            assertTrue(verdict.isEducationOnly());
        }

        @Test
        @DisplayName("deny renders the refusal with the tool's disclaimer")
        void denyExecution() throws Exception {
            guardReturns("{\"allow\": false, \"decision\": \"deny_execution\","
                    + " \"required_disclaimer\": \"Chỉ mang tính giáo dục.\"}");

            GuardVerdict verdict = guard.check(List.of(ToolName.SUITABILITY_GUARD),
                    call(IntentName.INVEST, "Mua cổ phiếu VNM giúp tôi"), TOKEN, true);

            assertTrue(verdict.isDenied());
            assertEquals("deny_execution", verdict.getDecision());
            assertEquals(List.of("suitability_denied", "suitability_decision:deny_execution"), verdict.getReasonCodes());
            assertTrue(verdict.getRefusalMessage().startsWith("Tôi không thể"));
            assertTrue(verdict.getRefusalMessage().endsWith("Chỉ mang tính giáo dục."));

            ArgumentCaptor<ObjectNode> args = ArgumentCaptor.forClass(ObjectNode.class);
            verify(fanOutService).executeSingle(eq(ToolName.SUITABILITY_GUARD), args.capture(), eq(TOKEN),
                    eq("trc_00000001"));
            assertEquals("buy", args.getValue().path("requested_action").asText());
            assertEquals("invest", args.getValue().path("intent").asText());
        }
    }

    @Nested
    @DisplayName("Guard failures")
    class Failures {

        @Test
        @DisplayName("invest fails closed")
        void investFailsClosed() {
            guardFails(ToolError.TIMEOUT);

            GuardVerdict verdict = guard.check(List.of(ToolName.SUITABILITY_GUARD),
                    call(IntentName.INVEST, "Should I buy gold?"), TOKEN, false);

            assertTrue(verdict.isDenied());
            assertEquals("fail_closed", verdict.getDecision());
            assertEquals(List.of("tool_error:suitability_guard_v1", "suitability_fail_closed"), verdict.getReasonCodes());
            assertTrue(verdict.getRefusalMessage().startsWith("I cannot execute"));
            assertEquals(ToolError.TIMEOUT, verdict.getToolError().errorKind());
        }

        @Test
        @DisplayName("other intents continue without the guard")
        void otherIntentsContinue() {
            guardFails("http_5xx");

            GuardVerdict verdict = guard.check(List.of(ToolName.SUITABILITY_GUARD, ToolName.SPEND_ANALYTICS),
                    call(IntentName.PLANNING, "Plan my savings"), TOKEN, false);

            assertFalse(verdict.isDenied());
            assertEquals("unavailable", verdict.getDecision());
            assertEquals(List.of("tool_error:suitability_guard_v1"), verdict.getReasonCodes());
            assertNull(verdict.getRefusalMessage());
        }
    }
}
