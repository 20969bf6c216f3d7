package com.demoBank.advisor.response.service;

import com.demoBank.advisor.response.model.AdvisoryContext;
import com.demoBank.advisor.response.model.AnswerOutcome;
import com.demoBank.advisor.response.model.AnswerPlan;
import com.demoBank.advisor.response.model.Fact;
import com.demoBank.advisor.response.model.SynthesisAttempt;
import com.demoBank.advisor.router.model.IntentName;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("AnswerRepairController")
class AnswerRepairControllerTest {

    private static final String NET = "spend.net_cashflow.30d";
    private static final String PROMPT = "How is my spending this month?";
    private static final String TRACE = "trc_0000abcd";

    private AnswerSynthesizer synthesizer;
    private AnswerRepairController controller;
    private AdvisoryContext context;

    @BeforeEach
    void setUp() {
        synthesizer = mock(AnswerSynthesizer.class);
        controller = new AnswerRepairController(synthesizer, new GroundingValidator(new ObjectMapper()));
        context = new AdvisoryContext(null, IntentName.SUMMARY, "en",
                List.of(new Fact(NET, "Net cashflow", 6_600_000.0, "+6,600,000", "VND", "30d",
                        "spend_analytics_v1", "net_cashflow")),
                List.of(), List.of(), List.of(), null);
    }

    private static AnswerPlan plan(String summary, List<String> usedFacts) {
        return new AnswerPlan(AnswerPlan.SCHEMA_VERSION, "en", List.of(summary, "Spending is on track.",
                "Keep the current budget."), List.of(), List.of("Review weekly.", "Keep a buffer."), List.of(),
                List.of(), "Educational guidance only.", usedFacts, List.of(), List.of());
    }

    @Test
    @DisplayName("a grounded first plan is returned without a retry")
    void validFirstAttempt() {
        AnswerPlan plan = plan("Net cashflow is [F:" + NET + "].", List.of(NET));
        when(synthesizer.synthesize(PROMPT, context, "", TRACE)).thenReturn(new SynthesisAttempt(plan, List.of()));

        AnswerOutcome outcome = controller.generate(PROMPT, context, Set.of(), TRACE);

        assertTrue(outcome.valid());
        assertFalse(outcome.repaired());
        assertEquals(1, outcome.generations());
        assertSame(plan, outcome.plan());
        verify(synthesizer, times(1)).synthesize(anyString(), any(), anyString(), anyString());
    }

    @Test
    @DisplayName("undeclared placeholders are repaired in place")
    void placeholderRepair() {
        when(synthesizer.synthesize(PROMPT, context, "", TRACE))
                .thenReturn(new SynthesisAttempt(plan("Net cashflow is [F:" + NET + "].", List.of()), List.of()));

        AnswerOutcome outcome = controller.generate(PROMPT, context, Set.of(), TRACE);

        assertTrue(outcome.valid());
        assertTrue(outcome.repaired());
        assertEquals(1, outcome.generations());
        assertEquals(List.of(NET), outcome.plan().usedFactIds());
    }

    @Test
    @DisplayName("a rejected plan triggers one corrective generation with the violated rules")
    void retryWithFeedback() {
        AnswerPlan invented = plan("You saved 9,999,999 this month.", List.of());
        AnswerPlan grounded = plan("Net cashflow is [F:" + NET + "].", List.of(NET));
        when(synthesizer.synthesize(eq(PROMPT), eq(context), anyString(), eq(TRACE)))
                .thenReturn(new SynthesisAttempt(invented, List.of()), new SynthesisAttempt(grounded, List.of()));

        AnswerOutcome outcome = controller.generate(PROMPT, context, Set.of(), TRACE);

        assertTrue(outcome.valid());
        assertEquals(2, outcome.generations());
        verify(synthesizer).synthesize(PROMPT, context, "", TRACE);
        verify(synthesizer).synthesize(PROMPT, context, "ungrounded_numeric_tokens", TRACE);
    }

    @Test
    @DisplayName("two failed generations return the last errors")
    void exhausted() {
        when(synthesizer.synthesize(eq(PROMPT), eq(context), anyString(), eq(TRACE)))
                .thenReturn(SynthesisAttempt.failed(List.of("answer_invalid_schema")));

        AnswerOutcome outcome = controller.generate(PROMPT, context, Set.of(), TRACE);

        assertFalse(outcome.valid());
        assertNull(outcome.plan());
        assertEquals(2, outcome.generations());
        assertEquals(List.of("answer_invalid_schema"), outcome.errors());
    }

    @Test
    @DisplayName("a missing model stops after the first generation")
    void modelNotConfigured() {
        when(synthesizer.synthesize(eq(PROMPT), eq(context), anyString(), eq(TRACE)))
                .thenReturn(SynthesisAttempt.failed(List.of("model_not_configured")));

        AnswerOutcome outcome = controller.generate(PROMPT, context, Set.of(), TRACE);

        assertFalse(outcome.valid());
        assertEquals(1, outcome.generations());
        verify(synthesizer, times(1)).synthesize(anyString(), any(), anyString(), anyString());
    }
}
