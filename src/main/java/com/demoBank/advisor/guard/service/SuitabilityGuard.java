package com.demoBank.advisor.guard.service;

import com.demoBank.advisor.config.ResponseSettings;
import com.demoBank.advisor.guard.model.GuardVerdict;
import com.demoBank.advisor.guard.prompt.RefusalTemplate;
import com.demoBank.advisor.router.model.IntentName;
import com.demoBank.advisor.tools.model.FanOutResult;
import com.demoBank.advisor.tools.model.ToolError;
import com.demoBank.advisor.tools.model.ToolName;
import com.demoBank.advisor.tools.service.ToolArgumentsBuilder;
import com.demoBank.advisor.tools.service.ToolFanOutService;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Suitability guard - runs the policy tool before any analytical tool.
 *
 * Responsibilities:
 * - Call suitability_guard_v1 first and alone when the bundle contains it
 * - End the request with the refusal template when the policy denies it
 * - Fail closed for investment requests when the guard is unavailable
 * - Force education-only answers for the invest intent
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SuitabilityGuard {

    static final String FAIL_CLOSED = "fail_closed";
    static final String GUARD_DENIED = "suitability_denied";

    private final ToolFanOutService fanOutService;
    private final ToolArgumentsBuilder argumentsBuilder;
    private final ResponseSettings responseSettings;

    /**
     * Checks a routed request.
     *
     * @param bundle     routed tool bundle
     * @param context    call context of the turn (user, trace, prompt, intent, slots)
     * @param authToken  caller token
     * @param vietnamese whether fixed texts are rendered in Vietnamese
     * @return the verdict; never null
     */
    public GuardVerdict check(List<ToolName> bundle, ToolArgumentsBuilder.CallContext context, String authToken,
                              boolean vietnamese) {
        boolean invest = context.intent() == IntentName.INVEST;
        String disclaimer = responseSettings.requiredDisclaimer();

        if (!bundle.contains(ToolName.SUITABILITY_GUARD)) {
            return GuardVerdict.builder()
                    .invoked(false)
                    .denied(false)
                    .decision("not_invoked")
                    .educationOnly(invest)
                    .requiredDisclaimer(disclaimer)
                    .reasonCodes(List.of())
                    .build();
        }

        FanOutResult result = fanOutService.executeSingle(ToolName.SUITABILITY_GUARD,
                argumentsBuilder.argumentsFor(ToolName.SUITABILITY_GUARD, context), authToken, context.traceId());

        ToolError error = result.errors().get(ToolName.SUITABILITY_GUARD);
        if (error != null) {
            return unavailable(error, invest, disclaimer, vietnamese, context.traceId());
        }

        JsonNode output = result.outputs().get(ToolName.SUITABILITY_GUARD);
        String decision = output.path("decision").asText("allow").trim().toLowerCase(Locale.ROOT);
        boolean allowed = !output.has("allow") || output.path("allow").asBoolean(true);
        boolean denied = !allowed || decision.startsWith("deny");
        boolean educationOnly = invest || output.path("education_only").asBoolean(false);
        String toolDisclaimer = output.path("required_disclaimer").asText("");
        if (!toolDisclaimer.isBlank()) {
            disclaimer = toolDisclaimer.trim();
        }

        List<String> reasonCodes = new ArrayList<>();
        if (denied) {
            reasonCodes.add(GUARD_DENIED);
            reasonCodes.add("suitability_decision:" + decision);
        }

        log.info("Suitability check - traceId: {}, decision: {}, denied: {}, educationOnly: {}",
                context.traceId(), decision, denied, educationOnly);

        return GuardVerdict.builder()
                .invoked(true)
                .denied(denied)
                .decision(decision)
                .educationOnly(educationOnly)
                .requiredDisclaimer(disclaimer)
                .refusalMessage(denied ? RefusalTemplate.render(vietnamese, disclaimer) : null)
                .reasonCodes(reasonCodes)
                .toolOutput(output)
                .build();
    }

    private GuardVerdict unavailable(ToolError error, boolean invest, String disclaimer, boolean vietnamese,
                                     String traceId) {
        List<String> reasonCodes = new ArrayList<>();
        reasonCodes.add("tool_error:" + ToolName.SUITABILITY_GUARD.code());
        if (invest) {
            reasonCodes.add("suitability_" + FAIL_CLOSED);
        }
        log.warn("Suitability guard unavailable - traceId: {}, kind: {}, failClosed: {}",
                traceId, error.errorKind(), invest);

        return GuardVerdict.builder()
                .invoked(true)
                .denied(invest)
                .decision(invest ? FAIL_CLOSED : "unavailable")
                .educationOnly(invest)
                .requiredDisclaimer(disclaimer)
                .refusalMessage(invest ? RefusalTemplate.render(vietnamese, disclaimer) : null)
                .reasonCodes(reasonCodes)
                .toolError(error)
                .build();
    }
}
