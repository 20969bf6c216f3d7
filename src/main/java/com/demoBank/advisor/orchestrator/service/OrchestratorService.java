package com.demoBank.advisor.orchestrator.service;

import com.demoBank.advisor.config.ResponseSettings;
import com.demoBank.advisor.config.RouterSettings;
import com.demoBank.advisor.config.ToolGatewaySettings;
import com.demoBank.advisor.encoding.model.GateOutcome;
import com.demoBank.advisor.encoding.service.EncodingGate;
import com.demoBank.advisor.gateway.dto.AdvisoryResponse;
import com.demoBank.advisor.gateway.model.AdvisorySession;
import com.demoBank.advisor.gateway.model.RequestContext;
import com.demoBank.advisor.guard.model.GuardVerdict;
import com.demoBank.advisor.guard.service.SuitabilityGuard;
import com.demoBank.advisor.language.model.LanguageDetectionResult;
import com.demoBank.advisor.language.service.LanguageDetector;
import com.demoBank.advisor.orchestrator.model.OrchestrationState;
import com.demoBank.advisor.orchestrator.model.PipelineStage;
import com.demoBank.advisor.orchestrator.prompt.SystemMessages;
import com.demoBank.advisor.response.model.AdvisoryContext;
import com.demoBank.advisor.response.model.AnswerOutcome;
import com.demoBank.advisor.response.model.ResponseMode;
import com.demoBank.advisor.response.model.RiskAppetite;
import com.demoBank.advisor.response.service.AdvisoryContextBuilder;
import com.demoBank.advisor.response.service.AnswerRenderer;
import com.demoBank.advisor.response.service.AnswerRepairController;
import com.demoBank.advisor.response.service.EvidenceExtractor;
import com.demoBank.advisor.response.service.FallbackRenderer;
import com.demoBank.advisor.response.service.GroundingValidator;
import com.demoBank.advisor.router.model.ClarificationState;
import com.demoBank.advisor.router.model.IntentExtraction;
import com.demoBank.advisor.router.model.RouteDecision;
import com.demoBank.advisor.router.model.RoutingResult;
import com.demoBank.advisor.router.service.ClarificationService;
import com.demoBank.advisor.router.service.IntentRouter;
import com.demoBank.advisor.tools.model.FanOutResult;
import com.demoBank.advisor.tools.model.KnowledgeBaseResult;
import com.demoBank.advisor.tools.model.ToolName;
import com.demoBank.advisor.tools.service.AuditSink;
import com.demoBank.advisor.tools.service.KnowledgeBaseClient;
import com.demoBank.advisor.tools.service.ToolArgumentsBuilder;
import com.demoBank.advisor.tools.service.ToolFanOutService;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Orchestrator service - workflow owner for one advisory turn.
 *
 * Responsibilities:
 * - Drive the stages in order over a single {@link OrchestrationState}
 * - Stop at the first stage that sets a response (fail-fast, clarification, refusal)
 * - Map unexpected failures to a generic answer with reason {@code internal_error:<Type>}
 * - Write the audit record after every turn, short-circuited or not
 *
 * Workflow steps:
 * GATE -> ROUTE -> (IF CLARIFY -> RESPOND) -> GUARD -> (IF DENIED -> RESPOND)
 * -> FAN_OUT -> KNOWLEDGE -> DERIVE -> SYNTHESIZE -> RENDER -> AUDIT
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrchestratorService {

    private static final Map<String, String> KB_FILTERS = Map.of("doc_type", "policy");

    private final EncodingGate encodingGate;
    private final LanguageDetector languageDetector;
    private final IntentRouter intentRouter;
    private final ClarificationService clarificationService;
    private final RouterSettings routerSettings;
    private final SuitabilityGuard suitabilityGuard;
    private final ToolArgumentsBuilder toolArgumentsBuilder;
    private final ToolFanOutService toolFanOutService;
    private final KnowledgeBaseClient knowledgeBaseClient;
    private final ToolGatewaySettings toolGatewaySettings;
    private final EvidenceExtractor evidenceExtractor;
    private final AdvisoryContextBuilder advisoryContextBuilder;
    private final AnswerRepairController answerRepairController;
    private final AnswerRenderer answerRenderer;
    private final FallbackRenderer fallbackRenderer;
    private final ResponseSettings responseSettings;
    private final AuditSink auditSink;

    /**
     * Processes one advisory turn through the complete workflow.
     *
     * @param requestContext request context with user id, token, trace id, session and prompt
     * @return the response; never null and never an exception
     */
    public AdvisoryResponse orchestrate(RequestContext requestContext) {
        String traceId = requestContext.getTraceId();
        log.info("Starting orchestration - traceId: {}", traceId);

        OrchestrationState state = OrchestrationState.builder()
                .requestContext(requestContext)
                .build();
        recordVersions(state);

        try {
            // Step 1: GATE - encoding check, language detection
            gate(state);

            // Step 2: ROUTE - intent, tool bundle or clarifying question
            route(state);

            // Step 3: GUARD - suitability check before any other tool spend
            guard(state);

            // Step 4: FAN_OUT - remaining tools of the bundle
            fanOut(state);

            // Step 5: KNOWLEDGE - policy and service catalog snippets
            retrieveKnowledge(state);

            // Step 6: DERIVE - facts, insights, actions
            derive(state);

            // Step 7: SYNTHESIZE - generation with validation and repair
            synthesize(state);

            // Step 8: RENDER - validated answer or deterministic fallback
            render(state);
        } catch (Exception e) {
            log.error("Error in orchestration - traceId: {}, stage: {}", traceId, state.getStage(), e);
            state.getReasonCodes().add("internal_error:" + e.getClass().getSimpleName());
            respond(state, SystemMessages.unableToComplete(state.isVietnamese()));
        }

        // Step 9: AUDIT - always
        audit(state);
        log.info("Orchestration finished - traceId: {}, intent: {}, tools: {}, reasons: {}",
                traceId, state.getIntent(), state.getToolCalls(), state.getReasonCodes());
        return state.getResponse();
    }

    private void gate(OrchestrationState state) {
        state.setStage(PipelineStage.GATE);
        GateOutcome outcome = encodingGate.apply(state.getRequestContext().getPrompt());
        state.setPrompt(outcome.text());
        state.setEncodingDecision(outcome.decision());
        state.setLanguage(languageDetector.detectLanguage(outcome.text()));
        state.getResponseMeta().put("encoding", outcome.decision());

        log.info("Step GATE - traceId: {}, decision: {}, score: {}, language: {}", state.getTraceId(),
                outcome.decision().decision().code(), String.format("%.2f", outcome.decision().mojibakeScore()),
                state.getLanguage().getLanguageCode());

        if (outcome.decision().isFailFast()) {
            state.addReasonCodes(outcome.decision().reasonCodes());
            respond(state, SystemMessages.encodingFailFast(state.isVietnamese()));
        }
    }

    private void route(OrchestrationState state) {
        if (state.isResponded()) {
            return;
        }
        state.setStage(PipelineStage.ROUTE);

        ClarificationState clarification = clarificationState(state.getRequestContext());
        state.setClarificationState(clarification);
        RoutingResult routing = intentRouter.route(state.getPrompt(), clarification, state.isVietnamese(),
                state.getTraceId());
        state.setRouting(routing);

        RouteDecision decision = routing.decision();
        state.addReasonCodes(decision.reasonCodes());
        applyRiskAppetite(state);

        if (decision.clarifyNeeded() && decision.clarifyingQuestion() != null) {
            log.info("Clarification needed - traceId: {}, questionId: {}, round: {}", state.getTraceId(),
                    decision.clarifyingQuestion().questionId(), clarification.getRound());
            respond(state, clarificationService.render(decision.clarifyingQuestion()));
        }
    }

    private void guard(OrchestrationState state) {
        if (state.isResponded()) {
            return;
        }
        state.setStage(PipelineStage.GUARD);

        GuardVerdict verdict = suitabilityGuard.check(state.getDecision().toolBundle(), callContext(state),
                state.getRequestContext().getAuthToken(), state.isVietnamese());
        state.setGuardVerdict(verdict);
        state.addReasonCodes(verdict.getReasonCodes());
        state.getResponseMeta().put("disclaimer_effective", verdict.getRequiredDisclaimer());

        if (verdict.isInvoked()) {
            state.getToolCalls().add(ToolName.SUITABILITY_GUARD.code());
            state.getResponseMeta().put("suitability_decision", verdict.getDecision());
        }
        if (verdict.getToolOutput() != null) {
            state.getToolOutputs().put(ToolName.SUITABILITY_GUARD, verdict.getToolOutput());
        }
        if (verdict.getToolError() != null) {
            state.getToolErrors().put(ToolName.SUITABILITY_GUARD, verdict.getToolError());
        }
        if (verdict.isEducationOnly()) {
            state.getPolicyFlags().put("education_only", true);
        }

        if (verdict.isDenied()) {
            log.info("Step GUARD - traceId: {}, request refused, decision: {}", state.getTraceId(), verdict.getDecision());
            respond(state, verdict.getRefusalMessage());
        }
    }

    private void fanOut(OrchestrationState state) {
        if (state.isResponded()) {
            return;
        }
        state.setStage(PipelineStage.FAN_OUT);

        List<ToolName> tools = state.getDecision().toolBundle().stream()
                .filter(tool -> tool != ToolName.SUITABILITY_GUARD)
                .toList();
        if (tools.isEmpty()) {
            log.debug("Step FAN_OUT - traceId: {}, no tools beyond the guard", state.getTraceId());
            return;
        }

        Map<ToolName, ObjectNode> arguments = toolArgumentsBuilder.build(tools, callContext(state));
        FanOutResult result = toolFanOutService.execute(arguments, state.getRequestContext().getAuthToken(),
                state.getTraceId());
        tools.forEach(tool -> state.getToolCalls().add(tool.code()));
        state.getToolOutputs().putAll(result.outputs());
        state.getToolErrors().putAll(result.errors());
        state.addReasonCodes(result.reasonCodes());
    }

    private void retrieveKnowledge(OrchestrationState state) {
        if (state.isResponded()) {
            return;
        }
        state.setStage(PipelineStage.KNOWLEDGE);

        if (!toolGatewaySettings.kbEnabled()) {
            state.setKnowledge(KnowledgeBaseResult.empty("KB disabled"));
            return;
        }
        KnowledgeBaseResult knowledge = knowledgeBaseClient.retrieve(state.getPrompt(), KB_FILTERS,
                state.getRequestContext().getAuthToken(), state.getTraceId());
        state.getToolCalls().add(KnowledgeBaseClient.KB_TOOL);
        state.setKnowledge(knowledge);
        log.debug("Step KNOWLEDGE - traceId: {}, matches: {}", state.getTraceId(), knowledge.matches().size());
    }

    private void derive(OrchestrationState state) {
        if (state.isResponded()) {
            return;
        }
        state.setStage(PipelineStage.DERIVE);

        EvidenceExtractor.Extraction extraction = evidenceExtractor.extract(state.getIntent(),
                languageCode(state), state.getToolOutputs(), state.getKnowledge(), state.getPolicyFlags(),
                slots(state));
        state.setEvidence(extraction.evidence());
        state.addReasonCodes(extraction.reasonCodes());

        AdvisoryContextBuilder.Assembly assembly = advisoryContextBuilder.build(extraction.evidence(),
                responseSettings.policyVersion());
        state.setAdvisoryContext(assembly.context());
        state.addReasonCodes(assembly.reasonCodes());

        log.info("Step DERIVE - traceId: {}, facts: {}, insights: {}, actions: {}", state.getTraceId(),
                assembly.context().facts().size(), assembly.context().insights().size(),
                assembly.context().actions().size());
    }

    private void synthesize(OrchestrationState state) {
        if (state.isResponded() || responseSettings.mode() == ResponseMode.TEMPLATE) {
            return;
        }
        state.setStage(PipelineStage.SYNTHESIZE);

        AnswerOutcome outcome = answerRepairController.generate(state.getPrompt(), state.getAdvisoryContext(),
                GroundingValidator.numericTokens(state.getPrompt()), state.getTraceId());
        state.setAnswerOutcome(outcome);

        Map<String, Object> meta = state.getResponseMeta();
        meta.put("generations", outcome.generations());
        meta.put("repaired", outcome.repaired());
        meta.put("answer_valid", outcome.valid());
        if (!outcome.errors().isEmpty()) {
            meta.put("validation_errors", outcome.errors());
        }
    }

    private void render(OrchestrationState state) {
        if (state.isResponded()) {
            return;
        }
        state.setStage(PipelineStage.RENDER);

        AdvisoryContext context = state.getAdvisoryContext();
        AnswerOutcome outcome = state.getAnswerOutcome();
        ResponseMode mode = responseSettings.mode();

        if (mode == ResponseMode.LLM_ENFORCE && outcome != null && outcome.valid()) {
            state.getResponseMeta().put("fallback_used", null);
            respond(state, answerRenderer.render(outcome.plan(), context));
            return;
        }

        String fallbackReason = switch (mode) {
            case TEMPLATE -> "template_mode";
            case LLM_SHADOW -> "shadow_mode";
            case LLM_ENFORCE -> outcome == null || outcome.plan() == null
                    ? "answer_synthesis_failed" : "answer_validation_failed";
        };
        if (mode == ResponseMode.LLM_ENFORCE) {
            state.getReasonCodes().add("answer_fallback");
        }
        state.getResponseMeta().put("fallback_used", fallbackReason);
        respond(state, fallbackRenderer.render(context, disclaimer(state)));
    }

    private void audit(OrchestrationState state) {
        state.setStage(PipelineStage.AUDIT);
        AdvisoryResponse response = state.getResponse();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("intent", state.getIntent() != null ? state.getIntent().code() : null);
        payload.put("route", state.getDecision());
        payload.put("tool_calls", List.copyOf(state.getToolCalls()));
        Map<String, String> toolErrors = new LinkedHashMap<>();
        state.getToolErrors().forEach((tool, error) -> toolErrors.put(tool.code(), error.errorKind()));
        payload.put("tool_errors", toolErrors);
        payload.put("reason_codes", List.copyOf(state.getReasonCodes()));
        payload.put("encoding", state.getEncodingDecision());
        payload.put("response_mode", responseSettings.mode().code());
        payload.put("fallback_used", state.getResponseMeta().get("fallback_used"));
        payload.put("response_length", response != null && response.getResponse() != null
                ? response.getResponse().length() : 0);

        String fingerprint = auditSink.write(state.getCustomerId(), state.getTraceId(), payload,
                state.getRequestContext().getAuthToken());
        state.getResponseMeta().put("audit_fingerprint", fingerprint);
    }

    /**
     * Sets the response; later stages see {@link OrchestrationState#isResponded()} and do nothing.
     */
    private void respond(OrchestrationState state, String text) {
        Map<String, Object> meta = state.getResponseMeta();
        meta.put("stage", state.getStage() != null ? state.getStage().name().toLowerCase(Locale.ROOT) : null);
        meta.put("reason_codes", List.copyOf(state.getReasonCodes()));
        meta.putIfAbsent("disclaimer_effective", responseSettings.requiredDisclaimer());

        state.setResponse(AdvisoryResponse.builder()
                .response(text)
                .traceId(state.getTraceId())
                .citations(citations(state))
                .toolCalls(List.copyOf(state.getToolCalls()))
                .routing(routingMeta(state))
                .responseMeta(meta)
                .language(languageCode(state))
                .build());
    }

    private void recordVersions(OrchestrationState state) {
        Map<String, Object> meta = state.getResponseMeta();
        meta.put("mode", responseSettings.mode().code());
        meta.put("prompt_version", responseSettings.promptVersion());
        meta.put("schema_version", responseSettings.schemaVersion());
        meta.put("policy_version", responseSettings.policyVersion());
    }

    private void applyRiskAppetite(OrchestrationState state) {
        RiskAppetite appetite = RiskAppetite.fromCode(slots(state).get("risk_appetite"));
        if (appetite != RiskAppetite.UNKNOWN) {
            state.getPolicyFlags().put("risk_appetite", appetite.code());
        }
    }

    private ClarificationState clarificationState(RequestContext requestContext) {
        AdvisorySession session = requestContext.getSession();
        if (session == null) {
            return ClarificationState.initial(routerSettings.maxClarifyQuestions());
        }
        if (session.getClarificationState() == null) {
            session.setClarificationState(ClarificationState.initial(routerSettings.maxClarifyQuestions()));
        }
        return session.getClarificationState();
    }

    private ToolArgumentsBuilder.CallContext callContext(OrchestrationState state) {
        return new ToolArgumentsBuilder.CallContext(state.getCustomerId(), state.getTraceId(), state.getPrompt(),
                state.getIntent(), slots(state));
    }

    private static Map<String, Object> slots(OrchestrationState state) {
        IntentExtraction extraction = state.getRouting() != null ? state.getRouting().extraction() : null;
        return extraction != null && extraction.slots() != null ? extraction.slots() : Map.of();
    }

    private static String languageCode(OrchestrationState state) {
        return state.getLanguage() != null ? state.getLanguage().getLanguageCode() : LanguageDetectionResult.ENGLISH;
    }

    private String disclaimer(OrchestrationState state) {
        Object effective = state.getResponseMeta().get("disclaimer_effective");
        return effective instanceof String text && !text.isBlank() ? text : responseSettings.requiredDisclaimer();
    }

    private static List<String> citations(OrchestrationState state) {
        if (state.getEvidence() != null) {
            return state.getEvidence().citations();
        }
        return state.getKnowledge() != null ? state.getKnowledge().citations() : List.of();
    }

    private static Map<String, Object> routingMeta(OrchestrationState state) {
        Map<String, Object> routing = new LinkedHashMap<>();
        RoutingResult result = state.getRouting();
        if (result == null) {
            return routing;
        }
        routing.put("decision", result.decision());
        if (result.shadowDecision() != null) {
            routing.put("shadow_decision", result.shadowDecision());
        }
        if (result.extractionOutcome() != null && !result.extractionOutcome().errors().isEmpty()) {
            routing.put("extraction_errors", result.extractionOutcome().errors());
        }
        if (state.getClarificationState() != null) {
            routing.put("clarify_round", state.getClarificationState().getRound());
        }
        return routing;
    }
}
