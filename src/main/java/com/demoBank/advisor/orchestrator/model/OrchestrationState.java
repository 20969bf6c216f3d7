package com.demoBank.advisor.orchestrator.model;

import com.demoBank.advisor.encoding.model.EncodingDecision;
import com.demoBank.advisor.gateway.dto.AdvisoryResponse;
import com.demoBank.advisor.gateway.model.RequestContext;
import com.demoBank.advisor.guard.model.GuardVerdict;
import com.demoBank.advisor.language.model.LanguageDetectionResult;
import com.demoBank.advisor.response.model.AdvisoryContext;
import com.demoBank.advisor.response.model.AnswerOutcome;
import com.demoBank.advisor.response.model.EvidencePack;
import com.demoBank.advisor.router.model.ClarificationState;
import com.demoBank.advisor.router.model.IntentName;
import com.demoBank.advisor.router.model.RouteDecision;
import com.demoBank.advisor.router.model.RoutingResult;
import com.demoBank.advisor.tools.model.KnowledgeBaseResult;
import com.demoBank.advisor.tools.model.ToolError;
import com.demoBank.advisor.tools.model.ToolName;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Orchestration state - threaded through every stage of one turn.
 *
 * Once {@code response} is set, every later stage except the audit is a no-op.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrchestrationState {

    private RequestContext requestContext;

    /**
     * Prompt after the encoding gate.
     */
    private String prompt;

    private LanguageDetectionResult language;

    private EncodingDecision encodingDecision;

    private ClarificationState clarificationState;

    private RoutingResult routing;

    private GuardVerdict guardVerdict;

    @Builder.Default
    private Map<String, Object> policyFlags = new LinkedHashMap<>();

    @Builder.Default
    private Map<ToolName, JsonNode> toolOutputs = new EnumMap<>(ToolName.class);

    @Builder.Default
    private Map<ToolName, ToolError> toolErrors = new EnumMap<>(ToolName.class);

    /**
     * Tool names invoked for this turn, in invocation order.
     */
    @Builder.Default
    private List<String> toolCalls = new ArrayList<>();

    private KnowledgeBaseResult knowledge;

    private EvidencePack evidence;

    private AdvisoryContext advisoryContext;

    private AnswerOutcome answerOutcome;

    @Builder.Default
    private Set<String> reasonCodes = new LinkedHashSet<>();

    @Builder.Default
    private Map<String, Object> responseMeta = new LinkedHashMap<>();

    private PipelineStage stage;

    private AdvisoryResponse response;

    public boolean isResponded() {
        return response != null;
    }

    public RouteDecision getDecision() {
        return routing != null ? routing.decision() : null;
    }

    public IntentName getIntent() {
        RouteDecision decision = getDecision();
        return decision != null ? decision.finalIntent() : null;
    }

    public boolean isVietnamese() {
        return language != null && language.isVietnamese();
    }

    public String getTraceId() {
        return requestContext != null ? requestContext.getTraceId() : null;
    }

    public String getCustomerId() {
        if (requestContext == null || requestContext.getCustomerId() == null) {
            throw new IllegalStateException("CustomerId is missing from RequestContext");
        }
        return requestContext.getCustomerId();
    }

    public void addReasonCodes(List<String> codes) {
        if (codes != null) {
            reasonCodes.addAll(codes);
        }
    }
}
