package com.demoBank.advisor.guard.model;

import com.demoBank.advisor.tools.model.ToolError;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Result of the suitability check for one turn.
 */
@Data
@Builder
public class GuardVerdict {

    /**
     * Whether the guard tool was part of the bundle and was called.
     */
    private boolean invoked;

    /**
     * Whether the request must end with the refusal template.
     */
    private boolean denied;

    /**
     * Decision reported by the guard tool (allow, education_only, deny_execution, deny_recommendation),
     * or "fail_closed" when the guard was unavailable for an investment request.
     */
    private String decision;

    /**
     * Whether the answer must stay educational.
     */
    private boolean educationOnly;

    /**
     * Disclaimer the answer must carry.
     */
    private String requiredDisclaimer;

    /**
     * Rendered refusal, set only when denied.
     */
    private String refusalMessage;

    private List<String> reasonCodes;

    /**
     * Raw guard output, null when the guard was not invoked or failed.
     */
    private JsonNode toolOutput;

    /**
     * Guard failure, null when the guard was not invoked or succeeded.
     */
    private ToolError toolError;
}
