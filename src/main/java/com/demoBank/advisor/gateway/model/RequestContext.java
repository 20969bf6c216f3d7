package com.demoBank.advisor.gateway.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Request context passed through the pipeline.
 * Contains the trusted user id from the header, the caller token and the trace id.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RequestContext {

    /**
     * User id from the X-User-ID header (trusted source). Never taken from the prompt.
     */
    private String customerId;

    private String traceId;

    private String sessionId;

    /**
     * Session of the customer; carries the clarification state.
     */
    private AdvisorySession session;

    /**
     * Raw prompt as received.
     */
    private String prompt;

    /**
     * Caller Authorization header, forwarded to the tool gateway.
     */
    private String authToken;

    private Instant receivedAt;
}
