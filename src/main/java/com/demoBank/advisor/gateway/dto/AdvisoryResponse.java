package com.demoBank.advisor.gateway.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Response DTO for advisory chat turns.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AdvisoryResponse {

    private String response;
    private String traceId;
    private List<String> citations;

    /**
     * Tools invoked for this turn, in invocation order.
     */
    private List<String> toolCalls;

    /**
     * Served route decision plus the shadow decision and extractor errors, when present.
     */
    private Map<String, Object> routing;

    /**
     * Response mode, versions, reason codes, fallback and validation details.
     */
    private Map<String, Object> responseMeta;

    @Builder.Default
    private String language = "en";
}
