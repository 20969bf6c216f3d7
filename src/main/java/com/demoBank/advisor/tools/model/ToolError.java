package com.demoBank.advisor.tools.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Why a tool produced no output.
 *
 * @param errorKind short machine-readable kind: timeout, transport, http_4xx, http_5xx, rpc_error, invalid_output, internal_error
 * @param message   human-readable detail, logged and audited only
 */
public record ToolError(
        @JsonProperty("error_kind") String errorKind,
        @JsonProperty("message") String message) {

    public static final String TIMEOUT = "timeout";
}
