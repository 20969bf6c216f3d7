package com.demoBank.advisor.tools.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JSON-RPC 2.0 response from the tool gateway.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class JsonRpcResponse {

    private String jsonrpc;
    private JsonNode id;
    private JsonNode result;
    private RpcError error;

    public boolean hasError() {
        return error != null;
    }

    /**
     * Text of the first content item of a tools/call result, or null.
     */
    public String firstContentText() {
        if (result == null) {
            return null;
        }
        JsonNode content = result.path("content");
        if (!content.isArray() || content.isEmpty()) {
            return null;
        }
        JsonNode text = content.get(0).path("text");
        return text.isTextual() ? text.asText() : null;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RpcError {
        private int code;
        private String message;
        private JsonNode data;
    }
}
