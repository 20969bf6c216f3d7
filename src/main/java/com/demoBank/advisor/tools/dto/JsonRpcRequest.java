package com.demoBank.advisor.tools.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * JSON-RPC 2.0 request sent to the tool gateway.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JsonRpcRequest {

    @Builder.Default
    private String jsonrpc = "2.0";

    private String id;

    private String method;

    private Map<String, Object> params;

    public static JsonRpcRequest toolsCall(String id, String toolName, Object arguments) {
        return JsonRpcRequest.builder()
                .id(id)
                .method("tools/call")
                .params(Map.of("name", toolName, "arguments", arguments))
                .build();
    }

    public static JsonRpcRequest toolsList(String id) {
        return JsonRpcRequest.builder()
                .id(id)
                .method("tools/list")
                .build();
    }
}
