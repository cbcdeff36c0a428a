package com.example.devopsgateway.gateway;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JSON-RPC 2.0 envelope used both for calls to the proxied gateway and for
 * the inbound MCP endpoint. The id is kept as-is since peers send strings or numbers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JsonRpcMessage {

    public static final int INVALID_REQUEST = -32600;
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INVALID_PARAMS = -32602;
    public static final int INTERNAL_ERROR = -32603;
    public static final int UNAUTHENTICATED = -32001;
    public static final int FORBIDDEN = -32003;

    @Builder.Default
    private String jsonrpc = "2.0";
    private Object id;
    private String method;
    private Object params;
    private Object result;
    private JsonRpcError error;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class JsonRpcError {
        private int code;
        private String message;
        private Object data;
    }

    /**
     * A request without an id expects no response.
     */
    @JsonIgnore
    public boolean isNotification() {
        return id == null && method != null;
    }

    public static JsonRpcMessage request(Object id, String method, Object params) {
        return JsonRpcMessage.builder()
                .id(id)
                .method(method)
                .params(params)
                .build();
    }

    public static JsonRpcMessage success(Object id, Object result) {
        return JsonRpcMessage.builder()
                .id(id)
                .result(result)
                .build();
    }

    public static JsonRpcMessage error(Object id, int code, String message) {
        return JsonRpcMessage.builder()
                .id(id)
                .error(JsonRpcError.builder().code(code).message(message).build())
                .build();
    }

    public static JsonRpcMessage notification(String method, Object params) {
        return JsonRpcMessage.builder()
                .method(method)
                .params(params)
                .build();
    }
}
