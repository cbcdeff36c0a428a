package com.example.devopsgateway.gateway;

import com.example.devopsgateway.exception.AuthenticationException;
import com.example.devopsgateway.exception.PermissionDeniedException;
import com.example.devopsgateway.exception.ValidationException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiFunction;

/**
 * Routes inbound JSON-RPC methods to their handlers and maps the error
 * taxonomy onto JSON-RPC error codes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class McpRpcRouter {

    private final ObjectMapper objectMapper;
    private final Map<String, BiFunction<JsonNode, McpInvocation, Object>> handlers = new ConcurrentHashMap<>();

    public void registerMethod(String method, BiFunction<JsonNode, McpInvocation, Object> handler) {
        handlers.put(method, handler);
        log.debug("Registered RPC method: {}", method);
    }

    public JsonRpcMessage route(JsonRpcMessage request, McpInvocation invocation) {
        String method = request.getMethod();
        if (method == null || method.isBlank()) {
            return JsonRpcMessage.error(request.getId(), JsonRpcMessage.INVALID_REQUEST, "Invalid request: missing method");
        }

        BiFunction<JsonNode, McpInvocation, Object> handler = handlers.get(method);
        if (handler == null) {
            return JsonRpcMessage.error(request.getId(), JsonRpcMessage.METHOD_NOT_FOUND, "Method not found: " + method);
        }

        JsonNode params = request.getParams() != null
                ? objectMapper.valueToTree(request.getParams())
                : NullNode.getInstance();
        try {
            Object result = handler.apply(params, invocation);
            return JsonRpcMessage.success(request.getId(), result);
        } catch (AuthenticationException e) {
            return JsonRpcMessage.error(request.getId(), JsonRpcMessage.UNAUTHENTICATED, e.getMessage());
        } catch (PermissionDeniedException e) {
            return JsonRpcMessage.error(request.getId(), JsonRpcMessage.FORBIDDEN, e.getMessage());
        } catch (ValidationException e) {
            return JsonRpcMessage.error(request.getId(), JsonRpcMessage.INVALID_PARAMS, e.getMessage());
        } catch (Exception e) {
            log.error("Error executing RPC method {}: {}", method, e.getMessage(), e);
            return JsonRpcMessage.error(request.getId(), JsonRpcMessage.INTERNAL_ERROR, "Internal error: " + e.getMessage());
        }
    }

    public Map<String, String> listMethods() {
        Map<String, String> methods = new TreeMap<>();
        handlers.keySet().forEach(method -> methods.put(method, "registered"));
        return methods;
    }

    public int getMethodCount() {
        return handlers.size();
    }
}
