package com.example.devopsgateway.gateway;

import com.example.devopsgateway.config.GatewayProperties;
import com.example.devopsgateway.exception.ValidationException;
import com.example.devopsgateway.security.Principal;
import com.example.devopsgateway.security.PrincipalResolver;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;

/**
 * Registers the inbound MCP methods at startup.
 *
 * Tools always run on the direct router, so this process can itself serve as
 * the audit gateway of another instance running in proxied mode.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class McpToolRegistration {

    static final String SERVER_NAME = "devops-gateway";

    private final McpRpcRouter router;
    private final McpSessionRegistry sessionRegistry;
    private final DirectGatewayRouter directRouter;
    private final PrincipalResolver principalResolver;
    private final GatewayProperties properties;
    private final ObjectMapper objectMapper;

    private final Map<String, BiFunction<JsonNode, McpInvocation, Object>> tools = new LinkedHashMap<>();

    @EventListener(ApplicationReadyEvent.class)
    public void registerRpcMethods() {
        log.info("Registering MCP RPC methods...");

        router.registerMethod("initialize", this::initialize);

        router.registerMethod("notifications/initialized", (params, invocation) -> {
            if (invocation.getSession() != null) {
                invocation.getSession().setInitialized(true);
            }
            return null;
        });

        router.registerMethod("ping", (params, invocation) -> Map.of());

        tools.put(ProxiedGatewayRouter.LOGS_TOOL, (args, invocation) -> directRouter.getLogs(
                invocation.getContext(), principal(invocation),
                text(args, "level"), integer(args, "limit", 100), text(args, "since")));

        tools.put(ProxiedGatewayRouter.METRICS_TOOL, (args, invocation) -> directRouter.getMetrics(
                invocation.getContext(), principal(invocation),
                integer(args, "limit", 50), text(args, "service")));

        tools.put(ProxiedGatewayRouter.DEPLOY_TOOL, (args, invocation) -> directRouter.deploy(
                invocation.getContext(), principal(invocation),
                text(args, "service_name"), text(args, "version"), text(args, "environment")));

        tools.put(ProxiedGatewayRouter.ROLLBACK_TOOL, (args, invocation) -> directRouter.rollback(
                invocation.getContext(), principal(invocation),
                text(args, "deployment_id"), text(args, "reason"), text(args, "environment")));

        tools.put(ProxiedGatewayRouter.AUTHENTICATE_TOOL, (args, invocation) -> {
            String sessionToken = text(args, "session_token");
            String refreshToken = text(args, "refresh_token");
            if (sessionToken == null) {
                sessionToken = invocation.getCredentials().sessionToken();
                refreshToken = refreshToken != null ? refreshToken : invocation.getCredentials().refreshToken();
            }
            Principal principal = directRouter.authenticate(invocation.getContext(), sessionToken, refreshToken);
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("tool", ProxiedGatewayRouter.AUTHENTICATE_TOOL);
            result.put("success", true);
            result.put("result", principal);
            return result;
        });

        router.registerMethod("tools/list", (params, invocation) -> Map.of("tools", toolCatalog()));
        router.registerMethod("tools/call", this::callTool);

        log.info("Registered {} RPC methods ({} tools)", router.getMethodCount(), tools.size());
    }

    private Object initialize(JsonNode params, McpInvocation invocation) {
        JsonNode clientInfo = params.path("clientInfo");
        String protocolVersion = params.path("protocolVersion").asText(properties.getProxy().getProtocolVersion());
        McpSession session = sessionRegistry.open(
                clientInfo.path("name").asText(null),
                clientInfo.path("version").asText(null),
                protocolVersion);
        invocation.setAssignedSessionId(session.getSessionId());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("protocolVersion", protocolVersion);
        result.put("capabilities", Map.of(
                "tools", Map.of("listChanged", false),
                "resources", Map.of("subscribe", false, "listChanged", false)));
        result.put("serverInfo", Map.of("name", SERVER_NAME, "version", properties.getProxy().getClientVersion()));
        return result;
    }

    private Object callTool(JsonNode params, McpInvocation invocation) {
        String name = params.path("name").asText(null);
        if (name == null || name.isBlank()) {
            throw new ValidationException("tools/call requires a tool name");
        }
        BiFunction<JsonNode, McpInvocation, Object> tool = tools.get(name);
        if (tool == null) {
            throw new ValidationException("Unknown tool: " + name);
        }
        JsonNode arguments = params.path("arguments");
        log.debug("MCP tools/call {} with {}", name, arguments);

        Object result = tool.apply(arguments, invocation);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("content", List.of(Map.of("type", "text", "text", toJson(result))));
        response.put("structuredContent", result);
        response.put("isError", false);
        return response;
    }

    private Principal principal(McpInvocation invocation) {
        return principalResolver.resolve(invocation.getCredentials().sessionToken(),
                invocation.getCredentials().refreshToken());
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Tool result is not serializable", e);
        }
    }

    static String text(JsonNode args, String field) {
        JsonNode value = args.path(field);
        if (value.isMissingNode() || value.isNull()) return null;
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    static int integer(JsonNode args, String field, int defaultValue) {
        JsonNode value = args.path(field);
        if (value.isMissingNode() || value.isNull()) return defaultValue;
        if (value.isIntegralNumber()) return value.asInt();
        try {
            return Integer.parseInt(value.asText().trim());
        } catch (NumberFormatException e) {
            throw new ValidationException(field + " must be an integer");
        }
    }

    private static List<Map<String, Object>> toolCatalog() {
        return List.of(
                tool(ProxiedGatewayRouter.LOGS_TOOL, "Recent log entries, optionally filtered by level",
                        Map.of("level", "string", "limit", "integer", "since", "string"), List.of()),
                tool(ProxiedGatewayRouter.METRICS_TOOL, "Latest sample per metric, optionally for one service",
                        Map.of("limit", "integer", "service", "string"), List.of()),
                tool(ProxiedGatewayRouter.DEPLOY_TOOL, "Deploy a service version to staging or production",
                        Map.of("service_name", "string", "version", "string", "environment", "string"),
                        List.of("service_name", "version", "environment")),
                tool(ProxiedGatewayRouter.ROLLBACK_TOOL, "Roll back a deployment",
                        Map.of("deployment_id", "string", "reason", "string", "environment", "string"),
                        List.of("deployment_id", "reason", "environment")),
                tool(ProxiedGatewayRouter.AUTHENTICATE_TOOL, "Validate a session token and return the caller's identity",
                        Map.of("session_token", "string", "refresh_token", "string"), List.of()));
    }

    private static Map<String, Object> tool(String name, String description, Map<String, String> properties,
                                            List<String> required) {
        Map<String, Object> schemaProperties = new LinkedHashMap<>();
        properties.forEach((key, type) -> schemaProperties.put(key, Map.of("type", type)));
        Map<String, Object> inputSchema = new LinkedHashMap<>();
        inputSchema.put("type", "object");
        inputSchema.put("properties", schemaProperties);
        inputSchema.put("required", required);
        return Map.of("name", name, "description", description, "inputSchema", inputSchema);
    }
}
