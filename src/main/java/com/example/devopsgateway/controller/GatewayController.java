package com.example.devopsgateway.controller;

import com.example.devopsgateway.config.GatewayProperties;
import com.example.devopsgateway.gateway.GatewayRouterFactory;
import com.example.devopsgateway.gateway.GatewayTransport;
import com.example.devopsgateway.gateway.McpRpcRouter;
import com.example.devopsgateway.gateway.McpSessionRegistry;
import com.example.devopsgateway.gateway.PendingResultStore;
import com.example.devopsgateway.security.SecurityAuditService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.lang.management.ManagementFactory;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gateway status and dashboard.
 */
@RestController
@RequestMapping("/api/gateway")
@RequiredArgsConstructor
public class GatewayController {

    private final GatewayRouterFactory routerFactory;
    private final GatewayTransport transport;
    private final PendingResultStore resultStore;
    private final McpRpcRouter rpcRouter;
    private final McpSessionRegistry sessionRegistry;
    private final SecurityAuditService securityAuditService;
    private final GatewayProperties properties;

    /**
     * Router in use, upstream handshake state and inbound MCP activity.
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> getStatus() {
        GatewayProperties.ProxyConfig proxy = properties.getProxy();

        Map<String, Object> upstream = new LinkedHashMap<>();
        upstream.put("enabled", proxy.isEnabled());
        upstream.put("url_configured", proxy.getUrl() != null && !proxy.getUrl().isBlank());
        upstream.put("read_mode", proxy.getReadMode().name());
        upstream.put("handshake_state", transport.getState().name());
        upstream.put("session_established", transport.getSessionId().isPresent());
        upstream.put("handshakes", transport.getHandshakeCount());

        Map<String, Object> status = new LinkedHashMap<>();
        status.put("version", "0.1.0");
        status.put("uptime", getUptime());
        status.put("router", routerFactory.getRouterType());
        status.put("upstream", upstream);
        status.put("optimistic_results", Map.of(
                "pending", resultStore.pendingCount(),
                "stored", resultStore.size()));
        status.put("mcp", Map.of(
                "active_sessions", sessionRegistry.getActiveCount(),
                "rpc_methods", rpcRouter.getMethodCount()));
        status.put("timestamp", Instant.now().toString());
        return ResponseEntity.ok(status);
    }

    @GetMapping("/methods")
    public ResponseEntity<Map<String, String>> listMethods() {
        return ResponseEntity.ok(rpcRouter.listMethods());
    }

    @GetMapping("/security-audit")
    public ResponseEntity<Map<String, Object>> getSecurityAudit() {
        List<Map<String, String>> findings = securityAuditService.runAudit().stream()
                .map(SecurityAuditService.AuditFinding::toMap)
                .toList();
        return ResponseEntity.ok(Map.of(
                "count", findings.size(),
                "findings", findings,
                "timestamp", Instant.now().toString()));
    }

    private String getUptime() {
        long seconds = ManagementFactory.getRuntimeMXBean().getUptime() / 1000;
        long minutes = seconds / 60;
        long hours = minutes / 60;
        return String.format("%dh %dm %ds", hours, minutes % 60, seconds % 60);
    }
}
