package com.example.devopsgateway.controller;

import com.example.devopsgateway.domain.LogsResult;
import com.example.devopsgateway.domain.MetricsResult;
import com.example.devopsgateway.gateway.GatewayRouterFactory;
import com.example.devopsgateway.gateway.RequestContext;
import com.example.devopsgateway.security.Principal;
import com.example.devopsgateway.security.RequestAuthenticator;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only resources: logs and metrics.
 */
@RestController
@RequestMapping("/api/resources")
@RequiredArgsConstructor
public class ResourceController {

    private final GatewayRouterFactory routerFactory;
    private final RequestAuthenticator authenticator;

    @GetMapping("/logs")
    public ResponseEntity<LogsResult> getLogs(
            @RequestParam(required = false) String level,
            @RequestParam(defaultValue = "100") int limit,
            @RequestParam(required = false) String since,
            HttpServletRequest request) {
        Principal principal = authenticator.authenticate(request);
        return ResponseEntity.ok(routerFactory.getRouter()
                .getLogs(RequestContext.from(request), principal, level, limit, since));
    }

    @GetMapping("/metrics")
    public ResponseEntity<MetricsResult> getMetrics(
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(required = false) String service,
            HttpServletRequest request) {
        Principal principal = authenticator.authenticate(request);
        return ResponseEntity.ok(routerFactory.getRouter()
                .getMetrics(RequestContext.from(request), principal, limit, service));
    }
}
