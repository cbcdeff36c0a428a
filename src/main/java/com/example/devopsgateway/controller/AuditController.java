package com.example.devopsgateway.controller;

import com.example.devopsgateway.domain.AuditLog;
import com.example.devopsgateway.domain.Route;
import com.example.devopsgateway.exception.ValidationException;
import com.example.devopsgateway.security.OperationPermissions;
import com.example.devopsgateway.security.PermissionEngine;
import com.example.devopsgateway.security.PermissionMode;
import com.example.devopsgateway.security.RequestAuthenticator;
import com.example.devopsgateway.service.AuditService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Operation audit trail.
 */
@RestController
@RequestMapping("/api/audit")
@RequiredArgsConstructor
public class AuditController {

    private final AuditService auditService;
    private final PermissionEngine permissionEngine;
    private final RequestAuthenticator authenticator;

    @GetMapping
    public ResponseEntity<List<AuditLog>> getAuditLog(
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(required = false) String actor,
            @RequestParam(required = false) String action,
            @RequestParam(required = false) String route,
            @RequestParam(name = "request_id", required = false) String requestId,
            HttpServletRequest request) {
        requireAuditAccess(request);

        if (requestId != null) {
            return ResponseEntity.ok(auditService.getByRequest(requestId));
        }
        if (actor != null || action != null || route != null) {
            return ResponseEntity.ok(auditService.filter(actor, action, parseRoute(route)));
        }
        return ResponseEntity.ok(auditService.getRecent(Math.max(1, Math.min(limit, 500))));
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<Route, Long>> getRouteStats(HttpServletRequest request) {
        requireAuditAccess(request);
        Map<Route, Long> counts = new EnumMap<>(Route.class);
        for (Route route : Route.values()) {
            counts.put(route, auditService.countByRoute(route));
        }
        return ResponseEntity.ok(counts);
    }

    private void requireAuditAccess(HttpServletRequest request) {
        permissionEngine.require(authenticator.authenticate(request),
                Set.of(OperationPermissions.READ_AUDIT), PermissionMode.ANY);
    }

    private static Route parseRoute(String route) {
        if (route == null || route.isBlank()) return null;
        try {
            return Route.valueOf(route.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid route '" + route + "'");
        }
    }
}
