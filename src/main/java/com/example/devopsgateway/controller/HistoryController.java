package com.example.devopsgateway.controller;

import com.example.devopsgateway.domain.Deployment;
import com.example.devopsgateway.domain.Rollback;
import com.example.devopsgateway.security.OperationPermissions;
import com.example.devopsgateway.security.PermissionEngine;
import com.example.devopsgateway.security.PermissionMode;
import com.example.devopsgateway.security.RequestAuthenticator;
import com.example.devopsgateway.service.DeployService;
import com.example.devopsgateway.service.RollbackService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Successful deployments and rollbacks, newest first.
 */
@RestController
@RequiredArgsConstructor
public class HistoryController {

    private final DeployService deployService;
    private final RollbackService rollbackService;
    private final PermissionEngine permissionEngine;
    private final RequestAuthenticator authenticator;

    @GetMapping("/api/deployments")
    public ResponseEntity<Map<String, Object>> recentDeployments(@RequestParam(defaultValue = "10") int limit,
                                                                 HttpServletRequest request) {
        permissionEngine.require(authenticator.authenticate(request),
                Set.of(OperationPermissions.READ_DEPLOYMENTS), PermissionMode.ANY);
        List<Deployment> deployments = deployService.getRecentDeployments(clamp(limit));
        return ResponseEntity.ok(Map.of("count", deployments.size(), "deployments", deployments));
    }

    @GetMapping("/api/rollbacks")
    public ResponseEntity<Map<String, Object>> recentRollbacks(@RequestParam(defaultValue = "10") int limit,
                                                               HttpServletRequest request) {
        permissionEngine.require(authenticator.authenticate(request),
                Set.of(OperationPermissions.READ_ROLLBACKS), PermissionMode.ANY);
        List<Rollback> rollbacks = rollbackService.getRecentRollbacks(clamp(limit));
        return ResponseEntity.ok(Map.of("count", rollbacks.size(), "rollbacks", rollbacks));
    }

    private static int clamp(int limit) {
        return Math.max(1, Math.min(limit, 100));
    }
}
