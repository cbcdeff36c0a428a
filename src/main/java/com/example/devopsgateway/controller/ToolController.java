package com.example.devopsgateway.controller;

import com.example.devopsgateway.domain.DeployResult;
import com.example.devopsgateway.domain.DeploymentStatus;
import com.example.devopsgateway.domain.RollbackResult;
import com.example.devopsgateway.gateway.GatewayRouterFactory;
import com.example.devopsgateway.gateway.RequestContext;
import com.example.devopsgateway.security.Principal;
import com.example.devopsgateway.security.RequestAuthenticator;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Write tools. Bodies are either the arguments themselves or wrapped as
 * {@code {"arguments": {...}}}.
 */
@RestController
@RequestMapping("/api/tools")
@RequiredArgsConstructor
public class ToolController {

    private final GatewayRouterFactory routerFactory;
    private final RequestAuthenticator authenticator;

    @PostMapping("/deploy_service")
    public ResponseEntity<DeployResult> deployService(@RequestBody(required = false) Map<String, Object> body,
                                                      HttpServletRequest request) {
        Principal principal = authenticator.authenticate(request);
        Map<String, Object> args = arguments(body);
        DeployResult result = routerFactory.getRouter().deploy(RequestContext.from(request), principal,
                text(args, "service_name"), text(args, "version"), text(args, "environment"));
        return ResponseEntity.status(statusFor(result.getStatus())).body(result);
    }

    @PostMapping("/rollback_deployment")
    public ResponseEntity<RollbackResult> rollbackDeployment(@RequestBody(required = false) Map<String, Object> body,
                                                             HttpServletRequest request) {
        Principal principal = authenticator.authenticate(request);
        Map<String, Object> args = arguments(body);
        RollbackResult result = routerFactory.getRouter().rollback(RequestContext.from(request), principal,
                text(args, "deployment_id"), text(args, "reason"), text(args, "environment"));
        return ResponseEntity.status(statusFor(result.getStatus())).body(result);
    }

    /**
     * Validate a session token given in the body, or the caller's own credentials.
     */
    @PostMapping("/authenticate_user")
    public ResponseEntity<Map<String, Object>> authenticateUser(@RequestBody(required = false) Map<String, Object> body,
                                                                HttpServletRequest request) {
        Map<String, Object> args = arguments(body);
        String sessionToken = text(args, "session_token");
        String refreshToken = text(args, "refresh_token");
        if (sessionToken == null) {
            RequestAuthenticator.Credentials credentials = authenticator.credentials(request);
            sessionToken = credentials.sessionToken();
            refreshToken = refreshToken != null ? refreshToken : credentials.refreshToken();
        }
        Principal principal = routerFactory.getRouter()
                .authenticate(RequestContext.from(request), sessionToken, refreshToken);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("tool", "authenticate_user");
        response.put("success", true);
        response.put("result", principal);
        return ResponseEntity.ok(response);
    }

    static HttpStatus statusFor(DeploymentStatus status) {
        return status == DeploymentStatus.IN_PROGRESS ? HttpStatus.ACCEPTED : HttpStatus.OK;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> arguments(Map<String, Object> body) {
        if (body == null) return Map.of();
        Object nested = body.get("arguments");
        if (nested instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return body;
    }

    static String text(Map<String, Object> args, String key) {
        Object value = args.get(key);
        if (value == null) return null;
        String text = String.valueOf(value);
        return text.isBlank() ? null : text;
    }
}
