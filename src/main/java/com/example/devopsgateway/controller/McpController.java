package com.example.devopsgateway.controller;

import com.example.devopsgateway.gateway.JsonRpcMessage;
import com.example.devopsgateway.gateway.McpGatewayTransport;
import com.example.devopsgateway.gateway.McpInvocation;
import com.example.devopsgateway.gateway.McpRpcRouter;
import com.example.devopsgateway.gateway.McpSessionRegistry;
import com.example.devopsgateway.gateway.RequestContext;
import com.example.devopsgateway.security.RequestAuthenticator;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

/**
 * Inbound MCP endpoint: one JSON-RPC envelope per POST.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class McpController {

    private final McpRpcRouter rpcRouter;
    private final McpSessionRegistry sessionRegistry;
    private final RequestAuthenticator authenticator;

    @PostMapping(path = "/mcp", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<JsonRpcMessage> handle(
            @RequestBody JsonRpcMessage message,
            @RequestHeader(name = McpGatewayTransport.SESSION_HEADER, required = false) String sessionId,
            HttpServletRequest request) {
        McpInvocation invocation = McpInvocation.builder()
                .context(RequestContext.from(request))
                .credentials(authenticator.credentials(request))
                .session(sessionRegistry.find(sessionId).orElse(null))
                .build();
        log.debug("MCP {} (session {})", message.getMethod(), sessionId);

        JsonRpcMessage response = rpcRouter.route(message, invocation);
        if (message.isNotification()) {
            return ResponseEntity.status(HttpStatus.ACCEPTED).build();
        }

        ResponseEntity.BodyBuilder builder = ResponseEntity.ok();
        if (invocation.getAssignedSessionId() != null) {
            builder.header(McpGatewayTransport.SESSION_HEADER, invocation.getAssignedSessionId());
        }
        return builder.body(response);
    }
}
