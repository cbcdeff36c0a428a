package com.example.devopsgateway.gateway;

import com.example.devopsgateway.security.RequestAuthenticator;
import lombok.Builder;
import lombok.Data;

/**
 * What an MCP method handler knows about the inbound call.
 */
@Data
@Builder
public class McpInvocation {

    private final RequestContext context;
    private final RequestAuthenticator.Credentials credentials;
    /** Session named by the Mcp-Session-Id header, if known */
    private final McpSession session;
    /** Set by {@code initialize}; echoed back in the Mcp-Session-Id header */
    private String assignedSessionId;
}
