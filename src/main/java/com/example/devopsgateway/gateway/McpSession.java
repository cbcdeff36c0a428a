package com.example.devopsgateway.gateway;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * A client session opened on the inbound MCP endpoint by {@code initialize}.
 */
@Data
@Builder
public class McpSession {

    private final String sessionId;
    private final Instant createdAt;
    private String clientName;
    private String clientVersion;
    private String protocolVersion;
    private boolean initialized;
    private Instant lastSeen;

    public void touch() {
        this.lastSeen = Instant.now();
    }
}
