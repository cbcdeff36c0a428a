package com.example.devopsgateway.gateway;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Inbound MCP sessions, evicted after an hour without traffic.
 */
@Slf4j
@Component
public class McpSessionRegistry {

    private final Cache<String, McpSession> sessions = Caffeine.newBuilder()
            .maximumSize(10_000)
            .expireAfterAccess(1, TimeUnit.HOURS)
            .build();

    public McpSession open(String clientName, String clientVersion, String protocolVersion) {
        Instant now = Instant.now();
        McpSession session = McpSession.builder()
                .sessionId(UUID.randomUUID().toString().replace("-", ""))
                .createdAt(now)
                .lastSeen(now)
                .clientName(clientName)
                .clientVersion(clientVersion)
                .protocolVersion(protocolVersion)
                .build();
        sessions.put(session.getSessionId(), session);
        log.info("MCP session {} opened by {} {}", session.getSessionId(), clientName, clientVersion);
        return session;
    }

    public Optional<McpSession> find(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) return Optional.empty();
        McpSession session = sessions.getIfPresent(sessionId);
        if (session != null) session.touch();
        return Optional.ofNullable(session);
    }

    public long getActiveCount() {
        return sessions.estimatedSize();
    }
}
