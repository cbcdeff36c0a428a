package com.example.devopsgateway.gateway;

import com.example.devopsgateway.config.GatewayProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;

/**
 * Short-lived store of background read outcomes, keyed by a server-issued result id.
 * An id is never reused while its entry is alive.
 * Entries expire after the configured TTL whatever their status.
 */
@Slf4j
@Component
public class PendingResultStore {

    private final Cache<String, PendingResult> results;

    public PendingResultStore(GatewayProperties properties) {
        this.results = Caffeine.newBuilder()
                .maximumSize(10_000)
                .expireAfterWrite(properties.getProxy().getResultTtlSeconds(), TimeUnit.SECONDS)
                .build();
    }

    public PendingResult begin(String requestId, String operation, String owner) {
        PendingResult pending = PendingResult.builder()
                .requestId(requestId)
                .operation(operation)
                .status(PendingResult.Status.PENDING)
                .owner(owner)
                .createdAt(Instant.now())
                .build();
        PendingResult existing = results.asMap().putIfAbsent(requestId, pending);
        if (existing != null) {
            throw new IllegalStateException("Result id already in use: " + requestId);
        }
        return pending;
    }

    public void complete(String requestId, Object data) {
        update(requestId, current -> current.toBuilder()
                .status(PendingResult.Status.COMPLETED)
                .data(data)
                .completedAt(Instant.now())
                .build());
    }

    public void fail(String requestId, String error) {
        update(requestId, current -> current.toBuilder()
                .status(PendingResult.Status.FAILED)
                .error(error)
                .completedAt(Instant.now())
                .build());
    }

    public Optional<PendingResult> find(String requestId) {
        if (requestId == null) return Optional.empty();
        return Optional.ofNullable(results.getIfPresent(requestId));
    }

    public long pendingCount() {
        return results.asMap().values().stream()
                .filter(r -> r.getStatus() == PendingResult.Status.PENDING)
                .count();
    }

    public long size() {
        return results.estimatedSize();
    }

    private void update(String requestId, UnaryOperator<PendingResult> change) {
        PendingResult updated = results.asMap().computeIfPresent(requestId, (id, current) -> change.apply(current));
        if (updated == null) {
            log.debug("Result for request {} expired before the background call finished", requestId);
        }
    }
}
