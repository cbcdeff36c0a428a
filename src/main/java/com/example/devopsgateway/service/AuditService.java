package com.example.devopsgateway.service;

import com.example.devopsgateway.domain.AuditLog;
import com.example.devopsgateway.domain.Route;
import com.example.devopsgateway.repository.AuditLogRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Audit trail of routed operations. Writes are async so a slow database never
 * delays the caller; a failed write is logged and dropped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditService {

    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;

    @Async("auditExecutor")
    public void record(String actor, String action, String target, Route route,
                       Map<String, Object> details, String requestId, boolean success) {
        try {
            String detailsJson = details != null ? objectMapper.writeValueAsString(details) : null;
            AuditLog entry = AuditLog.builder()
                    .actor(actor)
                    .action(action)
                    .target(target)
                    .route(route)
                    .details(detailsJson)
                    .requestId(requestId)
                    .success(success)
                    .timestamp(Instant.now())
                    .build();
            auditLogRepository.save(entry);
            log.debug("Audit: [{}] {} -> {} via {} ({})", actor, action, target, route, success ? "OK" : "FAIL");
        } catch (Exception e) {
            log.error("Failed to write audit log: {}", e.getMessage());
        }
    }

    /** Get recent audit entries */
    public List<AuditLog> getRecent(int limit) {
        return auditLogRepository.findAllPaged(PageRequest.of(0, limit)).getContent();
    }

    /** Filter audit entries */
    public List<AuditLog> filter(String actor, String action, Route route) {
        return auditLogRepository.findFiltered(actor, action, route);
    }

    public List<AuditLog> getByRequest(String requestId) {
        return auditLogRepository.findByRequestIdOrderByTimestampDesc(requestId);
    }

    public long countByRoute(Route route) {
        return auditLogRepository.countByRoute(route);
    }
}
