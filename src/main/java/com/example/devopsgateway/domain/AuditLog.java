package com.example.devopsgateway.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Immutable audit trail entry. One per routed operation, whichever router served it.
 */
@Entity
@Table(name = "audit_logs", indexes = {
        @Index(name = "idx_audit_actor", columnList = "actor"),
        @Index(name = "idx_audit_action", columnList = "action"),
        @Index(name = "idx_audit_timestamp", columnList = "timestamp")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    /** User id of the principal, "anonymous" for the anonymous principal */
    @Column(nullable = false)
    private String actor;

    /** GET_LOGS, GET_METRICS, DEPLOY, ROLLBACK, AUTHENTICATE, LOGOUT */
    @Column(nullable = false)
    private String action;

    /** Service name, deployment id or resource name */
    private String target;

    @Enumerated(EnumType.STRING)
    private Route route;

    /** JSON details about the action */
    @Column(length = 8192)
    private String details;

    @Column(name = "request_id")
    private String requestId;

    @Builder.Default
    private boolean success = true;

    @Column(nullable = false)
    private Instant timestamp;

    @PrePersist
    protected void onCreate() {
        if (timestamp == null) timestamp = Instant.now();
    }
}
