package com.example.devopsgateway.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A rollback of an earlier deployment.
 */
@Entity
@Table(name = "rollbacks", indexes = {
        @Index(name = "idx_rollback_status", columnList = "status"),
        @Index(name = "idx_rollback_timestamp", columnList = "timestamp")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Rollback {

    @Id
    @Column(name = "rollback_id")
    private String rollbackId;

    @Column(name = "deployment_id", nullable = false)
    private String deploymentId;

    @Column(nullable = false, length = 1024)
    private String reason;

    @Column(nullable = false)
    private String environment;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private DeploymentStatus status;

    @Column(nullable = false)
    private Instant timestamp;

    @PrePersist
    protected void onCreate() {
        if (timestamp == null) timestamp = Instant.now();
    }
}
