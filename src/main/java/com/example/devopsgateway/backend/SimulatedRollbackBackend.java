package com.example.devopsgateway.backend;

import com.example.devopsgateway.domain.DeploymentStatus;
import com.example.devopsgateway.domain.Rollback;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.UUID;

@Slf4j
public class SimulatedRollbackBackend implements RollbackBackend {

    @Override
    public Rollback rollback(String deploymentId, String reason, String environment) {
        log.info("Simulated rollback of deployment {} in {}", deploymentId, environment);
        return Rollback.builder()
                .rollbackId(UUID.randomUUID().toString())
                .deploymentId(deploymentId)
                .reason(reason)
                .environment(environment)
                .status(DeploymentStatus.SUCCESS)
                .timestamp(Instant.now())
                .build();
    }
}
