package com.example.devopsgateway.backend;

import com.example.devopsgateway.domain.Deployment;
import com.example.devopsgateway.domain.DeploymentStatus;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Locale;
import java.util.Random;
import java.util.UUID;

/**
 * CI/CD pipeline stand-in whose outcome depends on the service name:
 * test/demo services always succeed, critical/core services may fail in
 * production, experimental/beta services fail often and may stay in progress.
 * Production never reports IN_PROGRESS; a staging failure is retried into
 * SUCCESS or IN_PROGRESS.
 */
@Slf4j
public class SimulatedCiCdBackend implements CiCdBackend {

    private final Random random;

    public SimulatedCiCdBackend(Random random) {
        this.random = random;
    }

    @Override
    public Deployment deploy(String serviceName, String version, String environment) {
        DeploymentStatus status = applyEnvironment(baseOutcome(serviceName, environment), environment);
        log.info("Simulated deployment of {} {} to {} ({}): {}",
                serviceName, version, environment, serviceType(serviceName), status);
        return Deployment.builder()
                .deploymentId(UUID.randomUUID().toString())
                .serviceName(serviceName)
                .version(version)
                .environment(environment)
                .status(status)
                .timestamp(Instant.now())
                .build();
    }

    private DeploymentStatus baseOutcome(String serviceName, String environment) {
        return switch (serviceType(serviceName)) {
            case "test" -> DeploymentStatus.SUCCESS;
            case "critical" -> "production".equals(environment)
                    ? weighted(70, 30, 0)
                    : DeploymentStatus.SUCCESS;
            case "experimental" -> weighted(60, 30, 10);
            default -> weighted(85, 15, 0);
        };
    }

    private DeploymentStatus applyEnvironment(DeploymentStatus status, String environment) {
        if ("production".equals(environment) && status == DeploymentStatus.IN_PROGRESS) {
            return DeploymentStatus.SUCCESS;
        }
        if ("staging".equals(environment) && status == DeploymentStatus.FAILED) {
            return weighted(80, 0, 20);
        }
        return status;
    }

    private DeploymentStatus weighted(int success, int failed, int inProgress) {
        int roll = random.nextInt(success + failed + inProgress);
        if (roll < success) return DeploymentStatus.SUCCESS;
        if (roll < success + failed) return DeploymentStatus.FAILED;
        return DeploymentStatus.IN_PROGRESS;
    }

    static String serviceType(String serviceName) {
        String name = serviceName.toLowerCase(Locale.ROOT);
        if (name.contains("test") || name.contains("demo")) return "test";
        if (name.contains("critical") || name.contains("core")) return "critical";
        if (name.contains("experimental") || name.contains("beta")) return "experimental";
        return "standard";
    }
}
