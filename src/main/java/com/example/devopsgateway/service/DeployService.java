package com.example.devopsgateway.service;

import com.example.devopsgateway.backend.CiCdBackend;
import com.example.devopsgateway.domain.DeployResult;
import com.example.devopsgateway.domain.Deployment;
import com.example.devopsgateway.domain.DeploymentStatus;
import com.example.devopsgateway.repository.DeploymentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs deployments through the CI/CD backend and records them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeployService {

    private final CiCdBackend ciCdBackend;
    private final DeploymentRepository deploymentRepository;

    public DeployResult deploy(String serviceName, String version, String environment) {
        Deployment deployment = ciCdBackend.deploy(serviceName, version, environment);
        deploymentRepository.save(deployment);
        log.info("Deployment {} of {} {} to {}: {}", deployment.getDeploymentId(),
                serviceName, version, environment, deployment.getStatus());
        return DeployResult.of(deployment, message(deployment));
    }

    /**
     * Successful deployments, newest first.
     */
    public List<Deployment> getRecentDeployments(int limit) {
        return deploymentRepository.findByStatusOrderByTimestampDesc(
                DeploymentStatus.SUCCESS, PageRequest.of(0, limit));
    }

    private static String message(Deployment deployment) {
        return switch (deployment.getStatus()) {
            case SUCCESS -> "Successfully deployed " + deployment.getServiceName() + " "
                    + deployment.getVersion() + " to " + deployment.getEnvironment();
            case FAILED -> "Failed to deploy " + deployment.getServiceName() + " to "
                    + deployment.getEnvironment() + ". Check logs for details.";
            case IN_PROGRESS -> "Deployment of " + deployment.getServiceName() + " to "
                    + deployment.getEnvironment() + " is in progress";
        };
    }
}
