package com.example.devopsgateway.service;

import com.example.devopsgateway.backend.RollbackBackend;
import com.example.devopsgateway.domain.DeploymentStatus;
import com.example.devopsgateway.domain.Rollback;
import com.example.devopsgateway.domain.RollbackResult;
import com.example.devopsgateway.exception.ValidationException;
import com.example.devopsgateway.repository.RollbackRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class RollbackService {

    static final int MIN_REASON_LENGTH = 5;

    private final RollbackBackend rollbackBackend;
    private final RollbackRepository rollbackRepository;

    /**
     * @throws ValidationException if the trimmed reason is shorter than five characters
     */
    public RollbackResult rollback(String deploymentId, String reason, String environment) {
        if (reason == null || reason.trim().length() < MIN_REASON_LENGTH) {
            throw new ValidationException("Rollback reason must be at least " + MIN_REASON_LENGTH + " characters");
        }

        Rollback rollback = rollbackBackend.rollback(deploymentId, reason.trim(), environment);
        rollbackRepository.save(rollback);
        log.info("Rollback {} of deployment {} in {}: {}", rollback.getRollbackId(),
                deploymentId, environment, rollback.getStatus());

        String message = rollback.getStatus() == DeploymentStatus.FAILED
                ? "Rollback of deployment " + deploymentId + " failed"
                : "Rolled back deployment " + deploymentId + " in " + environment;
        return RollbackResult.of(rollback, message);
    }

    /**
     * Successful rollbacks, newest first.
     */
    public List<Rollback> getRecentRollbacks(int limit) {
        return rollbackRepository.findByStatusOrderByTimestampDesc(
                DeploymentStatus.SUCCESS, PageRequest.of(0, limit));
    }
}
