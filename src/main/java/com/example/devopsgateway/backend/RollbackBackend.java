package com.example.devopsgateway.backend;

import com.example.devopsgateway.domain.Rollback;

public interface RollbackBackend {

    Rollback rollback(String deploymentId, String reason, String environment);
}
