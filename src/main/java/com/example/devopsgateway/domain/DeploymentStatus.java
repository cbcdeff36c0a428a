package com.example.devopsgateway.domain;

public enum DeploymentStatus {
    SUCCESS, FAILED, IN_PROGRESS;

    /** SUCCESS and IN_PROGRESS are reported as successful calls */
    public boolean isAccepted() {
        return this != FAILED;
    }
}
