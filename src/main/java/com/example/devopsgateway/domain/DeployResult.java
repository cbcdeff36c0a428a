package com.example.devopsgateway.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a deploy, identical in shape whichever router produced it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DeployResult {

    public static final String TOOL = "deploy_service";

    @Builder.Default
    private String tool = TOOL;
    private boolean success;
    private DeploymentStatus status;
    private String environment;
    private String message;
    private Deployment deployment;

    public static DeployResult of(Deployment deployment, String message) {
        return DeployResult.builder()
                .success(deployment.getStatus().isAccepted())
                .status(deployment.getStatus())
                .environment(deployment.getEnvironment())
                .message(message)
                .deployment(deployment)
                .build();
    }
}
