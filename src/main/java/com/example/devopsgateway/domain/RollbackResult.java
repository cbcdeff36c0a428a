package com.example.devopsgateway.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a rollback. {@code environment} is always populated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RollbackResult {

    public static final String TOOL = "rollback_deployment";

    @Builder.Default
    private String tool = TOOL;
    private boolean success;
    private DeploymentStatus status;
    private String environment;
    private String message;
    private Rollback rollback;

    public static RollbackResult of(Rollback rollback, String message) {
        return RollbackResult.builder()
                .success(rollback.getStatus().isAccepted())
                .status(rollback.getStatus())
                .environment(rollback.getEnvironment())
                .message(message)
                .rollback(rollback)
                .build();
    }
}
