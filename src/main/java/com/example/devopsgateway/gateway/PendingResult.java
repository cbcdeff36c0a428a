package com.example.devopsgateway.gateway;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Outcome of the background call behind an optimistic read.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PendingResult {

    public enum Status {
        PENDING, COMPLETED, FAILED
    }

    String requestId;
    String operation;
    Status status;
    Object data;
    String error;
    Instant createdAt;
    Instant completedAt;

    /** User id of the principal that issued the read */
    @JsonIgnore
    String owner;
}
