package com.example.devopsgateway.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Logs resource payload. {@code loading}, {@code message} and {@code requestId}
 * are only set on optimistic placeholder responses.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class LogsResult {

    @Builder.Default
    private String uri = "logs";
    @Builder.Default
    private String type = "logs";
    private int count;
    private Map<String, Object> filters;
    private List<LogEntry> data;
    private Boolean loading;
    private String message;
    private String requestId;
}
