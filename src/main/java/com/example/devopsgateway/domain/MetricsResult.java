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

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MetricsResult {

    @Builder.Default
    private String uri = "metrics";
    @Builder.Default
    private String type = "metrics";
    private int count;
    private Map<String, Object> filters;
    private List<MetricSample> data;
    private Boolean loading;
    private String message;
    private String requestId;
}
