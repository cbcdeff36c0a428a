package com.example.devopsgateway.backend;

import com.example.devopsgateway.domain.MetricSample;

import java.util.List;

/**
 * Source of the latest value per metric.
 */
public interface MetricsBackend {

    List<MetricSample> fetchMetrics(String service, int limit);

    String getName();
}
