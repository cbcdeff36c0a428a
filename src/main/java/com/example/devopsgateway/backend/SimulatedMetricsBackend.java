package com.example.devopsgateway.backend;

import com.example.devopsgateway.domain.MetricSample;
import lombok.RequiredArgsConstructor;

import java.util.List;

@RequiredArgsConstructor
public class SimulatedMetricsBackend implements MetricsBackend {

    private final TelemetrySampleGenerator generator;

    @Override
    public List<MetricSample> fetchMetrics(String service, int limit) {
        return generator.metrics(limit, service);
    }

    @Override
    public String getName() {
        return "simulated";
    }
}
