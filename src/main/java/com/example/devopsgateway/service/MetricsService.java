package com.example.devopsgateway.service;

import com.example.devopsgateway.backend.MetricsBackend;
import com.example.devopsgateway.domain.MetricSample;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class MetricsService {

    private final MetricsBackend metricsBackend;

    /**
     * Latest sample per metric, optionally for one service.
     */
    public List<MetricSample> getLatestMetrics(String service, int limit) {
        log.debug("Fetching up to {} metrics (service={}) from {}", limit, service, metricsBackend.getName());
        return metricsBackend.fetchMetrics(service, limit).stream()
                .limit(limit)
                .toList();
    }
}
