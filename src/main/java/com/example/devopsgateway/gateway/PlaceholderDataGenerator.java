package com.example.devopsgateway.gateway;

import com.example.devopsgateway.backend.TelemetrySampleGenerator;
import com.example.devopsgateway.config.GatewayProperties;
import com.example.devopsgateway.domain.LogEntry;
import com.example.devopsgateway.domain.MetricSample;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Representative but fabricated data returned by optimistic reads.
 * Log messages carry a "LOADING: " prefix so they can't be mistaken for real entries.
 */
@Component
public class PlaceholderDataGenerator {

    static final String LOADING_PREFIX = "LOADING: ";
    static final String LOADING_MESSAGE = "Loading real data in background...";

    private final TelemetrySampleGenerator generator;
    private final GatewayProperties.ProxyConfig config;

    public PlaceholderDataGenerator(TelemetrySampleGenerator generator, GatewayProperties properties) {
        this.generator = generator;
        this.config = properties.getProxy();
    }

    public List<LogEntry> logs(int limit, String level) {
        return generator.logs(Math.min(limit, config.getPlaceholderLogCount()), level, LOADING_PREFIX);
    }

    public List<MetricSample> metrics(int limit, String service) {
        return generator.metrics(Math.min(limit, config.getPlaceholderMetricCount()), service);
    }
}
