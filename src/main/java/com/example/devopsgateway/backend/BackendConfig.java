package com.example.devopsgateway.backend;

import com.example.devopsgateway.config.GatewayProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Random;

/**
 * Picks telemetry and CI/CD backends. Datadog is used when both keys are set,
 * otherwise logs and metrics are simulated.
 */
@Slf4j
@Configuration
public class BackendConfig {

    @Bean
    public LogsBackend logsBackend(GatewayProperties properties, WebClient webClient,
                                   ObjectMapper objectMapper, TelemetrySampleGenerator generator) {
        LogsBackend simulated = new SimulatedLogsBackend(generator);
        if (properties.getTelemetry().getDatadog().isConfigured()) {
            log.info("Logs backend: datadog ({})", properties.getTelemetry().getDatadog().getSite());
            return new DatadogLogsBackend(webClient, objectMapper, properties, simulated);
        }
        log.info("Logs backend: simulated");
        return simulated;
    }

    @Bean
    public MetricsBackend metricsBackend(GatewayProperties properties, WebClient webClient,
                                         ObjectMapper objectMapper, TelemetrySampleGenerator generator) {
        MetricsBackend simulated = new SimulatedMetricsBackend(generator);
        if (properties.getTelemetry().getDatadog().isConfigured()) {
            log.info("Metrics backend: datadog ({})", properties.getTelemetry().getDatadog().getSite());
            return new DatadogMetricsBackend(webClient, objectMapper, properties, simulated);
        }
        log.info("Metrics backend: simulated");
        return simulated;
    }

    @Bean
    public CiCdBackend ciCdBackend() {
        return new SimulatedCiCdBackend(new Random());
    }

    @Bean
    public RollbackBackend rollbackBackend() {
        return new SimulatedRollbackBackend();
    }
}
