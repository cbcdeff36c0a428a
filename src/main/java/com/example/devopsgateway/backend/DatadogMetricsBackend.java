package com.example.devopsgateway.backend;

import com.example.devopsgateway.config.GatewayProperties;
import com.example.devopsgateway.domain.MetricSample;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Latest metric values from the Datadog query API. All configured metrics are
 * fetched in one batch query over the last seven days and reduced to the most
 * recent point per metric. Results are cached per service for five minutes.
 */
@Slf4j
public class DatadogMetricsBackend implements MetricsBackend {

    static final String QUERY_PATH = "/api/v1/query";

    /** Metric name → unit */
    static final Map<String, String> METRICS = new LinkedHashMap<>();

    static {
        METRICS.put("cpu_utilization", "percent");
        METRICS.put("memory_usage", "percent");
        METRICS.put("disk_usage", "percent");
        METRICS.put("network_in", "bytes");
        METRICS.put("network_out", "bytes");
        METRICS.put("response_time", "milliseconds");
        METRICS.put("request_count", "count");
        METRICS.put("error_rate", "percent");
        METRICS.put("database_connections", "count");
        METRICS.put("queue_size", "count");
    }

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final GatewayProperties.TelemetryConfig.DatadogConfig config;
    private final MetricsBackend fallback;
    private final Cache<String, List<MetricSample>> latestCache;

    public DatadogMetricsBackend(WebClient webClient, ObjectMapper objectMapper,
                                 GatewayProperties properties, MetricsBackend fallback) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.config = properties.getTelemetry().getDatadog();
        this.fallback = fallback;
        this.latestCache = Caffeine.newBuilder()
                .maximumSize(100)
                .expireAfterWrite(5, TimeUnit.MINUTES)
                .build();
    }

    @Override
    public List<MetricSample> fetchMetrics(String service, int limit) {
        String effectiveService = service != null ? service : config.getServiceName();
        List<MetricSample> cached = latestCache.getIfPresent(effectiveService);
        if (cached != null) {
            log.debug("Metrics cache hit for service {}", effectiveService);
            return truncate(cached, limit);
        }

        try {
            List<MetricSample> latest = query(effectiveService);
            if (latest.isEmpty()) {
                log.info("No metrics returned from Datadog for service '{}', using generated metrics", effectiveService);
                return fallback.fetchMetrics(service, limit);
            }
            latestCache.put(effectiveService, latest);
            log.info("Fetched {} latest metrics from Datadog in one batch query", latest.size());
            return truncate(latest, limit);
        } catch (Exception e) {
            log.warn("Datadog metrics query failed, using generated metrics: {}", e.getMessage());
            return fallback.fetchMetrics(service, limit);
        }
    }

    String buildQuery(String service) {
        return METRICS.keySet().stream()
                .map(name -> "avg:" + name + "{service:" + service + "}")
                .collect(Collectors.joining(","));
    }

    private List<MetricSample> query(String service) throws Exception {
        long to = Instant.now().getEpochSecond();
        long from = to - Duration.ofDays(7).toSeconds();

        String response = webClient.get()
                .uri(DatadogSupport.baseUrl(config) + QUERY_PATH + "?query={query}&from={from}&to={to}",
                        buildQuery(service), from, to)
                .headers(DatadogSupport.credentials(config))
                .retrieve()
                .bodyToMono(String.class)
                .block(Duration.ofSeconds(30));

        if (response == null || response.isBlank()) return List.of();

        Map<String, MetricSample> latest = new LinkedHashMap<>();
        for (JsonNode series : objectMapper.readTree(response).path("series")) {
            String name = series.path("metric").asText("unknown");
            JsonNode points = series.path("pointlist");
            if (!points.isArray() || points.isEmpty()) continue;

            JsonNode point = points.get(points.size() - 1);
            if (point.size() < 2 || point.get(1).isNull()) continue;

            MetricSample sample = new MetricSample(
                    Instant.ofEpochMilli(point.get(0).asLong()),
                    name,
                    point.get(1).asDouble(),
                    METRICS.getOrDefault(name, "unknown"),
                    service);
            latest.merge(name, sample, (a, b) -> a.timestamp().isAfter(b.timestamp()) ? a : b);
        }
        return latest.values().stream()
                .sorted(Comparator.comparing(MetricSample::name))
                .toList();
    }

    private static List<MetricSample> truncate(List<MetricSample> samples, int limit) {
        return samples.size() > limit ? samples.subList(0, limit) : samples;
    }

    @Override
    public String getName() {
        return "datadog";
    }
}
