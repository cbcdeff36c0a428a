package com.example.devopsgateway.backend;

import com.example.devopsgateway.config.GatewayProperties;
import com.example.devopsgateway.domain.LogEntry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Logs from the Datadog log search API, falling back to generated logs
 * when the API errors or has nothing for the service.
 */
@Slf4j
public class DatadogLogsBackend implements LogsBackend {

    static final String SEARCH_PATH = "/api/v2/logs/events/search";
    private static final Set<String> KNOWN_LEVELS = Set.of("INFO", "WARN", "ERROR");

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final GatewayProperties.TelemetryConfig.DatadogConfig config;
    private final LogsBackend fallback;

    public DatadogLogsBackend(WebClient webClient, ObjectMapper objectMapper,
                              GatewayProperties properties, LogsBackend fallback) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.config = properties.getTelemetry().getDatadog();
        this.fallback = fallback;
    }

    @Override
    public List<LogEntry> fetchLogs(String level, int limit) {
        String query = buildQuery(level);
        Map<String, Object> payload = Map.of(
                "filter", Map.of("query", query, "from", config.getLogsWindow(), "to", "now"),
                "sort", "-timestamp",
                "page", Map.of("limit", limit));

        try {
            log.info("Fetching logs from Datadog with query: {}", query);
            String response = webClient.post()
                    .uri(DatadogSupport.baseUrl(config) + SEARCH_PATH)
                    .headers(DatadogSupport.credentials(config))
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(payload)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(Duration.ofSeconds(30));

            List<LogEntry> entries = parse(response);
            if (entries.isEmpty()) {
                log.info("No logs in Datadog for service '{}' within {}, using generated logs",
                        config.getServiceName(), config.getLogsWindow());
                return fallback.fetchLogs(level, limit);
            }
            log.info("Fetched {} logs from Datadog", entries.size());
            return entries.size() > limit ? entries.subList(0, limit) : entries;
        } catch (Exception e) {
            log.warn("Datadog logs query failed, using generated logs: {}", e.getMessage());
            return fallback.fetchLogs(level, limit);
        }
    }

    String buildQuery(String level) {
        StringBuilder query = new StringBuilder("service:").append(config.getServiceName());
        if (level != null) {
            if ("WARN".equals(level)) {
                query.append(" (@level:WARN OR @level:WARNING)");
            } else {
                query.append(" @level:").append(level);
            }
        }
        return query.toString();
    }

    private List<LogEntry> parse(String response) throws Exception {
        List<LogEntry> entries = new ArrayList<>();
        if (response == null || response.isBlank()) return entries;

        JsonNode data = objectMapper.readTree(response).path("data");
        for (JsonNode item : data) {
            JsonNode attrs = item.path("attributes");
            entries.add(new LogEntry(
                    parseTimestamp(attrs.path("timestamp").asText(null)),
                    normalizeLevel(attrs.path("level").asText("INFO")),
                    attrs.path("message").asText(""),
                    attrs.path("service").asText(config.getServiceName())));
        }
        return entries;
    }

    static String normalizeLevel(String level) {
        String upper = level == null ? "INFO" : level.trim().toUpperCase();
        if (upper.equals("WARNING")) return "WARN";
        return KNOWN_LEVELS.contains(upper) ? upper : "INFO";
    }

    private static Instant parseTimestamp(String timestamp) {
        if (timestamp == null || timestamp.isBlank()) return Instant.now();
        try {
            return OffsetDateTime.parse(timestamp).toInstant();
        } catch (DateTimeParseException e) {
            return Instant.now();
        }
    }

    @Override
    public String getName() {
        return "datadog";
    }
}
