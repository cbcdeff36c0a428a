package com.example.devopsgateway.backend;

import com.example.devopsgateway.domain.LogEntry;
import com.example.devopsgateway.domain.MetricSample;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Generates representative log and metric samples. Used by the simulated
 * backends and for the placeholder data of optimistic reads.
 */
@Component
public class TelemetrySampleGenerator {

    record LogTemplate(String level, String message) {
    }

    record MetricConfig(String name, String unit, double min, double max) {
    }

    static final List<LogTemplate> LOG_TEMPLATES = List.of(
            new LogTemplate("INFO", "User authentication successful - user_id={user_id}"),
            new LogTemplate("INFO", "API request processed - endpoint=/api/v1/metrics, response_time={time}ms"),
            new LogTemplate("INFO", "Database query executed - duration={duration}ms, rows={rows}"),
            new LogTemplate("WARN", "High memory usage detected - current={memory}%, threshold=80%"),
            new LogTemplate("INFO", "Cache hit - key=user_session_{session}, ttl={ttl}s"),
            new LogTemplate("WARN", "Rate limit approaching - requests={requests}/min, limit=1000"),
            new LogTemplate("ERROR", "External API timeout - service={service}, timeout=30s"),
            new LogTemplate("INFO", "Background job completed - type=log_aggregation, duration={duration}s"),
            new LogTemplate("WARN", "Disk space warning - usage={usage}%, available={available}GB"),
            new LogTemplate("INFO", "Health check passed - all services operational, uptime={uptime}h"),
            new LogTemplate("DEBUG", "Debug trace - function={function}, line={line}, variable={variable}"),
            new LogTemplate("ERROR", "Database connection failed - host={host}, port={port}, error={error}"),
            new LogTemplate("INFO", "File uploaded successfully - filename={filename}, size={size}bytes"),
            new LogTemplate("WARN", "Slow query detected - query={query}, duration={duration}ms"),
            new LogTemplate("INFO", "User session expired - user_id={user_id}, session_duration={duration}m")
    );

    static final List<MetricConfig> METRIC_CONFIGS = List.of(
            new MetricConfig("cpu_utilization", "percent", 20, 80),
            new MetricConfig("memory_usage", "percent", 30, 85),
            new MetricConfig("disk_usage", "percent", 40, 90),
            new MetricConfig("response_time", "milliseconds", 50, 300),
            new MetricConfig("error_rate", "percent", 0.1, 5.0),
            new MetricConfig("request_count", "count", 100, 2000),
            new MetricConfig("database_connections", "count", 5, 100),
            new MetricConfig("network_in", "bytes", 1024, 1000000),
            new MetricConfig("network_out", "bytes", 1024, 1000000),
            new MetricConfig("queue_size", "count", 0, 50),
            new MetricConfig("active_sessions", "count", 10, 500),
            new MetricConfig("cache_hit_rate", "percent", 70, 95),
            new MetricConfig("throughput", "requests_per_second", 50, 500),
            new MetricConfig("latency_p95", "milliseconds", 100, 500),
            new MetricConfig("availability", "percent", 99.0, 99.99)
    );

    static final List<String> SERVICE_NAMES = List.of(
            "payment-service", "user-service", "notification-service", "analytics-service", "api-gateway",
            "database-service", "cache-service", "file-service", "email-service", "auth-service");

    private static final List<String> ERROR_MESSAGES = List.of(
            "Connection timeout", "Database connection lost", "Invalid credentials", "Resource not found",
            "Permission denied", "Rate limit exceeded", "Service unavailable", "Internal server error",
            "Validation failed", "Network error");

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)}");

    private final Supplier<Random> random;

    public TelemetrySampleGenerator() {
        this(ThreadLocalRandom::current);
    }

    TelemetrySampleGenerator(Supplier<Random> random) {
        this.random = random;
    }

    /**
     * Log entries newest first. A level with no matching template yields generic events at that level.
     */
    public List<LogEntry> logs(int count, String level, String messagePrefix) {
        List<LogTemplate> templates = LOG_TEMPLATES;
        if (level != null) {
            templates = LOG_TEMPLATES.stream().filter(t -> t.level().equals(level)).toList();
            if (templates.isEmpty()) {
                templates = List.of(new LogTemplate(level, "System event logged - id={event_id}"));
            }
        }

        Random rnd = random.get();
        Instant now = Instant.now();
        Instant timestamp = now;
        List<LogEntry> entries = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            LogTemplate template = templates.get(rnd.nextInt(templates.size()));
            entries.add(new LogEntry(
                    timestamp,
                    template.level(),
                    prefix(messagePrefix) + format(template.message(), rnd),
                    pick(SERVICE_NAMES, rnd)));
            timestamp = timestamp.minus(1 + rnd.nextInt(5), ChronoUnit.MINUTES);
        }
        return entries;
    }

    /**
     * One sample per configured metric, in configuration order.
     */
    public List<MetricSample> metrics(int count, String service) {
        Random rnd = random.get();
        Instant now = Instant.now();
        return METRIC_CONFIGS.stream()
                .limit(Math.max(0, count))
                .map(cfg -> new MetricSample(now, cfg.name(), value(cfg, rnd), cfg.unit(),
                        service != null ? service : pick(SERVICE_NAMES, rnd)))
                .toList();
    }

    private static double value(MetricConfig cfg, Random rnd) {
        double raw = cfg.min() + rnd.nextDouble() * (cfg.max() - cfg.min());
        if (cfg.unit().equals("count") || cfg.unit().equals("bytes")) {
            return Math.floor(raw);
        }
        return Math.round(raw * 100.0) / 100.0;
    }

    private static String format(String template, Random rnd) {
        Map<String, Supplier<Object>> values = Map.ofEntries(
                Map.entry("user_id", () -> 10000 + rnd.nextInt(90000)),
                Map.entry("time", () -> 50 + rnd.nextInt(251)),
                Map.entry("duration", () -> 10 + rnd.nextInt(491)),
                Map.entry("rows", () -> 1 + rnd.nextInt(100)),
                Map.entry("memory", () -> 60 + rnd.nextInt(36)),
                Map.entry("session", () -> 1000 + rnd.nextInt(9000)),
                Map.entry("ttl", () -> 300 + rnd.nextInt(3301)),
                Map.entry("requests", () -> 500 + rnd.nextInt(451)),
                Map.entry("service", () -> pick(SERVICE_NAMES, rnd)),
                Map.entry("usage", () -> 70 + rnd.nextInt(26)),
                Map.entry("available", () -> 5 + rnd.nextInt(46)),
                Map.entry("uptime", () -> 24 + rnd.nextInt(697)),
                Map.entry("event_id", () -> 100000 + rnd.nextInt(900000)),
                Map.entry("function", () -> pick(List.of("process_request", "validate_user", "save_data", "send_notification"), rnd)),
                Map.entry("line", () -> 10 + rnd.nextInt(191)),
                Map.entry("variable", () -> pick(List.of("user_id", "request_id", "session_token", "response_data"), rnd)),
                Map.entry("host", () -> "db-" + (1 + rnd.nextInt(5)) + ".example.com"),
                Map.entry("port", () -> pick(List.of(3306, 5432, 6379, 27017), rnd)),
                Map.entry("error", () -> pick(ERROR_MESSAGES, rnd)),
                Map.entry("filename", () -> "file_" + (1 + rnd.nextInt(1000)) + ".pdf"),
                Map.entry("size", () -> 1024 + rnd.nextInt(10485760 - 1024)),
                Map.entry("query", () -> pick(List.of("SELECT * FROM users", "UPDATE sessions SET", "INSERT INTO logs"), rnd))
        );

        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            Supplier<Object> supplier = values.get(matcher.group(1));
            String replacement = supplier != null ? String.valueOf(supplier.get()) : matcher.group();
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static <T> T pick(List<T> options, Random rnd) {
        return options.get(rnd.nextInt(options.size()));
    }

    private static String prefix(String messagePrefix) {
        return messagePrefix != null ? messagePrefix : "";
    }
}
