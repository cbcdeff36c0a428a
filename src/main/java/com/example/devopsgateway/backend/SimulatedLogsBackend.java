package com.example.devopsgateway.backend;

import com.example.devopsgateway.domain.LogEntry;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * Generated logs, used when no telemetry credentials are configured.
 */
@RequiredArgsConstructor
public class SimulatedLogsBackend implements LogsBackend {

    private final TelemetrySampleGenerator generator;

    @Override
    public List<LogEntry> fetchLogs(String level, int limit) {
        return generator.logs(Math.min(limit, 50), level, null);
    }

    @Override
    public String getName() {
        return "simulated";
    }
}
