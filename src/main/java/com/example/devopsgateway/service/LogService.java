package com.example.devopsgateway.service;

import com.example.devopsgateway.backend.LogsBackend;
import com.example.devopsgateway.domain.LogEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class LogService {

    private final LogsBackend logsBackend;

    /** Entries fetched from the backend when a time window narrows the result */
    static final int WINDOW_FETCH_SIZE = 1000;

    /**
     * Recent logs, newest first, optionally restricted to one level and to entries
     * at or after {@code since}. Both filters apply before the limit.
     */
    public List<LogEntry> getRecentLogs(String level, int limit, Instant since) {
        int fetchSize = since != null ? Math.max(limit, WINDOW_FETCH_SIZE) : limit;
        log.debug("Fetching up to {} logs (level={}, since={}) from {}", fetchSize, level, since, logsBackend.getName());
        return logsBackend.fetchLogs(level, fetchSize).stream()
                .filter(entry -> level == null || level.equals(entry.level()))
                .filter(entry -> since == null || entry.timestamp() == null || !entry.timestamp().isBefore(since))
                .limit(limit)
                .toList();
    }
}
