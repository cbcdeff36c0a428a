package com.example.devopsgateway.backend;

import com.example.devopsgateway.domain.LogEntry;

import java.util.List;

/**
 * Source of recent log entries.
 */
public interface LogsBackend {

    /**
     * @param level normalized level (DEBUG, INFO, WARN, ERROR) or null for all
     * @param limit maximum number of entries, newest first
     */
    List<LogEntry> fetchLogs(String level, int limit);

    String getName();
}
