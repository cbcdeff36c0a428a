package com.example.devopsgateway.service;

import com.example.devopsgateway.backend.LogsBackend;
import com.example.devopsgateway.domain.LogEntry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LogServiceTest {

    @Mock
    private LogsBackend logsBackend;

    @InjectMocks
    private LogService logService;

    @Test
    void dropsEntriesOfOtherLevelsAndHonoursLimit() {
        Instant now = Instant.now();
        when(logsBackend.fetchLogs("ERROR", 2)).thenReturn(List.of(
                new LogEntry(now, "ERROR", "a", "svc"),
                new LogEntry(now, "INFO", "b", "svc"),
                new LogEntry(now, "ERROR", "c", "svc"),
                new LogEntry(now, "ERROR", "d", "svc")));

        assertThat(logService.getRecentLogs("ERROR", 2, null)).extracting(LogEntry::message).containsExactly("a", "c");
    }

    @Test
    void sinceWindowIsAppliedBeforeTheLimit() {
        Instant now = Instant.now();
        when(logsBackend.fetchLogs(null, LogService.WINDOW_FETCH_SIZE)).thenReturn(List.of(
                new LogEntry(now.minus(Duration.ofMinutes(1)), "INFO", "a", "svc"),
                new LogEntry(now.minus(Duration.ofMinutes(2)), "INFO", "b", "svc"),
                new LogEntry(now.minus(Duration.ofMinutes(3)), "INFO", "c", "svc"),
                new LogEntry(now.minus(Duration.ofHours(2)), "INFO", "old", "svc")));

        List<LogEntry> logs = logService.getRecentLogs(null, 3, now.minus(Duration.ofHours(1)));

        assertThat(logs).extracting(LogEntry::message).containsExactly("a", "b", "c");
    }
}
