package com.example.devopsgateway.domain;

import java.time.Instant;

public record LogEntry(Instant timestamp, String level, String message, String source) {
}
