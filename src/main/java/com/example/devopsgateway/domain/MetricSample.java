package com.example.devopsgateway.domain;

import java.time.Instant;

/**
 * Latest observed value of one metric.
 */
public record MetricSample(Instant timestamp, String name, double value, String unit, String service) {
}
