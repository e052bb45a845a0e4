package com.ivamare.workflow.model;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Numeric observation recorded alongside domain events.
 */
public record MetricSample(
    UUID metricId,
    UUID workflowId,
    String metricType,
    String metricName,
    double metricValue,
    Map<String, Object> metadata,
    Instant createdAt
) {
    public MetricSample {
        metadata = metadata != null ? metadata : Map.of();
    }

    public static MetricSample of(UUID workflowId, String metricType, String metricName,
                                  double value, Map<String, Object> metadata) {
        return new MetricSample(UUID.randomUUID(), workflowId, metricType, metricName, value,
            metadata, Instant.now());
    }
}
