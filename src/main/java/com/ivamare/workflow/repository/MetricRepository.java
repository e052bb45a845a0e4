package com.ivamare.workflow.repository;

import com.ivamare.workflow.model.MetricSample;

import java.time.Instant;
import java.util.List;

/**
 * Append-only store of metric samples.
 */
public interface MetricRepository {

    void save(MetricSample sample);

    List<MetricSample> find(String metricType, String metricName, Instant since, int limit);
}
