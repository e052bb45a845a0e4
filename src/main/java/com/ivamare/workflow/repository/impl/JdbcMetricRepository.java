package com.ivamare.workflow.repository.impl;

import com.ivamare.workflow.model.MetricSample;
import com.ivamare.workflow.repository.MetricRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static com.ivamare.workflow.repository.impl.JsonColumns.instant;
import static com.ivamare.workflow.repository.impl.JsonColumns.timestamp;

/**
 * JDBC implementation of MetricRepository.
 */
public class JdbcMetricRepository implements MetricRepository {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcMetricRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void save(MetricSample sample) {
        String sql = """
            INSERT INTO workflow.workflow_metric
                (metric_id, workflow_id, metric_type, metric_name, metric_value, metadata, created_at)
            VALUES (?, ?, ?, ?, ?, ?::jsonb, ?)
            """;

        jdbcTemplate.update(sql,
            sample.metricId(),
            sample.workflowId(),
            sample.metricType(),
            sample.metricName(),
            sample.metricValue(),
            JsonColumns.write(objectMapper, sample.metadata()),
            timestamp(sample.createdAt())
        );
    }

    @Override
    public List<MetricSample> find(String metricType, String metricName, Instant since, int limit) {
        String sql = """
            SELECT metric_id, workflow_id, metric_type, metric_name, metric_value, metadata, created_at
            FROM workflow.workflow_metric
            WHERE metric_type = ? AND metric_name = ? AND created_at >= ?
            ORDER BY created_at DESC
            LIMIT ?
            """;

        return jdbcTemplate.query(sql, (rs, rowNum) -> new MetricSample(
            rs.getObject("metric_id", UUID.class),
            rs.getObject("workflow_id", UUID.class),
            rs.getString("metric_type"),
            rs.getString("metric_name"),
            rs.getDouble("metric_value"),
            JsonColumns.readMap(objectMapper, rs.getString("metadata")),
            instant(rs.getTimestamp("created_at"))
        ), metricType, metricName, timestamp(since), limit);
    }
}
