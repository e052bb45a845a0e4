package com.ivamare.workflow.ops.impl;

import com.ivamare.workflow.model.WorkflowState;
import com.ivamare.workflow.ops.WorkflowInsights;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * JDBC implementation of WorkflowInsights. Aggregation is done by PostgreSQL.
 */
public class JdbcWorkflowInsights implements WorkflowInsights {

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public JdbcWorkflowInsights(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    @Override
    public Map<WorkflowState, Long> countsByState() {
        Map<WorkflowState, Long> counts = new EnumMap<>(WorkflowState.class);
        for (WorkflowState state : WorkflowState.values()) {
            counts.put(state, 0L);
        }
        jdbcTemplate.query(
            "SELECT state, COUNT(*) AS total FROM workflow.workflow_item GROUP BY state",
            (RowCallbackHandler) rs ->
                counts.put(WorkflowState.fromValue(rs.getString("state")), rs.getLong("total")));
        return counts;
    }

    @Override
    public List<HourlyPerformance> performanceByHour(Instant since) {
        String sql = """
            SELECT DATE_TRUNC('hour', completed_at) AS hour,
                   state,
                   COUNT(*) AS total,
                   AVG(EXTRACT(EPOCH FROM (completed_at - queued_at))) AS avg_seconds,
                   MIN(EXTRACT(EPOCH FROM (completed_at - queued_at))) AS min_seconds,
                   MAX(EXTRACT(EPOCH FROM (completed_at - queued_at))) AS max_seconds,
                   PERCENTILE_CONT(0.5) WITHIN GROUP (
                       ORDER BY EXTRACT(EPOCH FROM (completed_at - queued_at))) AS median_seconds,
                   PERCENTILE_CONT(0.95) WITHIN GROUP (
                       ORDER BY EXTRACT(EPOCH FROM (completed_at - queued_at))) AS p95_seconds
            FROM workflow.workflow_item
            WHERE completed_at IS NOT NULL
              AND queued_at IS NOT NULL
              AND completed_at >= ?
            GROUP BY DATE_TRUNC('hour', completed_at), state
            ORDER BY hour DESC, state
            """;

        return jdbcTemplate.query(sql, (rs, rowNum) -> new HourlyPerformance(
            rs.getTimestamp("hour").toInstant(),
            WorkflowState.fromValue(rs.getString("state")),
            rs.getLong("total"),
            rs.getDouble("avg_seconds"),
            rs.getDouble("min_seconds"),
            rs.getDouble("max_seconds"),
            rs.getDouble("median_seconds"),
            rs.getDouble("p95_seconds")
        ), Timestamp.from(since));
    }

    @Override
    public List<TransitionCount> transitionCounts(Instant since) {
        String sql = """
            SELECT from_state, to_state, COUNT(*) AS total
            FROM workflow.workflow_transition
            WHERE created_at >= ?
            GROUP BY from_state, to_state
            ORDER BY total DESC, from_state, to_state
            """;

        return jdbcTemplate.query(sql, (rs, rowNum) -> new TransitionCount(
            WorkflowState.fromValue(rs.getString("from_state")),
            WorkflowState.fromValue(rs.getString("to_state")),
            rs.getLong("total")
        ), Timestamp.from(since));
    }

    @Override
    public List<BacklogItem> quotaExceededBacklog(int limit) {
        String sql = """
            SELECT workflow_id, state, stage, priority, quota_exceeded_count, next_retry_at, queued_at
            FROM workflow.workflow_item
            WHERE state IN ('quota_exceeded', 'partially_processed')
            ORDER BY priority DESC, queued_at ASC NULLS LAST
            LIMIT ?
            """;

        return jdbcTemplate.query(sql, (rs, rowNum) -> {
            Timestamp nextRetryAt = rs.getTimestamp("next_retry_at");
            Timestamp queuedAt = rs.getTimestamp("queued_at");
            return new BacklogItem(
                rs.getObject("workflow_id", UUID.class),
                WorkflowState.fromValue(rs.getString("state")),
                rs.getString("stage"),
                rs.getInt("priority"),
                rs.getInt("quota_exceeded_count"),
                nextRetryAt != null ? nextRetryAt.toInstant() : null,
                queuedAt != null ? queuedAt.toInstant() : null
            );
        }, limit);
    }

    @Override
    public long staleLeaseCount(long timeoutSeconds) {
        Long count = jdbcTemplate.queryForObject("""
            SELECT COUNT(*) FROM workflow.workflow_item
            WHERE state = 'processing' AND lease_holder IS NOT NULL AND lease_acquired_at < ?
            """, Long.class, Timestamp.from(clock.instant().minusSeconds(timeoutSeconds)));
        return count != null ? count : 0L;
    }

    @Override
    public List<QuotaUsageSummary> quotaUsageByHour(String serviceName, Instant from, Instant to) {
        String sql = """
            SELECT DATE_TRUNC('hour', l.created_at) AS hour,
                   COUNT(*) AS requests,
                   COALESCE(SUM((l.usage_data->'cost_tracking'->>'total_tokens')::BIGINT), 0) AS total_tokens,
                   COALESCE(SUM((l.usage_data->'cost_tracking'->>'total_cost_usd')::NUMERIC), 0) AS total_cost,
                   COALESCE(AVG((l.usage_data->'cost_tracking'->>'total_tokens')::NUMERIC), 0) AS avg_tokens,
                   COUNT(*) FILTER (WHERE i.state = 'quota_exceeded') AS quota_exceeded_count
            FROM workflow.quota_usage_log l
            LEFT JOIN workflow.workflow_item i ON i.workflow_id = l.workflow_id
            WHERE l.service_name = ?
              AND l.created_at >= ?
              AND l.created_at < ?
            GROUP BY DATE_TRUNC('hour', l.created_at)
            ORDER BY hour DESC
            """;

        return jdbcTemplate.query(sql, (rs, rowNum) -> {
            BigDecimal totalCost = rs.getBigDecimal("total_cost");
            return new QuotaUsageSummary(
                rs.getTimestamp("hour").toInstant(),
                rs.getLong("requests"),
                rs.getLong("total_tokens"),
                totalCost != null ? totalCost : BigDecimal.ZERO,
                rs.getDouble("avg_tokens"),
                rs.getLong("quota_exceeded_count")
            );
        }, serviceName, Timestamp.from(from), Timestamp.from(to));
    }
}
