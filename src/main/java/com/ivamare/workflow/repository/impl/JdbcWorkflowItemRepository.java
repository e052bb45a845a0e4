package com.ivamare.workflow.repository.impl;

import com.ivamare.workflow.model.TransitionRequest;
import com.ivamare.workflow.model.WorkflowItem;
import com.ivamare.workflow.model.WorkflowState;
import com.ivamare.workflow.repository.WorkflowItemRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.ivamare.workflow.repository.impl.JsonColumns.instant;
import static com.ivamare.workflow.repository.impl.JsonColumns.timestamp;

/**
 * JDBC implementation of WorkflowItemRepository.
 */
public class JdbcWorkflowItemRepository implements WorkflowItemRepository {

    private static final String SELECT_COLUMNS = """
        SELECT workflow_id, state, version, stage, priority, retry_count, max_retries,
               next_retry_at, payload, stage_details, partial_results, quota_exceeded_count,
               last_quota_check, lease_holder, lease_acquired_at, last_error, created_at,
               updated_at, queued_at, processing_started_at, completed_at
        FROM workflow.workflow_item
        """;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<WorkflowItem> rowMapper;

    public JdbcWorkflowItemRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = (rs, rowNum) -> new WorkflowItem(
            rs.getObject("workflow_id", UUID.class),
            WorkflowState.fromValue(rs.getString("state")),
            rs.getInt("version"),
            rs.getString("stage"),
            rs.getInt("priority"),
            rs.getInt("retry_count"),
            rs.getInt("max_retries"),
            instant(rs.getTimestamp("next_retry_at")),
            JsonColumns.readMap(objectMapper, rs.getString("payload")),
            JsonColumns.readMap(objectMapper, rs.getString("stage_details")),
            JsonColumns.readMap(objectMapper, rs.getString("partial_results")),
            rs.getInt("quota_exceeded_count"),
            instant(rs.getTimestamp("last_quota_check")),
            rs.getString("lease_holder"),
            instant(rs.getTimestamp("lease_acquired_at")),
            rs.getString("last_error"),
            instant(rs.getTimestamp("created_at")),
            instant(rs.getTimestamp("updated_at")),
            instant(rs.getTimestamp("queued_at")),
            instant(rs.getTimestamp("processing_started_at")),
            instant(rs.getTimestamp("completed_at"))
        );
    }

    @Override
    public void save(WorkflowItem item) {
        String sql = """
            INSERT INTO workflow.workflow_item (
                workflow_id, state, version, stage, priority, retry_count, max_retries,
                next_retry_at, payload, stage_details, partial_results, created_at, updated_at, queued_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?::jsonb, ?::jsonb, ?, ?, ?)
            """;

        jdbcTemplate.update(sql,
            item.workflowId(),
            item.state().getValue(),
            item.version(),
            item.stage(),
            item.priority(),
            item.retryCount(),
            item.maxRetries(),
            timestamp(item.nextRetryAt()),
            JsonColumns.write(objectMapper, item.payload()),
            JsonColumns.write(objectMapper, item.stageDetails()),
            JsonColumns.write(objectMapper, item.partialResults()),
            timestamp(item.createdAt()),
            timestamp(item.updatedAt()),
            timestamp(item.queuedAt())
        );
    }

    @Override
    public Optional<WorkflowItem> findById(UUID workflowId) {
        List<WorkflowItem> results = jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE workflow_id = ?", rowMapper, workflowId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Optional<WorkflowItem> lockById(UUID workflowId) {
        List<WorkflowItem> results = jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE workflow_id = ? FOR UPDATE", rowMapper, workflowId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public int applyTransition(TransitionRequest request, Instant now) {
        StringBuilder sql = new StringBuilder("""
            UPDATE workflow.workflow_item
            SET state = ?, version = version + 1, updated_at = ?,
                stage_details = stage_details || ?::jsonb""");
        List<Object> params = new ArrayList<>();
        params.add(request.toState().getValue());
        params.add(timestamp(now));
        params.add(JsonColumns.write(objectMapper, request.metadata()));

        if (request.stage() != null) {
            sql.append(", stage = ?");
            params.add(request.stage());
        }

        WorkflowState to = request.toState();
        if (to == WorkflowState.QUEUED) {
            sql.append(", queued_at = COALESCE(queued_at, ?)");
            params.add(timestamp(now));
        }
        if (to == WorkflowState.PROCESSING) {
            sql.append(", processing_started_at = ?");
            params.add(timestamp(now));
        }
        if (to.isTerminal()) {
            sql.append(", completed_at = ?");
            params.add(timestamp(now));
        }
        if (to == WorkflowState.QUOTA_EXCEEDED && request.fromState() != WorkflowState.QUOTA_EXCEEDED) {
            sql.append(", quota_exceeded_count = quota_exceeded_count + 1, last_quota_check = ?");
            params.add(timestamp(now));
        }

        if (request.resetRetries()) {
            sql.append(", retry_count = 0");
        } else if (request.incrementRetry()) {
            sql.append(", retry_count = retry_count + 1");
        }
        if (request.nextRetryAt() != null) {
            sql.append(", next_retry_at = ?");
            params.add(timestamp(request.nextRetryAt()));
        } else if (request.clearNextRetryAt()) {
            sql.append(", next_retry_at = NULL");
        }
        if (request.lastError() != null) {
            sql.append(", last_error = ?");
            params.add(request.lastError());
        }
        if (!request.partialResults().isEmpty()) {
            sql.append(", partial_results = partial_results || ?::jsonb");
            params.add(JsonColumns.write(objectMapper, request.partialResults()));
        }
        if (request.releaseLease()) {
            sql.append(", lease_holder = NULL, lease_acquired_at = NULL");
        }

        sql.append(" WHERE workflow_id = ? AND state = ?");
        params.add(request.workflowId());
        params.add(request.fromState().getValue());

        return jdbcTemplate.update(sql.toString(), params.toArray());
    }

    @Override
    public Optional<UUID> lockNextClaimable(Instant now, long leaseTimeoutSeconds) {
        String sql = """
            SELECT workflow_id
            FROM workflow.workflow_item
            WHERE state = 'queued'
              AND (next_retry_at IS NULL OR next_retry_at <= ?)
              AND (lease_holder IS NULL OR lease_acquired_at < ?)
            ORDER BY priority DESC, queued_at ASC NULLS LAST
            LIMIT 1
            FOR UPDATE SKIP LOCKED
            """;

        List<UUID> ids = jdbcTemplate.queryForList(sql, UUID.class,
            timestamp(now), timestamp(now.minusSeconds(leaseTimeoutSeconds)));
        return ids.isEmpty() ? Optional.empty() : Optional.of(ids.get(0));
    }

    @Override
    public boolean acquireLease(UUID workflowId, String workerId, Instant now, long timeoutSeconds) {
        String sql = """
            UPDATE workflow.workflow_item
            SET lease_holder = ?, lease_acquired_at = ?
            WHERE workflow_id = ?
              AND (lease_holder IS NULL OR lease_holder = ? OR lease_acquired_at < ?)
            """;

        int rows = jdbcTemplate.update(sql,
            workerId,
            timestamp(now),
            workflowId,
            workerId,
            timestamp(now.minusSeconds(timeoutSeconds))
        );
        return rows == 1;
    }

    @Override
    public boolean releaseLease(UUID workflowId, String workerId) {
        String sql = """
            UPDATE workflow.workflow_item
            SET lease_holder = NULL, lease_acquired_at = NULL
            WHERE workflow_id = ? AND lease_holder = ?
            """;

        return jdbcTemplate.update(sql, workflowId, workerId) == 1;
    }

    @Override
    public List<WorkflowItem> find(WorkflowState state, String stage, int limit, int offset) {
        StringBuilder sql = new StringBuilder(SELECT_COLUMNS).append("WHERE 1=1");
        List<Object> params = new ArrayList<>();
        appendFilters(sql, params, state, stage);
        sql.append(" ORDER BY created_at DESC LIMIT ? OFFSET ?");
        params.add(limit);
        params.add(offset);

        return jdbcTemplate.query(sql.toString(), rowMapper, params.toArray());
    }

    @Override
    public long count(WorkflowState state, String stage) {
        StringBuilder sql = new StringBuilder("SELECT COUNT(*) FROM workflow.workflow_item WHERE 1=1");
        List<Object> params = new ArrayList<>();
        appendFilters(sql, params, state, stage);

        Long count = jdbcTemplate.queryForObject(sql.toString(), Long.class, params.toArray());
        return count != null ? count : 0L;
    }

    @Override
    public List<ParkedItem> findDueForRequeue(Instant now, int limit) {
        String sql = """
            SELECT workflow_id, state
            FROM workflow.workflow_item
            WHERE state IN ('quota_exceeded', 'partially_processed')
              AND (next_retry_at IS NULL OR next_retry_at <= ?)
            ORDER BY priority DESC, queued_at ASC NULLS LAST
            LIMIT ?
            """;

        return jdbcTemplate.query(sql,
            (rs, rowNum) -> new ParkedItem(
                rs.getObject("workflow_id", UUID.class),
                WorkflowState.fromValue(rs.getString("state"))),
            timestamp(now), limit);
    }

    @Override
    public List<WorkflowItem> findExpiredLeases(Instant now, long timeoutSeconds, int limit) {
        String sql = SELECT_COLUMNS + """
            WHERE state = 'processing'
              AND lease_holder IS NOT NULL
              AND lease_acquired_at < ?
            ORDER BY lease_acquired_at ASC
            LIMIT ?
            """;

        return jdbcTemplate.query(sql, rowMapper,
            timestamp(now.minusSeconds(timeoutSeconds)), limit);
    }

    private void appendFilters(StringBuilder sql, List<Object> params, WorkflowState state, String stage) {
        if (state != null) {
            sql.append(" AND state = ?");
            params.add(state.getValue());
        }
        if (stage != null) {
            sql.append(" AND stage = ?");
            params.add(stage);
        }
    }
}
