package com.ivamare.workflow.repository.impl;

import com.ivamare.workflow.model.DeadLetterEntry;
import com.ivamare.workflow.repository.DeadLetterRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static com.ivamare.workflow.repository.impl.JsonColumns.instant;
import static com.ivamare.workflow.repository.impl.JsonColumns.timestamp;

/**
 * JDBC implementation of DeadLetterRepository.
 */
public class JdbcDeadLetterRepository implements DeadLetterRepository {

    private static final String COLUMNS = """
        deadletter_id, workflow_id, original_data, error_message, error_details,
        failure_count, last_failure_at, created_at, resolved_at, resolution_notes
        """;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<DeadLetterEntry> rowMapper;

    public JdbcDeadLetterRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = (rs, rowNum) -> new DeadLetterEntry(
            rs.getObject("deadletter_id", UUID.class),
            rs.getObject("workflow_id", UUID.class),
            JsonColumns.readMap(objectMapper, rs.getString("original_data")),
            rs.getString("error_message"),
            JsonColumns.readMap(objectMapper, rs.getString("error_details")),
            rs.getInt("failure_count"),
            instant(rs.getTimestamp("last_failure_at")),
            instant(rs.getTimestamp("created_at")),
            instant(rs.getTimestamp("resolved_at")),
            rs.getString("resolution_notes")
        );
    }

    @Override
    public DeadLetterEntry upsert(UUID workflowId, Map<String, Object> originalData, String errorMessage,
                                  Map<String, Object> errorDetails, Instant now) {
        String sql = """
            INSERT INTO workflow.workflow_deadletter (
                deadletter_id, workflow_id, original_data, error_message, error_details,
                failure_count, last_failure_at, created_at
            ) VALUES (?, ?, ?::jsonb, ?, ?::jsonb, 1, ?, ?)
            ON CONFLICT (workflow_id) DO UPDATE SET
                original_data = EXCLUDED.original_data,
                error_message = EXCLUDED.error_message,
                error_details = EXCLUDED.error_details || CASE
                    WHEN workflow_deadletter.resolved_at IS NOT NULL THEN jsonb_build_object(
                        'previous_resolution', jsonb_build_object(
                            'resolved_at', workflow_deadletter.resolved_at,
                            'notes', workflow_deadletter.resolution_notes))
                    WHEN workflow_deadletter.error_details -> 'previous_resolution' IS NOT NULL THEN jsonb_build_object(
                        'previous_resolution', workflow_deadletter.error_details -> 'previous_resolution')
                    ELSE '{}'::jsonb
                END,
                failure_count = workflow_deadletter.failure_count + 1,
                last_failure_at = EXCLUDED.last_failure_at,
                resolved_at = NULL
            RETURNING
            """ + COLUMNS;

        List<DeadLetterEntry> results = jdbcTemplate.query(sql, rowMapper,
            UUID.randomUUID(),
            workflowId,
            JsonColumns.write(objectMapper, originalData),
            errorMessage,
            JsonColumns.write(objectMapper, errorDetails),
            timestamp(now),
            timestamp(now)
        );
        if (results.isEmpty()) {
            throw new IllegalStateException("Dead-letter upsert returned no row for workflow " + workflowId);
        }
        return results.get(0);
    }

    @Override
    public Optional<DeadLetterEntry> findById(UUID deadletterId) {
        List<DeadLetterEntry> results = jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM workflow.workflow_deadletter WHERE deadletter_id = ?",
            rowMapper, deadletterId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public Optional<DeadLetterEntry> findByWorkflowId(UUID workflowId) {
        List<DeadLetterEntry> results = jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM workflow.workflow_deadletter WHERE workflow_id = ?",
            rowMapper, workflowId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<DeadLetterEntry> findUnresolved(int limit, int offset) {
        String sql = "SELECT " + COLUMNS + """
             FROM workflow.workflow_deadletter
            WHERE resolved_at IS NULL
            ORDER BY last_failure_at DESC
            LIMIT ? OFFSET ?
            """;

        return jdbcTemplate.query(sql, rowMapper, limit, offset);
    }

    @Override
    public long countUnresolved() {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM workflow.workflow_deadletter WHERE resolved_at IS NULL",
            Long.class);
        return count != null ? count : 0L;
    }

    @Override
    public boolean markResolved(UUID deadletterId, String notes, Instant now) {
        String sql = """
            UPDATE workflow.workflow_deadletter
            SET resolved_at = ?, resolution_notes = ?
            WHERE deadletter_id = ? AND resolved_at IS NULL
            """;

        return jdbcTemplate.update(sql, timestamp(now), notes, deadletterId) == 1;
    }
}
