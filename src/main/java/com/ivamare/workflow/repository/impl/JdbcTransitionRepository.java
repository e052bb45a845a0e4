package com.ivamare.workflow.repository.impl;

import com.ivamare.workflow.model.TransitionRecord;
import com.ivamare.workflow.model.WorkflowState;
import com.ivamare.workflow.repository.TransitionRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.UUID;

import static com.ivamare.workflow.repository.impl.JsonColumns.instant;
import static com.ivamare.workflow.repository.impl.JsonColumns.timestamp;

/**
 * JDBC implementation of TransitionRepository.
 */
public class JdbcTransitionRepository implements TransitionRepository {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcTransitionRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void save(TransitionRecord record) {
        String sql = """
            INSERT INTO workflow.workflow_transition
                (transition_id, workflow_id, from_state, to_state, stage, reason, metadata, actor, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?)
            """;

        jdbcTemplate.update(sql,
            record.transitionId(),
            record.workflowId(),
            record.fromState().getValue(),
            record.toState().getValue(),
            record.stage(),
            record.reason(),
            JsonColumns.write(objectMapper, record.metadata()),
            record.actor(),
            timestamp(record.createdAt())
        );
    }

    @Override
    public List<TransitionRecord> findByWorkflowId(UUID workflowId) {
        String sql = """
            SELECT transition_id, workflow_id, from_state, to_state, stage, reason, metadata, actor, created_at
            FROM workflow.workflow_transition
            WHERE workflow_id = ?
            ORDER BY seq ASC
            """;

        return jdbcTemplate.query(sql, (rs, rowNum) -> new TransitionRecord(
            rs.getObject("transition_id", UUID.class),
            rs.getObject("workflow_id", UUID.class),
            WorkflowState.fromValue(rs.getString("from_state")),
            WorkflowState.fromValue(rs.getString("to_state")),
            rs.getString("stage"),
            rs.getString("reason"),
            JsonColumns.readMap(objectMapper, rs.getString("metadata")),
            rs.getString("actor"),
            instant(rs.getTimestamp("created_at"))
        ), workflowId);
    }
}
