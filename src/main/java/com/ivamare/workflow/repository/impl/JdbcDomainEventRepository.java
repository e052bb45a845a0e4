package com.ivamare.workflow.repository.impl;

import com.ivamare.workflow.model.DomainEvent;
import com.ivamare.workflow.model.DomainEventType;
import com.ivamare.workflow.model.EventData;
import com.ivamare.workflow.repository.DomainEventRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static com.ivamare.workflow.repository.impl.JsonColumns.instant;
import static com.ivamare.workflow.repository.impl.JsonColumns.timestamp;

/**
 * JDBC implementation of DomainEventRepository.
 */
public class JdbcDomainEventRepository implements DomainEventRepository {

    private static final String SELECT_COLUMNS = """
        SELECT event_id, workflow_id, event_type, event_data, processed, created_at
        FROM workflow.workflow_event
        """;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<DomainEvent> rowMapper;

    public JdbcDomainEventRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.rowMapper = (rs, rowNum) -> {
            DomainEventType type = DomainEventType.fromValue(rs.getString("event_type"));
            return new DomainEvent(
                rs.getObject("event_id", UUID.class),
                rs.getObject("workflow_id", UUID.class),
                type,
                EventData.fromMap(type, JsonColumns.readMap(objectMapper, rs.getString("event_data"))),
                rs.getBoolean("processed"),
                instant(rs.getTimestamp("created_at"))
            );
        };
    }

    @Override
    public void save(DomainEvent event) {
        String sql = """
            INSERT INTO workflow.workflow_event (event_id, workflow_id, event_type, event_data, processed, created_at)
            VALUES (?, ?, ?, ?::jsonb, ?, ?)
            """;

        jdbcTemplate.update(sql,
            event.eventId(),
            event.workflowId(),
            event.eventType().getValue(),
            JsonColumns.write(objectMapper, event.eventData().toMap()),
            event.processed(),
            timestamp(event.createdAt())
        );
    }

    @Override
    public List<DomainEvent> findUnprocessed(int limit) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE processed = FALSE ORDER BY created_at ASC, seq ASC LIMIT ?",
            rowMapper, limit);
    }

    @Override
    public int markProcessed(List<UUID> eventIds) {
        if (eventIds == null || eventIds.isEmpty()) {
            return 0;
        }
        String sql = """
            UPDATE workflow.workflow_event
            SET processed = TRUE
            WHERE event_id = ? AND processed = FALSE
            """;

        List<Object[]> batchArgs = new ArrayList<>(eventIds.size());
        for (UUID eventId : eventIds) {
            batchArgs.add(new Object[]{eventId});
        }
        int[] counts = jdbcTemplate.batchUpdate(sql, batchArgs);
        int updated = 0;
        for (int count : counts) {
            updated += Math.max(count, 0);
        }
        return updated;
    }

    @Override
    public List<DomainEvent> findByWorkflowId(UUID workflowId) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE workflow_id = ? ORDER BY seq ASC",
            rowMapper, workflowId);
    }
}
