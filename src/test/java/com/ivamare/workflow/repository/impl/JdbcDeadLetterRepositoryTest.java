package com.ivamare.workflow.repository.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.workflow.model.DeadLetterEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JdbcDeadLetterRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");

    @Mock
    private JdbcTemplate jdbcTemplate;

    @Mock
    private ResultSet resultSet;

    private JdbcDeadLetterRepository repository;
    private UUID workflowId;
    private UUID deadletterId;

    @BeforeEach
    void setUp() {
        repository = new JdbcDeadLetterRepository(jdbcTemplate, new ObjectMapper());
        workflowId = UUID.randomUUID();
        deadletterId = UUID.randomUUID();
    }

    private void stubRow(int failureCount) throws Exception {
        when(resultSet.getObject("deadletter_id", UUID.class)).thenReturn(deadletterId);
        when(resultSet.getObject("workflow_id", UUID.class)).thenReturn(workflowId);
        when(resultSet.getString("original_data")).thenReturn("{\"doc\":\"a\"}");
        when(resultSet.getString("error_message")).thenReturn("boom");
        when(resultSet.getString("error_details")).thenReturn(null);
        when(resultSet.getInt("failure_count")).thenReturn(failureCount);
        when(resultSet.getTimestamp("last_failure_at")).thenReturn(Timestamp.from(NOW));
        when(resultSet.getTimestamp("created_at")).thenReturn(Timestamp.from(NOW.minusSeconds(60)));
        when(resultSet.getTimestamp("resolved_at")).thenReturn(null);
        when(resultSet.getString("resolution_notes")).thenReturn(null);
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldUpsertAndIncrementFailureCountOnConflict() throws Exception {
        stubRow(2);
        Object[][] captured = new Object[1][];
        String[] capturedSql = new String[1];
        when(jdbcTemplate.query(anyString(), any(RowMapper.class), any(Object[].class))).thenAnswer(invocation -> {
            Object[] args = invocation.getArguments();
            capturedSql[0] = (String) args[0];
            captured[0] = args.length == 3 && args[2] instanceof Object[] varargs
                ? varargs
                : Arrays.copyOfRange(args, 2, args.length);
            return List.of(((RowMapper<DeadLetterEntry>) args[1]).mapRow(resultSet, 0));
        });

        DeadLetterEntry entry = repository.upsert(workflowId, Map.of("doc", "a"), "boom", Map.of(), NOW);

        assertTrue(capturedSql[0].contains("ON CONFLICT (workflow_id) DO UPDATE"));
        assertTrue(capturedSql[0].contains("failure_count = workflow_deadletter.failure_count + 1"));
        assertTrue(capturedSql[0].contains("resolved_at = NULL"));
        assertTrue(capturedSql[0].contains("original_data = EXCLUDED.original_data"));
        assertTrue(capturedSql[0].contains("'previous_resolution'"));
        assertFalse(capturedSql[0].contains("resolution_notes = NULL"));
        assertTrue(capturedSql[0].contains("RETURNING"));
        assertEquals(workflowId, captured[0][1]);
        assertEquals("{\"doc\":\"a\"}", captured[0][2]);
        assertEquals(Timestamp.from(NOW), captured[0][5]);
        assertEquals(2, entry.failureCount());
        assertEquals(Map.of("doc", "a"), entry.originalData());
        assertTrue(entry.errorDetails().isEmpty());
        assertFalse(entry.isResolved());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldFailWhenUpsertReturnsNoRow() {
        when(jdbcTemplate.query(anyString(), any(RowMapper.class), any(Object[].class))).thenReturn(List.of());

        assertThrows(IllegalStateException.class,
            () -> repository.upsert(workflowId, Map.of(), "boom", Map.of(), NOW));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldReturnEmptyForUnknownId() {
        when(jdbcTemplate.query(contains("WHERE deadletter_id = ?"), any(RowMapper.class), eq(deadletterId)))
            .thenReturn(List.of());

        assertEquals(Optional.empty(), repository.findById(deadletterId));
    }

    @Test
    void shouldResolveOnlyOpenEntries() {
        when(jdbcTemplate.update(contains("AND resolved_at IS NULL"), eq(Timestamp.from(NOW)), eq("fixed"),
            eq(deadletterId))).thenReturn(1);

        assertTrue(repository.markResolved(deadletterId, "fixed", NOW));
    }

    @Test
    void shouldReportConcurrentResolution() {
        when(jdbcTemplate.update(anyString(), any(Object[].class))).thenReturn(0);

        assertFalse(repository.markResolved(deadletterId, "fixed", NOW));
    }

    @Test
    void shouldCountUnresolved() {
        when(jdbcTemplate.queryForObject(contains("resolved_at IS NULL"), eq(Long.class))).thenReturn(4L);

        assertEquals(4L, repository.countUnresolved());
    }
}
