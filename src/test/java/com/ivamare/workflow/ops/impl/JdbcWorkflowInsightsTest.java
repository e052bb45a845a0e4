package com.ivamare.workflow.ops.impl;

import com.ivamare.workflow.model.WorkflowState;
import com.ivamare.workflow.ops.WorkflowInsights.BacklogItem;
import com.ivamare.workflow.ops.WorkflowInsights.TransitionCount;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JdbcWorkflowInsightsTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");

    @Mock
    private JdbcTemplate jdbcTemplate;

    @Mock
    private ResultSet resultSet;

    private JdbcWorkflowInsights insights;

    @BeforeEach
    void setUp() {
        insights = new JdbcWorkflowInsights(jdbcTemplate, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldReportZeroForStatesWithoutItems() throws Exception {
        when(resultSet.getString("state")).thenReturn("queued");
        when(resultSet.getLong("total")).thenReturn(12L);
        doAnswer(invocation -> {
            ((RowCallbackHandler) invocation.getArgument(1)).processRow(resultSet);
            return null;
        }).when(jdbcTemplate).query(contains("GROUP BY state"), any(RowCallbackHandler.class));

        Map<WorkflowState, Long> counts = insights.countsByState();

        assertEquals(WorkflowState.values().length, counts.size());
        assertEquals(12L, counts.get(WorkflowState.QUEUED));
        assertEquals(0L, counts.get(WorkflowState.QUOTA_EXCEEDED));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldMapTransitionCounts() throws Exception {
        when(resultSet.getString("from_state")).thenReturn("processing");
        when(resultSet.getString("to_state")).thenReturn("quota_exceeded");
        when(resultSet.getLong("total")).thenReturn(4L);
        Instant since = NOW.minusSeconds(3600);
        when(jdbcTemplate.query(contains("workflow.workflow_transition"), any(RowMapper.class),
            eq(Timestamp.from(since))))
            .thenAnswer(invocation -> List.of(((RowMapper<TransitionCount>) invocation.getArgument(1))
                .mapRow(resultSet, 0)));

        List<TransitionCount> result = insights.transitionCounts(since);

        assertEquals(List.of(new TransitionCount(WorkflowState.PROCESSING, WorkflowState.QUOTA_EXCEEDED, 4L)),
            result);
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldOrderBacklogByPriorityThenAge() throws Exception {
        UUID id = UUID.randomUUID();
        when(resultSet.getObject("workflow_id", UUID.class)).thenReturn(id);
        when(resultSet.getString("state")).thenReturn("quota_exceeded");
        when(resultSet.getString("stage")).thenReturn("enrichment");
        when(resultSet.getInt("priority")).thenReturn(9);
        when(resultSet.getInt("quota_exceeded_count")).thenReturn(2);
        when(resultSet.getTimestamp("next_retry_at")).thenReturn(Timestamp.from(NOW.plusSeconds(30)));
        when(resultSet.getTimestamp("queued_at")).thenReturn(null);
        when(jdbcTemplate.query(contains("ORDER BY priority DESC, queued_at ASC"), any(RowMapper.class), eq(10)))
            .thenAnswer(invocation -> List.of(((RowMapper<BacklogItem>) invocation.getArgument(1))
                .mapRow(resultSet, 0)));

        List<BacklogItem> backlog = insights.quotaExceededBacklog(10);

        assertEquals(1, backlog.size());
        assertEquals(id, backlog.get(0).workflowId());
        assertEquals(2, backlog.get(0).quotaExceededCount());
        assertEquals(NOW.plusSeconds(30), backlog.get(0).nextRetryAt());
        assertNull(backlog.get(0).queuedAt());
    }

    @Test
    void shouldCountLeasesOlderThanTimeout() {
        when(jdbcTemplate.queryForObject(contains("lease_acquired_at < ?"), eq(Long.class),
            eq(Timestamp.from(NOW.minusSeconds(300))))).thenReturn(3L);

        assertEquals(3L, insights.staleLeaseCount(300));
    }

    @Test
    void shouldTreatMissingCountAsZero() {
        when(jdbcTemplate.queryForObject(anyString(), eq(Long.class), any(Object[].class))).thenReturn(null);

        assertEquals(0L, insights.staleLeaseCount(300));
    }
}
