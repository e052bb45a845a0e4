package com.ivamare.workflow.worker;

import com.ivamare.workflow.api.WorkflowQueue;
import com.ivamare.workflow.exception.QuotaExceededException;
import com.ivamare.workflow.lease.LeaseManager;
import com.ivamare.workflow.model.QuotaUsage;
import com.ivamare.workflow.quota.QuotaThrottle;
import com.ivamare.workflow.quota.QuotaTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WorkContextTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");

    @Mock
    private WorkflowQueue queue;

    @Mock
    private LeaseManager leaseManager;

    @Mock
    private QuotaTracker quotaTracker;

    @Mock
    private QuotaThrottle quotaThrottle;

    private UUID workflowId;
    private WorkContext context;

    @BeforeEach
    void setUp() {
        workflowId = UUID.randomUUID();
        context = new WorkContext(workflowId, "w1", 300, queue, leaseManager, quotaTracker, quotaThrottle,
            Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldRenewLeaseWithConfiguredTimeout() {
        when(leaseManager.acquireLease(workflowId, "w1", 300)).thenReturn(true);

        assertTrue(context.renewLease());
    }

    @Test
    void shouldPassQuotaCheckAndTakeTicket() {
        when(quotaThrottle.tryAcquire("gemini", Duration.ofSeconds(2))).thenReturn(true);

        assertDoesNotThrow(() -> context.acquireQuota("gemini", Duration.ofSeconds(2)));
        verify(quotaTracker).checkQuota("gemini");
    }

    @Test
    void shouldNotTakeTicketWhenQuotaExhausted() {
        doThrow(new QuotaExceededException("gemini", List.of("tokens_per_day"), NOW))
            .when(quotaTracker).checkQuota("gemini");

        assertThrows(QuotaExceededException.class, () -> context.acquireQuota("gemini", Duration.ZERO));
        verifyNoInteractions(quotaThrottle);
    }

    @Test
    void shouldParkUntilNextMinuteWhenNoTicket() {
        when(quotaThrottle.tryAcquire("gemini", Duration.ZERO)).thenReturn(false);

        QuotaExceededException ex = assertThrows(QuotaExceededException.class,
            () -> context.acquireQuota("gemini", Duration.ZERO));

        assertEquals(List.of("requests_per_minute"), ex.getQuotaTypes());
        assertEquals(Instant.parse("2024-05-01T10:16:00Z"), ex.getResetAt());
    }

    @Test
    void shouldSkipThrottleWhenNotConfigured() {
        WorkContext unthrottled = new WorkContext(workflowId, "w1", 300, queue, leaseManager, quotaTracker, null,
            Clock.fixed(NOW, ZoneOffset.UTC));

        assertDoesNotThrow(() -> unthrottled.acquireQuota("gemini", Duration.ZERO));
    }

    @Test
    void shouldRecordUsageAgainstItem() {
        QuotaUsage usage = new QuotaUsage(null, null);

        context.recordUsage("gemini", usage);

        verify(quotaTracker).recordUsage("gemini", usage, workflowId);
    }

    @Test
    void shouldReportStageCompletion() {
        context.stageCompleted("ocr", 25.0);

        verify(queue).reportStageCompleted(workflowId, "ocr", 25.0);
    }
}
