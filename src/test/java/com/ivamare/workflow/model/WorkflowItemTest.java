package com.ivamare.workflow.model;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowItemTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");

    private WorkflowItem leased(String holder, Instant acquiredAt) {
        WorkflowItem created = WorkflowItem.create(Map.of(), 0, 3, NOW);
        return new WorkflowItem(created.workflowId(), WorkflowState.PROCESSING, 3, null, 0, 0, 3, null,
            null, null, null, 0, null, holder, acquiredAt, null, NOW, NOW, NOW, NOW, null);
    }

    @Test
    void shouldCreateItemInCreatedState() {
        WorkflowItem item = WorkflowItem.create(Map.of("doc", "a"), 5, 3, NOW);

        assertEquals(WorkflowState.CREATED, item.state());
        assertEquals(1, item.version());
        assertEquals(0, item.retryCount());
        assertNull(item.queuedAt());
        assertNull(item.leaseHolder());
        assertEquals(NOW, item.createdAt());
        assertEquals(NOW, item.updatedAt());
    }

    @Test
    void shouldDefaultNullMapsToEmpty() {
        WorkflowItem item = leased(null, null);

        assertTrue(item.payload().isEmpty());
        assertTrue(item.stageDetails().isEmpty());
        assertTrue(item.partialResults().isEmpty());
    }

    @Nested
    class LeaseLivenessTests {

        @Test
        void shouldBeLiveAtExactTimeout() {
            assertTrue(leased("w1", NOW.minusSeconds(300)).hasLiveLease(NOW, 300));
        }

        @Test
        void shouldExpireOneSecondAfterTimeout() {
            assertFalse(leased("w1", NOW.minusSeconds(301)).hasLiveLease(NOW, 300));
        }

        @Test
        void shouldNotBeLiveWithoutHolder() {
            assertFalse(leased(null, NOW).hasLiveLease(NOW, 300));
        }
    }

    @Test
    void shouldAllowRetryWhileBelowBudget() {
        WorkflowItem item = WorkflowItem.create(Map.of(), 0, 0, NOW);

        assertFalse(item.canRetry());
        assertTrue(WorkflowItem.create(Map.of(), 0, 1, NOW).canRetry());
    }
}
