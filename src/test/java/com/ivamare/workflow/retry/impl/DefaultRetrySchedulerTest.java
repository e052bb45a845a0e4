package com.ivamare.workflow.retry.impl;

import com.ivamare.workflow.deadletter.DeadLetterStore;
import com.ivamare.workflow.engine.StateTransitionEngine;
import com.ivamare.workflow.events.EventEmitter;
import com.ivamare.workflow.exception.WorkflowNotFoundException;
import com.ivamare.workflow.lease.LeaseManager;
import com.ivamare.workflow.model.EventData;
import com.ivamare.workflow.model.TransitionRequest;
import com.ivamare.workflow.model.WorkFailure;
import com.ivamare.workflow.model.WorkflowItem;
import com.ivamare.workflow.model.WorkflowState;
import com.ivamare.workflow.quota.QuotaTracker;
import com.ivamare.workflow.repository.WorkflowItemRepository;
import com.ivamare.workflow.repository.WorkflowItemRepository.ParkedItem;
import com.ivamare.workflow.retry.BackoffPolicy;
import com.ivamare.workflow.retry.FailureOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DefaultRetrySchedulerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");
    private static final String WORKER = "worker-1";

    @Mock
    private WorkflowItemRepository itemRepository;

    @Mock
    private StateTransitionEngine transitionEngine;

    @Mock
    private LeaseManager leaseManager;

    @Mock
    private DeadLetterStore deadLetterStore;

    @Mock
    private QuotaTracker quotaTracker;

    @Mock
    private EventEmitter eventEmitter;

    @Mock
    private TransactionTemplate transactionTemplate;

    private DefaultRetryScheduler scheduler;
    private UUID workflowId;

    @BeforeEach
    void setUp() {
        lenient().when(transactionTemplate.execute(any())).thenAnswer(invocation ->
            ((TransactionCallback<?>) invocation.getArgument(0)).doInTransaction(null));
        scheduler = new DefaultRetryScheduler(itemRepository, transitionEngine, leaseManager, deadLetterStore,
            quotaTracker, eventEmitter, BackoffPolicy.defaultPolicy(), transactionTemplate,
            Clock.fixed(NOW, ZoneOffset.UTC));
        workflowId = UUID.randomUUID();
    }

    private WorkflowItem processing(int retryCount, String leaseHolder) {
        return item(WorkflowState.PROCESSING, retryCount, leaseHolder);
    }

    private WorkflowItem item(WorkflowState state, int retryCount, String leaseHolder) {
        return new WorkflowItem(workflowId, state, 5, "extract", 0, retryCount, 3, null,
            Map.of("doc", "a"), Map.of(), Map.of(), 0, null, leaseHolder, NOW.minusSeconds(10), null,
            NOW.minusSeconds(3600), NOW.minusSeconds(10), NOW.minusSeconds(3600), NOW.minusSeconds(10), null);
    }

    private TransitionRequest capturedTransition() {
        ArgumentCaptor<TransitionRequest> captor = ArgumentCaptor.forClass(TransitionRequest.class);
        verify(transitionEngine).transition(captor.capture());
        return captor.getValue();
    }

    @Nested
    @DisplayName("transient failures")
    class TransientFailures {

        @Test
        void shouldScheduleFirstRetryAfterFiveMinutes() {
            when(itemRepository.lockById(workflowId)).thenReturn(Optional.of(processing(0, WORKER)));
            when(transitionEngine.transition(any(TransitionRequest.class))).thenReturn(true);

            FailureOutcome outcome = scheduler.onFailure(workflowId, WORKER,
                WorkFailure.transientFailure("TIMEOUT", "upstream timed out"));

            assertEquals(FailureOutcome.RETRY_SCHEDULED, outcome);
            TransitionRequest request = capturedTransition();
            assertEquals(WorkflowState.PROCESSING, request.fromState());
            assertEquals(WorkflowState.QUEUED, request.toState());
            assertTrue(request.incrementRetry());
            assertTrue(request.releaseLease());
            assertEquals(NOW.plus(Duration.ofMinutes(5)), request.nextRetryAt());
            assertEquals("[TIMEOUT] upstream timed out", request.lastError());

            ArgumentCaptor<EventData> event = ArgumentCaptor.forClass(EventData.class);
            verify(eventEmitter).emit(eq(workflowId), event.capture());
            EventData.RetryScheduled scheduled = (EventData.RetryScheduled) event.getValue();
            assertEquals(1, scheduled.retryCount());
            assertEquals(300, scheduled.delaySeconds());
            verifyNoInteractions(deadLetterStore);
        }

        @Test
        void shouldScheduleSecondAndThirdRetriesAtTenAndTwentyMinutes() {
            when(transitionEngine.transition(any(TransitionRequest.class))).thenReturn(true);

            when(itemRepository.lockById(workflowId)).thenReturn(Optional.of(processing(1, WORKER)));
            scheduler.onFailure(workflowId, WORKER, WorkFailure.transientFailure("TIMEOUT", "again"));
            when(itemRepository.lockById(workflowId)).thenReturn(Optional.of(processing(2, WORKER)));
            scheduler.onFailure(workflowId, WORKER, WorkFailure.transientFailure("TIMEOUT", "again"));

            ArgumentCaptor<TransitionRequest> captor = ArgumentCaptor.forClass(TransitionRequest.class);
            verify(transitionEngine, times(2)).transition(captor.capture());
            assertEquals(NOW.plus(Duration.ofMinutes(10)), captor.getAllValues().get(0).nextRetryAt());
            assertEquals(NOW.plus(Duration.ofMinutes(20)), captor.getAllValues().get(1).nextRetryAt());
        }

        @Test
        void shouldDeadLetterFourthFailure() {
            when(itemRepository.lockById(workflowId)).thenReturn(Optional.of(processing(3, WORKER)));
            when(transitionEngine.transition(any(TransitionRequest.class))).thenReturn(true);

            FailureOutcome outcome = scheduler.onFailure(workflowId, WORKER,
                WorkFailure.transientFailure("TIMEOUT", "still down"));

            assertEquals(FailureOutcome.DEAD_LETTERED, outcome);
            TransitionRequest request = capturedTransition();
            assertEquals(WorkflowState.FAILED, request.toState());
            assertTrue(request.incrementRetry());
            assertEquals("retries exhausted", request.reason());

            @SuppressWarnings("unchecked")
            ArgumentCaptor<Map<String, Object>> details = ArgumentCaptor.forClass(Map.class);
            verify(deadLetterStore).record(eq(workflowId), anyMap(), eq("still down"),
                details.capture());
            assertEquals(4, details.getValue().get("retry_count"));
            assertEquals("TIMEOUT", details.getValue().get("code"));
        }

        @Test
        void shouldDeadLetterSnapshotOfFailedItem() {
            WorkflowItem locked = new WorkflowItem(workflowId, WorkflowState.PROCESSING, 5, "extract", 0, 3, 3,
                null, Map.of("doc", "a"), Map.of("k", "v"), Map.of("partial", 1), 2, NOW.minusSeconds(600),
                WORKER, NOW.minusSeconds(10), null, NOW.minusSeconds(3600), NOW.minusSeconds(10),
                NOW.minusSeconds(3600), NOW.minusSeconds(10), null);
            WorkflowItem failed = new WorkflowItem(workflowId, WorkflowState.FAILED, 6, "extract", 0, 4, 3,
                null, Map.of("doc", "a"), Map.of("k", "v"), Map.of("partial", 1), 2, NOW.minusSeconds(600),
                null, null, "[TIMEOUT] still down", NOW.minusSeconds(3600), NOW,
                NOW.minusSeconds(3600), NOW.minusSeconds(10), NOW);
            when(itemRepository.lockById(workflowId)).thenReturn(Optional.of(locked));
            when(itemRepository.findById(workflowId)).thenReturn(Optional.of(failed));
            when(transitionEngine.transition(any(TransitionRequest.class))).thenReturn(true);

            scheduler.onFailure(workflowId, WORKER, WorkFailure.transientFailure("TIMEOUT", "still down"));

            @SuppressWarnings("unchecked")
            ArgumentCaptor<Map<String, Object>> snapshot = ArgumentCaptor.forClass(Map.class);
            verify(deadLetterStore).record(eq(workflowId), snapshot.capture(), eq("still down"), anyMap());
            Map<String, Object> data = snapshot.getValue();
            assertEquals(workflowId.toString(), data.get("workflow_id"));
            assertEquals("failed", data.get("state"));
            assertEquals(6, data.get("version"));
            assertEquals("extract", data.get("stage"));
            assertEquals(4, data.get("retry_count"));
            assertEquals(2, data.get("quota_exceeded_count"));
            assertEquals(Map.of("doc", "a"), data.get("payload"));
            assertEquals(Map.of("k", "v"), data.get("stage_details"));
            assertEquals(Map.of("partial", 1), data.get("partial_results"));
            assertEquals("[TIMEOUT] still down", data.get("last_error"));
            assertEquals(NOW.toString(), data.get("completed_at"));
        }

        @Test
        void shouldSnapshotLockedItemWhenRereadFindsNothing() {
            WorkflowItem locked = new WorkflowItem(workflowId, WorkflowState.PROCESSING, 5, "extract", 0, 3, 3,
                null, Map.of("doc", "a"), Map.of("k", "v"), Map.of("partial", 1), 0, null,
                WORKER, NOW.minusSeconds(10), null, NOW.minusSeconds(3600), NOW.minusSeconds(10),
                NOW.minusSeconds(3600), NOW.minusSeconds(10), null);
            when(itemRepository.lockById(workflowId)).thenReturn(Optional.of(locked));
            when(itemRepository.findById(workflowId)).thenReturn(Optional.empty());
            when(transitionEngine.transition(any(TransitionRequest.class))).thenReturn(true);

            scheduler.onFailure(workflowId, WORKER, WorkFailure.transientFailure("TIMEOUT", "still down"));

            @SuppressWarnings("unchecked")
            ArgumentCaptor<Map<String, Object>> snapshot = ArgumentCaptor.forClass(Map.class);
            verify(deadLetterStore).record(eq(workflowId), snapshot.capture(), anyString(), anyMap());
            assertEquals("processing", snapshot.getValue().get("state"));
            assertEquals(Map.of("partial", 1), snapshot.getValue().get("partial_results"));
            assertEquals(Map.of("doc", "a"), snapshot.getValue().get("payload"));
            assertEquals(WORKER, snapshot.getValue().get("lease_holder"));
        }

        @Test
        void shouldIgnoreReportFromWorkerThatLostLease() {
            when(itemRepository.lockById(workflowId)).thenReturn(Optional.of(processing(0, "other-worker")));

            FailureOutcome outcome = scheduler.onFailure(workflowId, WORKER,
                WorkFailure.transientFailure("TIMEOUT", "late"));

            assertEquals(FailureOutcome.IGNORED, outcome);
            verifyNoInteractions(transitionEngine, deadLetterStore, eventEmitter);
        }

        @Test
        void shouldIgnoreReportForItemNoLongerProcessing() {
            when(itemRepository.lockById(workflowId)).thenReturn(Optional.of(item(WorkflowState.QUEUED, 1, null)));

            assertEquals(FailureOutcome.IGNORED, scheduler.onFailure(workflowId, WORKER,
                WorkFailure.transientFailure("TIMEOUT", "late")));
            verifyNoInteractions(transitionEngine);
        }

        @Test
        void shouldThrowWhenItemMissing() {
            when(itemRepository.lockById(workflowId)).thenReturn(Optional.empty());

            assertThrows(WorkflowNotFoundException.class, () -> scheduler.onFailure(workflowId, WORKER,
                WorkFailure.transientFailure("TIMEOUT", "x")));
        }
    }

    @Nested
    @DisplayName("permanent failures")
    class PermanentFailures {

        @Test
        void shouldDeadLetterWithoutConsumingRetry() {
            when(itemRepository.lockById(workflowId)).thenReturn(Optional.of(processing(1, WORKER)));
            when(transitionEngine.transition(any(TransitionRequest.class))).thenReturn(true);

            FailureOutcome outcome = scheduler.onFailure(workflowId, WORKER,
                WorkFailure.permanent("INVALID_DOCUMENT", "unreadable", Map.of("page", 3)));

            assertEquals(FailureOutcome.DEAD_LETTERED, outcome);
            TransitionRequest request = capturedTransition();
            assertEquals(WorkflowState.FAILED, request.toState());
            assertFalse(request.incrementRetry());

            @SuppressWarnings("unchecked")
            ArgumentCaptor<Map<String, Object>> details = ArgumentCaptor.forClass(Map.class);
            verify(deadLetterStore).record(eq(workflowId), anyMap(), eq("unreadable"), details.capture());
            assertEquals(3, details.getValue().get("page"));
            assertEquals("PERMANENT", details.getValue().get("kind"));
            assertEquals(1, details.getValue().get("retry_count"));
            verify(eventEmitter).recordMetric(eq(workflowId), eq("failure"), eq("deadletter.recorded"),
                eq(1.0), anyMap());
        }

        @Test
        void shouldNotDeadLetterWhenTransitionLosesRace() {
            when(itemRepository.lockById(workflowId)).thenReturn(Optional.of(processing(0, WORKER)));
            when(transitionEngine.transition(any(TransitionRequest.class))).thenReturn(false);

            assertEquals(FailureOutcome.IGNORED, scheduler.onFailure(workflowId, WORKER,
                WorkFailure.permanent("BAD", "bad")));
            verifyNoInteractions(deadLetterStore);
        }
    }

    @Nested
    @DisplayName("quota failures")
    class QuotaFailures {

        @Test
        void shouldParkUntilReportedRetryAfter() {
            Instant retryAfter = NOW.plusSeconds(30);
            when(itemRepository.lockById(workflowId)).thenReturn(Optional.of(processing(0, WORKER)));
            when(quotaTracker.exceededQuotaTypes("gemini")).thenReturn(List.of("requests_per_minute"));
            when(transitionEngine.transition(any(TransitionRequest.class))).thenReturn(true);

            FailureOutcome outcome = scheduler.onFailure(workflowId, WORKER,
                WorkFailure.quota("gemini", "429", retryAfter, Map.of("ocr", "done")));

            assertEquals(FailureOutcome.QUOTA_WAIT, outcome);
            TransitionRequest request = capturedTransition();
            assertEquals(WorkflowState.QUOTA_EXCEEDED, request.toState());
            assertEquals(retryAfter, request.nextRetryAt());
            assertFalse(request.incrementRetry());
            assertEquals(Map.of("ocr", "done"), request.partialResults());
            assertEquals(30L, request.metadata().get("estimated_wait_seconds"));
            assertEquals("extract", request.metadata().get("last_stage_attempted"));
            assertEquals(true, request.metadata().get("can_resume"));

            ArgumentCaptor<EventData> event = ArgumentCaptor.forClass(EventData.class);
            verify(eventEmitter).emit(eq(workflowId), event.capture());
            EventData.QuotaExceeded exceeded = (EventData.QuotaExceeded) event.getValue();
            assertEquals(List.of("requests_per_minute"), exceeded.quotaTypes());
            assertEquals(retryAfter, exceeded.resumeAt());
        }

        @Test
        void shouldUseTrackerResetTimeWhenNoRetryAfterGiven() {
            Instant midnight = Instant.parse("2024-05-02T00:00:00Z");
            when(itemRepository.lockById(workflowId)).thenReturn(Optional.of(processing(0, WORKER)));
            when(quotaTracker.exceededQuotaTypes("gemini")).thenReturn(List.of("requests_per_day"));
            when(quotaTracker.resumeAt("gemini")).thenReturn(Optional.of(midnight));
            when(transitionEngine.transition(any(TransitionRequest.class))).thenReturn(true);

            scheduler.onFailure(workflowId, WORKER, WorkFailure.quota("gemini", "daily cap", null, null));

            assertEquals(midnight, capturedTransition().nextRetryAt());
        }

        @Test
        void shouldFallBackToBaseDelayWhenResetUnknown() {
            when(itemRepository.lockById(workflowId)).thenReturn(Optional.of(processing(0, WORKER)));
            when(quotaTracker.exceededQuotaTypes("gemini")).thenReturn(List.of());
            when(quotaTracker.resumeAt("gemini")).thenReturn(Optional.empty());
            when(transitionEngine.transition(any(TransitionRequest.class))).thenReturn(true);

            scheduler.onFailure(workflowId, WORKER, WorkFailure.quota("gemini", "throttled", null, null));

            assertEquals(NOW.plus(Duration.ofMinutes(5)), capturedTransition().nextRetryAt());
        }
    }

    @Nested
    class PartialProgress {

        @Test
        void shouldParkWithPartialResults() {
            Instant resumeAt = NOW.plusSeconds(120);
            when(itemRepository.lockById(workflowId)).thenReturn(Optional.of(processing(0, WORKER)));
            when(transitionEngine.transition(any(TransitionRequest.class))).thenReturn(true);

            assertTrue(scheduler.onPartialProgress(workflowId, WORKER, "summarize",
                Map.of("ocr", "done"), resumeAt));

            TransitionRequest request = capturedTransition();
            assertEquals(WorkflowState.PARTIALLY_PROCESSED, request.toState());
            assertEquals("summarize", request.stage());
            assertEquals(resumeAt, request.nextRetryAt());
            assertTrue(request.releaseLease());
            assertEquals(Map.of("ocr", "done"), request.partialResults());
        }

        @Test
        void shouldClearScheduleWhenResumeImmediate() {
            when(itemRepository.lockById(workflowId)).thenReturn(Optional.of(processing(0, WORKER)));
            when(transitionEngine.transition(any(TransitionRequest.class))).thenReturn(true);

            scheduler.onPartialProgress(workflowId, WORKER, "summarize", Map.of(), null);

            assertTrue(capturedTransition().clearNextRetryAt());
        }
    }

    @Nested
    class Maintenance {

        @Test
        void shouldRequeueDueParkedItems() {
            UUID other = UUID.randomUUID();
            when(itemRepository.findDueForRequeue(NOW, 10)).thenReturn(List.of(
                new ParkedItem(workflowId, WorkflowState.QUOTA_EXCEEDED),
                new ParkedItem(other, WorkflowState.PARTIALLY_PROCESSED)));
            when(transitionEngine.transition(any(TransitionRequest.class))).thenReturn(true, false);

            int requeued = scheduler.requeueEligible(10);

            assertEquals(1, requeued);
            ArgumentCaptor<TransitionRequest> captor = ArgumentCaptor.forClass(TransitionRequest.class);
            verify(transitionEngine, times(2)).transition(captor.capture());
            assertEquals(WorkflowState.QUOTA_EXCEEDED, captor.getAllValues().get(0).fromState());
            assertEquals(WorkflowState.PARTIALLY_PROCESSED, captor.getAllValues().get(1).fromState());
            assertTrue(captor.getAllValues().get(0).clearNextRetryAt());
        }

        @Test
        void shouldTreatStaleLeaseAsTransientFailure() {
            WorkflowItem stale = processing(0, "crashed-worker");
            when(leaseManager.findExpiredLeases(300, 5)).thenReturn(List.of(stale));
            when(leaseManager.acquireLease(workflowId, WORKER, 300)).thenReturn(true);
            when(itemRepository.lockById(workflowId)).thenReturn(Optional.of(processing(0, WORKER)));
            when(transitionEngine.transition(any(TransitionRequest.class))).thenReturn(true);

            int recovered = scheduler.recoverStaleLeases(WORKER, 300, 5);

            assertEquals(1, recovered);
            TransitionRequest request = capturedTransition();
            assertEquals(WorkflowState.QUEUED, request.toState());
            assertTrue(request.lastError().startsWith("[LEASE_EXPIRED]"));
        }

        @Test
        void shouldSkipStaleLeaseTakenByAnotherWorker() {
            when(leaseManager.findExpiredLeases(300, 5)).thenReturn(List.of(processing(0, "crashed-worker")));
            when(leaseManager.acquireLease(workflowId, WORKER, 300)).thenReturn(false);

            assertEquals(0, scheduler.recoverStaleLeases(WORKER, 300, 5));
            verifyNoInteractions(transitionEngine);
        }

        @Test
        void shouldReleaseLeaseWhenRecoveredItemAlreadyMoved() {
            when(leaseManager.findExpiredLeases(300, 5)).thenReturn(List.of(processing(0, "crashed-worker")));
            when(leaseManager.acquireLease(workflowId, WORKER, 300)).thenReturn(true);
            when(itemRepository.lockById(workflowId)).thenReturn(Optional.of(item(WorkflowState.COMPLETED, 0, WORKER)));

            assertEquals(0, scheduler.recoverStaleLeases(WORKER, 300, 5));
            verify(leaseManager).releaseLease(workflowId, WORKER);
        }
    }
}
