package com.ivamare.workflow.engine.impl;

import com.ivamare.workflow.exception.InvalidTransitionException;
import com.ivamare.workflow.exception.StoreUnavailableException;
import com.ivamare.workflow.exception.WorkflowNotFoundException;
import com.ivamare.workflow.model.DomainEvent;
import com.ivamare.workflow.model.DomainEventType;
import com.ivamare.workflow.model.EventData;
import com.ivamare.workflow.model.TransitionRecord;
import com.ivamare.workflow.model.TransitionRequest;
import com.ivamare.workflow.model.WorkflowItem;
import com.ivamare.workflow.model.WorkflowState;
import com.ivamare.workflow.repository.DomainEventRepository;
import com.ivamare.workflow.repository.TransitionRepository;
import com.ivamare.workflow.repository.WorkflowItemRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
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
class DefaultStateTransitionEngineTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");

    @Mock
    private WorkflowItemRepository itemRepository;

    @Mock
    private TransitionRepository transitionRepository;

    @Mock
    private DomainEventRepository eventRepository;

    @Mock
    private TransactionTemplate transactionTemplate;

    private DefaultStateTransitionEngine engine;
    private UUID workflowId;

    @BeforeEach
    void setUp() {
        lenient().when(transactionTemplate.execute(any())).thenAnswer(invocation ->
            ((TransactionCallback<?>) invocation.getArgument(0)).doInTransaction(null));
        engine = new DefaultStateTransitionEngine(itemRepository, transitionRepository, eventRepository,
            transactionTemplate, Clock.fixed(NOW, ZoneOffset.UTC));
        workflowId = UUID.randomUUID();
    }

    private WorkflowItem itemIn(WorkflowState state, String stage, int version) {
        WorkflowItem created = WorkflowItem.create(Map.of("doc", "a"), 0, 3, NOW.minusSeconds(60));
        return new WorkflowItem(workflowId, state, version, stage, 0, 0, 3, null,
            created.payload(), Map.of(), Map.of(), 0, null, null, null, null,
            created.createdAt(), created.updatedAt(), null, null, null);
    }

    @Nested
    class SuccessfulTransition {

        @Test
        void shouldWriteOneTransitionRecordAndOneEvent() {
            when(itemRepository.lockById(workflowId)).thenReturn(Optional.of(itemIn(WorkflowState.QUEUED, null, 2)));
            when(itemRepository.applyTransition(any(TransitionRequest.class), eq(NOW))).thenReturn(1);

            boolean result = engine.transition(workflowId, WorkflowState.QUEUED, WorkflowState.PROCESSING,
                "extract", "claimed", Map.of("worker", "w1"), "worker");

            assertTrue(result);

            ArgumentCaptor<TransitionRecord> record = ArgumentCaptor.forClass(TransitionRecord.class);
            verify(transitionRepository, times(1)).save(record.capture());
            assertEquals(WorkflowState.QUEUED, record.getValue().fromState());
            assertEquals(WorkflowState.PROCESSING, record.getValue().toState());
            assertEquals("extract", record.getValue().stage());
            assertEquals("claimed", record.getValue().reason());
            assertEquals("worker", record.getValue().actor());
            assertEquals(Map.of("worker", "w1"), record.getValue().metadata());
            assertEquals(NOW, record.getValue().createdAt());

            ArgumentCaptor<DomainEvent> event = ArgumentCaptor.forClass(DomainEvent.class);
            verify(eventRepository, times(1)).save(event.capture());
            assertEquals(DomainEventType.STATE_CHANGED, event.getValue().eventType());
            assertFalse(event.getValue().processed());
            EventData.StateChanged data = (EventData.StateChanged) event.getValue().eventData();
            assertEquals(record.getValue().transitionId(), data.transitionId());
            assertEquals(WorkflowState.QUEUED, data.fromState());
            assertEquals(WorkflowState.PROCESSING, data.toState());
        }

        @Test
        void shouldKeepCurrentStageWhenRequestHasNone() {
            when(itemRepository.lockById(workflowId))
                .thenReturn(Optional.of(itemIn(WorkflowState.PROCESSING, "summarize", 4)));
            when(itemRepository.applyTransition(any(TransitionRequest.class), eq(NOW))).thenReturn(1);

            engine.transition(workflowId, WorkflowState.PROCESSING, WorkflowState.COMPLETED,
                null, "done", null, "worker");

            ArgumentCaptor<TransitionRecord> record = ArgumentCaptor.forClass(TransitionRecord.class);
            verify(transitionRepository).save(record.capture());
            assertEquals("summarize", record.getValue().stage());
        }

        @Test
        void shouldPassFieldUpdatesToRepository() {
            Instant retryAt = NOW.plusSeconds(300);
            when(itemRepository.lockById(workflowId)).thenReturn(Optional.of(itemIn(WorkflowState.PROCESSING, null, 3)));
            when(itemRepository.applyTransition(any(TransitionRequest.class), eq(NOW))).thenReturn(1);

            engine.transition(TransitionRequest.builder(workflowId, WorkflowState.PROCESSING, WorkflowState.QUEUED)
                .incrementRetry()
                .nextRetryAt(retryAt)
                .lastError("[TIMEOUT] slow")
                .releaseLease()
                .metadata(Map.of("b", 2, "a", 1))
                .build());

            ArgumentCaptor<TransitionRequest> applied = ArgumentCaptor.forClass(TransitionRequest.class);
            verify(itemRepository).applyTransition(applied.capture(), eq(NOW));
            assertTrue(applied.getValue().incrementRetry());
            assertTrue(applied.getValue().releaseLease());
            assertEquals(retryAt, applied.getValue().nextRetryAt());
            assertEquals(List.of("a", "b"), List.copyOf(applied.getValue().metadata().keySet()));
        }
    }

    @Nested
    class RejectedTransition {

        @Test
        void shouldReturnFalseOnStateMismatchWithoutSideEffects() {
            when(itemRepository.lockById(workflowId)).thenReturn(Optional.of(itemIn(WorkflowState.PROCESSING, null, 3)));

            boolean result = engine.transition(workflowId, WorkflowState.QUEUED, WorkflowState.PROCESSING,
                null, "claim", null, "worker");

            assertFalse(result);
            verify(itemRepository, never()).applyTransition(any(), any());
            verifyNoInteractions(transitionRepository, eventRepository);
        }

        @Test
        void shouldReturnFalseWhenUpdateMatchesNoRow() {
            when(itemRepository.lockById(workflowId)).thenReturn(Optional.of(itemIn(WorkflowState.QUEUED, null, 2)));
            when(itemRepository.applyTransition(any(TransitionRequest.class), eq(NOW))).thenReturn(0);

            assertFalse(engine.transition(workflowId, WorkflowState.QUEUED, WorkflowState.PROCESSING,
                null, null, null, null));
            verifyNoInteractions(transitionRepository, eventRepository);
        }

        @Test
        void shouldThrowOnIllegalEdgeBeforeTouchingStore() {
            InvalidTransitionException e = assertThrows(InvalidTransitionException.class, () ->
                engine.transition(workflowId, WorkflowState.COMPLETED, WorkflowState.QUEUED,
                    null, null, null, null));

            assertNotNull(e.getMessage());
            verifyNoInteractions(itemRepository);
            verify(transactionTemplate, never()).execute(any());
        }

        @Test
        void shouldThrowWhenItemMissing() {
            when(itemRepository.lockById(workflowId)).thenReturn(Optional.empty());

            assertThrows(WorkflowNotFoundException.class, () ->
                engine.transition(workflowId, WorkflowState.CREATED, WorkflowState.QUEUED,
                    null, null, null, null));
        }

        @Test
        void shouldTranslateStoreFailure() {
            when(itemRepository.lockById(workflowId))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

            assertThrows(StoreUnavailableException.class, () ->
                engine.transition(workflowId, WorkflowState.CREATED, WorkflowState.QUEUED,
                    null, null, null, null));
        }
    }
}
