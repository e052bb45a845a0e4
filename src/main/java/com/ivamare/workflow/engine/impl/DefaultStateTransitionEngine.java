package com.ivamare.workflow.engine.impl;

import com.ivamare.workflow.engine.StateTransitionEngine;
import com.ivamare.workflow.engine.WorkflowStateMachine;
import com.ivamare.workflow.exception.DatabaseExceptionClassifier;
import com.ivamare.workflow.exception.InvalidTransitionException;
import com.ivamare.workflow.exception.WorkflowNotFoundException;
import com.ivamare.workflow.model.DomainEvent;
import com.ivamare.workflow.model.EventData;
import com.ivamare.workflow.model.TransitionRecord;
import com.ivamare.workflow.model.TransitionRequest;
import com.ivamare.workflow.model.WorkflowItem;
import com.ivamare.workflow.model.WorkflowState;
import com.ivamare.workflow.repository.DomainEventRepository;
import com.ivamare.workflow.repository.TransitionRepository;
import com.ivamare.workflow.repository.WorkflowItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Default implementation of StateTransitionEngine.
 *
 * <p>Runs inside the caller's transaction when one is active, so that callers can
 * combine a transition with their own writes.
 */
public class DefaultStateTransitionEngine implements StateTransitionEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultStateTransitionEngine.class);

    private final WorkflowItemRepository itemRepository;
    private final TransitionRepository transitionRepository;
    private final DomainEventRepository eventRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public DefaultStateTransitionEngine(
            WorkflowItemRepository itemRepository,
            TransitionRepository transitionRepository,
            DomainEventRepository eventRepository,
            TransactionTemplate transactionTemplate,
            Clock clock) {
        this.itemRepository = itemRepository;
        this.transitionRepository = transitionRepository;
        this.eventRepository = eventRepository;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    @Override
    public boolean transition(UUID workflowId, WorkflowState fromState, WorkflowState toState,
                              String stage, String reason, Map<String, Object> metadata, String actor) {
        return transition(TransitionRequest.of(workflowId, fromState, toState, stage, reason, metadata, actor));
    }

    @Override
    public boolean transition(TransitionRequest request) {
        if (!WorkflowStateMachine.isAllowed(request.fromState(), request.toState())) {
            throw new InvalidTransitionException(request.fromState(), request.toState());
        }

        try {
            Boolean applied = transactionTemplate.execute(status -> applyLocked(request));
            return Boolean.TRUE.equals(applied);
        } catch (DataAccessException e) {
            throw DatabaseExceptionClassifier.translate("transition", e);
        }
    }

    private boolean applyLocked(TransitionRequest request) {
        UUID workflowId = request.workflowId();
        WorkflowItem item = itemRepository.lockById(workflowId)
            .orElseThrow(() -> new WorkflowNotFoundException(workflowId));

        if (item.state() != request.fromState()) {
            log.debug("State mismatch for workflow {}: expected {}, found {}",
                workflowId, request.fromState().getValue(), item.state().getValue());
            return false;
        }

        Instant now = clock.instant();
        TransitionRequest ordered = withOrderedMetadata(request);
        if (itemRepository.applyTransition(ordered, now) != 1) {
            log.debug("Workflow {} changed state under lock, transition skipped", workflowId);
            return false;
        }

        String stage = request.stage() != null ? request.stage() : item.stage();
        UUID transitionId = UUID.randomUUID();
        transitionRepository.save(new TransitionRecord(
            transitionId, workflowId, request.fromState(), request.toState(), stage,
            request.reason(), ordered.metadata(), request.actor(), now));

        EventData data = new EventData.StateChanged(
            transitionId, request.fromState(), request.toState(), stage, request.reason());
        eventRepository.save(new DomainEvent(UUID.randomUUID(), workflowId, data.type(), data, false, now));

        log.debug("Workflow {} transitioned {} -> {} (version {})",
            workflowId, request.fromState().getValue(), request.toState().getValue(), item.version() + 1);
        return true;
    }

    private TransitionRequest withOrderedMetadata(TransitionRequest request) {
        if (request.metadata().isEmpty()) {
            return request;
        }
        return new TransitionRequest(
            request.workflowId(), request.fromState(), request.toState(), request.stage(), request.reason(),
            new TreeMap<>(request.metadata()), request.actor(), request.incrementRetry(), request.resetRetries(),
            request.nextRetryAt(), request.clearNextRetryAt(), request.lastError(), request.partialResults(),
            request.releaseLease());
    }
}
