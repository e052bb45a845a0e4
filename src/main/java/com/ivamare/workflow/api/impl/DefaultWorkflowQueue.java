package com.ivamare.workflow.api.impl;

import com.ivamare.workflow.api.WorkflowQueue;
import com.ivamare.workflow.engine.StateTransitionEngine;
import com.ivamare.workflow.events.EventEmitter;
import com.ivamare.workflow.exception.DatabaseExceptionClassifier;
import com.ivamare.workflow.exception.InvalidOperationException;
import com.ivamare.workflow.exception.WorkflowNotFoundException;
import com.ivamare.workflow.lease.LeaseManager;
import com.ivamare.workflow.model.EventData;
import com.ivamare.workflow.model.TransitionRecord;
import com.ivamare.workflow.model.TransitionRequest;
import com.ivamare.workflow.model.WorkFailure;
import com.ivamare.workflow.model.WorkflowItem;
import com.ivamare.workflow.model.WorkflowState;
import com.ivamare.workflow.repository.TransitionRepository;
import com.ivamare.workflow.repository.WorkflowItemRepository;
import com.ivamare.workflow.retry.BackoffPolicy;
import com.ivamare.workflow.retry.FailureOutcome;
import com.ivamare.workflow.retry.RetryScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Default implementation of WorkflowQueue.
 */
public class DefaultWorkflowQueue implements WorkflowQueue {

    private static final Logger log = LoggerFactory.getLogger(DefaultWorkflowQueue.class);

    private final WorkflowItemRepository itemRepository;
    private final TransitionRepository transitionRepository;
    private final StateTransitionEngine transitionEngine;
    private final LeaseManager leaseManager;
    private final RetryScheduler retryScheduler;
    private final EventEmitter eventEmitter;
    private final BackoffPolicy backoffPolicy;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public DefaultWorkflowQueue(
            WorkflowItemRepository itemRepository,
            TransitionRepository transitionRepository,
            StateTransitionEngine transitionEngine,
            LeaseManager leaseManager,
            RetryScheduler retryScheduler,
            EventEmitter eventEmitter,
            BackoffPolicy backoffPolicy,
            TransactionTemplate transactionTemplate,
            Clock clock) {
        this.itemRepository = itemRepository;
        this.transitionRepository = transitionRepository;
        this.transitionEngine = transitionEngine;
        this.leaseManager = leaseManager;
        this.retryScheduler = retryScheduler;
        this.eventEmitter = eventEmitter;
        this.backoffPolicy = backoffPolicy;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    @Override
    public UUID enqueue(Map<String, Object> payload, int priority) {
        return enqueue(payload, priority, backoffPolicy.maxRetries());
    }

    @Override
    public UUID enqueue(Map<String, Object> payload, int priority, int maxRetries) {
        WorkflowItem item = WorkflowItem.create(payload, priority, maxRetries, clock.instant());
        try {
            itemRepository.save(item);
        } catch (DataAccessException e) {
            throw DatabaseExceptionClassifier.translate("enqueue", e);
        }
        log.debug("Enqueued workflow {} with priority {}", item.workflowId(), priority);
        return item.workflowId();
    }

    @Override
    public UUID submit(Map<String, Object> payload, int priority) {
        try {
            return transactionTemplate.execute(status -> {
                UUID workflowId = enqueue(payload, priority);
                transitionEngine.transition(workflowId, WorkflowState.CREATED, WorkflowState.QUEUED,
                    null, "submitted", Map.of(), "producer");
                return workflowId;
            });
        } catch (DataAccessException e) {
            throw DatabaseExceptionClassifier.translate("submit", e);
        }
    }

    @Override
    public Optional<WorkflowItem> claimNext(String workerId, long leaseTimeoutSeconds) {
        try {
            Optional<WorkflowItem> claimed = transactionTemplate.execute(status -> {
                Optional<UUID> next = itemRepository.lockNextClaimable(clock.instant(), leaseTimeoutSeconds);
                if (next.isEmpty()) {
                    return Optional.<WorkflowItem>empty();
                }
                UUID workflowId = next.get();
                if (!leaseManager.acquireLease(workflowId, workerId, leaseTimeoutSeconds)) {
                    return Optional.<WorkflowItem>empty();
                }
                if (!transitionEngine.transition(workflowId, WorkflowState.QUEUED, WorkflowState.PROCESSING,
                        null, "claimed", Map.of("worker_id", workerId), workerId)) {
                    throw new IllegalStateException("Workflow " + workflowId + " left queued while locked");
                }
                return itemRepository.findById(workflowId);
            });
            if (claimed != null && claimed.isPresent()) {
                log.debug("Worker {} claimed workflow {}", workerId, claimed.get().workflowId());
                return claimed;
            }
            return Optional.empty();
        } catch (DataAccessException e) {
            throw DatabaseExceptionClassifier.translate("claimNext", e);
        }
    }

    @Override
    public boolean complete(UUID workflowId, String workerId, Map<String, Object> resultMetadata) {
        try {
            Boolean completed = transactionTemplate.execute(status -> {
                WorkflowItem item = itemRepository.lockById(workflowId)
                    .orElseThrow(() -> new WorkflowNotFoundException(workflowId));
                if (item.state() != WorkflowState.PROCESSING || !workerId.equals(item.leaseHolder())) {
                    log.warn("Worker {} cannot complete workflow {} (state={}, holder={})",
                        workerId, workflowId, item.state().getValue(), item.leaseHolder());
                    return false;
                }
                boolean moved = transitionEngine.transition(TransitionRequest
                    .builder(workflowId, WorkflowState.PROCESSING, WorkflowState.COMPLETED)
                    .reason("completed")
                    .metadata(resultMetadata)
                    .actor(workerId)
                    .clearNextRetryAt()
                    .releaseLease()
                    .build());
                if (moved && item.processingStartedAt() != null) {
                    long millis = Duration.between(item.processingStartedAt(), clock.instant()).toMillis();
                    eventEmitter.recordMetric(workflowId, "performance", "processing.duration_ms", millis,
                        Map.of("worker_id", workerId));
                }
                return moved;
            });
            boolean result = Boolean.TRUE.equals(completed);
            if (result) {
                log.info("Workflow {} completed by {}", workflowId, workerId);
            }
            return result;
        } catch (DataAccessException e) {
            throw DatabaseExceptionClassifier.translate("complete", e);
        }
    }

    @Override
    public FailureOutcome fail(UUID workflowId, String workerId, WorkFailure failure) {
        return retryScheduler.onFailure(workflowId, workerId, failure);
    }

    @Override
    public void reportStageCompleted(UUID workflowId, String stage, double progressPercentage) {
        try {
            eventEmitter.emit(workflowId, new EventData.StageCompleted(stage, progressPercentage));
        } catch (DataAccessException e) {
            throw DatabaseExceptionClassifier.translate("reportStageCompleted", e);
        }
    }

    @Override
    public boolean cancel(UUID workflowId, String reason, String actor) {
        WorkflowItem item = itemRepository.findById(workflowId)
            .orElseThrow(() -> new WorkflowNotFoundException(workflowId));
        if (item.state().isTerminal() || item.state() == WorkflowState.PROCESSING) {
            throw new InvalidOperationException(
                "Cannot cancel workflow " + workflowId + " in state " + item.state().getValue());
        }

        boolean cancelled = transitionEngine.transition(TransitionRequest
            .builder(workflowId, item.state(), WorkflowState.CANCELLED)
            .reason(reason != null ? reason : "cancelled")
            .actor(actor)
            .clearNextRetryAt()
            .build());
        if (cancelled) {
            log.info("Workflow {} cancelled by {}: {}", workflowId, actor, reason);
        }
        return cancelled;
    }

    @Override
    public boolean requeue(UUID workflowId, String actor, String reason) {
        WorkflowItem item = itemRepository.findById(workflowId)
            .orElseThrow(() -> new WorkflowNotFoundException(workflowId));
        if (item.state() != WorkflowState.FAILED) {
            throw new InvalidOperationException(
                "Cannot requeue workflow " + workflowId + " in state " + item.state().getValue());
        }

        boolean requeued = transitionEngine.transition(TransitionRequest
            .builder(workflowId, WorkflowState.FAILED, WorkflowState.QUEUED)
            .reason(reason != null ? reason : "operator requeue")
            .actor(actor)
            .resetRetries()
            .clearNextRetryAt()
            .build());
        if (requeued) {
            log.info("Workflow {} requeued by {}", workflowId, actor);
        }
        return requeued;
    }

    @Override
    public Optional<WorkflowItem> get(UUID workflowId) {
        return itemRepository.findById(workflowId);
    }

    @Override
    public List<WorkflowItem> list(WorkflowState state, String stage, int limit, int offset) {
        return itemRepository.find(state, stage, limit, offset);
    }

    @Override
    public long count(WorkflowState state, String stage) {
        return itemRepository.count(state, stage);
    }

    @Override
    public List<TransitionRecord> history(UUID workflowId) {
        return transitionRepository.findByWorkflowId(workflowId);
    }
}
