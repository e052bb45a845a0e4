package com.ivamare.workflow.retry.impl;

import com.ivamare.workflow.deadletter.DeadLetterStore;
import com.ivamare.workflow.engine.StateTransitionEngine;
import com.ivamare.workflow.events.EventEmitter;
import com.ivamare.workflow.exception.DatabaseExceptionClassifier;
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
import com.ivamare.workflow.retry.RetryScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Default implementation of RetryScheduler.
 *
 * <p>Every decision re-reads the item under its row lock and applies the state change,
 * item field updates, events and dead-letter write in one transaction.
 */
public class DefaultRetryScheduler implements RetryScheduler {

    private static final Logger log = LoggerFactory.getLogger(DefaultRetryScheduler.class);

    static final String ACTOR = "retry-scheduler";

    private final WorkflowItemRepository itemRepository;
    private final StateTransitionEngine transitionEngine;
    private final LeaseManager leaseManager;
    private final DeadLetterStore deadLetterStore;
    private final QuotaTracker quotaTracker;
    private final EventEmitter eventEmitter;
    private final BackoffPolicy backoffPolicy;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public DefaultRetryScheduler(
            WorkflowItemRepository itemRepository,
            StateTransitionEngine transitionEngine,
            LeaseManager leaseManager,
            DeadLetterStore deadLetterStore,
            QuotaTracker quotaTracker,
            EventEmitter eventEmitter,
            BackoffPolicy backoffPolicy,
            TransactionTemplate transactionTemplate,
            Clock clock) {
        this.itemRepository = itemRepository;
        this.transitionEngine = transitionEngine;
        this.leaseManager = leaseManager;
        this.deadLetterStore = deadLetterStore;
        this.quotaTracker = quotaTracker;
        this.eventEmitter = eventEmitter;
        this.backoffPolicy = backoffPolicy;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    @Override
    public FailureOutcome onFailure(UUID workflowId, String workerId, WorkFailure failure) {
        try {
            FailureOutcome outcome = transactionTemplate.execute(status -> {
                Optional<WorkflowItem> item = lockProcessingItem(workflowId, workerId);
                if (item.isEmpty()) {
                    return FailureOutcome.IGNORED;
                }
                Instant now = clock.instant();
                return switch (failure.kind()) {
                    case TRANSIENT -> retryOrDeadLetter(item.get(), workerId, failure, now);
                    case PERMANENT -> deadLetter(item.get(), workerId, failure, false);
                    case QUOTA -> parkForQuota(item.get(), workerId, failure, now);
                };
            });
            return outcome != null ? outcome : FailureOutcome.IGNORED;
        } catch (DataAccessException e) {
            throw DatabaseExceptionClassifier.translate("onFailure", e);
        }
    }

    @Override
    public boolean onPartialProgress(UUID workflowId, String workerId, String stage,
                                     Map<String, Object> partialResults, Instant resumeAt) {
        try {
            Boolean parked = transactionTemplate.execute(status -> {
                if (lockProcessingItem(workflowId, workerId).isEmpty()) {
                    return false;
                }
                TransitionRequest.Builder request = TransitionRequest
                    .builder(workflowId, WorkflowState.PROCESSING, WorkflowState.PARTIALLY_PROCESSED)
                    .stage(stage)
                    .reason("partial progress")
                    .metadata(resumeMetadata(stage))
                    .actor(workerId)
                    .partialResults(partialResults)
                    .releaseLease();
                if (resumeAt != null) {
                    request.nextRetryAt(resumeAt);
                } else {
                    request.clearNextRetryAt();
                }
                return transitionEngine.transition(request.build());
            });
            boolean result = Boolean.TRUE.equals(parked);
            if (result) {
                log.info("Workflow {} parked after stage {}, resume at {}",
                    workflowId, stage, resumeAt != null ? resumeAt : "next sweep");
            }
            return result;
        } catch (DataAccessException e) {
            throw DatabaseExceptionClassifier.translate("onPartialProgress", e);
        }
    }

    @Override
    public int requeueEligible(int limit) {
        List<ParkedItem> due = itemRepository.findDueForRequeue(clock.instant(), limit);
        int requeued = 0;
        for (ParkedItem parked : due) {
            boolean moved = transitionEngine.transition(TransitionRequest
                .builder(parked.workflowId(), parked.state(), WorkflowState.QUEUED)
                .reason("wait elapsed")
                .actor(ACTOR)
                .clearNextRetryAt()
                .build());
            if (moved) {
                requeued++;
            }
        }
        if (requeued > 0) {
            log.info("Requeued {} of {} parked workflows", requeued, due.size());
        }
        return requeued;
    }

    @Override
    public int recoverStaleLeases(String workerId, long leaseTimeoutSeconds, int limit) {
        int recovered = 0;
        for (WorkflowItem item : leaseManager.findExpiredLeases(leaseTimeoutSeconds, limit)) {
            if (!leaseManager.acquireLease(item.workflowId(), workerId, leaseTimeoutSeconds)) {
                continue;
            }
            FailureOutcome outcome = onFailure(item.workflowId(), workerId, WorkFailure.transientFailure(
                "LEASE_EXPIRED", "Lease held by " + item.leaseHolder() + " expired"));
            if (outcome == FailureOutcome.IGNORED) {
                leaseManager.releaseLease(item.workflowId(), workerId);
            } else {
                recovered++;
                log.warn("Recovered workflow {} from stale lease of {} ({})",
                    item.workflowId(), item.leaseHolder(), outcome);
            }
        }
        return recovered;
    }

    private Optional<WorkflowItem> lockProcessingItem(UUID workflowId, String workerId) {
        WorkflowItem item = itemRepository.lockById(workflowId)
            .orElseThrow(() -> new WorkflowNotFoundException(workflowId));
        if (item.state() != WorkflowState.PROCESSING) {
            log.debug("Workflow {} is {}, not processing; failure report ignored",
                workflowId, item.state().getValue());
            return Optional.empty();
        }
        if (workerId != null && !workerId.equals(item.leaseHolder())) {
            log.warn("Worker {} no longer holds the lease on workflow {} (holder={}); report ignored",
                workerId, workflowId, item.leaseHolder());
            return Optional.empty();
        }
        return Optional.of(item);
    }

    private FailureOutcome retryOrDeadLetter(WorkflowItem item, String workerId, WorkFailure failure,
                                             Instant now) {
        int retryCount = item.retryCount();
        if (!backoffPolicy.shouldRetry(retryCount, item.maxRetries())) {
            return deadLetter(item, workerId, failure, true);
        }

        Duration delay = backoffPolicy.delayFor(retryCount);
        Instant nextRetryAt = now.plus(delay);
        int attempt = retryCount + 1;

        boolean moved = transitionEngine.transition(TransitionRequest
            .builder(item.workflowId(), WorkflowState.PROCESSING, WorkflowState.QUEUED)
            .reason("retry " + attempt + " of " + item.maxRetries())
            .metadata(errorMetadata(failure))
            .actor(workerId != null ? workerId : ACTOR)
            .incrementRetry()
            .nextRetryAt(nextRetryAt)
            .lastError(describe(failure))
            .partialResults(failure.partialResults())
            .releaseLease()
            .build());
        if (!moved) {
            return FailureOutcome.IGNORED;
        }

        eventEmitter.emit(item.workflowId(), new EventData.RetryScheduled(
            attempt, item.maxRetries(), nextRetryAt, delay.toSeconds(), failure.message()));
        eventEmitter.recordMetric(item.workflowId(), "retry", "retry.scheduled", delay.toSeconds(),
            Map.of("retry_count", attempt));

        log.info("Workflow {} failed transiently ({}), retry {} of {} at {}",
            item.workflowId(), describe(failure), attempt, item.maxRetries(), nextRetryAt);
        return FailureOutcome.RETRY_SCHEDULED;
    }

    private FailureOutcome deadLetter(WorkflowItem item, String workerId, WorkFailure failure,
                                      boolean consumeRetry) {
        TransitionRequest.Builder request = TransitionRequest
            .builder(item.workflowId(), WorkflowState.PROCESSING, WorkflowState.FAILED)
            .reason(consumeRetry ? "retries exhausted" : "permanent failure")
            .metadata(errorMetadata(failure))
            .actor(workerId != null ? workerId : ACTOR)
            .lastError(describe(failure))
            .partialResults(failure.partialResults())
            .clearNextRetryAt()
            .releaseLease();
        if (consumeRetry) {
            request.incrementRetry();
        }
        if (!transitionEngine.transition(request.build())) {
            return FailureOutcome.IGNORED;
        }

        Map<String, Object> details = new LinkedHashMap<>(failure.details());
        details.put("code", failure.code());
        details.put("kind", failure.kind().name());
        details.put("retry_count", consumeRetry ? item.retryCount() + 1 : item.retryCount());
        details.put("stage", item.stage());
        // Snapshot the row as written by the transition; fall back to the locked copy
        WorkflowItem failed = itemRepository.findById(item.workflowId()).orElse(item);
        deadLetterStore.record(item.workflowId(), failed.toSnapshot(), failure.message(), details);
        eventEmitter.recordMetric(item.workflowId(), "failure", "deadletter.recorded", 1,
            Map.of("kind", failure.kind().name()));

        log.warn("Workflow {} dead-lettered after {} ({})",
            item.workflowId(), consumeRetry ? "exhausting retries" : "permanent failure", describe(failure));
        return FailureOutcome.DEAD_LETTERED;
    }

    private FailureOutcome parkForQuota(WorkflowItem item, String workerId, WorkFailure failure, Instant now) {
        String serviceName = failure.serviceName();
        List<String> quotaTypes = List.of();
        Instant resumeAt = failure.retryAfter();
        if (serviceName != null) {
            quotaTypes = quotaTracker.exceededQuotaTypes(serviceName);
            if (resumeAt == null) {
                resumeAt = quotaTracker.resumeAt(serviceName).orElse(null);
            }
        }
        if (resumeAt == null || resumeAt.isBefore(now)) {
            resumeAt = now.plus(backoffPolicy.baseDelay());
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("quota_exceeded_at", now.toString());
        metadata.put("estimated_wait_seconds", Duration.between(now, resumeAt).toSeconds());
        metadata.put("last_stage_attempted", item.stage());
        metadata.put("can_resume", true);

        boolean moved = transitionEngine.transition(TransitionRequest
            .builder(item.workflowId(), WorkflowState.PROCESSING, WorkflowState.QUOTA_EXCEEDED)
            .reason("quota exceeded")
            .metadata(metadata)
            .actor(workerId != null ? workerId : ACTOR)
            .nextRetryAt(resumeAt)
            .lastError(describe(failure))
            .partialResults(failure.partialResults())
            .releaseLease()
            .build());
        if (!moved) {
            return FailureOutcome.IGNORED;
        }

        eventEmitter.emit(item.workflowId(),
            new EventData.QuotaExceeded(serviceName, quotaTypes, resumeAt, item.stage()));
        eventEmitter.recordMetric(item.workflowId(), "quota", "quota.exceeded", 1,
            serviceName != null ? Map.of("service_name", serviceName) : Map.of());

        log.warn("Workflow {} parked for quota of service={} types={}, resume at {}",
            item.workflowId(), serviceName, quotaTypes, resumeAt);
        return FailureOutcome.QUOTA_WAIT;
    }

    private static Map<String, Object> resumeMetadata(String stage) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("last_stage_attempted", stage);
        metadata.put("can_resume", true);
        return metadata;
    }

    private static Map<String, Object> errorMetadata(WorkFailure failure) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("error_kind", failure.kind().name());
        if (failure.code() != null) {
            metadata.put("error_code", failure.code());
        }
        return metadata;
    }

    private static String describe(WorkFailure failure) {
        return failure.code() != null ? "[" + failure.code() + "] " + failure.message() : failure.message();
    }
}
