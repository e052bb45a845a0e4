package com.ivamare.workflow.deadletter.impl;

import com.ivamare.workflow.deadletter.DeadLetterStore;
import com.ivamare.workflow.events.EventEmitter;
import com.ivamare.workflow.exception.DatabaseExceptionClassifier;
import com.ivamare.workflow.exception.DeadLetterNotFoundException;
import com.ivamare.workflow.exception.InvalidOperationException;
import com.ivamare.workflow.model.DeadLetterEntry;
import com.ivamare.workflow.model.EventData;
import com.ivamare.workflow.repository.DeadLetterRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Default implementation of DeadLetterStore.
 */
public class DefaultDeadLetterStore implements DeadLetterStore {

    private static final Logger log = LoggerFactory.getLogger(DefaultDeadLetterStore.class);

    private final DeadLetterRepository repository;
    private final EventEmitter eventEmitter;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public DefaultDeadLetterStore(
            DeadLetterRepository repository,
            EventEmitter eventEmitter,
            TransactionTemplate transactionTemplate,
            Clock clock) {
        this.repository = repository;
        this.eventEmitter = eventEmitter;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    @Override
    public DeadLetterEntry record(UUID workflowId, Map<String, Object> originalData, String errorMessage,
                                  Map<String, Object> errorDetails) {
        try {
            DeadLetterEntry entry = transactionTemplate.execute(status -> {
                DeadLetterEntry stored = repository.upsert(
                    workflowId, originalData, errorMessage, errorDetails, clock.instant());
                eventEmitter.emit(workflowId,
                    new EventData.DeadLettered(stored.deadletterId(), stored.failureCount(), errorMessage));
                return stored;
            });
            log.warn("Dead-lettered workflow {} (failure count {}): {}",
                workflowId, entry.failureCount(), errorMessage);
            return entry;
        } catch (DataAccessException e) {
            throw DatabaseExceptionClassifier.translate("recordDeadLetter", e);
        }
    }

    @Override
    public DeadLetterEntry resolve(UUID deadletterId, String notes) {
        DeadLetterEntry entry = repository.findById(deadletterId)
            .orElseThrow(() -> new DeadLetterNotFoundException(deadletterId));
        if (entry.isResolved()) {
            throw new InvalidOperationException("Dead-letter entry " + deadletterId + " is already resolved");
        }
        if (!repository.markResolved(deadletterId, notes, clock.instant())) {
            throw new InvalidOperationException("Dead-letter entry " + deadletterId + " was resolved concurrently");
        }

        log.info("Resolved dead-letter entry {} for workflow {}", deadletterId, entry.workflowId());
        return repository.findById(deadletterId)
            .orElseThrow(() -> new DeadLetterNotFoundException(deadletterId));
    }

    @Override
    public Optional<DeadLetterEntry> get(UUID deadletterId) {
        return repository.findById(deadletterId);
    }

    @Override
    public Optional<DeadLetterEntry> findByWorkflowId(UUID workflowId) {
        return repository.findByWorkflowId(workflowId);
    }

    @Override
    public List<DeadLetterEntry> listUnresolved(int limit, int offset) {
        return repository.findUnresolved(limit, offset);
    }

    @Override
    public long countUnresolved() {
        return repository.countUnresolved();
    }
}
