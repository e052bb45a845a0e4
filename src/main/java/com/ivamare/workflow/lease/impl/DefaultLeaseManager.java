package com.ivamare.workflow.lease.impl;

import com.ivamare.workflow.events.EventEmitter;
import com.ivamare.workflow.exception.DatabaseExceptionClassifier;
import com.ivamare.workflow.lease.LeaseManager;
import com.ivamare.workflow.model.EventData;
import com.ivamare.workflow.model.WorkflowItem;
import com.ivamare.workflow.repository.WorkflowItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Default implementation of LeaseManager.
 */
public class DefaultLeaseManager implements LeaseManager {

    private static final Logger log = LoggerFactory.getLogger(DefaultLeaseManager.class);

    private final WorkflowItemRepository itemRepository;
    private final EventEmitter eventEmitter;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public DefaultLeaseManager(
            WorkflowItemRepository itemRepository,
            EventEmitter eventEmitter,
            TransactionTemplate transactionTemplate,
            Clock clock) {
        this.itemRepository = itemRepository;
        this.eventEmitter = eventEmitter;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    @Override
    public boolean acquireLease(UUID workflowId, String workerId, long timeoutSeconds) {
        try {
            Boolean acquired = transactionTemplate.execute(status -> {
                if (!itemRepository.acquireLease(workflowId, workerId, clock.instant(), timeoutSeconds)) {
                    return false;
                }
                eventEmitter.emit(workflowId, new EventData.LeaseChanged(workerId, true));
                return true;
            });
            boolean result = Boolean.TRUE.equals(acquired);
            if (result) {
                log.debug("Worker {} holds lease on workflow {}", workerId, workflowId);
            } else {
                log.debug("Lease on workflow {} denied to worker {}", workflowId, workerId);
            }
            return result;
        } catch (DataAccessException e) {
            throw DatabaseExceptionClassifier.translate("acquireLease", e);
        }
    }

    @Override
    public boolean releaseLease(UUID workflowId, String workerId) {
        try {
            Boolean released = transactionTemplate.execute(status -> {
                if (!itemRepository.releaseLease(workflowId, workerId)) {
                    return false;
                }
                eventEmitter.emit(workflowId, new EventData.LeaseChanged(workerId, false));
                return true;
            });
            if (!Boolean.TRUE.equals(released)) {
                log.debug("Worker {} does not hold lease on workflow {}", workerId, workflowId);
                return false;
            }
            return true;
        } catch (DataAccessException e) {
            throw DatabaseExceptionClassifier.translate("releaseLease", e);
        }
    }

    @Override
    public List<WorkflowItem> findExpiredLeases(long timeoutSeconds, int limit) {
        return itemRepository.findExpiredLeases(clock.instant(), timeoutSeconds, limit);
    }
}
