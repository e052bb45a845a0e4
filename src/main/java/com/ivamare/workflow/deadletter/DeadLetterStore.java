package com.ivamare.workflow.deadletter;

import com.ivamare.workflow.model.DeadLetterEntry;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Store of items that exhausted their retries or failed permanently.
 *
 * <p>Entries are keyed by workflow item: a repeated failure of the same item bumps
 * the failure count of its entry instead of creating another one. Resolving an
 * entry is an administrative acknowledgement and never requeues the item.
 */
public interface DeadLetterStore {

    /**
     * Record a failure for an item.
     *
     * @param workflowId The failed item
     * @param originalData Snapshot of the whole item at the time of failure
     * @param errorMessage Error message
     * @param errorDetails Additional error context
     * @return The entry as stored, with its current failure count
     */
    DeadLetterEntry record(UUID workflowId, Map<String, Object> originalData, String errorMessage,
                           Map<String, Object> errorDetails);

    /**
     * Mark an entry as resolved.
     *
     * @param deadletterId The entry ID
     * @param notes Resolution notes
     * @return The resolved entry
     * @throws com.ivamare.workflow.exception.DeadLetterNotFoundException if the entry does not exist
     * @throws com.ivamare.workflow.exception.InvalidOperationException if the entry is already resolved
     */
    DeadLetterEntry resolve(UUID deadletterId, String notes);

    Optional<DeadLetterEntry> get(UUID deadletterId);

    Optional<DeadLetterEntry> findByWorkflowId(UUID workflowId);

    /**
     * Unresolved entries, most recent failure first.
     */
    List<DeadLetterEntry> listUnresolved(int limit, int offset);

    long countUnresolved();
}
