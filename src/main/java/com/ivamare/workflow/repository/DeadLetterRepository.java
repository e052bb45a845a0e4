package com.ivamare.workflow.repository;

import com.ivamare.workflow.model.DeadLetterEntry;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for dead-letter entries, one per workflow item.
 */
public interface DeadLetterRepository {

    /**
     * Insert an entry, or bump {@code failure_count} and overwrite the snapshot and
     * error of the existing entry for the same workflow. A new failure reopens a
     * resolved entry; the earlier resolution is kept in {@code resolution_notes} and
     * under {@code previous_resolution} in the error details.
     *
     * @return The entry as stored
     */
    DeadLetterEntry upsert(UUID workflowId, Map<String, Object> originalData, String errorMessage,
                           Map<String, Object> errorDetails, Instant now);

    Optional<DeadLetterEntry> findById(UUID deadletterId);

    Optional<DeadLetterEntry> findByWorkflowId(UUID workflowId);

    List<DeadLetterEntry> findUnresolved(int limit, int offset);

    long countUnresolved();

    /**
     * Mark an unresolved entry as resolved.
     *
     * @return true if the entry was updated
     */
    boolean markResolved(UUID deadletterId, String notes, Instant now);
}
