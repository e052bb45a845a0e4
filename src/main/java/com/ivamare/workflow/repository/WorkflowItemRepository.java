package com.ivamare.workflow.repository;

import com.ivamare.workflow.model.TransitionRequest;
import com.ivamare.workflow.model.WorkflowItem;
import com.ivamare.workflow.model.WorkflowState;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for workflow items.
 *
 * <p>Methods that lock rows must be called inside a transaction.
 */
public interface WorkflowItemRepository {

    /**
     * Insert a new item.
     *
     * @param item The item to insert
     */
    void save(WorkflowItem item);

    /**
     * Find an item by ID without locking.
     *
     * @param workflowId The item ID
     * @return The item, or empty if not found
     */
    Optional<WorkflowItem> findById(UUID workflowId);

    /**
     * Read an item and hold its row lock until the surrounding transaction ends.
     *
     * @param workflowId The item ID
     * @return The item, or empty if not found
     */
    Optional<WorkflowItem> lockById(UUID workflowId);

    /**
     * Apply a state change to a row already locked by the caller.
     *
     * <p>Bumps {@code version} by one, merges metadata into {@code stage_details} and
     * applies the state-entry side effects: {@code queued_at} is set on first entry into
     * queued, {@code processing_started_at} on entry into processing, {@code completed_at}
     * on entry into a terminal state, and entering quota_exceeded from another state
     * increments {@code quota_exceeded_count} and sets {@code last_quota_check}.
     *
     * @param request The transition with optional field updates
     * @param now Current time
     * @return Number of rows updated (0 if the state no longer matches)
     */
    int applyTransition(TransitionRequest request, Instant now);

    /**
     * Lock the next claimable item, skipping rows locked by other transactions.
     *
     * <p>Claimable means queued, due ({@code next_retry_at} null or in the past) and
     * without a live lease, ordered by priority descending, then queued time ascending.
     *
     * @param now Current time
     * @param leaseTimeoutSeconds Age after which a lease is stale
     * @return ID of the locked item, or empty if nothing is claimable
     */
    Optional<UUID> lockNextClaimable(Instant now, long leaseTimeoutSeconds);

    /**
     * Conditionally take the lease: succeeds if unheld, already held by this worker,
     * or held by a lease older than the timeout.
     *
     * @return true if the lease is now held by {@code workerId}
     */
    boolean acquireLease(UUID workflowId, String workerId, Instant now, long timeoutSeconds);

    /**
     * Clear the lease if held by {@code workerId}.
     *
     * @return true if the lease was released
     */
    boolean releaseLease(UUID workflowId, String workerId);

    /**
     * List items by optional state and stage, newest first.
     */
    List<WorkflowItem> find(WorkflowState state, String stage, int limit, int offset);

    /**
     * Count items by optional state and stage.
     */
    long count(WorkflowState state, String stage);

    /**
     * Find parked items (quota_exceeded, partially_processed) whose wait is over.
     *
     * @param now Current time
     * @param limit Maximum number of IDs
     * @return Item IDs with their current state, highest priority first
     */
    List<ParkedItem> findDueForRequeue(Instant now, int limit);

    /**
     * Find processing items whose lease has gone stale.
     */
    List<WorkflowItem> findExpiredLeases(Instant now, long timeoutSeconds, int limit);

    /**
     * Parked item ready to be requeued.
     */
    record ParkedItem(UUID workflowId, WorkflowState state) {}
}
