package com.ivamare.workflow.api;

import com.ivamare.workflow.model.TransitionRecord;
import com.ivamare.workflow.model.WorkFailure;
import com.ivamare.workflow.model.WorkflowItem;
import com.ivamare.workflow.model.WorkflowState;
import com.ivamare.workflow.retry.FailureOutcome;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for producers, workers and operators.
 *
 * <p>Example:
 * <pre>
 * UUID id = queue.submit(Map.of("product_id", 42), 5);
 *
 * queue.claimNext("worker-1", 300).ifPresent(item -&gt; {
 *     // do the work outside any transaction
 *     queue.complete(item.workflowId(), "worker-1", Map.of("score", 0.8));
 * });
 * </pre>
 */
public interface WorkflowQueue {

    /**
     * Create an item in the created state with the default retry budget.
     *
     * @param payload Work payload
     * @param priority Higher values are claimed first
     * @return The new item's ID
     */
    UUID enqueue(Map<String, Object> payload, int priority);

    /**
     * Create an item in the created state with a custom retry budget.
     */
    UUID enqueue(Map<String, Object> payload, int priority, int maxRetries);

    /**
     * Create an item and move it to queued in one transaction.
     */
    UUID submit(Map<String, Object> payload, int priority);

    /**
     * Claim the next due queued item: lease it and move it to processing.
     *
     * @param workerId The claiming worker
     * @param leaseTimeoutSeconds Lease timeout
     * @return The claimed item, or empty if nothing is claimable
     */
    Optional<WorkflowItem> claimNext(String workerId, long leaseTimeoutSeconds);

    /**
     * Complete an item processed by {@code workerId} and release its lease.
     *
     * @param resultMetadata Merged into the item's stage details (nullable)
     * @return true if completed, false if the item is not processing under this worker's lease
     */
    boolean complete(UUID workflowId, String workerId, Map<String, Object> resultMetadata);

    /**
     * Report a failed attempt. See {@link com.ivamare.workflow.retry.RetryScheduler#onFailure}.
     */
    FailureOutcome fail(UUID workflowId, String workerId, WorkFailure failure);

    /**
     * Record that a stage finished and how far along the item is.
     */
    void reportStageCompleted(UUID workflowId, String stage, double progressPercentage);

    /**
     * Cancel an item that is not processing and not terminal.
     *
     * @return true if cancelled, false if the state changed concurrently
     * @throws com.ivamare.workflow.exception.InvalidOperationException if the item cannot be cancelled
     */
    boolean cancel(UUID workflowId, String reason, String actor);

    /**
     * Operator retry of a failed item: back to queued with a fresh retry budget.
     *
     * @return true if requeued, false if the state changed concurrently
     * @throws com.ivamare.workflow.exception.InvalidOperationException if the item is not failed
     */
    boolean requeue(UUID workflowId, String actor, String reason);

    Optional<WorkflowItem> get(UUID workflowId);

    /**
     * List items filtered by optional state and stage, newest first.
     */
    List<WorkflowItem> list(WorkflowState state, String stage, int limit, int offset);

    long count(WorkflowState state, String stage);

    /**
     * Transition history of an item, oldest first.
     */
    List<TransitionRecord> history(UUID workflowId);
}
