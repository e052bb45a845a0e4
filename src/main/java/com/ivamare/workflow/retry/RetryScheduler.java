package com.ivamare.workflow.retry;

import com.ivamare.workflow.model.WorkFailure;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Decides what happens to an item after a failed or interrupted attempt.
 */
public interface RetryScheduler {

    /**
     * Handle a failure reported by the worker processing an item.
     *
     * <p>Transient failures are requeued with exponential backoff until the retry
     * budget is spent, then dead-lettered. Permanent failures are dead-lettered at
     * once. Quota failures park the item until the quota resets without consuming
     * a retry. All changes for one failure commit together.
     *
     * @param workflowId The item
     * @param workerId The worker holding the lease (nullable to skip the holder check)
     * @param failure The failure
     * @return What was done
     */
    FailureOutcome onFailure(UUID workflowId, String workerId, WorkFailure failure);

    /**
     * Park an item whose attempt completed some stages, keeping its partial results.
     *
     * @param workflowId The item
     * @param workerId The worker holding the lease
     * @param stage Last stage attempted
     * @param partialResults Results to resume from
     * @param resumeAt Earliest resume time (nullable for immediately)
     * @return true if the item was parked
     */
    boolean onPartialProgress(UUID workflowId, String workerId, String stage,
                              Map<String, Object> partialResults, Instant resumeAt);

    /**
     * Requeue parked items (quota_exceeded, partially_processed) whose wait is over.
     *
     * @param limit Maximum number of items to requeue
     * @return Number of items requeued
     */
    int requeueEligible(int limit);

    /**
     * Take over items whose worker lease went stale and treat the lost attempt as a
     * transient failure.
     *
     * @param workerId The worker taking over
     * @param leaseTimeoutSeconds Lease timeout
     * @param limit Maximum number of items to recover
     * @return Number of items recovered
     */
    int recoverStaleLeases(String workerId, long leaseTimeoutSeconds, int limit);
}
