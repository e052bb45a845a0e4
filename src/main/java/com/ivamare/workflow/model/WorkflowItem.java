package com.ivamare.workflow.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A unit of work tracked by the engine.
 *
 * <p>{@code state} and {@code version} are only ever changed by the state transition
 * engine; lease fields are only changed by the lease manager.
 *
 * @param workflowId Unique identifier
 * @param state Current state
 * @param version Incremented by exactly one on every successful transition
 * @param stage Current processing stage (nullable)
 * @param priority Higher values are claimed first
 * @param retryCount Number of failed attempts so far
 * @param maxRetries Retry budget before dead-lettering
 * @param nextRetryAt Earliest time the item may be claimed again (nullable)
 * @param payload Payload supplied at enqueue time
 * @param stageDetails Metadata merged in by transitions
 * @param partialResults Results from stages completed before an interruption
 * @param quotaExceededCount Number of entries into quota_exceeded
 * @param lastQuotaCheck Time of the last entry into quota_exceeded (nullable)
 * @param leaseHolder Worker currently holding the lease (nullable)
 * @param leaseAcquiredAt Time the lease was taken or renewed (nullable)
 * @param lastError Most recent failure message (nullable)
 * @param createdAt Creation time
 * @param updatedAt Last modification time
 * @param queuedAt First time the item entered queued (nullable)
 * @param processingStartedAt Last entry into processing (nullable)
 * @param completedAt Entry into a terminal state (nullable)
 */
public record WorkflowItem(
    UUID workflowId,
    WorkflowState state,
    int version,
    String stage,
    int priority,
    int retryCount,
    int maxRetries,
    Instant nextRetryAt,
    Map<String, Object> payload,
    Map<String, Object> stageDetails,
    Map<String, Object> partialResults,
    int quotaExceededCount,
    Instant lastQuotaCheck,
    String leaseHolder,
    Instant leaseAcquiredAt,
    String lastError,
    Instant createdAt,
    Instant updatedAt,
    Instant queuedAt,
    Instant processingStartedAt,
    Instant completedAt
) {
    public WorkflowItem {
        payload = payload != null ? payload : Map.of();
        stageDetails = stageDetails != null ? stageDetails : Map.of();
        partialResults = partialResults != null ? partialResults : Map.of();
    }

    /**
     * Create a new item in the created state.
     */
    public static WorkflowItem create(Map<String, Object> payload, int priority, int maxRetries, Instant now) {
        return new WorkflowItem(
            UUID.randomUUID(), WorkflowState.CREATED, 1, null, priority, 0, maxRetries, null,
            payload, Map.of(), Map.of(), 0, null, null, null, null,
            now, now, null, null, null
        );
    }

    /**
     * Check whether the lease is held by a live worker at the given time.
     */
    public boolean hasLiveLease(Instant now, long timeoutSeconds) {
        return leaseHolder != null
            && leaseAcquiredAt != null
            && !leaseAcquiredAt.isBefore(now.minusSeconds(timeoutSeconds));
    }

    /**
     * Full copy of the item as a JSON-ready map, used as the dead-letter snapshot.
     * Timestamps are ISO-8601 strings; unset fields map to null.
     */
    public Map<String, Object> toSnapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("workflow_id", workflowId.toString());
        snapshot.put("state", state.getValue());
        snapshot.put("version", version);
        snapshot.put("stage", stage);
        snapshot.put("priority", priority);
        snapshot.put("retry_count", retryCount);
        snapshot.put("max_retries", maxRetries);
        snapshot.put("next_retry_at", iso(nextRetryAt));
        snapshot.put("payload", payload);
        snapshot.put("stage_details", stageDetails);
        snapshot.put("partial_results", partialResults);
        snapshot.put("quota_exceeded_count", quotaExceededCount);
        snapshot.put("last_quota_check", iso(lastQuotaCheck));
        snapshot.put("lease_holder", leaseHolder);
        snapshot.put("lease_acquired_at", iso(leaseAcquiredAt));
        snapshot.put("last_error", lastError);
        snapshot.put("created_at", iso(createdAt));
        snapshot.put("updated_at", iso(updatedAt));
        snapshot.put("queued_at", iso(queuedAt));
        snapshot.put("processing_started_at", iso(processingStartedAt));
        snapshot.put("completed_at", iso(completedAt));
        return snapshot;
    }

    private static String iso(Instant instant) {
        return instant != null ? instant.toString() : null;
    }

    /**
     * Check whether the retry budget allows another attempt.
     */
    public boolean canRetry() {
        return retryCount < maxRetries;
    }
}
