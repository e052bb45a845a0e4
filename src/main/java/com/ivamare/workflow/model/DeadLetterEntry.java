package com.ivamare.workflow.model;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Dead-letter record for an item that exhausted retries or failed permanently.
 * One entry per workflow item; repeated failures bump {@code failureCount}.
 */
public record DeadLetterEntry(
    UUID deadletterId,
    UUID workflowId,
    Map<String, Object> originalData,
    String errorMessage,
    Map<String, Object> errorDetails,
    int failureCount,
    Instant lastFailureAt,
    Instant createdAt,
    Instant resolvedAt,
    String resolutionNotes
) {
    public DeadLetterEntry {
        originalData = originalData != null ? originalData : Map.of();
        errorDetails = errorDetails != null ? errorDetails : Map.of();
    }

    public boolean isResolved() {
        return resolvedAt != null;
    }
}
