package com.ivamare.workflow.model;

import java.time.Instant;
import java.util.Map;

/**
 * Failure reported for an item a worker was processing.
 *
 * @param kind Failure classification
 * @param code Short error code
 * @param message Human-readable message
 * @param details Additional error context
 * @param retryAfter Earliest resume time for quota failures (nullable)
 * @param serviceName Service whose quota was exhausted, for quota failures (nullable)
 * @param partialResults Results to keep for a later resume (nullable)
 */
public record WorkFailure(
    FailureKind kind,
    String code,
    String message,
    Map<String, Object> details,
    Instant retryAfter,
    String serviceName,
    Map<String, Object> partialResults
) {
    public WorkFailure {
        details = details != null ? Map.copyOf(details) : Map.of();
        partialResults = partialResults != null ? partialResults : Map.of();
    }

    public static WorkFailure transientFailure(String code, String message) {
        return new WorkFailure(FailureKind.TRANSIENT, code, message, Map.of(), null, null, null);
    }

    public static WorkFailure transientFailure(String code, String message, Map<String, Object> details) {
        return new WorkFailure(FailureKind.TRANSIENT, code, message, details, null, null, null);
    }

    public static WorkFailure permanent(String code, String message) {
        return new WorkFailure(FailureKind.PERMANENT, code, message, Map.of(), null, null, null);
    }

    public static WorkFailure permanent(String code, String message, Map<String, Object> details) {
        return new WorkFailure(FailureKind.PERMANENT, code, message, details, null, null, null);
    }

    public static WorkFailure quota(String serviceName, String message, Instant retryAfter,
                                    Map<String, Object> partialResults) {
        return new WorkFailure(FailureKind.QUOTA, "QUOTA_EXCEEDED", message, Map.of(), retryAfter,
            serviceName, partialResults);
    }
}
