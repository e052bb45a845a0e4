package com.ivamare.workflow.model;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Audit record of one successful state change. Append-only.
 */
public record TransitionRecord(
    UUID transitionId,
    UUID workflowId,
    WorkflowState fromState,
    WorkflowState toState,
    String stage,
    String reason,
    Map<String, Object> metadata,
    String actor,
    Instant createdAt
) {
    public TransitionRecord {
        metadata = metadata != null ? metadata : Map.of();
    }
}
