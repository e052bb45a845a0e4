package com.ivamare.workflow.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Request to move a workflow item from one state to another, together with the
 * item fields that must change atomically with the state.
 *
 * <p>Example:
 * <pre>
 * TransitionRequest request = TransitionRequest.builder(id, WorkflowState.PROCESSING, WorkflowState.QUEUED)
 *     .reason("transient failure")
 *     .incrementRetry()
 *     .nextRetryAt(now.plus(delay))
 *     .releaseLease()
 *     .build();
 * </pre>
 */
public record TransitionRequest(
    UUID workflowId,
    WorkflowState fromState,
    WorkflowState toState,
    String stage,
    String reason,
    Map<String, Object> metadata,
    String actor,
    boolean incrementRetry,
    boolean resetRetries,
    Instant nextRetryAt,
    boolean clearNextRetryAt,
    String lastError,
    Map<String, Object> partialResults,
    boolean releaseLease
) {
    public TransitionRequest {
        Objects.requireNonNull(workflowId, "workflowId");
        Objects.requireNonNull(fromState, "fromState");
        Objects.requireNonNull(toState, "toState");
        metadata = metadata != null ? metadata : Map.of();
        partialResults = partialResults != null ? partialResults : Map.of();
    }

    public static Builder builder(UUID workflowId, WorkflowState fromState, WorkflowState toState) {
        return new Builder(workflowId, fromState, toState);
    }

    /**
     * Plain transition without item field updates.
     */
    public static TransitionRequest of(UUID workflowId, WorkflowState fromState, WorkflowState toState,
                                       String stage, String reason, Map<String, Object> metadata,
                                       String actor) {
        return builder(workflowId, fromState, toState)
            .stage(stage)
            .reason(reason)
            .metadata(metadata)
            .actor(actor)
            .build();
    }

    public static final class Builder {

        private final UUID workflowId;
        private final WorkflowState fromState;
        private final WorkflowState toState;
        private String stage;
        private String reason;
        private Map<String, Object> metadata;
        private String actor;
        private boolean incrementRetry;
        private boolean resetRetries;
        private Instant nextRetryAt;
        private boolean clearNextRetryAt;
        private String lastError;
        private Map<String, Object> partialResults;
        private boolean releaseLease;

        private Builder(UUID workflowId, WorkflowState fromState, WorkflowState toState) {
            this.workflowId = workflowId;
            this.fromState = fromState;
            this.toState = toState;
        }

        public Builder stage(String stage) {
            this.stage = stage;
            return this;
        }

        public Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder actor(String actor) {
            this.actor = actor;
            return this;
        }

        public Builder incrementRetry() {
            this.incrementRetry = true;
            return this;
        }

        public Builder resetRetries() {
            this.resetRetries = true;
            return this;
        }

        public Builder nextRetryAt(Instant nextRetryAt) {
            this.nextRetryAt = nextRetryAt;
            return this;
        }

        public Builder clearNextRetryAt() {
            this.clearNextRetryAt = true;
            return this;
        }

        public Builder lastError(String lastError) {
            this.lastError = lastError;
            return this;
        }

        public Builder partialResults(Map<String, Object> partialResults) {
            this.partialResults = partialResults;
            return this;
        }

        public Builder releaseLease() {
            this.releaseLease = true;
            return this;
        }

        public TransitionRequest build() {
            return new TransitionRequest(workflowId, fromState, toState, stage, reason, metadata, actor,
                incrementRetry, resetRetries, nextRetryAt, clearNextRetryAt, lastError, partialResults,
                releaseLease);
        }
    }
}
