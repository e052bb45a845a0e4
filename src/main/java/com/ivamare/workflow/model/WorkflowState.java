package com.ivamare.workflow.model;

/**
 * State of a workflow item in its lifecycle.
 */
public enum WorkflowState {
    /** Item created, not yet eligible for claiming */
    CREATED("created"),

    /** Waiting for a worker */
    QUEUED("queued"),

    /** Leased and being worked on */
    PROCESSING("processing"),

    /** Successfully completed */
    COMPLETED("completed"),

    /** Retries exhausted or permanent failure; a dead-letter entry exists */
    FAILED("failed"),

    /** Parked until the service quota resets */
    QUOTA_EXCEEDED("quota_exceeded"),

    /** Some stages done, waiting to resume */
    PARTIALLY_PROCESSED("partially_processed"),

    /** Canceled by operator */
    CANCELLED("cancelled");

    private final String value;

    WorkflowState(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Terminal states never leave except through an explicit operator requeue.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public static WorkflowState fromValue(String value) {
        for (WorkflowState state : values()) {
            if (state.value.equals(value)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown WorkflowState: " + value);
    }
}
