package com.ivamare.workflow.exception;

import java.util.UUID;

/**
 * Raised when a workflow item does not exist.
 */
public class WorkflowNotFoundException extends WorkflowException {

    private final UUID workflowId;

    public WorkflowNotFoundException(UUID workflowId) {
        super("Workflow item not found: " + workflowId);
        this.workflowId = workflowId;
    }

    public UUID getWorkflowId() {
        return workflowId;
    }
}
