package com.ivamare.workflow.exception;

import java.util.UUID;

/**
 * Raised when a dead-letter entry does not exist.
 */
public class DeadLetterNotFoundException extends WorkflowException {

    private final UUID deadletterId;

    public DeadLetterNotFoundException(UUID deadletterId) {
        super("Dead-letter entry not found: " + deadletterId);
        this.deadletterId = deadletterId;
    }

    public UUID getDeadletterId() {
        return deadletterId;
    }
}
