package com.ivamare.workflow.exception;

/**
 * Thrown when an operation is not valid for the current state of its target.
 */
public class InvalidOperationException extends WorkflowException {

    public InvalidOperationException(String message) {
        super(message);
    }
}
