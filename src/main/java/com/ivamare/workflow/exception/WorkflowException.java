package com.ivamare.workflow.exception;

/**
 * Base exception for all workflow engine errors.
 */
public class WorkflowException extends RuntimeException {

    public WorkflowException(String message) {
        super(message);
    }

    public WorkflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
