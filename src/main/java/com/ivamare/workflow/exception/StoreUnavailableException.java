package com.ivamare.workflow.exception;

/**
 * Raised when the backing store cannot be reached or the transaction was rolled
 * back for a transient reason. The operation had no effect and may be retried.
 */
public class StoreUnavailableException extends WorkflowException {

    private final String reason;

    public StoreUnavailableException(String operation, Throwable cause) {
        super("Store unavailable during " + operation + ": " + cause.getMessage(), cause);
        this.reason = DatabaseExceptionClassifier.getTransientReason(cause);
    }

    /**
     * Brief description of the transient condition, for logging.
     */
    public String getReason() {
        return reason;
    }
}
