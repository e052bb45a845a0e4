package com.ivamare.workflow.exception;

import java.util.Map;

/**
 * Raised for retryable failures (network, timeout, temporary unavailability).
 *
 * <p>When a handler throws this exception, the item is requeued with exponential
 * backoff. After the retry budget is spent, it is dead-lettered.
 */
public class TransientWorkException extends WorkflowException {

    private final String code;
    private final String errorMessage;
    private final Map<String, Object> details;

    public TransientWorkException(String code, String message) {
        this(code, message, Map.of());
    }

    public TransientWorkException(String code, String message, Map<String, Object> details) {
        super("[" + code + "] " + message);
        this.code = code;
        this.errorMessage = message;
        this.details = details != null ? Map.copyOf(details) : Map.of();
    }

    public String getCode() {
        return code;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
