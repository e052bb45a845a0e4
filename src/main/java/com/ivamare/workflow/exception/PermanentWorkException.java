package com.ivamare.workflow.exception;

import java.util.Map;

/**
 * Raised for non-retryable failures (invalid input, unsupported content).
 *
 * <p>When a handler throws this exception, the item fails immediately and is
 * dead-lettered without consuming retries.
 */
public class PermanentWorkException extends WorkflowException {

    private final String code;
    private final String errorMessage;
    private final Map<String, Object> details;

    public PermanentWorkException(String code, String message) {
        this(code, message, Map.of());
    }

    public PermanentWorkException(String code, String message, Map<String, Object> details) {
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
