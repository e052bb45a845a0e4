package com.ivamare.workflow.exception;

import java.time.Instant;
import java.util.List;

/**
 * Raised when a service quota is exhausted.
 *
 * <p>Workers translate this into a quota failure so the item waits for the reset
 * without consuming a retry.
 */
public class QuotaExceededException extends WorkflowException {

    private final String serviceName;
    private final List<String> quotaTypes;
    private final Instant resetAt;

    public QuotaExceededException(String serviceName, List<String> quotaTypes, Instant resetAt) {
        super("Quota exceeded for " + serviceName + " " + quotaTypes
            + (resetAt != null ? ", resets at " + resetAt : ""));
        this.serviceName = serviceName;
        this.quotaTypes = quotaTypes != null ? List.copyOf(quotaTypes) : List.of();
        this.resetAt = resetAt;
    }

    public String getServiceName() {
        return serviceName;
    }

    public List<String> getQuotaTypes() {
        return quotaTypes;
    }

    public Instant getResetAt() {
        return resetAt;
    }
}
