package com.ivamare.workflow.model;

import java.time.Instant;

/**
 * Configured limit for one quota type of a service.
 *
 * @param serviceName External service name (e.g. "gemini")
 * @param quotaType Quota type (e.g. "tokens_per_minute")
 * @param limitValue Maximum units per window
 * @param windowSeconds Window length in seconds
 * @param active Inactive limits are ignored by exceeded checks
 * @param createdAt When the limit was created
 * @param updatedAt When the limit was last updated
 */
public record QuotaLimit(
    String serviceName,
    String quotaType,
    long limitValue,
    int windowSeconds,
    boolean active,
    Instant createdAt,
    Instant updatedAt
) {
    public static QuotaLimit create(String serviceName, QuotaType quotaType, long limitValue) {
        Instant now = Instant.now();
        return new QuotaLimit(serviceName, quotaType.getValue(), limitValue,
            (int) quotaType.getWindow().toSeconds(), true, now, now);
    }

    public static QuotaLimit create(String serviceName, String quotaType, long limitValue, int windowSeconds) {
        Instant now = Instant.now();
        return new QuotaLimit(serviceName, quotaType, limitValue, windowSeconds, true, now, now);
    }
}
