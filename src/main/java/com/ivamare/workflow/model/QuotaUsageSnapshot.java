package com.ivamare.workflow.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Point-in-time quota usage record. Append-only.
 */
public record QuotaUsageSnapshot(
    UUID logId,
    UUID workflowId,
    String serviceName,
    QuotaUsage usage,
    Instant createdAt
) {
}
