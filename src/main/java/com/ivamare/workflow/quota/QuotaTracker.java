package com.ivamare.workflow.quota;

import com.ivamare.workflow.model.QuotaLimit;
import com.ivamare.workflow.model.QuotaUsage;
import com.ivamare.workflow.model.QuotaUsageSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Tracks usage of external service quotas and answers whether work may proceed.
 *
 * <p>Usage is reported by callers as snapshots; the latest snapshot within the
 * recency window is the current usage. No snapshot means the quota is unconstrained.
 */
public interface QuotaTracker {

    /**
     * Append a usage snapshot for a service.
     *
     * @param serviceName Service name (e.g. "gemini")
     * @param usage Usage as computed by the caller
     * @param workflowId Item that consumed the quota (nullable)
     * @return The stored snapshot
     */
    QuotaUsageSnapshot recordUsage(String serviceName, QuotaUsage usage, UUID workflowId);

    /**
     * Most recent snapshot within the recency window.
     */
    Optional<QuotaUsageSnapshot> currentUsage(String serviceName);

    /**
     * True iff the current snapshot reports no remaining units for the quota type
     * and an active limit is configured for it.
     */
    boolean isExceeded(String serviceName, String quotaType);

    /**
     * All quota types of a service that are currently exceeded.
     */
    List<String> exceededQuotaTypes(String serviceName);

    /**
     * Estimated reset time of every exceeded quota type.
     *
     * <p>{@code *_minute} types reset at the start of the next minute, {@code *_day}
     * types at the next UTC midnight, anything else immediately.
     *
     * @return Reset time per exceeded quota type, ordered by type
     */
    Map<String, Instant> estimateResetTime(String serviceName);

    /**
     * Time at which every exceeded quota has reset.
     *
     * @return The latest reset time, or empty if nothing is exceeded
     */
    Optional<Instant> resumeAt(String serviceName);

    /**
     * Fail fast before quota-bound work.
     *
     * @throws com.ivamare.workflow.exception.QuotaExceededException if any quota type is exceeded
     */
    void checkQuota(String serviceName);

    /**
     * Active limits configured for a service.
     */
    List<QuotaLimit> limits(String serviceName);

    /**
     * Create or update a limit.
     */
    void setLimit(QuotaLimit limit);

    /**
     * Insert the default limits for a service, keeping any that already exist.
     *
     * @return Number of limits inserted
     */
    int seedDefaults(String serviceName);
}
