package com.ivamare.workflow.model;

import java.math.BigDecimal;
import java.util.Map;
import java.util.TreeMap;

/**
 * Usage report for one external service, as supplied by the caller.
 *
 * <p>The caller computes {@code remaining} per quota type; the tracker stores the
 * report as-is and never sums individual calls.
 *
 * @param quotas Usage per quota type
 * @param costTracking Cumulative cost figures (nullable)
 */
public record QuotaUsage(
    Map<String, QuotaWindowUsage> quotas,
    CostTracking costTracking
) {
    public QuotaUsage {
        quotas = quotas != null ? new TreeMap<>(quotas) : new TreeMap<>();
        costTracking = costTracking != null ? costTracking : CostTracking.EMPTY;
    }

    /**
     * Usage of one quota window.
     *
     * @param used Units consumed in the current window
     * @param limit Configured limit for the window
     * @param remaining Units left; zero or less means exhausted
     */
    public record QuotaWindowUsage(long used, long limit, long remaining) {

        public static QuotaWindowUsage of(long used, long limit) {
            return new QuotaWindowUsage(used, limit, Math.max(limit - used, 0));
        }

        public boolean isExhausted() {
            return remaining <= 0;
        }

        public double percentage() {
            return limit > 0 ? (double) used * 100.0 / limit : 0.0;
        }
    }

    /**
     * Cost and token counters for a service.
     */
    public record CostTracking(
        long totalTokens,
        long inputTokens,
        long outputTokens,
        long imageCount,
        long totalRequests,
        BigDecimal totalCostUsd
    ) {
        public static final CostTracking EMPTY = new CostTracking(0, 0, 0, 0, 0, BigDecimal.ZERO);

        public CostTracking {
            totalCostUsd = totalCostUsd != null ? totalCostUsd : BigDecimal.ZERO;
        }
    }
}
