package com.ivamare.workflow.ops;

import com.ivamare.workflow.model.WorkflowState;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Read-only aggregate views over workflow items, transitions and quota usage,
 * for dashboards and operators.
 */
public interface WorkflowInsights {

    /**
     * Number of items in every state. States without items report zero.
     */
    Map<WorkflowState, Long> countsByState();

    /**
     * Queue-to-completion time of items finished since {@code since}, grouped by
     * hour and final state.
     */
    List<HourlyPerformance> performanceByHour(Instant since);

    /**
     * Number of transitions per edge since {@code since}.
     */
    List<TransitionCount> transitionCounts(Instant since);

    /**
     * Items waiting on quota or resume, highest priority first, then oldest.
     */
    List<BacklogItem> quotaExceededBacklog(int limit);

    /**
     * Processing items whose lease is older than the timeout.
     */
    long staleLeaseCount(long timeoutSeconds);

    /**
     * Hourly usage of a service from its usage snapshots.
     */
    List<QuotaUsageSummary> quotaUsageByHour(String serviceName, Instant from, Instant to);

    /**
     * Timing of items that finished within one hour.
     *
     * @param hour Start of the hour
     * @param state Final state
     * @param count Number of items
     * @param avgSeconds Mean queue-to-completion time
     * @param minSeconds Shortest time
     * @param maxSeconds Longest time
     * @param medianSeconds 50th percentile
     * @param p95Seconds 95th percentile
     */
    record HourlyPerformance(
        Instant hour,
        WorkflowState state,
        long count,
        double avgSeconds,
        double minSeconds,
        double maxSeconds,
        double medianSeconds,
        double p95Seconds
    ) {}

    record TransitionCount(WorkflowState fromState, WorkflowState toState, long count) {}

    record BacklogItem(
        UUID workflowId,
        WorkflowState state,
        String stage,
        int priority,
        int quotaExceededCount,
        Instant nextRetryAt,
        Instant queuedAt
    ) {}

    /**
     * Usage of a service within one hour.
     *
     * @param hour Start of the hour
     * @param requests Number of usage snapshots
     * @param totalTokens Sum of reported tokens
     * @param totalCostUsd Sum of reported cost
     * @param avgTokensPerRequest Mean tokens per snapshot
     * @param quotaExceededCount Snapshots from items now parked for quota
     */
    record QuotaUsageSummary(
        Instant hour,
        long requests,
        long totalTokens,
        BigDecimal totalCostUsd,
        double avgTokensPerRequest,
        long quotaExceededCount
    ) {}
}
