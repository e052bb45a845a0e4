package com.ivamare.workflow.worker;

import com.ivamare.workflow.api.WorkflowQueue;
import com.ivamare.workflow.exception.QuotaExceededException;
import com.ivamare.workflow.lease.LeaseManager;
import com.ivamare.workflow.model.QuotaType;
import com.ivamare.workflow.model.QuotaUsage;
import com.ivamare.workflow.quota.QuotaThrottle;
import com.ivamare.workflow.quota.QuotaTracker;

import java.time.Clock;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

/**
 * Services available to a handler while it processes one item.
 */
public class WorkContext {

    private final UUID workflowId;
    private final String workerId;
    private final long leaseTimeoutSeconds;
    private final WorkflowQueue queue;
    private final LeaseManager leaseManager;
    private final QuotaTracker quotaTracker;
    private final QuotaThrottle quotaThrottle;
    private final Clock clock;

    public WorkContext(
            UUID workflowId,
            String workerId,
            long leaseTimeoutSeconds,
            WorkflowQueue queue,
            LeaseManager leaseManager,
            QuotaTracker quotaTracker,
            QuotaThrottle quotaThrottle,
            Clock clock) {
        this.workflowId = workflowId;
        this.workerId = workerId;
        this.leaseTimeoutSeconds = leaseTimeoutSeconds;
        this.queue = queue;
        this.leaseManager = leaseManager;
        this.quotaTracker = quotaTracker;
        this.quotaThrottle = quotaThrottle;
        this.clock = clock;
    }

    public UUID workflowId() {
        return workflowId;
    }

    public String workerId() {
        return workerId;
    }

    /**
     * Renew the lease for long-running work.
     *
     * @return false if the lease was lost to another worker
     */
    public boolean renewLease() {
        return leaseManager.acquireLease(workflowId, workerId, leaseTimeoutSeconds);
    }

    /**
     * Check the service quota and take a request ticket before a quota-bound call.
     *
     * @param serviceName The service about to be called
     * @param maxWait Maximum time to wait for a request ticket
     * @throws QuotaExceededException if the quota is exhausted or no ticket is available in time
     */
    public void acquireQuota(String serviceName, Duration maxWait) {
        quotaTracker.checkQuota(serviceName);
        if (quotaThrottle != null && !quotaThrottle.tryAcquire(serviceName, maxWait)) {
            throw new QuotaExceededException(serviceName,
                List.of(QuotaType.REQUESTS_PER_MINUTE.getValue()),
                clock.instant().truncatedTo(ChronoUnit.MINUTES).plus(1, ChronoUnit.MINUTES));
        }
    }

    /**
     * Report usage of a service after a call.
     */
    public void recordUsage(String serviceName, QuotaUsage usage) {
        quotaTracker.recordUsage(serviceName, usage, workflowId);
    }

    /**
     * Record that a stage finished.
     */
    public void stageCompleted(String stage, double progressPercentage) {
        queue.reportStageCompleted(workflowId, stage, progressPercentage);
    }
}
