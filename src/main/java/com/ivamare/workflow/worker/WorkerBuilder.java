package com.ivamare.workflow.worker;

import com.ivamare.workflow.WorkflowEngineProperties.ResilienceProperties;
import com.ivamare.workflow.api.WorkflowQueue;
import com.ivamare.workflow.lease.LeaseManager;
import com.ivamare.workflow.quota.QuotaThrottle;
import com.ivamare.workflow.quota.QuotaTracker;
import com.ivamare.workflow.retry.RetryScheduler;
import com.ivamare.workflow.worker.impl.DefaultWorkflowWorker;

import java.time.Clock;

/**
 * Builder for creating Worker instances.
 */
public class WorkerBuilder {

    private String workerId;
    private WorkflowQueue queue;
    private RetryScheduler retryScheduler;
    private LeaseManager leaseManager;
    private QuotaTracker quotaTracker;
    private QuotaThrottle quotaThrottle;
    private WorkflowHandler handler;
    private Clock clock = Clock.systemUTC();
    private long leaseTimeoutSeconds = 300;
    private int pollIntervalMs = 1000;
    private int concurrency = 1;
    private long maintenanceIntervalMs = 30000;
    private int maintenanceBatchSize = 100;
    private ResilienceProperties resilience = new ResilienceProperties();

    /**
     * Set the lease holder identifier.
     *
     * @param workerId The worker id
     * @return this builder
     */
    public WorkerBuilder workerId(String workerId) {
        this.workerId = workerId;
        return this;
    }

    public WorkerBuilder queue(WorkflowQueue queue) {
        this.queue = queue;
        return this;
    }

    public WorkerBuilder retryScheduler(RetryScheduler retryScheduler) {
        this.retryScheduler = retryScheduler;
        return this;
    }

    public WorkerBuilder leaseManager(LeaseManager leaseManager) {
        this.leaseManager = leaseManager;
        return this;
    }

    public WorkerBuilder quotaTracker(QuotaTracker quotaTracker) {
        this.quotaTracker = quotaTracker;
        return this;
    }

    /**
     * Set the request throttle (optional).
     *
     * @param quotaThrottle The throttle
     * @return this builder
     */
    public WorkerBuilder quotaThrottle(QuotaThrottle quotaThrottle) {
        this.quotaThrottle = quotaThrottle;
        return this;
    }

    /**
     * Set the handler that processes claimed items.
     *
     * @param handler The handler
     * @return this builder
     */
    public WorkerBuilder handler(WorkflowHandler handler) {
        this.handler = handler;
        return this;
    }

    public WorkerBuilder clock(Clock clock) {
        this.clock = clock;
        return this;
    }

    /**
     * Set the lease timeout in seconds (default: 300).
     *
     * @param seconds Lease timeout in seconds
     * @return this builder
     */
    public WorkerBuilder leaseTimeoutSeconds(long seconds) {
        this.leaseTimeoutSeconds = seconds;
        return this;
    }

    /**
     * Set the poll interval in milliseconds (default: 1000).
     *
     * @param ms Poll interval in milliseconds
     * @return this builder
     */
    public WorkerBuilder pollIntervalMs(int ms) {
        this.pollIntervalMs = ms;
        return this;
    }

    /**
     * Set the concurrency level (default: 1).
     *
     * @param concurrency Number of concurrent handlers
     * @return this builder
     */
    public WorkerBuilder concurrency(int concurrency) {
        this.concurrency = concurrency;
        return this;
    }

    /**
     * Set the interval between requeue and stale lease recovery runs (default: 30000).
     *
     * @param ms Interval in milliseconds
     * @return this builder
     */
    public WorkerBuilder maintenanceIntervalMs(long ms) {
        this.maintenanceIntervalMs = ms;
        return this;
    }

    public WorkerBuilder maintenanceBatchSize(int size) {
        this.maintenanceBatchSize = size;
        return this;
    }

    public WorkerBuilder resilience(ResilienceProperties resilience) {
        this.resilience = resilience;
        return this;
    }

    /**
     * Build the worker instance.
     *
     * @return configured Worker
     * @throws IllegalStateException if required properties not set
     */
    public Worker build() {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalStateException("workerId is required");
        }
        if (queue == null) {
            throw new IllegalStateException("queue is required");
        }
        if (retryScheduler == null) {
            throw new IllegalStateException("retryScheduler is required");
        }
        if (leaseManager == null) {
            throw new IllegalStateException("leaseManager is required");
        }
        if (quotaTracker == null) {
            throw new IllegalStateException("quotaTracker is required");
        }
        if (handler == null) {
            throw new IllegalStateException("handler is required");
        }
        if (concurrency < 1) {
            throw new IllegalStateException("concurrency must be at least 1");
        }

        return new DefaultWorkflowWorker(
            workerId,
            queue,
            retryScheduler,
            leaseManager,
            quotaTracker,
            quotaThrottle,
            handler,
            clock,
            leaseTimeoutSeconds,
            pollIntervalMs,
            concurrency,
            maintenanceIntervalMs,
            maintenanceBatchSize,
            resilience
        );
    }
}
