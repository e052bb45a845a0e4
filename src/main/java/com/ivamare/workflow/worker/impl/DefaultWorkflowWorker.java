package com.ivamare.workflow.worker.impl;

import com.ivamare.workflow.WorkflowEngineProperties.ResilienceProperties;
import com.ivamare.workflow.api.WorkflowQueue;
import com.ivamare.workflow.exception.DatabaseExceptionClassifier;
import com.ivamare.workflow.exception.PermanentWorkException;
import com.ivamare.workflow.exception.QuotaExceededException;
import com.ivamare.workflow.exception.TransientWorkException;
import com.ivamare.workflow.lease.LeaseManager;
import com.ivamare.workflow.model.WorkFailure;
import com.ivamare.workflow.model.WorkflowItem;
import com.ivamare.workflow.quota.QuotaThrottle;
import com.ivamare.workflow.quota.QuotaTracker;
import com.ivamare.workflow.retry.FailureOutcome;
import com.ivamare.workflow.retry.RetryScheduler;
import com.ivamare.workflow.worker.HandlerResult;
import com.ivamare.workflow.worker.WorkContext;
import com.ivamare.workflow.worker.Worker;
import com.ivamare.workflow.worker.WorkflowHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Polling worker backed by a fixed thread pool.
 *
 * <p>One thread runs the claim loop. The remaining {@code concurrency} threads run
 * handlers. Between polls the loop requeues parked items whose wait is over and
 * recovers items whose lease went stale.
 */
public class DefaultWorkflowWorker implements Worker {

    private static final Logger log = LoggerFactory.getLogger(DefaultWorkflowWorker.class);

    private final String workerId;
    private final WorkflowQueue queue;
    private final RetryScheduler retryScheduler;
    private final LeaseManager leaseManager;
    private final QuotaTracker quotaTracker;
    private final QuotaThrottle quotaThrottle;
    private final WorkflowHandler handler;
    private final Clock clock;
    private final long leaseTimeoutSeconds;
    private final int pollIntervalMs;
    private final int concurrency;
    private final long maintenanceIntervalMs;
    private final int maintenanceBatchSize;
    private final ResilienceProperties resilience;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private final AtomicInteger inFlightCount = new AtomicInteger(0);
    private final AtomicInteger consecutiveErrors = new AtomicInteger(0);
    private final Semaphore semaphore;

    private volatile long lastMaintenanceAt;
    private ExecutorService executor;

    public DefaultWorkflowWorker(
            String workerId,
            WorkflowQueue queue,
            RetryScheduler retryScheduler,
            LeaseManager leaseManager,
            QuotaTracker quotaTracker,
            QuotaThrottle quotaThrottle,
            WorkflowHandler handler,
            Clock clock,
            long leaseTimeoutSeconds,
            int pollIntervalMs,
            int concurrency,
            long maintenanceIntervalMs,
            int maintenanceBatchSize,
            ResilienceProperties resilience) {
        this.workerId = workerId;
        this.queue = queue;
        this.retryScheduler = retryScheduler;
        this.leaseManager = leaseManager;
        this.quotaTracker = quotaTracker;
        this.quotaThrottle = quotaThrottle;
        this.handler = handler;
        this.clock = clock;
        this.leaseTimeoutSeconds = leaseTimeoutSeconds;
        this.pollIntervalMs = pollIntervalMs;
        this.concurrency = concurrency;
        this.maintenanceIntervalMs = maintenanceIntervalMs;
        this.maintenanceBatchSize = maintenanceBatchSize;
        this.resilience = resilience;
        this.semaphore = new Semaphore(concurrency);
    }

    @Override
    public void start() {
        if (running.getAndSet(true)) {
            log.warn("Worker {} already running", workerId);
            return;
        }

        stopping.set(false);
        executor = Executors.newFixedThreadPool(concurrency + 1, threadFactory());

        log.info("Starting worker {}, concurrency={}, pollIntervalMs={}",
            workerId, concurrency, pollIntervalMs);

        executor.submit(this::runLoop);
    }

    @Override
    public CompletableFuture<Void> stop(Duration timeout) {
        if (!running.get()) {
            return CompletableFuture.completedFuture(null);
        }

        stopping.set(true);
        log.info("Stopping worker {}, waiting for {} in-flight items", workerId, inFlightCount.get());

        return CompletableFuture.runAsync(() -> {
            try {
                long deadline = System.currentTimeMillis() + timeout.toMillis();
                while (inFlightCount.get() > 0 && System.currentTimeMillis() < deadline) {
                    Thread.sleep(100);
                }

                if (inFlightCount.get() > 0) {
                    log.warn("Timeout waiting for {} in-flight items of worker {}",
                        inFlightCount.get(), workerId);
                }

                running.set(false);
                executor.shutdown();

                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }

                log.info("Worker {} stopped", workerId);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
    }

    @Override
    public void stopNow() {
        stopping.set(true);
        running.set(false);
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Override
    public boolean isRunning() {
        return running.get() && !stopping.get();
    }

    @Override
    public int inFlightCount() {
        return inFlightCount.get();
    }

    @Override
    public String workerId() {
        return workerId;
    }

    @Override
    public int getConsecutiveErrorCount() {
        return consecutiveErrors.get();
    }

    // --- Main Processing Loop ---

    private void runLoop() {
        log.debug("Worker loop started for {}", workerId);

        try {
            while (running.get() && !stopping.get()) {
                try {
                    runMaintenanceIfDue();
                    drainQueue();
                    consecutiveErrors.set(0);
                    if (stopping.get()) return;

                    sleep(pollIntervalMs);
                } catch (Exception e) {
                    if (!stopping.get()) {
                        int errors = consecutiveErrors.incrementAndGet();
                        long backoff = resilience.calculateBackoff(errors);

                        if (DatabaseExceptionClassifier.isTransient(e)) {
                            logConnectionError(errors, backoff, e);
                        } else {
                            log.error("Non-transient error in worker loop for {}: {}", workerId, e.getMessage());
                        }

                        sleep(backoff);
                    }
                }
            }
        } finally {
            running.set(false);
            log.debug("Worker loop ended for {}", workerId);
        }
    }

    void runMaintenanceIfDue() {
        long now = clock.millis();
        if (lastMaintenanceAt != 0 && now - lastMaintenanceAt < maintenanceIntervalMs) {
            return;
        }
        lastMaintenanceAt = now;

        int requeued = retryScheduler.requeueEligible(maintenanceBatchSize);
        int recovered = retryScheduler.recoverStaleLeases(workerId, leaseTimeoutSeconds, maintenanceBatchSize);
        if (requeued > 0 || recovered > 0) {
            log.info("Worker {} requeued {} parked items and recovered {} stale leases",
                workerId, requeued, recovered);
        }
    }

    private void logConnectionError(int errorCount, long backoffMs, Exception e) {
        String reason = DatabaseExceptionClassifier.getTransientReason(e);
        String message = "Worker {} database error (count={}, reason={}), backing off {}ms: {}";

        if (errorCount >= resilience.getErrorThreshold()) {
            log.error(message, workerId, errorCount, reason, backoffMs, e.getMessage());
        } else {
            log.warn(message, workerId, errorCount, reason, backoffMs, e.getMessage());
        }
    }

    private void drainQueue() {
        while (running.get() && !stopping.get()) {
            if (semaphore.availablePermits() == 0) {
                waitForSlot();
                continue;
            }

            Optional<WorkflowItem> claimed = queue.claimNext(workerId, leaseTimeoutSeconds);
            if (claimed.isEmpty()) {
                break;
            }

            dispatch(claimed.get());
        }
    }

    private void waitForSlot() {
        try {
            semaphore.acquire();
            semaphore.release();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void dispatch(WorkflowItem item) {
        try {
            semaphore.acquire();
            inFlightCount.incrementAndGet();

            executor.submit(() -> {
                try {
                    process(item);
                } finally {
                    inFlightCount.decrementAndGet();
                    semaphore.release();
                }
            });
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    // --- Item Processing ---

    /**
     * Run the handler for a claimed item and record the outcome.
     */
    void process(WorkflowItem item) {
        log.debug("Processing workflow {} (retry {}/{})",
            item.workflowId(), item.retryCount(), item.maxRetries());

        try {
            WorkContext context = new WorkContext(item.workflowId(), workerId, leaseTimeoutSeconds,
                queue, leaseManager, quotaTracker, quotaThrottle, clock);
            HandlerResult result = runHandler(item, context);
            if (result == null) {
                return;
            }

            if (result.partial()) {
                retryScheduler.onPartialProgress(item.workflowId(), workerId, result.stage(),
                    result.data(), result.resumeAt());
            } else if (!queue.complete(item.workflowId(), workerId, result.data())) {
                log.warn("Worker {} lost workflow {} before completing it", workerId, item.workflowId());
            }
        } catch (RuntimeException e) {
            // Outcome not recorded: the lease expires and the item is recovered later
            log.error("Worker {} failed to record outcome for workflow {}: {}",
                workerId, item.workflowId(), e.getMessage(), e);
        }
    }

    private HandlerResult runHandler(WorkflowItem item, WorkContext context) {
        try {
            HandlerResult result = handler.handle(item, context);
            if (result == null) {
                fail(item, WorkFailure.permanent("NULL_RESULT", "Handler returned no result"));
            }
            return result;
        } catch (QuotaExceededException e) {
            fail(item, WorkFailure.quota(e.getServiceName(), e.getMessage(), e.getResetAt(), Map.of()));
        } catch (TransientWorkException e) {
            fail(item, WorkFailure.transientFailure(e.getCode(), e.getErrorMessage(), e.getDetails()));
        } catch (PermanentWorkException e) {
            fail(item, WorkFailure.permanent(e.getCode(), e.getErrorMessage(), e.getDetails()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail(item, WorkFailure.transientFailure("INTERRUPTED", "Worker interrupted during processing"));
        } catch (Exception e) {
            // Unknown exceptions are retried
            fail(item, WorkFailure.transientFailure("INTERNAL_ERROR", String.valueOf(e.getMessage())));
        }
        return null;
    }

    private void fail(WorkflowItem item, WorkFailure failure) {
        FailureOutcome outcome = queue.fail(item.workflowId(), workerId, failure);
        log.debug("Workflow {} failed with {} [{}]: {}",
            item.workflowId(), failure.kind(), failure.code(), outcome);
    }

    private ThreadFactory threadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "workflow-" + workerId + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
