package com.ivamare.workflow.worker;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Worker that claims queued workflow items and runs them through a handler.
 *
 * <p>Example:
 * <pre>
 * Worker worker = Worker.builder()
 *     .workerId("scorer-1")
 *     .queue(queue)
 *     .retryScheduler(retryScheduler)
 *     .leaseManager(leaseManager)
 *     .quotaTracker(quotaTracker)
 *     .handler((item, ctx) -&gt; HandlerResult.completed())
 *     .concurrency(4)
 *     .build();
 *
 * worker.start();
 * // ... later
 * worker.stop(Duration.ofSeconds(30));
 * </pre>
 */
public interface Worker {

    /**
     * Start polling for work.
     */
    void start();

    /**
     * Stop claiming new items and wait for in-flight items within the timeout.
     *
     * @param timeout Maximum time to wait for in-flight items
     * @return Future that completes when the worker has stopped
     */
    CompletableFuture<Void> stop(Duration timeout);

    /**
     * Stop immediately without waiting. Leases of interrupted items expire and the
     * items are recovered by another worker.
     */
    void stopNow();

    boolean isRunning();

    /**
     * Number of items currently being processed.
     */
    int inFlightCount();

    /**
     * Identifier used as lease holder.
     */
    String workerId();

    /**
     * Consecutive store errors since the last successful poll.
     */
    int getConsecutiveErrorCount();

    static WorkerBuilder builder() {
        return new WorkerBuilder();
    }
}
