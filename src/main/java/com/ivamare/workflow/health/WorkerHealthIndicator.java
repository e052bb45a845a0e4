package com.ivamare.workflow.health;

import com.ivamare.workflow.worker.Worker;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reports each workflow worker as {@code idle}, {@code busy}, {@code degraded} or
 * {@code stopped}. A worker is degraded once its consecutive store errors reach the
 * configured threshold.
 */
public class WorkerHealthIndicator implements HealthIndicator {

    static final int DEFAULT_ERROR_THRESHOLD = 5;

    private final List<Worker> workers;
    private final int errorThreshold;

    public WorkerHealthIndicator(List<Worker> workers) {
        this(workers, DEFAULT_ERROR_THRESHOLD);
    }

    public WorkerHealthIndicator(List<Worker> workers, int errorThreshold) {
        this.workers = workers != null ? workers : List.of();
        this.errorThreshold = errorThreshold;
    }

    @Override
    public Health health() {
        if (workers.isEmpty()) {
            return Health.unknown()
                .withDetail("message", "No workers registered")
                .build();
        }

        Map<String, WorkerStatus> statuses = new LinkedHashMap<>();
        List<String> unhealthy = new ArrayList<>();
        int totalInFlight = 0;
        int maxErrors = 0;

        for (Worker worker : workers) {
            WorkerStatus status = statusOf(worker);
            statuses.putIfAbsent(worker.workerId(), status);
            totalInFlight += status.inFlight();
            maxErrors = Math.max(maxErrors, status.consecutiveErrors());
            if ("stopped".equals(status.state()) || "degraded".equals(status.state())) {
                unhealthy.add(worker.workerId());
            }
        }

        Health.Builder builder = unhealthy.isEmpty() ? Health.up() : Health.down();
        if (!unhealthy.isEmpty()) {
            builder.withDetail("unhealthyWorkers", unhealthy);
        }
        return builder
            .withDetail("workers", statuses)
            .withDetail("totalInFlight", totalInFlight)
            .withDetail("maxConsecutiveErrors", maxErrors)
            .withDetail("errorThreshold", errorThreshold)
            .build();
    }

    private WorkerStatus statusOf(Worker worker) {
        int inFlight = worker.inFlightCount();
        int errors = worker.getConsecutiveErrorCount();
        String state;
        if (!worker.isRunning()) {
            state = "stopped";
        } else if (errors >= errorThreshold) {
            state = "degraded";
        } else {
            state = inFlight > 0 ? "busy" : "idle";
        }
        return new WorkerStatus(state, inFlight, errors);
    }

    record WorkerStatus(String state, int inFlight, int consecutiveErrors) {}
}
