package com.ivamare.workflow;

import com.ivamare.workflow.api.WorkflowQueue;
import com.ivamare.workflow.health.WorkerHealthIndicator;
import com.ivamare.workflow.lease.LeaseManager;
import com.ivamare.workflow.quota.QuotaThrottle;
import com.ivamare.workflow.quota.QuotaTracker;
import com.ivamare.workflow.retry.RetryScheduler;
import com.ivamare.workflow.worker.Worker;
import com.ivamare.workflow.worker.WorkflowHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

import jakarta.annotation.PreDestroy;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Auto-start configuration for workers.
 *
 * <p>Enable with:
 * <pre>
 * workflow:
 *   worker:
 *     auto-start: true
 * </pre>
 *
 * <p>One worker is started for the application's {@link WorkflowHandler} bean.
 */
@Configuration
@ConditionalOnProperty(prefix = "workflow.worker", name = "auto-start", havingValue = "true")
public class WorkerAutoStartConfiguration {

    private static final Logger log = LoggerFactory.getLogger(WorkerAutoStartConfiguration.class);

    private final List<Worker> workers = new ArrayList<>();
    private final WorkflowQueue queue;
    private final RetryScheduler retryScheduler;
    private final LeaseManager leaseManager;
    private final QuotaTracker quotaTracker;
    private final ObjectProvider<QuotaThrottle> quotaThrottle;
    private final ObjectProvider<WorkflowHandler> handler;
    private final Clock clock;
    private final WorkflowEngineProperties properties;

    public WorkerAutoStartConfiguration(
            WorkflowQueue queue,
            RetryScheduler retryScheduler,
            LeaseManager leaseManager,
            QuotaTracker quotaTracker,
            ObjectProvider<QuotaThrottle> quotaThrottle,
            ObjectProvider<WorkflowHandler> handler,
            Clock clock,
            WorkflowEngineProperties properties) {
        this.queue = queue;
        this.retryScheduler = retryScheduler;
        this.leaseManager = leaseManager;
        this.quotaTracker = quotaTracker;
        this.quotaThrottle = quotaThrottle;
        this.handler = handler;
        this.clock = clock;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startWorkers() {
        WorkflowHandler workflowHandler = handler.getIfUnique();
        if (workflowHandler == null) {
            log.warn("No unique WorkflowHandler bean registered, no worker to start");
            return;
        }

        WorkflowEngineProperties.WorkerProperties wp = properties.getWorker();

        Worker worker = Worker.builder()
            .workerId(resolveWorkerId(wp.getWorkerId()))
            .queue(queue)
            .retryScheduler(retryScheduler)
            .leaseManager(leaseManager)
            .quotaTracker(quotaTracker)
            .quotaThrottle(quotaThrottle.getIfAvailable())
            .handler(workflowHandler)
            .clock(clock)
            .leaseTimeoutSeconds(properties.getLease().getTimeoutSeconds())
            .pollIntervalMs(wp.getPollIntervalMs())
            .concurrency(wp.getConcurrency())
            .maintenanceIntervalMs(wp.getMaintenanceIntervalMs())
            .maintenanceBatchSize(wp.getMaintenanceBatchSize())
            .resilience(wp.getResilience())
            .build();

        worker.start();
        workers.add(worker);

        log.info("Started worker {}", worker.workerId());
    }

    @PreDestroy
    public void stopWorkers() {
        if (workers.isEmpty()) {
            return;
        }

        log.info("Stopping {} workers...", workers.size());

        workers.forEach(w -> w.stop(Duration.ofSeconds(30)));

        log.info("All workers stopped");
    }

    @Bean
    public List<Worker> workflowWorkers() {
        return workers;
    }

    @Bean
    public HealthIndicator workerHealthIndicator() {
        return new WorkerHealthIndicator(workers,
            properties.getWorker().getResilience().getErrorThreshold());
    }

    static String resolveWorkerId(String configured) {
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        try {
            return InetAddress.getLocalHost().getHostName() + "-" + suffix;
        } catch (UnknownHostException e) {
            log.debug("Host name unavailable, using generated worker id: {}", e.getMessage());
            return "worker-" + suffix;
        }
    }
}
