package com.ivamare.workflow;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the workflow engine.
 *
 * <p>Example configuration:
 * <pre>
 * workflow:
 *   enabled: true
 *   retry:
 *     max-retries: 3
 *     base-delay: 5m
 *     multiplier: 2.0
 *   lease:
 *     timeout-seconds: 300
 *   quota:
 *     recency-window: 24h
 *     seed-defaults: true
 *     default-service: gemini
 *     throttle-enabled: false
 *   worker:
 *     auto-start: false
 *     worker-id: scorer-1
 *     poll-interval-ms: 1000
 *     concurrency: 4
 *     maintenance-interval-ms: 30000
 *     maintenance-batch-size: 100
 *     resilience:
 *       initial-backoff-ms: 1000
 *       max-backoff-ms: 30000
 *       backoff-multiplier: 2.0
 *       error-threshold: 5
 * </pre>
 */
@ConfigurationProperties(prefix = "workflow")
public class WorkflowEngineProperties {

    /**
     * Enable/disable workflow engine auto-configuration.
     */
    private boolean enabled = true;

    private RetryProperties retry = new RetryProperties();

    private LeaseProperties lease = new LeaseProperties();

    private QuotaProperties quota = new QuotaProperties();

    private WorkerProperties worker = new WorkerProperties();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public RetryProperties getRetry() {
        return retry;
    }

    public void setRetry(RetryProperties retry) {
        this.retry = retry;
    }

    public LeaseProperties getLease() {
        return lease;
    }

    public void setLease(LeaseProperties lease) {
        this.lease = lease;
    }

    public QuotaProperties getQuota() {
        return quota;
    }

    public void setQuota(QuotaProperties quota) {
        this.quota = quota;
    }

    public WorkerProperties getWorker() {
        return worker;
    }

    public void setWorker(WorkerProperties worker) {
        this.worker = worker;
    }

    /**
     * Retry policy for transient failures.
     */
    public static class RetryProperties {

        /**
         * Retries allowed before an item is dead-lettered.
         */
        private int maxRetries = 3;

        /**
         * Delay before the first retry.
         */
        private Duration baseDelay = Duration.ofMinutes(5);

        /**
         * Multiplier applied to the delay for each further retry.
         */
        private double multiplier = 2.0;

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }
    }

    public static class LeaseProperties {

        /**
         * Seconds after which a lease is considered stale.
         */
        private long timeoutSeconds = 300;

        public long getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(long timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }
    }

    /**
     * Quota tracking configuration.
     */
    public static class QuotaProperties {

        /**
         * Only usage snapshots newer than this are considered current.
         */
        private Duration recencyWindow = Duration.ofHours(24);

        /**
         * Insert the default limits for {@link #defaultService} at startup when missing.
         */
        private boolean seedDefaults = true;

        private String defaultService = "gemini";

        /**
         * Enforce requests_per_minute limits with a shared token bucket.
         */
        private boolean throttleEnabled = false;

        public Duration getRecencyWindow() {
            return recencyWindow;
        }

        public void setRecencyWindow(Duration recencyWindow) {
            this.recencyWindow = recencyWindow;
        }

        public boolean isSeedDefaults() {
            return seedDefaults;
        }

        public void setSeedDefaults(boolean seedDefaults) {
            this.seedDefaults = seedDefaults;
        }

        public String getDefaultService() {
            return defaultService;
        }

        public void setDefaultService(String defaultService) {
            this.defaultService = defaultService;
        }

        public boolean isThrottleEnabled() {
            return throttleEnabled;
        }

        public void setThrottleEnabled(boolean throttleEnabled) {
            this.throttleEnabled = throttleEnabled;
        }
    }

    /**
     * Worker configuration properties.
     */
    public static class WorkerProperties {

        /**
         * Auto-start workers on application ready.
         */
        private boolean autoStart = false;

        /**
         * Lease holder identifier. Generated from the host name when empty.
         */
        private String workerId;

        /**
         * Poll interval in milliseconds.
         */
        private int pollIntervalMs = 1000;

        /**
         * Number of concurrent handlers.
         */
        private int concurrency = 4;

        /**
         * Interval between requeue and stale lease recovery runs.
         */
        private long maintenanceIntervalMs = 30000;

        /**
         * Maximum items handled by one maintenance run.
         */
        private int maintenanceBatchSize = 100;

        /**
         * Resilience configuration for database error recovery.
         */
        private ResilienceProperties resilience = new ResilienceProperties();

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }

        public String getWorkerId() {
            return workerId;
        }

        public void setWorkerId(String workerId) {
            this.workerId = workerId;
        }

        public int getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(int pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }

        public long getMaintenanceIntervalMs() {
            return maintenanceIntervalMs;
        }

        public void setMaintenanceIntervalMs(long maintenanceIntervalMs) {
            this.maintenanceIntervalMs = maintenanceIntervalMs;
        }

        public int getMaintenanceBatchSize() {
            return maintenanceBatchSize;
        }

        public void setMaintenanceBatchSize(int maintenanceBatchSize) {
            this.maintenanceBatchSize = maintenanceBatchSize;
        }

        public ResilienceProperties getResilience() {
            return resilience;
        }

        public void setResilience(ResilienceProperties resilience) {
            this.resilience = resilience;
        }
    }

    /**
     * Backoff for the worker loop after store errors.
     */
    public static class ResilienceProperties {

        /**
         * Initial backoff in milliseconds after the first database error.
         */
        private long initialBackoffMs = 1000;

        /**
         * Cap for the exponential backoff.
         */
        private long maxBackoffMs = 30000;

        private double backoffMultiplier = 2.0;

        /**
         * Consecutive errors before logging at ERROR instead of WARN.
         */
        private int errorThreshold = 5;

        public long getInitialBackoffMs() {
            return initialBackoffMs;
        }

        public void setInitialBackoffMs(long initialBackoffMs) {
            this.initialBackoffMs = initialBackoffMs;
        }

        public long getMaxBackoffMs() {
            return maxBackoffMs;
        }

        public void setMaxBackoffMs(long maxBackoffMs) {
            this.maxBackoffMs = maxBackoffMs;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }

        public int getErrorThreshold() {
            return errorThreshold;
        }

        public void setErrorThreshold(int errorThreshold) {
            this.errorThreshold = errorThreshold;
        }

        /**
         * Calculate the backoff delay for a given error count.
         *
         * @param errorCount the number of consecutive errors (1-based)
         * @return the delay in milliseconds
         */
        public long calculateBackoff(int errorCount) {
            if (errorCount <= 0) {
                return initialBackoffMs;
            }
            double delay = initialBackoffMs * Math.pow(backoffMultiplier, errorCount - 1);
            // +/- 10% jitter
            double jitter = delay * 0.1 * (Math.random() * 2 - 1);
            return Math.min((long) (delay + jitter), maxBackoffMs);
        }
    }
}
