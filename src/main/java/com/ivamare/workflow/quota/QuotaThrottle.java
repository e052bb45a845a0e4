package com.ivamare.workflow.quota;

import com.ivamare.workflow.model.QuotaLimit;
import com.ivamare.workflow.model.QuotaType;
import com.ivamare.workflow.repository.QuotaLimitRepository;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.BucketConfiguration;
import io.github.bucket4j.distributed.BucketProxy;
import io.github.bucket4j.distributed.jdbc.PrimaryKeyMapper;
import io.github.bucket4j.distributed.proxy.ProxyManager;
import io.github.bucket4j.postgresql.Bucket4jPostgreSQL;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Paces requests to an external service so workers stay under its
 * {@code requests_per_minute} limit.
 *
 * <p>Buckets live in PostgreSQL and are coordinated with advisory locks, so the pace
 * is shared by every engine instance. Capacity and refill come from the active
 * {@code requests_per_minute} limit of the service; a service without that limit is
 * not paced.
 */
public class QuotaThrottle {

    private static final Logger log = LoggerFactory.getLogger(QuotaThrottle.class);

    private static final String KEY_PREFIX = "workflow-quota:";

    private final ProxyManager<String> proxyManager;
    private final QuotaLimitRepository limitRepository;
    private final ConcurrentHashMap<String, Optional<BucketConfiguration>> configCache = new ConcurrentHashMap<>();

    /**
     * Create a throttle backed by the given PostgreSQL data source.
     *
     * @param dataSource DataSource holding the bucket table
     * @param limitRepository Source of request limits
     */
    public QuotaThrottle(DataSource dataSource, QuotaLimitRepository limitRepository) {
        this(Bucket4jPostgreSQL
                .advisoryLockBasedBuilder(dataSource)
                .primaryKeyMapper(PrimaryKeyMapper.STRING)
                .build(),
            limitRepository);
    }

    /**
     * Create a throttle with an explicit proxy manager.
     *
     * @param proxyManager Bucket4j proxy manager keyed by string
     * @param limitRepository Source of request limits
     */
    public QuotaThrottle(ProxyManager<String> proxyManager, QuotaLimitRepository limitRepository) {
        this.proxyManager = proxyManager;
        this.limitRepository = limitRepository;
    }

    /**
     * Take one request ticket for a service, waiting up to {@code maxWait}.
     *
     * @param serviceName The service to pace
     * @param maxWait Maximum time to wait for a ticket
     * @return true if a ticket was taken or the service is not paced
     */
    public boolean tryAcquire(String serviceName, Duration maxWait) {
        Optional<BucketConfiguration> config = getConfig(serviceName);
        if (config.isEmpty()) {
            return true;
        }
        BucketProxy bucket = proxyManager.getProxy(KEY_PREFIX + serviceName, config::get);

        try {
            boolean acquired = bucket.asBlocking().tryConsume(1, maxWait);
            if (!acquired) {
                log.debug("No request ticket for service={} within {}", serviceName, maxWait);
            }
            return acquired;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Request ticket wait interrupted for service={}", serviceName);
            return false;
        }
    }

    /**
     * Tickets currently available for a service, or -1 if the service is not paced.
     */
    public long availableRequests(String serviceName) {
        Optional<BucketConfiguration> config = getConfig(serviceName);
        if (config.isEmpty()) {
            return -1;
        }
        return proxyManager.getProxy(KEY_PREFIX + serviceName, config::get).getAvailableTokens();
    }

    /**
     * Drop the cached limit of a service so the next call reloads it.
     */
    public void refresh(String serviceName) {
        configCache.remove(serviceName);
        log.debug("Refreshed request pacing config for service={}", serviceName);
    }

    private Optional<BucketConfiguration> getConfig(String serviceName) {
        return configCache.computeIfAbsent(serviceName, this::loadConfig);
    }

    private Optional<BucketConfiguration> loadConfig(String serviceName) {
        Optional<QuotaLimit> limit = limitRepository
            .find(serviceName, QuotaType.REQUESTS_PER_MINUTE.getValue())
            .filter(QuotaLimit::active)
            .filter(l -> l.limitValue() > 0 && l.windowSeconds() > 0);
        if (limit.isEmpty()) {
            log.debug("No request limit for service={}, requests are not paced", serviceName);
            return Optional.empty();
        }

        long capacity = limit.get().limitValue();
        Duration window = Duration.ofSeconds(limit.get().windowSeconds());
        return Optional.of(BucketConfiguration.builder()
            .addLimit(Bandwidth.builder()
                .capacity(capacity)
                .refillGreedy(capacity, window)
                .build())
            .build());
    }
}
