package com.ivamare.workflow.quota.impl;

import com.ivamare.workflow.exception.QuotaExceededException;
import com.ivamare.workflow.model.QuotaLimit;
import com.ivamare.workflow.model.QuotaType;
import com.ivamare.workflow.model.QuotaUsage;
import com.ivamare.workflow.model.QuotaUsage.QuotaWindowUsage;
import com.ivamare.workflow.model.QuotaUsageSnapshot;
import com.ivamare.workflow.quota.QuotaTracker;
import com.ivamare.workflow.repository.QuotaLimitRepository;
import com.ivamare.workflow.repository.QuotaUsageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Default implementation of QuotaTracker.
 */
public class DefaultQuotaTracker implements QuotaTracker {

    private static final Logger log = LoggerFactory.getLogger(DefaultQuotaTracker.class);

    /** Default limits seeded per service. */
    static final Map<QuotaType, Long> DEFAULT_LIMITS = Map.of(
        QuotaType.TOKENS_PER_MINUTE, 4_000_000L,
        QuotaType.TOKENS_PER_DAY, 1_000_000_000L,
        QuotaType.REQUESTS_PER_MINUTE, 15L,
        QuotaType.REQUESTS_PER_DAY, 1_500L
    );

    private final QuotaUsageRepository usageRepository;
    private final QuotaLimitRepository limitRepository;
    private final Clock clock;
    private final Duration recencyWindow;

    public DefaultQuotaTracker(
            QuotaUsageRepository usageRepository,
            QuotaLimitRepository limitRepository,
            Clock clock,
            Duration recencyWindow) {
        this.usageRepository = usageRepository;
        this.limitRepository = limitRepository;
        this.clock = clock;
        this.recencyWindow = recencyWindow;
    }

    @Override
    public QuotaUsageSnapshot recordUsage(String serviceName, QuotaUsage usage, UUID workflowId) {
        QuotaUsageSnapshot snapshot = new QuotaUsageSnapshot(
            UUID.randomUUID(), workflowId, serviceName, usage, clock.instant());
        usageRepository.save(snapshot);

        List<String> exhausted = exhaustedTypes(usage);
        if (!exhausted.isEmpty()) {
            log.warn("Quota exhausted for service={} types={}", serviceName, exhausted);
        } else {
            log.debug("Recorded quota usage for service={} workflow={}", serviceName, workflowId);
        }
        return snapshot;
    }

    @Override
    public Optional<QuotaUsageSnapshot> currentUsage(String serviceName) {
        return usageRepository.findLatest(serviceName, clock.instant().minus(recencyWindow));
    }

    @Override
    public boolean isExceeded(String serviceName, String quotaType) {
        Optional<QuotaUsageSnapshot> current = currentUsage(serviceName);
        if (current.isEmpty()) {
            return false;
        }
        QuotaWindowUsage window = current.get().usage().quotas().get(quotaType);
        if (window == null || !window.isExhausted()) {
            return false;
        }
        return limitRepository.find(serviceName, quotaType)
            .map(QuotaLimit::active)
            .orElse(false);
    }

    @Override
    public List<String> exceededQuotaTypes(String serviceName) {
        Optional<QuotaUsageSnapshot> current = currentUsage(serviceName);
        if (current.isEmpty()) {
            return List.of();
        }
        List<String> exhausted = exhaustedTypes(current.get().usage());
        if (exhausted.isEmpty()) {
            return List.of();
        }
        Set<String> limited = limitRepository.findActiveByService(serviceName).stream()
            .map(QuotaLimit::quotaType)
            .collect(Collectors.toSet());
        return exhausted.stream().filter(limited::contains).toList();
    }

    @Override
    public Map<String, Instant> estimateResetTime(String serviceName) {
        Instant now = clock.instant();
        Map<String, Instant> resets = new TreeMap<>();
        for (String quotaType : exceededQuotaTypes(serviceName)) {
            resets.put(quotaType, resetTime(quotaType, now));
        }
        return Collections.unmodifiableMap(resets);
    }

    @Override
    public Optional<Instant> resumeAt(String serviceName) {
        return estimateResetTime(serviceName).values().stream().max(Instant::compareTo);
    }

    @Override
    public void checkQuota(String serviceName) {
        List<String> exceeded = exceededQuotaTypes(serviceName);
        if (!exceeded.isEmpty()) {
            throw new QuotaExceededException(serviceName, exceeded, resumeAt(serviceName).orElse(null));
        }
    }

    @Override
    public List<QuotaLimit> limits(String serviceName) {
        return limitRepository.findActiveByService(serviceName);
    }

    @Override
    public void setLimit(QuotaLimit limit) {
        limitRepository.save(limit);
        log.info("Set quota limit service={} type={} limit={} window={}s",
            limit.serviceName(), limit.quotaType(), limit.limitValue(), limit.windowSeconds());
    }

    @Override
    public int seedDefaults(String serviceName) {
        int inserted = 0;
        for (QuotaType type : QuotaType.values()) {
            QuotaLimit limit = QuotaLimit.create(serviceName, type, DEFAULT_LIMITS.get(type));
            if (limitRepository.insertIfAbsent(limit)) {
                inserted++;
            }
        }
        if (inserted > 0) {
            log.info("Seeded {} default quota limits for service={}", inserted, serviceName);
        }
        return inserted;
    }

    static Instant resetTime(String quotaType, Instant now) {
        if (quotaType.endsWith("_minute")) {
            return now.truncatedTo(ChronoUnit.MINUTES).plus(1, ChronoUnit.MINUTES);
        }
        if (quotaType.endsWith("_day")) {
            return LocalDate.ofInstant(now, ZoneOffset.UTC).plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        return now;
    }

    private static List<String> exhaustedTypes(QuotaUsage usage) {
        List<String> exhausted = new ArrayList<>();
        usage.quotas().forEach((type, window) -> {
            if (window.isExhausted()) {
                exhausted.add(type);
            }
        });
        return exhausted;
    }
}
