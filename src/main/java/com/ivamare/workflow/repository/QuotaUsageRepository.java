package com.ivamare.workflow.repository;

import com.ivamare.workflow.model.QuotaUsageSnapshot;

import java.time.Instant;
import java.util.Optional;

/**
 * Append-only log of quota usage snapshots.
 */
public interface QuotaUsageRepository {

    void save(QuotaUsageSnapshot snapshot);

    /**
     * Most recent snapshot for a service created at or after {@code since}.
     */
    Optional<QuotaUsageSnapshot> findLatest(String serviceName, Instant since);
}
