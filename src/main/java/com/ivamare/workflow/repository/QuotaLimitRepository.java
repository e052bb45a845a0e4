package com.ivamare.workflow.repository;

import com.ivamare.workflow.model.QuotaLimit;

import java.util.List;
import java.util.Optional;

/**
 * Repository for configured quota limits.
 */
public interface QuotaLimitRepository {

    /**
     * Insert or update a limit.
     */
    void save(QuotaLimit limit);

    /**
     * Insert a limit unless one exists for the same service and quota type.
     *
     * @return true if inserted
     */
    boolean insertIfAbsent(QuotaLimit limit);

    Optional<QuotaLimit> find(String serviceName, String quotaType);

    /**
     * Active limits of a service.
     */
    List<QuotaLimit> findActiveByService(String serviceName);

    List<QuotaLimit> findAll();

    boolean deactivate(String serviceName, String quotaType);

    boolean delete(String serviceName, String quotaType);
}
