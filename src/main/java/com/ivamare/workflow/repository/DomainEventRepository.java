package com.ivamare.workflow.repository;

import com.ivamare.workflow.model.DomainEvent;

import java.util.List;
import java.util.UUID;

/**
 * Append-only event log. Only the {@code processed} flag is ever updated.
 */
public interface DomainEventRepository {

    void save(DomainEvent event);

    /**
     * Unprocessed events, oldest first.
     */
    List<DomainEvent> findUnprocessed(int limit);

    /**
     * Flag events as handled by a consumer.
     *
     * @return Number of events newly flagged
     */
    int markProcessed(List<UUID> eventIds);

    List<DomainEvent> findByWorkflowId(UUID workflowId);
}
