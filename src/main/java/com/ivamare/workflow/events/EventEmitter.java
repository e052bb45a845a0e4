package com.ivamare.workflow.events;

import com.ivamare.workflow.model.DomainEvent;
import com.ivamare.workflow.model.EventData;
import com.ivamare.workflow.model.MetricSample;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Appends domain events and metric samples, and exposes the event feed read by
 * downstream consumers.
 *
 * <p>Writes join the caller's transaction when one is active.
 */
public interface EventEmitter {

    /**
     * Append a domain event.
     *
     * @param workflowId Item the event belongs to (nullable)
     * @param data Event payload; its type determines the event type
     * @return The stored event
     */
    DomainEvent emit(UUID workflowId, EventData data);

    /**
     * Append a metric sample.
     */
    void recordMetric(MetricSample sample);

    /**
     * Append a metric sample stamped with the current time.
     */
    void recordMetric(UUID workflowId, String metricType, String metricName, double value,
                      Map<String, Object> metadata);

    /**
     * Events not yet flagged as processed, oldest first.
     */
    List<DomainEvent> unprocessedEvents(int limit);

    /**
     * Flag events as processed. Only consumers call this.
     *
     * @return Number of events newly flagged
     */
    int markProcessed(List<UUID> eventIds);

    /**
     * Event history of one item in insertion order.
     */
    List<DomainEvent> eventsFor(UUID workflowId);
}
