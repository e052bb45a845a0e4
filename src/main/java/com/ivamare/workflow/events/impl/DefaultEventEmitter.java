package com.ivamare.workflow.events.impl;

import com.ivamare.workflow.events.EventEmitter;
import com.ivamare.workflow.model.DomainEvent;
import com.ivamare.workflow.model.EventData;
import com.ivamare.workflow.model.MetricSample;
import com.ivamare.workflow.repository.DomainEventRepository;
import com.ivamare.workflow.repository.MetricRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Default implementation of EventEmitter backed by the event and metric tables.
 */
public class DefaultEventEmitter implements EventEmitter {

    private static final Logger log = LoggerFactory.getLogger(DefaultEventEmitter.class);

    private final DomainEventRepository eventRepository;
    private final MetricRepository metricRepository;
    private final Clock clock;

    public DefaultEventEmitter(DomainEventRepository eventRepository, MetricRepository metricRepository,
                               Clock clock) {
        this.eventRepository = eventRepository;
        this.metricRepository = metricRepository;
        this.clock = clock;
    }

    @Override
    public DomainEvent emit(UUID workflowId, EventData data) {
        DomainEvent event = new DomainEvent(UUID.randomUUID(), workflowId, data.type(), data, false,
            clock.instant());
        eventRepository.save(event);
        log.trace("Emitted {} for workflow {}", data.type().getValue(), workflowId);
        return event;
    }

    @Override
    public void recordMetric(MetricSample sample) {
        metricRepository.save(sample);
    }

    @Override
    public void recordMetric(UUID workflowId, String metricType, String metricName, double value,
                             Map<String, Object> metadata) {
        metricRepository.save(new MetricSample(UUID.randomUUID(), workflowId, metricType, metricName, value,
            metadata, clock.instant()));
    }

    @Override
    public List<DomainEvent> unprocessedEvents(int limit) {
        return eventRepository.findUnprocessed(limit);
    }

    @Override
    public int markProcessed(List<UUID> eventIds) {
        int updated = eventRepository.markProcessed(eventIds);
        log.debug("Marked {} of {} events processed", updated, eventIds == null ? 0 : eventIds.size());
        return updated;
    }

    @Override
    public List<DomainEvent> eventsFor(UUID workflowId) {
        return eventRepository.findByWorkflowId(workflowId);
    }
}
