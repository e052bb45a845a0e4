package com.ivamare.workflow.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Event appended to the workflow event log.
 *
 * @param eventId Unique identifier
 * @param workflowId Item the event belongs to (nullable for service-wide events)
 * @param eventType Event type
 * @param eventData Structured event payload
 * @param processed Set by downstream consumers once handled
 * @param createdAt Creation time
 */
public record DomainEvent(
    UUID eventId,
    UUID workflowId,
    DomainEventType eventType,
    EventData eventData,
    boolean processed,
    Instant createdAt
) {
}
