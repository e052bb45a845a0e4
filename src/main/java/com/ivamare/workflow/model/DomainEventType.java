package com.ivamare.workflow.model;

/**
 * Types of domain events appended to the event log.
 */
public enum DomainEventType {
    STATE_CHANGED("state_changed"),
    LEASE_ACQUIRED("lease_acquired"),
    LEASE_RELEASED("lease_released"),
    RETRY_SCHEDULED("retry_scheduled"),
    QUOTA_EXCEEDED("quota_exceeded"),
    DEAD_LETTERED("dead_lettered"),
    STAGE_COMPLETED("stage_completed"),
    CUSTOM("custom");

    private final String value;

    DomainEventType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static DomainEventType fromValue(String value) {
        for (DomainEventType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown DomainEventType: " + value);
    }
}
