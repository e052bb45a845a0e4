package com.ivamare.workflow.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Structured payload of a domain event.
 *
 * <p>Each known event shape is its own record; {@link Generic} carries anything else
 * as a key-ordered map. Payloads are stored as jsonb via {@link #toMap()} and read back
 * with {@link #fromMap(DomainEventType, Map)}.
 */
public sealed interface EventData {

    DomainEventType type();

    Map<String, Object> toMap();

    /**
     * Emitted for every successful state transition.
     */
    record StateChanged(
        UUID transitionId,
        WorkflowState fromState,
        WorkflowState toState,
        String stage,
        String reason
    ) implements EventData {

        @Override
        public DomainEventType type() {
            return DomainEventType.STATE_CHANGED;
        }

        @Override
        public Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("transition_id", transitionId.toString());
            map.put("from_state", fromState.getValue());
            map.put("to_state", toState.getValue());
            map.put("stage", stage);
            map.put("reason", reason);
            return map;
        }
    }

    /**
     * Emitted when a lease is taken, renewed or released.
     */
    record LeaseChanged(String workerId, boolean acquired) implements EventData {

        @Override
        public DomainEventType type() {
            return acquired ? DomainEventType.LEASE_ACQUIRED : DomainEventType.LEASE_RELEASED;
        }

        @Override
        public Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("worker_id", workerId);
            return map;
        }
    }

    /**
     * Emitted when a transient failure is scheduled for another attempt.
     */
    record RetryScheduled(
        int retryCount,
        int maxRetries,
        Instant nextRetryAt,
        long delaySeconds,
        String error
    ) implements EventData {

        @Override
        public DomainEventType type() {
            return DomainEventType.RETRY_SCHEDULED;
        }

        @Override
        public Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("retry_count", retryCount);
            map.put("max_retries", maxRetries);
            map.put("next_retry_at", nextRetryAt.toString());
            map.put("delay_seconds", delaySeconds);
            map.put("error", error);
            return map;
        }
    }

    /**
     * Emitted when an item is parked because a service quota is exhausted.
     */
    record QuotaExceeded(
        String serviceName,
        List<String> quotaTypes,
        Instant resumeAt,
        String stage
    ) implements EventData {

        public QuotaExceeded {
            quotaTypes = quotaTypes != null ? List.copyOf(quotaTypes) : List.of();
        }

        @Override
        public DomainEventType type() {
            return DomainEventType.QUOTA_EXCEEDED;
        }

        @Override
        public Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("service_name", serviceName);
            map.put("quota_types", quotaTypes);
            map.put("resume_at", resumeAt != null ? resumeAt.toString() : null);
            map.put("stage", stage);
            return map;
        }
    }

    /**
     * Emitted when an item is recorded in the dead-letter store.
     */
    record DeadLettered(UUID deadletterId, int failureCount, String errorMessage) implements EventData {

        @Override
        public DomainEventType type() {
            return DomainEventType.DEAD_LETTERED;
        }

        @Override
        public Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("deadletter_id", deadletterId.toString());
            map.put("failure_count", failureCount);
            map.put("error_message", errorMessage);
            return map;
        }
    }

    /**
     * Emitted when a worker finishes one stage of a multi-stage item.
     */
    record StageCompleted(String stage, double progressPercentage) implements EventData {

        @Override
        public DomainEventType type() {
            return DomainEventType.STAGE_COMPLETED;
        }

        @Override
        public Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("stage", stage);
            map.put("progress_percentage", progressPercentage);
            return map;
        }
    }

    /**
     * Free-form event data with deterministic key order.
     */
    record Generic(Map<String, Object> fields) implements EventData {

        public Generic {
            fields = fields != null ? new TreeMap<>(fields) : new TreeMap<>();
        }

        @Override
        public DomainEventType type() {
            return DomainEventType.CUSTOM;
        }

        @Override
        public Map<String, Object> toMap() {
            return new TreeMap<>(fields);
        }
    }

    /**
     * Rebuild event data from its stored map form. Unknown or malformed shapes
     * fall back to {@link Generic}.
     */
    static EventData fromMap(DomainEventType type, Map<String, Object> map) {
        Map<String, Object> data = map != null ? map : Map.of();
        try {
            return switch (type) {
                case STATE_CHANGED -> new StateChanged(
                    UUID.fromString((String) data.get("transition_id")),
                    WorkflowState.fromValue((String) data.get("from_state")),
                    WorkflowState.fromValue((String) data.get("to_state")),
                    (String) data.get("stage"),
                    (String) data.get("reason"));
                case LEASE_ACQUIRED, LEASE_RELEASED -> new LeaseChanged(
                    (String) data.get("worker_id"),
                    type == DomainEventType.LEASE_ACQUIRED);
                case RETRY_SCHEDULED -> new RetryScheduled(
                    ((Number) data.get("retry_count")).intValue(),
                    ((Number) data.get("max_retries")).intValue(),
                    Instant.parse((String) data.get("next_retry_at")),
                    ((Number) data.get("delay_seconds")).longValue(),
                    (String) data.get("error"));
                case QUOTA_EXCEEDED -> new QuotaExceeded(
                    (String) data.get("service_name"),
                    toStringList(data.get("quota_types")),
                    data.get("resume_at") != null ? Instant.parse((String) data.get("resume_at")) : null,
                    (String) data.get("stage"));
                case DEAD_LETTERED -> new DeadLettered(
                    UUID.fromString((String) data.get("deadletter_id")),
                    ((Number) data.get("failure_count")).intValue(),
                    (String) data.get("error_message"));
                case STAGE_COMPLETED -> new StageCompleted(
                    (String) data.get("stage"),
                    ((Number) data.get("progress_percentage")).doubleValue());
                case CUSTOM -> new Generic(data);
            };
        } catch (RuntimeException e) {
            return new Generic(data);
        }
    }

    private static List<String> toStringList(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object element : list) {
                result.add(String.valueOf(element));
            }
        }
        return result;
    }
}
