package com.ivamare.workflow.engine;

import com.ivamare.workflow.model.WorkflowState;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.ivamare.workflow.model.WorkflowState.*;

/**
 * Allowed edges between workflow states.
 *
 * <p>completed and cancelled are terminal. failed only leaves through an explicit
 * operator requeue.
 */
public final class WorkflowStateMachine {

    private static final Map<WorkflowState, Set<WorkflowState>> TRANSITIONS = new EnumMap<>(WorkflowState.class);

    static {
        TRANSITIONS.put(CREATED, EnumSet.of(QUEUED, CANCELLED));
        TRANSITIONS.put(QUEUED, EnumSet.of(PROCESSING, CANCELLED));
        TRANSITIONS.put(PROCESSING, EnumSet.of(COMPLETED, FAILED, QUOTA_EXCEEDED, PARTIALLY_PROCESSED, QUEUED));
        TRANSITIONS.put(QUOTA_EXCEEDED, EnumSet.of(QUEUED, CANCELLED));
        TRANSITIONS.put(PARTIALLY_PROCESSED, EnumSet.of(QUEUED, PROCESSING, CANCELLED));
        TRANSITIONS.put(FAILED, EnumSet.of(QUEUED));
        TRANSITIONS.put(COMPLETED, EnumSet.noneOf(WorkflowState.class));
        TRANSITIONS.put(CANCELLED, EnumSet.noneOf(WorkflowState.class));
    }

    private WorkflowStateMachine() {
    }

    public static boolean isAllowed(WorkflowState from, WorkflowState to) {
        return TRANSITIONS.getOrDefault(from, Set.of()).contains(to);
    }

    public static Set<WorkflowState> allowedTargets(WorkflowState from) {
        return Collections.unmodifiableSet(TRANSITIONS.getOrDefault(from, EnumSet.noneOf(WorkflowState.class)));
    }
}
