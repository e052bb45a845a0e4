package com.ivamare.workflow.exception;

import com.ivamare.workflow.model.WorkflowState;

/**
 * Thrown when a caller requests a state change that is not an allowed edge.
 *
 * <p>This signals a programming error. A caller that merely lost a race gets
 * {@code false} from the transition engine instead.
 */
public class InvalidTransitionException extends InvalidOperationException {

    private final WorkflowState fromState;
    private final WorkflowState toState;

    public InvalidTransitionException(WorkflowState fromState, WorkflowState toState) {
        super("Transition not allowed: " + fromState.getValue() + " -> " + toState.getValue());
        this.fromState = fromState;
        this.toState = toState;
    }

    public WorkflowState getFromState() {
        return fromState;
    }

    public WorkflowState getToState() {
        return toState;
    }
}
