package com.ivamare.workflow.engine;

import com.ivamare.workflow.model.TransitionRequest;
import com.ivamare.workflow.model.WorkflowState;

import java.util.Map;
import java.util.UUID;

/**
 * Compare-and-swap state changes for workflow items.
 *
 * <p>Each successful call, in one transaction, locks the item row, verifies the
 * expected state, updates the state and bumps {@code version} by one, appends a
 * transition record and appends a {@code state_changed} event. Either all of these
 * are committed or none.
 *
 * <p>Example:
 * <pre>
 * boolean moved = engine.transition(id, WorkflowState.QUEUED, WorkflowState.PROCESSING,
 *     "enrichment", "claimed", Map.of(), "worker-1");
 * if (!moved) {
 *     // another caller changed the state first
 * }
 * </pre>
 */
public interface StateTransitionEngine {

    /**
     * Transition an item if it is currently in {@code fromState}.
     *
     * @param workflowId The item ID
     * @param fromState Expected current state
     * @param toState Target state
     * @param stage New stage (nullable, keeps the current stage)
     * @param reason Reason recorded in the audit trail (nullable)
     * @param metadata Merged into the item's stage details (nullable)
     * @param actor Who requested the change (nullable)
     * @return true if the transition was applied, false if the state did not match
     * @throws com.ivamare.workflow.exception.InvalidTransitionException if the edge is not allowed
     * @throws com.ivamare.workflow.exception.WorkflowNotFoundException if the item does not exist
     * @throws com.ivamare.workflow.exception.StoreUnavailableException if the store failed transiently
     */
    boolean transition(UUID workflowId, WorkflowState fromState, WorkflowState toState,
                       String stage, String reason, Map<String, Object> metadata, String actor);

    /**
     * Transition with additional item field updates applied in the same statement.
     *
     * @param request The transition request
     * @return true if the transition was applied, false if the state did not match
     */
    boolean transition(TransitionRequest request);
}
