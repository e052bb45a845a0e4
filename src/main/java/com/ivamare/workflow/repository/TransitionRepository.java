package com.ivamare.workflow.repository;

import com.ivamare.workflow.model.TransitionRecord;

import java.util.List;
import java.util.UUID;

/**
 * Append-only store of transition records.
 */
public interface TransitionRepository {

    void save(TransitionRecord record);

    /**
     * Transition history of one item in insertion order.
     */
    List<TransitionRecord> findByWorkflowId(UUID workflowId);
}
