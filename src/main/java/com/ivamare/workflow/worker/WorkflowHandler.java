package com.ivamare.workflow.worker;

import com.ivamare.workflow.model.WorkflowItem;

/**
 * Application code that performs the work of one item.
 *
 * <p>Handlers run outside any database transaction while the worker holds the
 * item's lease. Throw {@link com.ivamare.workflow.exception.TransientWorkException}
 * for retryable failures, {@link com.ivamare.workflow.exception.PermanentWorkException}
 * for failures that must not be retried, and
 * {@link com.ivamare.workflow.exception.QuotaExceededException} when a service quota
 * is exhausted. Any other exception is treated as transient.
 */
@FunctionalInterface
public interface WorkflowHandler {

    /**
     * Process an item.
     *
     * @param item The claimed item, including partial results of earlier attempts
     * @param context Access to the lease and quota services
     * @return The result
     * @throws Exception if processing fails
     */
    HandlerResult handle(WorkflowItem item, WorkContext context) throws Exception;
}
