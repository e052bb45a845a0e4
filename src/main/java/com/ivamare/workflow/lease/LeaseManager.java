package com.ivamare.workflow.lease;

import com.ivamare.workflow.model.WorkflowItem;

import java.util.List;
import java.util.UUID;

/**
 * Time-bounded exclusive leases on workflow items.
 *
 * <p>A lease is free when unheld or older than the timeout. Acquiring is a single
 * conditional update, so two workers can never both succeed for a live lease.
 * Leases never change an item's state or version.
 */
public interface LeaseManager {

    /**
     * Take or renew the lease on an item.
     *
     * <p>Succeeds when the lease is unheld, already held by {@code workerId} (renewal),
     * or was acquired more than {@code timeoutSeconds} ago (stale takeover).
     *
     * @param workflowId The item ID
     * @param workerId The worker requesting the lease
     * @param timeoutSeconds Lease timeout
     * @return true if the worker now holds the lease
     */
    boolean acquireLease(UUID workflowId, String workerId, long timeoutSeconds);

    /**
     * Release the lease if held by {@code workerId}.
     *
     * @return true if released, false if the worker did not hold it
     */
    boolean releaseLease(UUID workflowId, String workerId);

    /**
     * Processing items whose lease has gone stale.
     */
    List<WorkflowItem> findExpiredLeases(long timeoutSeconds, int limit);
}
