package com.ivamare.workflow.retry;

/**
 * What the retry scheduler did with a failure.
 */
public enum FailureOutcome {
    /** Requeued with a future next_retry_at */
    RETRY_SCHEDULED,

    /** Moved to failed and recorded in the dead-letter store */
    DEAD_LETTERED,

    /** Parked in quota_exceeded until the quota resets */
    QUOTA_WAIT,

    /** Item was no longer processing under this worker's lease; nothing changed */
    IGNORED
}
