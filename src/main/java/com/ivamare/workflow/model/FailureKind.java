package com.ivamare.workflow.model;

/**
 * Classification of a work failure reported by a worker.
 */
public enum FailureKind {
    /** Retryable with backoff */
    TRANSIENT,

    /** Never retried, dead-lettered immediately */
    PERMANENT,

    /** Service quota exhausted, wait for reset without consuming retries */
    QUOTA
}
