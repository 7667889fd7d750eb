package org.javai.backoff.retry;

/**
 * How a retry run ended.
 */
public enum Termination {

    /** The operation returned a successful outcome. */
    SUCCEEDED,

    /** The retry predicate rejected the most recent error. */
    REJECTED,

    /** The delay sequence ran out of delays. */
    EXHAUSTED,

    /** The blocking retrier's thread was interrupted while waiting. */
    INTERRUPTED,

    /** The caller cancelled the asynchronous run. */
    CANCELLED,

    /** An attempt or a hook threw, and the exception was propagated to the caller. */
    FAULTED;

    /**
     * Whether the run ended with a failure returned to the caller.
     */
    public boolean gaveUp() {
        return this == REJECTED || this == EXHAUSTED || this == INTERRUPTED;
    }
}
