package org.javai.backoff.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * The decision made by a retry run after evaluating a failed attempt.
 */
sealed interface RetryDecision permits RetryDecision.Retry, RetryDecision.GiveUp {

    /**
     * Retry the operation after waiting for the specified delay.
     */
    record Retry(Duration delay) implements RetryDecision {
        public Retry {
            Objects.requireNonNull(delay, "delay must not be null");
            if (delay.isNegative()) {
                throw new IllegalArgumentException("delay must not be negative");
            }
        }
    }

    /**
     * Do not retry; hand the failure back to the caller.
     */
    record GiveUp(Termination termination) implements RetryDecision {
        public GiveUp {
            Objects.requireNonNull(termination, "termination must not be null");
        }
    }
}
