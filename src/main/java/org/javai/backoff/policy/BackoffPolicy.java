package org.javai.backoff.policy;

import java.time.Duration;
import java.util.Optional;

/**
 * Immutable description of how retry delays evolve over attempts.
 *
 * <p>A policy is reusable and side-effect-free: every call to {@link #build()} returns a new,
 * independent {@link Backoff} starting from the first delay.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * BackoffPolicy policy = ExponentialBackoffPolicy.defaults()
 *     .withInitialDelay(Duration.ofMillis(100))
 *     .withMaxDelay(Duration.ofSeconds(5))
 *     .withMaxTimes(5)
 *     .withJitter();
 *
 * Backoff delays = policy.build();
 * }</pre>
 */
public interface BackoffPolicy {

    /**
     * Validates this configuration and creates a fresh delay sequence.
     *
     * @return a new sequence positioned before its first delay
     * @throws IllegalArgumentException if the configuration is invalid
     */
    Backoff build();

    /**
     * A policy that never retries: its sequences are exhausted from the start.
     */
    static BackoffPolicy noRetry() {
        return ConstantBackoffPolicy.defaults().withMaxTimes(0);
    }

    /**
     * Retries up to {@code maxTimes} times without waiting in between.
     */
    static BackoffPolicy immediate(int maxTimes) {
        return () -> {
            if (maxTimes < 0) {
                throw new IllegalArgumentException("maxTimes must be >= 0, was: " + maxTimes);
            }
            return new Backoff() {
                private int yielded;

                @Override
                public Optional<Duration> next() {
                    if (yielded >= maxTimes) {
                        return Optional.empty();
                    }
                    yielded++;
                    return Optional.of(Duration.ZERO);
                }
            };
        };
    }
}
