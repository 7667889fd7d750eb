package org.javai.backoff.policy;

import java.time.Duration;
import java.util.Objects;

/**
 * Grows delays along the Fibonacci sequence seeded with {@code (initialDelay, initialDelay)}:
 * 1x, 1x, 2x, 3x, 5x, 8x, ... Once a term exceeds {@code maxDelay} the sequence stays at
 * {@code maxDelay}.
 *
 * <p>Defaults: 1 second initial delay, 60 second cap, at most 3 retries, no jitter.
 *
 * @param initialDelay the first delay; must be positive
 * @param maxDelay upper clamp, null for none
 * @param maxTimes maximum number of retries, null for unlimited
 * @param maxTotalDelay cap on the sum of all waits, null for unlimited
 * @param jitter whether to sample each delay uniformly from {@code [0, term]}
 * @param jitterSeed seed for the jitter source, null for a random seed
 */
public record FibonacciBackoffPolicy(
        Duration initialDelay,
        Duration maxDelay,
        Integer maxTimes,
        Duration maxTotalDelay,
        boolean jitter,
        Long jitterSeed
) implements BackoffPolicy {

    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(60);
    public static final int DEFAULT_MAX_TIMES = 3;

    public static FibonacciBackoffPolicy defaults() {
        return new FibonacciBackoffPolicy(DEFAULT_INITIAL_DELAY, DEFAULT_MAX_DELAY, DEFAULT_MAX_TIMES, null, false, null);
    }

    public FibonacciBackoffPolicy withInitialDelay(Duration initialDelay) {
        Objects.requireNonNull(initialDelay, "initialDelay must not be null");
        return new FibonacciBackoffPolicy(initialDelay, maxDelay, maxTimes, maxTotalDelay, jitter, jitterSeed);
    }

    public FibonacciBackoffPolicy withMaxDelay(Duration maxDelay) {
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        return new FibonacciBackoffPolicy(initialDelay, maxDelay, maxTimes, maxTotalDelay, jitter, jitterSeed);
    }

    public FibonacciBackoffPolicy withoutMaxDelay() {
        return new FibonacciBackoffPolicy(initialDelay, null, maxTimes, maxTotalDelay, jitter, jitterSeed);
    }

    public FibonacciBackoffPolicy withMaxTimes(int maxTimes) {
        return new FibonacciBackoffPolicy(initialDelay, maxDelay, maxTimes, maxTotalDelay, jitter, jitterSeed);
    }

    public FibonacciBackoffPolicy withoutMaxTimes() {
        return new FibonacciBackoffPolicy(initialDelay, maxDelay, null, maxTotalDelay, jitter, jitterSeed);
    }

    public FibonacciBackoffPolicy withMaxTotalDelay(Duration maxTotalDelay) {
        return new FibonacciBackoffPolicy(initialDelay, maxDelay, maxTimes, maxTotalDelay, jitter, jitterSeed);
    }

    public FibonacciBackoffPolicy withJitter() {
        return new FibonacciBackoffPolicy(initialDelay, maxDelay, maxTimes, maxTotalDelay, true, jitterSeed);
    }

    public FibonacciBackoffPolicy withJitterSeed(long seed) {
        return new FibonacciBackoffPolicy(initialDelay, maxDelay, maxTimes, maxTotalDelay, jitter, seed);
    }

    @Override
    public Backoff build() {
        PolicyChecks.requirePositive("initialDelay", initialDelay);
        PolicyChecks.requireAtLeast("maxDelay", maxDelay, "initialDelay", initialDelay);
        PolicyChecks.requireNonNegative("maxTimes", maxTimes);
        PolicyChecks.requireNonNegative("maxTotalDelay", maxTotalDelay);
        return new FibonacciBackoff(this);
    }

    static final class FibonacciBackoff extends AbstractBackoff {

        private final long capNanos;

        private long previous;
        private long current;
        private boolean clamped;

        private FibonacciBackoff(FibonacciBackoffPolicy policy) {
            super(policy.maxTimes(), policy.maxTotalDelay(),
                    policy.jitter() ? Jitter.seeded(policy.jitterSeed()) : null);
            this.capNanos = policy.maxDelay() == null ? Long.MAX_VALUE : Durations.toNanos(policy.maxDelay());
            this.previous = 0L;
            this.current = Durations.toNanos(policy.initialDelay());
        }

        @Override
        long nextTerm(int step) {
            if (clamped) {
                return capNanos;
            }
            long term = current;
            if (term >= capNanos) {
                clamped = true;
                return capNanos;
            }
            long following = Durations.saturatingAdd(previous, current);
            previous = current;
            current = following;
            return term;
        }
    }
}
