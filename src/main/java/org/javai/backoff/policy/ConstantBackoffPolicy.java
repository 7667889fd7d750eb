package org.javai.backoff.policy;

import java.time.Duration;
import java.util.Objects;

/**
 * Waits the same delay before every retry.
 *
 * <p>Defaults: 1 second delay, at most 3 retries, no cumulative cap, no jitter.
 * With jitter enabled each delay is sampled uniformly from {@code [0, delay]}.
 *
 * @param delay the wait before each retry; must be positive
 * @param maxTimes maximum number of retries, null for unlimited
 * @param maxTotalDelay cap on the sum of all waits, null for unlimited
 * @param jitter whether to randomize each delay downward
 * @param jitterSeed seed for the jitter source, null for a random seed
 */
public record ConstantBackoffPolicy(
        Duration delay,
        Integer maxTimes,
        Duration maxTotalDelay,
        boolean jitter,
        Long jitterSeed
) implements BackoffPolicy {

    public static final Duration DEFAULT_DELAY = Duration.ofSeconds(1);
    public static final int DEFAULT_MAX_TIMES = 3;

    public static ConstantBackoffPolicy defaults() {
        return new ConstantBackoffPolicy(DEFAULT_DELAY, DEFAULT_MAX_TIMES, null, false, null);
    }

    public static ConstantBackoffPolicy of(Duration delay, int maxTimes) {
        return defaults().withDelay(delay).withMaxTimes(maxTimes);
    }

    public ConstantBackoffPolicy withDelay(Duration delay) {
        Objects.requireNonNull(delay, "delay must not be null");
        return new ConstantBackoffPolicy(delay, maxTimes, maxTotalDelay, jitter, jitterSeed);
    }

    public ConstantBackoffPolicy withMaxTimes(int maxTimes) {
        return new ConstantBackoffPolicy(delay, maxTimes, maxTotalDelay, jitter, jitterSeed);
    }

    public ConstantBackoffPolicy withoutMaxTimes() {
        return new ConstantBackoffPolicy(delay, null, maxTotalDelay, jitter, jitterSeed);
    }

    public ConstantBackoffPolicy withMaxTotalDelay(Duration maxTotalDelay) {
        return new ConstantBackoffPolicy(delay, maxTimes, maxTotalDelay, jitter, jitterSeed);
    }

    public ConstantBackoffPolicy withJitter() {
        return new ConstantBackoffPolicy(delay, maxTimes, maxTotalDelay, true, jitterSeed);
    }

    public ConstantBackoffPolicy withJitterSeed(long seed) {
        return new ConstantBackoffPolicy(delay, maxTimes, maxTotalDelay, jitter, seed);
    }

    @Override
    public Backoff build() {
        PolicyChecks.requirePositive("delay", delay);
        PolicyChecks.requireNonNegative("maxTimes", maxTimes);
        PolicyChecks.requireNonNegative("maxTotalDelay", maxTotalDelay);
        return new ConstantBackoff(this);
    }

    static final class ConstantBackoff extends AbstractBackoff {

        private final long delayNanos;

        private ConstantBackoff(ConstantBackoffPolicy policy) {
            super(policy.maxTimes(), policy.maxTotalDelay(),
                    policy.jitter() ? Jitter.seeded(policy.jitterSeed()) : null);
            this.delayNanos = Durations.toNanos(policy.delay());
        }

        @Override
        long nextTerm(int step) {
            return delayNanos;
        }
    }
}
