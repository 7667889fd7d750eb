package org.javai.backoff.policy;

import java.time.Duration;
import java.util.Objects;

/**
 * Grows delays geometrically: the k-th delay (0-based) is {@code initialDelay * factor^k},
 * clamped to {@code maxDelay}.
 *
 * <p>With jitter enabled the returned delay is sampled uniformly from {@code [minDelay, term]},
 * or from {@code [0, term]} when no {@code minDelay} is configured. A {@code minDelay} above the
 * current term collapses the range to the term itself.
 *
 * <p>When {@code initialDelay * factor^k} no longer fits in a 64-bit nanosecond count the term
 * saturates at {@code maxDelay}, or at {@link Durations#MAX} when no clamp is configured.
 *
 * <p>Defaults: 1 second initial delay, factor 2, 60 second cap, at most 3 retries, no jitter.
 *
 * @param initialDelay the first delay; must be positive
 * @param maxDelay upper clamp, null for none
 * @param factor growth multiplier; must be finite and at least 1
 * @param minDelay floor of the jitter range, null for zero
 * @param maxTimes maximum number of retries, null for unlimited
 * @param maxTotalDelay cap on the sum of all waits, null for unlimited
 * @param jitter whether to randomize each delay downward
 * @param jitterSeed seed for the jitter source, null for a random seed
 */
public record ExponentialBackoffPolicy(
        Duration initialDelay,
        Duration maxDelay,
        double factor,
        Duration minDelay,
        Integer maxTimes,
        Duration maxTotalDelay,
        boolean jitter,
        Long jitterSeed
) implements BackoffPolicy {

    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(60);
    public static final double DEFAULT_FACTOR = 2.0;
    public static final int DEFAULT_MAX_TIMES = 3;

    public static ExponentialBackoffPolicy defaults() {
        return new ExponentialBackoffPolicy(
                DEFAULT_INITIAL_DELAY, DEFAULT_MAX_DELAY, DEFAULT_FACTOR, null, DEFAULT_MAX_TIMES, null, false, null);
    }

    /**
     * Doubling backoff between the given bounds.
     */
    public static ExponentialBackoffPolicy of(Duration initialDelay, Duration maxDelay, int maxTimes) {
        return defaults().withInitialDelay(initialDelay).withMaxDelay(maxDelay).withMaxTimes(maxTimes);
    }

    public ExponentialBackoffPolicy withInitialDelay(Duration initialDelay) {
        Objects.requireNonNull(initialDelay, "initialDelay must not be null");
        return new ExponentialBackoffPolicy(initialDelay, maxDelay, factor, minDelay, maxTimes, maxTotalDelay, jitter, jitterSeed);
    }

    public ExponentialBackoffPolicy withMaxDelay(Duration maxDelay) {
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        return new ExponentialBackoffPolicy(initialDelay, maxDelay, factor, minDelay, maxTimes, maxTotalDelay, jitter, jitterSeed);
    }

    public ExponentialBackoffPolicy withoutMaxDelay() {
        return new ExponentialBackoffPolicy(initialDelay, null, factor, minDelay, maxTimes, maxTotalDelay, jitter, jitterSeed);
    }

    public ExponentialBackoffPolicy withFactor(double factor) {
        return new ExponentialBackoffPolicy(initialDelay, maxDelay, factor, minDelay, maxTimes, maxTotalDelay, jitter, jitterSeed);
    }

    public ExponentialBackoffPolicy withMinDelay(Duration minDelay) {
        Objects.requireNonNull(minDelay, "minDelay must not be null");
        return new ExponentialBackoffPolicy(initialDelay, maxDelay, factor, minDelay, maxTimes, maxTotalDelay, jitter, jitterSeed);
    }

    public ExponentialBackoffPolicy withMaxTimes(int maxTimes) {
        return new ExponentialBackoffPolicy(initialDelay, maxDelay, factor, minDelay, maxTimes, maxTotalDelay, jitter, jitterSeed);
    }

    public ExponentialBackoffPolicy withoutMaxTimes() {
        return new ExponentialBackoffPolicy(initialDelay, maxDelay, factor, minDelay, null, maxTotalDelay, jitter, jitterSeed);
    }

    public ExponentialBackoffPolicy withMaxTotalDelay(Duration maxTotalDelay) {
        return new ExponentialBackoffPolicy(initialDelay, maxDelay, factor, minDelay, maxTimes, maxTotalDelay, jitter, jitterSeed);
    }

    public ExponentialBackoffPolicy withJitter() {
        return new ExponentialBackoffPolicy(initialDelay, maxDelay, factor, minDelay, maxTimes, maxTotalDelay, true, jitterSeed);
    }

    public ExponentialBackoffPolicy withJitterSeed(long seed) {
        return new ExponentialBackoffPolicy(initialDelay, maxDelay, factor, minDelay, maxTimes, maxTotalDelay, jitter, seed);
    }

    @Override
    public Backoff build() {
        PolicyChecks.requirePositive("initialDelay", initialDelay);
        PolicyChecks.requireAtLeast("maxDelay", maxDelay, "initialDelay", initialDelay);
        if (Double.isNaN(factor) || Double.isInfinite(factor) || factor < 1.0) {
            throw new IllegalArgumentException("factor must be a finite number >= 1, was: " + factor);
        }
        PolicyChecks.requireNonNegative("minDelay", minDelay);
        PolicyChecks.requireNonNegative("maxTimes", maxTimes);
        PolicyChecks.requireNonNegative("maxTotalDelay", maxTotalDelay);
        return new ExponentialBackoff(this);
    }

    static final class ExponentialBackoff extends AbstractBackoff {

        private final long initialNanos;
        private final long capNanos;
        private final long floorNanos;
        private final double factor;

        private boolean saturated;

        private ExponentialBackoff(ExponentialBackoffPolicy policy) {
            super(policy.maxTimes(), policy.maxTotalDelay(),
                    policy.jitter() ? Jitter.seeded(policy.jitterSeed()) : null);
            this.initialNanos = Durations.toNanos(policy.initialDelay());
            this.capNanos = policy.maxDelay() == null ? Long.MAX_VALUE : Durations.toNanos(policy.maxDelay());
            this.floorNanos = policy.minDelay() == null ? 0L : Durations.toNanos(policy.minDelay());
            this.factor = policy.factor();
        }

        @Override
        long nextTerm(int step) {
            if (saturated) {
                return capNanos;
            }
            long term = Durations.scale(initialNanos, factor, step, capNanos);
            if (term >= capNanos) {
                saturated = true;
            }
            return term;
        }

        @Override
        long jitterFloor() {
            return floorNanos;
        }
    }
}
