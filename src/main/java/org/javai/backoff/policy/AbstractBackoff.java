package org.javai.backoff.policy;

import java.time.Duration;
import java.util.Optional;

/**
 * Exhaustion bookkeeping shared by the built-in sequences.
 *
 * <p>Subclasses supply the un-jittered term for each step and, optionally, the jitter floor.
 * This class enforces the attempt cap, applies jitter and enforces the cumulative delay cap.
 * Exhaustion is sticky.
 */
abstract class AbstractBackoff implements Backoff {

    private final Integer maxTimes;
    private final long maxTotalNanos;
    private final Jitter jitter;

    private int attempts;
    private long cumulativeNanos;
    private boolean exhausted;

    /**
     * @param maxTimes maximum number of delays to yield, null for unlimited
     * @param maxTotalDelay cap on the sum of yielded delays, null for unlimited
     * @param jitter randomness source, null when jitter is disabled
     */
    AbstractBackoff(Integer maxTimes, Duration maxTotalDelay, Jitter jitter) {
        this.maxTimes = maxTimes;
        this.maxTotalNanos = maxTotalDelay == null ? Long.MAX_VALUE : Durations.toNanos(maxTotalDelay);
        this.jitter = jitter;
    }

    @Override
    public final Optional<Duration> next() {
        if (exhausted || (maxTimes != null && attempts >= maxTimes)) {
            exhausted = true;
            return Optional.empty();
        }

        long term = nextTerm(attempts);
        long delay = jitter == null ? term : jitter.between(jitterFloor(), term);

        long cumulative = Durations.saturatingAdd(cumulativeNanos, delay);
        if (cumulative > maxTotalNanos) {
            exhausted = true;
            return Optional.empty();
        }

        cumulativeNanos = cumulative;
        attempts++;
        return Optional.of(Duration.ofNanos(delay));
    }

    /**
     * Computes the un-jittered term for the given 0-based step and advances any growth state.
     *
     * @param step the number of delays yielded so far
     * @return the term in nanoseconds
     */
    abstract long nextTerm(int step);

    /**
     * The lower bound of the jitter range, in nanoseconds.
     */
    long jitterFloor() {
        return 0L;
    }
}
