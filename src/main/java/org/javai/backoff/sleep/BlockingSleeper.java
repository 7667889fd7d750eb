package org.javai.backoff.sleep;

import org.javai.backoff.policy.Durations;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Waits out a delay by blocking the calling thread.
 * Used by the blocking retrier; tests substitute a recording implementation.
 */
@FunctionalInterface
public interface BlockingSleeper {

    /**
     * Blocks the calling thread for the given duration.
     *
     * @param duration how long to wait; never negative
     * @throws InterruptedException if the thread is interrupted while waiting
     */
    void sleep(Duration duration) throws InterruptedException;

    /**
     * The default sleeper, backed by {@link TimeUnit#sleep(long)}.
     */
    static BlockingSleeper threadSleep() {
        return duration -> TimeUnit.NANOSECONDS.sleep(Durations.toNanos(duration));
    }
}
