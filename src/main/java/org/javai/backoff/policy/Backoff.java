package org.javai.backoff.policy;

import java.time.Duration;
import java.util.Optional;

/**
 * A stateful cursor producing the wait durations of one retry run.
 *
 * <p>Each call to {@link #next()} either returns the next delay or signals exhaustion. Once a
 * sequence has returned empty, every later call returns empty as well. Sequences are not
 * restartable in place; build a fresh one from its {@link BackoffPolicy} instead.
 *
 * <p>Instances are exclusively owned by a single retry run and are not thread-safe.
 */
public interface Backoff {

    /**
     * Advances the sequence by one step.
     *
     * @return the next delay, or empty once the sequence is exhausted
     */
    Optional<Duration> next();
}
