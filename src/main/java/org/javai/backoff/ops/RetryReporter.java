package org.javai.backoff.ops;

import org.javai.backoff.retry.Termination;

import java.time.Duration;

/**
 * Reports retry events for observability and operator notification.
 * Implementations might emit metrics, structured logs, or alerts.
 *
 * <p>Reporters are called synchronously from the retry loop. They must not throw; a reporter
 * failure is never treated as a retry condition.
 */
public interface RetryReporter {

    /**
     * Reports that a failed attempt will be retried.
     *
     * @param operation The operation name
     * @param error The error returned by the failed attempt
     * @param attemptNumber The attempt that failed (1-based)
     * @param delay The wait before the next attempt
     */
    default void reportRetryAttempt(String operation, Object error, int attemptNumber, Duration delay) {
        // Default: no-op. Implementations may override.
    }

    /**
     * Reports that a retry run has ended.
     *
     * @param operation The operation name
     * @param termination How the run ended
     * @param totalAttempts The number of times the operation was invoked
     * @param lastError The most recent error, or null if the run succeeded or was cancelled before failing
     */
    default void reportTerminated(String operation, Termination termination, int totalAttempts, Object lastError) {
        // Default: no-op. Implementations may override.
    }

    /**
     * A reporter that does nothing.
     */
    static RetryReporter noOp() {
        return new RetryReporter() {};
    }

    /**
     * Creates a composite reporter that fans out to all given reporters.
     *
     * @param reporters the reporters to delegate to
     * @return a composite reporter
     */
    static RetryReporter composite(RetryReporter... reporters) {
        return CompositeRetryReporter.of(reporters);
    }
}
