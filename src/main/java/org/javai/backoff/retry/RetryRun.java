package org.javai.backoff.retry;

import org.javai.backoff.ops.RetryReporter;
import org.javai.backoff.policy.Backoff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * State of one invocation of a retrier: the delay sequence, the attempt counter and the most
 * recent error. Owned by a single run and discarded when it terminates.
 *
 * <p>Implements the decision part of the attempt loop shared by the blocking and asynchronous
 * retriers. The loops themselves only differ in how they call the operation and how they wait.
 */
final class RetryRun<E> {

    private static final Logger LOG = LoggerFactory.getLogger(RetryRun.class);

    private final String operation;
    private final Backoff backoff;
    private final RetryHooks<E> hooks;
    private final RetryReporter reporter;
    private final Instant startedAt;

    private int attemptNumber = 1;
    private E lastError;
    private boolean terminated;

    RetryRun(String operation, Backoff backoff, RetryHooks<E> hooks, RetryReporter reporter) {
        this.operation = Objects.requireNonNull(operation, "operation must not be null");
        this.backoff = Objects.requireNonNull(backoff, "backoff must not be null");
        this.hooks = hooks;
        this.reporter = reporter;
        this.startedAt = Instant.now();
    }

    /**
     * Evaluates a failed attempt: consults the retry predicate, pulls the next delay, applies the
     * adjust hook and notifies observers. Exceptions thrown by hooks propagate to the caller.
     */
    RetryDecision onFailure(E error) {
        Objects.requireNonNull(error, "error must not be null");
        lastError = error;

        if (!hooks.retryWhen().test(error)) {
            return new RetryDecision.GiveUp(Termination.REJECTED);
        }

        Optional<Duration> next = backoff.next();
        if (next.isEmpty()) {
            return new RetryDecision.GiveUp(Termination.EXHAUSTED);
        }

        Duration delay = hooks.adjust().apply(error, next.get());
        if (delay == null || delay.isNegative()) {
            throw new IllegalStateException(
                    "adjust hook must return a non-negative delay, returned: " + delay + " for [" + operation + "]");
        }

        hooks.onRetry().accept(error, delay);
        reporter.reportRetryAttempt(operation, error, attemptNumber, delay);
        LOG.debug("Attempt {} of [{}] failed, retrying in {}", attemptNumber, operation, delay);
        return new RetryDecision.Retry(delay);
    }

    /**
     * Moves on to the next attempt once the wait is over.
     */
    void advance() {
        attemptNumber++;
    }

    /**
     * Records how the run ended. Only the first call has any effect.
     */
    void terminate(Termination termination) {
        report(termination, termination == Termination.SUCCEEDED ? null : lastError);
    }

    /**
     * Records that the run ended because an attempt or a hook threw. The exception is reported
     * as the last error; the caller still propagates it.
     */
    void fault(Throwable defect) {
        report(Termination.FAULTED, defect);
    }

    private void report(Termination termination, Object error) {
        if (terminated) {
            return;
        }
        terminated = true;
        reporter.reportTerminated(operation, termination, attemptNumber, error);
        LOG.debug("[{}] finished as {} after {} attempts in {}",
                operation, termination, attemptNumber, Duration.between(startedAt, Instant.now()));
    }

    String operation() {
        return operation;
    }

    int attemptNumber() {
        return attemptNumber;
    }
}
