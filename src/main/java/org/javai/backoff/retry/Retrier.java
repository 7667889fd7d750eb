package org.javai.backoff.retry;

import org.javai.backoff.Outcome;
import org.javai.backoff.boundary.Boundary;
import org.javai.backoff.boundary.ThrowingSupplier;
import org.javai.backoff.ops.RetryReporter;
import org.javai.backoff.policy.BackoffPolicy;
import org.javai.backoff.policy.ExponentialBackoffPolicy;
import org.javai.backoff.sleep.BlockingSleeper;

import java.time.Duration;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Executes synchronous operations with retry logic based on a backoff policy, blocking the
 * calling thread between attempts.
 * Operates entirely over Outcome values: the operation's own error comes back unchanged,
 * never wrapped in a "retries exceeded" error.
 *
 * <p>A Retrier is immutable and may be shared between threads. Every call to {@code execute}
 * builds a fresh delay sequence from the policy, so concurrent runs never share state.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Retrier<HttpError> retrier = Retrier.<HttpError>builder()
 *     .policy(ExponentialBackoffPolicy.of(Duration.ofMillis(100), Duration.ofSeconds(5), 3))
 *     .retryWhen(HttpError::isTransient)
 *     .adjust((error, delay) -> error.retryAfter().orElse(delay))
 *     .reporter(reporter)
 *     .build();
 *
 * Outcome<User, HttpError> result = retrier.execute("FetchUser", () -> userApi.fetch(userId));
 * }</pre>
 *
 * @param <E> The operation's error type
 */
public final class Retrier<E> {

    private static final String DEFAULT_OPERATION = "retry";

    private final BackoffPolicy policy;
    private final RetryHooks<E> hooks;
    private final RetryReporter reporter;
    private final BlockingSleeper sleeper;

    private Retrier(BackoffPolicy policy, RetryHooks<E> hooks, RetryReporter reporter, BlockingSleeper sleeper) {
        this.policy = policy;
        this.hooks = hooks;
        this.reporter = reporter;
        this.sleeper = sleeper;
    }

    /**
     * Creates a builder for configuring a Retrier instance.
     *
     * @param <E> the error type of the operations the retrier will run
     * @return a new builder
     */
    public static <E> Builder<E> builder() {
        return new Builder<>();
    }

    /**
     * Builder for configuring a Retrier instance.
     */
    public static final class Builder<E> {
        private BackoffPolicy policy;
        private RetryHooks<E> hooks = RetryHooks.defaults();
        private RetryReporter reporter = RetryReporter.noOp();
        private BlockingSleeper sleeper = BlockingSleeper.threadSleep();

        private Builder() {}

        /**
         * Sets the backoff policy (required).
         *
         * @param policy the policy each run builds its delay sequence from
         * @return this builder
         */
        public Builder<E> policy(BackoffPolicy policy) {
            this.policy = Objects.requireNonNull(policy, "policy must not be null");
            return this;
        }

        /**
         * Sets the predicate deciding whether an error is retried (optional, defaults to always).
         *
         * @param retryWhen returns false for errors that should be handed back immediately
         * @return this builder
         */
        public Builder<E> retryWhen(Predicate<? super E> retryWhen) {
            hooks = hooks.withRetryWhen(Objects.requireNonNull(retryWhen, "retryWhen must not be null"));
            return this;
        }

        /**
         * Sets an observer called with the error and the delay before each wait (optional).
         *
         * @param onRetry the observer; it cannot abort the run
         * @return this builder
         */
        public Builder<E> onRetry(BiConsumer<? super E, Duration> onRetry) {
            hooks = hooks.withOnRetry(Objects.requireNonNull(onRetry, "onRetry must not be null"));
            return this;
        }

        /**
         * Sets a hook that may replace each computed delay (optional).
         *
         * @param adjust receives the error and the computed delay, returns the delay to wait
         * @return this builder
         */
        public Builder<E> adjust(BiFunction<? super E, Duration, Duration> adjust) {
            hooks = hooks.withAdjust(Objects.requireNonNull(adjust, "adjust must not be null"));
            return this;
        }

        /**
         * Sets the reporter for retry events (optional, defaults to no-op).
         *
         * @param reporter the reporter for retry events
         * @return this builder
         */
        public Builder<E> reporter(RetryReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * Sets how the retrier waits between attempts (optional, defaults to {@link BlockingSleeper#threadSleep()}).
         *
         * @param sleeper the blocking sleeper
         * @return this builder
         */
        public Builder<E> sleeper(BlockingSleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        /**
         * Builds the Retrier instance.
         *
         * @return a configured Retrier
         * @throws NullPointerException if policy has not been set
         * @throws IllegalArgumentException if the policy configuration is invalid
         */
        public Retrier<E> build() {
            Objects.requireNonNull(policy, "policy must be set");
            policy.build();
            return new Retrier<>(policy, hooks, reporter, sleeper);
        }
    }

    /**
     * Executes an operation with retry according to the configured policy.
     *
     * @param operation The operation name for reporting
     * @param attempt Performs one attempt
     * @return The first successful Outcome, or the most recent failed one once the run gives up
     */
    public <T> Outcome<T, E> execute(String operation, Supplier<Outcome<T, E>> attempt) {
        Objects.requireNonNull(attempt, "attempt must not be null");
        return this.<Void, T>executeWithContext(operation, null, ignored -> new ContextOutcome<Void, T, E>(null, attempt.get()))
                .outcome();
    }

    /**
     * Executes an operation with retry, reporting it under a generic name.
     */
    public <T> Outcome<T, E> execute(Supplier<Outcome<T, E>> attempt) {
        return execute(DEFAULT_OPERATION, attempt);
    }

    /**
     * Executes an operation that borrows a context value for each attempt and hands it back
     * with its result. The context returned by one attempt is passed to the next.
     *
     * @param operation The operation name for reporting
     * @param context The context handed to the first attempt
     * @param attempt Performs one attempt
     * @return The last attempt's context and outcome
     */
    public <C, T> ContextOutcome<C, T, E> executeWithContext(
            String operation,
            C context,
            ContextOperation<C, T, E> attempt
    ) {
        Objects.requireNonNull(attempt, "attempt must not be null");

        RetryRun<E> run = new RetryRun<>(operation, policy.build(), hooks, reporter);
        try {
            ContextOutcome<C, T, E> result = requireResult(attempt.attempt(context));

            while (result.outcome() instanceof Outcome.Fail<T, E> fail) {
                RetryDecision decision = run.onFailure(fail.error());

                if (decision instanceof RetryDecision.GiveUp giveUp) {
                    run.terminate(giveUp.termination());
                    return result;
                }

                Duration delay = ((RetryDecision.Retry) decision).delay();
                if (!sleep(delay)) {
                    run.terminate(Termination.INTERRUPTED);
                    return result;
                }
                run.advance();
                result = requireResult(attempt.attempt(result.context()));
            }

            run.terminate(Termination.SUCCEEDED);
            return result;
        } catch (RuntimeException | Error e) {
            run.fault(e);
            throw e;
        }
    }

    /**
     * Returns a function that runs each call through this retrier.
     *
     * @param operation The operation name for reporting
     * @param function Performs one attempt for a given argument
     * @return a function retrying every call independently
     */
    public <R, T> Function<R, Outcome<T, E>> wrap(String operation, Function<? super R, Outcome<T, E>> function) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(function, "function must not be null");
        return argument -> execute(operation, () -> function.apply(argument));
    }

    private boolean sleep(Duration duration) {
        if (duration.isZero()) {
            return true;
        }
        try {
            sleeper.sleep(duration);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static <C, T, E> ContextOutcome<C, T, E> requireResult(ContextOutcome<C, T, E> result) {
        return Objects.requireNonNull(result, "attempt must not return null");
    }

    // === STATIC CONVENIENCE METHODS ===

    private static final Duration DEFAULT_INITIAL_DELAY = Duration.ofMillis(100);
    private static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(5);

    /**
     * Simple retry with exponential backoff for code that throws checked exceptions.
     *
     * <p>Every checked exception is retried; runtime exceptions propagate immediately. Uses default
     * delays (100ms initial, doubling, 5s max). For custom delays or reporting, use {@link #builder()}.
     *
     * @param maxTimes maximum number of retries after the first attempt (must be >= 0)
     * @param work the work to execute
     * @return the final Outcome after success or retry exhaustion
     * @throws IllegalArgumentException if maxTimes is negative
     */
    public static <T> Outcome<T, Exception> attempt(int maxTimes, ThrowingSupplier<T, ? extends Exception> work) {
        Objects.requireNonNull(work, "work must not be null");

        Retrier<Exception> retrier = Retrier.<Exception>builder()
                .policy(ExponentialBackoffPolicy.of(DEFAULT_INITIAL_DELAY, DEFAULT_MAX_DELAY, maxTimes))
                .build();
        return retrier.execute("attempt", () -> Boundary.call(work));
    }
}
