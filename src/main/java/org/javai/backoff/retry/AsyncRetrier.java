package org.javai.backoff.retry;

import org.javai.backoff.Outcome;
import org.javai.backoff.ops.RetryReporter;
import org.javai.backoff.policy.BackoffPolicy;
import org.javai.backoff.sleep.Sleeper;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Executes asynchronous operations with retry logic based on a backoff policy.
 *
 * <p>The retry loop runs as one logical task. Waiting between attempts is the only point where it
 * suspends, and no thread is blocked while it does. Attempts whose stages are already complete
 * are processed in a loop rather than by nested callbacks.
 *
 * <p>Cancelling the returned future abandons the run: the pending wait is cancelled (when the
 * sleeper's stage is a {@link java.util.concurrent.Future}) and no further attempt starts.
 * An operation that throws, or whose stage completes exceptionally, fails the returned future
 * with that exception; such failures are defects and are never retried.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * AsyncRetrier<Exception> retrier = AsyncRetrier.<Exception>builder()
 *     .policy(ExponentialBackoffPolicy.defaults().withJitter())
 *     .retryWhen(e -> e instanceof IOException)
 *     .build();
 *
 * CompletableFuture<Outcome<String, Exception>> body = retrier.execute(
 *     "FetchPage",
 *     () -> Boundary.callAsync(() -> client.sendAsync(request, BodyHandlers.ofString()).thenApply(HttpResponse::body))
 * );
 * }</pre>
 *
 * @param <E> The operation's error type
 */
public final class AsyncRetrier<E> {

    private static final String DEFAULT_OPERATION = "retry";

    private final BackoffPolicy policy;
    private final RetryHooks<E> hooks;
    private final RetryReporter reporter;
    private final Sleeper sleeper;

    private AsyncRetrier(BackoffPolicy policy, RetryHooks<E> hooks, RetryReporter reporter, Sleeper sleeper) {
        this.policy = policy;
        this.hooks = hooks;
        this.reporter = reporter;
        this.sleeper = sleeper;
    }

    /**
     * Creates a builder for configuring an AsyncRetrier instance.
     *
     * @param <E> the error type of the operations the retrier will run
     * @return a new builder
     */
    public static <E> Builder<E> builder() {
        return new Builder<>();
    }

    /**
     * Builder for configuring an AsyncRetrier instance.
     */
    public static final class Builder<E> {
        private BackoffPolicy policy;
        private RetryHooks<E> hooks = RetryHooks.defaults();
        private RetryReporter reporter = RetryReporter.noOp();
        private Sleeper sleeper = Sleeper.delayed();

        private Builder() {}

        /**
         * Sets the backoff policy (required).
         */
        public Builder<E> policy(BackoffPolicy policy) {
            this.policy = Objects.requireNonNull(policy, "policy must not be null");
            return this;
        }

        /**
         * Sets the predicate deciding whether an error is retried (optional, defaults to always).
         */
        public Builder<E> retryWhen(Predicate<? super E> retryWhen) {
            hooks = hooks.withRetryWhen(Objects.requireNonNull(retryWhen, "retryWhen must not be null"));
            return this;
        }

        /**
         * Sets an observer called with the error and the delay before each wait (optional).
         */
        public Builder<E> onRetry(BiConsumer<? super E, Duration> onRetry) {
            hooks = hooks.withOnRetry(Objects.requireNonNull(onRetry, "onRetry must not be null"));
            return this;
        }

        /**
         * Sets a hook that may replace each computed delay (optional).
         */
        public Builder<E> adjust(BiFunction<? super E, Duration, Duration> adjust) {
            hooks = hooks.withAdjust(Objects.requireNonNull(adjust, "adjust must not be null"));
            return this;
        }

        /**
         * Sets the reporter for retry events (optional, defaults to no-op).
         */
        public Builder<E> reporter(RetryReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
            return this;
        }

        /**
         * Sets how the retrier waits between attempts (optional, defaults to {@link Sleeper#delayed()}).
         */
        public Builder<E> sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        /**
         * Builds the AsyncRetrier instance.
         *
         * @throws NullPointerException if policy has not been set
         * @throws IllegalArgumentException if the policy configuration is invalid
         */
        public AsyncRetrier<E> build() {
            Objects.requireNonNull(policy, "policy must be set");
            policy.build();
            return new AsyncRetrier<>(policy, hooks, reporter, sleeper);
        }
    }

    /**
     * Executes an asynchronous operation with retry according to the configured policy.
     *
     * @param operation The operation name for reporting
     * @param attempt Starts one attempt
     * @return a future completing with the first successful Outcome, or the most recent failed one
     */
    public <T> CompletableFuture<Outcome<T, E>> execute(
            String operation,
            Supplier<? extends CompletionStage<Outcome<T, E>>> attempt
    ) {
        Objects.requireNonNull(attempt, "attempt must not be null");
        CompletableFuture<ContextOutcome<Void, T, E>> run = this.<Void, T>executeWithContext(operation, null,
                ignored -> Objects.requireNonNull(attempt.get(), "attempt must not return a null stage")
                        .thenApply(outcome -> new ContextOutcome<Void, T, E>(null, outcome)));

        CompletableFuture<Outcome<T, E>> result = run.thenApply(ContextOutcome::outcome);
        result.whenComplete((ignored, failure) -> {
            if (result.isCancelled()) {
                run.cancel(false);
            }
        });
        return result;
    }

    /**
     * Executes an asynchronous operation with retry, reporting it under a generic name.
     */
    public <T> CompletableFuture<Outcome<T, E>> execute(Supplier<? extends CompletionStage<Outcome<T, E>>> attempt) {
        return execute(DEFAULT_OPERATION, attempt);
    }

    /**
     * Executes an asynchronous operation that borrows a context value for each attempt and hands
     * it back with its result. The context returned by one attempt is passed to the next.
     *
     * @param operation The operation name for reporting
     * @param context The context handed to the first attempt
     * @param attempt Starts one attempt
     * @return a future completing with the last attempt's context and outcome
     */
    public <C, T> CompletableFuture<ContextOutcome<C, T, E>> executeWithContext(
            String operation,
            C context,
            AsyncContextOperation<C, T, E> attempt
    ) {
        Objects.requireNonNull(attempt, "attempt must not be null");

        RetryRun<E> run = new RetryRun<>(operation, policy.build(), hooks, reporter);
        Loop<C, T> loop = new Loop<>(run, attempt);
        loop.start(context);
        return loop.result;
    }

    /**
     * Returns a function that runs each call through this retrier.
     *
     * @param operation The operation name for reporting
     * @param function Starts one attempt for a given argument
     * @return a function retrying every call independently
     */
    public <R, T> Function<R, CompletableFuture<Outcome<T, E>>> wrap(
            String operation,
            Function<? super R, ? extends CompletionStage<Outcome<T, E>>> function
    ) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(function, "function must not be null");
        return argument -> execute(operation, () -> function.apply(argument));
    }

    /**
     * One run of the attempt loop. Callbacks from completed stages re-enter {@link #step}; stages
     * that are already complete are handled inline by the same loop.
     */
    private final class Loop<C, T> {

        private final RetryRun<E> run;
        private final AsyncContextOperation<C, T, E> operation;
        private final CompletableFuture<ContextOutcome<C, T, E>> result = new CompletableFuture<>();

        private volatile CompletableFuture<?> pendingWait;

        Loop(RetryRun<E> run, AsyncContextOperation<C, T, E> operation) {
            this.run = run;
            this.operation = operation;
            result.whenComplete((ignored, failure) -> {
                CompletableFuture<?> wait = pendingWait;
                if (result.isCancelled() && wait != null) {
                    wait.cancel(false);
                }
            });
        }

        void start(C context) {
            step(context, false);
        }

        /**
         * Runs attempts until one of them, or a wait, has not completed yet; then registers a
         * callback and returns.
         *
         * @param context the context for the next attempt
         * @param waited whether a wait has just finished, i.e. the attempt counter must advance
         */
        private void step(C context, boolean waited) {
            C next = context;
            boolean advance = waited;
            while (true) {
                if (abandoned()) {
                    return;
                }
                if (advance) {
                    run.advance();
                }

                CompletableFuture<ContextOutcome<C, T, E>> attempt;
                try {
                    attempt = Objects.requireNonNull(operation.attempt(next), "attempt must not return a null stage")
                            .toCompletableFuture();
                } catch (RuntimeException | Error e) {
                    fail(e);
                    return;
                }

                if (!attempt.isDone()) {
                    attempt.whenComplete((outcome, failure) -> {
                        if (abandoned()) {
                            return;
                        }
                        CompletableFuture<Void> wait = afterAttempt(outcome, failure);
                        if (wait != null) {
                            resumeAfter(wait, outcome.context());
                        }
                    });
                    return;
                }

                CompletableFuture<Void> wait = afterAttempt(attempt);
                if (wait == null) {
                    return;
                }
                if (!wait.isDone()) {
                    resumeAfter(wait, attempt.join().context());
                    return;
                }
                if (wait.isCompletedExceptionally() && !abandoned()) {
                    fail(failureOf(wait));
                    return;
                }
                next = attempt.join().context();
                advance = true;
            }
        }

        private void resumeAfter(CompletableFuture<Void> wait, C context) {
            pendingWait = wait;
            wait.whenComplete((ignored, failure) -> {
                pendingWait = null;
                if (failure != null && !abandoned()) {
                    fail(failure);
                    return;
                }
                step(context, true);
            });
        }

        private CompletableFuture<Void> afterAttempt(CompletableFuture<ContextOutcome<C, T, E>> attempt) {
            try {
                return afterAttempt(attempt.join(), null);
            } catch (CompletionException | CancellationException e) {
                return afterAttempt(null, e);
            }
        }

        /**
         * Classifies a finished attempt.
         *
         * @return the wait before the next attempt, or null if the run has ended
         */
        private CompletableFuture<Void> afterAttempt(ContextOutcome<C, T, E> attempted, Throwable failure) {
            if (failure != null) {
                fail(failure);
                return null;
            }
            try {
                Objects.requireNonNull(attempted, "attempt must not complete with null");
                if (!(attempted.outcome() instanceof Outcome.Fail<T, E> failed)) {
                    run.terminate(Termination.SUCCEEDED);
                    result.complete(attempted);
                    return null;
                }

                RetryDecision decision = run.onFailure(failed.error());
                if (decision instanceof RetryDecision.GiveUp giveUp) {
                    run.terminate(giveUp.termination());
                    result.complete(attempted);
                    return null;
                }

                Duration delay = ((RetryDecision.Retry) decision).delay();
                if (delay.isZero()) {
                    return CompletableFuture.completedFuture(null);
                }
                return Objects.requireNonNull(sleeper.sleep(delay), "sleeper must not return a null stage")
                        .toCompletableFuture();
            } catch (RuntimeException | Error e) {
                fail(e);
                return null;
            }
        }

        private boolean abandoned() {
            if (!result.isDone()) {
                return false;
            }
            if (result.isCancelled()) {
                run.terminate(Termination.CANCELLED);
            }
            return true;
        }

        private void fail(Throwable failure) {
            Throwable defect = unwrap(failure);
            run.fault(defect);
            result.completeExceptionally(defect);
        }

        private Throwable failureOf(CompletableFuture<?> completed) {
            return completed.handle((value, failure) -> failure).join();
        }

        private Throwable unwrap(Throwable failure) {
            if (failure instanceof CompletionException && failure.getCause() != null) {
                return failure.getCause();
            }
            return failure;
        }
    }
}
