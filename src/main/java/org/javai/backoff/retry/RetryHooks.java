package org.javai.backoff.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Predicate;

/**
 * The caller-supplied callbacks consulted after a failed attempt.
 * All of them run synchronously on the thread that observed the failure.
 *
 * @param retryWhen decides whether an error is worth another attempt
 * @param onRetry observes the error and the delay about to be waited
 * @param adjust replaces the computed delay, e.g. with a server-provided retry hint
 */
record RetryHooks<E>(
        Predicate<? super E> retryWhen,
        BiConsumer<? super E, Duration> onRetry,
        BiFunction<? super E, Duration, Duration> adjust
) {
    RetryHooks {
        Objects.requireNonNull(retryWhen, "retryWhen must not be null");
        Objects.requireNonNull(onRetry, "onRetry must not be null");
        Objects.requireNonNull(adjust, "adjust must not be null");
    }

    static <E> RetryHooks<E> defaults() {
        return new RetryHooks<>(error -> true, (error, delay) -> {}, (error, delay) -> delay);
    }

    RetryHooks<E> withRetryWhen(Predicate<? super E> retryWhen) {
        return new RetryHooks<>(retryWhen, onRetry, adjust);
    }

    RetryHooks<E> withOnRetry(BiConsumer<? super E, Duration> onRetry) {
        return new RetryHooks<>(retryWhen, onRetry, adjust);
    }

    RetryHooks<E> withAdjust(BiFunction<? super E, Duration, Duration> adjust) {
        return new RetryHooks<>(retryWhen, onRetry, adjust);
    }
}
