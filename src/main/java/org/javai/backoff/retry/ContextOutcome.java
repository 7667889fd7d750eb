package org.javai.backoff.retry;

import org.javai.backoff.Outcome;

import java.util.Objects;

/**
 * The result of one context-carrying attempt: the context handed back by the operation,
 * paired with the attempt's outcome.
 *
 * <p>The retrier passes {@code context} into the next attempt, and returns the pair from the
 * last attempt once the run ends.
 *
 * @param context the context, as left by the attempt (may be null if the caller uses no context)
 * @param outcome the attempt's outcome
 */
public record ContextOutcome<C, T, E>(C context, Outcome<T, E> outcome) {

    public ContextOutcome {
        Objects.requireNonNull(outcome, "outcome must not be null");
    }

    public static <C, T, E> ContextOutcome<C, T, E> ok(C context, T value) {
        return new ContextOutcome<>(context, Outcome.ok(value));
    }

    public static <C, T, E> ContextOutcome<C, T, E> fail(C context, E error) {
        return new ContextOutcome<>(context, Outcome.fail(error));
    }
}
