package org.javai.backoff.retry;

/**
 * A blocking operation that takes a context value and must hand it back with every result,
 * successful or not.
 *
 * @param <C> The context type
 * @param <T> The type of the successful value
 * @param <E> The type of the error value
 */
@FunctionalInterface
public interface ContextOperation<C, T, E> {

    ContextOutcome<C, T, E> attempt(C context);
}
