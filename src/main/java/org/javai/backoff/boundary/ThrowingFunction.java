package org.javai.backoff.boundary;

/**
 * A function that may throw a checked exception.
 *
 * @param <R> The argument type
 * @param <T> The result type
 * @param <E> The type of exception that may be thrown
 */
@FunctionalInterface
public interface ThrowingFunction<R, T, E extends Exception> {

    T apply(R argument) throws E;
}
