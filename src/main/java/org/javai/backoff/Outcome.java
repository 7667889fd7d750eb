package org.javai.backoff;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Represents the outcome of one attempt at an operation that may fail.
 * Either {@link Ok} containing a successful value, or {@link Fail} containing the caller's own error value.
 *
 * <p>The error type is chosen by the caller. Retriers classify outcomes structurally and hand the
 * most recent {@code Fail} back unchanged, so matching on the caller's error type keeps working after
 * an outcome has passed through a retry loop.
 *
 * @param <T> The type of the successful value
 * @param <E> The type of the error value
 */
public sealed interface Outcome<T, E> permits Outcome.Ok, Outcome.Fail {

    /**
     * A successful outcome containing a value.
     *
     * @param value the successful value (may be null for {@code Void} operations)
     */
    record Ok<T, E>(T value) implements Outcome<T, E> {

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public boolean isFail() {
            return false;
        }

        @Override
        public Optional<E> failure() {
            return Optional.empty();
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return value;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            return value;
        }

        @Override
        public <U> Outcome<U, E> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Ok<>(mapper.apply(value));
        }

        @Override
        public <U> Outcome<U, E> flatMap(Function<? super T, ? extends Outcome<U, E>> mapper) {
            Objects.requireNonNull(mapper);
            return mapper.apply(value);
        }

        @Override
        public <F> Outcome<T, F> mapError(Function<? super E, ? extends F> mapper) {
            return new Ok<>(value);
        }

        @Override
        public Outcome<T, E> recover(Function<? super E, ? extends T> recovery) {
            return this;
        }
    }

    /**
     * A failed outcome containing the caller's error value.
     *
     * @param error the error value, never null
     */
    record Fail<T, E>(E error) implements Outcome<T, E> {

        public Fail {
            Objects.requireNonNull(error, "error must not be null");
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public boolean isFail() {
            return true;
        }

        @Override
        public Optional<E> failure() {
            return Optional.of(error);
        }

        /**
         * Throws the error itself when it is a {@link RuntimeException}, otherwise an
         * {@link OutcomeFailedException} carrying it.
         */
        @Override
        public T getOrThrow() {
            if (error instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new OutcomeFailedException(error);
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            Objects.requireNonNull(supplier);
            return supplier.get();
        }

        @Override
        public <U> Outcome<U, E> map(Function<? super T, ? extends U> mapper) {
            return new Fail<>(error);
        }

        @Override
        public <U> Outcome<U, E> flatMap(Function<? super T, ? extends Outcome<U, E>> mapper) {
            return new Fail<>(error);
        }

        @Override
        public <F> Outcome<T, F> mapError(Function<? super E, ? extends F> mapper) {
            Objects.requireNonNull(mapper);
            return new Fail<>(mapper.apply(error));
        }

        @Override
        public Outcome<T, E> recover(Function<? super E, ? extends T> recovery) {
            Objects.requireNonNull(recovery);
            return new Ok<>(recovery.apply(error));
        }
    }

    // Query methods
    boolean isOk();
    boolean isFail();

    /**
     * Returns the error of a failed outcome.
     *
     * @return the error, or empty for a successful outcome
     */
    Optional<E> failure();

    // Value extraction
    T getOrThrow();
    T getOrElse(T defaultValue);
    T getOrElseGet(Supplier<? extends T> supplier);

    // Transformations
    <U> Outcome<U, E> map(Function<? super T, ? extends U> mapper);
    <U> Outcome<U, E> flatMap(Function<? super T, ? extends Outcome<U, E>> mapper);
    <F> Outcome<T, F> mapError(Function<? super E, ? extends F> mapper);

    // Recovery
    Outcome<T, E> recover(Function<? super E, ? extends T> recovery);

    // Static factories
    static <E> Outcome<Void, E> ok() {
        return new Ok<>(null);
    }

    static <T, E> Outcome<T, E> ok(T value) {
        return new Ok<>(value);
    }

    static <T, E> Outcome<T, E> fail(E error) {
        return new Fail<>(error);
    }
}
