package org.javai.backoff.boundary;

import org.javai.backoff.Outcome;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The boundary adapter for code that signals failure by throwing checked exceptions.
 * Catches them and returns {@link Outcome} values a retrier can classify.
 *
 * <p>This is the single point where checked exceptions are translated into the Outcome world.
 * After passing through a Boundary, code operates entirely in outcome-space.</p>
 *
 * <p>RuntimeExceptions and Errors (defects) are not caught—they propagate to the caller and are
 * never retried.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Retrier<Exception> retrier = Retrier.<Exception>builder()
 *     .policy(ExponentialBackoffPolicy.defaults())
 *     .retryWhen(e -> e instanceof IOException)
 *     .build();
 *
 * Outcome<Response, Exception> result = retrier.execute(
 *     "HttpClient.send",
 *     () -> Boundary.call(() -> httpClient.send(request, BodyHandlers.ofString()))
 * );
 * }</pre>
 */
public final class Boundary {

    private Boundary() {}

    /**
     * Executes work that may throw checked exceptions, translating any such exception into a failed Outcome.
     *
     * @param work The work to execute
     * @return Ok with the result, or Fail with the checked exception
     */
    public static <T> Outcome<T, Exception> call(ThrowingSupplier<T, ? extends Exception> work) {
        Objects.requireNonNull(work, "work must not be null");

        try {
            return Outcome.ok(work.get());
        } catch (RuntimeException e) {
            // Defects propagate—they're not operational failures.
            throw e;
        } catch (Exception e) {
            return Outcome.fail(e);
        }
    }

    /**
     * Adapts a throwing function into one returning outcomes, for use with {@code Retrier.wrap}.
     */
    public static <R, T> Function<R, Outcome<T, Exception>> lift(ThrowingFunction<R, T, ? extends Exception> work) {
        Objects.requireNonNull(work, "work must not be null");
        return argument -> call(() -> work.apply(argument));
    }

    /**
     * Starts asynchronous work and translates a checked-exception completion into a failed Outcome.
     *
     * <p>Wrappers such as {@link CompletionException} are removed before classifying. A stage that
     * completes with a runtime exception or an error stays exceptional. So does a supplier that
     * throws instead of returning a stage.
     *
     * @param work Starts the work and returns its stage
     * @return a stage completing with Ok or Fail
     */
    public static <T> CompletionStage<Outcome<T, Exception>> callAsync(Supplier<? extends CompletionStage<T>> work) {
        Objects.requireNonNull(work, "work must not be null");

        CompletionStage<T> stage = Objects.requireNonNull(work.get(), "work must not return a null stage");
        CompletableFuture<Outcome<T, Exception>> lifted = new CompletableFuture<>();
        stage.whenComplete((value, failure) -> {
            if (failure == null) {
                lifted.complete(Outcome.ok(value));
                return;
            }
            Throwable cause = unwrap(failure);
            if (cause instanceof Exception checked && !(cause instanceof RuntimeException)) {
                lifted.complete(Outcome.fail(checked));
            } else {
                lifted.completeExceptionally(cause);
            }
        });
        return lifted;
    }

    static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
