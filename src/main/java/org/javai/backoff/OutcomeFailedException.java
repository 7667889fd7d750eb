package org.javai.backoff;

/**
 * Thrown when {@link Outcome#getOrThrow()} is called on a failed outcome whose error is not
 * itself a {@link RuntimeException}.
 * This is an unchecked exception because it indicates misuse of the API—
 * the caller should have checked {@link Outcome#isFail()} first or used pattern matching.
 */
public class OutcomeFailedException extends RuntimeException {

    private final transient Object error;

    public OutcomeFailedException(Object error) {
        super("Outcome failed: " + describe(error), causeOf(error));
        this.error = error;
    }

    /**
     * The error carried by the failed outcome.
     */
    public Object error() {
        return error;
    }

    private static Throwable causeOf(Object error) {
        return error instanceof Throwable ? (Throwable) error : null;
    }

    private static String describe(Object error) {
        if (error instanceof Throwable throwable && throwable.getMessage() != null) {
            return throwable.getMessage();
        }
        return String.valueOf(error);
    }
}
