package org.javai.backoff.retry;

import org.javai.backoff.Outcome;
import org.javai.backoff.ops.RetryReporter;
import org.javai.backoff.policy.BackoffPolicy;
import org.javai.backoff.policy.ConstantBackoffPolicy;
import org.javai.backoff.policy.ExponentialBackoffPolicy;
import org.javai.backoff.policy.FibonacciBackoffPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.*;

class RetrierTest {

    private List<Duration> sleeps;
    private List<RetryAttempt> reportedRetries;
    private List<Terminated> reportedTerminations;
    private RetryReporter reporter;

    record RetryAttempt(String operation, Object error, int attemptNumber, Duration delay) {}
    record Terminated(String operation, Termination termination, int totalAttempts, Object lastError) {}

    record HttpError(int status, Duration retryAfter) {
        boolean isTransient() {
            return status >= 500 || status == 429;
        }
    }

    @BeforeEach
    void setUp() {
        sleeps = new ArrayList<>();
        reportedRetries = new ArrayList<>();
        reportedTerminations = new ArrayList<>();

        reporter = new RetryReporter() {
            @Override
            public void reportRetryAttempt(String operation, Object error, int attemptNumber, Duration delay) {
                reportedRetries.add(new RetryAttempt(operation, error, attemptNumber, delay));
            }

            @Override
            public void reportTerminated(String operation, Termination termination, int totalAttempts, Object lastError) {
                reportedTerminations.add(new Terminated(operation, termination, totalAttempts, lastError));
            }
        };
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private <E> Retrier.Builder<E> retrier(BackoffPolicy policy) {
        return Retrier.<E>builder()
                .policy(policy)
                .reporter(reporter)
                .sleeper(sleeps::add);
    }

    @Test
    void execute_success_returnsOkWithoutWaiting() {
        Retrier<String> retrier = this.<String>retrier(ConstantBackoffPolicy.defaults()).build();

        Outcome<String, String> result = retrier.execute("Op", () -> Outcome.ok("success"));

        assertThat(result.getOrThrow()).isEqualTo("success");
        assertThat(sleeps).isEmpty();
        assertThat(reportedRetries).isEmpty();
        assertThat(reportedTerminations).containsExactly(new Terminated("Op", Termination.SUCCEEDED, 1, null));
    }

    @Test
    void execute_retriesUntilSuccess() {
        AtomicInteger adjusted = new AtomicInteger();
        AtomicInteger notified = new AtomicInteger();
        Retrier<String> retrier = this.<String>retrier(ConstantBackoffPolicy.of(Duration.ofMillis(10), 3))
                .adjust((error, delay) -> {
                    adjusted.incrementAndGet();
                    return delay;
                })
                .onRetry((error, delay) -> notified.incrementAndGet())
                .build();
        AtomicInteger attempts = new AtomicInteger();

        Outcome<String, String> result = retrier.execute("Op", () -> {
            if (attempts.incrementAndGet() < 3) {
                return Outcome.fail("attempt " + attempts.get());
            }
            return Outcome.ok("success on attempt 3");
        });

        assertThat(result.getOrThrow()).isEqualTo("success on attempt 3");
        assertThat(attempts.get()).isEqualTo(3);
        assertThat(adjusted.get()).isEqualTo(2);
        assertThat(notified.get()).isEqualTo(2);
        assertThat(sleeps).containsExactly(Duration.ofMillis(10), Duration.ofMillis(10));
        assertThat(reportedRetries).extracting(RetryAttempt::attemptNumber).containsExactly(1, 2);
        assertThat(reportedTerminations).containsExactly(new Terminated("Op", Termination.SUCCEEDED, 3, null));
    }

    @Test
    void execute_alwaysFailing_waitsOutTheWholeSequenceAndReturnsLastError() {
        Retrier<String> retrier = this.<String>retrier(ExponentialBackoffPolicy.defaults()
                .withMaxDelay(Duration.ofSeconds(4))
                .withMaxTimes(5)).build();
        AtomicInteger attempts = new AtomicInteger();

        Outcome<String, String> result = retrier.execute("Op", () -> Outcome.fail("failure " + attempts.incrementAndGet()));

        assertThat(attempts.get()).isEqualTo(6);
        assertThat(sleeps).containsExactly(
                Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4),
                Duration.ofSeconds(4), Duration.ofSeconds(4));
        assertThat(result.failure()).contains("failure 6");
        assertThat(reportedTerminations).containsExactly(
                new Terminated("Op", Termination.EXHAUSTED, 6, "failure 6"));
    }

    @Test
    void execute_zeroMaxTimes_runsOnce() {
        Retrier<String> retrier = this.<String>retrier(ConstantBackoffPolicy.of(Duration.ofMillis(10), 0)).build();
        AtomicInteger attempts = new AtomicInteger();

        Outcome<Integer, String> result = retrier.execute("Op", () -> {
            attempts.incrementAndGet();
            return Outcome.fail("nope");
        });

        assertThat(attempts.get()).isEqualTo(1);
        assertThat(result.failure()).contains("nope");
        assertThat(sleeps).isEmpty();
    }

    @Test
    void execute_retryWhenRejects_returnsImmediatelyWithoutConsumingBackoff() {
        Retrier<HttpError> retrier = this.<HttpError>retrier(FibonacciBackoffPolicy.defaults())
                .retryWhen(HttpError::isTransient)
                .build();
        AtomicInteger attempts = new AtomicInteger();

        Outcome<String, HttpError> result = retrier.execute("FetchUser", () -> {
            attempts.incrementAndGet();
            return Outcome.fail(new HttpError(404, null));
        });

        assertThat(attempts.get()).isEqualTo(1);
        assertThat(result.failure()).contains(new HttpError(404, null));
        assertThat(sleeps).isEmpty();
        assertThat(reportedTerminations).extracting(Terminated::termination).containsExactly(Termination.REJECTED);
    }

    @Test
    void execute_errorReturnedUnchanged_soCallerCanMatchOnIt() {
        Retrier<HttpError> retrier = this.<HttpError>retrier(ConstantBackoffPolicy.of(Duration.ofMillis(1), 2)).build();
        HttpError error = new HttpError(503, null);

        Outcome<String, HttpError> result = retrier.execute("Op", () -> Outcome.fail(error));

        assertThat(result).isInstanceOf(Outcome.Fail.class);
        assertThat(((Outcome.Fail<String, HttpError>) result).error()).isSameAs(error);
    }

    @Test
    void execute_onRetrySeesEachErrorAndDelayBeforeWaiting() {
        List<String> events = new ArrayList<>();
        Retrier<String> retrier = Retrier.<String>builder()
                .policy(ConstantBackoffPolicy.of(Duration.ofMillis(5), 2))
                .onRetry((error, delay) -> events.add("retry " + error + " " + delay.toMillis()))
                .sleeper(delay -> events.add("sleep " + delay.toMillis()))
                .build();
        AtomicInteger attempts = new AtomicInteger();

        retrier.execute("Op", () -> Outcome.fail("e" + attempts.incrementAndGet()));

        assertThat(events).containsExactly("retry e1 5", "sleep 5", "retry e2 5", "sleep 5");
    }

    @Test
    void execute_adjustReplacesDelayWithServerHint() {
        Retrier<HttpError> retrier = this.<HttpError>retrier(ExponentialBackoffPolicy.defaults())
                .adjust((error, delay) -> error.retryAfter() != null ? error.retryAfter() : delay)
                .build();
        AtomicInteger attempts = new AtomicInteger();

        Outcome<String, HttpError> result = retrier.execute("Op", () -> {
            int n = attempts.incrementAndGet();
            if (n == 1) {
                return Outcome.fail(new HttpError(429, Duration.ofSeconds(30)));
            }
            if (n == 2) {
                return Outcome.fail(new HttpError(503, null));
            }
            return Outcome.ok("done");
        });

        assertThat(result.isOk()).isTrue();
        // the adjusted delay does not reset the sequence: the second pull is still 2s
        assertThat(sleeps).containsExactly(Duration.ofSeconds(30), Duration.ofSeconds(2));
        assertThat(reportedRetries).extracting(RetryAttempt::delay)
                .containsExactly(Duration.ofSeconds(30), Duration.ofSeconds(2));
    }

    @Test
    void execute_adjustToZero_skipsWaitingButStillNotifies() {
        List<Duration> notified = new ArrayList<>();
        Retrier<String> retrier = this.<String>retrier(ConstantBackoffPolicy.of(Duration.ofSeconds(1), 2))
                .adjust((error, delay) -> Duration.ZERO)
                .onRetry((error, delay) -> notified.add(delay))
                .build();
        AtomicInteger attempts = new AtomicInteger();

        retrier.execute("Op", () -> Outcome.fail("e" + attempts.incrementAndGet()));

        assertThat(attempts.get()).isEqualTo(3);
        assertThat(notified).containsExactly(Duration.ZERO, Duration.ZERO);
        assertThat(sleeps).isEmpty();
        assertThat(reportedRetries).extracting(RetryAttempt::delay).containsExactly(Duration.ZERO, Duration.ZERO);
    }

    @Test
    void execute_adjustReturningNegativeDelay_throws() {
        Retrier<String> retrier = this.<String>retrier(ConstantBackoffPolicy.defaults())
                .adjust((error, delay) -> Duration.ofMillis(-1))
                .build();

        assertThatThrownBy(() -> retrier.execute("Op", () -> Outcome.fail("e")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("adjust");
    }

    @Test
    void execute_runtimeExceptionFromOperation_propagatesWithoutRetry() {
        Retrier<String> retrier = this.<String>retrier(ConstantBackoffPolicy.defaults()).build();
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> retrier.execute("Op", () -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("bug");
        }))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("bug");
        assertThat(attempts.get()).isEqualTo(1);
    }

    @Test
    void execute_exceptionAfterRetries_isReportedAsFaultedBeforePropagating() {
        Retrier<String> retrier = this.<String>retrier(ConstantBackoffPolicy.of(Duration.ofMillis(1), 3)).build();
        AtomicInteger attempts = new AtomicInteger();
        IllegalStateException bug = new IllegalStateException("bug");

        assertThatThrownBy(() -> retrier.execute("Op", () -> {
            if (attempts.incrementAndGet() < 3) {
                return Outcome.fail("e" + attempts.get());
            }
            throw bug;
        })).isSameAs(bug);

        assertThat(reportedRetries).hasSize(2);
        assertThat(reportedTerminations).containsExactly(new Terminated("Op", Termination.FAULTED, 3, bug));
    }

    @Test
    void execute_throwingHook_isReportedAsFaulted() {
        Retrier<String> retrier = this.<String>retrier(ConstantBackoffPolicy.defaults())
                .retryWhen(error -> {
                    throw new UnsupportedOperationException("no classifier for " + error);
                })
                .build();

        assertThatThrownBy(() -> retrier.execute("Op", () -> Outcome.fail("e")))
                .isInstanceOf(UnsupportedOperationException.class);

        assertThat(reportedTerminations).extracting(Terminated::termination).containsExactly(Termination.FAULTED);
        assertThat(reportedTerminations.get(0).lastError()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void execute_interruptedWhileWaiting_returnsLastFailureAndKeepsInterruptFlag() {
        Retrier<String> retrier = Retrier.<String>builder()
                .policy(ConstantBackoffPolicy.defaults())
                .reporter(reporter)
                .sleeper(delay -> {
                    throw new InterruptedException("stop");
                })
                .build();
        AtomicInteger attempts = new AtomicInteger();

        Outcome<String, String> result = retrier.execute("Op", () -> Outcome.fail("e" + attempts.incrementAndGet()));

        assertThat(attempts.get()).isEqualTo(1);
        assertThat(result.failure()).contains("e1");
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
        assertThat(reportedTerminations).extracting(Terminated::termination).containsExactly(Termination.INTERRUPTED);
    }

    @Test
    void execute_eachCallStartsAFreshSequence() {
        Retrier<String> retrier = this.<String>retrier(ExponentialBackoffPolicy.defaults()).build();

        retrier.execute("Op", () -> Outcome.fail("e"));
        retrier.execute("Op", () -> Outcome.fail("e"));

        assertThat(sleeps).containsExactly(
                Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4),
                Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4));
    }

    @Test
    void execute_withRealSleeper_waits() {
        Retrier<String> retrier = Retrier.<String>builder()
                .policy(ConstantBackoffPolicy.of(Duration.ofMillis(20), 2))
                .build();
        long start = System.nanoTime();

        retrier.execute(() -> Outcome.fail("e"));

        assertThat(Duration.ofNanos(System.nanoTime() - start)).isGreaterThanOrEqualTo(Duration.ofMillis(40));
    }

    @Test
    void executeWithContext_threadsContextThroughAttempts() {
        Retrier<String> retrier = this.<String>retrier(ConstantBackoffPolicy.of(Duration.ofMillis(1), 5)).build();
        List<Integer> seen = new ArrayList<>();

        ContextOutcome<Integer, String, String> result = retrier.executeWithContext("Op", 0, connection -> {
            seen.add(connection);
            if (connection < 2) {
                return ContextOutcome.fail(connection + 1, "not yet");
            }
            return ContextOutcome.ok(connection, "ready on " + connection);
        });

        assertThat(seen).containsExactly(0, 1, 2);
        assertThat(result.context()).isEqualTo(2);
        assertThat(result.outcome().getOrThrow()).isEqualTo("ready on 2");
    }

    @Test
    void executeWithContext_exhausted_returnsLastContextWithLastError() {
        Retrier<String> retrier = this.<String>retrier(ConstantBackoffPolicy.of(Duration.ofMillis(1), 2)).build();

        ContextOutcome<StringBuilder, String, String> result = retrier.executeWithContext(
                "Op", new StringBuilder(), buffer -> ContextOutcome.fail(buffer.append('x'), "fail " + buffer.length()));

        assertThat(result.context().toString()).isEqualTo("xxx");
        assertThat(result.outcome().failure()).contains("fail 3");
    }

    @Test
    void wrap_retriesEachCallIndependently() {
        Retrier<IOException> retrier = this.<IOException>retrier(ConstantBackoffPolicy.of(Duration.ofMillis(1), 1)).build();
        AtomicInteger calls = new AtomicInteger();

        Function<String, Outcome<Integer, IOException>> length = retrier.wrap("Length", s -> {
            if (calls.incrementAndGet() % 2 == 1) {
                return Outcome.fail(new IOException("flaky"));
            }
            return Outcome.ok(s.length());
        });

        assertThat(length.apply("abc").getOrThrow()).isEqualTo(3);
        assertThat(length.apply("hello").getOrThrow()).isEqualTo(5);
        assertThat(calls.get()).isEqualTo(4);
    }

    @Test
    void builder_withoutPolicy_throws() {
        assertThatThrownBy(() -> Retrier.<String>builder().build())
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("policy");
    }

    @Test
    void builder_invalidPolicy_failsAtBuildTime() {
        assertThatThrownBy(() -> Retrier.<String>builder()
                .policy(ExponentialBackoffPolicy.defaults().withFactor(0.1))
                .build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void attempt_retriesCheckedExceptions() {
        AtomicInteger attempts = new AtomicInteger();

        Outcome<String, Exception> result = Retrier.attempt(2, () -> {
            if (attempts.incrementAndGet() < 2) {
                throw new IOException("temporary");
            }
            return "ok";
        });

        assertThat(result.getOrThrow()).isEqualTo("ok");
        assertThat(attempts.get()).isEqualTo(2);
    }

    @Test
    void attempt_negativeMaxTimes_throws() {
        assertThatThrownBy(() -> Retrier.attempt(-1, () -> "never"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
