package org.javai.backoff.sleep;

import org.javai.backoff.policy.Durations;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Waits out a delay cooperatively: the returned stage completes once the duration has elapsed,
 * and no thread is blocked in the meantime.
 *
 * <p>The embedding application chooses the timer. The defaults below use the JDK's own
 * scheduling facilities; a runtime with its own event loop supplies an implementation backed by
 * that loop's timer.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Starts a wait.
     *
     * @param duration how long to wait; never negative
     * @return a stage that completes normally once the duration has elapsed
     */
    CompletionStage<Void> sleep(Duration duration);

    /**
     * A sleeper backed by {@link CompletableFuture#delayedExecutor(long, TimeUnit)}.
     * Continuations run on the common pool.
     */
    static Sleeper delayed() {
        return duration -> CompletableFuture.runAsync(
                () -> {},
                CompletableFuture.delayedExecutor(Durations.toNanos(duration), TimeUnit.NANOSECONDS));
    }

    /**
     * A sleeper backed by the given scheduler. Continuations run on the scheduler's threads.
     * Cancelling the returned future cancels the scheduled wake-up.
     *
     * @param scheduler the scheduler to use; its lifecycle is owned by the caller
     */
    static Sleeper scheduled(ScheduledExecutorService scheduler) {
        Objects.requireNonNull(scheduler, "scheduler must not be null");
        return duration -> {
            CompletableFuture<Void> wakeUp = new CompletableFuture<>();
            ScheduledFuture<?> task = scheduler.schedule(
                    () -> wakeUp.complete(null), Durations.toNanos(duration), TimeUnit.NANOSECONDS);
            wakeUp.whenComplete((ignored, failure) -> {
                if (wakeUp.isCancelled()) {
                    task.cancel(false);
                }
            });
            return wakeUp;
        };
    }
}
