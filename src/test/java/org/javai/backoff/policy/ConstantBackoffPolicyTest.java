package org.javai.backoff.policy;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class ConstantBackoffPolicyTest {

    @Test
    void defaults_yieldOneSecondThreeTimes() {
        Backoff backoff = ConstantBackoffPolicy.defaults().build();

        assertThat(backoff.next()).contains(Duration.ofSeconds(1));
        assertThat(backoff.next()).contains(Duration.ofSeconds(1));
        assertThat(backoff.next()).contains(Duration.ofSeconds(1));
        assertThat(backoff.next()).isEmpty();
    }

    @Test
    void withDelay_usesConfiguredDelay() {
        Backoff backoff = ConstantBackoffPolicy.defaults().withDelay(Duration.ofSeconds(2)).build();

        assertThat(drain(backoff)).containsExactly(
                Duration.ofSeconds(2), Duration.ofSeconds(2), Duration.ofSeconds(2));
    }

    @Test
    void withoutMaxTimes_isUnbounded() {
        Backoff backoff = ConstantBackoffPolicy.defaults()
                .withDelay(Duration.ofMillis(10))
                .withoutMaxTimes()
                .build();

        for (int i = 0; i < 10_000; i++) {
            assertThat(backoff.next()).contains(Duration.ofMillis(10));
        }
    }

    @Test
    void zeroMaxTimes_isExhaustedImmediately() {
        Backoff backoff = ConstantBackoffPolicy.of(Duration.ofMillis(10), 0).build();

        assertThat(backoff.next()).isEmpty();
    }

    @Test
    void exhaustion_isSticky() {
        Backoff backoff = ConstantBackoffPolicy.of(Duration.ofMillis(10), 1).build();

        assertThat(backoff.next()).isPresent();
        assertThat(backoff.next()).isEmpty();
        assertThat(backoff.next()).isEmpty();
    }

    @Test
    void maxTotalDelay_stopsBeforeCapIsExceeded() {
        Backoff backoff = ConstantBackoffPolicy.defaults()
                .withDelay(Duration.ofSeconds(1))
                .withoutMaxTimes()
                .withMaxTotalDelay(Duration.ofMillis(2500))
                .build();

        assertThat(drain(backoff)).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(1));
    }

    @Test
    void jitter_staysWithinZeroAndDelay() {
        Backoff backoff = ConstantBackoffPolicy.defaults()
                .withDelay(Duration.ofMillis(100))
                .withMaxTimes(200)
                .withJitter()
                .build();

        assertThat(drain(backoff))
                .hasSize(200)
                .allSatisfy(d -> assertThat(d).isBetween(Duration.ZERO, Duration.ofMillis(100)));
    }

    @Test
    void build_returnsIndependentSequences() {
        ConstantBackoffPolicy policy = ConstantBackoffPolicy.of(Duration.ofMillis(5), 2);

        Backoff first = policy.build();
        drain(first);
        Backoff second = policy.build();

        assertThat(first.next()).isEmpty();
        assertThat(drain(second)).hasSize(2);
    }

    @Test
    void build_rejectsNonPositiveDelay() {
        assertThatThrownBy(() -> ConstantBackoffPolicy.defaults().withDelay(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("delay");
    }

    @Test
    void build_rejectsNegativeMaxTimes() {
        assertThatThrownBy(() -> ConstantBackoffPolicy.defaults().withMaxTimes(-1).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxTimes");
    }

    @Test
    void noRetry_isExhaustedImmediately() {
        assertThat(BackoffPolicy.noRetry().build().next()).isEmpty();
    }

    @Test
    void immediate_yieldsZeroDelays() {
        assertThat(drain(BackoffPolicy.immediate(3).build()))
                .containsExactly(Duration.ZERO, Duration.ZERO, Duration.ZERO);
    }

    static List<Duration> drain(Backoff backoff) {
        List<Duration> delays = new ArrayList<>();
        Optional<Duration> next = backoff.next();
        while (next.isPresent()) {
            delays.add(next.get());
            next = backoff.next();
        }
        return delays;
    }
}
