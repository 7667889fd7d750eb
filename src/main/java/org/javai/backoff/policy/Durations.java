package org.javai.backoff.policy;

import java.time.Duration;

/**
 * Saturating arithmetic over delays expressed as nanoseconds.
 *
 * <p>Delays are bounded by {@link #MAX}, the largest duration that fits in a signed 64-bit
 * nanosecond count (roughly 292 years). Arithmetic past that bound saturates at {@code MAX}.
 */
public final class Durations {

    /**
     * The largest delay a sequence will ever yield.
     */
    public static final Duration MAX = Duration.ofNanos(Long.MAX_VALUE);

    private Durations() {}

    /**
     * Converts to nanoseconds, saturating at {@link Long#MAX_VALUE} instead of overflowing.
     */
    public static long toNanos(Duration duration) {
        if (duration.compareTo(MAX) >= 0) {
            return Long.MAX_VALUE;
        }
        return duration.toNanos();
    }

    static long saturatingAdd(long a, long b) {
        long sum = a + b;
        // both operands are non-negative, so overflow shows up as a negative sum
        return sum < 0 ? Long.MAX_VALUE : sum;
    }

    /**
     * Multiplies a nanosecond count by {@code factor^exponent}, saturating at {@code cap}.
     */
    static long scale(long nanos, double factor, int exponent, long cap) {
        double scaled = nanos * Math.pow(factor, exponent);
        if (Double.isNaN(scaled) || scaled >= cap) {
            return cap;
        }
        return Math.round(scaled);
    }
}
