package org.javai.backoff.policy;

import java.time.Duration;

final class PolicyChecks {

    private PolicyChecks() {}

    static void requirePositive(String name, Duration value) {
        if (value == null) {
            throw new IllegalArgumentException(name + " must be set");
        }
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be > 0, was: " + value);
        }
    }

    static void requireNonNegative(String name, Duration value) {
        if (value != null && value.isNegative()) {
            throw new IllegalArgumentException(name + " must be >= 0, was: " + value);
        }
    }

    static void requireNonNegative(String name, Integer value) {
        if (value != null && value < 0) {
            throw new IllegalArgumentException(name + " must be >= 0, was: " + value);
        }
    }

    static void requireAtLeast(String name, Duration value, String boundName, Duration bound) {
        if (value != null && value.compareTo(bound) < 0) {
            throw new IllegalArgumentException(
                    name + " must be >= " + boundName + " (" + bound + "), was: " + value);
        }
    }
}
