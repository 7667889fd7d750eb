package org.javai.backoff.policy;

import java.util.SplittableRandom;

/**
 * Non-cryptographic randomness private to one delay sequence.
 * Each sequence owns its own instance, so concurrent retry runs never contend on a shared source.
 */
final class Jitter {

    private final SplittableRandom random;

    private Jitter(SplittableRandom random) {
        this.random = random;
    }

    static Jitter seeded(Long seed) {
        return new Jitter(seed == null ? new SplittableRandom() : new SplittableRandom(seed));
    }

    /**
     * Samples uniformly from {@code [floor, ceiling]}, both in nanoseconds.
     * A floor above the ceiling collapses the range to the ceiling.
     */
    long between(long floor, long ceiling) {
        if (floor >= ceiling) {
            return ceiling;
        }
        long bound = ceiling == Long.MAX_VALUE ? ceiling : ceiling + 1;
        return random.nextLong(floor, bound);
    }
}
