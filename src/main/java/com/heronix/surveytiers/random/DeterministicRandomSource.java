package com.heronix.surveytiers.random;

import java.util.List;

/**
 * Seeded pseudo-random float stream.
 *
 * Linear congruential recurrence:
 *   state = (1664525 * state + 1013904223) mod 2^32
 *   output = state / 2^32
 *
 * Any implementation following the same recurrence and modulus reproduces the
 * same sequence for the same seed. Seed 1 yields state 1015568748 (~0.2363) on
 * the first call.
 *
 * Instances are stateful and must not be shared between generation runs.
 */
public final class DeterministicRandomSource {

    private static final long MULTIPLIER = 1664525L;
    private static final long INCREMENT = 1013904223L;
    private static final long MODULUS = 1L << 32;
    private static final double MODULUS_DOUBLE = 4294967296.0;

    private long state;

    /**
     * @param seed only the low 32 bits are used (treated as unsigned)
     */
    public DeterministicRandomSource(long seed) {
        this.state = seed & 0xFFFFFFFFL;
    }

    /**
     * Advance the state and return a float in [0, 1).
     */
    public double next() {
        state = (MULTIPLIER * state + INCREMENT) % MODULUS;
        return state / MODULUS_DOUBLE;
    }

    /**
     * Uniform integer in [0, bound), consuming exactly one draw.
     */
    public int nextInt(int bound) {
        if (bound <= 0) {
            throw new IllegalArgumentException("bound must be positive: " + bound);
        }
        return (int) Math.floor(next() * bound);
    }

    /**
     * Pick one element uniformly, consuming exactly one draw.
     */
    public <T> T pick(List<T> values) {
        return values.get(nextInt(values.size()));
    }

    /**
     * Current unsigned 32-bit state.
     */
    public long state() {
        return state;
    }
}
