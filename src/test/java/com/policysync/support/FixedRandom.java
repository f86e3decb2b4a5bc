package com.policysync.support;

import java.util.random.RandomGenerator;

/** Always draws the same value, clamped into the requested bound. */
public class FixedRandom implements RandomGenerator {

    private final long value;

    public FixedRandom(long value) {
        this.value = value;
    }

    @Override
    public long nextLong() {
        return value;
    }

    @Override
    public long nextLong(long bound) {
        return Math.min(value, bound - 1);
    }
}
