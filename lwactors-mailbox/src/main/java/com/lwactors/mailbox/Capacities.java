package com.lwactors.mailbox;

/**
 * Sizing helpers shared by the array-backed mailboxes and their configuration.
 */
public final class Capacities {

    // Largest power of two representable as an int
    public static final int MAX_POWER_OF_TWO = 1 << 30;

    private Capacities() {
    }

    /**
     * Rounds up to the next power of 2.
     */
    static int nextPowerOfTwo(int value) {
        if (value <= 1) {
            return 1;
        }
        if (value > MAX_POWER_OF_TWO) {
            throw new IllegalArgumentException("Capacity too large: " + value);
        }
        if ((value & (value - 1)) == 0) {
            return value;
        }
        return Integer.highestOneBit(value) << 1;
    }

    /**
     * The number of messages a bounded mailbox created with the requested
     * capacity actually holds: the next power of two, and at least 2.
     *
     * @param requested the requested capacity (must be positive)
     * @return the effective capacity
     */
    public static int boundedCapacity(int requested) {
        if (requested <= 0) {
            throw new IllegalArgumentException("Capacity must be positive, got: " + requested);
        }
        return nextPowerOfTwo(Math.max(2, requested));
    }
}
