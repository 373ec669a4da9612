package com.lwactors;

import java.time.Duration;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Polling assertion for conditions reached asynchronously.
 * Use instead of Thread.sleep() when waiting on an actor.
 *
 * <pre>{@code
 * AsyncAssertion.eventually(() -> sender.termination().isDone(), Duration.ofSeconds(2));
 * }</pre>
 */
public final class AsyncAssertion {

    private static final long DEFAULT_POLL_INTERVAL_MS = 10;

    private AsyncAssertion() {
    }

    /**
     * Waits until the condition becomes true or timeout is reached.
     *
     * @param condition the condition to check
     * @param timeout the maximum time to wait
     * @throws AssertionError if condition doesn't become true within timeout
     */
    public static void eventually(BooleanSupplier condition, Duration timeout) {
        Objects.requireNonNull(condition, "condition cannot be null");
        Objects.requireNonNull(timeout, "timeout cannot be null");
        long endTime = System.nanoTime() + timeout.toNanos();

        while (System.nanoTime() < endTime) {
            if (condition.getAsBoolean()) {
                return;
            }
            try {
                Thread.sleep(DEFAULT_POLL_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AssertionError("Interrupted while waiting for condition", e);
            }
        }
        if (!condition.getAsBoolean()) {
            throw new AssertionError("Condition did not become true within " + timeout);
        }
    }
}
