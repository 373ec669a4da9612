package com.lwactors.examples.counter;

import com.lwactors.ActorException;

/**
 * Errors a {@link Counter} can report.
 */
public sealed interface CounterError {

    /**
     * Adding {@code amount} would take the counter above {@link Long#MAX_VALUE}
     * or, for a negative amount, below {@link Long#MIN_VALUE}.
     */
    record Overflow(long current, long amount) implements CounterError {
    }

    /**
     * Subtracting {@code amount} would take the counter outside the range of a long.
     */
    record Underflow(long current, long amount) implements CounterError {
    }

    /**
     * The counter actor could not take or answer the request.
     */
    record Unavailable(ActorException cause) implements CounterError {
    }

    static CounterError structural(ActorException cause) {
        return new Unavailable(cause);
    }
}
