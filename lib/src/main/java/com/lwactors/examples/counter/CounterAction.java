package com.lwactors.examples.counter;

import com.lwactors.Action;
import com.lwactors.Result;
import com.lwactors.StateCell;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Operations on a counter. Each returns the counter's value after it was applied.
 */
public sealed interface CounterAction extends Action<Long, Long, CounterError> {

    Logger logger = LoggerFactory.getLogger(CounterAction.class);

    record Add(long amount) implements CounterAction {
        @Override
        public Result<Long, CounterError> act(StateCell<Long> state) {
            long current = state.get();
            logger.debug("Acting {} on {}", this, current);
            try {
                return Result.success(state.update(value -> Math.addExact(value, amount)));
            } catch (ArithmeticException e) {
                return Result.failure(new CounterError.Overflow(current, amount));
            }
        }
    }

    record Subtract(long amount) implements CounterAction {
        @Override
        public Result<Long, CounterError> act(StateCell<Long> state) {
            long current = state.get();
            logger.debug("Acting {} on {}", this, current);
            try {
                return Result.success(state.update(value -> Math.subtractExact(value, amount)));
            } catch (ArithmeticException e) {
                return Result.failure(new CounterError.Underflow(current, amount));
            }
        }
    }

    record Get() implements CounterAction {
        @Override
        public Result<Long, CounterError> act(StateCell<Long> state) {
            return Result.success(state.get());
        }
    }
}
