package com.lwactors;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of applying an {@link Action}: a value, or a domain error.
 * Sealed to ensure exhaustive handling.
 *
 * <p>The mailbox never inspects or alters the error carried by a
 * {@link Failure}; it reaches the caller exactly as the action returned it.
 *
 * @param <R> The value type
 * @param <E> The error type
 */
public sealed interface Result<R, E> permits Result.Success, Result.Failure {

    /**
     * Successful result containing a value.
     */
    record Success<R, E>(R value) implements Result<R, E> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public R getOrThrow() {
            return value;
        }

        @Override
        public R getOrElse(R defaultValue) {
            return value;
        }

        @Override
        public R getOrElse(Function<E, R> fn) {
            return value;
        }
    }

    /**
     * Failed result containing a domain error.
     */
    record Failure<R, E>(E error) implements Result<R, E> {
        public Failure {
            Objects.requireNonNull(error, "error cannot be null");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public R getOrThrow() {
            if (error instanceof RuntimeException re) {
                throw re;
            }
            if (error instanceof Error err) {
                throw err;
            }
            throw new ReplyException("Action failed", error);
        }

        @Override
        public R getOrElse(R defaultValue) {
            return defaultValue;
        }

        @Override
        public R getOrElse(Function<E, R> fn) {
            return fn.apply(error);
        }
    }

    static <R, E> Result<R, E> success(R value) {
        return new Success<>(value);
    }

    static <R, E> Result<R, E> failure(E error) {
        return new Failure<>(error);
    }

    // Common operations
    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Returns the value, or throws the error: as-is when unchecked, otherwise
     * wrapped in a {@link ReplyException}.
     */
    R getOrThrow();

    R getOrElse(R defaultValue);

    R getOrElse(Function<E, R> fn);

    /**
     * Returns the error of a failed result.
     *
     * @return the error
     * @throws IllegalStateException if this result is a success
     */
    default E getError() {
        if (this instanceof Failure<R, E> failure) {
            return failure.error();
        }
        throw new IllegalStateException("Result is a success: " + this);
    }

    // Monadic operations
    default <U> Result<U, E> map(Function<R, U> fn) {
        if (this instanceof Success<R, E> success) {
            return new Success<>(fn.apply(success.value()));
        }
        return new Failure<>(getError());
    }

    default <F> Result<R, F> mapError(Function<E, F> fn) {
        if (this instanceof Failure<R, E> failure) {
            return new Failure<>(fn.apply(failure.error()));
        }
        return new Success<>(((Success<R, E>) this).value());
    }

    default <U> Result<U, E> flatMap(Function<R, Result<U, E>> fn) {
        if (this instanceof Success<R, E> success) {
            return fn.apply(success.value());
        }
        return new Failure<>(getError());
    }

    default Result<R, E> recover(Function<E, R> fn) {
        if (this instanceof Failure<R, E> failure) {
            return new Success<>(fn.apply(failure.error()));
        }
        return this;
    }

    default void ifSuccess(Consumer<R> consumer) {
        if (this instanceof Success<R, E> success) {
            consumer.accept(success.value());
        }
    }

    default void ifFailure(Consumer<E> consumer) {
        if (this instanceof Failure<R, E> failure) {
            consumer.accept(failure.error());
        }
    }
}
