package com.lwactors;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Implementation of Reply backed by CompletableFuture.
 */
record PendingReply<R, E>(CompletableFuture<Result<R, E>> future) implements Reply<R, E> {

    // ========== TIER 1: SIMPLE API ==========

    @Override
    public R get() {
        return await().getOrThrow();
    }

    @Override
    public R get(Duration timeout) throws TimeoutException {
        return await(timeout).getOrThrow();
    }

    // ========== TIER 2: SAFE API ==========

    @Override
    public Result<R, E> await() {
        try {
            return future.join();
        } catch (CancellationException e) {
            throw new ReplyException("Reply was cancelled", e);
        } catch (CompletionException e) {
            throw new ReplyException("Reply failed", e.getCause());
        }
    }

    @Override
    public Result<R, E> await(Duration timeout) throws TimeoutException {
        try {
            return future.get(saturatedNanos(timeout), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ReplyException("Interrupted while waiting for reply", e);
        } catch (CancellationException e) {
            throw new ReplyException("Reply was cancelled", e);
        } catch (ExecutionException e) {
            throw new ReplyException("Reply failed", e.getCause());
        }
    }

    private static long saturatedNanos(Duration timeout) {
        try {
            return timeout.toNanos();
        } catch (ArithmeticException e) {
            return timeout.isNegative() ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
    }

    @Override
    public Optional<Result<R, E>> poll() {
        if (!future.isDone()) {
            return Optional.empty();
        }
        return Optional.of(await());
    }

    @Override
    public boolean isDone() {
        return future.isDone();
    }

    // ========== COMPOSITION ==========

    @Override
    public <U> Reply<U, E> map(Function<R, U> fn) {
        return new PendingReply<>(future.thenApply(result -> result.map(fn)));
    }

    @Override
    public void onComplete(Consumer<R> onSuccess, Consumer<E> onFailure) {
        onComplete(onSuccess, onFailure, error -> { });
    }

    @Override
    public void onComplete(Consumer<R> onSuccess, Consumer<E> onFailure, Consumer<Throwable> onAbandoned) {
        future.whenComplete((result, error) -> {
            if (error != null) {
                Throwable cause = error instanceof CompletionException
                        ? error.getCause()
                        : error;
                onAbandoned.accept(cause);
            } else {
                result.ifSuccess(onSuccess);
                result.ifFailure(onFailure);
            }
        });
    }
}
