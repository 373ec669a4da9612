package com.lwactors;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * The caller's side of one invocation's reply channel.
 *
 * <p>It resolves exactly once: with the action's own {@link Result}, or with a
 * failure built by the actor's {@link ActorErrorMapper} when the action could
 * not be submitted or its answer was lost.
 *
 * <p>Provides three tiers of API:
 * <ol>
 *   <li>Simple: {@link #get()} blocks and returns the value or throws</li>
 *   <li>Safe: {@link #await()} blocks and returns the {@link Result}</li>
 *   <li>Advanced: {@link #future()} exposes the underlying CompletableFuture</li>
 * </ol>
 *
 * <p>Discarding a Reply does not retract the action. Cancelling
 * {@link #future()} only abandons the wait.
 *
 * @param <R> The result type
 * @param <E> The error type
 */
public interface Reply<R, E> {

    // ========== TIER 1: SIMPLE API ==========

    /**
     * Blocks until the reply is available and returns the value.
     *
     * @throws ReplyException wrapping the error unless it is unchecked, in which case it is thrown as-is
     */
    R get();

    /**
     * Blocks until the reply is available or the timeout expires.
     *
     * @throws TimeoutException if the timeout expires before the reply
     */
    R get(Duration timeout) throws TimeoutException;

    // ========== TIER 2: SAFE API ==========

    /**
     * Blocks until the reply is available and returns it.
     */
    Result<R, E> await();

    /**
     * Blocks until the reply is available or the timeout expires.
     *
     * @throws TimeoutException if the timeout expires before the reply
     */
    Result<R, E> await(Duration timeout) throws TimeoutException;

    /**
     * Non-blocking check; empty until the reply has arrived.
     *
     * @throws ReplyException if the future was cancelled or completed
     *         exceptionally (a failing {@link ActorErrorMapper})
     */
    Optional<Result<R, E>> poll();

    boolean isDone();

    // ========== TIER 3: ADVANCED API ==========

    /**
     * Access the underlying CompletableFuture. It always completes normally
     * unless the caller cancels it.
     */
    CompletableFuture<Result<R, E>> future();

    // ========== COMPOSITION ==========

    /**
     * Transform the value when it arrives; failures pass through unchanged.
     */
    <U> Reply<U, E> map(Function<R, U> fn);

    /**
     * Register callbacks for success and failure. Non-blocking.
     * Neither runs if the reply is cancelled or completes exceptionally; use
     * {@link #onComplete(Consumer, Consumer, Consumer)} to observe that too.
     */
    void onComplete(Consumer<R> onSuccess, Consumer<E> onFailure);

    /**
     * Register callbacks for success, failure, and a reply that ends without a
     * {@link Result} (cancelled, or a failing {@link ActorErrorMapper}).
     * Exactly one of them runs. Non-blocking.
     */
    void onComplete(Consumer<R> onSuccess, Consumer<E> onFailure, Consumer<Throwable> onAbandoned);

    // ========== FACTORY METHODS ==========

    static <R, E> Reply<R, E> from(CompletableFuture<Result<R, E>> future) {
        return new PendingReply<>(future);
    }

    static <R, E> Reply<R, E> completed(Result<R, E> result) {
        return new PendingReply<>(CompletableFuture.completedFuture(result));
    }

    static <R, E> Reply<R, E> failed(E error) {
        return completed(Result.failure(error));
    }
}
