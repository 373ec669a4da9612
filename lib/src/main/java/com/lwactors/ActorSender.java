package com.lwactors;

import com.lwactors.internal.ActorChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle used to submit actions to an actor and await their replies.
 *
 * <p>Thread-safe and cheap to copy: {@link #clone()} returns a new handle on
 * the same mailbox and state. Each handle is closed independently; once every
 * handle has been closed the actor applies what is already queued and stops.
 *
 * <pre>{@code
 * try (ActorSender<CounterAction, Long, Long, CounterError> counter =
 *          Actors.spawn(executor, 0L, CounterError::structural)) {
 *     counter.invoke(new CounterAction.Add(5));
 *     long value = counter.invoke(new CounterAction.Get()).get();
 * }
 * }</pre>
 *
 * @param <A> The action type accepted by this actor
 * @param <S> The state type
 * @param <R> The result type
 * @param <E> The error type
 */
public final class ActorSender<A extends Action<S, R, E>, S, R, E> implements AutoCloseable, Cloneable {

    private static final Logger logger = LoggerFactory.getLogger(ActorSender.class);

    private final ActorChannel<A, S, R, E> channel;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    ActorSender(ActorChannel<A, S, R, E> channel) {
        this.channel = channel;
    }

    /**
     * Submits an action and returns its reply without waiting for it to run.
     *
     * <p>The action is enqueued before this method returns, so discarding the
     * reply does not stop it from being applied. If this handle is closed or
     * the actor has terminated, the reply is already failed with the mapped
     * {@link ActorException.Kind#SUBMISSION_FAILED} error.
     *
     * @param action The action to apply
     * @return The reply for this action
     */
    public Reply<R, E> invoke(A action) {
        Objects.requireNonNull(action, "action cannot be null");
        if (closed.get()) {
            logger.debug("Handle for actor {} is closed, rejecting action: {}", channel.name(), action);
            CompletableFuture<Result<R, E>> reply = new CompletableFuture<>();
            channel.completeSubmissionFailure(reply);
            return Reply.from(reply);
        }
        return channel.submit(action);
    }

    /**
     * Returns another handle on the same actor.
     *
     * @return a new, open handle
     * @throws IllegalStateException if this handle, or the actor, is closed
     */
    @Override
    public ActorSender<A, S, R, E> clone() {
        if (closed.get() || !channel.retainHandle()) {
            throw new IllegalStateException("Cannot clone a closed handle for actor " + channel.name());
        }
        return new ActorSender<>(channel);
    }

    /**
     * Closes this handle. Idempotent. Closing the last open handle lets the
     * actor drain its mailbox and stop.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            channel.releaseHandle();
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    public String name() {
        return channel.name();
    }

    /**
     * Completes once the actor has stopped. Completes exceptionally if the
     * actor stopped because its executor refused to run it.
     *
     * @return the termination future
     */
    public CompletableFuture<Void> termination() {
        return channel.termination().copy();
    }

    /**
     * Approximate number of queued actions, for diagnostics only.
     *
     * @return the queue size
     */
    public int pendingCount() {
        return channel.pendingCount();
    }

    @Override
    public String toString() {
        return "ActorSender{" + channel.name() + (closed.get() ? ", closed" : "") + '}';
    }
}
