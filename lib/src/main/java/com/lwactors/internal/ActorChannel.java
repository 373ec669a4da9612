package com.lwactors.internal;

import com.lwactors.Action;
import com.lwactors.ActorErrorMapper;
import com.lwactors.ActorException;
import com.lwactors.Reply;
import com.lwactors.Result;
import com.lwactors.mailbox.Mailbox;
import com.lwactors.mailbox.config.DefaultMailboxProvider;
import com.lwactors.mailbox.config.MailboxConfig;
import com.lwactors.mailbox.config.MailboxProvider;
import com.lwactors.mailbox.config.OverflowStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Producer and scheduling side of one actor: the mailbox, the count of open
 * sender handles, and the consumer token.
 *
 * Key features:
 * - Coalesced scheduling: the runner is submitted to the executor only by the
 *   thread that flips the consumer token from free to taken
 * - Whoever holds the token is the only consumer of the mailbox
 * - Termination once no open handle remains and the mailbox is drained
 * - Envelopes that miss the runner (executor rejection, a runner discarded by
 *   a terminated executor, late arrival after termination) are answered with
 *   REPLY_LOST, never applied
 *
 * @param <A> The action type
 * @param <S> The state type
 * @param <R> The result type
 * @param <E> The error type
 */
public final class ActorChannel<A extends Action<S, R, E>, S, R, E> {

    private static final Logger logger = LoggerFactory.getLogger(ActorChannel.class);

    private final String name;
    private final Mailbox<Envelope<A, R, E>> mailbox;
    private final OverflowStrategy overflowStrategy;
    private final long offerTimeoutNanos;
    private final Executor executor;
    private final ActorErrorMapper<E> errorMapper;
    private final ActorRunner<A, S, R, E> runner;

    private final AtomicInteger openHandles = new AtomicInteger(1);
    private final AtomicBoolean scheduled = new AtomicBoolean(false);
    // True from just before the runner is handed to the executor until it starts
    private final AtomicBoolean dispatched = new AtomicBoolean(false);
    private final CompletableFuture<Void> termination = new CompletableFuture<>();
    private volatile boolean terminated = false;

    /**
     * Creates a channel with one open handle. Nothing is scheduled until the
     * first submission. The configuration is read here only; later changes to
     * it do not affect this actor.
     *
     * @param name The actor name for logging and errors
     * @param initialState The state the runner starts from
     * @param config The mailbox configuration (throughput, overflow behaviour)
     * @param executor The executor the runner is scheduled on
     * @param errorMapper Converts structural failures into the caller's error type
     * @param onStop Receives the final state on termination, may be null
     */
    public ActorChannel(
            String name,
            S initialState,
            MailboxConfig config,
            Executor executor,
            ActorErrorMapper<E> errorMapper,
            Consumer<? super S> onStop) {
        this.name = Objects.requireNonNull(name, "name");
        Objects.requireNonNull(config, "config");
        this.overflowStrategy = config.getOverflowStrategy();
        this.offerTimeoutNanos = config.getOfferTimeoutNanos();
        MailboxProvider<Envelope<A, R, E>> provider = new DefaultMailboxProvider<>();
        this.mailbox = provider.createMailbox(config);
        this.executor = Objects.requireNonNull(executor, "executor");
        this.errorMapper = Objects.requireNonNull(errorMapper, "errorMapper");
        this.runner = new ActorRunner<>(this, initialState, onStop, config.getThroughput());
        logger.info("Actor {} started with {}", name, config);
    }

    /**
     * Enqueues an action and returns its reply. Never waits, except for space
     * in a full bounded mailbox with the BLOCK overflow strategy.
     *
     * @param action The action to apply
     * @return The reply for this action
     */
    public Reply<R, E> submit(A action) {
        CompletableFuture<Result<R, E>> reply = new CompletableFuture<>();
        if (!terminated && executorTerminated()) {
            abandonDiscardedRunner();
        }
        if (terminated) {
            logger.debug("Actor {} already terminated, rejecting action: {}", name, action);
            completeStructural(reply, ActorException.submissionFailed(name));
            return Reply.from(reply);
        }

        Envelope<A, R, E> envelope = new Envelope<>(action, reply);
        try {
            if (!enqueue(envelope)) {
                logger.warn("Actor {} mailbox full (capacity {}), rejecting action: {}",
                        name, mailbox.capacity(), action);
                completeStructural(reply, ActorException.submissionFailed(name));
                return Reply.from(reply);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("Actor {} interrupted while waiting for mailbox space", name);
            completeStructural(reply, ActorException.submissionFailed(name, e));
            return Reply.from(reply);
        }

        signal();
        return Reply.from(reply);
    }

    private boolean enqueue(Envelope<A, R, E> envelope) throws InterruptedException {
        if (mailbox.offer(envelope)) {
            return true;
        }
        if (overflowStrategy == OverflowStrategy.FAIL) {
            return false;
        }
        return mailbox.offer(envelope, offerTimeoutNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Registers one more open handle.
     *
     * @return false if every handle was already closed
     */
    public boolean retainHandle() {
        int current;
        do {
            current = openHandles.get();
            if (current == 0) {
                return false;
            }
        } while (!openHandles.compareAndSet(current, current + 1));
        return true;
    }

    /**
     * Releases one open handle. The last release lets the runner drain the
     * mailbox and terminate.
     */
    public void releaseHandle() {
        int remaining = openHandles.decrementAndGet();
        if (remaining == 0) {
            logger.debug("Actor {} has no open handles, draining {} pending actions",
                    name, mailbox.size());
            signal();
        } else if (remaining < 0) {
            throw new IllegalStateException("Actor " + name + " handle released more than once");
        }
    }

    /**
     * Takes the consumer token if it is free and acts on it: schedules the
     * runner, or fails whatever is queued if the actor has terminated.
     */
    private void signal() {
        if (!scheduled.compareAndSet(false, true)) {
            if (executorTerminated()) {
                abandonDiscardedRunner();
            }
            return;
        }
        if (terminated) {
            failPending();
            return;
        }
        dispatched.set(true);
        try {
            executor.execute(runner);
        } catch (RuntimeException e) {
            if (!dispatched.compareAndSet(true, false)) {
                // Another thread found the executor terminated and took over
                return;
            }
            logger.error("Actor {} could not be scheduled, terminating: {}", name, e.getMessage(), e);
            terminate(e);
            failPending();
        }
    }

    /**
     * Called by the runner when an activation starts.
     */
    void activated() {
        dispatched.set(false);
    }

    private boolean executorTerminated() {
        return executor instanceof ExecutorService service && service.isTerminated();
    }

    /**
     * Takes over the consumer side when the executor terminated while holding
     * a runner it never started, as {@code shutdownNow()} does. A terminated
     * executor runs nothing, so winning the dispatched flag makes the caller
     * the only consumer.
     */
    private void abandonDiscardedRunner() {
        if (!dispatched.compareAndSet(true, false)) {
            return;
        }
        logger.error("Actor {} runner was discarded by its terminated executor, terminating", name);
        terminate(new RejectedExecutionException("Executor terminated before running actor " + name));
        failPending();
    }

    /**
     * Called by the runner at the end of each activation, still holding the token.
     */
    void afterRun() {
        if (!terminated && openHandles.get() == 0 && mailbox.isEmpty()) {
            terminate(null);
        }
        if (terminated) {
            failPending();
            return;
        }
        scheduled.set(false);
        // Recheck: work that arrived while the token was held would otherwise be missed
        if (!mailbox.isEmpty() || openHandles.get() == 0) {
            signal();
        }
    }

    private void terminate(Throwable cause) {
        terminated = true;
        runner.stop();
        if (cause == null) {
            termination.complete(null);
        } else {
            termination.completeExceptionally(cause);
        }
    }

    /**
     * Answers every queued envelope with REPLY_LOST, then releases the token.
     * Only called after termination, by the token holder.
     */
    private void failPending() {
        do {
            Envelope<A, R, E> envelope;
            int failed = 0;
            while ((envelope = mailbox.poll()) != null) {
                completeStructural(envelope.reply(), ActorException.replyLost(name));
                failed++;
            }
            if (failed > 0) {
                logger.debug("Actor {} terminated, {} pending actions not applied", name, failed);
            }
            scheduled.set(false);
        } while (!mailbox.isEmpty() && scheduled.compareAndSet(false, true));
    }

    /**
     * Fails a reply for an action that was never enqueued.
     *
     * @param reply The reply to complete
     */
    public void completeSubmissionFailure(CompletableFuture<Result<R, E>> reply) {
        completeStructural(reply, ActorException.submissionFailed(name));
    }

    void completeStructural(CompletableFuture<Result<R, E>> reply, ActorException error) {
        Result<R, E> failure;
        try {
            failure = Result.failure(errorMapper.map(error));
        } catch (RuntimeException e) {
            logger.error("Actor {} error mapper failed for: {}", name, error.getKind(), e);
            e.addSuppressed(error);
            reply.completeExceptionally(e);
            return;
        }
        reply.complete(failure);
    }

    Mailbox<Envelope<A, R, E>> mailbox() {
        return mailbox;
    }

    ActorRunner<A, S, R, E> runner() {
        return runner;
    }

    public String name() {
        return name;
    }

    public boolean isTerminated() {
        return terminated;
    }

    public CompletableFuture<Void> termination() {
        return termination;
    }

    public int pendingCount() {
        return mailbox.size();
    }

    public int openHandles() {
        return openHandles.get();
    }
}
