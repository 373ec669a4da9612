package com.lwactors;

import com.lwactors.config.ThreadPoolFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Entry point for spawning actors.
 *
 * <p>An actor is one piece of state plus a mailbox. Spawning returns the first
 * {@link ActorSender}; the action, result and error types are taken from the
 * variable it is assigned to:
 *
 * <pre>{@code
 * ActorSender<CounterAction, Long, Long, CounterError> counter =
 *         Actors.spawn(executor, 0L, CounterError::structural);
 * }</pre>
 */
public final class Actors {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private Actors() {
    }

    /**
     * Spawns an actor with an unbounded mailbox on the given executor.
     *
     * @param executor Runs the actor's processing loop; not owned by the actor
     * @param initialState The state the actor starts from
     * @param errorMapper Converts structural failures into the error type E
     * @return the first handle on the new actor
     */
    public static <A extends Action<S, R, E>, S, R, E> ActorSender<A, S, R, E> spawn(
            Executor executor, S initialState, ActorErrorMapper<E> errorMapper) {
        return builder(initialState)
                .withExecutor(executor)
                .spawn(errorMapper);
    }

    /**
     * Spawns an actor with an unbounded mailbox on the shared default executor.
     *
     * @param initialState The state the actor starts from
     * @param errorMapper Converts structural failures into the error type E
     * @return the first handle on the new actor
     */
    public static <A extends Action<S, R, E>, S, R, E> ActorSender<A, S, R, E> spawn(
            S initialState, ActorErrorMapper<E> errorMapper) {
        return builder(initialState).spawn(errorMapper);
    }

    /**
     * Starts a builder for an actor with more options than {@link #spawn}.
     *
     * @param initialState The state the actor starts from
     * @return a new builder
     */
    public static <S> ActorBuilder<S> builder(S initialState) {
        return new ActorBuilder<>(initialState);
    }

    /**
     * The executor actors run on when none is given: a work-stealing pool of
     * daemon threads, created on first use and never shut down.
     *
     * @return the shared default executor
     */
    public static Executor defaultExecutor() {
        return DefaultExecutorHolder.INSTANCE;
    }

    static String nextName() {
        return "actor-" + SEQUENCE.incrementAndGet();
    }

    private static final class DefaultExecutorHolder {
        private static final ExecutorService INSTANCE = new ThreadPoolFactory()
                .setDaemonThreads(true)
                .createExecutorService("lwactors");
    }
}
