package com.lwactors;

import com.lwactors.internal.ActorChannel;
import com.lwactors.mailbox.config.MailboxConfig;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Builder for spawning actors with a fluent API.
 *
 * @param <S> The type of the actor's state
 */
public class ActorBuilder<S> {

    private final S initialState;
    private String name;
    private Executor executor;
    private MailboxConfig mailboxConfig;
    private Consumer<? super S> onStop;

    ActorBuilder(S initialState) {
        this.initialState = initialState;
        this.mailboxConfig = new MailboxConfig();
    }

    /**
     * Sets the name used in logs and in {@link ActorException}s.
     * Defaults to {@code actor-<n>}.
     *
     * @param name The actor name
     * @return This builder for method chaining
     */
    public ActorBuilder<S> withName(String name) {
        this.name = Objects.requireNonNull(name, "name");
        return this;
    }

    /**
     * Sets the executor running the actor's processing loop.
     * Defaults to {@link Actors#defaultExecutor()}.
     *
     * @param executor The executor
     * @return This builder for method chaining
     */
    public ActorBuilder<S> withExecutor(Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
        return this;
    }

    /**
     * Sets the mailbox configuration. Defaults to an unbounded mailbox.
     *
     * @param mailboxConfig The mailbox configuration
     * @return This builder for method chaining
     */
    public ActorBuilder<S> withMailboxConfig(MailboxConfig mailboxConfig) {
        this.mailboxConfig = Objects.requireNonNull(mailboxConfig, "mailboxConfig");
        return this;
    }

    /**
     * Registers a hook that receives the final state when the actor stops.
     * Runs once, after the last action has been applied.
     *
     * @param onStop The stop hook
     * @return This builder for method chaining
     */
    public ActorBuilder<S> onStop(Consumer<? super S> onStop) {
        this.onStop = Objects.requireNonNull(onStop, "onStop");
        return this;
    }

    /**
     * Spawns the actor.
     *
     * @param errorMapper Converts structural failures into the error type E
     * @return the first handle on the new actor
     */
    public <A extends Action<S, R, E>, R, E> ActorSender<A, S, R, E> spawn(ActorErrorMapper<E> errorMapper) {
        Objects.requireNonNull(errorMapper, "errorMapper");
        String actorName = name != null ? name : Actors.nextName();
        Executor actorExecutor = executor != null ? executor : Actors.defaultExecutor();
        ActorChannel<A, S, R, E> channel = new ActorChannel<>(
                actorName, initialState, mailboxConfig, actorExecutor, errorMapper, onStop);
        return new ActorSender<>(channel);
    }
}
