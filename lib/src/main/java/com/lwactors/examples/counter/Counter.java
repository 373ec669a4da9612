package com.lwactors.examples.counter;

import com.lwactors.ActorSender;
import com.lwactors.Actors;
import com.lwactors.Reply;

import java.util.concurrent.Executor;

/**
 * A shared counter. Copies made with {@link #clone()} can be handed to other
 * threads; every copy updates the same value.
 */
public final class Counter implements AutoCloseable {

    private final ActorSender<CounterAction, Long, Long, CounterError> sender;

    private Counter(ActorSender<CounterAction, Long, Long, CounterError> sender) {
        this.sender = sender;
    }

    public static Counter start(Executor executor) {
        return start(executor, 0L);
    }

    public static Counter start(Executor executor, long initialValue) {
        ActorSender<CounterAction, Long, Long, CounterError> sender =
                Actors.spawn(executor, initialValue, CounterError::structural);
        return new Counter(sender);
    }

    public Reply<Long, CounterError> add(long amount) {
        return sender.invoke(new CounterAction.Add(amount));
    }

    public Reply<Long, CounterError> subtract(long amount) {
        return sender.invoke(new CounterAction.Subtract(amount));
    }

    public Reply<Long, CounterError> value() {
        return sender.invoke(new CounterAction.Get());
    }

    @Override
    public Counter clone() {
        return new Counter(sender.clone());
    }

    @Override
    public void close() {
        sender.close();
    }
}
