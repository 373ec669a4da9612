package com.lwactors.internal;

import com.lwactors.Action;
import com.lwactors.ActorException;
import com.lwactors.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * The actor's processing loop. Each activation applies up to 'throughput'
 * actions from the mailbox, in order, to the state it owns, then hands
 * control back to the channel which re-schedules it if more work remains.
 *
 * Only one activation runs at a time: the channel submits the runner to the
 * executor only after winning the consumer token.
 *
 * @param <A> The action type
 * @param <S> The state type
 * @param <R> The result type
 * @param <E> The error type
 */
final class ActorRunner<A extends Action<S, R, E>, S, R, E> implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(ActorRunner.class);

    private final ActorChannel<A, S, R, E> channel;
    private final OwnedState<S> state;
    private final Consumer<? super S> onStop;
    private final int throughput;

    // Written only by the token holder
    private long applied;

    ActorRunner(ActorChannel<A, S, R, E> channel, S initialState, Consumer<? super S> onStop, int throughput) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.state = new OwnedState<>(initialState);
        this.onStop = onStop;
        this.throughput = Math.max(1, throughput);
    }

    @Override
    public void run() {
        channel.activated();
        int processed = 0;
        try {
            Envelope<A, R, E> envelope;
            while (processed < throughput && (envelope = channel.mailbox().poll()) != null) {
                apply(envelope);
                processed++;
            }
            if (processed > 0) {
                logger.trace("Actor {} processed {} actions", channel.name(), processed);
            }
        } finally {
            applied += processed;
            channel.afterRun();
        }
    }

    private void apply(Envelope<A, R, E> envelope) {
        A action = envelope.action();
        Result<R, E> result;
        try {
            result = action.act(state);
        } catch (Throwable t) {
            logger.error("Actor {} error applying action: {}", channel.name(), action, t);
            channel.completeStructural(envelope.reply(), ActorException.replyLost(channel.name(), t));
            return;
        }
        if (result == null) {
            logger.error("Actor {} action returned no result: {}", channel.name(), action);
            channel.completeStructural(envelope.reply(), ActorException.replyLost(channel.name(),
                    new NullPointerException("Action returned null: " + action)));
            return;
        }
        if (!envelope.reply().complete(result)) {
            // The caller cancelled its wait; the state change stands
            logger.trace("Actor {} reply abandoned for action: {}", channel.name(), action);
        }
    }

    /**
     * Runs the stop hook on the final state and drops it. Called once, by the
     * token holder, when the channel terminates.
     */
    void stop() {
        S last = state.release();
        logger.info("Actor {} stopped after applying {} actions", channel.name(), applied);
        if (onStop == null) {
            return;
        }
        try {
            onStop.accept(last);
        } catch (RuntimeException e) {
            logger.error("Actor {} stop hook failed", channel.name(), e);
        }
    }

    long applied() {
        return applied;
    }
}
