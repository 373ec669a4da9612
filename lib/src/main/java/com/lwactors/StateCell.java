package com.lwactors;

import java.util.function.UnaryOperator;

/**
 * Exclusive access to an actor's state, handed to one {@link Action} at a time.
 *
 * <p>The cell belongs to the actor's runner. It is not thread-safe and must not
 * escape the {@link Action#act(StateCell)} call it was passed to.
 *
 * @param <S> The state type
 */
public interface StateCell<S> {

    /**
     * @return the current state
     */
    S get();

    /**
     * Replaces the state.
     *
     * @param state the new state
     */
    void set(S state);

    /**
     * Replaces the state with the result of applying a function to it.
     *
     * @param fn the update function
     * @return the new state
     */
    default S update(UnaryOperator<S> fn) {
        S next = fn.apply(get());
        set(next);
        return next;
    }
}
