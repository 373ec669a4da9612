package com.lwactors.internal;

import com.lwactors.StateCell;

/**
 * The runner's state holder. Plain field, no synchronization: only the thread
 * holding the consumer token touches it, and the token hand-off publishes it.
 */
final class OwnedState<S> implements StateCell<S> {

    private S state;

    OwnedState(S initial) {
        this.state = initial;
    }

    @Override
    public S get() {
        return state;
    }

    @Override
    public void set(S state) {
        this.state = state;
    }

    S release() {
        S last = state;
        state = null;
        return last;
    }
}
