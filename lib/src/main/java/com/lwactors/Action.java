package com.lwactors;

/**
 * A unit of work applied to an actor's state.
 *
 * <p>An action is submitted with {@link ActorSender#invoke(Action)} and from then
 * on belongs to the mailbox. The actor's runner applies it exactly once, or not
 * at all if the actor terminates first.
 *
 * <p>Distinct operations are usually modelled as a sealed interface of records
 * extending this one; a lambda works when operation identity does not matter.
 *
 * <pre>{@code
 * sealed interface CounterAction extends Action<Long, Long, CounterError> {
 *     record Add(long amount) implements CounterAction {
 *         public Result<Long, CounterError> act(StateCell<Long> state) {
 *             return Result.success(state.update(v -> v + amount));
 *         }
 *     }
 * }
 * }</pre>
 *
 * @param <S> The state type
 * @param <R> The result type
 * @param <E> The domain error type
 */
@FunctionalInterface
public interface Action<S, R, E> {

    /**
     * Applies this action to the state.
     * Domain failures are returned as {@link Result.Failure}; exceptions thrown
     * from here are treated as defects.
     *
     * @param state exclusive access to the actor's state
     * @return the outcome, never null
     */
    Result<R, E> act(StateCell<S> state);
}
