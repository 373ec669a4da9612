package com.lwactors;

/**
 * Converts a structural {@link ActorException} into the caller's error type,
 * so that an actor's replies carry a single error type.
 *
 * @param <E> The caller's error type
 */
@FunctionalInterface
public interface ActorErrorMapper<E> {

    /**
     * Maps a structural failure.
     *
     * @param error the failure (never null)
     * @return the caller's representation of it
     */
    E map(ActorException error);

    /**
     * Mapper for actors whose error type is {@link ActorException} itself.
     * Actors using a wider error type such as {@code Exception} can pass
     * {@code error -> error} instead.
     *
     * @return a mapper returning its argument
     */
    static ActorErrorMapper<ActorException> passthrough() {
        return error -> error;
    }
}
