package com.lwactors.mailbox;

import java.util.Collection;
import java.util.concurrent.TimeUnit;

/**
 * Multi-producer, single-consumer queue backing an actor.
 * Any number of threads may offer concurrently; only the thread currently
 * holding the actor's consumer token may poll or drain.
 *
 * @param <T> The type of messages stored in the mailbox
 */
public interface Mailbox<T> {

    /**
     * Inserts the specified message into this mailbox if it is possible to do
     * so immediately without exceeding capacity, returning true upon success
     * and false if the mailbox is full.
     *
     * @param message the message to add
     * @return true if the message was added, false otherwise
     * @throws NullPointerException if the message is null
     */
    boolean offer(T message);

    /**
     * Inserts the specified message into this mailbox, waiting up to the
     * specified wait time if necessary for space to become available.
     *
     * @param message the message to add
     * @param timeout how long to wait before giving up
     * @param unit the time unit of the timeout argument
     * @return true if successful, false if the timeout elapsed
     * @throws InterruptedException if interrupted while waiting
     */
    boolean offer(T message, long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Retrieves and removes the head of this mailbox, or returns null if empty.
     * Consumer side only.
     *
     * @return the head of this mailbox, or null if empty
     */
    T poll();

    /**
     * Removes up to maxElements available messages from this mailbox and adds
     * them to the given collection. Consumer side only.
     *
     * @param collection the collection to transfer messages into
     * @param maxElements the maximum number of messages to transfer
     * @return the number of messages transferred
     */
    int drainTo(Collection<? super T> collection, int maxElements);

    /**
     * Returns the approximate number of messages in this mailbox.
     *
     * @return the number of messages
     */
    int size();

    /**
     * Returns true if this mailbox contains no messages.
     *
     * @return true if empty
     */
    boolean isEmpty();

    /**
     * Returns the number of additional messages this mailbox can accept
     * without blocking, or Integer.MAX_VALUE if unbounded.
     *
     * @return the remaining capacity
     */
    int remainingCapacity();

    /**
     * Removes all messages from this mailbox. Consumer side only.
     */
    void clear();

    /**
     * Returns the total capacity of this mailbox (size + remaining capacity).
     * Returns Integer.MAX_VALUE if unbounded.
     *
     * @return the total capacity
     */
    default int capacity() {
        int size = size();
        int remaining = remainingCapacity();
        if (remaining == Integer.MAX_VALUE) {
            return Integer.MAX_VALUE;
        }
        return size + remaining;
    }

    /**
     * Returns true if this mailbox never refuses an offer.
     *
     * @return true if unbounded
     */
    default boolean isUnbounded() {
        return capacity() == Integer.MAX_VALUE;
    }
}
