package com.lwactors.mailbox.config;

/**
 * Defines the type of mailbox backing an actor.
 *
 * <ul>
 *   <li>{@link #UNBOUNDED} - Lock-free MPSC queue that never refuses a message (default)</li>
 *   <li>{@link #BOUNDED} - Lock-free MPSC array queue with a fixed capacity</li>
 * </ul>
 */
public enum MailboxType {
    /**
     * JCTools MpscUnboundedArrayQueue. Submissions never wait for space.
     */
    UNBOUNDED,

    /**
     * JCTools MpscArrayQueue. Capacity is rounded up to a power of 2.
     * What happens when it is full is decided by the {@link OverflowStrategy}.
     */
    BOUNDED
}
