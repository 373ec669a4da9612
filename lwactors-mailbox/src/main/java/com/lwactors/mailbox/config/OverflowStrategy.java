package com.lwactors.mailbox.config;

/**
 * Defines how a bounded mailbox handles a submission when the queue is full.
 *
 * <ul>
 *   <li>{@link #BLOCK} - Sender waits for space, up to the configured offer timeout (default)</li>
 *   <li>{@link #FAIL} - Submission fails immediately</li>
 * </ul>
 *
 * Unbounded mailboxes ignore this setting.
 */
public enum OverflowStrategy {
    /**
     * Wait for space using spin-wait then short parks.
     * Gives up and reports a submission failure when the offer timeout elapses.
     */
    BLOCK,

    /**
     * Report a submission failure right away, without waiting.
     */
    FAIL
}
