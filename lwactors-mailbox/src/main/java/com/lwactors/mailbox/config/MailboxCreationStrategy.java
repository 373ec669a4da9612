package com.lwactors.mailbox.config;

import com.lwactors.mailbox.Mailbox;

/**
 * Strategy interface for creating mailboxes from a configuration.
 *
 * @param <M> The message type
 */
@FunctionalInterface
public interface MailboxCreationStrategy<M> {

    /**
     * Creates a mailbox according to this strategy.
     *
     * @param config The mailbox configuration
     * @return A new mailbox instance
     */
    Mailbox<M> createMailbox(MailboxConfig config);
}
