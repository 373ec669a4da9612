package com.lwactors.mailbox.config;

import com.lwactors.mailbox.BoundedMpscMailbox;
import com.lwactors.mailbox.Mailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates a {@link BoundedMpscMailbox} sized from the configured capacity.
 *
 * @param <M> The message type
 */
public class BoundedMailboxStrategy<M> implements MailboxCreationStrategy<M> {
    private static final Logger logger = LoggerFactory.getLogger(BoundedMailboxStrategy.class);

    @Override
    public Mailbox<M> createMailbox(MailboxConfig config) {
        logger.debug("Creating BoundedMpscMailbox with capacity: {}", config.getCapacity());
        return new BoundedMpscMailbox<>(config.getCapacity());
    }
}
