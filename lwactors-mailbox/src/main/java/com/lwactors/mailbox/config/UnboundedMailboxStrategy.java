package com.lwactors.mailbox.config;

import com.lwactors.mailbox.Mailbox;
import com.lwactors.mailbox.MpscMailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates an {@link MpscMailbox}: lock-free and never full.
 *
 * @param <M> The message type
 */
public class UnboundedMailboxStrategy<M> implements MailboxCreationStrategy<M> {
    private static final Logger logger = LoggerFactory.getLogger(UnboundedMailboxStrategy.class);

    @Override
    public Mailbox<M> createMailbox(MailboxConfig config) {
        logger.debug("Creating MpscMailbox with chunk size: {}", config.getChunkSize());
        return new MpscMailbox<>(config.getChunkSize());
    }
}
