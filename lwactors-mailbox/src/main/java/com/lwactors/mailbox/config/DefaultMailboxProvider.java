package com.lwactors.mailbox.config;

import com.lwactors.mailbox.Mailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Default mailbox provider. Selects a creation strategy by {@link MailboxType}:
 * - UNBOUNDED: MpscMailbox
 * - BOUNDED: BoundedMpscMailbox
 *
 * @param <M> The message type
 */
public class DefaultMailboxProvider<M> implements MailboxProvider<M> {
    private static final Logger logger = LoggerFactory.getLogger(DefaultMailboxProvider.class);

    private final Map<MailboxType, MailboxCreationStrategy<M>> strategies;

    public DefaultMailboxProvider() {
        this.strategies = new EnumMap<>(MailboxType.class);
        this.strategies.put(MailboxType.UNBOUNDED, new UnboundedMailboxStrategy<>());
        this.strategies.put(MailboxType.BOUNDED, new BoundedMailboxStrategy<>());
    }

    @Override
    public Mailbox<M> createMailbox(MailboxConfig config) {
        MailboxConfig effectiveConfig = (config != null) ? config : new MailboxConfig();
        logger.debug("DefaultMailboxProvider creating mailbox - config: {}", effectiveConfig);
        return strategies.get(effectiveConfig.getMailboxType()).createMailbox(effectiveConfig);
    }
}
