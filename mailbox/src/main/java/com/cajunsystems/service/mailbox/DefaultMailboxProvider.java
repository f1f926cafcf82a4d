package com.cajunsystems.service.mailbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.IntFunction;

/**
 * Mailbox provider that maps each {@link MailboxType} to a creation strategy.
 *
 * @param <M> The message type
 */
public class DefaultMailboxProvider<M> implements MailboxProvider<M> {
    private static final Logger logger = LoggerFactory.getLogger(DefaultMailboxProvider.class);

    private final Map<MailboxType, IntFunction<Mailbox<M>>> strategies = new EnumMap<>(MailboxType.class);

    public DefaultMailboxProvider() {
        strategies.put(MailboxType.LINKED, LinkedMailbox::new);
        strategies.put(MailboxType.MPSC, capacity -> {
            if (capacity != Integer.MAX_VALUE) {
                logger.debug("MPSC mailbox is unbounded, ignoring capacity {}", capacity);
            }
            return new MpscMailbox<>();
        });
    }

    @Override
    public Mailbox<M> createMailbox(MailboxType type, int capacity) {
        MailboxType effectiveType = type != null ? type : MailboxType.LINKED;
        logger.debug("Creating {} mailbox with capacity {}", effectiveType, capacity);
        return strategies.get(effectiveType).apply(capacity);
    }
}
