package com.cajunsystems.service.mailbox;

/**
 * Creates the mailbox for a newly started worker.
 *
 * @param <M> The message type
 */
@FunctionalInterface
public interface MailboxProvider<M> {

    /**
     * @param type     the requested mailbox implementation
     * @param capacity the capacity bound, ignored by unbounded implementations
     * @return a new, empty mailbox
     */
    Mailbox<M> createMailbox(MailboxType type, int capacity);
}
