package com.cajunsystems.service.mailbox;

/**
 * The mailbox implementations a worker can be given.
 */
public enum MailboxType {
    /**
     * {@link LinkedMailbox}: general purpose, optionally bounded.
     */
    LINKED,

    /**
     * {@link MpscMailbox}: lock-free enqueue for workers with many concurrent callers. Unbounded.
     */
    MPSC
}
