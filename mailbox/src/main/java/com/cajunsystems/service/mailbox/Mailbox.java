package com.cajunsystems.service.mailbox;

import java.util.Collection;
import java.util.concurrent.TimeUnit;

/**
 * Inbound queue of a single worker.
 * Many callers enqueue; exactly one worker thread dequeues, in FIFO order.
 *
 * @param <T> The type of messages stored in the mailbox
 */
public interface Mailbox<T> {

    /**
     * Enqueues a message without blocking.
     *
     * @param message the message to add, never null
     * @return true if the message was accepted, false if the mailbox is full
     */
    boolean offer(T message);

    /**
     * Retrieves and removes the head of this mailbox, or returns null if empty.
     *
     * @return the head of this mailbox, or null if empty
     */
    T poll();

    /**
     * Retrieves and removes the head of this mailbox, waiting up to the
     * given time for a message to arrive.
     *
     * @param timeout how long to wait before giving up
     * @param unit the time unit of the timeout argument
     * @return the head of this mailbox, or null if the timeout elapsed
     * @throws InterruptedException if interrupted while waiting
     */
    T poll(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Retrieves and removes the head of this mailbox, waiting until a message arrives.
     *
     * @return the head of this mailbox
     * @throws InterruptedException if interrupted while waiting
     */
    T take() throws InterruptedException;

    /**
     * Moves every queued message, in order, into the given collection.
     *
     * @param collection the collection to transfer messages into
     * @return the number of messages transferred
     */
    int drainTo(Collection<? super T> collection);

    int size();

    boolean isEmpty();

    /**
     * Returns the total number of messages this mailbox can hold,
     * or Integer.MAX_VALUE if unbounded.
     */
    int capacity();
}
