package com.cajunsystems.service.mailbox;

import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Default worker mailbox backed by a {@link LinkedBlockingQueue}.
 * Supports an optional capacity bound.
 *
 * @param <T> The type of messages
 */
public class LinkedMailbox<T> implements Mailbox<T> {

    private final LinkedBlockingQueue<T> queue;
    private final int capacity;

    /**
     * Creates an unbounded mailbox.
     */
    public LinkedMailbox() {
        this(Integer.MAX_VALUE);
    }

    /**
     * Creates a bounded mailbox.
     *
     * @param capacity the maximum number of queued messages
     */
    public LinkedMailbox(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Mailbox capacity must be positive: " + capacity);
        }
        this.queue = new LinkedBlockingQueue<>(capacity);
        this.capacity = capacity;
    }

    @Override
    public boolean offer(T message) {
        Objects.requireNonNull(message, "Message cannot be null");
        return queue.offer(message);
    }

    @Override
    public T poll() {
        return queue.poll();
    }

    @Override
    public T poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    @Override
    public T take() throws InterruptedException {
        return queue.take();
    }

    @Override
    public int drainTo(Collection<? super T> collection) {
        return queue.drainTo(collection);
    }

    @Override
    public int size() {
        return queue.size();
    }

    @Override
    public boolean isEmpty() {
        return queue.isEmpty();
    }

    @Override
    public int capacity() {
        return capacity;
    }
}
