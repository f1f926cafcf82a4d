package com.cajunsystems.service.mailbox;

import org.jctools.queues.MpscUnboundedArrayQueue;

import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Worker mailbox backed by a JCTools multi-producer single-consumer queue.
 * <p>
 * Enqueuing is lock-free. The single consumer parks on a condition when the
 * queue is empty; producers only take the lock when the consumer is parked.
 * Always unbounded.
 *
 * @param <T> The type of messages
 */
public class MpscMailbox<T> implements Mailbox<T> {

    private static final int DEFAULT_CHUNK_SIZE = 128;

    private final MpscUnboundedArrayQueue<T> queue;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private volatile boolean consumerWaiting = false;

    public MpscMailbox() {
        this(DEFAULT_CHUNK_SIZE);
    }

    /**
     * @param chunkSize the queue's growth chunk, rounded up to a power of two
     */
    public MpscMailbox(int chunkSize) {
        this.queue = new MpscUnboundedArrayQueue<>(nextPowerOfTwo(Math.max(2, chunkSize)));
    }

    @Override
    public boolean offer(T message) {
        Objects.requireNonNull(message, "Message cannot be null");
        boolean added = queue.offer(message);
        if (added && consumerWaiting) {
            lock.lock();
            try {
                notEmpty.signal();
            } finally {
                lock.unlock();
            }
        }
        return added;
    }

    @Override
    public T poll() {
        return queue.poll();
    }

    @Override
    public T poll(long timeout, TimeUnit unit) throws InterruptedException {
        T message = queue.poll();
        if (message != null || timeout <= 0) {
            return message;
        }
        long nanos = unit.toNanos(timeout);
        lock.lock();
        try {
            consumerWaiting = true;
            while (true) {
                message = queue.poll();
                if (message != null) {
                    return message;
                }
                if (nanos <= 0) {
                    return null;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
        } finally {
            consumerWaiting = false;
            lock.unlock();
        }
    }

    @Override
    public T take() throws InterruptedException {
        T message = queue.poll();
        if (message != null) {
            return message;
        }
        lock.lock();
        try {
            consumerWaiting = true;
            while ((message = queue.poll()) == null) {
                notEmpty.await();
            }
            return message;
        } finally {
            consumerWaiting = false;
            lock.unlock();
        }
    }

    @Override
    public int drainTo(Collection<? super T> collection) {
        Objects.requireNonNull(collection, "Collection cannot be null");
        int count = 0;
        T message;
        while ((message = queue.poll()) != null) {
            collection.add(message);
            count++;
        }
        return count;
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
        return Integer.MAX_VALUE;
    }

    private static int nextPowerOfTwo(int value) {
        int result = 1;
        while (result < value) {
            result <<= 1;
        }
        return result;
    }
}
