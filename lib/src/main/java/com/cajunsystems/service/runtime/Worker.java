package com.cajunsystems.service.runtime;

import com.cajunsystems.service.ServiceUnavailableException;
import com.cajunsystems.service.declaration.FunctionKey;
import com.cajunsystems.service.generator.Implementation;
import com.cajunsystems.service.generator.NormalizedReply;
import com.cajunsystems.service.mailbox.Mailbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A long-lived worker that owns one copy of the service state and serves calls one at a
 * time, in arrival order, on its own thread.
 * <p>
 * A failure inside the implementation terminates the worker: it moves to
 * {@link WorkerLifecycle#TERMINATED}, hands its queued requests to the termination listener,
 * and only then fails the call it was serving with a {@link ServiceUnavailableException}.
 *
 * @param <S> The type of the service state
 */
public final class Worker<S> {

    private static final Logger logger = LoggerFactory.getLogger(Worker.class);

    private static final long POLL_TIMEOUT_MS = 50;

    private final String serviceId;
    private final String workerId;
    private final Implementation<S> implementation;
    private final Mailbox<WorkerMessage<S>> mailbox;
    private final ThreadFactory threadFactory;
    private final TerminationListener<S> terminationListener;
    private final Duration stopTimeout;

    private final ReentrantLock lifecycleLock = new ReentrantLock();
    private final CountDownLatch readyLatch = new CountDownLatch(1);
    private final CountDownLatch terminatedLatch = new CountDownLatch(1);
    private final AtomicLong callsServed = new AtomicLong();

    private volatile WorkerLifecycle lifecycle = WorkerLifecycle.CREATED;
    private volatile Thread thread;

    // Confined to the worker thread once started
    private S currentState;

    /**
     * Creates a worker. Nothing runs until {@link #start()}.
     *
     * @param serviceId           the id of the owning service, for conditions and logs
     * @param workerId            the id of this worker
     * @param implementation      the generated implementation
     * @param initialState        the state the worker starts with
     * @param mailbox             the mailbox requests queue in
     * @param threadFactory       creates the worker thread
     * @param terminationListener told when the worker terminates, normally or not
     * @param stopTimeout         how long {@link #stop()} waits for the thread to finish
     */
    public Worker(String serviceId,
                  String workerId,
                  Implementation<S> implementation,
                  S initialState,
                  Mailbox<WorkerMessage<S>> mailbox,
                  ThreadFactory threadFactory,
                  TerminationListener<S> terminationListener,
                  Duration stopTimeout) {
        this.serviceId = serviceId;
        this.workerId = workerId;
        this.implementation = implementation;
        this.currentState = initialState;
        this.mailbox = mailbox;
        this.threadFactory = threadFactory;
        this.terminationListener = terminationListener != null ? terminationListener : termination -> { };
        this.stopTimeout = stopTimeout;
    }

    /**
     * Starts the worker thread and blocks until it is serving its mailbox.
     *
     * @throws IllegalStateException if the worker was already started or has terminated
     */
    public void start() {
        lifecycleLock.lock();
        try {
            if (lifecycle != WorkerLifecycle.CREATED) {
                throw new IllegalStateException("Worker " + workerId + " cannot start from " + lifecycle);
            }
            lifecycle = WorkerLifecycle.RUNNING;
            thread = threadFactory.newThread(this::processMailboxLoop);
            thread.start();
        } finally {
            lifecycleLock.unlock();
        }
        logger.debug("Started worker {} of service {}", workerId, serviceId);

        try {
            if (!readyLatch.await(5, TimeUnit.SECONDS)) {
                logger.warn("Worker {} did not start within timeout", workerId);
            }
        } catch (InterruptedException e) {
            logger.warn("Interrupted while waiting for worker {} to start", workerId);
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Queues a call.
     *
     * @return a future completed with the unwrapped reply value, or exceptionally with a
     * {@link ServiceUnavailableException} if the worker terminated first
     */
    public CompletableFuture<Object> submit(FunctionKey function, List<Object> args) {
        CompletableFuture<Object> reply = new CompletableFuture<>();
        WorkerMessage<S> call = new WorkerMessage.Call<>(function, args, reply);
        if (!offer(call)) {
            call.fail(unavailable("Worker " + workerId + " is not accepting calls", null));
        }
        return reply;
    }

    /**
     * Queues a request for a snapshot of the state, answered in FIFO order with the calls.
     */
    public CompletableFuture<S> inspectState() {
        CompletableFuture<S> reply = new CompletableFuture<>();
        WorkerMessage<S> request = new WorkerMessage.InspectState<>(reply);
        if (!offer(request)) {
            request.fail(unavailable("Worker " + workerId + " is not accepting requests", null));
        }
        return reply;
    }

    /**
     * Queues a request unless the worker has terminated. Requests may be queued before
     * {@link #start()}; they are served once the worker runs.
     *
     * @return true if the request was queued
     */
    public boolean offer(WorkerMessage<S> message) {
        lifecycleLock.lock();
        try {
            return lifecycle != WorkerLifecycle.TERMINATED && mailbox.offer(message);
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Queues requests carried over from a terminated worker, keeping their order.
     * Requests that cannot be queued are failed.
     */
    public void adopt(List<WorkerMessage<S>> carried) {
        for (WorkerMessage<S> message : carried) {
            if (!offer(message)) {
                message.fail(unavailable("Worker " + workerId + " could not take over a queued request", null));
            }
        }
    }

    /**
     * Stops the worker. The call being served, if any, completes; queued requests fail with
     * {@link ServiceUnavailableException}. The termination listener is told of a normal stop.
     */
    public void stop() {
        List<WorkerMessage<S>> pending;
        lifecycleLock.lock();
        try {
            if (lifecycle == WorkerLifecycle.TERMINATED) {
                return;
            }
            lifecycle = WorkerLifecycle.TERMINATED;
            pending = drainMailbox();
        } finally {
            lifecycleLock.unlock();
        }
        logger.debug("Stopping worker {} of service {}, failing {} queued request(s)", workerId, serviceId, pending.size());
        ServiceUnavailableException stopped = unavailable("Worker " + workerId + " stopped", null);
        pending.forEach(message -> message.fail(stopped));

        Thread current = thread;
        if (current != null && Thread.currentThread() != current) {
            current.interrupt();
            try {
                current.join(stopTimeout.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        terminatedLatch.countDown();
        terminationListener.onTermination(new WorkerTermination<>(this, null, List.of()));
    }

    /**
     * Waits until the worker has terminated.
     *
     * @return true if it terminated within the timeout
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminatedLatch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void processMailboxLoop() {
        readyLatch.countDown();
        while (lifecycle == WorkerLifecycle.RUNNING) {
            WorkerMessage<S> message;
            try {
                message = mailbox.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                if (lifecycle == WorkerLifecycle.RUNNING) {
                    // interrupted by something other than stop()
                    logger.error("Worker {} of service {} was interrupted while running", workerId, serviceId);
                    terminateAbnormally(new IllegalStateException("Worker " + workerId + " was interrupted", e));
                } else {
                    logger.debug("Worker {} interrupted", workerId);
                }
                Thread.currentThread().interrupt();
                break;
            }
            if (message == null) {
                continue;
            }
            if (message instanceof WorkerMessage.InspectState) {
                ((WorkerMessage.InspectState<S>) message).reply().complete(currentState);
            } else if (!serve((WorkerMessage.Call<S>) message)) {
                return;
            }
        }
    }

    /**
     * @return false if the call terminated the worker
     */
    private boolean serve(WorkerMessage.Call<S> call) {
        NormalizedReply<S> reply;
        try {
            reply = implementation.apply(call.function(), currentState, call.args());
        } catch (Throwable failure) {
            crash(call, failure);
            return false;
        }
        currentState = reply.nextState(currentState);
        callsServed.incrementAndGet();
        call.reply().complete(reply.value());
        return true;
    }

    private void crash(WorkerMessage.Call<S> call, Throwable failure) {
        logger.error("Worker {} of service {} failed serving {}", workerId, serviceId, call.function(), failure);
        try {
            terminateAbnormally(failure);
        } finally {
            call.fail(unavailable("Worker " + workerId + " terminated while serving " + call.function(), failure));
        }
    }

    /**
     * Moves to TERMINATED and hands the queued requests to the termination listener.
     * Does nothing if the worker was stopped in the meantime; stop() already failed them.
     */
    private void terminateAbnormally(Throwable failure) {
        List<WorkerMessage<S>> pending;
        lifecycleLock.lock();
        try {
            if (lifecycle == WorkerLifecycle.TERMINATED) {
                return;
            }
            lifecycle = WorkerLifecycle.TERMINATED;
            pending = drainMailbox();
        } finally {
            lifecycleLock.unlock();
        }
        terminatedLatch.countDown();
        terminationListener.onTermination(new WorkerTermination<>(this, failure, pending));
    }

    private List<WorkerMessage<S>> drainMailbox() {
        List<WorkerMessage<S>> drained = new ArrayList<>();
        mailbox.drainTo(drained);
        return drained;
    }

    private ServiceUnavailableException unavailable(String message, Throwable cause) {
        return new ServiceUnavailableException(serviceId, message, cause);
    }

    public String id() {
        return workerId;
    }

    public String serviceId() {
        return serviceId;
    }

    public WorkerLifecycle lifecycle() {
        return lifecycle;
    }

    public boolean isRunning() {
        return lifecycle == WorkerLifecycle.RUNNING;
    }

    /**
     * @return the number of calls this worker completed
     */
    public long callsServed() {
        return callsServed.get();
    }

    /**
     * @return the number of requests waiting in the mailbox
     */
    public int queueLength() {
        return mailbox.size();
    }

    @Override
    public String toString() {
        return "Worker{" + workerId + ", " + lifecycle + '}';
    }
}
