package com.cajunsystems.service.supervision;

import com.cajunsystems.service.ServiceUnavailableException;
import com.cajunsystems.service.declaration.FunctionKey;
import com.cajunsystems.service.runtime.Worker;
import com.cajunsystems.service.runtime.WorkerMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A supervised position holding one worker at a time. When the supervisor restarts a worker
 * the replacement takes the same slot, so callers holding the slot reach the replacement.
 * <p>
 * Requests that arrive after a worker terminated but before the supervisor has decided its
 * fate are parked on the slot. A restart hands them to the replacement behind the requests
 * the failed worker had queued; closing the slot fails them.
 *
 * @param <S> The type of the service state
 */
public final class WorkerSlot<S> {

    private final String serviceId;
    private final String slotId;
    private final AtomicReference<Worker<S>> current = new AtomicReference<>();
    private final AtomicInteger generation = new AtomicInteger();
    private final Object parkLock = new Object();
    private final List<WorkerMessage<S>> parked = new ArrayList<>();
    private volatile boolean closed;

    WorkerSlot(String serviceId, String slotId) {
        this.serviceId = serviceId;
        this.slotId = slotId;
    }

    /**
     * Sends a call to the slot's current worker. If that worker terminates between the
     * lookup and the send, the call goes to its replacement.
     */
    public CompletableFuture<Object> submit(FunctionKey function, List<Object> args) {
        CompletableFuture<Object> reply = new CompletableFuture<>();
        deliver(new WorkerMessage.Call<>(function, args, reply));
        return reply;
    }

    public CompletableFuture<S> inspectState() {
        CompletableFuture<S> reply = new CompletableFuture<>();
        deliver(new WorkerMessage.InspectState<>(reply));
        return reply;
    }

    private void deliver(WorkerMessage<S> message) {
        Worker<S> worker = current.get();
        while (!closed && worker != null) {
            if (worker.offer(message)) {
                return;
            }
            synchronized (parkLock) {
                if (closed) {
                    break;
                }
                Worker<S> replacement = current.get();
                if (replacement == worker) {
                    // terminated, replacement not installed yet
                    parked.add(message);
                    return;
                }
                worker = replacement;
            }
        }
        message.fail(new ServiceUnavailableException(serviceId, "Slot " + slotId + " of service "
                + serviceId + " has no running worker"));
    }

    String nextWorkerId() {
        return slotId + "." + generation.incrementAndGet();
    }

    void install(Worker<S> worker) {
        current.set(worker);
    }

    /**
     * Installs a replacement for a terminated worker and hands it the requests parked since
     * the termination. The replacement must still accept requests, i.e. not be started yet.
     *
     * @return false if the slot no longer held the failed worker
     */
    boolean replace(Worker<S> failed, Worker<S> replacement) {
        synchronized (parkLock) {
            if (closed || current.get() != failed) {
                return false;
            }
            replacement.adopt(parked);
            parked.clear();
            current.set(replacement);
            return true;
        }
    }

    /**
     * Closes the slot, fails the parked requests and stops its worker.
     */
    void close() {
        List<WorkerMessage<S>> stranded;
        synchronized (parkLock) {
            closed = true;
            stranded = new ArrayList<>(parked);
            parked.clear();
        }
        if (!stranded.isEmpty()) {
            ServiceUnavailableException unavailable = new ServiceUnavailableException(serviceId,
                    "Slot " + slotId + " of service " + serviceId + " closed before its worker was replaced");
            stranded.forEach(message -> message.fail(unavailable));
        }
        Worker<S> worker = current.get();
        if (worker != null) {
            worker.stop();
        }
    }

    /**
     * @return the number of requests waiting for a replacement worker
     */
    int parkedCount() {
        synchronized (parkLock) {
            return parked.size();
        }
    }

    /**
     * @return true while the slot holds a worker that accepts calls
     */
    public boolean isAlive() {
        Worker<S> worker = current.get();
        return !closed && worker != null && worker.isRunning();
    }

    public boolean isClosed() {
        return closed;
    }

    public String id() {
        return slotId;
    }

    /**
     * @return the worker currently in the slot, possibly terminated
     */
    public Worker<S> worker() {
        return current.get();
    }

    /**
     * @return how many workers this slot has held, counting the first
     */
    public int generation() {
        return generation.get();
    }

    @Override
    public String toString() {
        return "WorkerSlot{" + slotId + ", worker=" + current.get() + (closed ? ", closed" : "") + '}';
    }
}
