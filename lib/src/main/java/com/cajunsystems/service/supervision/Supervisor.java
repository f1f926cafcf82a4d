package com.cajunsystems.service.supervision;

import com.cajunsystems.service.ServiceUnavailableException;
import com.cajunsystems.service.runtime.TerminationListener;
import com.cajunsystems.service.runtime.Worker;
import com.cajunsystems.service.runtime.WorkerFactory;
import com.cajunsystems.service.runtime.WorkerMessage;
import com.cajunsystems.service.runtime.WorkerTermination;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Watches the workers of one service and applies its {@link SupervisionStrategy} when one
 * of them terminates abnormally.
 * <p>
 * Restarted workers begin again from the service's initial state. Exceeding the
 * {@link RestartIntensity}, escalating, or stopping the last worker of a single-worker
 * service is fatal: every slot is closed, queued callers fail, the termination future
 * completes exceptionally and the failure listeners are told.
 *
 * @param <S> The type of the service state
 */
public final class Supervisor<S> {

    private static final Logger logger = LoggerFactory.getLogger(Supervisor.class);

    private final String serviceId;
    private final SupervisionStrategy strategy;
    private final RestartBudget budget;
    private final WorkerFactory<S> workerFactory;
    private final S initialState;
    private final boolean terminateWhenEmpty;

    private final Set<WorkerSlot<S>> slots = ConcurrentHashMap.newKeySet();
    private final List<ServiceFailureListener> failureListeners = new CopyOnWriteArrayList<>();
    private final CompletableFuture<Void> termination = new CompletableFuture<>();
    private final AtomicInteger slotCounter = new AtomicInteger();
    private final AtomicLong restarts = new AtomicLong();

    private volatile ServiceUnavailableException failure;
    private volatile boolean shutdown;

    /**
     * @param serviceId          the id of the supervised service
     * @param strategy           what to do when a worker fails
     * @param budget             restarts allowed before failures become fatal
     * @param workerFactory      creates workers
     * @param initialState       the state every new or restarted worker starts with
     * @param terminateWhenEmpty whether the service is finished once no slot remains open
     */
    public Supervisor(String serviceId,
                      SupervisionStrategy strategy,
                      RestartBudget budget,
                      WorkerFactory<S> workerFactory,
                      S initialState,
                      boolean terminateWhenEmpty) {
        this.serviceId = serviceId;
        this.strategy = strategy;
        this.budget = budget;
        this.workerFactory = workerFactory;
        this.initialState = initialState;
        this.terminateWhenEmpty = terminateWhenEmpty;
    }

    /**
     * Opens a new slot with a running worker.
     *
     * @throws ServiceUnavailableException if the service has failed or been shut down
     */
    public WorkerSlot<S> openSlot() {
        ensureServing();
        WorkerSlot<S> slot = new WorkerSlot<>(serviceId, serviceId + "-" + slotCounter.incrementAndGet());
        Worker<S> worker = workerFactory.create(slot.nextWorkerId(), initialState, listenerFor(slot));
        slot.install(worker);
        slots.add(slot);
        worker.start();
        if (shutdown || failure != null) {
            // lost a race with shutdown or a fatal failure
            slots.remove(slot);
            slot.close();
            ensureServing();
        }
        logger.debug("Opened slot {} of service {}", slot.id(), serviceId);
        return slot;
    }

    /**
     * Closes a slot and stops its worker without treating it as a failure.
     */
    public void closeSlot(WorkerSlot<S> slot) {
        slots.remove(slot);
        slot.close();
        logger.debug("Closed slot {} of service {}", slot.id(), serviceId);
    }

    private TerminationListener<S> listenerFor(WorkerSlot<S> slot) {
        return termination -> handleTermination(slot, termination);
    }

    void handleTermination(WorkerSlot<S> slot, WorkerTermination<S> termination) {
        if (!termination.isAbnormal()) {
            logger.debug("Worker {} of service {} stopped", termination.worker().id(), serviceId);
            return;
        }
        Throwable cause = termination.cause();
        if (shutdown || failure != null || slot.isClosed()) {
            failPending(termination.pending(), cause);
            return;
        }
        switch (strategy) {
            case RESTART -> restart(slot, termination);
            case STOP -> {
                logger.info("Stopping slot {} of service {} after worker failure", slot.id(), serviceId);
                slots.remove(slot);
                slot.close();
                failPending(termination.pending(), cause);
                if (terminateWhenEmpty && slots.isEmpty()) {
                    fail(new ServiceUnavailableException(serviceId, "Service " + serviceId
                            + " stopped after its worker failed", cause));
                }
            }
            case ESCALATE -> {
                logger.info("Escalating worker failure in service {}", serviceId);
                failPending(termination.pending(), cause);
                fail(new ServiceUnavailableException(serviceId, "Service " + serviceId
                        + " failed: worker failure escalated", cause));
            }
        }
    }

    private void restart(WorkerSlot<S> slot, WorkerTermination<S> termination) {
        Throwable cause = termination.cause();
        if (!budget.tryAcquire()) {
            RestartIntensity intensity = budget.intensity();
            failPending(termination.pending(), cause);
            fail(new ServiceUnavailableException(serviceId, "Service " + serviceId + " exceeded "
                    + intensity.maxRestarts() + " restarts within " + intensity.window().toMillis() + " ms", cause));
            return;
        }
        logger.info("Restarting worker in slot {} of service {} after failure: {}", slot.id(), serviceId, cause.toString());
        Worker<S> replacement;
        try {
            replacement = workerFactory.create(slot.nextWorkerId(), initialState, listenerFor(slot));
        } catch (RuntimeException e) {
            failPending(termination.pending(), cause);
            fail(new ServiceUnavailableException(serviceId, "Service " + serviceId
                    + " could not create a replacement worker", e));
            return;
        }
        replacement.adopt(termination.pending());
        if (!slot.replace(termination.worker(), replacement)) {
            // slot closed while the replacement was prepared
            replacement.stop();
            return;
        }
        replacement.start();
        restarts.incrementAndGet();
    }

    private void failPending(List<WorkerMessage<S>> pending, Throwable cause) {
        if (pending.isEmpty()) {
            return;
        }
        ServiceUnavailableException unavailable = new ServiceUnavailableException(serviceId,
                "Worker of service " + serviceId + " terminated before serving the request", cause);
        pending.forEach(message -> message.fail(unavailable));
    }

    private void fail(ServiceUnavailableException cause) {
        synchronized (this) {
            if (failure != null || shutdown) {
                return;
            }
            failure = cause;
        }
        logger.error("Service {} failed and is no longer available", serviceId, cause);
        for (WorkerSlot<S> slot : slots) {
            slot.close();
        }
        slots.clear();
        termination.completeExceptionally(cause);
        for (ServiceFailureListener listener : failureListeners) {
            listener.onServiceFailure(serviceId, cause);
        }
    }

    /**
     * Stops every worker. The termination future completes normally unless the service
     * had already failed.
     */
    public void shutdown() {
        synchronized (this) {
            if (shutdown) {
                return;
            }
            shutdown = true;
        }
        logger.debug("Shutting down {} slot(s) of service {}", slots.size(), serviceId);
        for (WorkerSlot<S> slot : slots) {
            slot.close();
        }
        slots.clear();
        if (failure == null) {
            termination.complete(null);
        }
    }

    /**
     * @throws ServiceUnavailableException if the service has failed or been shut down
     */
    public void ensureServing() {
        ServiceUnavailableException failed = failure;
        if (failed != null) {
            throw new ServiceUnavailableException(serviceId, "Service " + serviceId + " has failed", failed);
        }
        if (shutdown) {
            throw new ServiceUnavailableException(serviceId, "Service " + serviceId + " has been stopped");
        }
    }

    public boolean isServing() {
        return failure == null && !shutdown;
    }

    public void addFailureListener(ServiceFailureListener listener) {
        failureListeners.add(listener);
    }

    public Optional<ServiceUnavailableException> failure() {
        return Optional.ofNullable(failure);
    }

    public CompletableFuture<Void> terminationFuture() {
        return termination;
    }

    public String serviceId() {
        return serviceId;
    }

    public SupervisionStrategy strategy() {
        return strategy;
    }

    public long restartCount() {
        return restarts.get();
    }

    public int openSlots() {
        return slots.size();
    }
}
