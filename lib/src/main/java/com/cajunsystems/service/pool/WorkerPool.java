package com.cajunsystems.service.pool;

import com.cajunsystems.service.PoolExhaustedException;
import com.cajunsystems.service.ServiceUnavailableException;
import com.cajunsystems.service.declaration.PoolBounds;
import com.cajunsystems.service.supervision.Supervisor;
import com.cajunsystems.service.supervision.WorkerSlot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * A bounded pool of supervised worker slots.
 * <p>
 * {@link #checkout(Duration)} hands out the most recently used idle slot, creates a new one
 * while the pool is below its maximum, and otherwise waits for a checkin. A scheduled reaper
 * retires slots that stayed idle longer than the grace period, never going below the minimum.
 *
 * @param <S> The type of the service state
 */
public final class WorkerPool<S> {

    private static final Logger logger = LoggerFactory.getLogger(WorkerPool.class);

    private static final long MIN_REAPER_PERIOD_MS = 10;

    private final String serviceId;
    private final PoolBounds bounds;
    private final Supervisor<S> supervisor;
    private final Duration idleRetirementGrace;
    private final ScheduledExecutorService scheduler;
    private final LongSupplier nanoClock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition available = lock.newCondition();
    private final Deque<IdleSlot<S>> idle = new ArrayDeque<>();
    private final Set<WorkerSlot<S>> busy = new HashSet<>();

    private int waiting;
    private long created;
    private long retired;
    private long dropped;
    private long exhausted;
    private boolean started;
    private boolean shutdown;
    private volatile ScheduledFuture<?> reaper;

    /**
     * @param serviceId           the id of the pooled service
     * @param bounds              the pool bounds
     * @param supervisor          opens and supervises the slots
     * @param idleRetirementGrace how long a slot above the minimum may stay idle
     * @param scheduler           runs the reaper, or null to disable retirement
     */
    public WorkerPool(String serviceId, PoolBounds bounds, Supervisor<S> supervisor,
                      Duration idleRetirementGrace, ScheduledExecutorService scheduler) {
        this(serviceId, bounds, supervisor, idleRetirementGrace, scheduler, System::nanoTime);
    }

    WorkerPool(String serviceId, PoolBounds bounds, Supervisor<S> supervisor,
               Duration idleRetirementGrace, ScheduledExecutorService scheduler, LongSupplier nanoClock) {
        this.serviceId = serviceId;
        this.bounds = bounds;
        this.supervisor = supervisor;
        this.idleRetirementGrace = idleRetirementGrace;
        this.scheduler = scheduler;
        this.nanoClock = nanoClock;
        supervisor.addFailureListener((id, cause) -> closeAfterFailure());
    }

    /**
     * Starts the minimum number of workers and schedules the reaper.
     */
    public void start() {
        lock.lock();
        try {
            if (started) {
                throw new IllegalStateException("Pool of service " + serviceId + " already started");
            }
            started = true;
            for (int i = 0; i < bounds.min(); i++) {
                idle.addFirst(new IdleSlot<>(supervisor.openSlot(), nanoClock.getAsLong()));
                created++;
            }
        } finally {
            lock.unlock();
        }
        if (scheduler != null) {
            long period = Math.max(MIN_REAPER_PERIOD_MS, idleRetirementGrace.toMillis() / 2);
            reaper = scheduler.scheduleAtFixedRate(this::retireIdle, period, period, TimeUnit.MILLISECONDS);
            if (!supervisor.isServing()) {
                stopReaper();
            }
        }
        logger.info("Started pool of service {} with {} worker(s), max {}", serviceId, bounds.min(), bounds.max());
    }

    /**
     * Checks out a slot, waiting up to the timeout for one to become free.
     *
     * @param timeout how long to wait when all {@code max} slots are busy; zero fails immediately
     * @return a slot reserved for the caller until {@link #checkin(WorkerSlot)}
     * @throws PoolExhaustedException      if no slot became free in time
     * @throws ServiceUnavailableException if the pool is shut down or the service has failed
     */
    public WorkerSlot<S> checkout(Duration timeout) {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (true) {
                ensureOpen();
                IdleSlot<S> entry = idle.pollFirst();
                while (entry != null && !entry.slot().isAlive()) {
                    logger.debug("Discarding dead idle slot {} of service {}", entry.slot().id(), serviceId);
                    dropped++;
                    entry = idle.pollFirst();
                }
                if (entry != null) {
                    busy.add(entry.slot());
                    return entry.slot();
                }
                if (size() < bounds.max()) {
                    WorkerSlot<S> slot = supervisor.openSlot();
                    created++;
                    busy.add(slot);
                    logger.debug("Grew pool of service {} to {}", serviceId, size());
                    return slot;
                }
                if (remaining <= 0L) {
                    exhausted++;
                    throw new PoolExhaustedException(serviceId, bounds.max(), timeout);
                }
                waiting++;
                try {
                    remaining = available.awaitNanos(remaining);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    exhausted++;
                    throw new PoolExhaustedException(serviceId, bounds.max(), timeout);
                } finally {
                    waiting--;
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a slot to the pool. A slot whose worker was restarted comes back with the
     * replacement; a slot that was closed after a failure is dropped.
     */
    public void checkin(WorkerSlot<S> slot) {
        boolean close = false;
        lock.lock();
        try {
            if (!busy.remove(slot)) {
                logger.warn("Ignoring checkin of slot {} not checked out from service {}", slot.id(), serviceId);
                return;
            }
            if (shutdown) {
                close = true;
            } else if (slot.isAlive()) {
                idle.addFirst(new IdleSlot<>(slot, nanoClock.getAsLong()));
            } else {
                logger.debug("Dropping dead slot {} of service {}", slot.id(), serviceId);
                dropped++;
            }
            available.signal();
        } finally {
            lock.unlock();
        }
        if (close) {
            supervisor.closeSlot(slot);
        }
    }

    /**
     * Retires slots that have been idle longer than the grace period, oldest first,
     * while the pool is above its minimum.
     */
    void retireIdle() {
        List<WorkerSlot<S>> retiring = new ArrayList<>();
        lock.lock();
        try {
            if (shutdown) {
                return;
            }
            long now = nanoClock.getAsLong();
            long graceNanos = idleRetirementGrace.toNanos();
            Iterator<IdleSlot<S>> oldestFirst = idle.descendingIterator();
            while (oldestFirst.hasNext() && size() > bounds.min()) {
                IdleSlot<S> entry = oldestFirst.next();
                if (now - entry.idleSince() >= graceNanos) {
                    oldestFirst.remove();
                    retiring.add(entry.slot());
                    retired++;
                }
            }
        } finally {
            lock.unlock();
        }
        for (WorkerSlot<S> slot : retiring) {
            logger.info("Retiring idle worker slot {} of service {}", slot.id(), serviceId);
            supervisor.closeSlot(slot);
        }
    }

    /**
     * Stops every worker. Busy slots finish their current call; waiting callers fail.
     */
    public void shutdown() {
        lock.lock();
        try {
            if (shutdown) {
                return;
            }
            shutdown = true;
            idle.clear();
            available.signalAll();
        } finally {
            lock.unlock();
        }
        stopReaper();
        supervisor.shutdown();
        logger.info("Shut down pool of service {}", serviceId);
    }

    public PoolStats stats() {
        lock.lock();
        try {
            return new PoolStats(size(), idle.size(), busy.size(), waiting, bounds.min(), bounds.max(),
                    created, retired, dropped, exhausted);
        } finally {
            lock.unlock();
        }
    }

    public PoolBounds bounds() {
        return bounds;
    }

    private int size() {
        return idle.size() + busy.size();
    }

    private void ensureOpen() {
        supervisor.ensureServing();
        if (shutdown) {
            throw new ServiceUnavailableException(serviceId, "Pool of service " + serviceId + " has been shut down");
        }
    }

    /**
     * The supervisor has given up on the service: wake waiting callers so they fail, and
     * release the reaper thread.
     */
    private void closeAfterFailure() {
        lock.lock();
        try {
            shutdown = true;
            idle.clear();
            available.signalAll();
        } finally {
            lock.unlock();
        }
        stopReaper();
        logger.info("Closed pool of service {} after the service failed", serviceId);
    }

    private void stopReaper() {
        ScheduledFuture<?> scheduled = reaper;
        if (scheduled != null) {
            scheduled.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }

    /**
     * @return true once the pool no longer hands out workers
     */
    public boolean isShutdown() {
        lock.lock();
        try {
            return shutdown;
        } finally {
            lock.unlock();
        }
    }

    private record IdleSlot<S>(WorkerSlot<S> slot, long idleSince) {
    }
}
