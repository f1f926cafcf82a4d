package com.cajunsystems.service.mode;

import com.cajunsystems.service.declaration.FunctionKey;
import com.cajunsystems.service.declaration.ServiceMode;
import com.cajunsystems.service.pool.PoolStats;
import com.cajunsystems.service.pool.WorkerPool;
import com.cajunsystems.service.supervision.Supervisor;
import com.cajunsystems.service.supervision.WorkerSlot;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * A pooled service. Every call checks a worker out, runs on it and checks it back in once
 * the reply is complete, whether the call succeeded or not.
 * <p>
 * The checkout happens on the calling thread for blocking calls, async calls and casts
 * alike, waiting at most the checkout timeout.
 *
 * @param <S> The type of the service state
 */
public final class PooledHandle<S> extends AbstractServiceHandle<S> {

    private final WorkerPool<S> pool;
    private final Supervisor<S> supervisor;
    private final Duration checkoutTimeout;

    PooledHandle(String id, WorkerPool<S> pool, Supervisor<S> supervisor, Duration checkoutTimeout) {
        super(id, ServiceMode.POOLED);
        this.pool = pool;
        this.supervisor = supervisor;
        this.checkoutTimeout = checkoutTimeout;
    }

    @Override
    protected CompletableFuture<Object> dispatch(FunctionKey function, List<Object> args) {
        WorkerSlot<S> slot = pool.checkout(checkoutTimeout);
        CompletableFuture<Object> reply;
        try {
            reply = slot.submit(function, args);
        } catch (RuntimeException e) {
            pool.checkin(slot);
            throw e;
        }
        reply.whenComplete((value, failure) -> pool.checkin(slot));
        return reply;
    }

    /**
     * Inspects the state of whichever worker is checked out. Each pooled worker holds its own state.
     */
    @Override
    public CompletableFuture<S> inspectState() {
        WorkerSlot<S> slot = pool.checkout(checkoutTimeout);
        CompletableFuture<S> reply = slot.inspectState();
        reply.whenComplete((value, failure) -> pool.checkin(slot));
        return reply;
    }

    public PoolStats stats() {
        return pool.stats();
    }

    @Override
    public boolean isAlive() {
        return supervisor.isServing();
    }

    @Override
    public CompletableFuture<Void> terminationFuture() {
        return supervisor.terminationFuture();
    }

    @Override
    public void stop() {
        pool.shutdown();
    }
}
