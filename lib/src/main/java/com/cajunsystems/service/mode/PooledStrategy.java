package com.cajunsystems.service.mode;

import com.cajunsystems.service.ServiceHandle;
import com.cajunsystems.service.config.WorkerThreadFactory;
import com.cajunsystems.service.declaration.PoolBounds;
import com.cajunsystems.service.declaration.ServiceMode;
import com.cajunsystems.service.pool.WorkerPool;
import com.cajunsystems.service.supervision.Supervisor;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * A bounded pool of supervised workers per run.
 */
final class PooledStrategy<S> implements ServiceStrategy<S> {

    private final ServiceContext<S> context;
    private final PoolBounds bounds;
    private final AtomicInteger instances = new AtomicInteger();

    PooledStrategy(ServiceContext<S> context) {
        this.context = context;
        this.bounds = context.spec().poolBounds()
                .orElseThrow(() -> new IllegalStateException("Pooled service without pool bounds"));
    }

    @Override
    public ServiceMode mode() {
        return ServiceMode.POOLED;
    }

    @Override
    public ServiceHandle<S> start(S initialState) {
        String id = context.name() + "-pool#" + instances.incrementAndGet();
        WorkerThreadFactory threads = context.threadFactory(id);
        Supervisor<S> supervisor = context.newSupervisor(id, threads, initialState, false);
        WorkerPool<S> pool = new WorkerPool<>(id, bounds, supervisor,
                context.config().getIdleRetirementGrace(), threads.createScheduledExecutorService("reaper"));
        pool.start();
        return new PooledHandle<>(id, pool, supervisor, context.config().getCheckoutTimeout());
    }
}
