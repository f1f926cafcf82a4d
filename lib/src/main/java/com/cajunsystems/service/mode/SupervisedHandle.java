package com.cajunsystems.service.mode;

import com.cajunsystems.service.declaration.FunctionKey;
import com.cajunsystems.service.declaration.ServiceMode;
import com.cajunsystems.service.supervision.Supervisor;
import com.cajunsystems.service.supervision.WorkerSlot;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * A service served by one supervised worker, as used by anonymous and named services.
 *
 * @param <S> The type of the service state
 */
public final class SupervisedHandle<S> extends AbstractServiceHandle<S> {

    private final Supervisor<S> supervisor;
    private final WorkerSlot<S> slot;

    SupervisedHandle(String id, ServiceMode mode, Supervisor<S> supervisor, WorkerSlot<S> slot) {
        super(id, mode);
        this.supervisor = supervisor;
        this.slot = slot;
    }

    /**
     * Starts a supervised worker and returns its handle.
     */
    static <S> SupervisedHandle<S> launch(ServiceContext<S> context, String id, ServiceMode mode, S initialState) {
        Supervisor<S> supervisor = context.newSupervisor(id, context.threadFactory(id), initialState, true);
        return new SupervisedHandle<>(id, mode, supervisor, supervisor.openSlot());
    }

    @Override
    protected CompletableFuture<Object> dispatch(FunctionKey function, List<Object> args) {
        supervisor.ensureServing();
        return slot.submit(function, args);
    }

    @Override
    public CompletableFuture<S> inspectState() {
        return slot.inspectState();
    }

    @Override
    public boolean isAlive() {
        return supervisor.isServing() && !slot.isClosed();
    }

    @Override
    public CompletableFuture<Void> terminationFuture() {
        return supervisor.terminationFuture();
    }

    @Override
    public void stop() {
        supervisor.shutdown();
    }

    /**
     * @return how many times the worker has been restarted
     */
    public long restartCount() {
        return supervisor.restartCount();
    }
}
