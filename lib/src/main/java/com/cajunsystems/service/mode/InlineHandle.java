package com.cajunsystems.service.mode;

import com.cajunsystems.service.ServiceUnavailableException;
import com.cajunsystems.service.declaration.FunctionKey;
import com.cajunsystems.service.declaration.ServiceMode;
import com.cajunsystems.service.generator.Implementation;
import com.cajunsystems.service.generator.NormalizedReply;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * A service without a worker. Calls run on the caller's thread and thread the state through
 * this handle. Not thread safe: confine a handle to one thread. Failures inside the
 * implementation reach the caller unchanged.
 *
 * @param <S> The type of the service state
 */
public final class InlineHandle<S> extends AbstractServiceHandle<S> {

    private final Implementation<S> implementation;
    private final CompletableFuture<Void> termination = new CompletableFuture<>();
    private S state;
    private boolean stopped;

    InlineHandle(String id, Implementation<S> implementation, S initialState) {
        super(id, ServiceMode.INLINE);
        this.implementation = implementation;
        this.state = initialState;
    }

    /**
     * Runs the call immediately. The timeout is irrelevant because nothing is waited for.
     */
    @Override
    public Object call(FunctionKey function, List<Object> args, Duration timeout) {
        return apply(function, args);
    }

    @Override
    protected CompletableFuture<Object> dispatch(FunctionKey function, List<Object> args) {
        try {
            return CompletableFuture.completedFuture(apply(function, args));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private Object apply(FunctionKey function, List<Object> args) {
        if (stopped) {
            throw new ServiceUnavailableException(id, "Inline service " + id + " has been stopped");
        }
        NormalizedReply<S> reply = implementation.apply(function, state, args);
        state = reply.nextState(state);
        return reply.value();
    }

    @Override
    public CompletableFuture<S> inspectState() {
        return CompletableFuture.completedFuture(state);
    }

    /**
     * @return the state threaded through this handle so far
     */
    public S state() {
        return state;
    }

    @Override
    public boolean isAlive() {
        return !stopped;
    }

    @Override
    public CompletableFuture<Void> terminationFuture() {
        return termination;
    }

    @Override
    public void stop() {
        stopped = true;
        termination.complete(null);
    }
}
