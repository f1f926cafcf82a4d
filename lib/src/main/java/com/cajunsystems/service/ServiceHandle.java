package com.cajunsystems.service;

import com.cajunsystems.service.declaration.FunctionKey;
import com.cajunsystems.service.declaration.ServiceMode;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * A running service, as returned by {@link Service#run()}.
 * <p>
 * The handle resolves each call to the worker that serves it: the worker itself for
 * anonymous and named services, a checked-out pool member for pooled services,
 * or the caller's own thread for inline services. Callers never see the state.
 *
 * @param <S> The type of the service state
 */
public interface ServiceHandle<S> {

    /**
     * @return the id of this running service
     */
    String id();

    ServiceMode mode();

    /**
     * @return true while the service accepts calls
     */
    boolean isAlive();

    /**
     * Sends a call and blocks until the reply arrives or the timeout elapses.
     *
     * @param function the public function to call
     * @param args     the arguments, without the state
     * @param timeout  how long the caller is willing to wait
     * @return the unwrapped reply value
     * @throws CallTimeoutException        if no reply arrived in time
     * @throws PoolExhaustedException      if no pooled worker could be checked out
     * @throws ServiceUnavailableException if the worker or service terminated
     */
    Object call(FunctionKey function, List<Object> args, Duration timeout);

    /**
     * Sends a call without waiting for the reply.
     * <p>
     * A pooled service first checks a worker out on the calling thread, so this may block up
     * to the configured checkout timeout while every worker is busy. A checkout that times
     * out completes the future with a {@link PoolExhaustedException} rather than throwing.
     *
     * @return a future completed with the unwrapped reply value, or with one of the service conditions
     */
    CompletableFuture<Object> callAsync(FunctionKey function, List<Object> args);

    /**
     * Sends a one-way call. The reply is discarded; a state update is still committed.
     * Like {@link #callAsync}, a pooled service may block the caller while it checks a worker out.
     */
    void cast(FunctionKey function, List<Object> args);

    /**
     * Asks the worker for a snapshot of its current state. The request is queued
     * behind every call already sent, so it observes their effects.
     *
     * @return a future completed with the state
     */
    CompletableFuture<S> inspectState();

    /**
     * Completes normally when the service is stopped by its owner, and exceptionally with a
     * {@link ServiceUnavailableException} when the service can no longer serve calls.
     */
    CompletableFuture<Void> terminationFuture();

    /**
     * Stops the service. Queued calls fail with {@link ServiceUnavailableException}.
     */
    void stop();
}
