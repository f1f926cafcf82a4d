package com.cajunsystems.service.api;

import com.cajunsystems.service.ServiceHandle;
import com.cajunsystems.service.declaration.FunctionKey;
import com.cajunsystems.service.generator.Implementation;
import com.cajunsystems.service.generator.NormalizedReply;
import com.cajunsystems.service.generator.ReplyShape;
import com.cajunsystems.service.generator.UndefinedFunctionException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * The client side of one public function. The state parameter is gone: callers pass only
 * the arguments, and the handle decides which worker serves the call.
 *
 * @param <S> The type of the service state
 */
public final class ClientFunction<S> {

    private final FunctionKey key;
    private final ReplyShape shape;
    private final Implementation<S> implementation;
    private final Duration defaultTimeout;
    private final Supplier<ServiceHandle<S>> implicitHandle;

    ClientFunction(FunctionKey key, ReplyShape shape, Implementation<S> implementation,
                   Duration defaultTimeout, Supplier<ServiceHandle<S>> implicitHandle) {
        this.key = key;
        this.shape = shape;
        this.implementation = implementation;
        this.defaultTimeout = defaultTimeout;
        this.implicitHandle = implicitHandle;
    }

    /**
     * Calls the function and waits for the reply with the default call timeout.
     *
     * @param handle the running service
     * @param args   the arguments, without the state
     * @param <T>    the expected reply type
     * @return the reply value
     */
    public <T> T call(ServiceHandle<S> handle, Object... args) {
        return call(handle, defaultTimeout, args);
    }

    /**
     * Calls the function and waits at most {@code timeout} for the reply.
     * A leading {@link Duration} is always taken as the timeout.
     */
    @SuppressWarnings("unchecked")
    public <T> T call(ServiceHandle<S> handle, Duration timeout, Object... args) {
        return (T) handle.call(key, arguments(args), timeout);
    }

    /**
     * Calls the function on the service the caller names no handle for: the registered
     * service of a named declaration, started on first use if so configured.
     *
     * @throws IllegalStateException if the service is not named
     */
    public <T> T invoke(Object... args) {
        return call(implicitHandle.get(), defaultTimeout, args);
    }

    /**
     * Sends the call and returns the pending reply. Pooled services check a worker out first,
     * which may block while the pool is exhausted.
     */
    public CompletableFuture<Object> callAsync(ServiceHandle<S> handle, Object... args) {
        return handle.callAsync(key, arguments(args));
    }

    /**
     * Sends the call without waiting for the reply, which is discarded; a state update is
     * committed. Pooled services may block while checking a worker out.
     */
    public void cast(ServiceHandle<S> handle, Object... args) {
        handle.cast(key, arguments(args));
    }

    /**
     * Runs the implementation directly against a state the caller holds, for inline use
     * without a handle.
     *
     * @return the reply value and the next state
     */
    public Threaded<S> thread(S state, Object... args) {
        NormalizedReply<S> reply = implementation.apply(key, state, arguments(args));
        return new Threaded<>(reply.value(), reply.nextState(state));
    }

    private List<Object> arguments(Object[] args) {
        if (args.length != key.arity()) {
            throw new UndefinedFunctionException(implementation.serviceName(), FunctionKey.of(key.name(), args.length));
        }
        return Collections.unmodifiableList(new ArrayList<>(Arrays.asList(args)));
    }

    public FunctionKey key() {
        return key;
    }

    public String name() {
        return key.name();
    }

    public int arity() {
        return key.arity();
    }

    /**
     * @return whether calls to this function can change the state
     */
    public ReplyShape shape() {
        return shape;
    }

    @Override
    public String toString() {
        return "ClientFunction{" + key + ", " + shape + '}';
    }
}
