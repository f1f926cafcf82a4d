package com.cajunsystems.service.mode;

import com.cajunsystems.service.CallTimeoutException;
import com.cajunsystems.service.ServiceException;
import com.cajunsystems.service.ServiceHandle;
import com.cajunsystems.service.ServiceUnavailableException;
import com.cajunsystems.service.declaration.FunctionKey;
import com.cajunsystems.service.declaration.ServiceMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Turns the asynchronous dispatch of a concrete handle into blocking calls with a timeout,
 * async calls and casts.
 *
 * @param <S> The type of the service state
 */
abstract class AbstractServiceHandle<S> implements ServiceHandle<S> {

    private static final Logger logger = LoggerFactory.getLogger(AbstractServiceHandle.class);

    protected final String id;
    private final ServiceMode mode;

    AbstractServiceHandle(String id, ServiceMode mode) {
        this.id = id;
        this.mode = mode;
    }

    /**
     * Routes a call to a worker.
     *
     * @throws ServiceException if the call cannot be routed
     */
    protected abstract CompletableFuture<Object> dispatch(FunctionKey function, List<Object> args);

    @Override
    public Object call(FunctionKey function, List<Object> args, Duration timeout) {
        CompletableFuture<Object> reply = dispatch(function, args);
        try {
            return reply.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            throw new CallTimeoutException(id, function.toString(), timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ServiceException) {
                throw (ServiceException) cause;
            }
            throw new ServiceUnavailableException(id, "Call to " + function + " failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceUnavailableException(id, "Interrupted while waiting for " + function, e);
        }
    }

    @Override
    public CompletableFuture<Object> callAsync(FunctionKey function, List<Object> args) {
        try {
            return dispatch(function, args);
        } catch (ServiceException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public void cast(FunctionKey function, List<Object> args) {
        callAsync(function, args).whenComplete((value, failure) -> {
            if (failure != null) {
                logger.warn("Cast of {} to service {} failed: {}", function, id, failure.getMessage());
            }
        });
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public ServiceMode mode() {
        return mode;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + id + (isAlive() ? "" : ", terminated") + '}';
    }
}
