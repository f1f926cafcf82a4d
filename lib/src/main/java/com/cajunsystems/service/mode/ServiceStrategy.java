package com.cajunsystems.service.mode;

import com.cajunsystems.service.ServiceHandle;
import com.cajunsystems.service.declaration.ServiceMode;

/**
 * How a service is deployed. Every strategy shares the same implementation and client API;
 * only the way calls reach the implementation differs.
 *
 * @param <S> The type of the service state
 */
public interface ServiceStrategy<S> {

    ServiceMode mode();

    /**
     * Starts a service instance.
     *
     * @param initialState the state the worker(s) start with
     * @return the handle of the running service
     */
    ServiceHandle<S> start(S initialState);

    /**
     * Returns the handle calls go to when the caller names no handle.
     *
     * @throws IllegalStateException if the mode has no such handle
     */
    default ServiceHandle<S> implicitHandle() {
        throw new IllegalStateException(mode() + " services must be called through the handle returned by run()");
    }
}
