package com.cajunsystems.service.runtime;

/**
 * Notified, on the terminating worker's thread or the stopping thread, when a worker terminates.
 *
 * @param <S> The type of the service state
 */
@FunctionalInterface
public interface TerminationListener<S> {

    void onTermination(WorkerTermination<S> termination);
}
