package com.cajunsystems.service.mode;

import com.cajunsystems.service.config.ServiceConfig;
import com.cajunsystems.service.config.WorkerThreadFactory;
import com.cajunsystems.service.declaration.ServiceSpec;
import com.cajunsystems.service.generator.Implementation;
import com.cajunsystems.service.registry.ServiceRegistry;
import com.cajunsystems.service.runtime.WorkerFactory;
import com.cajunsystems.service.supervision.RestartBudget;
import com.cajunsystems.service.supervision.ServiceFailureListener;
import com.cajunsystems.service.supervision.Supervisor;

import java.util.List;

/**
 * Everything a {@link ServiceStrategy} needs to start a service.
 *
 * @param name             the declaration name
 * @param spec             the declared mode and options
 * @param implementation   the generated implementation, shared by every mode
 * @param config           runtime configuration
 * @param registry         the registry named services register in
 * @param failureListeners told when a running service fails fatally
 * @param <S>              The type of the service state
 */
public record ServiceContext<S>(String name,
                                ServiceSpec<S> spec,
                                Implementation<S> implementation,
                                ServiceConfig config,
                                ServiceRegistry registry,
                                List<ServiceFailureListener> failureListeners) {

    public ServiceContext {
        failureListeners = List.copyOf(failureListeners);
    }

    public WorkerThreadFactory threadFactory(String serviceId) {
        String prefix = config.getThreadNamePrefix();
        return new WorkerThreadFactory(prefix != null ? prefix : serviceId);
    }

    /**
     * Creates a supervisor for a running service with the configured strategy and intensity.
     */
    Supervisor<S> newSupervisor(String serviceId, WorkerThreadFactory threads, S initialState, boolean terminateWhenEmpty) {
        WorkerFactory<S> workers = WorkerFactory.standard(serviceId, implementation, config, threads.workerThreads());
        Supervisor<S> supervisor = new Supervisor<>(
                serviceId,
                config.getSupervisionStrategy(),
                new RestartBudget(config.getRestartIntensity()),
                workers,
                initialState,
                terminateWhenEmpty);
        failureListeners.forEach(supervisor::addFailureListener);
        return supervisor;
    }
}
