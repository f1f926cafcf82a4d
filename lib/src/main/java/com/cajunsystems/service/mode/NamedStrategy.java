package com.cajunsystems.service.mode;

import com.cajunsystems.service.ServiceHandle;
import com.cajunsystems.service.declaration.ServiceMode;
import com.cajunsystems.service.registry.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One supervised worker registered under the service name. Callers reach it by name
 * through the registry; a normal stop removes the registration.
 */
final class NamedStrategy<S> implements ServiceStrategy<S> {

    private static final Logger logger = LoggerFactory.getLogger(NamedStrategy.class);

    private final ServiceContext<S> context;
    private final String serviceName;

    NamedStrategy(ServiceContext<S> context) {
        this.context = context;
        this.serviceName = context.spec().serviceName()
                .orElseThrow(() -> new IllegalStateException("Named service without a name"));
    }

    @Override
    public ServiceMode mode() {
        return ServiceMode.NAMED;
    }

    /**
     * @throws IllegalStateException if a live service is already registered under the name
     */
    @Override
    public ServiceHandle<S> start(S initialState) {
        return context.registry().register(serviceName, () -> launch(initialState));
    }

    @Override
    public ServiceHandle<S> implicitHandle() {
        ServiceRegistry registry = context.registry();
        if (context.config().isStartOnFirstUse()) {
            return registry.lookupOrStart(serviceName, () -> launch(context.spec().initialState()));
        }
        return registry.resolve(serviceName);
    }

    private ServiceHandle<S> launch(S initialState) {
        SupervisedHandle<S> handle = SupervisedHandle.launch(context, serviceName, ServiceMode.NAMED, initialState);
        handle.terminationFuture().whenComplete((ignored, failure) -> {
            if (failure == null) {
                context.registry().unregister(serviceName, handle);
            }
        });
        logger.info("Started service {}", serviceName);
        return handle;
    }
}
