package com.cajunsystems.service.mode;

import com.cajunsystems.service.ServiceHandle;
import com.cajunsystems.service.declaration.ServiceMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * One supervised worker per run, reachable only through the returned handle.
 */
final class AnonymousStrategy<S> implements ServiceStrategy<S> {

    private static final Logger logger = LoggerFactory.getLogger(AnonymousStrategy.class);

    private final ServiceContext<S> context;
    private final AtomicInteger instances = new AtomicInteger();

    AnonymousStrategy(ServiceContext<S> context) {
        this.context = context;
    }

    @Override
    public ServiceMode mode() {
        return ServiceMode.ANONYMOUS;
    }

    @Override
    public ServiceHandle<S> start(S initialState) {
        String id = context.name() + "#" + instances.incrementAndGet();
        SupervisedHandle<S> handle = SupervisedHandle.launch(context, id, ServiceMode.ANONYMOUS, initialState);
        logger.info("Started service {}", id);
        return handle;
    }
}
