package com.cajunsystems.service.mode;

import com.cajunsystems.service.ServiceHandle;
import com.cajunsystems.service.declaration.ServiceMode;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the implementation directly on the caller's thread. No worker, no supervision.
 */
final class InlineStrategy<S> implements ServiceStrategy<S> {

    private final ServiceContext<S> context;
    private final AtomicInteger instances = new AtomicInteger();

    InlineStrategy(ServiceContext<S> context) {
        this.context = context;
    }

    @Override
    public ServiceMode mode() {
        return ServiceMode.INLINE;
    }

    @Override
    public ServiceHandle<S> start(S initialState) {
        return new InlineHandle<>(context.name() + "#" + instances.incrementAndGet(), context.implementation(), initialState);
    }
}
