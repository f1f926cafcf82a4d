package com.cajunsystems.service.mode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the deployment strategy for a service from its declared mode, once, when the
 * service is built.
 */
public final class ModeSelector {

    private static final Logger logger = LoggerFactory.getLogger(ModeSelector.class);

    public <S> ServiceStrategy<S> select(ServiceContext<S> context) {
        ServiceStrategy<S> strategy = switch (context.spec().mode()) {
            case INLINE -> new InlineStrategy<>(context);
            case ANONYMOUS -> new AnonymousStrategy<>(context);
            case NAMED -> new NamedStrategy<>(context);
            case POOLED -> new PooledStrategy<>(context);
        };
        logger.debug("Selected {} for service {}", strategy.getClass().getSimpleName(), context.name());
        return strategy;
    }
}
