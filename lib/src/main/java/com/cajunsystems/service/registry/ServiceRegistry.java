package com.cajunsystems.service.registry;

import com.cajunsystems.service.ServiceHandle;
import com.cajunsystems.service.ServiceUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Maps service names to the running services registered under them.
 * <p>
 * At most one live service is registered per name. A service that failed fatally stays
 * registered, so name-based callers see it as unavailable, until its owner runs it again.
 * A service stopped normally is removed.
 */
public final class ServiceRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ServiceRegistry.class);

    private static final ServiceRegistry GLOBAL = new ServiceRegistry();

    private final ConcurrentHashMap<String, ServiceHandle<?>> entries = new ConcurrentHashMap<>();

    /**
     * @return the registry shared by all services that do not configure their own
     */
    public static ServiceRegistry global() {
        return GLOBAL;
    }

    /**
     * Starts a service and registers it under a name. A failed or stopped entry under the
     * same name is replaced.
     *
     * @param name    the service name
     * @param starter starts the service; only invoked if the name is free
     * @return the registered handle
     * @throws IllegalStateException if a live service is already registered under the name
     */
    public <S> ServiceHandle<S> register(String name, Supplier<ServiceHandle<S>> starter) {
        ServiceHandle<?> registered = entries.compute(name, (key, existing) -> {
            if (existing != null && existing.isAlive()) {
                throw new IllegalStateException("A service is already running under the name " + name);
            }
            if (existing != null) {
                logger.info("Replacing terminated service registered as {}", name);
            }
            return starter.get();
        });
        logger.debug("Registered service {}", name);
        return cast(registered);
    }

    /**
     * Returns the service registered under a name, starting it if the name is free.
     * An entry that failed is returned as is, so calls through it fail as unavailable.
     */
    public <S> ServiceHandle<S> lookupOrStart(String name, Supplier<ServiceHandle<S>> starter) {
        ServiceHandle<?> registered = entries.computeIfAbsent(name, key -> {
            logger.info("Starting service {} on first use", name);
            return starter.get();
        });
        return cast(registered);
    }

    public <S> Optional<ServiceHandle<S>> lookup(String name) {
        return Optional.ofNullable(cast(entries.get(name)));
    }

    /**
     * @throws ServiceUnavailableException if no service is registered under the name
     */
    public <S> ServiceHandle<S> resolve(String name) {
        ServiceHandle<S> handle = cast(entries.get(name));
        if (handle == null) {
            throw new ServiceUnavailableException(name, "No service registered under the name " + name);
        }
        return handle;
    }

    /**
     * Removes an entry if it still maps to the given handle.
     *
     * @return true if the entry was removed
     */
    public boolean unregister(String name, ServiceHandle<?> handle) {
        boolean removed = entries.remove(name, handle);
        if (removed) {
            logger.debug("Unregistered service {}", name);
        }
        return removed;
    }

    public boolean isRegistered(String name) {
        return entries.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    @SuppressWarnings("unchecked")
    private static <S> ServiceHandle<S> cast(ServiceHandle<?> handle) {
        return (ServiceHandle<S>) handle;
    }
}
