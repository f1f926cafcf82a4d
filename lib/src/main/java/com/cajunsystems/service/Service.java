package com.cajunsystems.service;

import com.cajunsystems.service.api.ClientApi;
import com.cajunsystems.service.api.ClientApiGenerator;
import com.cajunsystems.service.api.ClientFunction;
import com.cajunsystems.service.config.ServiceConfig;
import com.cajunsystems.service.declaration.FunctionKey;
import com.cajunsystems.service.declaration.ServiceDeclaration;
import com.cajunsystems.service.declaration.ServiceMode;
import com.cajunsystems.service.declaration.ServiceSpec;
import com.cajunsystems.service.generator.Implementation;
import com.cajunsystems.service.generator.ImplementationGenerator;
import com.cajunsystems.service.generator.NormalizedReply;
import com.cajunsystems.service.generator.SourceRenderer;
import com.cajunsystems.service.generator.UndefinedFunctionException;
import com.cajunsystems.service.mode.ModeSelector;
import com.cajunsystems.service.mode.ServiceContext;
import com.cajunsystems.service.mode.ServiceStrategy;
import com.cajunsystems.service.registry.ServiceRegistry;
import com.cajunsystems.service.supervision.ServiceFailureListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * A service built from stateless function clauses.
 * <p>
 * The implementation functions, the client API and the deployment strategy are generated
 * once when the service is built; {@link #run()} then starts as many instances as needed.
 *
 * @param <S> The type of the service state
 */
public final class Service<S> {

    private static final Logger logger = LoggerFactory.getLogger(Service.class);

    private final ServiceDeclaration<S> declaration;
    private final ServiceConfig config;
    private final ServiceRegistry registry;
    private final Implementation<S> implementation;
    private final ServiceStrategy<S> strategy;
    private final ClientApi<S> api;

    Service(ServiceDeclaration<S> declaration, ServiceConfig config, ServiceRegistry registry,
            List<ServiceFailureListener> failureListeners) {
        this.declaration = declaration;
        this.config = config;
        this.registry = registry;
        this.implementation = new ImplementationGenerator().generate(declaration);
        ServiceContext<S> context = new ServiceContext<>(
                declaration.name(), declaration.spec(), implementation, config, registry, failureListeners);
        this.strategy = new ModeSelector().select(context);
        this.api = new ClientApiGenerator().generate(implementation, config.getCallTimeout(), strategy::implicitHandle);
        if (declaration.spec().diagnosticsEnabled()) {
            logger.info("Generated source of service {}:\n{}", declaration.name(), generatedSource());
        }
    }

    /**
     * Starts building a service.
     *
     * @param name the declaration name, also the default service name in named mode
     */
    public static <S> ServiceBuilder<S> builder(String name) {
        return new ServiceBuilder<>(name);
    }

    /**
     * Starts an instance with the declared initial state.
     *
     * @throws IllegalStateException if a live named service is already registered under the name
     */
    public ServiceHandle<S> run() {
        return strategy.start(declaration.spec().initialState());
    }

    /**
     * Starts an instance with the given initial state.
     */
    public ServiceHandle<S> run(S initialState) {
        return strategy.start(initialState);
    }

    public void stop(ServiceHandle<S> handle) {
        handle.stop();
    }

    /**
     * Stops the registered instance of a named service, if one is running.
     */
    public void stop() {
        if (mode() != ServiceMode.NAMED) {
            throw new IllegalStateException(mode() + " services are stopped through their handle");
        }
        registry.lookup(declaration.spec().serviceName().orElseThrow()).ifPresent(ServiceHandle::stop);
    }

    /**
     * Returns the handle of the registered instance of a named service, starting it on first
     * use when so configured.
     *
     * @throws ServiceUnavailableException if no instance is registered and none may be started
     */
    public ServiceHandle<S> lookup() {
        return strategy.implicitHandle();
    }

    public ClientFunction<S> function(String name) {
        return api.function(name);
    }

    public ClientFunction<S> function(String name, int arity) {
        return api.function(name, arity);
    }

    /**
     * Calls a public function on a running instance with the default call timeout.
     *
     * @throws UndefinedFunctionException if the service has no such function
     */
    public <T> T call(ServiceHandle<S> handle, String function, Object... args) {
        return clientFunction(function, args.length).call(handle, args);
    }

    /**
     * Calls a public function of a named service by name.
     */
    public <T> T call(String function, Object... args) {
        return clientFunction(function, args.length).invoke(args);
    }

    private ClientFunction<S> clientFunction(String function, int arity) {
        if (!api.has(function, arity)) {
            throw new UndefinedFunctionException(declaration.name(), FunctionKey.of(function, arity));
        }
        return api.function(function, arity);
    }

    /**
     * Runs an implementation function directly against a state, without any worker.
     */
    public NormalizedReply<S> impl(String function, S state, Object... args) {
        return implementation.apply(function, state, args);
    }

    /**
     * Renders the generated implementation, worker dispatch and client API as source text.
     */
    public String generatedSource() {
        return new SourceRenderer().render(declaration, implementation);
    }

    public String name() {
        return declaration.name();
    }

    public ServiceMode mode() {
        return declaration.spec().mode();
    }

    public ServiceSpec<S> spec() {
        return declaration.spec();
    }

    public ServiceDeclaration<S> declaration() {
        return declaration;
    }

    public Implementation<S> implementation() {
        return implementation;
    }

    public ClientApi<S> api() {
        return api;
    }

    public ServiceConfig config() {
        return config;
    }
}
