package com.cajunsystems.service;

import com.cajunsystems.service.config.ServiceConfig;
import com.cajunsystems.service.declaration.ClauseBody;
import com.cajunsystems.service.declaration.DeclarationException;
import com.cajunsystems.service.declaration.DeclarationParser;
import com.cajunsystems.service.declaration.FunctionClause;
import com.cajunsystems.service.declaration.Guard;
import com.cajunsystems.service.declaration.Parameter;
import com.cajunsystems.service.declaration.PoolBounds;
import com.cajunsystems.service.declaration.ServiceDeclaration;
import com.cajunsystems.service.declaration.ServiceMode;
import com.cajunsystems.service.declaration.ServiceSpec;
import com.cajunsystems.service.declaration.Signature;
import com.cajunsystems.service.declaration.SignatureParser;
import com.cajunsystems.service.declaration.Visibility;
import com.cajunsystems.service.registry.ServiceRegistry;
import com.cajunsystems.service.supervision.ServiceFailureListener;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Builder for a {@link Service}.
 * <p>
 * Public functions are written without their state parameter; the builder prepends it,
 * bound to the state name:
 * <pre>{@code
 * Service<Integer> counter = Service.<Integer>builder("counter")
 *     .anonymous()
 *     .withInitialState(0)
 *     .function("increment(by)", ClauseBody.setState(b -> b.<Integer>get("state") + b.<Integer>get("by")))
 *     .function("value()", ClauseBody.reply(Expression.variable("state")))
 *     .build();
 * }</pre>
 *
 * @param <S> The type of the service state
 */
public final class ServiceBuilder<S> {

    private final String name;
    private final Map<String, Object> options = new HashMap<>();
    private final List<Function<String, FunctionClause>> clauses = new ArrayList<>();
    private final List<ServiceFailureListener> failureListeners = new ArrayList<>();
    private ServiceConfig config = new ServiceConfig();
    private ServiceRegistry registry = ServiceRegistry.global();

    ServiceBuilder(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    /**
     * Adds declaration options: {@code mode}, {@code state}, {@code state_name},
     * {@code service_name}, {@code pool} and {@code diagnostics}.
     */
    public ServiceBuilder<S> withOptions(Map<String, ?> options) {
        this.options.putAll(options);
        return this;
    }

    public ServiceBuilder<S> inline() {
        options.put(DeclarationParser.MODE, ServiceMode.INLINE);
        return this;
    }

    public ServiceBuilder<S> anonymous() {
        options.put(DeclarationParser.MODE, ServiceMode.ANONYMOUS);
        return this;
    }

    /**
     * Named mode, registered under the declaration name.
     */
    public ServiceBuilder<S> named() {
        options.put(DeclarationParser.MODE, ServiceMode.NAMED);
        return this;
    }

    public ServiceBuilder<S> named(String serviceName) {
        options.put(DeclarationParser.MODE, ServiceMode.NAMED);
        options.put(DeclarationParser.SERVICE_NAME, serviceName);
        return this;
    }

    /**
     * Pooled mode with the default bounds.
     */
    public ServiceBuilder<S> pooled() {
        options.put(DeclarationParser.MODE, ServiceMode.POOLED);
        return this;
    }

    public ServiceBuilder<S> pooled(int min, int max) {
        options.put(DeclarationParser.MODE, ServiceMode.POOLED);
        options.put(DeclarationParser.POOL, new PoolBounds(min, max));
        return this;
    }

    public ServiceBuilder<S> withInitialState(S initialState) {
        options.put(DeclarationParser.STATE, initialState);
        return this;
    }

    public ServiceBuilder<S> withStateName(String stateName) {
        options.put(DeclarationParser.STATE_NAME, stateName);
        return this;
    }

    public ServiceBuilder<S> withDiagnostics(boolean diagnostics) {
        options.put(DeclarationParser.DIAGNOSTICS, diagnostics);
        return this;
    }

    public ServiceBuilder<S> withConfig(ServiceConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        return this;
    }

    /**
     * Uses a registry other than {@link ServiceRegistry#global()} for named mode.
     */
    public ServiceBuilder<S> withRegistry(ServiceRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
        return this;
    }

    public ServiceBuilder<S> withFailureListener(ServiceFailureListener listener) {
        failureListeners.add(Objects.requireNonNull(listener, "listener"));
        return this;
    }

    /**
     * Adds a clause of a public function.
     *
     * @param signature the clause head without the state, e.g. {@code "put(key, value)"}
     * @param body      the clause body
     */
    public ServiceBuilder<S> function(String signature, ClauseBody body) {
        return function(signature, Guard.ALWAYS, body);
    }

    /**
     * Adds a guarded clause of a public function. Clauses are tried in the order they are added.
     */
    public ServiceBuilder<S> function(String signature, Guard guard, ClauseBody body) {
        return addClause(signature, Visibility.PUBLIC, guard, body);
    }

    /**
     * Adds a clause of a private helper, reachable from bodies through
     * {@link com.cajunsystems.service.declaration.Bindings#call(String, Object...)}.
     */
    public ServiceBuilder<S> privateFunction(String signature, ClauseBody body) {
        return privateFunction(signature, Guard.ALWAYS, body);
    }

    public ServiceBuilder<S> privateFunction(String signature, Guard guard, ClauseBody body) {
        return addClause(signature, Visibility.PRIVATE, guard, body);
    }

    /**
     * Adds a fully formed clause. Public clauses must declare the state parameter themselves.
     */
    public ServiceBuilder<S> clause(FunctionClause clause) {
        Objects.requireNonNull(clause, "clause");
        clauses.add(stateName -> clause);
        return this;
    }

    private ServiceBuilder<S> addClause(String signature, Visibility visibility, Guard guard, ClauseBody body) {
        Signature parsed = SignatureParser.parse(signature);
        clauses.add(stateName -> {
            List<Parameter> params = new ArrayList<>(parsed.arity() + 1);
            if (visibility == Visibility.PUBLIC) {
                params.add(Parameter.named(stateName));
            }
            params.addAll(parsed.params());
            return new FunctionClause(parsed.name(), visibility, params, guard, body);
        });
        return this;
    }

    /**
     * Validates the declaration and generates the implementation, client API and deployment strategy.
     *
     * @throws DeclarationException if the declaration is malformed
     */
    public Service<S> build() {
        ServiceSpec<S> spec = new DeclarationParser().parseOptions(name, options);
        List<FunctionClause> declared = new ArrayList<>(clauses.size());
        for (Function<String, FunctionClause> clause : clauses) {
            declared.add(clause.apply(spec.stateVarName()));
        }
        ServiceDeclaration<S> declaration = new ServiceDeclaration<>(name, spec, declared);
        return new Service<>(declaration, config.copy(), registry, failureListeners);
    }
}
