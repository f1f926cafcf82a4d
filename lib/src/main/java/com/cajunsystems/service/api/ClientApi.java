package com.cajunsystems.service.api;

import com.cajunsystems.service.declaration.FunctionKey;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * The client functions of a service, one per public function.
 *
 * @param <S> The type of the service state
 */
public final class ClientApi<S> {

    private final String serviceName;
    private final Map<FunctionKey, ClientFunction<S>> functions;

    ClientApi(String serviceName, Map<FunctionKey, ClientFunction<S>> functions) {
        this.serviceName = serviceName;
        this.functions = Collections.unmodifiableMap(functions);
    }

    /**
     * Looks up a function by name.
     *
     * @throws IllegalArgumentException if no function or more than one arity has the name
     */
    public ClientFunction<S> function(String name) {
        List<ClientFunction<S>> matches = functions.values().stream()
                .filter(function -> function.name().equals(name))
                .collect(Collectors.toList());
        if (matches.isEmpty()) {
            throw new IllegalArgumentException("Service " + serviceName + " has no public function " + name);
        }
        if (matches.size() > 1) {
            throw new IllegalArgumentException("Function " + name + " of service " + serviceName
                    + " has several arities " + matches.stream().map(ClientFunction::arity).collect(Collectors.toList())
                    + ", look it up with its arity");
        }
        return matches.get(0);
    }

    /**
     * @throws IllegalArgumentException if the service has no such function
     */
    public ClientFunction<S> function(String name, int arity) {
        ClientFunction<S> function = functions.get(FunctionKey.of(name, arity));
        if (function == null) {
            throw new IllegalArgumentException("Service " + serviceName + " has no public function " + name + "/" + arity);
        }
        return function;
    }

    public boolean has(String name, int arity) {
        return functions.containsKey(FunctionKey.of(name, arity));
    }

    public Collection<ClientFunction<S>> functions() {
        return functions.values();
    }
}
