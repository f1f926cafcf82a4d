package com.cajunsystems.service.generator;

import com.cajunsystems.service.declaration.FunctionKey;
import com.cajunsystems.service.declaration.HelperInvoker;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The generated implementation of a service: its public functions and private helpers.
 * Shared, unchanged, by every mode and every worker of the service.
 *
 * @param <S> The type of the service state
 */
public final class Implementation<S> implements HelperInvoker {

    private final String serviceName;
    private final String stateVarName;
    private final Map<FunctionKey, ImplFunction<S>> functions = new LinkedHashMap<>();
    private final Map<FunctionKey, HelperFunction> helpers = new LinkedHashMap<>();

    Implementation(String serviceName, String stateVarName) {
        this.serviceName = serviceName;
        this.stateVarName = stateVarName;
    }

    void define(ImplFunction<S> function) {
        functions.put(function.key(), function);
    }

    void defineHelper(HelperFunction helper) {
        helpers.put(helper.key(), helper);
    }

    /**
     * Runs a public function against a state.
     *
     * @throws UndefinedFunctionException if the service defines no such function
     */
    public NormalizedReply<S> apply(FunctionKey function, S state, List<Object> args) {
        ImplFunction<S> impl = functions.get(function);
        if (impl == null) {
            throw new UndefinedFunctionException(serviceName, function);
        }
        return impl.apply(state, args);
    }

    public NormalizedReply<S> apply(String function, S state, Object... args) {
        return apply(FunctionKey.of(function, args.length), state, Arrays.asList(args));
    }

    /**
     * Calls a private helper. Public functions are not reachable this way.
     */
    @Override
    public Object invoke(String name, List<Object> args) {
        HelperFunction helper = helpers.get(FunctionKey.of(name, args.size()));
        if (helper == null) {
            throw new UndefinedFunctionException(serviceName, FunctionKey.of(name, args.size()));
        }
        return helper.apply(args);
    }

    public Optional<ImplFunction<S>> function(FunctionKey key) {
        return Optional.ofNullable(functions.get(key));
    }

    public Collection<ImplFunction<S>> functions() {
        return Collections.unmodifiableCollection(functions.values());
    }

    public Collection<HelperFunction> helpers() {
        return Collections.unmodifiableCollection(helpers.values());
    }

    public String serviceName() {
        return serviceName;
    }

    public String stateVarName() {
        return stateVarName;
    }
}
