package com.cajunsystems.service.api;

import com.cajunsystems.service.ServiceHandle;
import com.cajunsystems.service.declaration.FunctionKey;
import com.cajunsystems.service.generator.ImplFunction;
import com.cajunsystems.service.generator.Implementation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Builds the {@link ClientApi} of an implementation: for each public function
 * {@code f(state, a1..an)} a client function taking {@code a1..an}.
 */
public final class ClientApiGenerator {

    private static final Logger logger = LoggerFactory.getLogger(ClientApiGenerator.class);

    /**
     * @param implementation the generated implementation
     * @param defaultTimeout the call timeout used when the caller gives none
     * @param implicitHandle resolves the handle for calls that name none
     */
    public <S> ClientApi<S> generate(Implementation<S> implementation, Duration defaultTimeout,
                                     Supplier<ServiceHandle<S>> implicitHandle) {
        Map<FunctionKey, ClientFunction<S>> functions = new LinkedHashMap<>();
        for (ImplFunction<S> function : implementation.functions()) {
            functions.put(function.key(), new ClientFunction<>(
                    function.key(), function.shape(), implementation, defaultTimeout, implicitHandle));
        }
        logger.debug("Generated client API of {} with functions {}", implementation.serviceName(), functions.keySet());
        return new ClientApi<>(implementation.serviceName(), functions);
    }
}
