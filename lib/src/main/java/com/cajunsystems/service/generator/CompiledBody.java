package com.cajunsystems.service.generator;

import com.cajunsystems.service.declaration.Bindings;

/**
 * A clause body compiled by the {@link ResponseTranslator}.
 *
 * @param <S> The type of the service state
 */
@FunctionalInterface
public interface CompiledBody<S> {

    NormalizedReply<S> evaluate(Bindings bindings);
}
