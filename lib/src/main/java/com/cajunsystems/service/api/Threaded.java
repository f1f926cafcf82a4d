package com.cajunsystems.service.api;

/**
 * The result of calling a function on a state the caller threads itself.
 *
 * @param value the reply value
 * @param state the state to pass to the next call
 * @param <S>   The type of the service state
 */
public record Threaded<S>(Object value, S state) {

    @SuppressWarnings("unchecked")
    public <T> T valueAs() {
        return (T) value;
    }
}
