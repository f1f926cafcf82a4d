package com.cajunsystems.service.generator;

/**
 * What every implementation function returns: either a plain value, which leaves the state
 * unchanged, or a value together with the next state.
 *
 * @param <S> The type of the service state
 */
public sealed interface NormalizedReply<S> permits NormalizedReply.Plain, NormalizedReply.WithState {

    /**
     * @return the value the caller receives
     */
    Object value();

    boolean updatesState();

    /**
     * @param current the state before the call
     * @return the state after the call
     */
    S nextState(S current);

    static <S> NormalizedReply<S> plain(Object value) {
        return new Plain<>(value);
    }

    static <S> NormalizedReply<S> withState(Object value, S newState) {
        return new WithState<>(value, newState);
    }

    record Plain<S>(Object value) implements NormalizedReply<S> {
        @Override
        public boolean updatesState() {
            return false;
        }

        @Override
        public S nextState(S current) {
            return current;
        }
    }

    record WithState<S>(Object value, S newState) implements NormalizedReply<S> {
        @Override
        public boolean updatesState() {
            return true;
        }

        @Override
        public S nextState(S current) {
            return newState;
        }
    }
}
