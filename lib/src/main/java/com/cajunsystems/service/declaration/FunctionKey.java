package com.cajunsystems.service.declaration;

/**
 * Identifies a function by name and arity. For public functions the arity counts the
 * client-visible arguments only, so {@code put(state, key, value)} is {@code put/2}.
 */
public record FunctionKey(String name, int arity) {

    public FunctionKey {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Function name must not be blank");
        }
        if (arity < 0) {
            throw new IllegalArgumentException("Arity must not be negative");
        }
    }

    public static FunctionKey of(String name, int arity) {
        return new FunctionKey(name, arity);
    }

    @Override
    public String toString() {
        return name + "/" + arity;
    }
}
