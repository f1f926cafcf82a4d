package com.cajunsystems.service.generator;

import com.cajunsystems.service.declaration.FunctionKey;

import java.util.List;

/**
 * Raised when no clause of a function accepts the arguments of a call.
 */
public class FunctionClauseException extends RuntimeException {

    private final FunctionKey function;

    public FunctionClauseException(FunctionKey function, List<Object> args) {
        super("No clause of " + function + " matches arguments " + args);
        this.function = function;
    }

    public FunctionKey getFunction() {
        return function;
    }
}
