package com.cajunsystems.service.generator;

import com.cajunsystems.service.declaration.FunctionKey;

/**
 * Raised when a call names a function, or an arity, the service does not define.
 */
public class UndefinedFunctionException extends RuntimeException {

    private final FunctionKey function;

    public UndefinedFunctionException(String serviceName, FunctionKey function) {
        super("Service " + serviceName + " does not define " + function);
        this.function = function;
    }

    public FunctionKey getFunction() {
        return function;
    }
}
