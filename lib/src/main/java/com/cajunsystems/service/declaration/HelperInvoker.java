package com.cajunsystems.service.declaration;

import java.util.List;

/**
 * Calls the private helper functions of a service from inside a clause body.
 */
@FunctionalInterface
public interface HelperInvoker {

    /** Used where no helpers exist. */
    HelperInvoker NONE = (name, args) -> {
        throw new UnsupportedOperationException("No helper functions available to call " + name);
    };

    Object invoke(String name, List<Object> args);
}
