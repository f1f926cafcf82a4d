package com.cajunsystems.service.declaration;

import java.util.List;

/**
 * A parsed clause head: the function name and its declared parameters.
 */
public record Signature(String name, List<Parameter> params) {

    public Signature {
        params = List.copyOf(params);
    }

    public int arity() {
        return params.size();
    }
}
