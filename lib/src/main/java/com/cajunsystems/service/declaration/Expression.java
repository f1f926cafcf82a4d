package com.cajunsystems.service.declaration;

/**
 * A pure computation over the bindings of a clause.
 */
@FunctionalInterface
public interface Expression {

    Object evaluate(Bindings bindings);

    /**
     * @return an expression that reads a bound variable
     */
    static Expression variable(String name) {
        return bindings -> bindings.get(name);
    }

    static Expression constant(Object value) {
        return bindings -> value;
    }
}
