package com.cajunsystems.service.declaration;

/**
 * A pure condition over the bindings of a clause, used as a clause guard or a branch condition.
 */
@FunctionalInterface
public interface Guard {

    /** A guard that always holds. */
    Guard ALWAYS = bindings -> true;

    boolean test(Bindings bindings);

    default Guard negate() {
        return bindings -> !test(bindings);
    }
}
