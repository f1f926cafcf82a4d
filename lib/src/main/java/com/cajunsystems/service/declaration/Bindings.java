package com.cajunsystems.service.declaration;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The immutable variable environment a clause body is evaluated in. Holds the bound
 * parameters (including the state variable) and gives access to private helpers.
 */
public final class Bindings {

    private final Map<String, Object> values;
    private final HelperInvoker helpers;

    private Bindings(Map<String, Object> values, HelperInvoker helpers) {
        this.values = values;
        this.helpers = helpers;
    }

    public static Bindings empty() {
        return new Bindings(Collections.emptyMap(), HelperInvoker.NONE);
    }

    /**
     * Creates bindings over a copy of the given values. Null values are allowed.
     */
    public static Bindings of(Map<String, ?> values, HelperInvoker helpers) {
        return new Bindings(Collections.unmodifiableMap(new HashMap<>(values)), helpers);
    }

    /**
     * Reads a bound variable.
     *
     * @param name the variable name
     * @param <T>  the expected type
     * @return the bound value, possibly null
     * @throws IllegalArgumentException if the name is not bound
     */
    @SuppressWarnings("unchecked")
    public <T> T get(String name) {
        if (!values.containsKey(name)) {
            throw new IllegalArgumentException("Unbound variable '" + name + "', bound: " + values.keySet());
        }
        return (T) values.get(name);
    }

    /**
     * Reads a bound variable holding an integral number.
     */
    public long getLong(String name) {
        Object value = get(name);
        if (!(value instanceof Number)) {
            throw new IllegalArgumentException("Variable '" + name + "' is not a number: " + value);
        }
        return ((Number) value).longValue();
    }

    public boolean isBound(String name) {
        return values.containsKey(name);
    }

    /**
     * @return new bindings with one more variable; an existing binding of the same name is shadowed
     */
    public Bindings with(String name, Object value) {
        Map<String, Object> extended = new HashMap<>(values);
        extended.put(name, value);
        return new Bindings(Collections.unmodifiableMap(extended), helpers);
    }

    /**
     * Calls a private helper function of the same service.
     *
     * @param function the helper name
     * @param args     the helper arguments
     * @param <T>      the expected result type
     * @return the helper's result
     */
    @SuppressWarnings("unchecked")
    public <T> T call(String function, Object... args) {
        List<Object> arguments = Collections.unmodifiableList(new ArrayList<>(Arrays.asList(args)));
        return (T) helpers.invoke(function, arguments);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "Bindings" + values;
    }
}
