package com.cajunsystems.service.declaration;

import java.math.BigInteger;
import java.util.Objects;

/**
 * A parameter in a clause head: a name that binds the argument, a literal the argument
 * must equal, or an ignored name that matches anything without binding it.
 */
public sealed interface Parameter permits Parameter.Named, Parameter.Literal, Parameter.Ignored {

    /**
     * @param argument the incoming argument
     * @return true if this parameter accepts the argument
     */
    boolean matches(Object argument);

    /**
     * @return the source form of this parameter, as written in a signature
     */
    String source();

    static Parameter named(String name) {
        return new Named(name);
    }

    static Parameter literal(Object value) {
        return new Literal(value);
    }

    static Parameter ignored(String name) {
        return new Ignored(name);
    }

    record Named(String name) implements Parameter {
        public Named {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public boolean matches(Object argument) {
            return true;
        }

        @Override
        public String source() {
            return name;
        }
    }

    /**
     * A literal parameter. Integer literals are held as {@link Long} and match any
     * integral argument of the same value, so {@code fib(0)} accepts {@code 0} and {@code 0L}.
     */
    record Literal(Object value) implements Parameter {
        public Literal {
            if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
                value = ((Number) value).longValue();
            }
        }

        @Override
        public boolean matches(Object argument) {
            if (value instanceof Long) {
                long expected = (Long) value;
                if (argument instanceof Long || argument instanceof Integer
                        || argument instanceof Short || argument instanceof Byte) {
                    return ((Number) argument).longValue() == expected;
                }
                if (argument instanceof BigInteger) {
                    return argument.equals(BigInteger.valueOf(expected));
                }
                return false;
            }
            return Objects.equals(value, argument);
        }

        @Override
        public String source() {
            if (value == null) {
                return "nil";
            }
            if (value instanceof String) {
                String text = (String) value;
                return '"' + text.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
            }
            return String.valueOf(value);
        }
    }

    record Ignored(String name) implements Parameter {
        public Ignored {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public boolean matches(Object argument) {
            return true;
        }

        @Override
        public String source() {
            return name;
        }
    }
}
