package com.cajunsystems.service.declaration;

import java.util.Locale;

/**
 * The deployment shape of a service.
 */
public enum ServiceMode {
    /** No worker; functions run on the caller's thread against state the caller threads. */
    INLINE,
    /** One supervised worker reached through the handle returned by run(). */
    ANONYMOUS,
    /** One supervised worker registered under a service name. */
    NAMED,
    /** A bounded pool of supervised workers. */
    POOLED;

    /**
     * Parses an option value such as {@code "pooled"} or {@code "Named"}.
     * {@code "none"} is accepted as an alias for {@link #INLINE}.
     *
     * @param value the option value
     * @return the mode
     * @throws DeclarationException if the value names no mode
     */
    public static ServiceMode parse(String value) {
        if (value == null) {
            throw new DeclarationException("Service mode must not be null");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("NONE".equals(normalized)) {
            return INLINE;
        }
        for (ServiceMode mode : values()) {
            if (mode.name().equals(normalized)) {
                return mode;
            }
        }
        throw new DeclarationException("Unknown service mode '" + value
                + "', expected one of inline, anonymous, named, pooled");
    }
}
