package com.cajunsystems.service.generator;

/**
 * The terminal form of a clause body or a function, decided structurally at generation time.
 */
public enum ReplyShape {
    /** Always replies without changing the state. */
    PLAIN,
    /** Always replaces the state. */
    WITH_STATE,
    /** Depends on which branch is taken at run time. */
    MIXED;

    ReplyShape combine(ReplyShape other) {
        return this == other ? this : MIXED;
    }
}
