package com.cajunsystems.service.declaration;

/**
 * Whether a function is part of the client API or a private helper.
 */
public enum Visibility {
    PUBLIC,
    PRIVATE
}
