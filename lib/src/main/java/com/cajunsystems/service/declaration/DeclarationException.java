package com.cajunsystems.service.declaration;

/**
 * Raised while building a service when its options or clauses are malformed.
 * Never raised once a service has been built.
 */
public class DeclarationException extends RuntimeException {

    public DeclarationException(String message) {
        super(message);
    }

    public DeclarationException(String message, Throwable cause) {
        super(message, cause);
    }
}
