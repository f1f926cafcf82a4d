package com.cajunsystems.service;

import java.time.Duration;

/**
 * Raised when a caller gives up waiting for a reply.
 * The call itself is not cancelled; the worker still completes it and commits any state update.
 */
public class CallTimeoutException extends ServiceException {

    private final String function;
    private final Duration timeout;

    public CallTimeoutException(String serviceId, String function, Duration timeout) {
        super(serviceId, "Call to " + function + " on service " + serviceId
                + " timed out after " + timeout.toMillis() + " ms");
        this.function = function;
        this.timeout = timeout;
    }

    public String getFunction() {
        return function;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
