package com.cajunsystems.service;

import java.time.Duration;

/**
 * Raised when no pooled worker could be checked out within the checkout timeout.
 * Recoverable: the caller may retry later.
 */
public class PoolExhaustedException extends ServiceException {

    private final int maxWorkers;
    private final Duration waited;

    public PoolExhaustedException(String serviceId, int maxWorkers, Duration waited) {
        super(serviceId, "Pool of service " + serviceId + " exhausted: all " + maxWorkers
                + " workers busy after waiting " + waited.toMillis() + " ms");
        this.maxWorkers = maxWorkers;
        this.waited = waited;
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    public Duration getWaited() {
        return waited;
    }
}
