package com.cajunsystems.service.runtime;

/**
 * Lifecycle of a worker. Transitions only move forward.
 */
public enum WorkerLifecycle {
    CREATED,
    RUNNING,
    TERMINATED
}
