package com.cajunsystems.service.supervision;

/**
 * What the supervisor does when a worker terminates abnormally.
 */
public enum SupervisionStrategy {
    /**
     * Start a replacement worker with the service's initial state in the same slot.
     * Calls queued on the failed worker are redelivered to the replacement.
     */
    RESTART,
    /**
     * Close the slot. A single-worker service becomes unavailable; a pool drops the slot
     * and creates new workers on demand.
     */
    STOP,
    /**
     * Treat the failure as fatal for the whole service.
     */
    ESCALATE
}
