package com.cajunsystems.service.pool;

/**
 * A snapshot of a worker pool.
 *
 * @param size      live slots, idle and busy
 * @param idle      slots waiting for a checkout
 * @param busy      slots checked out
 * @param waiting   callers waiting for a slot
 * @param min       configured minimum size
 * @param max       configured maximum size
 * @param created   slots created since start
 * @param retired   idle slots retired by the reaper
 * @param dropped   slots dropped because their worker was stopped after a failure
 * @param exhausted checkouts that timed out
 */
public record PoolStats(int size, int idle, int busy, int waiting, int min, int max,
                        long created, long retired, long dropped, long exhausted) {
}
