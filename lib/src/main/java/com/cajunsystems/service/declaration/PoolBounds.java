package com.cajunsystems.service.declaration;

/**
 * Minimum and maximum size of a worker pool.
 *
 * @param min workers kept alive while idle
 * @param max hard upper bound on live workers
 */
public record PoolBounds(int min, int max) {

    /** Bounds used when a pooled service declares none. */
    public static final PoolBounds DEFAULT = new PoolBounds(2, 5);

    public PoolBounds {
        if (min < 0) {
            throw new DeclarationException("Pool min must not be negative, was " + min);
        }
        if (max < 1) {
            throw new DeclarationException("Pool max must be at least 1, was " + max);
        }
        if (min > max) {
            throw new DeclarationException("Pool min " + min + " exceeds max " + max);
        }
    }
}
