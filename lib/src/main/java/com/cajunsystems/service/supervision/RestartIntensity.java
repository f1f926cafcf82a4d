package com.cajunsystems.service.supervision;

import java.time.Duration;

/**
 * How many restarts a service may perform within a sliding window before its
 * failures are considered fatal.
 *
 * @param maxRestarts restarts allowed within the window
 * @param window      the length of the sliding window
 */
public record RestartIntensity(int maxRestarts, Duration window) {

    /** Three restarts within five seconds. */
    public static final RestartIntensity DEFAULT = new RestartIntensity(3, Duration.ofSeconds(5));

    public RestartIntensity {
        if (maxRestarts < 0) {
            throw new IllegalArgumentException("maxRestarts must not be negative");
        }
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive");
        }
    }

    public static RestartIntensity of(int maxRestarts, Duration window) {
        return new RestartIntensity(maxRestarts, window);
    }
}
