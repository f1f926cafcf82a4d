package com.cajunsystems.service.supervision;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.LongSupplier;

/**
 * Tracks restarts within the sliding window of a {@link RestartIntensity}.
 */
public final class RestartBudget {

    private final RestartIntensity intensity;
    private final LongSupplier nanoClock;
    private final Deque<Long> restarts = new ArrayDeque<>();

    public RestartBudget(RestartIntensity intensity) {
        this(intensity, System::nanoTime);
    }

    public RestartBudget(RestartIntensity intensity, LongSupplier nanoClock) {
        this.intensity = intensity;
        this.nanoClock = nanoClock;
    }

    /**
     * Records a restart if the window still allows one.
     *
     * @return false if the restart would exceed the intensity
     */
    public synchronized boolean tryAcquire() {
        long now = nanoClock.getAsLong();
        long windowNanos = intensity.window().toNanos();
        while (!restarts.isEmpty() && now - restarts.peekFirst() >= windowNanos) {
            restarts.pollFirst();
        }
        if (restarts.size() >= intensity.maxRestarts()) {
            return false;
        }
        restarts.addLast(now);
        return true;
    }

    /**
     * @return restarts recorded within the current window
     */
    public synchronized int recent() {
        long now = nanoClock.getAsLong();
        long windowNanos = intensity.window().toNanos();
        return (int) restarts.stream().filter(at -> now - at < windowNanos).count();
    }

    public RestartIntensity intensity() {
        return intensity;
    }
}
