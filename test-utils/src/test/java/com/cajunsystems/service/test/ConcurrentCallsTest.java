package com.cajunsystems.service.test;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CyclicBarrier;

import static org.junit.jupiter.api.Assertions.*;

class ConcurrentCallsTest {

    @Test
    void shouldReleaseAllCallersTogether() {
        CyclicBarrier barrier = new CyclicBarrier(3);

        ConcurrentCalls.Results<Integer> results = ConcurrentCalls.run(3, i -> {
            try {
                barrier.await();
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
            return i;
        }, Duration.ofSeconds(5));

        assertEquals(List.of(0, 1, 2), results.successes());
    }

    @Test
    void shouldCollectFailuresInCallerOrder() {
        ConcurrentCalls.Results<String> results = ConcurrentCalls.run(4, i -> {
            if (i % 2 == 1) {
                throw new IllegalArgumentException("odd " + i);
            }
            return "even " + i;
        }, Duration.ofSeconds(5));

        assertEquals(List.of("even 0", "even 2"), results.successes());
        assertEquals(2, results.failures(IllegalArgumentException.class).size());
        assertEquals("odd 1", results.failures().get(0).getMessage());
        assertFalse(results.outcomes().get(1).isSuccess());
    }

    @Test
    void shouldRejectNoCallers() {
        assertThrows(IllegalArgumentException.class, () -> ConcurrentCalls.run(0, i -> i, Duration.ofSeconds(1)));
    }
}
