package com.cajunsystems.service.supervision;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class RestartBudgetTest {

    private AtomicLong clock;
    private RestartBudget budget;

    @BeforeEach
    void setUp() {
        clock = new AtomicLong();
        budget = new RestartBudget(RestartIntensity.of(2, Duration.ofSeconds(1)), clock::get);
    }

    @Test
    void testAllowsRestartsUpToTheLimit() {
        assertTrue(budget.tryAcquire());
        assertTrue(budget.tryAcquire());
        assertFalse(budget.tryAcquire());
        assertEquals(2, budget.recent());
    }

    @Test
    void testWindowSlides() {
        assertTrue(budget.tryAcquire());
        clock.addAndGet(Duration.ofMillis(600).toNanos());
        assertTrue(budget.tryAcquire());
        assertFalse(budget.tryAcquire());

        clock.addAndGet(Duration.ofMillis(500).toNanos());

        assertEquals(1, budget.recent());
        assertTrue(budget.tryAcquire());
        assertFalse(budget.tryAcquire());
    }

    @Test
    void testZeroRestartsNeverAllowsOne() {
        RestartBudget none = new RestartBudget(RestartIntensity.of(0, Duration.ofSeconds(1)), clock::get);

        assertFalse(none.tryAcquire());
    }
}
