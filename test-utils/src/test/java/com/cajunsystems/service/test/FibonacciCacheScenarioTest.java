package com.cajunsystems.service.test;

import com.cajunsystems.service.Service;
import com.cajunsystems.service.ServiceHandle;
import com.cajunsystems.service.generator.NormalizedReply;
import examples.FibonacciCache;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The memoized Fibonacci service: computing fib(20) fills the cache, later calls for smaller
 * numbers are answered from it without changing the state.
 */
class FibonacciCacheScenarioTest {

    private ServiceTestKit kit;
    private Service<Map<Integer, Long>> fib;

    @BeforeEach
    void setUp() {
        kit = ServiceTestKit.create();
        fib = FibonacciCache.declare();
    }

    @AfterEach
    void tearDown() {
        kit.close();
    }

    @Test
    void shouldComputeFib20ThroughClientApi() {
        ServiceHandle<Map<Integer, Long>> handle = kit.run(fib);

        Long fib20 = fib.call(handle, "fib", 20);

        assertEquals(6765L, fib20);
        Map<Integer, Long> cache = kit.stateOf(handle);
        assertEquals(21, cache.size());
        assertEquals(4181L, cache.get(19));
    }

    @Test
    void shouldAnswerCachedNumberWithoutChangingState() {
        ServiceHandle<Map<Integer, Long>> handle = kit.run(fib);
        fib.call(handle, "fib", 20);
        Map<Integer, Long> filled = kit.stateOf(handle);

        Long fib10 = fib.call(handle, "fib", 10);

        assertEquals(55L, fib10);
        assertSame(filled, kit.stateOf(handle));
        NormalizedReply<Map<Integer, Long>> reply = fib.impl("fib", filled, 10);
        assertInstanceOf(NormalizedReply.Plain.class, reply);
        assertEquals(55L, reply.value());
    }

    @Test
    void shouldReplyWithStateOnCacheMiss() {
        NormalizedReply<Map<Integer, Long>> reply = kit.assertPure(fib, "fib", Map.of(), 10);

        assertInstanceOf(NormalizedReply.WithState.class, reply);
        assertEquals(55L, reply.value());
        assertEquals(11, reply.nextState(Map.of()).size());
    }

    @Test
    void shouldStartEveryRunWithEmptyCache() {
        ServiceHandle<Map<Integer, Long>> first = kit.run(fib);
        ServiceHandle<Map<Integer, Long>> second = kit.run(fib);

        fib.call(first, "fib", 5);

        assertEquals(6, kit.stateOf(first).size());
        assertTrue(kit.stateOf(second).isEmpty());
    }
}
