package com.cajunsystems.service.supervision;

import com.cajunsystems.service.ServiceUnavailableException;
import com.cajunsystems.service.TestServices;
import com.cajunsystems.service.config.ServiceConfig;
import com.cajunsystems.service.config.WorkerThreadFactory;
import com.cajunsystems.service.declaration.FunctionKey;
import com.cajunsystems.service.generator.Implementation;
import com.cajunsystems.service.runtime.WorkerFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class SupervisorTest {

    private static final FunctionKey INCREMENT = FunctionKey.of("increment", 0);
    private static final FunctionKey VALUE = FunctionKey.of("value", 0);
    private static final FunctionKey FAIL = FunctionKey.of("fail", 0);
    private static final FunctionKey SLEEP = FunctionKey.of("sleep", 1);

    private Implementation<Integer> implementation;
    private Supervisor<Integer> supervisor;

    @BeforeEach
    void setUp() {
        implementation = TestServices.counter("supervised").anonymous().build().implementation();
    }

    @AfterEach
    void tearDown() {
        if (supervisor != null) {
            supervisor.shutdown();
        }
    }

    private Supervisor<Integer> supervisor(SupervisionStrategy strategy, RestartIntensity intensity,
                                           boolean terminateWhenEmpty) {
        WorkerFactory<Integer> workers = WorkerFactory.standard("supervised", implementation, new ServiceConfig(),
                new WorkerThreadFactory("supervised").workerThreads());
        supervisor = new Supervisor<>("supervised", strategy, new RestartBudget(intensity), workers, 0, terminateWhenEmpty);
        return supervisor;
    }

    /**
     * A restarting supervisor whose replacement workers are held back until the gate opens.
     */
    private Supervisor<Integer> gatedSupervisor(CountDownLatch restarting, CountDownLatch gate) {
        WorkerFactory<Integer> standard = WorkerFactory.standard("supervised", implementation, new ServiceConfig(),
                new WorkerThreadFactory("supervised").workerThreads());
        AtomicInteger created = new AtomicInteger();
        WorkerFactory<Integer> gated = (workerId, initialState, listener) -> {
            if (created.incrementAndGet() > 1) {
                restarting.countDown();
                try {
                    gate.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return standard.create(workerId, initialState, listener);
        };
        supervisor = new Supervisor<>("supervised", SupervisionStrategy.RESTART,
                new RestartBudget(RestartIntensity.DEFAULT), gated, 0, true);
        return supervisor;
    }

    private static Object await(CompletableFuture<Object> reply) throws Exception {
        return reply.get(2, TimeUnit.SECONDS);
    }

    private static void assertUnavailable(CompletableFuture<?> reply) {
        ExecutionException thrown = assertThrows(ExecutionException.class, () -> reply.get(2, TimeUnit.SECONDS));
        assertInstanceOf(ServiceUnavailableException.class, thrown.getCause());
    }

    @Test
    void testRestartReplacesWorkerWithInitialState() throws Exception {
        WorkerSlot<Integer> slot = supervisor(SupervisionStrategy.RESTART, RestartIntensity.DEFAULT, true).openSlot();
        assertEquals(1, await(slot.submit(INCREMENT, List.of())));

        assertUnavailable(slot.submit(FAIL, List.of()));

        assertEquals(0, await(slot.submit(VALUE, List.of())));
        assertEquals(1, supervisor.restartCount());
        assertEquals(2, slot.generation());
        assertTrue(slot.isAlive());
        assertTrue(supervisor.isServing());
    }

    @Test
    void testQueuedRequestsMoveToReplacement() throws Exception {
        WorkerSlot<Integer> slot = supervisor(SupervisionStrategy.RESTART, RestartIntensity.DEFAULT, true).openSlot();
        slot.submit(INCREMENT, List.of());
        CompletableFuture<Object> blocked = slot.submit(SLEEP, List.of(100));
        CompletableFuture<Object> failing = slot.submit(FAIL, List.of());
        CompletableFuture<Object> queued = slot.submit(INCREMENT, List.of());

        assertEquals(1, await(blocked));
        assertUnavailable(failing);
        assertEquals(1, await(queued));
    }

    @Test
    void testExceedingIntensityIsFatal() throws Exception {
        ServiceFailureListener listener = mock(ServiceFailureListener.class);
        supervisor(SupervisionStrategy.RESTART, RestartIntensity.of(1, Duration.ofSeconds(10)), true);
        supervisor.addFailureListener(listener);
        WorkerSlot<Integer> slot = supervisor.openSlot();

        assertUnavailable(slot.submit(FAIL, List.of()));
        assertTrue(supervisor.isServing());
        assertUnavailable(slot.submit(FAIL, List.of()));

        assertFalse(supervisor.isServing());
        assertTrue(supervisor.failure().isPresent());
        assertTrue(supervisor.terminationFuture().isCompletedExceptionally());
        assertFalse(slot.isAlive());
        assertEquals(0, supervisor.openSlots());
        verify(listener).onServiceFailure(eq("supervised"), any(ServiceUnavailableException.class));
        assertThrows(ServiceUnavailableException.class, () -> supervisor.openSlot());
        assertUnavailable(slot.submit(VALUE, List.of()));
    }

    @Test
    void testStopStrategyOnSingleWorkerIsFatal() {
        WorkerSlot<Integer> slot = supervisor(SupervisionStrategy.STOP, RestartIntensity.DEFAULT, true).openSlot();

        assertUnavailable(slot.submit(FAIL, List.of()));

        assertTrue(slot.isClosed());
        assertFalse(supervisor.isServing());
        assertEquals(0, supervisor.restartCount());
    }

    @Test
    void testStopStrategyInPoolClosesOnlyTheFailedSlot() throws Exception {
        supervisor(SupervisionStrategy.STOP, RestartIntensity.DEFAULT, false);
        WorkerSlot<Integer> failing = supervisor.openSlot();
        WorkerSlot<Integer> healthy = supervisor.openSlot();

        assertUnavailable(failing.submit(FAIL, List.of()));

        assertTrue(failing.isClosed());
        assertTrue(healthy.isAlive());
        assertTrue(supervisor.isServing());
        assertEquals(1, supervisor.openSlots());
        assertEquals(1, await(healthy.submit(INCREMENT, List.of())));
    }

    @Test
    void testEscalateIsFatalAndCarriesTheCause() {
        WorkerSlot<Integer> slot = supervisor(SupervisionStrategy.ESCALATE, RestartIntensity.DEFAULT, true).openSlot();

        assertUnavailable(slot.submit(FAIL, List.of()));

        ServiceUnavailableException failure = supervisor.failure().orElseThrow();
        assertInstanceOf(IllegalStateException.class, failure.getCause());
        ExecutionException thrown = assertThrows(ExecutionException.class,
                () -> supervisor.terminationFuture().get(1, TimeUnit.SECONDS));
        assertSame(failure, thrown.getCause());
    }

    @Test
    void testShutdownCompletesTerminationNormally() throws Exception {
        WorkerSlot<Integer> slot = supervisor(SupervisionStrategy.RESTART, RestartIntensity.DEFAULT, true).openSlot();

        supervisor.shutdown();

        assertNull(supervisor.terminationFuture().get(1, TimeUnit.SECONDS));
        assertFalse(slot.isAlive());
        assertThrows(ServiceUnavailableException.class, () -> supervisor.ensureServing());
        assertUnavailable(slot.submit(VALUE, List.of()));
    }

    @Test
    void testInspectStateSeesEarlierCalls() throws Exception {
        WorkerSlot<Integer> slot = supervisor(SupervisionStrategy.RESTART, RestartIntensity.DEFAULT, true).openSlot();
        slot.submit(INCREMENT, List.of());
        slot.submit(INCREMENT, List.of());

        assertEquals(2, slot.inspectState().get(1, TimeUnit.SECONDS));
    }

    @Test
    void testCallsDuringRestartWaitForReplacement() throws Exception {
        CountDownLatch restarting = new CountDownLatch(1);
        CountDownLatch gate = new CountDownLatch(1);
        WorkerSlot<Integer> slot = gatedSupervisor(restarting, gate).openSlot();
        assertEquals(1, await(slot.submit(INCREMENT, List.of())));

        CompletableFuture<Object> failing = slot.submit(FAIL, List.of());
        assertTrue(restarting.await(2, TimeUnit.SECONDS));
        CompletableFuture<Object> duringRestart = slot.submit(VALUE, List.of());

        assertFalse(duringRestart.isDone());
        assertEquals(1, slot.parkedCount());

        gate.countDown();

        assertEquals(0, await(duringRestart));
        assertUnavailable(failing);
        assertEquals(0, slot.parkedCount());
        assertEquals(1, supervisor.restartCount());
    }

    @Test
    void testShutdownDuringRestartFailsParkedCalls() throws Exception {
        CountDownLatch restarting = new CountDownLatch(1);
        CountDownLatch gate = new CountDownLatch(1);
        WorkerSlot<Integer> slot = gatedSupervisor(restarting, gate).openSlot();

        CompletableFuture<Object> failing = slot.submit(FAIL, List.of());
        assertTrue(restarting.await(2, TimeUnit.SECONDS));
        CompletableFuture<Object> duringRestart = slot.submit(VALUE, List.of());

        supervisor.shutdown();

        assertUnavailable(duringRestart);
        gate.countDown();
        assertUnavailable(failing);
        assertEquals(0, supervisor.restartCount());
        assertTrue(slot.isClosed());
        assertFalse(slot.isAlive());
    }
}
