package com.cajunsystems.service;

import com.cajunsystems.service.api.ClientFunction;
import com.cajunsystems.service.api.Threaded;
import com.cajunsystems.service.config.ServiceConfig;
import com.cajunsystems.service.declaration.ServiceMode;
import com.cajunsystems.service.generator.NormalizedReply;
import com.cajunsystems.service.generator.UndefinedFunctionException;
import com.cajunsystems.service.mode.InlineHandle;
import com.cajunsystems.service.mode.PooledHandle;
import com.cajunsystems.service.mode.SupervisedHandle;
import com.cajunsystems.service.registry.ServiceRegistry;
import com.cajunsystems.service.supervision.RestartIntensity;
import com.cajunsystems.service.supervision.ServiceFailureListener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class ServiceTest {

    private final List<ServiceHandle<?>> handles = new ArrayList<>();
    private ServiceRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ServiceRegistry();
    }

    @AfterEach
    void tearDown() {
        handles.forEach(ServiceHandle::stop);
        for (String name : List.copyOf(registry.names())) {
            registry.lookup(name).ifPresent(ServiceHandle::stop);
        }
    }

    private <S> ServiceHandle<S> run(Service<S> service) {
        ServiceHandle<S> handle = service.run();
        handles.add(handle);
        return handle;
    }

    @Test
    void testAnonymousServiceThreadsState() throws Exception {
        Service<Integer> counter = TestServices.counter("counter").anonymous().build();
        ServiceHandle<Integer> handle = run(counter);

        Integer first = counter.call(handle, "increment");
        Integer second = counter.call(handle, "increment");
        String ok = counter.call(handle, "add", 10);
        Integer value = counter.call(handle, "value");

        assertEquals(1, first);
        assertEquals(2, second);
        assertEquals("ok", ok);
        assertEquals(12, value);
        assertEquals(12, handle.inspectState().get(1, TimeUnit.SECONDS));
        assertEquals(ServiceMode.ANONYMOUS, handle.mode());
        assertTrue(handle.isAlive());
    }

    @Test
    void testEachRunHasItsOwnWorker() {
        Service<Integer> counter = TestServices.counter("counter").anonymous().build();
        ServiceHandle<Integer> a = run(counter);
        ServiceHandle<Integer> b = counter.run(100);
        handles.add(b);

        counter.call(a, "increment");
        Integer fromA = counter.call(a, "value");
        Integer fromB = counter.call(b, "value");

        assertNotEquals(a.id(), b.id());
        assertEquals(1, fromA);
        assertEquals(100, fromB);
    }

    @Test
    void testFailureRestartsWorkerWithInitialState() {
        Service<Integer> counter = TestServices.counter("counter").anonymous().build();
        ServiceHandle<Integer> handle = run(counter);
        counter.call(handle, "increment");

        ServiceUnavailableException thrown = assertThrows(ServiceUnavailableException.class,
                () -> counter.call(handle, "fail"));

        assertInstanceOf(IllegalStateException.class, thrown.getCause());
        Integer value = counter.call(handle, "value");
        assertEquals(0, value);
        assertTrue(handle.isAlive());
        assertEquals(1, ((SupervisedHandle<Integer>) handle).restartCount());
    }

    @Test
    void testExceedingRestartIntensityIsFatal() {
        ServiceFailureListener listener = mock(ServiceFailureListener.class);
        Service<Integer> counter = TestServices.counter("fragile")
                .anonymous()
                .withConfig(new ServiceConfig().setRestartIntensity(RestartIntensity.of(0, Duration.ofSeconds(5))))
                .withFailureListener(listener)
                .build();
        ServiceHandle<Integer> handle = run(counter);

        assertThrows(ServiceUnavailableException.class, () -> counter.call(handle, "fail"));

        assertFalse(handle.isAlive());
        assertTrue(handle.terminationFuture().isCompletedExceptionally());
        verify(listener).onServiceFailure(eq(handle.id()), any(ServiceUnavailableException.class));
        assertThrows(ServiceUnavailableException.class, () -> counter.call(handle, "value"));
    }

    @Test
    void testRestartsStayInvisibleToConcurrentCallers() throws Exception {
        Service<Integer> counter = TestServices.counter("resilient")
                .anonymous()
                .withConfig(new ServiceConfig().setRestartIntensity(RestartIntensity.of(1_000_000, Duration.ofSeconds(60))))
                .build();
        ServiceHandle<Integer> handle = run(counter);
        AtomicBoolean crashing = new AtomicBoolean(true);
        AtomicInteger served = new AtomicInteger();
        List<ServiceException> rejected = new CopyOnWriteArrayList<>();
        Thread reader = new Thread(() -> {
            while (crashing.get()) {
                try {
                    counter.call(handle, "value");
                    served.incrementAndGet();
                } catch (ServiceException e) {
                    rejected.add(e);
                }
            }
        }, "resilient-reader");
        reader.start();

        try {
            for (int i = 0; i < 200; i++) {
                assertThrows(ServiceUnavailableException.class, () -> counter.call(handle, "fail"));
            }
        } finally {
            crashing.set(false);
            reader.join(5000);
        }

        assertTrue(rejected.isEmpty(), () -> rejected.size() + " calls rejected, first: " + rejected.get(0));
        assertTrue(served.get() > 0);
        assertTrue(handle.isAlive());
        assertEquals(200, ((SupervisedHandle<Integer>) handle).restartCount());
    }

    @Test
    void testTimedOutCallIsStillCommitted() {
        Service<Integer> counter = TestServices.counter("slow").anonymous().build();
        ServiceHandle<Integer> handle = run(counter);
        ClientFunction<Integer> sleep = counter.function("sleep");

        CallTimeoutException thrown = assertThrows(CallTimeoutException.class,
                () -> sleep.call(handle, Duration.ofMillis(50), 300));

        assertEquals("sleep/1", thrown.getFunction());
        counter.function("add").cast(handle, 5);
        Integer value = counter.call(handle, "value");
        assertEquals(5, value);
    }

    @Test
    void testCallAsyncAndCast() throws Exception {
        Service<Integer> counter = TestServices.counter("async").anonymous().build();
        ServiceHandle<Integer> handle = run(counter);

        counter.function("increment").cast(handle);
        CompletableFuture<Object> reply = counter.function("add").callAsync(handle, 2);

        assertEquals("ok", reply.get(1, TimeUnit.SECONDS));
        Integer value = counter.call(handle, "value");
        assertEquals(3, value);
    }

    @Test
    void testStoppedServiceIsUnavailable() throws Exception {
        Service<Integer> counter = TestServices.counter("stopped").anonymous().build();
        ServiceHandle<Integer> handle = run(counter);

        counter.stop(handle);

        assertFalse(handle.isAlive());
        assertNull(handle.terminationFuture().get(1, TimeUnit.SECONDS));
        assertThrows(ServiceUnavailableException.class, () -> counter.call(handle, "value"));
        ExecutionException async = assertThrows(ExecutionException.class,
                () -> counter.function("value").callAsync(handle).get(1, TimeUnit.SECONDS));
        assertInstanceOf(ServiceUnavailableException.class, async.getCause());
    }

    @Test
    void testInlineRunsOnCallerThread() {
        Service<Integer> counter = TestServices.counter("inline").inline().build();
        ServiceHandle<Integer> handle = run(counter);

        counter.call(handle, "add", 3);
        Integer value = counter.call(handle, "value");

        assertEquals(3, value);
        assertEquals(3, ((InlineHandle<Integer>) handle).state());
        assertThrows(IllegalStateException.class, () -> counter.call(handle, "fail"));
        Integer afterFailure = counter.call(handle, "value");
        assertEquals(3, afterFailure);
    }

    @Test
    void testThreadReturnsValueAndNextState() {
        Service<Integer> counter = TestServices.counter("threaded").inline().build();

        Threaded<Integer> added = counter.function("add").thread(4, 3);
        Threaded<Integer> read = counter.function("value").thread(added.state());

        assertEquals("ok", added.<String>valueAs());
        assertEquals(7, added.state());
        assertEquals(7, read.<Integer>valueAs());
        assertEquals(7, read.state());
    }

    @Test
    void testImplIsPure() {
        Service<Integer> counter = TestServices.counter("pure").anonymous().build();

        NormalizedReply<Integer> first = counter.impl("add", 4, 3);
        NormalizedReply<Integer> second = counter.impl("add", 4, 3);

        assertEquals(first, second);
        assertEquals(NormalizedReply.withState("ok", 7), first);
        assertEquals(NormalizedReply.plain(4), counter.impl("value", 4));
    }

    @Test
    void testNamedServiceIsReachableByName() {
        Service<Integer> counter = TestServices.counter("named-counter").named().withRegistry(registry).build();
        counter.run();

        counter.call("increment");
        Integer value = counter.call("value");

        assertEquals(1, value);
        assertTrue(registry.isRegistered("named-counter"));
        assertThrows(IllegalStateException.class, counter::run);
    }

    @Test
    void testNamedServiceStartsOnFirstUse() {
        Service<Integer> counter = TestServices.counter("lazy").named("lazy-counter").withRegistry(registry).build();

        Integer value = counter.function("value").invoke();

        assertEquals(0, value);
        assertTrue(registry.isRegistered("lazy-counter"));
        assertSame(counter.lookup(), registry.resolve("lazy-counter"));
    }

    @Test
    void testNamedServiceWithoutStartOnFirstUseMustBeRun() {
        Service<Integer> counter = TestServices.counter("manual")
                .named()
                .withRegistry(registry)
                .withConfig(new ServiceConfig().setStartOnFirstUse(false))
                .build();

        assertThrows(ServiceUnavailableException.class, () -> counter.call("value"));

        counter.run();
        Integer value = counter.call("value");
        assertEquals(0, value);
    }

    @Test
    void testNamedStopRemovesRegistration() {
        Service<Integer> counter = TestServices.counter("short-lived").named().withRegistry(registry).build();
        ServiceHandle<Integer> handle = counter.run();

        counter.stop();

        assertFalse(handle.isAlive());
        assertFalse(registry.isRegistered("short-lived"));
        counter.stop();
    }

    @Test
    void testFailedNamedServiceStaysRegisteredUntilRunAgain() {
        Service<Integer> counter = TestServices.counter("doomed")
                .named()
                .withRegistry(registry)
                .withConfig(new ServiceConfig().setRestartIntensity(RestartIntensity.of(0, Duration.ofSeconds(5))))
                .build();
        ServiceHandle<Integer> failed = counter.run();

        assertThrows(ServiceUnavailableException.class, () -> counter.call("fail"));
        assertThrows(ServiceUnavailableException.class, () -> counter.call("value"));
        assertSame(failed, counter.lookup());

        ServiceHandle<Integer> replacement = counter.run();
        Integer value = counter.call("value");

        assertNotSame(failed, replacement);
        assertEquals(0, value);
    }

    @Test
    void testPooledServiceServesCalls() {
        Service<Integer> counter = TestServices.counter("pooled-counter").pooled(1, 2).build();
        ServiceHandle<Integer> handle = run(counter);

        Integer value = counter.call(handle, "increment");

        assertEquals(1, value);
        PooledHandle<Integer> pooled = (PooledHandle<Integer>) handle;
        assertEquals(1, pooled.stats().size());
        assertEquals(2, pooled.stats().max());
        assertEquals(ServiceMode.POOLED, handle.mode());
    }

    @Test
    void testPooledCallAsyncReportsExhaustionThroughFuture() throws Exception {
        Service<Integer> counter = TestServices.counter("busy-pool")
                .pooled(1, 1)
                .withConfig(new ServiceConfig().setCheckoutTimeout(Duration.ZERO))
                .build();
        ServiceHandle<Integer> handle = run(counter);
        CompletableFuture<Object> slow = counter.function("sleep").callAsync(handle, 500);

        CompletableFuture<Object> rejected = counter.function("value").callAsync(handle);

        assertTrue(rejected.isDone());
        ExecutionException thrown = assertThrows(ExecutionException.class, () -> rejected.get(1, TimeUnit.SECONDS));
        assertInstanceOf(PoolExhaustedException.class, thrown.getCause());
        assertEquals(0, slow.get(2, TimeUnit.SECONDS));
    }

    @Test
    void testUndefinedFunctionsAreRejected() {
        Service<Integer> counter = TestServices.counter("strict").anonymous().build();
        ServiceHandle<Integer> handle = run(counter);

        assertThrows(UndefinedFunctionException.class, () -> counter.call(handle, "add"));
        assertThrows(UndefinedFunctionException.class, () -> counter.call(handle, "missing"));
        assertThrows(UndefinedFunctionException.class, () -> counter.function("add").call(handle, 1, 2));
        assertThrows(IllegalArgumentException.class, () -> counter.function("missing"));
        assertThrows(IllegalStateException.class, () -> counter.call("value"));
    }

    @Test
    void testDiagnosticsRenderGeneratedSource() {
        Service<Integer> counter = TestServices.counter("diagnosed").anonymous().withDiagnostics(true).build();

        assertTrue(counter.spec().diagnosticsEnabled());
        assertTrue(counter.generatedSource().contains("class DiagnosedImpl"));
    }
}
