package com.cajunsystems.service.test;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntFunction;
import java.util.stream.Collectors;

/**
 * Issues calls from several threads at once. Every caller thread is started and parked on a
 * gate first, so the calls are released together.
 *
 * <pre>{@code
 * ConcurrentCalls.Results<Object> results = ConcurrentCalls.run(3, i -> hasher.call(handle, "hash", "pw" + i, "salt"),
 *         Duration.ofSeconds(5));
 * assertEquals(3, results.successes().size());
 * }</pre>
 */
public final class ConcurrentCalls {

    private static final Logger logger = LoggerFactory.getLogger(ConcurrentCalls.class);

    private ConcurrentCalls() {
    }

    /**
     * Runs {@code callers} calls concurrently and waits for all of them.
     *
     * @param callers how many calls to issue
     * @param call    the call, given the caller index
     * @param timeout how long to wait for all calls to finish
     * @param <T>     the reply type
     * @return one outcome per caller, in caller order
     * @throws AssertionError if the calls do not finish within the timeout
     */
    public static <T> Results<T> run(int callers, IntFunction<T> call, Duration timeout) {
        Objects.requireNonNull(call, "call cannot be null");
        if (callers < 1) {
            throw new IllegalArgumentException("callers must be at least 1");
        }
        AtomicInteger threadNumber = new AtomicInteger(1);
        ExecutorService executor = Executors.newFixedThreadPool(callers, r -> {
            Thread thread = new Thread(r, "concurrent-caller-" + threadNumber.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });
        CountDownLatch ready = new CountDownLatch(callers);
        CountDownLatch gate = new CountDownLatch(1);
        try {
            List<Future<Outcome<T>>> futures = new ArrayList<>(callers);
            for (int i = 0; i < callers; i++) {
                int index = i;
                futures.add(executor.submit(() -> {
                    ready.countDown();
                    gate.await();
                    try {
                        return Outcome.success(call.apply(index));
                    } catch (RuntimeException e) {
                        return Outcome.<T>failure(e);
                    }
                }));
            }
            if (!ready.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new AssertionError("Caller threads did not start within " + timeout);
            }
            long startedAt = System.nanoTime();
            gate.countDown();

            List<Outcome<T>> outcomes = new ArrayList<>(callers);
            long deadline = startedAt + timeout.toNanos();
            for (Future<Outcome<T>> future : futures) {
                outcomes.add(future.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS));
            }
            logger.debug("{} concurrent calls finished in {} ms", callers,
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt));
            return new Results<>(outcomes);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssertionError("Interrupted while waiting for concurrent calls", e);
        } catch (Exception e) {
            throw new AssertionError("Concurrent calls did not finish within " + timeout, e);
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * The result of one call: a value or the exception the call threw.
     */
    public record Outcome<T>(T value, RuntimeException failure) {

        static <T> Outcome<T> success(T value) {
            return new Outcome<>(value, null);
        }

        static <T> Outcome<T> failure(RuntimeException failure) {
            return new Outcome<>(null, failure);
        }

        public boolean isSuccess() {
            return failure == null;
        }
    }

    /**
     * The outcomes of a concurrent run, in caller order.
     */
    public record Results<T>(List<Outcome<T>> outcomes) {

        public Results {
            outcomes = List.copyOf(outcomes);
        }

        public List<T> successes() {
            return outcomes.stream()
                    .filter(Outcome::isSuccess)
                    .map(Outcome::value)
                    .collect(Collectors.toList());
        }

        public List<RuntimeException> failures() {
            return outcomes.stream()
                    .filter(outcome -> !outcome.isSuccess())
                    .map(Outcome::failure)
                    .collect(Collectors.toList());
        }

        /**
         * @return the failures of the given type
         */
        public <X extends RuntimeException> List<X> failures(Class<X> type) {
            return failures().stream()
                    .filter(type::isInstance)
                    .map(type::cast)
                    .collect(Collectors.toList());
        }
    }
}
