package examples;

import com.cajunsystems.service.Service;
import com.cajunsystems.service.ServiceHandle;
import com.cajunsystems.service.declaration.Bindings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static com.cajunsystems.service.declaration.ClauseBody.let;
import static com.cajunsystems.service.declaration.ClauseBody.reply;
import static com.cajunsystems.service.declaration.ClauseBody.setState;

/**
 * Memoized Fibonacci numbers. The worker keeps every number computed so far; a cached
 * number is answered without changing the state.
 */
public final class FibonacciCache {

    private static final Logger logger = LoggerFactory.getLogger(FibonacciCache.class);

    private FibonacciCache() {
    }

    public static Service<Map<Integer, Long>> declare() {
        return Service.<Map<Integer, Long>>builder("fib")
                .anonymous()
                .withInitialState(Map.of())
                .withStateName("cache")
                .function("fib(n)", b -> n(b) >= 0 && cache(b).containsKey(n(b)),
                        reply(b -> cache(b).get(n(b))))
                .function("fib(n)", b -> n(b) >= 0,
                        let("filled", b -> b.call("fill", n(b), cache(b)),
                                setState(b -> b.get("filled"), b -> filled(b).get(n(b)))))
                .privateFunction("fill(n, memo)", b -> memo(b).containsKey(n(b)), reply(b -> memo(b)))
                .privateFunction("fill(0, memo)", reply(b -> with(memo(b), 0, 0L)))
                .privateFunction("fill(1, memo)", reply(b -> with(b.call("fill", 0, memo(b)), 1, 1L)))
                .privateFunction("fill(n, memo)", reply(FibonacciCache::fillUpTo))
                .build();
    }

    private static Map<Integer, Long> fillUpTo(Bindings bindings) {
        int n = n(bindings);
        Map<Integer, Long> below = bindings.call("fill", n - 1, memo(bindings));
        return with(below, n, below.get(n - 1) + below.get(n - 2));
    }

    private static int n(Bindings bindings) {
        return Math.toIntExact(bindings.getLong("n"));
    }

    private static Map<Integer, Long> cache(Bindings bindings) {
        return bindings.get("cache");
    }

    private static Map<Integer, Long> memo(Bindings bindings) {
        return bindings.get("memo");
    }

    private static Map<Integer, Long> filled(Bindings bindings) {
        return bindings.get("filled");
    }

    private static Map<Integer, Long> with(Map<Integer, Long> memo, int n, long value) {
        Map<Integer, Long> next = new HashMap<>(memo);
        next.put(n, value);
        return Collections.unmodifiableMap(next);
    }

    public static void main(String[] args) {
        Service<Map<Integer, Long>> fib = declare();
        ServiceHandle<Map<Integer, Long>> handle = fib.run();

        long fib20 = fib.call(handle, "fib", 20);
        long fib10 = fib.call(handle, "fib", 10);
        logger.info("fib(20)={}, fib(10)={}", fib20, fib10);

        fib.stop(handle);
    }
}
