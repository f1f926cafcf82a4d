package examples;

import com.cajunsystems.service.Service;
import com.cajunsystems.service.declaration.Bindings;
import com.cajunsystems.service.declaration.Expression;
import com.cajunsystems.service.registry.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeSet;

import static com.cajunsystems.service.declaration.ClauseBody.reply;
import static com.cajunsystems.service.declaration.ClauseBody.setState;

/**
 * A key-value store registered under the name {@code alfred}, declared through the option map.
 * The state is bound as {@code kvs} inside the clause bodies.
 */
public final class KeyValueStore {

    private static final Logger logger = LoggerFactory.getLogger(KeyValueStore.class);

    public static final String SERVICE_NAME = "alfred";

    private KeyValueStore() {
    }

    public static Service<Map<String, Object>> declare() {
        return declare(ServiceRegistry.global());
    }

    public static Service<Map<String, Object>> declare(ServiceRegistry registry) {
        return Service.<Map<String, Object>>builder("key-value-store")
                .withOptions(Map.of(
                        "mode", "named",
                        "service_name", SERVICE_NAME,
                        "state_name", "kvs",
                        "state", Map.of()))
                .withRegistry(registry)
                .function("put(key, value)", setState(KeyValueStore::stored, Expression.variable("value")))
                .function("get(key)", reply(b -> kvs(b).get(b.<String>get("key"))))
                .function("delete(key)", setState(KeyValueStore::removed, b -> kvs(b).get(b.<String>get("key"))))
                .function("keys()", reply(b -> new TreeSet<>(kvs(b).keySet())))
                .build();
    }

    private static Map<String, Object> kvs(Bindings bindings) {
        return bindings.get("kvs");
    }

    private static Object stored(Bindings bindings) {
        Map<String, Object> next = new HashMap<>(kvs(bindings));
        next.put(bindings.get("key"), bindings.get("value"));
        return Collections.unmodifiableMap(next);
    }

    private static Object removed(Bindings bindings) {
        Map<String, Object> next = new HashMap<>(kvs(bindings));
        next.remove(bindings.<String>get("key"));
        return Collections.unmodifiableMap(next);
    }

    public static void main(String[] args) {
        Service<Map<String, Object>> store = declare();
        store.run();

        store.call("put", "name", "Dave");
        store.call("put", "language", "Java");
        Object name = store.call("get", "name");
        Object missing = store.call("get", "email");
        logger.info("name={}, email={}, keys={}", name, missing, store.call("keys"));

        store.stop();
    }
}
