package com.cajunsystems.service.generator;

import com.cajunsystems.service.Service;
import com.cajunsystems.service.TestServices;
import com.cajunsystems.service.declaration.Expression;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.cajunsystems.service.declaration.ClauseBody.reply;
import static com.cajunsystems.service.declaration.ClauseBody.setState;
import static org.junit.jupiter.api.Assertions.*;

class SourceRendererTest {

    @Test
    void testRendersImplementationDispatchAndClient() {
        Service<Integer> counter = TestServices.counter("counter").anonymous().build();

        String source = counter.generatedSource();

        assertTrue(source.contains("public final class CounterImpl"), source);
        assertTrue(source.contains("public static NormalizedReply add(Object state, Object arg0)"), source);
        assertTrue(source.contains("// increment/0 -> WITH_STATE"), source);
        assertTrue(source.contains("case \"add/1\" -> CounterImpl.add(state, args.get(0));"), source);
        assertTrue(source.contains("public static Object add(ServiceHandle handle, Object arg0)"), source);
    }

    @Test
    void testNamedClientResolvesByName() {
        Service<Map<String, Object>> kv = Service.<Map<String, Object>>builder("key-value")
                .named("alfred")
                .withStateName("kvs")
                .function("put(key, value)", setState(Expression.variable("kvs"), Expression.variable("value")))
                .build();

        String source = kv.generatedSource();

        assertTrue(source.contains("class KeyValueImpl"), source);
        assertTrue(source.contains("public static Object put(Object arg0, Object arg1)"), source);
        assertTrue(source.contains("registry.resolve(\"alfred\")"), source);
    }

    @Test
    void testInlineHasNoWorker() {
        Service<Integer> calc = Service.<Integer>builder("calc")
                .inline()
                .function("double(0)", reply(Expression.constant(0)))
                .function("double(n)", reply(b -> b.<Integer>get("n") * 2))
                .build();

        String source = calc.generatedSource();

        assertFalse(source.contains("Worker"), source);
        assertTrue(source.contains("matches(arg0, 0)"), source);
        assertTrue(source.contains("public static Object double(Object state, Object arg0)"), source);
    }
}
