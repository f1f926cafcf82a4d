package com.cajunsystems.service;

import com.cajunsystems.service.declaration.Bindings;
import com.cajunsystems.service.declaration.Expression;

import static com.cajunsystems.service.declaration.ClauseBody.reply;
import static com.cajunsystems.service.declaration.ClauseBody.setState;

/**
 * Service declarations shared by the tests.
 */
public final class TestServices {

    private TestServices() {
    }

    /**
     * A counter starting at 0 with functions that update, read, fail and stall. The mode is left to the caller.
     */
    public static ServiceBuilder<Integer> counter(String name) {
        return Service.<Integer>builder(name)
                .withInitialState(0)
                .function("increment()", setState(b -> b.<Integer>get("state") + 1))
                .function("add(n)", setState(b -> b.<Integer>get("state") + b.<Integer>get("n"), b -> "ok"))
                .function("value()", reply(Expression.variable("state")))
                .function("fail()", reply(b -> {
                    throw new IllegalStateException("boom");
                }))
                .function("sleep(millis)", reply(TestServices::sleepThenReplyState));
    }

    private static Object sleepThenReplyState(Bindings bindings) {
        try {
            Thread.sleep(bindings.getLong("millis"));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return bindings.get("state");
    }
}
