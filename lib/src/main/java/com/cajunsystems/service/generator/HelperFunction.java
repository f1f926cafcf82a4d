package com.cajunsystems.service.generator;

import com.cajunsystems.service.declaration.FunctionClause;
import com.cajunsystems.service.declaration.FunctionKey;
import com.cajunsystems.service.declaration.HelperInvoker;

import java.util.Collections;
import java.util.List;

/**
 * A private helper, callable only from clause bodies of the same service.
 */
public final class HelperFunction {

    private final ClauseSet<Object> clauses;
    private final HelperInvoker helpers;

    HelperFunction(ClauseSet<Object> clauses, HelperInvoker helpers) {
        this.clauses = clauses;
        this.helpers = helpers;
    }

    public Object apply(List<Object> args) {
        return clauses.evaluate(args, Collections.emptyMap(), helpers, args).value();
    }

    public FunctionKey key() {
        return clauses.key();
    }

    public List<FunctionClause> clauses() {
        return clauses.clauses();
    }
}
