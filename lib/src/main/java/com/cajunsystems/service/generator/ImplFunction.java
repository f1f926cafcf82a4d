package com.cajunsystems.service.generator;

import com.cajunsystems.service.declaration.FunctionClause;
import com.cajunsystems.service.declaration.FunctionKey;
import com.cajunsystems.service.declaration.HelperInvoker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The generated implementation of one public function: {@code impl(state, args...) -> NormalizedReply}.
 * Deterministic and free of side effects as long as the declared expressions are.
 *
 * @param <S> The type of the service state
 */
public final class ImplFunction<S> {

    private final String serviceName;
    private final String stateVarName;
    private final ClauseSet<S> clauses;
    private final HelperInvoker helpers;

    ImplFunction(String serviceName, String stateVarName, ClauseSet<S> clauses, HelperInvoker helpers) {
        this.serviceName = serviceName;
        this.stateVarName = stateVarName;
        this.clauses = clauses;
        this.helpers = helpers;
    }

    /**
     * Runs the function against a state.
     *
     * @param state the current state, bound to the state variable
     * @param args  the client arguments
     * @return the normalized reply
     * @throws UndefinedFunctionException if the number of arguments does not match the arity
     * @throws FunctionClauseException    if no clause accepts the arguments
     */
    public NormalizedReply<S> apply(S state, List<Object> args) {
        FunctionKey key = clauses.key();
        if (args.size() != key.arity()) {
            throw new UndefinedFunctionException(serviceName, FunctionKey.of(key.name(), args.size()));
        }
        List<Object> arguments = new ArrayList<>(args.size() + 1);
        arguments.add(state);
        arguments.addAll(args);
        return clauses.evaluate(arguments, Collections.singletonMap(stateVarName, state), helpers, args);
    }

    public FunctionKey key() {
        return clauses.key();
    }

    public ReplyShape shape() {
        return clauses.shape();
    }

    public List<FunctionClause> clauses() {
        return clauses.clauses();
    }
}
