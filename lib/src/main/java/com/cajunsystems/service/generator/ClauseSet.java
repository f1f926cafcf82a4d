package com.cajunsystems.service.generator;

import com.cajunsystems.service.declaration.Bindings;
import com.cajunsystems.service.declaration.FunctionClause;
import com.cajunsystems.service.declaration.FunctionKey;
import com.cajunsystems.service.declaration.HelperInvoker;
import com.cajunsystems.service.declaration.Parameter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The compiled clauses of one function, tried in declaration order.
 */
final class ClauseSet<S> {

    private final FunctionKey key;
    private final List<FunctionClause> clauses;
    private final List<CompiledBody<S>> bodies;
    private final ReplyShape shape;

    ClauseSet(FunctionKey key, List<FunctionClause> clauses, ResponseTranslator translator) {
        this.key = key;
        this.clauses = List.copyOf(clauses);
        this.bodies = new ArrayList<>(clauses.size());
        ReplyShape combined = null;
        for (FunctionClause clause : clauses) {
            bodies.add(translator.translate(clause.body()));
            ReplyShape clauseShape = translator.classify(clause.body());
            combined = combined == null ? clauseShape : combined.combine(clauseShape);
        }
        this.shape = combined;
    }

    /**
     * Evaluates the first clause whose parameters accept the arguments and whose guard holds.
     *
     * @param arguments    one argument per declared parameter
     * @param preset       bindings every clause starts with
     * @param helpers      private helpers reachable from the bodies
     * @param reportedArgs the arguments to name if no clause matches
     */
    NormalizedReply<S> evaluate(List<Object> arguments, Map<String, Object> preset,
                                HelperInvoker helpers, List<Object> reportedArgs) {
        for (int i = 0; i < clauses.size(); i++) {
            FunctionClause clause = clauses.get(i);
            Map<String, Object> bound = bind(clause.params(), arguments, preset);
            if (bound == null) {
                continue;
            }
            Bindings bindings = Bindings.of(bound, helpers);
            if (clause.guard().test(bindings)) {
                return bodies.get(i).evaluate(bindings);
            }
        }
        throw new FunctionClauseException(key, reportedArgs);
    }

    private static Map<String, Object> bind(List<Parameter> params, List<Object> arguments, Map<String, Object> preset) {
        Map<String, Object> bound = new HashMap<>(preset);
        for (int i = 0; i < params.size(); i++) {
            Parameter param = params.get(i);
            Object argument = arguments.get(i);
            if (!param.matches(argument)) {
                return null;
            }
            if (param instanceof Parameter.Named) {
                bound.put(((Parameter.Named) param).name(), argument);
            }
        }
        return bound;
    }

    FunctionKey key() {
        return key;
    }

    List<FunctionClause> clauses() {
        return clauses;
    }

    ReplyShape shape() {
        return shape;
    }
}
