package com.cajunsystems.service.generator;

import com.cajunsystems.service.declaration.ClauseBody;
import com.cajunsystems.service.declaration.Expression;

/**
 * Recognizes the terminal form of a clause body and compiles it into an evaluator that
 * produces a {@link NormalizedReply}.
 * <p>
 * A {@link ClauseBody.Reply} becomes {@code Plain}; a {@link ClauseBody.SetState} becomes
 * {@code WithState}, replying with the new state when it declares no result.
 * {@link ClauseBody.Let} is transparent and a {@link ClauseBody.Branch} takes the shape of
 * whichever arm runs.
 */
public final class ResponseTranslator {

    /**
     * Classifies a body without evaluating it.
     *
     * @param body the clause body
     * @return the shape of every reply the body can produce
     */
    public ReplyShape classify(ClauseBody body) {
        if (body instanceof ClauseBody.Reply) {
            return ReplyShape.PLAIN;
        }
        if (body instanceof ClauseBody.SetState) {
            return ReplyShape.WITH_STATE;
        }
        if (body instanceof ClauseBody.Let) {
            return classify(((ClauseBody.Let) body).body());
        }
        ClauseBody.Branch branch = (ClauseBody.Branch) body;
        return classify(branch.then()).combine(classify(branch.otherwise()));
    }

    /**
     * Compiles a body. The returned evaluator is pure as long as the body's expressions are.
     *
     * @param body the clause body
     * @param <S>  the state type
     * @return the compiled evaluator
     */
    @SuppressWarnings("unchecked")
    public <S> CompiledBody<S> translate(ClauseBody body) {
        if (body instanceof ClauseBody.Reply) {
            Expression value = ((ClauseBody.Reply) body).value();
            return bindings -> NormalizedReply.plain(value.evaluate(bindings));
        }
        if (body instanceof ClauseBody.SetState) {
            ClauseBody.SetState setState = (ClauseBody.SetState) body;
            Expression newState = setState.newState();
            Expression result = setState.result();
            if (result == null) {
                return bindings -> {
                    S next = (S) newState.evaluate(bindings);
                    return NormalizedReply.withState(next, next);
                };
            }
            return bindings -> {
                S next = (S) newState.evaluate(bindings);
                return NormalizedReply.withState(result.evaluate(bindings), next);
            };
        }
        if (body instanceof ClauseBody.Let) {
            ClauseBody.Let let = (ClauseBody.Let) body;
            CompiledBody<S> inner = translate(let.body());
            return bindings -> inner.evaluate(bindings.with(let.name(), let.value().evaluate(bindings)));
        }
        ClauseBody.Branch branch = (ClauseBody.Branch) body;
        CompiledBody<S> then = translate(branch.then());
        CompiledBody<S> otherwise = translate(branch.otherwise());
        return bindings -> branch.condition().test(bindings) ? then.evaluate(bindings) : otherwise.evaluate(bindings);
    }
}
