package com.cajunsystems.service.declaration;

import java.util.Objects;

/**
 * The body of a function clause. Every body ends in exactly one terminal form:
 * {@link Reply} (the state is left unchanged) or {@link SetState} (the state is replaced).
 * {@link Let} binds a local before its inner body, {@link Branch} picks one of two bodies.
 */
public sealed interface ClauseBody permits ClauseBody.Reply, ClauseBody.SetState, ClauseBody.Let, ClauseBody.Branch {

    /**
     * Replies with a value and keeps the current state.
     */
    static ClauseBody reply(Expression value) {
        return new Reply(value);
    }

    /**
     * Replaces the state and replies with the new state.
     */
    static ClauseBody setState(Expression newState) {
        return new SetState(newState, null);
    }

    /**
     * Replaces the state and replies with the given result.
     */
    static ClauseBody setState(Expression newState, Expression result) {
        return new SetState(newState, Objects.requireNonNull(result, "result"));
    }

    static ClauseBody let(String name, Expression value, ClauseBody body) {
        return new Let(name, value, body);
    }

    static ClauseBody when(Guard condition, ClauseBody then, ClauseBody otherwise) {
        return new Branch(condition, then, otherwise);
    }

    record Reply(Expression value) implements ClauseBody {
        public Reply {
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * @param newState the expression computing the next state
     * @param result   the expression computing the reply, or null to reply with the new state
     */
    record SetState(Expression newState, Expression result) implements ClauseBody {
        public SetState {
            Objects.requireNonNull(newState, "newState");
        }

        public boolean hasResult() {
            return result != null;
        }
    }

    record Let(String name, Expression value, ClauseBody body) implements ClauseBody {
        public Let {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(body, "body");
        }
    }

    record Branch(Guard condition, ClauseBody then, ClauseBody otherwise) implements ClauseBody {
        public Branch {
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(then, "then");
            Objects.requireNonNull(otherwise, "otherwise");
        }
    }
}
