package com.cajunsystems.service.declaration;

import java.util.List;
import java.util.Objects;

/**
 * One clause of a declared function. For public clauses the first parameter receives
 * the incoming state.
 */
public record FunctionClause(String name, Visibility visibility, List<Parameter> params, Guard guard, ClauseBody body) {

    public FunctionClause {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(visibility, "visibility");
        Objects.requireNonNull(body, "body");
        params = List.copyOf(params);
        guard = guard == null ? Guard.ALWAYS : guard;
        if (visibility == Visibility.PUBLIC) {
            if (params.isEmpty()) {
                throw new DeclarationException("Public function " + name + " must take the state as its first parameter");
            }
            if (params.get(0) instanceof Parameter.Literal) {
                throw new DeclarationException("State parameter of " + name + " must be a name, not a literal");
            }
        }
    }

    /**
     * @return the key callers use; the state parameter is not counted for public clauses
     */
    public FunctionKey key() {
        int arity = visibility == Visibility.PUBLIC ? params.size() - 1 : params.size();
        return new FunctionKey(name, arity);
    }

    public boolean isPublic() {
        return visibility == Visibility.PUBLIC;
    }

    /**
     * @return the parameters after the state parameter for public clauses, all parameters otherwise
     */
    public List<Parameter> argumentParams() {
        return isPublic() ? params.subList(1, params.size()) : params;
    }

    /**
     * @return the clause head as written, e.g. {@code put(state, key, value)}
     */
    public String signature() {
        StringBuilder sb = new StringBuilder(name).append('(');
        for (int i = 0; i < params.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(params.get(i).source());
        }
        return sb.append(')').toString();
    }
}
