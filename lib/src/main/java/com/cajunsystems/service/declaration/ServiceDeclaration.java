package com.cajunsystems.service.declaration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A validated service declaration: its {@link ServiceSpec} plus its clauses grouped into functions.
 *
 * @param <S> The type of the service state
 */
public final class ServiceDeclaration<S> {

    private final String name;
    private final ServiceSpec<S> spec;
    private final List<FunctionClause> clauses;
    private final Map<FunctionKey, List<FunctionClause>> functions;

    /**
     * @throws DeclarationException if there are no public functions or the clauses of a
     *                              function disagree on visibility
     */
    public ServiceDeclaration(String name, ServiceSpec<S> spec, List<FunctionClause> clauses) {
        if (name == null || name.isBlank()) {
            throw new DeclarationException("Service declaration needs a name");
        }
        this.name = name;
        this.spec = Objects.requireNonNull(spec, "spec");
        this.clauses = List.copyOf(clauses);
        this.functions = group(this.clauses);

        if (functions.keySet().stream().noneMatch(key -> functions.get(key).get(0).isPublic())) {
            throw new DeclarationException("Service " + name + " declares no public function");
        }
    }

    private static Map<FunctionKey, List<FunctionClause>> group(List<FunctionClause> clauses) {
        Map<FunctionKey, List<FunctionClause>> grouped = new LinkedHashMap<>();
        Map<String, Visibility> visibilityByName = new LinkedHashMap<>();
        for (FunctionClause clause : clauses) {
            Visibility previous = visibilityByName.putIfAbsent(clause.name(), clause.visibility());
            if (previous != null && previous != clause.visibility()) {
                throw new DeclarationException("Function " + clause.name()
                        + " is declared both public and private");
            }
            grouped.computeIfAbsent(clause.key(), k -> new ArrayList<>()).add(clause);
        }
        Map<FunctionKey, List<FunctionClause>> frozen = new LinkedHashMap<>();
        grouped.forEach((key, list) -> frozen.put(key, List.copyOf(list)));
        return Collections.unmodifiableMap(frozen);
    }

    public String name() {
        return name;
    }

    public ServiceSpec<S> spec() {
        return spec;
    }

    public List<FunctionClause> clauses() {
        return clauses;
    }

    /**
     * @return the clauses of every function keyed by name and arity, in declaration order
     */
    public Map<FunctionKey, List<FunctionClause>> functions() {
        return functions;
    }

    public Map<FunctionKey, List<FunctionClause>> functions(Visibility visibility) {
        Map<FunctionKey, List<FunctionClause>> selected = new LinkedHashMap<>();
        functions.forEach((key, list) -> {
            if (list.get(0).visibility() == visibility) {
                selected.put(key, list);
            }
        });
        return selected;
    }
}
