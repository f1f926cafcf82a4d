package com.cajunsystems.service.generator;

import com.cajunsystems.service.declaration.DeclarationException;
import com.cajunsystems.service.declaration.FunctionClause;
import com.cajunsystems.service.declaration.FunctionKey;
import com.cajunsystems.service.declaration.Parameter;
import com.cajunsystems.service.declaration.ServiceDeclaration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Builds the {@link Implementation} of a declaration: one {@link ImplFunction} per public
 * function, with the state parameter bound to the declared state name, and one
 * {@link HelperFunction} per private function.
 */
public final class ImplementationGenerator {

    private static final Logger logger = LoggerFactory.getLogger(ImplementationGenerator.class);

    private final ResponseTranslator translator;

    public ImplementationGenerator() {
        this(new ResponseTranslator());
    }

    public ImplementationGenerator(ResponseTranslator translator) {
        this.translator = translator;
    }

    /**
     * @throws DeclarationException if a private function sets the state or a public clause
     *                              reuses the state name for an argument
     */
    public <S> Implementation<S> generate(ServiceDeclaration<S> declaration) {
        String stateVarName = declaration.spec().stateVarName();
        Implementation<S> implementation = new Implementation<>(declaration.name(), stateVarName);

        for (Map.Entry<FunctionKey, List<FunctionClause>> entry : declaration.functions().entrySet()) {
            FunctionKey key = entry.getKey();
            List<FunctionClause> clauses = entry.getValue();
            if (clauses.get(0).isPublic()) {
                clauses.forEach(clause -> checkArguments(clause, stateVarName));
                ClauseSet<S> set = new ClauseSet<>(key, clauses, translator);
                implementation.define(new ImplFunction<>(declaration.name(), stateVarName, set, implementation));
                logger.debug("Generated {} of {} with {} clause(s), shape {}",
                        key, declaration.name(), clauses.size(), set.shape());
            } else {
                for (FunctionClause clause : clauses) {
                    if (translator.classify(clause.body()) != ReplyShape.PLAIN) {
                        throw new DeclarationException("Private function " + clause.signature()
                                + " must not set the state");
                    }
                }
                implementation.defineHelper(new HelperFunction(new ClauseSet<>(key, clauses, translator), implementation));
                logger.debug("Generated helper {} of {}", key, declaration.name());
            }
        }
        return implementation;
    }

    private static void checkArguments(FunctionClause clause, String stateVarName) {
        for (Parameter param : clause.argumentParams()) {
            if (param instanceof Parameter.Named && ((Parameter.Named) param).name().equals(stateVarName)) {
                throw new DeclarationException("Argument of " + clause.signature()
                        + " shadows the state name '" + stateVarName + "'");
            }
        }
    }
}
