package com.cajunsystems.service.generator;

import com.cajunsystems.service.declaration.ClauseBody;
import com.cajunsystems.service.declaration.FunctionClause;
import com.cajunsystems.service.declaration.FunctionKey;
import com.cajunsystems.service.declaration.Parameter;
import com.cajunsystems.service.declaration.ServiceDeclaration;
import com.cajunsystems.service.declaration.ServiceMode;
import com.cajunsystems.service.declaration.ServiceSpec;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders what the generators produced for a declaration as Java-like source, for
 * inspection when diagnostics are enabled: the implementation functions, the worker's
 * dispatch table and the client API. Expressions are opaque and appear as placeholders.
 */
public final class SourceRenderer {

    private static final String INDENT = "    ";

    private final ResponseTranslator translator;

    public SourceRenderer() {
        this(new ResponseTranslator());
    }

    public SourceRenderer(ResponseTranslator translator) {
        this.translator = translator;
    }

    public String render(ServiceDeclaration<?> declaration, Implementation<?> implementation) {
        String base = typeName(declaration.name());
        StringBuilder out = new StringBuilder();
        ServiceSpec<?> spec = declaration.spec();
        out.append("// ").append(declaration.name()).append(": mode ").append(spec.mode())
                .append(", state bound as '").append(spec.stateVarName()).append("'\n\n");
        renderImplementation(out, base, declaration, implementation);
        out.append('\n');
        if (spec.mode() != ServiceMode.INLINE) {
            renderDispatch(out, base, implementation);
            out.append('\n');
        }
        renderClientApi(out, base, spec, implementation);
        return out.toString();
    }

    private void renderImplementation(StringBuilder out, String base, ServiceDeclaration<?> declaration,
                                      Implementation<?> implementation) {
        out.append("public final class ").append(base).append("Impl {\n");
        for (ImplFunction<?> function : implementation.functions()) {
            out.append('\n').append(INDENT).append("// ").append(function.key()).append(" -> ")
                    .append(function.shape()).append('\n');
            out.append(INDENT).append("public static NormalizedReply ").append(function.key().name()).append("(Object ")
                    .append(declaration.spec().stateVarName());
            for (int i = 0; i < function.key().arity(); i++) {
                out.append(", Object arg").append(i);
            }
            out.append(") {\n");
            renderClauses(out, function.clauses());
            out.append(INDENT).append("}\n");
        }
        for (HelperFunction helper : implementation.helpers()) {
            out.append('\n').append(INDENT).append("private static Object ").append(helper.key().name()).append('(');
            for (int i = 0; i < helper.key().arity(); i++) {
                out.append(i > 0 ? ", " : "").append("Object arg").append(i);
            }
            out.append(") {\n");
            renderClauses(out, helper.clauses());
            out.append(INDENT).append("}\n");
        }
        out.append("}\n");
    }

    private void renderClauses(StringBuilder out, List<FunctionClause> clauses) {
        String indent = INDENT + INDENT;
        for (FunctionClause clause : clauses) {
            out.append(indent).append("// ").append(clause.signature()).append('\n');
            List<String> conditions = new ArrayList<>();
            List<Parameter> params = clause.argumentParams();
            for (int i = 0; i < params.size(); i++) {
                Parameter param = params.get(i);
                if (param instanceof Parameter.Literal) {
                    conditions.add("matches(arg" + i + ", " + param.source() + ")");
                }
            }
            conditions.add("<guard>");
            out.append(indent).append("if (").append(String.join(" && ", conditions)).append(") {\n");
            for (int i = 0; i < params.size(); i++) {
                Parameter param = params.get(i);
                if (param instanceof Parameter.Named) {
                    out.append(indent).append(INDENT).append("Object ").append(param.source())
                            .append(" = arg").append(i).append(";\n");
                }
            }
            renderBody(out, clause.body(), indent + INDENT, clause.isPublic());
            out.append(indent).append("}\n");
        }
        out.append(indent).append("throw new FunctionClauseException();\n");
    }

    private void renderBody(StringBuilder out, ClauseBody body, String indent, boolean normalized) {
        if (body instanceof ClauseBody.Reply) {
            out.append(indent).append("return ")
                    .append(normalized ? "NormalizedReply.plain(<expression>)" : "<expression>").append(";\n");
        } else if (body instanceof ClauseBody.SetState) {
            ClauseBody.SetState setState = (ClauseBody.SetState) body;
            out.append(indent).append("Object next = <new state>;\n");
            out.append(indent).append("return NormalizedReply.withState(")
                    .append(setState.hasResult() ? "<result>" : "next").append(", next);\n");
        } else if (body instanceof ClauseBody.Let) {
            ClauseBody.Let let = (ClauseBody.Let) body;
            out.append(indent).append("Object ").append(let.name()).append(" = <expression>;\n");
            renderBody(out, let.body(), indent, normalized);
        } else {
            ClauseBody.Branch branch = (ClauseBody.Branch) body;
            out.append(indent).append("if (<condition>) { // ").append(translator.classify(branch)).append('\n');
            renderBody(out, branch.then(), indent + INDENT, normalized);
            out.append(indent).append("} else {\n");
            renderBody(out, branch.otherwise(), indent + INDENT, normalized);
            out.append(indent).append("}\n");
        }
    }

    private void renderDispatch(StringBuilder out, String base, Implementation<?> implementation) {
        out.append("final class ").append(base).append("Worker {\n");
        out.append(INDENT).append("private Object state;\n\n");
        out.append(INDENT).append("Object handleCall(FunctionKey function, List<Object> args) {\n");
        out.append(INDENT).append(INDENT).append("NormalizedReply reply = switch (function.toString()) {\n");
        for (ImplFunction<?> function : implementation.functions()) {
            FunctionKey key = function.key();
            out.append(INDENT).append(INDENT).append(INDENT).append("case \"").append(key).append("\" -> ")
                    .append(base).append("Impl.").append(key.name()).append("(state");
            for (int i = 0; i < key.arity(); i++) {
                out.append(", args.get(").append(i).append(')');
            }
            out.append(");\n");
        }
        out.append(INDENT).append(INDENT).append(INDENT).append("default -> throw new UndefinedFunctionException(function);\n");
        out.append(INDENT).append(INDENT).append("};\n");
        out.append(INDENT).append(INDENT).append("state = reply.nextState(state);\n");
        out.append(INDENT).append(INDENT).append("return reply.value();\n");
        out.append(INDENT).append("}\n");
        out.append("}\n");
    }

    private void renderClientApi(StringBuilder out, String base, ServiceSpec<?> spec, Implementation<?> implementation) {
        out.append("public final class ").append(base).append("Client {\n");
        for (ImplFunction<?> function : implementation.functions()) {
            FunctionKey key = function.key();
            out.append('\n').append(INDENT).append("public static Object ").append(key.name()).append('(');
            List<String> params = new ArrayList<>();
            if (spec.mode() == ServiceMode.INLINE) {
                params.add("Object " + spec.stateVarName());
            } else if (spec.mode() != ServiceMode.NAMED) {
                params.add("ServiceHandle handle");
            }
            for (int i = 0; i < key.arity(); i++) {
                params.add("Object arg" + i);
            }
            out.append(String.join(", ", params)).append(") {\n");
            out.append(INDENT).append(INDENT).append("return ").append(clientCall(base, spec, key)).append(";\n");
            out.append(INDENT).append("}\n");
        }
        out.append("}\n");
    }

    private static String clientCall(String base, ServiceSpec<?> spec, FunctionKey key) {
        StringBuilder args = new StringBuilder();
        for (int i = 0; i < key.arity(); i++) {
            args.append(i > 0 ? ", " : "").append("arg").append(i);
        }
        switch (spec.mode()) {
            case INLINE:
                return base + "Impl." + key.name() + "(" + spec.stateVarName()
                        + (key.arity() > 0 ? ", " : "") + args + ").value()";
            case NAMED:
                return "registry.resolve(\"" + spec.serviceName().orElse("") + "\").call(\"" + key + "\", List.of(" + args + "))";
            case POOLED:
                return "withCheckedOutWorker(handle, worker -> worker.call(\"" + key + "\", List.of(" + args + ")))";
            default:
                return "handle.call(\"" + key + "\", List.of(" + args + "))";
        }
    }

    private static String typeName(String name) {
        StringBuilder out = new StringBuilder();
        boolean upper = true;
        for (char c : name.toCharArray()) {
            if (!Character.isLetterOrDigit(c)) {
                upper = true;
                continue;
            }
            out.append(upper ? Character.toUpperCase(c) : c);
            upper = false;
        }
        if (out.length() == 0 || !Character.isLetter(out.charAt(0))) {
            out.insert(0, "Service");
        }
        return out.toString();
    }
}
