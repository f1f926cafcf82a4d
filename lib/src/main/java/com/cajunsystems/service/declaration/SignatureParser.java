package com.cajunsystems.service.declaration;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses clause heads.
 * <p>
 * Supported forms:
 * <ul>
 *   <li>{@code "get(key)"} - named parameters bind the argument</li>
 *   <li>{@code "fib(0)"}, {@code "lookup(\"admin\")"} - literal parameters must equal the argument</li>
 *   <li>{@code "enabled(true)"}, {@code "find(nil)"} - boolean and null literals</li>
 *   <li>{@code "size(_)"}, {@code "size(_ignored)"} - ignored parameters match anything and bind nothing</li>
 * </ul>
 * The state parameter of a public function is not written in its signature;
 * the builder prepends it.
 */
public final class SignatureParser {

    private final String source;
    private int position;

    private SignatureParser(String source) {
        this.source = source;
    }

    /**
     * Parses a clause head.
     *
     * @param signature the clause head, e.g. {@code "put(key, value)"}
     * @return the parsed signature
     * @throws DeclarationException if the text is not a valid clause head
     */
    public static Signature parse(String signature) {
        if (signature == null) {
            throw new DeclarationException("Signature must not be null");
        }
        return new SignatureParser(signature).parseSignature();
    }

    /**
     * @return true if the text is a valid function or variable name
     */
    public static boolean isIdentifier(String text) {
        if (text == null || text.isEmpty() || !isIdentifierStart(text.charAt(0))) {
            return false;
        }
        for (int i = 1; i < text.length(); i++) {
            if (!isIdentifierPart(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private Signature parseSignature() {
        skipWhitespace();
        String name = identifier();
        if (name.startsWith("_")) {
            throw error("Function name must not start with '_'");
        }
        skipWhitespace();
        expect('(');
        List<Parameter> params = new ArrayList<>();
        skipWhitespace();
        if (peek() != ')') {
            params.add(parameter());
            skipWhitespace();
            while (peek() == ',') {
                position++;
                skipWhitespace();
                params.add(parameter());
                skipWhitespace();
            }
        }
        expect(')');
        skipWhitespace();
        if (position < source.length()) {
            throw error("Unexpected trailing input");
        }
        checkDistinctNames(name, params);
        return new Signature(name, params);
    }

    private Parameter parameter() {
        char c = peek();
        if (c == '"') {
            return Parameter.literal(stringLiteral());
        }
        if (c == '-' || Character.isDigit(c)) {
            return Parameter.literal(integerLiteral());
        }
        if (isIdentifierStart(c)) {
            String word = identifier();
            switch (word) {
                case "true":
                    return Parameter.literal(Boolean.TRUE);
                case "false":
                    return Parameter.literal(Boolean.FALSE);
                case "nil":
                case "null":
                    return Parameter.literal(null);
                default:
                    return word.startsWith("_") ? Parameter.ignored(word) : Parameter.named(word);
            }
        }
        throw error("Expected a parameter");
    }

    private String identifier() {
        int start = position;
        if (!isIdentifierStart(peek())) {
            throw error("Expected a name");
        }
        position++;
        while (isIdentifierPart(peek())) {
            position++;
        }
        return source.substring(start, position);
    }

    private Long integerLiteral() {
        int start = position;
        if (peek() == '-') {
            position++;
        }
        if (!Character.isDigit(peek())) {
            throw error("Expected a digit");
        }
        while (Character.isDigit(peek())) {
            position++;
        }
        String digits = source.substring(start, position);
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            throw new DeclarationException("Integer literal " + digits + " out of range in '" + source + "'", e);
        }
    }

    private String stringLiteral() {
        expect('"');
        StringBuilder value = new StringBuilder();
        while (true) {
            if (position >= source.length()) {
                throw error("Unterminated string literal");
            }
            char c = source.charAt(position++);
            if (c == '"') {
                return value.toString();
            }
            if (c == '\\') {
                if (position >= source.length()) {
                    throw error("Unterminated escape");
                }
                char escaped = source.charAt(position++);
                switch (escaped) {
                    case 'n':
                        value.append('\n');
                        break;
                    case 't':
                        value.append('\t');
                        break;
                    case '"':
                    case '\\':
                        value.append(escaped);
                        break;
                    default:
                        throw error("Unknown escape \\" + escaped);
                }
            } else {
                value.append(c);
            }
        }
    }

    private void checkDistinctNames(String function, List<Parameter> params) {
        List<String> seen = new ArrayList<>();
        for (Parameter param : params) {
            if (param instanceof Parameter.Named) {
                String name = ((Parameter.Named) param).name();
                if (seen.contains(name)) {
                    throw new DeclarationException("Parameter '" + name + "' declared twice in " + function);
                }
                seen.add(name);
            }
        }
    }

    private void expect(char expected) {
        if (peek() != expected) {
            throw error("Expected '" + expected + "'");
        }
        position++;
    }

    private char peek() {
        return position < source.length() ? source.charAt(position) : '\0';
    }

    private void skipWhitespace() {
        while (position < source.length() && Character.isWhitespace(source.charAt(position))) {
            position++;
        }
    }

    private DeclarationException error(String message) {
        return new DeclarationException(message + " at position " + position + " in '" + source + "'");
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || (c < 128 && Character.isLetter(c));
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c < 128 && Character.isDigit(c));
    }
}
