package com.cajunsystems.service.declaration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns the option map of a service declaration into a validated {@link ServiceSpec}.
 * <p>
 * Recognized options:
 * <ul>
 *   <li>{@code mode} - {@code inline}, {@code anonymous}, {@code named} or {@code pooled} (required)</li>
 *   <li>{@code state} - the initial state, default null</li>
 *   <li>{@code state_name} - the name the state is bound to in clause bodies, default {@code state}</li>
 *   <li>{@code service_name} - named mode only, defaults to the declaration name</li>
 *   <li>{@code pool} - pooled mode only, a map with {@code min} and {@code max}, default 2..5</li>
 *   <li>{@code diagnostics} - render and log the generated source</li>
 * </ul>
 */
public final class DeclarationParser {

    private static final Logger logger = LoggerFactory.getLogger(DeclarationParser.class);

    public static final String MODE = "mode";
    public static final String STATE = "state";
    public static final String STATE_NAME = "state_name";
    public static final String SERVICE_NAME = "service_name";
    public static final String POOL = "pool";
    public static final String DIAGNOSTICS = "diagnostics";

    private static final Set<String> KNOWN_OPTIONS = Set.of(MODE, STATE, STATE_NAME, SERVICE_NAME, POOL, DIAGNOSTICS);

    /**
     * Parses options and clauses into a declaration.
     *
     * @param name    the declaration name, used as the default service name
     * @param options the option map
     * @param clauses the function clauses
     * @param <S>     the state type
     * @return the validated declaration
     * @throws DeclarationException if an option or clause is malformed
     */
    public <S> ServiceDeclaration<S> parse(String name, Map<String, ?> options, List<FunctionClause> clauses) {
        ServiceSpec<S> spec = parseOptions(name, options);
        logger.debug("Parsed declaration {} with {}", name, spec);
        return new ServiceDeclaration<>(name, spec, clauses);
    }

    @SuppressWarnings("unchecked")
    public <S> ServiceSpec<S> parseOptions(String name, Map<String, ?> options) {
        for (String key : options.keySet()) {
            if (!KNOWN_OPTIONS.contains(key)) {
                throw new DeclarationException("Unknown option '" + key + "' in declaration " + name
                        + ", expected one of " + KNOWN_OPTIONS);
            }
        }

        Object modeOption = options.get(MODE);
        if (modeOption == null) {
            throw new DeclarationException("Declaration " + name + " does not set a mode");
        }
        ServiceMode mode = modeOption instanceof ServiceMode
                ? (ServiceMode) modeOption
                : ServiceMode.parse(modeOption.toString());

        S initialState = (S) options.get(STATE);
        String stateName = stringOption(options, STATE_NAME);
        boolean diagnostics = booleanOption(options, DIAGNOSTICS);

        String serviceName = stringOption(options, SERVICE_NAME);
        if (mode == ServiceMode.NAMED && serviceName == null) {
            serviceName = name;
        }

        PoolBounds bounds = null;
        if (options.containsKey(POOL)) {
            bounds = poolOption(options.get(POOL));
        } else if (mode == ServiceMode.POOLED) {
            bounds = PoolBounds.DEFAULT;
        }

        return new ServiceSpec<>(mode, initialState, stateName, serviceName, bounds, diagnostics);
    }

    private static String stringOption(Map<String, ?> options, String key) {
        Object value = options.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String)) {
            throw new DeclarationException("Option '" + key + "' must be a string, was " + value.getClass().getSimpleName());
        }
        return (String) value;
    }

    private static boolean booleanOption(Map<String, ?> options, String key) {
        Object value = options.get(key);
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if ("true".equals(value) || "false".equals(value)) {
            return Boolean.parseBoolean((String) value);
        }
        throw new DeclarationException("Option '" + key + "' must be true or false, was " + value);
    }

    private static PoolBounds poolOption(Object value) {
        if (value instanceof PoolBounds) {
            return (PoolBounds) value;
        }
        if (!(value instanceof Map)) {
            throw new DeclarationException("Option 'pool' must be a map with min and max, was " + value);
        }
        Map<?, ?> pool = (Map<?, ?>) value;
        for (Object key : pool.keySet()) {
            if (!"min".equals(key) && !"max".equals(key)) {
                throw new DeclarationException("Unknown pool option '" + key + "', expected min or max");
            }
        }
        int max = poolSize(pool, "max", PoolBounds.DEFAULT.max());
        // a lone max below the default min lowers the min with it
        int min = poolSize(pool, "min", Math.min(PoolBounds.DEFAULT.min(), max));
        return new PoolBounds(min, max);
    }

    private static int poolSize(Map<?, ?> pool, String key, int defaultValue) {
        Object value = pool.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof Integer || value instanceof Long || value instanceof Short)) {
            throw new DeclarationException("Pool " + key + " must be an integer, was " + value);
        }
        return Math.toIntExact(((Number) value).longValue());
    }
}
