package com.cajunsystems.service.declaration;

import java.util.Objects;
import java.util.Optional;

/**
 * The declared shape of a service: its mode, initial state, the name the state is bound to
 * inside clause bodies, and the mode-specific options.
 *
 * @param <S> The type of the service state
 */
public final class ServiceSpec<S> {

    /** Name the state is bound to when none is declared. */
    public static final String DEFAULT_STATE_NAME = "state";

    private final ServiceMode mode;
    private final S initialState;
    private final String stateVarName;
    private final String serviceName;
    private final PoolBounds poolBounds;
    private final boolean diagnosticsEnabled;

    /**
     * @param serviceName present iff the mode is NAMED
     * @param poolBounds  present iff the mode is POOLED
     * @throws DeclarationException if the options do not fit the mode
     */
    public ServiceSpec(ServiceMode mode, S initialState, String stateVarName, String serviceName,
                       PoolBounds poolBounds, boolean diagnosticsEnabled) {
        this.mode = Objects.requireNonNull(mode, "mode");
        this.initialState = initialState;
        this.stateVarName = stateVarName == null ? DEFAULT_STATE_NAME : stateVarName;
        this.serviceName = serviceName;
        this.poolBounds = poolBounds;
        this.diagnosticsEnabled = diagnosticsEnabled;

        if (!SignatureParser.isIdentifier(this.stateVarName)) {
            throw new DeclarationException("State name '" + this.stateVarName + "' is not a valid variable name");
        }
        if ((mode == ServiceMode.NAMED) != (serviceName != null)) {
            throw new DeclarationException(mode == ServiceMode.NAMED
                    ? "Named service requires a service name"
                    : "Service name is only allowed in named mode, mode was " + mode);
        }
        if (serviceName != null && serviceName.isBlank()) {
            throw new DeclarationException("Service name must not be blank");
        }
        if ((mode == ServiceMode.POOLED) != (poolBounds != null)) {
            throw new DeclarationException(mode == ServiceMode.POOLED
                    ? "Pooled service requires pool bounds"
                    : "Pool bounds are only allowed in pooled mode, mode was " + mode);
        }
    }

    public ServiceMode mode() {
        return mode;
    }

    public S initialState() {
        return initialState;
    }

    public String stateVarName() {
        return stateVarName;
    }

    public Optional<String> serviceName() {
        return Optional.ofNullable(serviceName);
    }

    public Optional<PoolBounds> poolBounds() {
        return Optional.ofNullable(poolBounds);
    }

    public boolean diagnosticsEnabled() {
        return diagnosticsEnabled;
    }

    @Override
    public String toString() {
        return "ServiceSpec{mode=" + mode
                + ", stateVarName='" + stateVarName + '\''
                + (serviceName != null ? ", serviceName='" + serviceName + '\'' : "")
                + (poolBounds != null ? ", pool=" + poolBounds.min() + ".." + poolBounds.max() : "")
                + ", diagnostics=" + diagnosticsEnabled + '}';
    }
}
