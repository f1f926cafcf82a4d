package com.cajunsystems.service.config;

import com.cajunsystems.service.mailbox.MailboxType;
import com.cajunsystems.service.supervision.RestartIntensity;
import com.cajunsystems.service.supervision.SupervisionStrategy;

import java.time.Duration;
import java.util.Objects;

/**
 * Runtime configuration of a service: timeouts, supervision and worker mailboxes.
 * Setters return this instance for method chaining.
 */
public class ServiceConfig {

    // Default values
    private static final Duration DEFAULT_CALL_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration DEFAULT_CHECKOUT_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration DEFAULT_IDLE_RETIREMENT_GRACE = Duration.ofSeconds(30);
    private static final Duration DEFAULT_STOP_TIMEOUT = Duration.ofSeconds(5);
    private static final int UNBOUNDED = Integer.MAX_VALUE;

    // Call configuration
    private Duration callTimeout = DEFAULT_CALL_TIMEOUT;
    private Duration checkoutTimeout = DEFAULT_CHECKOUT_TIMEOUT;

    // Pool configuration
    private Duration idleRetirementGrace = DEFAULT_IDLE_RETIREMENT_GRACE;

    // Supervision configuration
    private SupervisionStrategy supervisionStrategy = SupervisionStrategy.RESTART;
    private RestartIntensity restartIntensity = RestartIntensity.DEFAULT;

    // Worker configuration
    private MailboxType mailboxType = MailboxType.LINKED;
    private int mailboxCapacity = UNBOUNDED;
    private Duration stopTimeout = DEFAULT_STOP_TIMEOUT;
    private String threadNamePrefix;

    // Registry configuration
    private boolean startOnFirstUse = true;

    /**
     * Creates a configuration with default settings.
     */
    public ServiceConfig() {
        // Use defaults
    }

    /**
     * @return a copy of this configuration
     */
    public ServiceConfig copy() {
        return new ServiceConfig()
                .setCallTimeout(callTimeout)
                .setCheckoutTimeout(checkoutTimeout)
                .setIdleRetirementGrace(idleRetirementGrace)
                .setSupervisionStrategy(supervisionStrategy)
                .setRestartIntensity(restartIntensity)
                .setMailboxType(mailboxType)
                .setMailboxCapacity(mailboxCapacity)
                .setStopTimeout(stopTimeout)
                .setThreadNamePrefix(threadNamePrefix)
                .setStartOnFirstUse(startOnFirstUse);
    }

    // Getters and setters

    public Duration getCallTimeout() {
        return callTimeout;
    }

    public ServiceConfig setCallTimeout(Duration callTimeout) {
        this.callTimeout = requirePositive(callTimeout, "callTimeout");
        return this;
    }

    public Duration getCheckoutTimeout() {
        return checkoutTimeout;
    }

    /**
     * @param checkoutTimeout how long a pooled call waits for a free worker; zero fails immediately
     */
    public ServiceConfig setCheckoutTimeout(Duration checkoutTimeout) {
        Objects.requireNonNull(checkoutTimeout, "checkoutTimeout");
        if (checkoutTimeout.isNegative()) {
            throw new IllegalArgumentException("checkoutTimeout must not be negative");
        }
        this.checkoutTimeout = checkoutTimeout;
        return this;
    }

    public Duration getIdleRetirementGrace() {
        return idleRetirementGrace;
    }

    public ServiceConfig setIdleRetirementGrace(Duration idleRetirementGrace) {
        this.idleRetirementGrace = requirePositive(idleRetirementGrace, "idleRetirementGrace");
        return this;
    }

    public SupervisionStrategy getSupervisionStrategy() {
        return supervisionStrategy;
    }

    public ServiceConfig setSupervisionStrategy(SupervisionStrategy supervisionStrategy) {
        this.supervisionStrategy = Objects.requireNonNull(supervisionStrategy, "supervisionStrategy");
        return this;
    }

    public RestartIntensity getRestartIntensity() {
        return restartIntensity;
    }

    public ServiceConfig setRestartIntensity(RestartIntensity restartIntensity) {
        this.restartIntensity = Objects.requireNonNull(restartIntensity, "restartIntensity");
        return this;
    }

    public MailboxType getMailboxType() {
        return mailboxType;
    }

    public ServiceConfig setMailboxType(MailboxType mailboxType) {
        this.mailboxType = Objects.requireNonNull(mailboxType, "mailboxType");
        return this;
    }

    public int getMailboxCapacity() {
        return mailboxCapacity;
    }

    public ServiceConfig setMailboxCapacity(int mailboxCapacity) {
        if (mailboxCapacity <= 0) {
            throw new IllegalArgumentException("mailboxCapacity must be positive");
        }
        this.mailboxCapacity = mailboxCapacity;
        return this;
    }

    public Duration getStopTimeout() {
        return stopTimeout;
    }

    public ServiceConfig setStopTimeout(Duration stopTimeout) {
        this.stopTimeout = requirePositive(stopTimeout, "stopTimeout");
        return this;
    }

    /**
     * @return the thread name prefix, or null to use the service name
     */
    public String getThreadNamePrefix() {
        return threadNamePrefix;
    }

    public ServiceConfig setThreadNamePrefix(String threadNamePrefix) {
        this.threadNamePrefix = threadNamePrefix;
        return this;
    }

    public boolean isStartOnFirstUse() {
        return startOnFirstUse;
    }

    public ServiceConfig setStartOnFirstUse(boolean startOnFirstUse) {
        this.startOnFirstUse = startOnFirstUse;
        return this;
    }

    private static Duration requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }

    @Override
    public String toString() {
        return "ServiceConfig{callTimeout=" + callTimeout
                + ", checkoutTimeout=" + checkoutTimeout
                + ", idleRetirementGrace=" + idleRetirementGrace
                + ", supervisionStrategy=" + supervisionStrategy
                + ", restartIntensity=" + restartIntensity
                + ", mailboxType=" + mailboxType
                + ", stopTimeout=" + stopTimeout
                + ", startOnFirstUse=" + startOnFirstUse + '}';
    }
}
