package com.cajunsystems.service;

/**
 * Base class of the conditions that cross a service's external boundary.
 * Every subclass carries the id of the service that raised it.
 */
public class ServiceException extends RuntimeException {

    /** The id of the service where the condition occurred. */
    private final String serviceId;

    public ServiceException(String serviceId, String message) {
        super(message);
        this.serviceId = serviceId;
    }

    public ServiceException(String serviceId, String message, Throwable cause) {
        super(message, cause);
        this.serviceId = serviceId;
    }

    /**
     * Returns the id of the service where the condition occurred.
     *
     * @return the service id, or null if not known
     */
    public String getServiceId() {
        return serviceId;
    }
}
