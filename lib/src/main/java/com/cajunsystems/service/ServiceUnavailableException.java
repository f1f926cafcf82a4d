package com.cajunsystems.service;

/**
 * Raised when a call cannot be served because its worker or the whole service has terminated.
 * When the restart budget of a service is exceeded this condition is permanent
 * until the owner runs the service again.
 */
public class ServiceUnavailableException extends ServiceException {

    public ServiceUnavailableException(String serviceId, String message) {
        super(serviceId, message);
    }

    public ServiceUnavailableException(String serviceId, String message, Throwable cause) {
        super(serviceId, message, cause);
    }
}
