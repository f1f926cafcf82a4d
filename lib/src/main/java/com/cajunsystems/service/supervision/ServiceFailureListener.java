package com.cajunsystems.service.supervision;

import com.cajunsystems.service.ServiceUnavailableException;

/**
 * Told when a service fails fatally and stops serving calls.
 */
@FunctionalInterface
public interface ServiceFailureListener {

    void onServiceFailure(String serviceId, ServiceUnavailableException cause);
}
