package org.meshbus.api.errors;

/**
 * Thrown by operations whose callers cannot degrade when no provider passes the
 * capability, domain and availability filter.
 */
public class ProviderUnavailableException extends BusOperationException {

    public ProviderUnavailableException(String message) {
        super(message);
    }
}
