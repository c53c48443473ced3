package org.meshbus.api.errors;

import java.time.Duration;

/**
 * Thrown when a provider call exceeded its time bound.
 */
public class OperationTimeoutException extends OperationFailedException {

    private final Duration timeout;

    public OperationTimeoutException(String providerName, Duration timeout) {
        super(providerName, "Provider '" + providerName + "' did not respond within " + timeout.toMillis() + " ms", null);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
