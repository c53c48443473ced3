package org.meshbus.api.errors;

/**
 * Thrown when a provider raised an error for an operation and no further provider
 * was eligible to take over.
 */
public class OperationFailedException extends BusOperationException {

    private final String providerName;

    /**
     * Creates a new OperationFailedException.
     *
     * @param providerName name of the provider whose attempt failed last.
     * @param message      description of the failure.
     * @param cause        the error raised by the provider, may be null.
     */
    public OperationFailedException(String providerName, String message, Throwable cause) {
        super(message, cause);
        this.providerName = providerName;
    }

    /**
     * @return name of the provider whose attempt failed last.
     */
    public String getProviderName() {
        return providerName;
    }
}
