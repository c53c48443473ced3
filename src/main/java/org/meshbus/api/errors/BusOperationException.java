package org.meshbus.api.errors;

/**
 * Base class of the typed errors a bus operation can surface to its caller.
 */
public class BusOperationException extends Exception {

    public BusOperationException(String message) {
        super(message);
    }

    public BusOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
