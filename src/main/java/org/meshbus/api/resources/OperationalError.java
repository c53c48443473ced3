package org.meshbus.api.resources;

import java.time.Instant;

/**
 * Represents an operational error that occurred within a mesh component.
 * <p>
 * This record is used to provide detailed, structured information about errors
 * for monitoring and debugging purposes.
 *
 * @param timestamp The timestamp of when the error occurred.
 * @param errorType A category for the error (e.g., "PROVIDER_TIMEOUT", "QUEUE_OVERFLOW").
 * @param message   A human-readable description of the error.
 * @param details   Optional additional context, such as the provider or message involved.
 */
public record OperationalError(
    Instant timestamp,
    String errorType,
    String message,
    String details
) {
}
