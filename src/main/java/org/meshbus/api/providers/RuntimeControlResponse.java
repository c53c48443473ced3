package org.meshbus.api.providers;

import java.time.Instant;

/**
 * Outcome of a runtime control command.
 *
 * @param success        Whether the command took effect.
 * @param message        Human-readable description.
 * @param processorState State of the processor after the command, may be null.
 * @param timestamp      When the response was produced.
 * @param error          Error description, null on success.
 */
public record RuntimeControlResponse(
    boolean success,
    String message,
    String processorState,
    Instant timestamp,
    String error
) {

    public static RuntimeControlResponse ok(String message, String processorState) {
        return new RuntimeControlResponse(true, message, processorState, Instant.now(), null);
    }

    public static RuntimeControlResponse failure(String error) {
        return new RuntimeControlResponse(false, error, null, Instant.now(), error);
    }
}
