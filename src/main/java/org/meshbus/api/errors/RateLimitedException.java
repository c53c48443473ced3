package org.meshbus.api.errors;

import java.time.Duration;
import java.util.Optional;

/**
 * Raised by a provider to signal that its upstream rejected the call because of rate
 * limiting. Buses treat it as a cooldown signal rather than as a health failure.
 */
public class RateLimitedException extends Exception {

    private final Duration retryAfter;

    /**
     * @param message    description from the upstream.
     * @param retryAfter how long the upstream asked to wait, or null if unknown.
     */
    public RateLimitedException(String message, Duration retryAfter) {
        super(message);
        this.retryAfter = retryAfter;
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
