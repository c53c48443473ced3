package org.meshbus.registry.breaker;

import java.time.Instant;

/**
 * Point-in-time view of a {@link CircuitBreaker}.
 *
 * @param name            Name of the guarded provider.
 * @param state           Current state.
 * @param failureCount    Failures counted in the current CLOSED period.
 * @param successCount    Successes counted in the current HALF_OPEN period.
 * @param lastFailureTime Time of the failure that last opened the circuit, null if never opened.
 * @param totalFailures   Failures recorded over the breaker's lifetime.
 * @param totalSuccesses  Successes recorded over the breaker's lifetime.
 * @param timesOpened     How often the circuit opened.
 */
public record CircuitBreakerStats(
    String name,
    CircuitState state,
    int failureCount,
    int successCount,
    Instant lastFailureTime,
    long totalFailures,
    long totalSuccesses,
    long timesOpened
) {
}
