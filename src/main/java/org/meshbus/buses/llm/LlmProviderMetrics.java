package org.meshbus.buses.llm;

import org.meshbus.registry.breaker.CircuitState;

import java.time.Instant;

/**
 * Call statistics of one language model provider as seen by the {@link LlmBus}.
 *
 * @param providerName         The provider.
 * @param totalRequests        Attempts made on the provider.
 * @param failedRequests       Attempts that raised an error or timed out.
 * @param averageLatencyMillis Average latency of attempts, failures counted as the call timeout, 0 if none.
 * @param consecutiveFailures  Failures since the last success.
 * @param rateLimitedCount     Attempts rejected by upstream rate limiting.
 * @param rateLimitedUntil     End of the current cooldown, null if none.
 * @param circuitState         State of the provider's breaker.
 */
public record LlmProviderMetrics(
    String providerName,
    long totalRequests,
    long failedRequests,
    double averageLatencyMillis,
    long consecutiveFailures,
    long rateLimitedCount,
    Instant rateLimitedUntil,
    CircuitState circuitState
) {

    /**
     * @return Failed attempts divided by all attempts, 0 if there were none.
     */
    public double failureRate() {
        return totalRequests == 0 ? 0.0 : (double) failedRequests / totalRequests;
    }
}
