package org.meshbus.registry;

import org.meshbus.registry.breaker.CircuitBreakerStats;

import java.util.Map;
import java.util.Set;

/**
 * Diagnostic view of one registration.
 *
 * @param name          Provider name.
 * @param providerClass Simple class name of the provider implementation.
 * @param priority      Priority.
 * @param priorityGroup Priority group.
 * @param strategy      Requested strategy, null for the bus default.
 * @param capabilities  Declared capabilities.
 * @param metadata      Registration metadata.
 * @param sequence      Registration order.
 * @param circuitBreaker State and counters of the provider's breaker.
 */
public record ProviderInfo(
    String name,
    String providerClass,
    Priority priority,
    int priorityGroup,
    SelectionStrategy strategy,
    Set<String> capabilities,
    Map<String, String> metadata,
    long sequence,
    CircuitBreakerStats circuitBreaker
) {
}
