package org.meshbus.registry;

/**
 * How a bus picks among the providers returned by the registry.
 */
public enum SelectionStrategy {
    /** Try providers in registry order, moving to the next one on failure. */
    FALLBACK,
    /** Rotate among the providers tied at the best priority and group. */
    ROUND_ROBIN,
    /** Pick the provider of the best tie group with the lowest average latency. */
    LATENCY_BASED
}
