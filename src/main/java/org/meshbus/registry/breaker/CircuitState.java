package org.meshbus.registry.breaker;

/**
 * States of a {@link CircuitBreaker}.
 */
public enum CircuitState {
    /** Normal operation, calls pass. */
    CLOSED,
    /** Provider considered down, calls are refused until the recovery timeout elapsed. */
    OPEN,
    /** Recovery probing, calls pass until enough successes close the circuit or one failure reopens it. */
    HALF_OPEN
}
