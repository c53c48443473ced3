package org.meshbus.registry.breaker;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.time.Duration;
import java.util.Map;

/**
 * Thresholds of a {@link CircuitBreaker}.
 *
 * @param failureThreshold  Failures in CLOSED state that open the circuit.
 * @param recoveryTimeout   Time the circuit stays OPEN before a probe is allowed.
 * @param successThreshold  Successes in HALF_OPEN state that close the circuit.
 * @param halfOpenMaxProbes Concurrent probe calls allowed in HALF_OPEN state, 0 for unlimited.
 */
public record CircuitBreakerConfig(
    int failureThreshold,
    Duration recoveryTimeout,
    int successThreshold,
    int halfOpenMaxProbes
) {

    private static final Config DEFAULTS = ConfigFactory.parseMap(Map.of(
        "failureThreshold", 5,
        "recoveryTimeout", "60s",
        "successThreshold", 3,
        "halfOpenMaxProbes", 0
    ));

    public CircuitBreakerConfig {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be at least 1, was " + failureThreshold);
        }
        if (successThreshold < 1) {
            throw new IllegalArgumentException("successThreshold must be at least 1, was " + successThreshold);
        }
        if (recoveryTimeout == null || recoveryTimeout.isNegative()) {
            throw new IllegalArgumentException("recoveryTimeout must be a non-negative duration, was " + recoveryTimeout);
        }
        if (halfOpenMaxProbes < 0) {
            throw new IllegalArgumentException("halfOpenMaxProbes must not be negative, was " + halfOpenMaxProbes);
        }
    }

    /**
     * @return failure threshold 5, recovery timeout 60s, success threshold 3, unlimited probes.
     */
    public static CircuitBreakerConfig defaults() {
        return fromConfig(ConfigFactory.empty());
    }

    /**
     * Reads a breaker configuration block. Missing keys fall back to {@link #defaults()}.
     *
     * @param options The {@code circuitBreaker} block, may be empty.
     * @return The parsed configuration.
     * @throws IllegalArgumentException if a value is out of range.
     */
    public static CircuitBreakerConfig fromConfig(Config options) {
        Config finalConfig = options.withFallback(DEFAULTS);
        return new CircuitBreakerConfig(
            finalConfig.getInt("failureThreshold"),
            finalConfig.getDuration("recoveryTimeout"),
            finalConfig.getInt("successThreshold"),
            finalConfig.getInt("halfOpenMaxProbes")
        );
    }
}
