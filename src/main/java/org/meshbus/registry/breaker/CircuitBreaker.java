package org.meshbus.registry.breaker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Per-provider circuit breaker.
 * <p>
 * Starts CLOSED. Consecutive failures reaching {@code failureThreshold} open the circuit;
 * once {@code recoveryTimeout} elapsed, the next availability check moves it to HALF_OPEN
 * where {@code successThreshold} successes close it again and any failure reopens it.
 * Counters are cleared on every transition into CLOSED or OPEN.
 * <p>
 * <strong>Thread Safety:</strong> All methods are synchronized on the breaker instance,
 * so state reads and transitions are atomic for concurrent bus consumers.
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private int successCount;
    private int probesInFlight;
    private Instant lastFailureTime;

    private long totalFailures;
    private long totalSuccesses;
    private long timesOpened;

    public CircuitBreaker(String name, CircuitBreakerConfig config) {
        this(name, config, Clock.systemUTC());
    }

    /**
     * @param name   Name of the guarded provider, used in log output.
     * @param config Thresholds.
     * @param clock  Time source for the recovery timeout.
     */
    public CircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
        this.name = name;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Checks whether the guarded provider may be called. An OPEN circuit whose recovery
     * timeout elapsed moves to HALF_OPEN as part of this check.
     *
     * @return {@code true} in CLOSED and HALF_OPEN state.
     */
    public synchronized boolean isAvailable() {
        if (state == CircuitState.OPEN) {
            Duration sinceFailure = Duration.between(lastFailureTime, clock.instant());
            if (sinceFailure.compareTo(config.recoveryTimeout()) < 0) {
                return false;
            }
            state = CircuitState.HALF_OPEN;
            successCount = 0;
            probesInFlight = 0;
            log.debug("Circuit breaker for '{}' is HALF_OPEN after {}ms", name, sinceFailure.toMillis());
        }
        return true;
    }

    /**
     * Like {@link #isAvailable()}, but in HALF_OPEN state also takes one of the
     * {@code halfOpenMaxProbes} probe slots. A slot is released by the next
     * {@link #recordSuccess()}, {@link #recordFailure()} or {@link #releasePermission()}.
     *
     * @return {@code true} if the caller may invoke the provider now.
     */
    public synchronized boolean tryAcquirePermission() {
        if (!isAvailable()) {
            return false;
        }
        if (state == CircuitState.HALF_OPEN && config.halfOpenMaxProbes() > 0) {
            if (probesInFlight >= config.halfOpenMaxProbes()) {
                log.debug("Circuit breaker for '{}' refused probe, {} already in flight", name, probesInFlight);
                return false;
            }
            probesInFlight++;
        }
        return true;
    }

    /**
     * Releases a probe slot for a call whose outcome is neither a success nor a failure.
     */
    public synchronized void releasePermission() {
        if (probesInFlight > 0) {
            probesInFlight--;
        }
    }

    public synchronized void recordSuccess() {
        totalSuccesses++;
        switch (state) {
            case CLOSED -> failureCount = 0;
            case HALF_OPEN -> {
                releasePermission();
                successCount++;
                if (successCount >= config.successThreshold()) {
                    state = CircuitState.CLOSED;
                    clearCounters();
                    log.info("Circuit breaker for '{}' CLOSED, provider recovered", name);
                } else {
                    log.debug("Circuit breaker for '{}' probe succeeded ({}/{})",
                        name, successCount, config.successThreshold());
                }
            }
            case OPEN -> {
                // late result of a call started before the circuit opened
            }
        }
    }

    public synchronized void recordFailure() {
        totalFailures++;
        switch (state) {
            case CLOSED -> {
                failureCount++;
                if (failureCount >= config.failureThreshold()) {
                    open();
                    log.info("Circuit breaker for '{}' OPEN after {} failures",
                        name, config.failureThreshold());
                }
            }
            case HALF_OPEN -> {
                open();
                log.info("Circuit breaker for '{}' OPEN again, recovery probe failed", name);
            }
            case OPEN -> {
                // late result of a call started before the circuit opened
            }
        }
    }

    /**
     * Forces the circuit CLOSED and clears all counters. Lifetime totals are kept.
     */
    public synchronized void reset() {
        CircuitState previous = state;
        state = CircuitState.CLOSED;
        clearCounters();
        lastFailureTime = null;
        if (previous != CircuitState.CLOSED) {
            log.info("Circuit breaker for '{}' reset from {} to CLOSED", name, previous);
        }
    }

    public synchronized CircuitState getState() {
        return state;
    }

    public synchronized CircuitBreakerStats getStats() {
        return new CircuitBreakerStats(name, state, failureCount, successCount, lastFailureTime,
            totalFailures, totalSuccesses, timesOpened);
    }

    public String getName() {
        return name;
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    private void open() {
        state = CircuitState.OPEN;
        lastFailureTime = clock.instant();
        clearCounters();
        timesOpened++;
    }

    private void clearCounters() {
        failureCount = 0;
        successCount = 0;
        probesInFlight = 0;
    }
}
