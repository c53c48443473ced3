package org.meshbus.registry.breaker;

import com.typesafe.config.ConfigFactory;
import org.meshbus.junit.extensions.logging.LogWatchExtension;
import org.meshbus.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class CircuitBreakerTest {

    private MutableClock clock;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        breaker = new CircuitBreaker("test", new CircuitBreakerConfig(3, Duration.ofSeconds(10), 2, 0), clock);
    }

    private void openBreaker() {
        for (int i = 0; i < 3; i++) {
            breaker.recordFailure();
        }
        assertEquals(CircuitState.OPEN, breaker.getState());
    }

    @Test
    void startsClosedAndAvailable() {
        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertTrue(breaker.isAvailable());
    }

    @Test
    void failuresBelowThresholdKeepCircuitClosed() {
        breaker.recordFailure();
        breaker.recordFailure();

        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertEquals(2, breaker.getStats().failureCount());
        assertTrue(breaker.isAvailable());
    }

    @Test
    void reachingFailureThresholdOpensCircuitAndClearsCount() {
        openBreaker();

        CircuitBreakerStats stats = breaker.getStats();
        assertFalse(breaker.isAvailable());
        assertEquals(0, stats.failureCount());
        assertEquals(clock.instant(), stats.lastFailureTime());
        assertEquals(1, stats.timesOpened());
    }

    @Test
    void successWhileClosedResetsFailureCount() {
        breaker.recordFailure();
        breaker.recordFailure();
        breaker.recordSuccess();
        breaker.recordFailure();
        breaker.recordFailure();

        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertEquals(2, breaker.getStats().failureCount());
    }

    @Test
    void openCircuitStaysUnavailableBeforeRecoveryTimeout() {
        openBreaker();
        clock.advance(Duration.ofSeconds(9));

        assertFalse(breaker.isAvailable());
        assertEquals(CircuitState.OPEN, breaker.getState());
    }

    @Test
    void availabilityCheckAfterRecoveryTimeoutMovesToHalfOpen() {
        openBreaker();
        clock.advance(Duration.ofSeconds(10));

        assertEquals(CircuitState.OPEN, breaker.getState());
        assertTrue(breaker.isAvailable());
        assertEquals(CircuitState.HALF_OPEN, breaker.getState());
        assertEquals(0, breaker.getStats().successCount());
    }

    @Test
    void successThresholdInHalfOpenClosesCircuitAndClearsCounters() {
        openBreaker();
        clock.advance(Duration.ofSeconds(10));
        breaker.isAvailable();

        breaker.recordSuccess();
        assertEquals(CircuitState.HALF_OPEN, breaker.getState());
        assertEquals(1, breaker.getStats().successCount());

        breaker.recordSuccess();
        CircuitBreakerStats stats = breaker.getStats();
        assertEquals(CircuitState.CLOSED, stats.state());
        assertEquals(0, stats.failureCount());
        assertEquals(0, stats.successCount());
    }

    @Test
    void anyFailureInHalfOpenReopensCircuit() {
        openBreaker();
        clock.advance(Duration.ofSeconds(10));
        breaker.isAvailable();
        breaker.recordSuccess();

        clock.advance(Duration.ofSeconds(1));
        breaker.recordFailure();

        assertEquals(CircuitState.OPEN, breaker.getState());
        assertEquals(clock.instant(), breaker.getStats().lastFailureTime());
        assertEquals(0, breaker.getStats().successCount());
        assertFalse(breaker.isAvailable());
        assertEquals(2, breaker.getStats().timesOpened());
    }

    @Test
    void reopenedCircuitWaitsFullRecoveryTimeoutAgain() {
        openBreaker();
        clock.advance(Duration.ofSeconds(10));
        breaker.isAvailable();
        breaker.recordFailure();

        clock.advance(Duration.ofSeconds(5));
        assertFalse(breaker.isAvailable());
        clock.advance(Duration.ofSeconds(5));
        assertTrue(breaker.isAvailable());
    }

    @Test
    void halfOpenProbeCapLimitsConcurrentProbes() {
        breaker = new CircuitBreaker("capped", new CircuitBreakerConfig(1, Duration.ofSeconds(1), 2, 1), clock);
        breaker.recordFailure();
        clock.advance(Duration.ofSeconds(1));

        assertTrue(breaker.tryAcquirePermission());
        assertEquals(CircuitState.HALF_OPEN, breaker.getState());
        assertFalse(breaker.tryAcquirePermission());

        breaker.recordSuccess();
        assertTrue(breaker.tryAcquirePermission());
        breaker.releasePermission();
        assertTrue(breaker.tryAcquirePermission());
    }

    @Test
    void unlimitedProbesByDefault() {
        openBreaker();
        clock.advance(Duration.ofSeconds(10));

        for (int i = 0; i < 10; i++) {
            assertTrue(breaker.tryAcquirePermission());
        }
    }

    @Test
    void resetForcesClosedAndKeepsTotals() {
        openBreaker();
        breaker.reset();

        CircuitBreakerStats stats = breaker.getStats();
        assertEquals(CircuitState.CLOSED, stats.state());
        assertTrue(breaker.isAvailable());
        assertNull(stats.lastFailureTime());
        assertEquals(3, stats.totalFailures());
        assertEquals(1, stats.timesOpened());
    }

    @Test
    void resultsArrivingWhileOpenDoNotChangeState() {
        openBreaker();
        breaker.recordSuccess();
        breaker.recordFailure();

        assertEquals(CircuitState.OPEN, breaker.getState());
        assertEquals(4, breaker.getStats().totalFailures());
        assertEquals(1, breaker.getStats().totalSuccesses());
    }

    @Test
    void configDefaultsMatchDocumentedValues() {
        CircuitBreakerConfig defaults = CircuitBreakerConfig.defaults();

        assertEquals(5, defaults.failureThreshold());
        assertEquals(Duration.ofSeconds(60), defaults.recoveryTimeout());
        assertEquals(3, defaults.successThreshold());
        assertEquals(0, defaults.halfOpenMaxProbes());
    }

    @Test
    void configReadsOverridesAndFallsBackForMissingKeys() {
        CircuitBreakerConfig config = CircuitBreakerConfig.fromConfig(ConfigFactory.parseMap(Map.of(
            "failureThreshold", 2,
            "recoveryTimeout", "250ms"
        )));

        assertEquals(2, config.failureThreshold());
        assertEquals(Duration.ofMillis(250), config.recoveryTimeout());
        assertEquals(3, config.successThreshold());
    }

    @Test
    void configRejectsInvalidThresholds() {
        assertThrows(IllegalArgumentException.class,
            () -> new CircuitBreakerConfig(0, Duration.ofSeconds(1), 1, 0));
        assertThrows(IllegalArgumentException.class,
            () -> new CircuitBreakerConfig(1, Duration.ofSeconds(1), 0, 0));
        assertThrows(IllegalArgumentException.class,
            () -> new CircuitBreakerConfig(1, Duration.ofSeconds(-1), 1, 0));
        assertThrows(IllegalArgumentException.class,
            () -> CircuitBreakerConfig.fromConfig(ConfigFactory.parseMap(Map.of("halfOpenMaxProbes", -1))));
    }

    @Test
    void concurrentFailuresOpenCircuitExactlyOnce() throws Exception {
        runConcurrently(8, () -> {
            for (int i = 0; i < 250; i++) {
                breaker.recordFailure();
            }
        });

        CircuitBreakerStats stats = breaker.getStats();
        assertEquals(CircuitState.OPEN, stats.state());
        assertEquals(1, stats.timesOpened());
        assertEquals(2000, stats.totalFailures());
        assertEquals(0, stats.failureCount());
    }

    @Test
    void concurrentRecordingKeepsTotalsConsistent() throws Exception {
        breaker = new CircuitBreaker("busy", new CircuitBreakerConfig(1_000_000, Duration.ofSeconds(10), 2, 0), clock);

        runConcurrently(9, new Runnable() {
            private final AtomicInteger role = new AtomicInteger();

            @Override
            public void run() {
                int mine = role.getAndIncrement() % 3;
                for (int i = 0; i < 500; i++) {
                    switch (mine) {
                        case 0 -> breaker.recordSuccess();
                        case 1 -> breaker.recordFailure();
                        default -> assertTrue(breaker.isAvailable());
                    }
                }
            }
        });

        CircuitBreakerStats stats = breaker.getStats();
        assertEquals(CircuitState.CLOSED, stats.state());
        assertEquals(1500, stats.totalSuccesses());
        assertEquals(1500, stats.totalFailures());
        assertEquals(0, stats.timesOpened());
    }

    @Test
    void concurrentProbesRespectHalfOpenCap() throws Exception {
        breaker = new CircuitBreaker("probed", new CircuitBreakerConfig(1, Duration.ofSeconds(1), 5, 2), clock);
        breaker.recordFailure();
        clock.advance(Duration.ofSeconds(2));
        AtomicInteger granted = new AtomicInteger();

        runConcurrently(16, () -> {
            if (breaker.tryAcquirePermission()) {
                granted.incrementAndGet();
            }
        });

        assertEquals(2, granted.get());
        assertEquals(CircuitState.HALF_OPEN, breaker.getState());
    }

    private static void runConcurrently(int threads, Runnable task) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch startGate = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    startGate.await();
                    task.run();
                    return null;
                }));
            }
            startGate.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
