package org.meshbus.buses;

import org.meshbus.api.providers.IToolProvider;
import org.meshbus.api.providers.ServiceType;
import org.meshbus.junit.extensions.logging.LogWatchExtension;
import org.meshbus.registry.Priority;
import org.meshbus.registry.ProviderHandle;
import org.meshbus.registry.RegisteredProvider;
import org.meshbus.registry.RegistrationOptions;
import org.meshbus.registry.SelectionStrategy;
import org.meshbus.registry.ServiceRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.meshbus.testing.TestProviders.provider;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ProviderSelectorTest {

    private ServiceRegistry registry;
    private LatencyTracker latencyTracker;
    private ProviderSelector selector;

    @BeforeEach
    void setUp() {
        registry = new ServiceRegistry();
        latencyTracker = new LatencyTracker();
        selector = new ProviderSelector(latencyTracker);
    }

    private ProviderHandle register(String name, Priority priority, SelectionStrategy strategy) {
        return registry.register(ServiceType.TOOL, provider(IToolProvider.class, name),
            RegistrationOptions.builder().priority(priority).strategy(strategy).build());
    }

    private static List<String> names(ProviderSelector.Plan plan) {
        return plan.candidates().stream().map(RegisteredProvider::getName).toList();
    }

    private List<RegisteredProvider> available() {
        return registry.getProviders(ServiceType.TOOL);
    }

    @Test
    void emptyListSelectsNothing() {
        assertTrue(selector.select(List.of(), SelectionStrategy.FALLBACK).isEmpty());
    }

    @Test
    void fallbackKeepsRegistryOrder() {
        register("normal", Priority.NORMAL, null);
        register("high", Priority.HIGH, null);
        register("fallback", Priority.FALLBACK, null);

        ProviderSelector.Plan plan = selector.select(available(), SelectionStrategy.FALLBACK);

        assertEquals(List.of("high", "normal", "fallback"), names(plan));
        assertFalse(plan.singleAttempt());
    }

    @Test
    void roundRobinDistributesEvenlyWithinTieGroup() {
        register("a", Priority.NORMAL, SelectionStrategy.ROUND_ROBIN);
        register("b", Priority.NORMAL, SelectionStrategy.ROUND_ROBIN);
        register("c", Priority.NORMAL, SelectionStrategy.ROUND_ROBIN);
        register("backup", Priority.LOW, SelectionStrategy.ROUND_ROBIN);

        Map<String, Integer> counts = new HashMap<>();
        for (int i = 0; i < 10; i++) {
            ProviderSelector.Plan plan = selector.select(available(), SelectionStrategy.FALLBACK);
            assertTrue(plan.singleAttempt());
            assertEquals(3, plan.candidates().size());
            counts.merge(plan.candidates().get(0).getName(), 1, Integer::sum);
        }

        assertEquals(3, counts.size());
        assertFalse(counts.containsKey("backup"));
        int max = counts.values().stream().mapToInt(Integer::intValue).max().orElseThrow();
        int min = counts.values().stream().mapToInt(Integer::intValue).min().orElseThrow();
        assertTrue(max - min <= 1, "uneven distribution " + counts);
    }

    @Test
    void roundRobinRotatesInRegistrationOrder() {
        register("a", Priority.NORMAL, null);
        register("b", Priority.NORMAL, null);

        assertEquals(List.of("a", "b"), names(selector.select(available(), SelectionStrategy.ROUND_ROBIN)));
        assertEquals(List.of("b", "a"), names(selector.select(available(), SelectionStrategy.ROUND_ROBIN)));
        assertEquals(List.of("a", "b"), names(selector.select(available(), SelectionStrategy.ROUND_ROBIN)));
    }

    @Test
    void latencyBasedPrefersUnmeasuredProvider() {
        ProviderHandle measured = register("measured", Priority.NORMAL, SelectionStrategy.LATENCY_BASED);
        register("fresh", Priority.NORMAL, SelectionStrategy.LATENCY_BASED);
        latencyTracker.record(measured, 1_000_000);

        assertEquals(List.of("fresh", "measured"), names(selector.select(available(), SelectionStrategy.FALLBACK)));
    }

    @Test
    void latencyBasedPicksLowestAverage() {
        ProviderHandle slow = register("slow", Priority.NORMAL, SelectionStrategy.LATENCY_BASED);
        ProviderHandle fast = register("fast", Priority.NORMAL, SelectionStrategy.LATENCY_BASED);
        latencyTracker.record(slow, 50_000_000);
        latencyTracker.record(slow, 30_000_000);
        latencyTracker.record(fast, 5_000_000);

        ProviderSelector.Plan plan = selector.select(available(), SelectionStrategy.FALLBACK);

        assertTrue(plan.singleAttempt());
        assertEquals(List.of("fast", "slow"), names(plan));
        assertEquals(40.0, latencyTracker.getAverageMillis(slow).orElseThrow(), 0.001);
    }

    @Test
    void latencyBasedNeverLeavesBestTieGroup() {
        ProviderHandle preferred = register("preferred", Priority.HIGH, SelectionStrategy.LATENCY_BASED);
        ProviderHandle quicker = register("quicker", Priority.NORMAL, SelectionStrategy.LATENCY_BASED);
        latencyTracker.record(preferred, 90_000_000);
        latencyTracker.record(quicker, 1_000_000);

        assertEquals(List.of("preferred"), names(selector.select(available(), SelectionStrategy.FALLBACK)));
    }

    @Test
    void strategyOfFirstProviderOverridesBusDefault() {
        register("a", Priority.NORMAL, SelectionStrategy.FALLBACK);
        register("b", Priority.NORMAL, null);

        ProviderSelector.Plan plan = selector.select(available(), SelectionStrategy.ROUND_ROBIN);

        assertEquals(SelectionStrategy.FALLBACK, plan.strategy());
        assertEquals(List.of("a", "b"), names(plan));
    }
}
