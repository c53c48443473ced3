package org.meshbus.buses;

import org.meshbus.registry.RegisteredProvider;
import org.meshbus.registry.SelectionStrategy;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Turns the registry's ordered list of available providers into the providers a bus
 * attempts, according to the {@link SelectionStrategy} in effect.
 * <p>
 * The strategy in effect is the one registered by the first provider of the list, or the
 * bus default if that provider registered none:
 * <ul>
 *   <li>{@link SelectionStrategy#FALLBACK}: the whole list, in registry order. Every provider
 *       is attempted until one succeeds.</li>
 *   <li>{@link SelectionStrategy#ROUND_ROBIN}: the providers tied at the best priority and
 *       priority group, starting with the next one in rotation.</li>
 *   <li>{@link SelectionStrategy#LATENCY_BASED}: the same tie group ordered by average latency,
 *       unmeasured providers first, ties by registration order.</li>
 * </ul>
 * For the last two, only one provider is attempted. The rest of the tie group stands in when
 * the chosen provider's breaker refuses the call.
 * <p>
 * One selector serves one bus, so rotation indices are per service type.
 */
public class ProviderSelector {

    /**
     * The providers a bus should attempt for one operation.
     *
     * @param strategy   The strategy in effect.
     * @param candidates Providers in attempt order.
     */
    public record Plan(SelectionStrategy strategy, List<RegisteredProvider> candidates) {

        static final Plan EMPTY = new Plan(SelectionStrategy.FALLBACK, List.of());

        /**
         * @return True if the plan ends after the first provider that was actually called.
         */
        public boolean singleAttempt() {
            return strategy != SelectionStrategy.FALLBACK;
        }

        public boolean isEmpty() {
            return candidates.isEmpty();
        }
    }

    private final LatencyTracker latencyTracker;
    private final Map<String, AtomicLong> rotation = new ConcurrentHashMap<>();

    public ProviderSelector(LatencyTracker latencyTracker) {
        this.latencyTracker = latencyTracker;
    }

    /**
     * @param available       Available providers in registry order.
     * @param defaultStrategy Strategy of the bus, used when the first provider registered none.
     * @return The plan. Empty if {@code available} is empty.
     */
    public Plan select(List<RegisteredProvider> available, SelectionStrategy defaultStrategy) {
        if (available.isEmpty()) {
            return Plan.EMPTY;
        }
        SelectionStrategy strategy = available.get(0).getStrategy().orElse(defaultStrategy);
        List<RegisteredProvider> candidates = switch (strategy) {
            case FALLBACK -> available;
            case ROUND_ROBIN -> inRotation(tieGroup(available));
            case LATENCY_BASED -> byLatency(tieGroup(available));
        };
        return new Plan(strategy, candidates);
    }

    private List<RegisteredProvider> inRotation(List<RegisteredProvider> group) {
        RegisteredProvider first = group.get(0);
        String key = first.getPriority() + "/" + first.getPriorityGroup();
        long index = rotation.computeIfAbsent(key, k -> new AtomicLong()).getAndIncrement();
        int start = (int) (index % group.size());
        List<RegisteredProvider> rotated = new ArrayList<>(group.size());
        for (int i = 0; i < group.size(); i++) {
            rotated.add(group.get((start + i) % group.size()));
        }
        return rotated;
    }

    private List<RegisteredProvider> byLatency(List<RegisteredProvider> group) {
        return group.stream()
            .sorted(Comparator
                .comparingDouble((RegisteredProvider p) -> latencyTracker.getAverageMillis(p.getHandle()).orElse(-1.0))
                .thenComparingLong(p -> p.getHandle().sequence()))
            .toList();
    }

    private static List<RegisteredProvider> tieGroup(List<RegisteredProvider> available) {
        RegisteredProvider first = available.get(0);
        List<RegisteredProvider> group = new ArrayList<>();
        for (RegisteredProvider provider : available) {
            if (!provider.isTiedWith(first)) {
                break;
            }
            group.add(provider);
        }
        return group;
    }
}
