package org.meshbus.registry;

import org.meshbus.api.providers.ServiceType;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of all registrations at one point in time.
 *
 * @param takenAt   When the snapshot was taken.
 * @param providers Registrations per service type, in registry order.
 */
public record RegistrySnapshot(Instant takenAt, Map<ServiceType, List<ProviderInfo>> providers) {

    public RegistrySnapshot {
        providers = Map.copyOf(providers);
    }

    public List<ProviderInfo> providers(ServiceType serviceType) {
        return providers.getOrDefault(serviceType, List.of());
    }

    public int totalProviders() {
        return providers.values().stream().mapToInt(List::size).sum();
    }
}
