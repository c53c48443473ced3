package org.meshbus.registry;

import org.meshbus.api.providers.IProvider;
import org.meshbus.api.providers.ServiceType;
import org.meshbus.registry.breaker.CircuitBreaker;

import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A provider as held by the {@link ServiceRegistry}: the provider instance, its routing
 * attributes and its own {@link CircuitBreaker}.
 * <p>
 * Routing attributes are only changed by the registry. Buses read them and drive the
 * breaker through {@link #getCircuitBreaker()}.
 */
public final class RegisteredProvider {

    /** Registry order: priority, then priority group, then registration order. */
    public static final Comparator<RegisteredProvider> REGISTRY_ORDER = Comparator
        .comparingInt((RegisteredProvider p) -> p.getPriority().value())
        .thenComparingInt(RegisteredProvider::getPriorityGroup)
        .thenComparingLong(p -> p.getHandle().sequence());

    private final ProviderHandle handle;
    private final IProvider provider;
    private final Set<String> capabilities;
    private final CircuitBreaker circuitBreaker;
    private volatile Priority priority;
    private volatile int priorityGroup;
    private volatile SelectionStrategy strategy;
    private volatile Map<String, String> metadata;

    RegisteredProvider(ProviderHandle handle, IProvider provider, RegistrationOptions options, CircuitBreaker circuitBreaker) {
        this.handle = handle;
        this.provider = provider;
        this.capabilities = options.getCapabilities();
        this.circuitBreaker = circuitBreaker;
        this.priority = options.getPriority();
        this.priorityGroup = options.getPriorityGroup();
        this.strategy = options.getStrategy().orElse(null);
        this.metadata = options.getMetadata();
    }

    public ProviderHandle getHandle() {
        return handle;
    }

    public String getName() {
        return handle.name();
    }

    public ServiceType getServiceType() {
        return handle.serviceType();
    }

    public IProvider getProvider() {
        return provider;
    }

    /**
     * Returns the provider cast to the interface of its service type.
     *
     * @throws IllegalArgumentException if the provider does not implement the given interface.
     */
    public <P extends IProvider> P getProvider(Class<P> providerInterface) {
        if (!providerInterface.isInstance(provider)) {
            throw new IllegalArgumentException("Provider '" + getName() + "' is of type " + provider.getClass().getName()
                + ", but expected type is " + providerInterface.getName());
        }
        return providerInterface.cast(provider);
    }

    public Set<String> getCapabilities() {
        return capabilities;
    }

    public boolean hasCapabilities(Set<String> required) {
        return capabilities.containsAll(required);
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public Priority getPriority() {
        return priority;
    }

    public int getPriorityGroup() {
        return priorityGroup;
    }

    /**
     * @return The strategy requested at registration, empty to use the bus default.
     */
    public Optional<SelectionStrategy> getStrategy() {
        return Optional.ofNullable(strategy);
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    /**
     * Checks whether every entry of the filter is present with an equal value in the metadata.
     */
    public boolean matchesMetadata(Map<String, String> filter) {
        return filter.entrySet().stream()
            .allMatch(e -> e.getValue().equals(metadata.get(e.getKey())));
    }

    /**
     * @return {@code true} if both providers share priority and priority group.
     */
    public boolean isTiedWith(RegisteredProvider other) {
        return priority == other.priority && priorityGroup == other.priorityGroup;
    }

    void updateRouting(Priority newPriority, int newGroup, SelectionStrategy newStrategy) {
        this.priority = newPriority;
        this.priorityGroup = newGroup;
        this.strategy = newStrategy;
    }

    void updateMetadata(Map<String, String> newMetadata) {
        this.metadata = Map.copyOf(newMetadata);
    }

    ProviderInfo toInfo() {
        return new ProviderInfo(getName(), provider.getClass().getSimpleName(), priority, priorityGroup,
            strategy, capabilities, metadata, handle.sequence(), circuitBreaker.getStats());
    }

    @Override
    public String toString() {
        return "RegisteredProvider{" + handle.serviceType() + "/" + getName() + ", " + priority + "/" + priorityGroup + "}";
    }
}
