package org.meshbus.registry;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.meshbus.api.providers.IProvider;
import org.meshbus.api.providers.ServiceType;
import org.meshbus.audit.AuditTrail;
import org.meshbus.registry.breaker.CircuitBreaker;
import org.meshbus.registry.breaker.CircuitBreakerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * Holds every provider of the mesh, keyed by {@link ServiceType}, together with its
 * routing attributes and its own {@link CircuitBreaker}.
 * <p>
 * Lookups return providers ordered by {@link RegisteredProvider#REGISTRY_ORDER} and only
 * those whose breaker reports available. Applying a selection strategy is left to the buses.
 * <p>
 * <strong>Thread Safety:</strong> Structural changes are guarded by a read/write lock;
 * breakers synchronize on themselves.
 */
public class ServiceRegistry {

    private static final Logger log = LoggerFactory.getLogger(ServiceRegistry.class);

    private final Map<ServiceType, List<RegisteredProvider>> providers = new EnumMap<>(ServiceType.class);
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Condition providersChanged = lock.writeLock().newCondition();
    private final AtomicLong sequence = new AtomicLong();
    private final CircuitBreakerConfig defaultBreakerConfig;
    private final AuditTrail auditTrail;
    private final Clock clock;
    private final Duration readinessTimeout;
    private final Set<ServiceType> requiredServices;

    public ServiceRegistry() {
        this(ConfigFactory.empty(), new AuditTrail(), Clock.systemUTC());
    }

    /**
     * Creates a registry from the {@code meshbus} configuration block.
     * <p>
     * Reads {@code circuitBreaker} for the default breaker thresholds and
     * {@code registry.readinessTimeout} / {@code registry.requiredServices} for {@link #waitReady()}.
     *
     * @param options    The {@code meshbus} block, may be empty.
     * @param auditTrail Receives administrative events.
     * @param clock      Time source handed to every breaker.
     * @throws IllegalArgumentException if the configuration is invalid.
     */
    public ServiceRegistry(Config options, AuditTrail auditTrail, Clock clock) {
        Config defaults = ConfigFactory.parseMap(Map.of(
            "registry.readinessTimeout", "30s",
            "registry.requiredServices", List.of()
        ));
        Config finalConfig = options.withFallback(defaults);

        this.defaultBreakerConfig = finalConfig.hasPath("circuitBreaker")
            ? CircuitBreakerConfig.fromConfig(finalConfig.getConfig("circuitBreaker"))
            : CircuitBreakerConfig.defaults();
        this.readinessTimeout = finalConfig.getDuration("registry.readinessTimeout");
        this.requiredServices = parseServiceTypes(finalConfig.getStringList("registry.requiredServices"));
        this.auditTrail = auditTrail;
        this.clock = clock;
        for (ServiceType type : ServiceType.values()) {
            providers.put(type, new ArrayList<>());
        }
    }

    /**
     * Registers a provider with a fresh circuit breaker.
     *
     * @param serviceType The type to register under.
     * @param provider    The provider, must implement the type's provider interface.
     * @param options     Routing options.
     * @return The handle identifying this registration.
     * @throws IllegalArgumentException if the provider does not fit the type or its name is
     *                                  already registered for that type.
     */
    public ProviderHandle register(ServiceType serviceType, IProvider provider, RegistrationOptions options) {
        if (!serviceType.accepts(provider)) {
            throw new IllegalArgumentException("Provider " + provider.getClass().getName() + " does not implement "
                + serviceType.providerInterface().getSimpleName() + " required for " + serviceType);
        }
        String name = provider.getName();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Provider " + provider.getClass().getName() + " has no name.");
        }

        lock.writeLock().lock();
        try {
            List<RegisteredProvider> list = providers.get(serviceType);
            if (list.stream().anyMatch(p -> p.getName().equals(name))) {
                throw new IllegalArgumentException("Provider '" + name + "' is already registered for " + serviceType + ".");
            }
            ProviderHandle handle = new ProviderHandle(serviceType, name, sequence.incrementAndGet());
            CircuitBreakerConfig breakerConfig = options.getBreakerConfig().orElse(defaultBreakerConfig);
            CircuitBreaker breaker = new CircuitBreaker(serviceType + "/" + name, breakerConfig, clock);
            list.add(new RegisteredProvider(handle, provider, options, breaker));
            providersChanged.signalAll();

            log.info("Registered {} provider '{}' (priority={}, group={}, capabilities={})",
                serviceType, name, options.getPriority(), options.getPriorityGroup(), options.getCapabilities());
            return handle;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public ProviderHandle register(ServiceType serviceType, IProvider provider) {
        return register(serviceType, provider, RegistrationOptions.defaults());
    }

    /**
     * Removes a registration and its breaker. Unknown handles are ignored.
     *
     * @return {@code true} if the registration existed.
     */
    public boolean unregister(ProviderHandle handle) {
        lock.writeLock().lock();
        try {
            boolean removed = providers.get(handle.serviceType())
                .removeIf(p -> p.getHandle().equals(handle));
            if (removed) {
                log.info("Unregistered {} provider '{}'", handle.serviceType(), handle.name());
                providersChanged.signalAll();
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<RegisteredProvider> getProviders(ServiceType serviceType) {
        return getProviders(serviceType, Set.of(), Map.of());
    }

    public List<RegisteredProvider> getProviders(ServiceType serviceType, Set<String> requiredCapabilities) {
        return getProviders(serviceType, requiredCapabilities, Map.of());
    }

    /**
     * Returns the available providers of a type that declare every required capability
     * and match every metadata entry, in registry order.
     * <p>
     * Availability is decided by each provider's breaker, so an OPEN breaker whose
     * recovery timeout elapsed moves to HALF_OPEN here and its provider is returned.
     *
     * @param serviceType          The service type.
     * @param requiredCapabilities Capabilities the provider must declare, may be empty.
     * @param metadataFilter       Metadata entries the provider must carry, may be empty.
     * @return The ordered list, possibly empty.
     */
    public List<RegisteredProvider> getProviders(ServiceType serviceType, Set<String> requiredCapabilities,
                                                 Map<String, String> metadataFilter) {
        lock.readLock().lock();
        try {
            return providers.get(serviceType).stream()
                .filter(p -> p.hasCapabilities(requiredCapabilities))
                .filter(p -> p.matchesMetadata(metadataFilter))
                .filter(p -> p.getCircuitBreaker().isAvailable())
                .sorted(RegisteredProvider.REGISTRY_ORDER)
                .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns every provider of a type regardless of its breaker, in registry order.
     */
    public List<RegisteredProvider> getAllProviders(ServiceType serviceType) {
        lock.readLock().lock();
        try {
            return providers.get(serviceType).stream()
                .sorted(RegisteredProvider.REGISTRY_ORDER)
                .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<RegisteredProvider> findProvider(ServiceType serviceType, String name) {
        lock.readLock().lock();
        try {
            return providers.get(serviceType).stream()
                .filter(p -> p.getName().equals(name))
                .findFirst();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean hasProviders(ServiceType serviceType) {
        lock.readLock().lock();
        try {
            return !providers.get(serviceType).isEmpty();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Forces the breakers of one type, or of all types, to CLOSED. The reset is audited.
     *
     * @param serviceType The type to reset, empty for all types.
     * @return The number of breakers reset.
     */
    public int resetCircuitBreakers(Optional<ServiceType> serviceType) {
        List<RegisteredProvider> targets = new ArrayList<>();
        lock.readLock().lock();
        try {
            Collection<ServiceType> types = serviceType.<Collection<ServiceType>>map(t -> EnumSet.of(t)).orElseGet(() -> EnumSet.allOf(ServiceType.class));
            for (ServiceType type : types) {
                targets.addAll(providers.get(type));
            }
        } finally {
            lock.readLock().unlock();
        }

        targets.forEach(p -> p.getCircuitBreaker().reset());

        String target = serviceType.map(Enum::name).orElse("ALL");
        log.info("Reset {} circuit breakers for {}", targets.size(), target);
        auditTrail.record("circuit_breaker_reset", "service_registry", target, "success",
            Map.of("count", String.valueOf(targets.size())));
        return targets.size();
    }

    public int resetCircuitBreakers() {
        return resetCircuitBreakers(Optional.empty());
    }

    /**
     * Changes the routing attributes of a registration. The change is audited.
     *
     * @param handle   The registration.
     * @param priority New priority.
     * @param group    New priority group.
     * @param strategy New strategy, null for the bus default.
     * @return Old and new values.
     * @throws IllegalArgumentException if the handle is not registered.
     */
    public ProviderUpdate updatePriority(ProviderHandle handle, Priority priority, int group, SelectionStrategy strategy) {
        if (group < 0) {
            throw new IllegalArgumentException("priority group must not be negative, was " + group);
        }
        lock.writeLock().lock();
        try {
            RegisteredProvider provider = requireRegistered(handle);
            ProviderUpdate update = new ProviderUpdate(handle,
                provider.getPriority(), priority,
                provider.getPriorityGroup(), group,
                provider.getStrategy().orElse(null), strategy);
            provider.updateRouting(priority, group, strategy);

            log.info("Updated {} provider '{}': priority {} -> {}, group {} -> {}",
                handle.serviceType(), handle.name(), update.oldPriority(), priority, update.oldGroup(), group);
            auditTrail.record("provider_priority_update", "service_registry",
                handle.serviceType() + "/" + handle.name(), "success",
                Map.of("priority", priority.name(), "group", String.valueOf(group)));
            return update;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replaces the metadata of a registration.
     *
     * @throws IllegalArgumentException if the handle is not registered.
     */
    public void updateMetadata(ProviderHandle handle, Map<String, String> metadata) {
        lock.writeLock().lock();
        try {
            requireRegistered(handle).updateMetadata(metadata);
            log.debug("Updated metadata of {} provider '{}' to {}", handle.serviceType(), handle.name(), metadata);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Returns every registration with its breaker state. Does not change any breaker.
     */
    public RegistrySnapshot snapshot() {
        lock.readLock().lock();
        try {
            Map<ServiceType, List<ProviderInfo>> view = new LinkedHashMap<>();
            providers.forEach((type, list) -> view.put(type, list.stream()
                .sorted(RegisteredProvider.REGISTRY_ORDER)
                .map(RegisteredProvider::toInfo)
                .collect(Collectors.toUnmodifiableList())));
            return new RegistrySnapshot(clock.instant(), view);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Blocks until every configured required service type has a provider, or the configured
     * readiness timeout elapsed.
     */
    public boolean waitReady() throws InterruptedException {
        return waitReady(readinessTimeout, requiredServices);
    }

    /**
     * Blocks until every given service type has at least one registered provider.
     *
     * @param timeout       Maximum time to wait.
     * @param requiredTypes Types that need a provider.
     * @return {@code true} if all types are covered, {@code false} on timeout.
     * @throws InterruptedException if interrupted while waiting.
     */
    public boolean waitReady(Duration timeout, Set<ServiceType> requiredTypes) throws InterruptedException {
        long remainingNanos = timeout.toNanos();
        lock.writeLock().lock();
        try {
            while (true) {
                Set<ServiceType> missing = requiredTypes.stream()
                    .filter(t -> providers.get(t).isEmpty())
                    .collect(Collectors.toSet());
                if (missing.isEmpty()) {
                    return true;
                }
                if (remainingNanos <= 0) {
                    log.warn("Registry not ready after {}ms, missing providers for {}", timeout.toMillis(), missing);
                    return false;
                }
                remainingNanos = providersChanged.awaitNanos(remainingNanos);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes every registration.
     */
    public void clear() {
        lock.writeLock().lock();
        try {
            int count = providers.values().stream().mapToInt(List::size).sum();
            providers.values().forEach(List::clear);
            providersChanged.signalAll();
            log.info("Cleared {} provider registrations", count);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public CircuitBreakerConfig getDefaultBreakerConfig() {
        return defaultBreakerConfig;
    }

    public AuditTrail getAuditTrail() {
        return auditTrail;
    }

    public Clock getClock() {
        return clock;
    }

    private RegisteredProvider requireRegistered(ProviderHandle handle) {
        return providers.get(handle.serviceType()).stream()
            .filter(p -> p.getHandle().equals(handle))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Provider '" + handle.name() + "' is not registered for "
                + handle.serviceType() + "."));
    }

    private static Set<ServiceType> parseServiceTypes(List<String> names) {
        Set<ServiceType> types = EnumSet.noneOf(ServiceType.class);
        for (String name : names) {
            try {
                types.add(ServiceType.valueOf(name.trim().toUpperCase()));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown service type '" + name + "' in registry.requiredServices", e);
            }
        }
        return types;
    }
}
