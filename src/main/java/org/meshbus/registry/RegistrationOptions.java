package org.meshbus.registry;

import org.meshbus.registry.breaker.CircuitBreakerConfig;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Options of a provider registration. Create instances with {@link #builder()}.
 */
public final class RegistrationOptions {

    private final Priority priority;
    private final int priorityGroup;
    private final Set<String> capabilities;
    private final SelectionStrategy strategy;
    private final Map<String, String> metadata;
    private final CircuitBreakerConfig breakerConfig;

    private RegistrationOptions(Builder builder) {
        this.priority = builder.priority;
        this.priorityGroup = builder.priorityGroup;
        this.capabilities = Set.copyOf(builder.capabilities);
        this.strategy = builder.strategy;
        this.metadata = Map.copyOf(builder.metadata);
        this.breakerConfig = builder.breakerConfig;
    }

    /**
     * @return Options with NORMAL priority, group 0, no capabilities and no metadata.
     */
    public static RegistrationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Priority getPriority() {
        return priority;
    }

    public int getPriorityGroup() {
        return priorityGroup;
    }

    public Set<String> getCapabilities() {
        return capabilities;
    }

    /**
     * @return The requested strategy, empty to use the bus default.
     */
    public Optional<SelectionStrategy> getStrategy() {
        return Optional.ofNullable(strategy);
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    /**
     * @return The breaker thresholds, empty to use the registry default.
     */
    public Optional<CircuitBreakerConfig> getBreakerConfig() {
        return Optional.ofNullable(breakerConfig);
    }

    public static final class Builder {
        private Priority priority = Priority.NORMAL;
        private int priorityGroup = 0;
        private Set<String> capabilities = Set.of();
        private SelectionStrategy strategy;
        private Map<String, String> metadata = Map.of();
        private CircuitBreakerConfig breakerConfig;

        private Builder() {
        }

        public Builder priority(Priority priority) {
            if (priority == null) {
                throw new IllegalArgumentException("priority must not be null");
            }
            this.priority = priority;
            return this;
        }

        public Builder priorityGroup(int priorityGroup) {
            if (priorityGroup < 0) {
                throw new IllegalArgumentException("priorityGroup must not be negative, was " + priorityGroup);
            }
            this.priorityGroup = priorityGroup;
            return this;
        }

        public Builder capabilities(Set<String> capabilities) {
            this.capabilities = capabilities == null ? Set.of() : capabilities;
            return this;
        }

        public Builder capabilities(String... capabilities) {
            return capabilities(Set.copyOf(Arrays.asList(capabilities)));
        }

        public Builder strategy(SelectionStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder metadata(Map<String, String> metadata) {
            this.metadata = metadata == null ? Map.of() : metadata;
            return this;
        }

        public Builder breakerConfig(CircuitBreakerConfig breakerConfig) {
            this.breakerConfig = breakerConfig;
            return this;
        }

        public RegistrationOptions build() {
            return new RegistrationOptions(this);
        }
    }
}
