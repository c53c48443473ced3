package org.meshbus.api.providers;

/**
 * Base contract of every pluggable service provider.
 * <p>
 * Providers are registered with the {@code ServiceRegistry} under a {@link ServiceType}
 * and are only ever invoked through a bus. Each service type has its own sub-interface
 * carrying the operations the matching bus routes to it.
 */
public interface IProvider {

    /**
     * Returns the provider name. Names must be unique within a service type.
     *
     * @return The provider name.
     */
    String getName();

    /**
     * Lightweight health check consulted before a provider is invoked. A provider that
     * reports unhealthy is skipped and the miss is recorded against its circuit breaker.
     *
     * @return {@code true} if the provider can take requests.
     */
    default boolean isHealthy() {
        return true;
    }
}
