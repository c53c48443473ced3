package org.meshbus.registry;

import org.meshbus.api.providers.ServiceType;

/**
 * Identifies a registration. Returned by {@link ServiceRegistry#register} and used to
 * unregister or update the provider later.
 *
 * @param serviceType  The type the provider was registered under.
 * @param name         The provider name.
 * @param sequence     Registration order, unique per registry.
 */
public record ProviderHandle(ServiceType serviceType, String name, long sequence) {
}
