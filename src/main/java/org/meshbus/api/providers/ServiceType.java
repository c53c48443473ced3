package org.meshbus.api.providers;

/**
 * The service types routed by the mesh. Each type names the provider interface
 * its providers must implement.
 */
public enum ServiceType {
    COMMUNICATION(ICommunicationProvider.class),
    TOOL(IToolProvider.class),
    LLM(ILlmProvider.class),
    WISE_AUTHORITY(IWiseAuthorityProvider.class),
    RUNTIME_CONTROL(IRuntimeControlProvider.class);

    private final Class<? extends IProvider> providerInterface;

    ServiceType(Class<? extends IProvider> providerInterface) {
        this.providerInterface = providerInterface;
    }

    /**
     * @return The interface a provider of this type must implement.
     */
    public Class<? extends IProvider> providerInterface() {
        return providerInterface;
    }

    /**
     * Checks whether the given provider may be registered under this type.
     *
     * @param provider The provider to check.
     * @return {@code true} if the provider implements {@link #providerInterface()}.
     */
    public boolean accepts(IProvider provider) {
        return providerInterface.isInstance(provider);
    }
}
