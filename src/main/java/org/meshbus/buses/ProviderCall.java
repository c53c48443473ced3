package org.meshbus.buses;

/**
 * One operation invoked on a provider.
 *
 * @param <P> The provider interface.
 * @param <R> The result type.
 */
@FunctionalInterface
public interface ProviderCall<P, R> {

    R invoke(P provider) throws Exception;
}
