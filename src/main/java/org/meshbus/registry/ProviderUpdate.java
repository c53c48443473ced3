package org.meshbus.registry;

/**
 * Result of {@link ServiceRegistry#updatePriority}.
 *
 * @param handle      The updated registration.
 * @param oldPriority Priority before the update.
 * @param newPriority Priority after the update.
 * @param oldGroup    Priority group before the update.
 * @param newGroup    Priority group after the update.
 * @param oldStrategy Strategy before the update, null for the bus default.
 * @param newStrategy Strategy after the update, null for the bus default.
 */
public record ProviderUpdate(
    ProviderHandle handle,
    Priority oldPriority,
    Priority newPriority,
    int oldGroup,
    int newGroup,
    SelectionStrategy oldStrategy,
    SelectionStrategy newStrategy
) {
}
