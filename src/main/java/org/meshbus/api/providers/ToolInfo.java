package org.meshbus.api.providers;

import java.util.Map;
import java.util.Set;

/**
 * Describes a tool offered by a tool provider.
 *
 * @param name               Tool name, unique per provider.
 * @param description        Human-readable description.
 * @param parameters         Parameter names mapped to a type hint such as {@code "string"}.
 * @param requiredParameters Parameters that must be present for a call to be valid.
 */
public record ToolInfo(
    String name,
    String description,
    Map<String, String> parameters,
    Set<String> requiredParameters
) {
    public ToolInfo {
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
        requiredParameters = requiredParameters == null ? Set.of() : Set.copyOf(requiredParameters);
    }
}
