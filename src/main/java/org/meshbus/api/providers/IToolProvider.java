package org.meshbus.api.providers;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A provider that executes named tools.
 * <p>
 * Tools a provider wants to be routed to must also be declared as {@code tool:<name>}
 * capabilities at registration time; the bus routes on those declarations only.
 */
public interface IToolProvider extends IProvider {

    ToolExecutionResult executeTool(String toolName, Map<String, Object> parameters) throws Exception;

    List<String> getAvailableTools() throws Exception;

    Optional<ToolInfo> getToolInfo(String toolName) throws Exception;

    /**
     * Validates parameters before execution. The default accepts everything the tool
     * info marks as required being present.
     */
    default boolean validateParameters(String toolName, Map<String, Object> parameters) throws Exception {
        Optional<ToolInfo> info = getToolInfo(toolName);
        return info.isPresent() && parameters.keySet().containsAll(info.get().requiredParameters());
    }
}
