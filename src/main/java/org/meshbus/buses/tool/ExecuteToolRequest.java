package org.meshbus.buses.tool;

import org.meshbus.buses.BusMessage;

import java.util.Map;

/**
 * A queued tool execution whose result is not awaited.
 */
public class ExecuteToolRequest extends BusMessage {

    private final String toolName;
    private final Map<String, Object> parameters;

    public ExecuteToolRequest(String handlerName, String correlationId, String toolName, Map<String, Object> parameters) {
        super(handlerName, correlationId);
        this.toolName = toolName;
        this.parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }

    public String getToolName() {
        return toolName;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }
}
