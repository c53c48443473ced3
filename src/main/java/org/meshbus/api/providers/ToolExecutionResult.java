package org.meshbus.api.providers;

import java.util.Map;

/**
 * Result of a tool execution, either produced by a provider or synthesized by the
 * tool bus when no provider could run the tool.
 *
 * @param toolName      The tool that was requested.
 * @param status        Execution outcome.
 * @param success       Whether the tool did what was asked.
 * @param data          Tool output, empty on failure.
 * @param error         Error description, null on success.
 * @param correlationId Correlation id of the request, may be null.
 */
public record ToolExecutionResult(
    String toolName,
    ToolExecutionStatus status,
    boolean success,
    Map<String, Object> data,
    String error,
    String correlationId
) {
    public ToolExecutionResult {
        data = data == null ? Map.of() : Map.copyOf(data);
    }

    public static ToolExecutionResult completed(String toolName, Map<String, Object> data, String correlationId) {
        return new ToolExecutionResult(toolName, ToolExecutionStatus.COMPLETED, true, data, null, correlationId);
    }

    public static ToolExecutionResult notFound(String toolName, String correlationId) {
        return new ToolExecutionResult(toolName, ToolExecutionStatus.NOT_FOUND, false, Map.of(),
            "No provider offers tool '" + toolName + "'", correlationId);
    }

    public static ToolExecutionResult failed(String toolName, String error, String correlationId) {
        return new ToolExecutionResult(toolName, ToolExecutionStatus.FAILED, false, Map.of(), error, correlationId);
    }

    public static ToolExecutionResult timedOut(String toolName, String error, String correlationId) {
        return new ToolExecutionResult(toolName, ToolExecutionStatus.TIMEOUT, false, Map.of(), error, correlationId);
    }
}
