package org.meshbus.api.providers;

/**
 * Outcome of a tool execution.
 */
public enum ToolExecutionStatus {
    COMPLETED,
    FAILED,
    TIMEOUT,
    NOT_FOUND
}
