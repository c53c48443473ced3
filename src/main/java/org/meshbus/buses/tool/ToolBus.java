package org.meshbus.buses.tool;

import com.typesafe.config.Config;
import org.meshbus.api.errors.BusOperationException;
import org.meshbus.api.errors.OperationFailedException;
import org.meshbus.api.errors.OperationTimeoutException;
import org.meshbus.api.providers.IToolProvider;
import org.meshbus.api.providers.ServiceType;
import org.meshbus.api.providers.ToolExecutionResult;
import org.meshbus.api.providers.ToolInfo;
import org.meshbus.buses.AbstractBus;
import org.meshbus.buses.BusMessage;
import org.meshbus.registry.RegisteredProvider;
import org.meshbus.registry.SelectionStrategy;
import org.meshbus.registry.ServiceRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Routes tool executions to tool providers.
 * <p>
 * A provider is routed a tool only if it declared the capability {@code tool:<name>} at
 * registration. A result returned by a provider counts as a success for its breaker, even
 * if the tool itself reports a failure; only raised errors and timeouts count as failures.
 */
public class ToolBus extends AbstractBus<IToolProvider> {

    public static final String TOOL_CAPABILITY_PREFIX = "tool:";

    private final AtomicLong executions = new AtomicLong();
    private final AtomicLong executionErrors = new AtomicLong();

    public ToolBus(ServiceRegistry registry, Config options) {
        super(ServiceType.TOOL, IToolProvider.class, registry, options, SelectionStrategy.FALLBACK);
    }

    /**
     * @return The capability a provider declares to offer the tool.
     */
    public static String toolCapability(String toolName) {
        return TOOL_CAPABILITY_PREFIX + toolName;
    }

    /**
     * Executes a tool on the first provider able to run it.
     *
     * @param toolName    The tool.
     * @param parameters  Tool parameters.
     * @param handlerName The requesting handler, used as correlation context.
     * @return The provider's result; {@code NOT_FOUND} if no available provider declares the
     *         tool; {@code TIMEOUT} or {@code FAILED} if every attempt failed.
     */
    public ToolExecutionResult executeTool(String toolName, Map<String, Object> parameters, String handlerName) {
        executions.incrementAndGet();
        Map<String, Object> params = parameters == null ? Map.of() : parameters;
        try {
            Optional<ToolExecutionResult> result = invokeWithFallback("execute_tool", Set.of(toolCapability(toolName)),
                provider -> provider.executeTool(toolName, params));
            if (result.isEmpty()) {
                executionErrors.incrementAndGet();
                log.debug("No tool provider offers '{}' for {}", toolName, handlerName);
                return ToolExecutionResult.notFound(toolName, null);
            }
            if (!result.get().success()) {
                executionErrors.incrementAndGet();
            }
            return result.get();
        } catch (OperationTimeoutException e) {
            executionErrors.incrementAndGet();
            return ToolExecutionResult.timedOut(toolName, e.getMessage(), null);
        } catch (OperationFailedException e) {
            executionErrors.incrementAndGet();
            return ToolExecutionResult.failed(toolName, e.getMessage(), null);
        }
    }

    /**
     * Queues a tool execution whose result is discarded.
     *
     * @return {@code false} if the request could not be queued.
     */
    public boolean executeToolAsync(String toolName, Map<String, Object> parameters, String handlerName) {
        return submit(new ExecuteToolRequest(handlerName, null, toolName, parameters));
    }

    /**
     * @return The sorted names of all tools declared by available providers.
     */
    public List<String> getAvailableTools() {
        Set<String> tools = new TreeSet<>();
        for (RegisteredProvider provider : registry.getProviders(serviceType)) {
            provider.getCapabilities().stream()
                .filter(c -> c.startsWith(TOOL_CAPABILITY_PREFIX))
                .map(c -> c.substring(TOOL_CAPABILITY_PREFIX.length()))
                .forEach(tools::add);
        }
        return new ArrayList<>(tools);
    }

    /**
     * @return The tool description from the first provider offering the tool, empty if none does.
     * @throws OperationFailedException if every attempted provider failed.
     */
    public Optional<ToolInfo> getToolInfo(String toolName) throws OperationFailedException {
        return invokeWithFallback("get_tool_info", Set.of(toolCapability(toolName)),
            provider -> provider.getToolInfo(toolName).orElse(null));
    }

    /**
     * @return Descriptions of every available tool. Tools whose description cannot be read are left out.
     */
    public List<ToolInfo> getAllToolInfo() {
        List<ToolInfo> infos = new ArrayList<>();
        for (String tool : getAvailableTools()) {
            try {
                getToolInfo(tool).ifPresent(infos::add);
            } catch (OperationFailedException e) {
                log.warn("Could not read description of tool '{}': {}", tool, e.getMessage());
            }
        }
        return infos;
    }

    /**
     * @return {@code true} if a provider offering the tool accepts the parameters.
     * @throws OperationFailedException if every attempted provider failed.
     */
    public boolean validateParameters(String toolName, Map<String, Object> parameters) throws OperationFailedException {
        return invokeWithFallback("validate_parameters", Set.of(toolCapability(toolName)),
            provider -> provider.validateParameters(toolName, parameters)).orElse(false);
    }

    @Override
    protected void processMessage(BusMessage message) throws Exception {
        if (!(message instanceof ExecuteToolRequest request)) {
            throw new BusOperationException("Unsupported message type " + message.getClass().getSimpleName());
        }
        ToolExecutionResult result = executeTool(request.getToolName(), request.getParameters(), request.getHandlerName());
        if (!result.success()) {
            throw new BusOperationException("Tool '" + request.getToolName() + "' finished with " + result.status()
                + ": " + result.error());
        }
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("tool_executions_total", executions.get());
        metrics.put("tool_errors_total", executionErrors.get());
    }
}
