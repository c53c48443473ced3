package org.meshbus.buses.runtime;

import com.typesafe.config.Config;
import org.meshbus.api.errors.BusOperationException;
import org.meshbus.api.errors.OperationFailedException;
import org.meshbus.api.providers.IRuntimeControlProvider;
import org.meshbus.api.providers.ProcessorQueueStatus;
import org.meshbus.api.providers.RuntimeControlResponse;
import org.meshbus.api.providers.ServiceType;
import org.meshbus.buses.AbstractBus;
import org.meshbus.buses.BusMessage;
import org.meshbus.buses.ProviderCall;
import org.meshbus.registry.SelectionStrategy;
import org.meshbus.registry.ServiceRegistry;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Routes control commands to the runtime's processor.
 * <p>
 * Commands never raise; a missing or failing provider yields an unsuccessful
 * {@link RuntimeControlResponse}. Once a shutdown was accepted every further command is
 * rejected; status queries still pass. A failed shutdown lifts the block again.
 */
public class RuntimeControlBus extends AbstractBus<IRuntimeControlProvider> {

    private final AtomicBoolean shutdownInProgress = new AtomicBoolean();
    private final AtomicLong commands = new AtomicLong();
    private final AtomicLong rejectedCommands = new AtomicLong();
    private final AtomicLong stateQueries = new AtomicLong();

    public RuntimeControlBus(ServiceRegistry registry, Config options) {
        super(ServiceType.RUNTIME_CONTROL, IRuntimeControlProvider.class, registry, options, SelectionStrategy.FALLBACK);
    }

    public RuntimeControlResponse pauseProcessing() {
        return command("pause_processing", IRuntimeControlProvider::pauseProcessing);
    }

    public RuntimeControlResponse resumeProcessing() {
        return command("resume_processing", IRuntimeControlProvider::resumeProcessing);
    }

    public RuntimeControlResponse singleStep() {
        return command("single_step", IRuntimeControlProvider::singleStep);
    }

    /**
     * @return The processor's queue status, {@link ProcessorQueueStatus#unknown()} if it cannot be read.
     */
    public ProcessorQueueStatus getProcessorQueueStatus() {
        stateQueries.incrementAndGet();
        try {
            return invokeWithFallback("get_processor_queue_status", Set.of(),
                IRuntimeControlProvider::getProcessorQueueStatus).orElse(ProcessorQueueStatus.unknown());
        } catch (OperationFailedException e) {
            log.debug("Processor queue status unavailable: {}", e.getMessage());
            return ProcessorQueueStatus.unknown();
        }
    }

    public RuntimeControlResponse getRuntimeStatus() {
        stateQueries.incrementAndGet();
        return call("get_runtime_status", IRuntimeControlProvider::getRuntimeStatus);
    }

    /**
     * Requests a runtime shutdown. Only the first request is forwarded while a shutdown is in progress.
     */
    public RuntimeControlResponse shutdownRuntime(String reason) {
        if (!shutdownInProgress.compareAndSet(false, true)) {
            rejectedCommands.incrementAndGet();
            return RuntimeControlResponse.failure("Shutdown already in progress");
        }
        commands.incrementAndGet();
        log.info("Runtime shutdown requested: {}", reason);
        RuntimeControlResponse response = call("shutdown_runtime", provider -> provider.shutdownRuntime(reason));
        if (!response.success()) {
            shutdownInProgress.set(false);
            log.warn("Runtime shutdown failed: {}", response.error());
        }
        return response;
    }

    public boolean isShutdownInProgress() {
        return shutdownInProgress.get();
    }

    private RuntimeControlResponse command(String operation, ProviderCall<IRuntimeControlProvider, RuntimeControlResponse> call) {
        if (shutdownInProgress.get()) {
            rejectedCommands.incrementAndGet();
            log.debug("Rejected {} during shutdown", operation);
            return RuntimeControlResponse.failure("Cannot " + operation + " while shutdown is in progress");
        }
        commands.incrementAndGet();
        return call(operation, call);
    }

    private RuntimeControlResponse call(String operation, ProviderCall<IRuntimeControlProvider, RuntimeControlResponse> call) {
        try {
            Optional<RuntimeControlResponse> response = invokeWithFallback(operation, Set.of(), call);
            return response.orElseGet(() -> RuntimeControlResponse.failure("No runtime control provider available"));
        } catch (OperationFailedException e) {
            return RuntimeControlResponse.failure(e.getMessage());
        }
    }

    @Override
    protected void processMessage(BusMessage message) throws Exception {
        throw new BusOperationException("RuntimeControlBus only serves synchronous commands, got "
            + message.getClass().getSimpleName());
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("commands_total", commands.get());
        metrics.put("commands_rejected_total", rejectedCommands.get());
        metrics.put("state_queries_total", stateQueries.get());
    }
}
