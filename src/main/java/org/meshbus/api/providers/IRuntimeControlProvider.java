package org.meshbus.api.providers;

/**
 * A provider that controls the agent's processing loop.
 */
public interface IRuntimeControlProvider extends IProvider {

    RuntimeControlResponse pauseProcessing() throws Exception;

    RuntimeControlResponse resumeProcessing() throws Exception;

    RuntimeControlResponse singleStep() throws Exception;

    ProcessorQueueStatus getProcessorQueueStatus() throws Exception;

    RuntimeControlResponse getRuntimeStatus() throws Exception;

    RuntimeControlResponse shutdownRuntime(String reason) throws Exception;
}
