package org.meshbus.api.providers;

/**
 * Queue status of the agent's processor.
 *
 * @param processorName Name of the processor.
 * @param queueSize     Items currently queued.
 * @param maxSize       Queue capacity.
 */
public record ProcessorQueueStatus(String processorName, int queueSize, int maxSize) {

    /**
     * Status reported when no runtime control provider is available.
     */
    public static ProcessorQueueStatus unknown() {
        return new ProcessorQueueStatus("unknown", 0, 0);
    }
}
