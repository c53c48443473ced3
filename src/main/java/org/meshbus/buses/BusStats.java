package org.meshbus.buses;

import org.meshbus.api.providers.ServiceType;

/**
 * Counters of a bus at one point in time.
 *
 * @param serviceType The bus's service type.
 * @param queueSize   Messages waiting in the queue.
 * @param processed   Messages handled successfully.
 * @param failed      Messages that failed, including dropped ones.
 * @param dropped     Messages rejected because the queue was full or the bus was stopping.
 * @param running     Whether the consumer loop runs.
 */
public record BusStats(
    ServiceType serviceType,
    int queueSize,
    long processed,
    long failed,
    long dropped,
    boolean running
) {
}
