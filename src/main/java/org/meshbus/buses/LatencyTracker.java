package org.meshbus.buses;

import org.meshbus.registry.ProviderHandle;

import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Running average of call latencies per registration, used by the latency based selection.
 * <p>
 * Samples are keyed by {@link ProviderHandle}, so a provider registered again under the same
 * name starts unmeasured. Failed attempts are recorded too, with the penalty chosen by the bus.
 * <p>
 * <strong>Thread Safety:</strong> Lock-free, counters are atomic. An average read concurrently
 * with a recording may lag by one sample.
 */
public class LatencyTracker {

    private final Map<ProviderHandle, Sample> samples = new ConcurrentHashMap<>();

    /**
     * Records the latency of an attempt.
     *
     * @param handle       The registration that served the attempt.
     * @param latencyNanos The latency in nanoseconds.
     */
    public void record(ProviderHandle handle, long latencyNanos) {
        Sample sample = samples.computeIfAbsent(handle, k -> new Sample());
        sample.totalNanos.addAndGet(latencyNanos);
        sample.count.incrementAndGet();
    }

    /**
     * @return The average latency in milliseconds, empty if the registration was never measured.
     */
    public OptionalDouble getAverageMillis(ProviderHandle handle) {
        Sample sample = samples.get(handle);
        if (sample == null) {
            return OptionalDouble.empty();
        }
        long count = sample.count.get();
        if (count == 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(sample.totalNanos.get() / (double) count / 1_000_000.0);
    }

    public long getSampleCount(ProviderHandle handle) {
        Sample sample = samples.get(handle);
        return sample == null ? 0 : sample.count.get();
    }

    private static final class Sample {
        private final AtomicLong totalNanos = new AtomicLong();
        private final AtomicLong count = new AtomicLong();
    }
}
