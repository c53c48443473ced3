package org.meshbus.buses;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.meshbus.api.errors.OperationFailedException;
import org.meshbus.api.errors.OperationTimeoutException;
import org.meshbus.api.errors.RateLimitedException;
import org.meshbus.api.providers.IProvider;
import org.meshbus.api.providers.ServiceType;
import org.meshbus.api.resources.IMonitorable;
import org.meshbus.api.resources.OperationalError;
import org.meshbus.registry.RegisteredProvider;
import org.meshbus.registry.SelectionStrategy;
import org.meshbus.registry.ServiceRegistry;
import org.meshbus.registry.breaker.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Base class of all buses: a bounded queue drained by a dedicated consumer thread, and
 * circuit-breaker guarded provider invocation with strategy based selection and fallback.
 * <p>
 * Subclasses implement {@link #processMessage(BusMessage)} for their queued operations and
 * use {@link #invokeWithFallback} for synchronous ones.
 * <p>
 * <strong>Configuration</strong> (all optional):
 * <ul>
 *   <li>{@code queueCapacity} - bound of the queue, default 1000</li>
 *   <li>{@code pollInterval} - how long the consumer waits for a message, default 100ms</li>
 *   <li>{@code callTimeout} - timeout of a single provider call, default 30s</li>
 *   <li>{@code shutdownGracePeriod} - time allowed to drain the queue on stop, default 5s</li>
 *   <li>{@code strategy} - selection strategy for providers that registered none</li>
 * </ul>
 * <p>
 * <strong>Error Handling:</strong> A failing queued message is logged at WARN, recorded via
 * {@link #recordError(String, String, String)} and counted as failed; the consumer loop
 * keeps running. Failed provider attempts are logged at DEBUG while fallback continues; only
 * the exhausted operation is logged at WARN.
 *
 * @param <P> The provider interface served by this bus.
 */
public abstract class AbstractBus<P extends IProvider> implements IMonitorable {

    /**
     * Lifecycle states of a bus.
     */
    public enum State {
        STOPPED,
        RUNNING,
        STOPPING
    }

    protected final Logger log = LoggerFactory.getLogger(this.getClass());
    protected final ServiceType serviceType;
    protected final ServiceRegistry registry;
    protected final Config options;

    private final Class<P> providerInterface;
    private final ArrayBlockingQueue<BusMessage> queue;
    private final int queueCapacity;
    private final Duration pollInterval;
    private final Duration callTimeout;
    private final Duration shutdownGracePeriod;
    private final SelectionStrategy defaultStrategy;
    private final LatencyTracker latencyTracker = new LatencyTracker();
    private final ProviderSelector selector = new ProviderSelector(latencyTracker);
    private final ExecutorService invoker;
    private final AtomicReference<State> currentState = new AtomicReference<>(State.STOPPED);
    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private volatile boolean accepting;
    private Thread busThread;

    /**
     * Bounded collection of operational errors, oldest removed first.
     * Private to enforce use of {@link #recordError(String, String, String)}.
     */
    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();

    /**
     * Maximum number of errors to keep in memory.
     */
    protected int getMaxErrors() {
        return 10000;
    }

    /**
     * @param serviceType       The service type this bus routes.
     * @param providerInterface The provider interface of that type.
     * @param registry          The registry providers are looked up in.
     * @param options           The bus's configuration block, may be empty.
     * @param defaultStrategy   Strategy used when neither configuration nor provider set one.
     * @throws IllegalArgumentException if the configuration is invalid.
     */
    protected AbstractBus(ServiceType serviceType, Class<P> providerInterface, ServiceRegistry registry,
                          Config options, SelectionStrategy defaultStrategy) {
        this.serviceType = serviceType;
        this.providerInterface = providerInterface;
        this.registry = registry;
        this.options = options;

        Config defaults = ConfigFactory.parseMap(Map.of(
            "queueCapacity", 1000,
            "pollInterval", "100ms",
            "callTimeout", "30s",
            "shutdownGracePeriod", "5s",
            "strategy", defaultStrategy.name()
        ));
        Config finalConfig = options.withFallback(defaults);

        try {
            this.queueCapacity = finalConfig.getInt("queueCapacity");
            this.pollInterval = finalConfig.getDuration("pollInterval");
            this.callTimeout = finalConfig.getDuration("callTimeout");
            this.shutdownGracePeriod = finalConfig.getDuration("shutdownGracePeriod");
            this.defaultStrategy = finalConfig.getEnum(SelectionStrategy.class, "strategy");
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid configuration for " + getClass().getSimpleName(), e);
        }
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be positive for " + getClass().getSimpleName() + ".");
        }
        if (callTimeout.isZero() || callTimeout.isNegative()) {
            throw new IllegalArgumentException("callTimeout must be positive for " + getClass().getSimpleName() + ".");
        }
        this.queue = new ArrayBlockingQueue<>(queueCapacity);
        this.invoker = Executors.newCachedThreadPool(daemonThreads(getClass().getSimpleName() + "-call-"));
    }

    /**
     * Starts the consumer thread and begins accepting messages.
     *
     * @throws IllegalStateException if the bus is not stopped.
     */
    public final void start() {
        if (!currentState.compareAndSet(State.STOPPED, State.RUNNING)) {
            throw new IllegalStateException(String.format("Cannot start %s as it is in state %s",
                getClass().getSimpleName(), getCurrentState()));
        }
        accepting = true;
        busThread = new Thread(this::runLoop);
        busThread.setName(this.getClass().getSimpleName());
        busThread.setDaemon(true);
        busThread.start();
        log.info("{} started (capacity={}, strategy={})", getClass().getSimpleName(), queueCapacity, defaultStrategy);
    }

    /**
     * Stops accepting messages, drains the queue within the shutdown grace period and then
     * interrupts the consumer thread. Messages still queued at that point are counted as
     * dropped. Calling stop on a stopped bus does nothing.
     */
    public final void stop() {
        if (!currentState.compareAndSet(State.RUNNING, State.STOPPING)) {
            log.debug("{} is {}, nothing to stop", getClass().getSimpleName(), getCurrentState());
            return;
        }
        accepting = false;

        try {
            busThread.join(shutdownGracePeriod.toMillis());
            if (busThread.isAlive()) {
                busThread.interrupt();
                busThread.join(1000);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{} interrupted while waiting for the consumer thread to stop", getClass().getSimpleName());
            busThread.interrupt();
        }

        List<BusMessage> remaining = new ArrayList<>();
        queue.drainTo(remaining);
        if (!remaining.isEmpty()) {
            dropped.addAndGet(remaining.size());
            failed.addAndGet(remaining.size());
            log.warn("{} stopped with {} undelivered messages after {}ms grace period",
                getClass().getSimpleName(), remaining.size(), shutdownGracePeriod.toMillis());
            recordError("SHUTDOWN_DROPPED", "Messages dropped on shutdown", "count=" + remaining.size());
        }
        if (busThread.isAlive()) {
            log.error("{} consumer thread did not stop", getClass().getSimpleName());
        }
        currentState.set(State.STOPPED);
        log.debug("{} stopped", getClass().getSimpleName());
    }

    public State getCurrentState() {
        return currentState.get();
    }

    public boolean isRunning() {
        return currentState.get() == State.RUNNING;
    }

    /**
     * Queues a message without blocking.
     *
     * @return {@code false} if the queue is full or the bus does not accept messages.
     */
    public boolean submit(BusMessage message) {
        if (!accepting) {
            dropped.incrementAndGet();
            failed.incrementAndGet();
            log.warn("{} is not accepting messages, dropped {}", getClass().getSimpleName(), message);
            return false;
        }
        if (!queue.offer(message)) {
            dropped.incrementAndGet();
            failed.incrementAndGet();
            log.warn("{} queue full ({}), dropped {}", getClass().getSimpleName(), queueCapacity, message);
            recordError("QUEUE_OVERFLOW", "Queue full, message dropped", message.toString());
            return false;
        }
        return true;
    }

    public BusStats getStats() {
        return new BusStats(serviceType, queue.size(), processed.get(), failed.get(), dropped.get(), isRunning());
    }

    public ServiceType getServiceType() {
        return serviceType;
    }

    public SelectionStrategy getDefaultStrategy() {
        return defaultStrategy;
    }

    public Duration getCallTimeout() {
        return callTimeout;
    }

    public LatencyTracker getLatencyTracker() {
        return latencyTracker;
    }

    private void runLoop() {
        try {
            while (true) {
                BusMessage message = queue.poll(pollInterval.toMillis(), TimeUnit.MILLISECONDS);
                if (message == null) {
                    if (currentState.get() != State.RUNNING) {
                        break;
                    }
                    continue;
                }
                handle(message);
            }
        } catch (InterruptedException e) {
            log.debug("{} consumer thread interrupted, shutting down.", getClass().getSimpleName());
            Thread.currentThread().interrupt();
        } finally {
            log.debug("Consumer thread for {} has terminated.", getClass().getSimpleName());
        }
    }

    private void handle(BusMessage message) throws InterruptedException {
        try {
            processMessage(message);
            processed.incrementAndGet();
        } catch (InterruptedException e) {
            failed.incrementAndGet();
            throw e;
        } catch (Exception e) {
            failed.incrementAndGet();
            log.warn("{} failed to process {}: {}", getClass().getSimpleName(), message, e.getMessage());
            log.debug("Message failure details:", e);
            recordError("MESSAGE_FAILED", String.valueOf(e.getMessage()), message.toString());
        }
    }

    /**
     * Handles one queued message on the consumer thread. Throwing marks the message as failed;
     * the loop continues with the next message.
     *
     * @throws InterruptedException if interrupted while waiting on a provider.
     * @throws Exception            if the message could not be handled.
     */
    protected abstract void processMessage(BusMessage message) throws Exception;

    /**
     * Invokes an operation with the bus's call timeout and no metadata filter.
     *
     * @see #invokeWithFallback(String, Set, Map, Duration, ProviderCall)
     */
    protected <R> Optional<R> invokeWithFallback(String operation, Set<String> requiredCapabilities,
                                                 ProviderCall<P, R> call) throws OperationFailedException {
        return invokeWithFallback(operation, requiredCapabilities, Map.of(), callTimeout, call);
    }

    /**
     * Looks up the available providers, applies the selection strategy and invokes the call on
     * the selected providers in turn until one succeeds.
     * <p>
     * Each attempt is gated by the provider's breaker and its health check. A provider whose
     * breaker refuses the call is passed over for the next candidate, also when the strategy
     * allows a single attempt. Successes and failures, timeouts included, are recorded on the
     * breaker and the latency statistics exactly once per attempt. A
     * {@link RateLimitedException} is passed to {@link #onRateLimited} and does not count
     * as a failure.
     *
     * @param operation            Name of the operation for logging.
     * @param requiredCapabilities Capabilities the provider must declare.
     * @param metadataFilter       Metadata the provider must carry.
     * @param timeout              Timeout of a single attempt.
     * @param call                 The operation.
     * @return The result, or empty if no provider was available. A null result is also empty.
     * @throws OperationFailedException if every attempted provider failed; an
     *                                  {@link OperationTimeoutException} if the last one timed out.
     */
    protected <R> Optional<R> invokeWithFallback(String operation, Set<String> requiredCapabilities,
                                                 Map<String, String> metadataFilter, Duration timeout,
                                                 ProviderCall<P, R> call) throws OperationFailedException {
        List<RegisteredProvider> candidates = eligibleProviders(requiredCapabilities, metadataFilter);
        ProviderSelector.Plan plan = selector.select(candidates, defaultStrategy);
        if (plan.isEmpty()) {
            log.debug("No {} provider available for {} (capabilities={})", serviceType, operation, requiredCapabilities);
            return Optional.empty();
        }

        OperationFailedException lastError = null;
        int attempted = 0;
        for (RegisteredProvider candidate : plan.candidates()) {
            if (plan.singleAttempt() && attempted > 0) {
                break;
            }
            CircuitBreaker breaker = candidate.getCircuitBreaker();
            if (!breaker.tryAcquirePermission()) {
                log.debug("Breaker of '{}' refused {}, trying next candidate", candidate.getName(), operation);
                continue;
            }
            attempted++;
            P provider = candidate.getProvider(providerInterface);
            if (!isProviderHealthy(candidate, provider)) {
                lastError = new OperationFailedException(candidate.getName(),
                    operation + " skipped unhealthy provider '" + candidate.getName() + "'", null);
                recordAttemptFailure(candidate, lastError, timeout);
                continue;
            }

            long start = System.nanoTime();
            try {
                R result = callWithTimeout(provider, timeout, call);
                recordAttemptSuccess(candidate, System.nanoTime() - start);
                return Optional.ofNullable(result);
            } catch (RateLimitedException e) {
                breaker.releasePermission();
                onRateLimited(candidate, e);
                lastError = new OperationFailedException(candidate.getName(),
                    operation + " rate limited by '" + candidate.getName() + "'", e);
            } catch (TimeoutException e) {
                recordAttemptFailure(candidate, e, timeout);
                lastError = new OperationTimeoutException(candidate.getName(), timeout);
            } catch (InterruptedException e) {
                breaker.releasePermission();
                Thread.currentThread().interrupt();
                throw new OperationFailedException(candidate.getName(), operation + " interrupted", e);
            } catch (Exception e) {
                recordAttemptFailure(candidate, e, timeout);
                lastError = new OperationFailedException(candidate.getName(),
                    operation + " failed on '" + candidate.getName() + "': " + e.getMessage(), e);
            }
            log.debug("{} attempt on '{}' failed: {}", operation, candidate.getName(), lastError.getMessage());
        }

        if (lastError == null) {
            log.debug("No {} provider permitted a call for {}", serviceType, operation);
            return Optional.empty();
        }
        log.warn("{} failed on all {} attempted {} providers, last error: {}",
            operation, attempted, serviceType, lastError.getMessage());
        recordError("OPERATION_FAILED", lastError.getMessage(), "operation=" + operation);
        throw lastError;
    }

    /**
     * Returns the available providers matching the filters, in registry order, minus those
     * rejected by {@link #isEligible(RegisteredProvider)}.
     */
    protected List<RegisteredProvider> eligibleProviders(Set<String> requiredCapabilities, Map<String, String> metadataFilter) {
        return registry.getProviders(serviceType, requiredCapabilities, metadataFilter).stream()
            .filter(this::isEligible)
            .collect(Collectors.toList());
    }

    /**
     * Hook to exclude providers beyond capability, metadata and breaker filtering.
     */
    protected boolean isEligible(RegisteredProvider provider) {
        return true;
    }

    /**
     * Hook invoked when a provider signals rate limiting. The default logs it.
     */
    protected void onRateLimited(RegisteredProvider provider, RateLimitedException e) {
        log.debug("Provider '{}' is rate limited: {}", provider.getName(), e.getMessage());
    }

    /**
     * Hook invoked after every successful attempt, after breaker and latency bookkeeping.
     */
    protected void onAttemptSucceeded(RegisteredProvider provider, long latencyNanos) {
        // Default: nothing
    }

    /**
     * Hook invoked after every failed attempt, after breaker bookkeeping.
     */
    protected void onAttemptFailed(RegisteredProvider provider, Exception error) {
        // Default: nothing
    }

    /**
     * Records a successful attempt on the provider's breaker and latency statistics.
     */
    protected final void recordAttemptSuccess(RegisteredProvider provider, long latencyNanos) {
        provider.getCircuitBreaker().recordSuccess();
        latencyTracker.record(provider.getHandle(), latencyNanos);
        onAttemptSucceeded(provider, latencyNanos);
    }

    /**
     * Records a failed attempt on the provider's breaker and latency statistics. A failed
     * attempt is measured as if it had used up the whole attempt timeout.
     *
     * @param timeout The timeout the attempt ran under.
     */
    protected final void recordAttemptFailure(RegisteredProvider provider, Exception error, Duration timeout) {
        provider.getCircuitBreaker().recordFailure();
        latencyTracker.record(provider.getHandle(), timeout.toNanos());
        log.debug("Provider '{}' failure details:", provider.getName(), error);
        onAttemptFailed(provider, error);
    }

    /**
     * Runs a call on the invocation executor and waits for it at most {@code timeout}.
     * A timed out call is cancelled.
     *
     * @throws TimeoutException     if the call did not finish in time.
     * @throws InterruptedException if the waiting thread was interrupted.
     * @throws Exception            whatever the provider raised.
     */
    protected final <R> R callWithTimeout(P provider, Duration timeout, ProviderCall<P, R> call) throws Exception {
        Future<R> future = invoker.submit(() -> call.invoke(provider));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException | InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    /**
     * Submits a call to the invocation executor without waiting for it. Used by fan-out
     * operations that collect several results.
     */
    protected final <R> Future<R> submitCall(P provider, ProviderCall<P, R> call) {
        return invoker.submit(() -> call.invoke(provider));
    }

    protected final ExecutorService getInvoker() {
        return invoker;
    }

    protected final Class<P> getProviderInterface() {
        return providerInterface;
    }

    /**
     * Runs the provider's health check. A check that throws counts as unhealthy.
     */
    protected final boolean isProviderHealthy(RegisteredProvider candidate, P provider) {
        try {
            if (provider.isHealthy()) {
                return true;
            }
            log.debug("Provider '{}' reported unhealthy", candidate.getName());
        } catch (RuntimeException e) {
            log.debug("Health check of provider '{}' failed: {}", candidate.getName(), e.getMessage());
        }
        return false;
    }

    /**
     * Records an operational error. Use for transient errors only; the bus keeps running.
     * The collection is bounded by {@link #getMaxErrors()}.
     *
     * @param code    Error code for categorization (e.g., "QUEUE_OVERFLOW", "OPERATION_FAILED")
     * @param message Human-readable error message
     * @param details Additional context about the error
     */
    protected void recordError(String code, String message, String details) {
        errors.add(new OperationalError(Instant.now(), code, message, details));
        int maxErrors = getMaxErrors();
        while (errors.size() > maxErrors) {
            errors.pollFirst();
        }
    }

    @Override
    public List<OperationalError> getErrors() {
        return new ArrayList<>(errors);
    }

    @Override
    public void clearErrors() {
        errors.clear();
    }

    /**
     * A bus is healthy while no operational error is recorded.
     */
    @Override
    public boolean isHealthy() {
        return errors.isEmpty();
    }

    /**
     * Returns base metrics ({@code error_count}, {@code processed}, {@code failed},
     * {@code dropped}, {@code queue_size}, {@code queue_capacity}) followed by the
     * metrics added in {@link #addCustomMetrics(Map)}.
     */
    @Override
    public final Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("error_count", errors.size());
        metrics.put("processed", processed.get());
        metrics.put("failed", failed.get());
        metrics.put("dropped", dropped.get());
        metrics.put("queue_size", queue.size());
        metrics.put("queue_capacity", queueCapacity);
        addCustomMetrics(metrics);
        return metrics;
    }

    /**
     * Hook for subclasses to add bus-specific metrics. Always call
     * {@code super.addCustomMetrics(metrics)} first.
     *
     * @param metrics Mutable map already containing the base metrics.
     */
    protected void addCustomMetrics(Map<String, Number> metrics) {
        // Default: no custom metrics
    }

    private static java.util.concurrent.ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
