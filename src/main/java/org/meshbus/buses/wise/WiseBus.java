package org.meshbus.buses.wise;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.meshbus.api.errors.BusOperationException;
import org.meshbus.api.errors.CapabilityProhibitedException;
import org.meshbus.api.errors.OperationFailedException;
import org.meshbus.api.errors.RateLimitedException;
import org.meshbus.api.providers.DeferralRequest;
import org.meshbus.api.providers.GuidanceContext;
import org.meshbus.api.providers.GuidanceRequest;
import org.meshbus.api.providers.GuidanceResponse;
import org.meshbus.api.providers.IWiseAuthorityProvider;
import org.meshbus.api.providers.ServiceType;
import org.meshbus.buses.AbstractBus;
import org.meshbus.buses.BusMessage;
import org.meshbus.buses.ProviderCall;
import org.meshbus.registry.RegisteredProvider;
import org.meshbus.registry.SelectionStrategy;
import org.meshbus.registry.ServiceRegistry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Routes deferrals and guidance requests to wise authorities.
 * <p>
 * <strong>Capability firewall:</strong> every guidance request passes the
 * {@link CapabilityFirewall} before the registry is consulted, so prohibited capabilities are
 * rejected even when no provider is registered.
 * <p>
 * <strong>Fan-out:</strong> deferrals go to every available authority, guidance requests to at
 * most {@code maxFanOut} authorities declaring the requested capability. Calls run
 * concurrently and are collected until the operation's timeout; authorities that did not
 * answer by then are cancelled and their breaker records one failure.
 * <p>
 * <strong>Arbitration:</strong> the answer with the highest confidence wins; on equal
 * confidence the earlier answer wins. Without any answer a degraded response is returned.
 * <p>
 * When no authority declares the requested capability, the first authority declaring
 * {@value #FETCH_GUIDANCE} is asked the question instead and its free-form answer is wrapped
 * into a {@link GuidanceResponse}.
 */
public class WiseBus extends AbstractBus<IWiseAuthorityProvider> {

    public static final String FETCH_GUIDANCE = "fetch_guidance";
    static final String BUS_WA_ID = "wisebus";
    static final String LEGACY_WA_ID = "legacy";
    static final String LEGACY_REASONING = "Legacy guidance response";

    private final CapabilityFirewall firewall;
    private final Duration guidanceTimeout;
    private final Duration deferralTimeout;
    private final int maxFanOut;
    private final AtomicLong guidanceRequests = new AtomicLong();
    private final AtomicLong degradedResponses = new AtomicLong();
    private final AtomicLong deferralsSent = new AtomicLong();
    private final AtomicLong deferralsAcknowledged = new AtomicLong();
    private final AtomicLong firewallRejections = new AtomicLong();

    /**
     * @param registry The registry.
     * @param options  The {@code wise} configuration block, may be empty.
     * @throws IllegalArgumentException if the configuration is invalid.
     */
    public WiseBus(ServiceRegistry registry, Config options) {
        super(ServiceType.WISE_AUTHORITY, IWiseAuthorityProvider.class, registry, options, SelectionStrategy.FALLBACK);
        Config defaults = ConfigFactory.parseMap(Map.of(
            "guidanceTimeout", "5s",
            "deferralTimeout", "10s",
            "maxFanOut", 5
        ));
        Config finalConfig = options.withFallback(defaults);
        this.guidanceTimeout = finalConfig.getDuration("guidanceTimeout");
        this.deferralTimeout = finalConfig.getDuration("deferralTimeout");
        this.maxFanOut = finalConfig.getInt("maxFanOut");
        if (maxFanOut < 1) {
            throw new IllegalArgumentException("maxFanOut must be at least 1, was " + maxFanOut);
        }
        this.firewall = new CapabilityFirewall(registry.getAuditTrail());
    }

    /**
     * Sends a deferral to every available wise authority and waits for their acknowledgements
     * up to {@code deferralTimeout}.
     *
     * @return {@code true} if at least one authority acknowledged.
     */
    public boolean sendDeferral(DeferralRequest request, String handlerName) {
        deferralsSent.incrementAndGet();
        List<RegisteredProvider> providers = eligibleProviders(Set.of(), Map.of());
        if (providers.isEmpty()) {
            log.warn("No wise authority available for deferral of task '{}' from {}", request.taskId(), handlerName);
            recordError("NO_PROVIDER", "No wise authority available for deferral", "task=" + request.taskId());
            return false;
        }

        List<Answer<Boolean>> answers;
        try {
            answers = fanOut("send_deferral", providers, deferralTimeout, provider -> provider.sendDeferral(request));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Deferral of task '{}' interrupted", request.taskId());
            return false;
        }

        long acks = answers.stream().filter(a -> Boolean.TRUE.equals(a.result())).count();
        if (acks == 0) {
            log.warn("Deferral of task '{}' was not acknowledged by any of {} wise authorities",
                request.taskId(), providers.size());
            recordError("DEFERRAL_UNACKNOWLEDGED", "No wise authority acknowledged the deferral", "task=" + request.taskId());
            return false;
        }
        deferralsAcknowledged.incrementAndGet();
        log.debug("Deferral of task '{}' acknowledged by {}/{} wise authorities", request.taskId(), acks, providers.size());
        return true;
    }

    /**
     * Queues a deferral broadcast.
     *
     * @return {@code false} if the deferral could not be queued.
     */
    public boolean sendDeferralAsync(DeferralRequest request, String handlerName) {
        return submit(new DeferralMessage(handlerName, request));
    }

    /**
     * Asks wise authorities to review something, sent as a deferral.
     *
     * @param reviewType  Kind of review, e.g. {@code "identity_variance"}.
     * @param reviewData  Material to review.
     * @param handlerName The requesting handler.
     * @return {@code true} if at least one authority acknowledged.
     */
    public boolean requestReview(String reviewType, Map<String, String> reviewData, String handlerName) {
        Map<String, String> context = new HashMap<>(reviewData == null ? Map.of() : reviewData);
        context.put("review_type", reviewType);
        context.put("handler_name", handlerName);
        DeferralRequest deferral = new DeferralRequest(
            "review_task_" + reviewType,
            "review_" + reviewType + "_" + handlerName,
            "Review requested: " + reviewType,
            null,
            context);
        return sendDeferral(deferral, handlerName);
    }

    /**
     * Asks a single authority declaring {@value #FETCH_GUIDANCE} a free-form question.
     *
     * @return The guidance, empty if no authority is available or it had none.
     * @throws OperationFailedException if every attempted authority failed.
     */
    public Optional<String> fetchGuidance(GuidanceContext context, String handlerName) throws OperationFailedException {
        log.debug("Fetching guidance for thought '{}' from {}", context.thoughtId(), handlerName);
        return invokeWithFallback(FETCH_GUIDANCE, Set.of(FETCH_GUIDANCE),
            provider -> provider.fetchGuidance(context).orElse(null));
    }

    public GuidanceResponse requestGuidance(GuidanceRequest request) throws CapabilityProhibitedException {
        return requestGuidance(request, guidanceTimeout);
    }

    /**
     * Fans a guidance request out to the authorities declaring its capability and returns the
     * most confident answer.
     *
     * @param request The request.
     * @param timeout How long to collect answers.
     * @return The selected answer, or a degraded response if nobody answered in time.
     * @throws CapabilityProhibitedException if the capability belongs to a prohibited domain.
     */
    public GuidanceResponse requestGuidance(GuidanceRequest request, Duration timeout) throws CapabilityProhibitedException {
        try {
            firewall.check(request.capability(), "request_guidance");
        } catch (CapabilityProhibitedException e) {
            firewallRejections.incrementAndGet();
            throw e;
        }
        guidanceRequests.incrementAndGet();

        Set<String> capabilities = request.capability() == null || request.capability().isBlank()
            ? Set.of()
            : Set.of(request.capability());
        List<RegisteredProvider> providers = eligibleProviders(capabilities, Map.of()).stream()
            .limit(maxFanOut)
            .collect(Collectors.toList());
        ProviderCall<IWiseAuthorityProvider, GuidanceResponse> call = provider -> provider.getGuidance(request);
        if (providers.isEmpty()) {
            providers = eligibleProviders(Set.of(FETCH_GUIDANCE), Map.of()).stream()
                .limit(1)
                .collect(Collectors.toList());
            if (providers.isEmpty()) {
                log.debug("No wise authority declares capability '{}'", request.capability());
                return degraded();
            }
            log.debug("No wise authority declares capability '{}', asking '{}' for free-form guidance",
                request.capability(), providers.get(0).getName());
            call = provider -> legacyGuidance(provider, request);
        }

        List<Answer<GuidanceResponse>> answers;
        try {
            answers = fanOut("request_guidance", providers, timeout, call);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Guidance request interrupted");
            return degraded();
        }

        List<GuidanceResponse> responses = answers.stream()
            .map(Answer::result)
            .filter(r -> r != null)
            .collect(Collectors.toList());
        if (responses.isEmpty()) {
            log.warn("None of {} wise authorities answered guidance request within {}ms",
                providers.size(), timeout.toMillis());
            recordError("NO_GUIDANCE", "No wise authority answered", "capability=" + request.capability());
            return degraded();
        }
        return arbitrate(responses);
    }

    /**
     * Asks a {@value #FETCH_GUIDANCE} authority the request's question and wraps its free-form
     * answer. The first option, if any, is reported as selected.
     *
     * @return The wrapped answer, null if the authority had none.
     */
    private static GuidanceResponse legacyGuidance(IWiseAuthorityProvider provider, GuidanceRequest request) throws Exception {
        String id = UUID.randomUUID().toString();
        GuidanceContext context = new GuidanceContext("guidance_" + id, "task_" + id, request.context(),
            Map.of("urgency", request.urgency()));
        String selected = request.options().isEmpty() ? null : request.options().get(0);
        return provider.fetchGuidance(context)
            .map(text -> new GuidanceResponse(selected, text, LEGACY_REASONING, LEGACY_WA_ID, 0.0))
            .orElse(null);
    }

    /**
     * Picks the response with the highest confidence. The earliest response wins ties.
     */
    static GuidanceResponse arbitrate(List<GuidanceResponse> responses) {
        if (responses.size() == 1) {
            return responses.get(0);
        }
        GuidanceResponse best = responses.get(0);
        for (GuidanceResponse candidate : responses.subList(1, responses.size())) {
            if (candidate.confidence() > best.confidence()) {
                best = candidate;
            }
        }
        return best.withReasoning(String.format(Locale.ROOT, "%s (selected with %.2f confidence from %d providers)",
            best.reasoning(), best.confidence(), responses.size()));
    }

    private GuidanceResponse degraded() {
        degradedResponses.incrementAndGet();
        return new GuidanceResponse(null, "No providers responded", "No guidance available", BUS_WA_ID, 0.0, true);
    }

    /**
     * Invokes all given providers concurrently and collects the answers that arrive within
     * the timeout, in completion order. Stragglers are cancelled and recorded as failures.
     */
    private <R> List<Answer<R>> fanOut(String operation, List<RegisteredProvider> providers, Duration timeout,
                                       ProviderCall<IWiseAuthorityProvider, R> call) throws InterruptedException {
        ExecutorCompletionService<R> completion = new ExecutorCompletionService<>(getInvoker());
        Map<Future<R>, RegisteredProvider> pending = new LinkedHashMap<>();
        long start = System.nanoTime();
        for (RegisteredProvider candidate : providers) {
            if (!candidate.getCircuitBreaker().tryAcquirePermission()) {
                continue;
            }
            IWiseAuthorityProvider provider = candidate.getProvider(IWiseAuthorityProvider.class);
            if (!isProviderHealthy(candidate, provider)) {
                recordAttemptFailure(candidate,
                    new BusOperationException("Wise authority '" + candidate.getName() + "' is unhealthy"), timeout);
                continue;
            }
            pending.put(completion.submit(() -> call.invoke(provider)), candidate);
        }

        List<Answer<R>> answers = new ArrayList<>();
        long deadline = start + timeout.toNanos();
        try {
            while (!pending.isEmpty()) {
                long remaining = deadline - System.nanoTime();
                Future<R> done = remaining > 0 ? completion.poll(remaining, TimeUnit.NANOSECONDS) : null;
                if (done == null) {
                    break;
                }
                RegisteredProvider candidate = pending.remove(done);
                collect(operation, candidate, done, System.nanoTime() - start, timeout, answers);
            }
        } catch (InterruptedException e) {
            pending.forEach((future, candidate) -> {
                future.cancel(true);
                candidate.getCircuitBreaker().releasePermission();
            });
            throw e;
        }

        pending.forEach((future, candidate) -> {
            future.cancel(true);
            log.debug("{} on '{}' did not answer within {}ms", operation, candidate.getName(), timeout.toMillis());
            recordAttemptFailure(candidate, new TimeoutException(operation + " timed out after " + timeout.toMillis() + "ms"), timeout);
        });
        return answers;
    }

    private <R> void collect(String operation, RegisteredProvider candidate, Future<R> done, long latencyNanos,
                             Duration timeout, List<Answer<R>> answers) throws InterruptedException {
        try {
            R result = done.get();
            recordAttemptSuccess(candidate, latencyNanos);
            answers.add(new Answer<>(candidate, result));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RateLimitedException rateLimited) {
                candidate.getCircuitBreaker().releasePermission();
                onRateLimited(candidate, rateLimited);
                return;
            }
            log.debug("{} on '{}' failed: {}", operation, candidate.getName(), String.valueOf(cause));
            recordAttemptFailure(candidate, cause instanceof Exception exception ? exception : e, timeout);
        }
    }

    @Override
    protected void processMessage(BusMessage message) throws Exception {
        if (!(message instanceof DeferralMessage deferral)) {
            throw new BusOperationException("Unsupported message type " + message.getClass().getSimpleName());
        }
        if (!sendDeferral(deferral.getRequest(), deferral.getHandlerName())) {
            throw new BusOperationException("Deferral of task '" + deferral.getRequest().taskId() + "' was not acknowledged");
        }
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("guidance_requests_total", guidanceRequests.get());
        metrics.put("guidance_degraded_total", degradedResponses.get());
        metrics.put("deferrals_sent_total", deferralsSent.get());
        metrics.put("deferrals_acknowledged_total", deferralsAcknowledged.get());
        metrics.put("firewall_rejections_total", firewallRejections.get());
    }

    private record Answer<R>(RegisteredProvider provider, R result) {
    }
}
