package org.meshbus.buses.llm;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.meshbus.api.errors.BusOperationException;
import org.meshbus.api.errors.OperationFailedException;
import org.meshbus.api.errors.ProviderUnavailableException;
import org.meshbus.api.errors.RateLimitedException;
import org.meshbus.api.providers.ILlmProvider;
import org.meshbus.api.providers.LlmMessage;
import org.meshbus.api.providers.LlmResponse;
import org.meshbus.api.providers.ServiceType;
import org.meshbus.buses.AbstractBus;
import org.meshbus.buses.BusMessage;
import org.meshbus.registry.RegisteredProvider;
import org.meshbus.registry.SelectionStrategy;
import org.meshbus.registry.ServiceRegistry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Routes language model calls, with domain isolation and rate limit cooldowns.
 * <p>
 * <strong>Domain routing:</strong> providers carry a {@value #DOMAIN_KEY} metadata tag. A call
 * naming a domain only reaches providers tagged with exactly that domain; a call without a
 * domain only reaches providers tagged {@value #GENERAL_DOMAIN} or not tagged at all.
 * <p>
 * <strong>Rate limiting:</strong> a provider raising {@link RateLimitedException} is not
 * counted as a breaker failure. It is left out of routing until its cooldown ends, which is
 * the retry-after it reported or {@code rateLimitCooldown} (default 60s). Its next success
 * clears the cooldown.
 * <p>
 * The default selection strategy is {@link SelectionStrategy#LATENCY_BASED}. Callers cannot
 * degrade without an answer, so an empty provider set raises {@link ProviderUnavailableException}.
 */
public class LlmBus extends AbstractBus<ILlmProvider> {

    public static final String DOMAIN_KEY = "domain";
    public static final String GENERAL_DOMAIN = "general";

    private final Clock clock;
    private final Duration rateLimitCooldown;
    private final Map<String, Instant> rateLimitedUntil = new ConcurrentHashMap<>();
    private final Map<String, ProviderCounters> counters = new ConcurrentHashMap<>();
    private final AtomicLong requests = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private final AtomicLong rateLimited = new AtomicLong();
    private final AtomicLong tokensUsed = new AtomicLong();

    public LlmBus(ServiceRegistry registry, Config options) {
        super(ServiceType.LLM, ILlmProvider.class, registry, options, SelectionStrategy.LATENCY_BASED);
        Config defaults = ConfigFactory.parseMap(Map.of("rateLimitCooldown", "60s"));
        this.rateLimitCooldown = options.withFallback(defaults).getDuration("rateLimitCooldown");
        this.clock = registry.getClock();
    }

    public LlmResponse callLlm(List<LlmMessage> messages, int maxTokens, double temperature, String handlerName)
        throws ProviderUnavailableException, OperationFailedException {
        return callLlm(messages, maxTokens, temperature, handlerName, null);
    }

    /**
     * Calls a language model.
     *
     * @param messages    The conversation.
     * @param maxTokens   Completion limit.
     * @param temperature Sampling temperature.
     * @param handlerName The requesting handler.
     * @param domain      Required provider domain, null for general providers.
     * @return The model's answer.
     * @throws ProviderUnavailableException if no provider of the domain is available.
     * @throws OperationFailedException     if every attempted provider failed.
     */
    public LlmResponse callLlm(List<LlmMessage> messages, int maxTokens, double temperature, String handlerName,
                               String domain) throws ProviderUnavailableException, OperationFailedException {
        requests.incrementAndGet();
        Map<String, String> filter = domain == null ? Map.of() : Map.of(DOMAIN_KEY, domain);
        Optional<LlmResponse> response;
        try {
            response = invokeWithFallback("call_llm", Set.of(), filter, getCallTimeout(),
                provider -> provider.callLlm(messages, maxTokens, temperature));
        } catch (OperationFailedException e) {
            failures.incrementAndGet();
            throw e;
        }

        if (response.isEmpty()) {
            failures.incrementAndGet();
            String target = domain == null ? GENERAL_DOMAIN : domain;
            log.warn("No LLM provider available for domain '{}' (requested by {})", target, handlerName);
            recordError("NO_PROVIDER", "No LLM provider available", "domain=" + target + ", handler=" + handlerName);
            throw new ProviderUnavailableException("No LLM provider available for domain '" + target + "'");
        }
        if (response.get().usage() != null) {
            tokensUsed.addAndGet(response.get().usage().tokensUsed());
        }
        return response.get();
    }

    /**
     * @return Models offered by the first available general provider, empty if there is none.
     * @throws OperationFailedException if every attempted provider failed.
     */
    public List<String> getAvailableModels(String handlerName) throws OperationFailedException {
        return invokeWithFallback("get_available_models", Set.of(), ILlmProvider::getAvailableModels)
            .orElse(List.of());
    }

    /**
     * @return Statistics per provider that was attempted at least once.
     */
    public Map<String, LlmProviderMetrics> getProviderStats() {
        Map<String, LlmProviderMetrics> stats = new LinkedHashMap<>();
        for (RegisteredProvider provider : registry.getAllProviders(serviceType)) {
            ProviderCounters c = counters.get(provider.getName());
            if (c == null) {
                continue;
            }
            stats.put(provider.getName(), new LlmProviderMetrics(
                provider.getName(),
                c.requests.get(),
                c.failures.get(),
                getLatencyTracker().getAverageMillis(provider.getHandle()).orElse(0.0),
                c.consecutiveFailures.get(),
                c.rateLimited.get(),
                rateLimitedUntil.get(provider.getName()),
                provider.getCircuitBreaker().getState()));
        }
        return stats;
    }

    /**
     * Restricts calls without a domain to general providers.
     */
    @Override
    protected List<RegisteredProvider> eligibleProviders(Set<String> requiredCapabilities, Map<String, String> metadataFilter) {
        List<RegisteredProvider> providers = super.eligibleProviders(requiredCapabilities, metadataFilter);
        if (metadataFilter.containsKey(DOMAIN_KEY)) {
            return providers;
        }
        return providers.stream()
            .filter(p -> {
                String domain = p.getMetadata().get(DOMAIN_KEY);
                return domain == null || GENERAL_DOMAIN.equals(domain);
            })
            .collect(Collectors.toList());
    }

    @Override
    protected boolean isEligible(RegisteredProvider provider) {
        Instant until = rateLimitedUntil.get(provider.getName());
        if (until != null && clock.instant().isBefore(until)) {
            log.debug("Skipping LLM provider '{}', rate limited until {}", provider.getName(), until);
            return false;
        }
        return true;
    }

    @Override
    protected void onRateLimited(RegisteredProvider provider, RateLimitedException e) {
        Duration cooldown = e.getRetryAfter().orElse(rateLimitCooldown);
        Instant until = clock.instant().plus(cooldown);
        rateLimitedUntil.put(provider.getName(), until);
        rateLimited.incrementAndGet();
        ProviderCounters c = countersFor(provider);
        c.requests.incrementAndGet();
        c.rateLimited.incrementAndGet();
        log.warn("LLM provider '{}' is rate limited, cooling down for {}s", provider.getName(), cooldown.toSeconds());
    }

    @Override
    protected void onAttemptSucceeded(RegisteredProvider provider, long latencyNanos) {
        ProviderCounters c = countersFor(provider);
        c.requests.incrementAndGet();
        c.consecutiveFailures.set(0);
        if (rateLimitedUntil.remove(provider.getName()) != null) {
            log.debug("Cleared rate limit cooldown of LLM provider '{}'", provider.getName());
        }
    }

    @Override
    protected void onAttemptFailed(RegisteredProvider provider, Exception error) {
        ProviderCounters c = countersFor(provider);
        c.requests.incrementAndGet();
        c.failures.incrementAndGet();
        c.consecutiveFailures.incrementAndGet();
    }

    @Override
    protected void processMessage(BusMessage message) throws Exception {
        throw new BusOperationException("LlmBus only serves synchronous calls, got " + message.getClass().getSimpleName());
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("llm_requests_total", requests.get());
        metrics.put("llm_failures_total", failures.get());
        metrics.put("llm_rate_limited_total", rateLimited.get());
        metrics.put("llm_tokens_total", tokensUsed.get());
    }

    private ProviderCounters countersFor(RegisteredProvider provider) {
        return counters.computeIfAbsent(provider.getName(), k -> new ProviderCounters());
    }

    private static final class ProviderCounters {
        private final AtomicLong requests = new AtomicLong();
        private final AtomicLong failures = new AtomicLong();
        private final AtomicLong consecutiveFailures = new AtomicLong();
        private final AtomicLong rateLimited = new AtomicLong();
    }
}
