package org.meshbus.api.providers;

import java.util.List;

/**
 * A provider that answers language model calls.
 * <p>
 * Implementations signal upstream rate limiting by throwing
 * {@link org.meshbus.api.errors.RateLimitedException}.
 */
public interface ILlmProvider extends IProvider {

    LlmResponse callLlm(List<LlmMessage> messages, int maxTokens, double temperature) throws Exception;

    List<String> getAvailableModels() throws Exception;
}
