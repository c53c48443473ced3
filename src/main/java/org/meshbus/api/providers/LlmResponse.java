package org.meshbus.api.providers;

/**
 * Answer of a language model provider.
 *
 * @param content Generated text.
 * @param usage   Resources consumed by the call.
 */
public record LlmResponse(String content, ResourceUsage usage) {
}
