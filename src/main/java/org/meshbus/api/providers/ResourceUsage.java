package org.meshbus.api.providers;

/**
 * Resources consumed by a single language model call.
 *
 * @param tokensInput  Prompt tokens.
 * @param tokensOutput Completion tokens.
 * @param costCents    Cost of the call in cents.
 * @param modelUsed    Model that served the call.
 */
public record ResourceUsage(int tokensInput, int tokensOutput, double costCents, String modelUsed) {

    public int tokensUsed() {
        return tokensInput + tokensOutput;
    }
}
