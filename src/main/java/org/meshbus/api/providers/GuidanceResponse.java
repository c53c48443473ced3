package org.meshbus.api.providers;

/**
 * A guidance answer. The wise bus returns the highest-confidence answer among those it
 * collected, or a degraded answer when nobody responded.
 *
 * @param selectedOption The option chosen, may be null.
 * @param customGuidance Free-form guidance, may be null.
 * @param reasoning      Explanation of the answer.
 * @param waId           Identifier of the authority that answered.
 * @param confidence     Confidence in {@code [0, 1]}.
 * @param degraded       {@code true} if the answer was synthesized because no authority answered.
 */
public record GuidanceResponse(
    String selectedOption,
    String customGuidance,
    String reasoning,
    String waId,
    double confidence,
    boolean degraded
) {

    public GuidanceResponse(String selectedOption, String customGuidance, String reasoning, String waId, double confidence) {
        this(selectedOption, customGuidance, reasoning, waId, confidence, false);
    }

    /**
     * Returns a copy with its reasoning replaced.
     */
    public GuidanceResponse withReasoning(String newReasoning) {
        return new GuidanceResponse(selectedOption, customGuidance, newReasoning, waId, confidence, degraded);
    }
}
