package org.meshbus.api.providers;

import java.util.Optional;

/**
 * A provider of guidance and the receiver of deferrals (human or automated wise authorities).
 */
public interface IWiseAuthorityProvider extends IProvider {

    /**
     * Receives a deferred task.
     *
     * @return {@code true} if the deferral was acknowledged.
     */
    boolean sendDeferral(DeferralRequest request) throws Exception;

    /**
     * Answers a free-form guidance question.
     */
    Optional<String> fetchGuidance(GuidanceContext context) throws Exception;

    /**
     * Answers a structured guidance request with a confidence score.
     */
    GuidanceResponse getGuidance(GuidanceRequest request) throws Exception;
}
