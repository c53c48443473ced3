package org.meshbus.api.providers;

import java.util.List;

/**
 * A structured request for guidance sent to wise authorities.
 *
 * @param context    Description of the situation.
 * @param options    Candidate options the requester is choosing between, may be empty.
 * @param capability Capability the answering authority must declare, may be null.
 * @param urgency    Free-form urgency hint such as {@code "normal"} or {@code "high"}.
 */
public record GuidanceRequest(String context, List<String> options, String capability, String urgency) {

    public GuidanceRequest {
        options = options == null ? List.of() : List.copyOf(options);
        urgency = urgency == null ? "normal" : urgency;
    }

    public GuidanceRequest(String context, List<String> options, String capability) {
        this(context, options, capability, "normal");
    }
}
