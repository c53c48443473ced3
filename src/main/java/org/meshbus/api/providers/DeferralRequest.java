package org.meshbus.api.providers;

import java.time.Instant;
import java.util.Map;

/**
 * A task handed to wise authorities for later review.
 *
 * @param taskId     The deferred task.
 * @param thoughtId  The thought that decided to defer.
 * @param reason     Why the task was deferred.
 * @param deferUntil Earliest time the task should be revisited, may be null.
 * @param context    Additional key/value context.
 */
public record DeferralRequest(
    String taskId,
    String thoughtId,
    String reason,
    Instant deferUntil,
    Map<String, String> context
) {
    public DeferralRequest {
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
