package org.meshbus.audit;

import java.time.Instant;
import java.util.Map;

/**
 * An administrative or security relevant event.
 *
 * @param timestamp When the event happened.
 * @param action    What happened, e.g. {@code "circuit_breaker_reset"}.
 * @param actor     Who triggered it, e.g. the originating handler.
 * @param target    What it affected, e.g. a service type or a capability.
 * @param outcome   {@code "success"}, {@code "rejected"} and similar.
 * @param details   Additional key/value context.
 */
public record AuditEvent(
    Instant timestamp,
    String action,
    String actor,
    String target,
    String outcome,
    Map<String, String> details
) {
    public AuditEvent {
        details = details == null ? Map.of() : Map.copyOf(details);
    }
}
