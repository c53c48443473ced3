package org.meshbus.audit;

/**
 * Receives every event recorded by an {@link AuditTrail}, e.g. to persist it.
 */
@FunctionalInterface
public interface IAuditListener {

    void onAuditEvent(AuditEvent event);
}
