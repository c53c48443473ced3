package org.meshbus.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Records administrative actions (breaker resets, re-prioritisation) and firewall rejections.
 * <p>
 * Every event is written to the dedicated {@code AUDIT} logger and handed to the registered
 * {@link IAuditListener}s. The most recent events are kept in memory for diagnostics,
 * bounded by {@link #MAX_RECENT_EVENTS}.
 */
public class AuditTrail {

    /** Name of the logger receiving audit events. */
    public static final String AUDIT_LOGGER = "AUDIT";

    static final int MAX_RECENT_EVENTS = 1000;

    private static final Logger log = LoggerFactory.getLogger(AuditTrail.class);
    private static final Logger audit = LoggerFactory.getLogger(AUDIT_LOGGER);

    private final Clock clock;
    private final List<IAuditListener> listeners = new CopyOnWriteArrayList<>();
    private final ConcurrentLinkedDeque<AuditEvent> recentEvents = new ConcurrentLinkedDeque<>();

    public AuditTrail() {
        this(Clock.systemUTC());
    }

    public AuditTrail(Clock clock) {
        this.clock = clock;
    }

    public void addListener(IAuditListener listener) {
        listeners.add(listener);
    }

    public void removeListener(IAuditListener listener) {
        listeners.remove(listener);
    }

    /**
     * Records an event stamped with the current time.
     *
     * @return The recorded event.
     */
    public AuditEvent record(String action, String actor, String target, String outcome, Map<String, String> details) {
        AuditEvent event = new AuditEvent(clock.instant(), action, actor, target, outcome, details);
        record(event);
        return event;
    }

    public void record(AuditEvent event) {
        audit.info("action={} actor={} target={} outcome={} details={}",
            event.action(), event.actor(), event.target(), event.outcome(), event.details());

        recentEvents.add(event);
        while (recentEvents.size() > MAX_RECENT_EVENTS) {
            recentEvents.pollFirst();
        }

        for (IAuditListener listener : listeners) {
            try {
                listener.onAuditEvent(event);
            } catch (RuntimeException e) {
                log.warn("Audit listener {} failed for action '{}': {}",
                    listener.getClass().getSimpleName(), event.action(), e.getMessage());
                log.debug("Audit listener failure details:", e);
            }
        }
    }

    /**
     * @return The most recent events, oldest first.
     */
    public List<AuditEvent> getRecentEvents() {
        return new ArrayList<>(recentEvents);
    }
}
