package org.meshbus.buses.wise;

import org.meshbus.api.errors.CapabilityProhibitedException;
import org.meshbus.audit.AuditTrail;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Rejects guidance capabilities of the medical and health domain.
 * <p>
 * A capability is prohibited if its lower-cased form contains any of {@link #PROHIBITED_TERMS}.
 * The list is fixed; every rejection is written to the audit trail.
 */
public class CapabilityFirewall {

    private static final Logger log = LoggerFactory.getLogger(CapabilityFirewall.class);

    /** Prohibited terms, checked in this order. */
    public static final List<String> PROHIBITED_TERMS = List.of(
        "domain:medical",
        "domain:health",
        "domain:triage",
        "domain:diagnosis",
        "domain:treatment",
        "domain:prescription",
        "domain:patient",
        "domain:clinical",
        "domain:symptom",
        "domain:disease",
        "domain:medication",
        "domain:therapy",
        "domain:condition",
        "domain:disorder",
        "modality:medical",
        "provider:medical",
        "clinical",
        "symptom",
        "disease",
        "medication",
        "therapy",
        "triage",
        "diagnosis",
        "treatment",
        "prescription",
        "patient",
        "health",
        "medical",
        "condition",
        "disorder"
    );

    private final AuditTrail auditTrail;

    public CapabilityFirewall(AuditTrail auditTrail) {
        this.auditTrail = auditTrail;
    }

    /**
     * @return The first prohibited term contained in the capability, empty if there is none
     *         or the capability is null.
     */
    public static Optional<String> findProhibitedTerm(String capability) {
        if (capability == null || capability.isEmpty()) {
            return Optional.empty();
        }
        String lower = capability.toLowerCase(Locale.ROOT);
        return PROHIBITED_TERMS.stream().filter(lower::contains).findFirst();
    }

    /**
     * Rejects a prohibited capability. Null and empty capabilities pass.
     *
     * @param capability The requested capability.
     * @param requester  Who asked, recorded in the audit trail.
     * @throws CapabilityProhibitedException if the capability contains a prohibited term.
     */
    public void check(String capability, String requester) throws CapabilityProhibitedException {
        Optional<String> term = findProhibitedTerm(capability);
        if (term.isEmpty()) {
            return;
        }
        log.warn("Rejected guidance capability '{}' requested by {}: contains '{}'", capability, requester, term.get());
        auditTrail.record("capability_prohibited", requester, capability, "rejected",
            Map.of("matched_term", term.get()));
        throw new CapabilityProhibitedException(capability, term.get());
    }
}
