package org.meshbus.api.errors;

/**
 * Thrown when a request names a capability that belongs to a prohibited domain.
 * Such requests are never routed and never retried.
 */
public class CapabilityProhibitedException extends BusOperationException {

    private final String capability;
    private final String matchedTerm;

    /**
     * Creates a new CapabilityProhibitedException.
     *
     * @param capability  the capability as requested by the caller.
     * @param matchedTerm the prohibited term found inside the capability.
     */
    public CapabilityProhibitedException(String capability, String matchedTerm) {
        super(String.format("PROHIBITED: capability '%s' contains prohibited term '%s'. "
                + "Medical and health capabilities are blocked on this bus.", capability, matchedTerm));
        this.capability = capability;
        this.matchedTerm = matchedTerm;
    }

    public String getCapability() {
        return capability;
    }

    public String getMatchedTerm() {
        return matchedTerm;
    }
}
