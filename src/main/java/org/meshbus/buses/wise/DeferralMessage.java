package org.meshbus.buses.wise;

import org.meshbus.api.providers.DeferralRequest;
import org.meshbus.buses.BusMessage;

/**
 * A queued deferral broadcast.
 */
public class DeferralMessage extends BusMessage {

    private final DeferralRequest request;

    public DeferralMessage(String handlerName, DeferralRequest request) {
        super(handlerName, request.taskId());
        this.request = request;
    }

    public DeferralRequest getRequest() {
        return request;
    }
}
