package org.meshbus.buses.communication;

import org.meshbus.buses.BusMessage;

/**
 * A queued outgoing message.
 */
public class SendMessageRequest extends BusMessage {

    private final String channelId;
    private final String content;

    public SendMessageRequest(String handlerName, String correlationId, String channelId, String content) {
        super(handlerName, correlationId);
        this.channelId = channelId;
        this.content = content;
    }

    public String getChannelId() {
        return channelId;
    }

    public String getContent() {
        return content;
    }
}
