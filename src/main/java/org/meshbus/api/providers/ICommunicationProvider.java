package org.meshbus.api.providers;

import java.util.List;

/**
 * A provider that can deliver messages to and read messages from channels
 * (chat adapters, CLI, HTTP APIs).
 */
public interface ICommunicationProvider extends IProvider {

    /**
     * Sends a message to a channel.
     *
     * @return {@code true} if the channel accepted the message.
     * @throws Exception if delivery failed.
     */
    boolean sendMessage(String channelId, String content) throws Exception;

    /**
     * Fetches the most recent messages of a channel.
     *
     * @throws Exception if the channel could not be read.
     */
    List<FetchedMessage> fetchMessages(String channelId, int limit) throws Exception;
}
