package org.meshbus.api.providers;

import java.time.Instant;

/**
 * A message read back from a communication channel.
 *
 * @param messageId Identifier assigned by the channel.
 * @param channelId The channel the message was read from.
 * @param author    Display name or id of the author.
 * @param content   Message text.
 * @param timestamp When the channel received the message.
 */
public record FetchedMessage(
    String messageId,
    String channelId,
    String author,
    String content,
    Instant timestamp
) {
}
