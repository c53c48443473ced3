package org.meshbus.buses.communication;

import com.typesafe.config.Config;
import org.meshbus.api.errors.BusOperationException;
import org.meshbus.api.errors.OperationFailedException;
import org.meshbus.api.providers.FetchedMessage;
import org.meshbus.api.providers.ICommunicationProvider;
import org.meshbus.api.providers.ServiceType;
import org.meshbus.buses.AbstractBus;
import org.meshbus.buses.BusMessage;
import org.meshbus.registry.SelectionStrategy;
import org.meshbus.registry.ServiceRegistry;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Routes outgoing messages and channel reads to communication providers.
 * <p>
 * Providers declare {@value #SEND_MESSAGE} and/or {@value #FETCH_MESSAGES}.
 * {@link #sendMessage} is fire-and-forget through the queue; {@link #sendMessageSync}
 * and {@link #fetchMessages} call a provider directly.
 */
public class CommunicationBus extends AbstractBus<ICommunicationProvider> {

    public static final String SEND_MESSAGE = "send_message";
    public static final String FETCH_MESSAGES = "fetch_messages";

    private final AtomicLong messagesSent = new AtomicLong();
    private final AtomicLong messagesFetched = new AtomicLong();

    public CommunicationBus(ServiceRegistry registry, Config options) {
        super(ServiceType.COMMUNICATION, ICommunicationProvider.class, registry, options, SelectionStrategy.FALLBACK);
    }

    /**
     * Queues a message for delivery.
     *
     * @return {@code false} if the message could not be queued.
     */
    public boolean sendMessage(String channelId, String content, String handlerName) {
        return submit(new SendMessageRequest(handlerName, null, channelId, content));
    }

    /**
     * Delivers a message on the calling thread.
     *
     * @return {@code true} if a provider accepted the message, {@code false} if none is
     *         available or the provider declined it.
     * @throws OperationFailedException if every attempted provider failed.
     */
    public boolean sendMessageSync(String channelId, String content, String handlerName) throws OperationFailedException {
        Optional<Boolean> sent = invokeWithFallback(SEND_MESSAGE, Set.of(SEND_MESSAGE),
            provider -> provider.sendMessage(channelId, content));
        if (sent.isEmpty()) {
            log.debug("No communication provider available to send to channel '{}' for {}", channelId, handlerName);
            return false;
        }
        if (sent.get()) {
            messagesSent.incrementAndGet();
        }
        return sent.get();
    }

    /**
     * Reads the most recent messages of a channel.
     *
     * @return The messages, empty if no provider is available.
     * @throws OperationFailedException if every attempted provider failed.
     */
    public List<FetchedMessage> fetchMessages(String channelId, int limit, String handlerName) throws OperationFailedException {
        List<FetchedMessage> messages = invokeWithFallback(FETCH_MESSAGES, Set.of(FETCH_MESSAGES),
            provider -> provider.fetchMessages(channelId, limit)).orElse(List.of());
        messagesFetched.addAndGet(messages.size());
        return messages;
    }

    @Override
    protected void processMessage(BusMessage message) throws Exception {
        if (!(message instanceof SendMessageRequest request)) {
            throw new BusOperationException("Unsupported message type " + message.getClass().getSimpleName());
        }
        if (!sendMessageSync(request.getChannelId(), request.getContent(), request.getHandlerName())) {
            throw new BusOperationException("Message to channel '" + request.getChannelId() + "' was not delivered");
        }
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("messages_sent", messagesSent.get());
        metrics.put("messages_fetched", messagesFetched.get());
    }
}
