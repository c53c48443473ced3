package org.meshbus.buses;

import java.time.Instant;
import java.util.UUID;

/**
 * A unit of work queued on a bus. Each bus defines its own subclasses carrying the payload.
 */
public abstract class BusMessage {

    private final String id = UUID.randomUUID().toString();
    private final String handlerName;
    private final String correlationId;
    private final Instant createdAt = Instant.now();

    /**
     * @param handlerName   Name of the handler that submitted the message.
     * @param correlationId Correlation id for tracing, a random one is used if null.
     */
    protected BusMessage(String handlerName, String correlationId) {
        this.handlerName = handlerName;
        this.correlationId = correlationId != null ? correlationId : UUID.randomUUID().toString();
    }

    public String getId() {
        return id;
    }

    public String getHandlerName() {
        return handlerName;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id=" + id + ", handler=" + handlerName + ", correlationId=" + correlationId + "}";
    }
}
