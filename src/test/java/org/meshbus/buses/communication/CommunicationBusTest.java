package org.meshbus.buses.communication;

import com.typesafe.config.ConfigFactory;
import org.meshbus.api.errors.OperationFailedException;
import org.meshbus.api.providers.FetchedMessage;
import org.meshbus.api.providers.ICommunicationProvider;
import org.meshbus.api.providers.ServiceType;
import org.meshbus.junit.extensions.logging.AllowLog;
import org.meshbus.junit.extensions.logging.LogLevel;
import org.meshbus.junit.extensions.logging.LogWatchExtension;
import org.meshbus.registry.Priority;
import org.meshbus.registry.RegistrationOptions;
import org.meshbus.registry.ServiceRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.meshbus.testing.TestProviders.provider;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class CommunicationBusTest {

    private ServiceRegistry registry;
    private CommunicationBus communicationBus;

    @BeforeEach
    void setUp() {
        registry = new ServiceRegistry();
        communicationBus = new CommunicationBus(registry, ConfigFactory.parseMap(Map.of("callTimeout", "1s")));
    }

    @AfterEach
    void tearDown() {
        communicationBus.stop();
    }

    private ICommunicationProvider register(String name, Priority priority, String... capabilities) {
        ICommunicationProvider p = provider(ICommunicationProvider.class, name);
        registry.register(ServiceType.COMMUNICATION, p,
            RegistrationOptions.builder().priority(priority).capabilities(capabilities).build());
        return p;
    }

    @Test
    void queuedMessageIsDeliveredByConsumer() throws Exception {
        ICommunicationProvider discord = register("discord", Priority.NORMAL, CommunicationBus.SEND_MESSAGE);
        when(discord.sendMessage("general", "hello")).thenReturn(true);
        communicationBus.start();

        assertTrue(communicationBus.sendMessage("general", "hello", "speak_handler"));

        await().atMost(2, TimeUnit.SECONDS).until(() -> communicationBus.getStats().processed() == 1);
        verify(discord).sendMessage("general", "hello");
        assertEquals(1L, communicationBus.getMetrics().get("messages_sent"));
    }

    @Test
    void syncSendFallsBackToSecondaryProvider() throws Exception {
        ICommunicationProvider primary = register("primary", Priority.HIGH, CommunicationBus.SEND_MESSAGE);
        ICommunicationProvider secondary = register("secondary", Priority.NORMAL, CommunicationBus.SEND_MESSAGE);
        when(primary.sendMessage(anyString(), anyString())).thenThrow(new IllegalStateException("gateway down"));
        when(secondary.sendMessage(anyString(), anyString())).thenReturn(true);

        assertTrue(communicationBus.sendMessageSync("general", "hello", "speak_handler"));
    }

    @Test
    void syncSendWithoutProviderReturnsFalse() throws Exception {
        ICommunicationProvider readOnly = register("reader", Priority.NORMAL, CommunicationBus.FETCH_MESSAGES);

        assertFalse(communicationBus.sendMessageSync("general", "hello", "speak_handler"));
        verify(readOnly, never()).sendMessage(anyString(), anyString());
    }

    @Test
    @AllowLog(level = LogLevel.WARN, messagePattern = "send_message failed on all .*")
    void syncSendRaisesWhenAllProvidersFail() throws Exception {
        ICommunicationProvider broken = register("broken", Priority.NORMAL, CommunicationBus.SEND_MESSAGE);
        when(broken.sendMessage(anyString(), anyString())).thenThrow(new IllegalStateException("gateway down"));

        assertThrows(OperationFailedException.class,
            () -> communicationBus.sendMessageSync("general", "hello", "speak_handler"));
    }

    @Test
    @AllowLog(level = LogLevel.WARN, messagePattern = "CommunicationBus failed to process .*")
    void declinedQueuedMessageCountsAsFailed() throws Exception {
        ICommunicationProvider discord = register("discord", Priority.NORMAL, CommunicationBus.SEND_MESSAGE);
        when(discord.sendMessage(anyString(), anyString())).thenReturn(false);
        communicationBus.start();

        communicationBus.sendMessage("general", "hello", "speak_handler");

        await().atMost(2, TimeUnit.SECONDS).until(() -> communicationBus.getStats().failed() == 1);
        assertEquals(0L, communicationBus.getMetrics().get("messages_sent"));
    }

    @Test
    void fetchMessagesReadsFromCapableProvider() throws Exception {
        ICommunicationProvider reader = register("reader", Priority.NORMAL, CommunicationBus.FETCH_MESSAGES);
        List<FetchedMessage> messages = List.of(
            new FetchedMessage("1", "general", "alice", "hi", Instant.parse("2026-01-01T10:00:00Z")),
            new FetchedMessage("2", "general", "bob", "hello", Instant.parse("2026-01-01T10:01:00Z")));
        when(reader.fetchMessages("general", 10)).thenReturn(messages);

        assertEquals(messages, communicationBus.fetchMessages("general", 10, "observe_handler"));
        assertEquals(2L, communicationBus.getMetrics().get("messages_fetched"));
    }

    @Test
    void fetchMessagesWithoutProviderIsEmpty() throws Exception {
        assertEquals(List.of(), communicationBus.fetchMessages("general", 10, "observe_handler"));
    }
}
