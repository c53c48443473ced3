package org.meshbus.buses.wise;

import com.typesafe.config.ConfigFactory;
import org.meshbus.api.errors.CapabilityProhibitedException;
import org.meshbus.api.providers.DeferralRequest;
import org.meshbus.api.providers.GuidanceContext;
import org.meshbus.api.providers.GuidanceRequest;
import org.meshbus.api.providers.GuidanceResponse;
import org.meshbus.api.providers.IWiseAuthorityProvider;
import org.meshbus.api.providers.ServiceType;
import org.meshbus.audit.AuditEvent;
import org.meshbus.audit.AuditTrail;
import org.meshbus.junit.extensions.logging.AllowLog;
import org.meshbus.junit.extensions.logging.LogLevel;
import org.meshbus.junit.extensions.logging.LogWatchExtension;
import org.meshbus.registry.RegistrationOptions;
import org.meshbus.registry.ServiceRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.meshbus.testing.TestProviders.provider;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class WiseBusTest {

    private static final String CAPABILITY = "domain:ethics";

    private AuditTrail auditTrail;
    private ServiceRegistry registry;
    private WiseBus wiseBus;

    @BeforeEach
    void setUp() {
        auditTrail = new AuditTrail();
        registry = spy(new ServiceRegistry(ConfigFactory.empty(), auditTrail, Clock.systemUTC()));
        wiseBus = new WiseBus(registry, ConfigFactory.parseMap(Map.of(
            "guidanceTimeout", "1s",
            "deferralTimeout", "1s"
        )));
    }

    @AfterEach
    void tearDown() {
        wiseBus.stop();
    }

    private IWiseAuthorityProvider register(String name, String... capabilities) {
        IWiseAuthorityProvider p = provider(IWiseAuthorityProvider.class, name);
        registry.register(ServiceType.WISE_AUTHORITY, p, RegistrationOptions.builder().capabilities(capabilities).build());
        return p;
    }

    private static GuidanceResponse answer(String option, double confidence) {
        return new GuidanceResponse(option, null, "because " + option, option + "-wa", confidence);
    }

    private static GuidanceRequest request(String capability) {
        return new GuidanceRequest("Should the agent proceed?", List.of("yes", "no"), capability);
    }

    @Test
    @AllowLog(level = LogLevel.WARN, loggerPattern = ".*CapabilityFirewall", messagePattern = "Rejected guidance capability .*")
    void prohibitedCapabilityIsRejectedBeforeRegistryLookup() {
        for (String capability : List.of("Domain:Medical", "medical_advice", "mental_health_support", "CLINICAL-notes")) {
            CapabilityProhibitedException e = assertThrows(CapabilityProhibitedException.class,
                () -> wiseBus.requestGuidance(request(capability)));
            assertEquals(capability, e.getCapability());
        }

        verify(registry, never()).getProviders(any(), anySet(), anyMap());
        assertEquals(4L, wiseBus.getMetrics().get("firewall_rejections_total"));
        assertEquals(0L, wiseBus.getMetrics().get("guidance_requests_total"));

        AuditEvent event = auditTrail.getRecentEvents().get(0);
        assertEquals("capability_prohibited", event.action());
        assertEquals("Domain:Medical", event.target());
        assertEquals("rejected", event.outcome());
        assertEquals("domain:medical", event.details().get("matched_term"));
    }

    @Test
    void firewallMatchesFirstTermInListOrder() {
        assertEquals(Optional.of("domain:medical"), CapabilityFirewall.findProhibitedTerm("DOMAIN:MEDICAL"));
        assertEquals(Optional.of("medical"), CapabilityFirewall.findProhibitedTerm("medical_advice"));
        assertEquals(Optional.empty(), CapabilityFirewall.findProhibitedTerm("domain:ethics"));
        assertEquals(Optional.empty(), CapabilityFirewall.findProhibitedTerm(null));
    }

    @Test
    void highestConfidenceWinsAndReasoningIsAnnotated() throws Exception {
        when(register("a", CAPABILITY).getGuidance(any())).thenReturn(answer("a", 0.4));
        when(register("b", CAPABILITY).getGuidance(any())).thenReturn(answer("b", 0.9));
        when(register("c", CAPABILITY).getGuidance(any())).thenReturn(answer("c", 0.6));

        GuidanceResponse response = wiseBus.requestGuidance(request(CAPABILITY));

        assertEquals("b", response.selectedOption());
        assertEquals(0.9, response.confidence());
        assertEquals("because b (selected with 0.90 confidence from 3 providers)", response.reasoning());
        assertFalse(response.degraded());
    }

    @Test
    void singleResponseIsReturnedUnchanged() throws Exception {
        GuidanceResponse only = answer("only", 0.3);
        when(register("only", CAPABILITY).getGuidance(any())).thenReturn(only);

        assertEquals(only, wiseBus.requestGuidance(request(CAPABILITY)));
    }

    @Test
    void equalConfidenceKeepsFirstResponse() {
        GuidanceResponse first = answer("first", 0.7);
        GuidanceResponse second = answer("second", 0.7);

        GuidanceResponse selected = WiseBus.arbitrate(List.of(first, second));

        assertEquals("first", selected.selectedOption());
        assertThat(selected.reasoning()).endsWith("(selected with 0.70 confidence from 2 providers)");
    }

    @Test
    void providersWithoutCapabilityAreNotAsked() throws Exception {
        IWiseAuthorityProvider other = register("other", "domain:finance");
        when(register("ethics", CAPABILITY).getGuidance(any())).thenReturn(answer("ethics", 0.5));

        assertEquals("ethics", wiseBus.requestGuidance(request(CAPABILITY)).selectedOption());
        verify(other, never()).getGuidance(any());
    }

    @Test
    void noMatchingProviderYieldsDegradedResponse() throws Exception {
        GuidanceResponse response = wiseBus.requestGuidance(request(CAPABILITY));

        assertTrue(response.degraded());
        assertEquals(0.0, response.confidence());
        assertNull(response.selectedOption());
        assertEquals("No providers responded", response.customGuidance());
        assertEquals("No guidance available", response.reasoning());
        assertEquals(WiseBus.BUS_WA_ID, response.waId());
        assertEquals(1L, wiseBus.getMetrics().get("guidance_degraded_total"));
    }

    @Test
    void freeFormGuidanceStandsInWhenNoProviderDeclaresCapability() throws Exception {
        IWiseAuthorityProvider guide = register("guide", WiseBus.FETCH_GUIDANCE);
        when(guide.fetchGuidance(any())).thenReturn(Optional.of("Proceed carefully."));

        GuidanceResponse response = wiseBus.requestGuidance(request(CAPABILITY));

        assertEquals("yes", response.selectedOption());
        assertEquals("Proceed carefully.", response.customGuidance());
        assertEquals(WiseBus.LEGACY_REASONING, response.reasoning());
        assertEquals(WiseBus.LEGACY_WA_ID, response.waId());
        assertFalse(response.degraded());
        verify(guide, never()).getGuidance(any());

        ArgumentCaptor<GuidanceContext> context = ArgumentCaptor.forClass(GuidanceContext.class);
        verify(guide).fetchGuidance(context.capture());
        assertEquals("Should the agent proceed?", context.getValue().question());
        assertEquals(Map.of("urgency", "normal"), context.getValue().domainContext());
        assertThat(context.getValue().thoughtId()).startsWith("guidance_");
    }

    @Test
    void freeFormGuidanceWithoutOptionsSelectsNothing() throws Exception {
        when(register("guide", WiseBus.FETCH_GUIDANCE).fetchGuidance(any())).thenReturn(Optional.of("Wait."));

        GuidanceResponse response = wiseBus.requestGuidance(new GuidanceRequest("Now?", List.of(), CAPABILITY));

        assertNull(response.selectedOption());
        assertEquals("Wait.", response.customGuidance());
    }

    @Test
    @AllowLog(level = LogLevel.WARN, messagePattern = "None of 1 wise authorities answered guidance request within .*")
    void emptyFreeFormGuidanceYieldsDegradedResponse() throws Exception {
        when(register("guide", WiseBus.FETCH_GUIDANCE).fetchGuidance(any())).thenReturn(Optional.empty());

        assertTrue(wiseBus.requestGuidance(request(CAPABILITY)).degraded());
    }

    @Test
    void matchingProviderIsPreferredOverFreeFormGuidance() throws Exception {
        IWiseAuthorityProvider guide = register("guide", WiseBus.FETCH_GUIDANCE);
        when(register("ethics", CAPABILITY).getGuidance(any())).thenReturn(answer("ethics", 0.5));

        assertEquals("ethics", wiseBus.requestGuidance(request(CAPABILITY)).selectedOption());
        verify(guide, never()).fetchGuidance(any());
    }

    @Test
    @AllowLog(level = LogLevel.WARN, messagePattern = "None of 1 wise authorities answered guidance request within 100ms")
    void slowProviderTimesOutIntoDegradedResponse() throws Exception {
        IWiseAuthorityProvider slow = register("slow", CAPABILITY);
        when(slow.getGuidance(any())).thenAnswer(inv -> {
            Thread.sleep(2000);
            return answer("slow", 1.0);
        });

        long start = System.nanoTime();
        GuidanceResponse response = wiseBus.requestGuidance(request(CAPABILITY), Duration.ofMillis(100));

        assertTrue(System.nanoTime() - start < TimeUnit.MILLISECONDS.toNanos(1500));
        assertTrue(response.degraded());
        assertEquals(1, registry.findProvider(ServiceType.WISE_AUTHORITY, "slow").orElseThrow()
            .getCircuitBreaker().getStats().failureCount());
    }

    @Test
    void answersArrivingInTimeWinOverStragglers() throws Exception {
        IWiseAuthorityProvider slow = register("slow", CAPABILITY);
        when(slow.getGuidance(any())).thenAnswer(inv -> {
            Thread.sleep(2000);
            return answer("slow", 1.0);
        });
        when(register("fast", CAPABILITY).getGuidance(any())).thenReturn(answer("fast", 0.2));

        GuidanceResponse response = wiseBus.requestGuidance(request(CAPABILITY), Duration.ofMillis(200));

        assertEquals("fast", response.selectedOption());
        assertEquals("because fast", response.reasoning());
    }

    @Test
    void failingProviderDoesNotSpoilOtherAnswers() throws Exception {
        when(register("broken", CAPABILITY).getGuidance(any())).thenThrow(new IllegalStateException("offline"));
        when(register("working", CAPABILITY).getGuidance(any())).thenReturn(answer("working", 0.8));

        assertEquals("working", wiseBus.requestGuidance(request(CAPABILITY)).selectedOption());
        assertEquals(1, registry.findProvider(ServiceType.WISE_AUTHORITY, "broken").orElseThrow()
            .getCircuitBreaker().getStats().failureCount());
    }

    @Test
    void fanOutIsLimitedToMaxFanOut() throws Exception {
        wiseBus = new WiseBus(registry, ConfigFactory.parseMap(Map.of("maxFanOut", 2)));
        when(register("a", CAPABILITY).getGuidance(any())).thenReturn(answer("a", 0.1));
        when(register("b", CAPABILITY).getGuidance(any())).thenReturn(answer("b", 0.2));
        IWiseAuthorityProvider c = register("c", CAPABILITY);

        assertEquals("b", wiseBus.requestGuidance(request(CAPABILITY)).selectedOption());
        verify(c, never()).getGuidance(any());
    }

    @Test
    void deferralIsBroadcastToAllProviders() throws Exception {
        IWiseAuthorityProvider a = register("a");
        IWiseAuthorityProvider b = register("b", CAPABILITY);
        when(a.sendDeferral(any())).thenReturn(false);
        when(b.sendDeferral(any())).thenReturn(true);
        DeferralRequest deferral = new DeferralRequest("task-1", "thought-1", "needs a human", null, Map.of());

        assertTrue(wiseBus.sendDeferral(deferral, "handler"));

        verify(a).sendDeferral(deferral);
        verify(b).sendDeferral(deferral);
        assertEquals(1L, wiseBus.getMetrics().get("deferrals_acknowledged_total"));
    }

    @Test
    @AllowLog(level = LogLevel.WARN, messagePattern = "Deferral of task 'task-1' was not acknowledged by any of 1 wise authorities")
    void unacknowledgedDeferralFails() throws Exception {
        when(register("a").sendDeferral(any())).thenReturn(false);

        assertFalse(wiseBus.sendDeferral(new DeferralRequest("task-1", "t", "r", null, null), "handler"));
        assertEquals("DEFERRAL_UNACKNOWLEDGED", wiseBus.getErrors().get(0).errorType());
    }

    @Test
    @AllowLog(level = LogLevel.WARN, messagePattern = "No wise authority available for deferral of task 'task-1' from handler")
    void deferralWithoutProviderFails() {
        assertFalse(wiseBus.sendDeferral(new DeferralRequest("task-1", "t", "r", null, null), "handler"));
        assertEquals("NO_PROVIDER", wiseBus.getErrors().get(0).errorType());
    }

    @Test
    void reviewIsSentAsDeferral() throws Exception {
        IWiseAuthorityProvider a = register("a");
        when(a.sendDeferral(any())).thenReturn(true);

        assertTrue(wiseBus.requestReview("identity_variance", Map.of("variance", "0.3"), "identity_handler"));

        ArgumentCaptor<DeferralRequest> captor = ArgumentCaptor.forClass(DeferralRequest.class);
        verify(a).sendDeferral(captor.capture());
        DeferralRequest sent = captor.getValue();
        assertEquals("review_task_identity_variance", sent.taskId());
        assertEquals("review_identity_variance_identity_handler", sent.thoughtId());
        assertEquals("Review requested: identity_variance", sent.reason());
        assertEquals(Map.of(
            "variance", "0.3",
            "review_type", "identity_variance",
            "handler_name", "identity_handler"), sent.context());
    }

    @Test
    void asyncDeferralIsDeliveredByConsumer() throws Exception {
        IWiseAuthorityProvider a = register("a");
        when(a.sendDeferral(any())).thenReturn(true);
        wiseBus.start();

        assertTrue(wiseBus.sendDeferralAsync(new DeferralRequest("task-2", "t", "r", null, null), "handler"));

        await().atMost(2, TimeUnit.SECONDS).until(() -> wiseBus.getStats().processed() == 1);
    }

    @Test
    void fetchGuidanceAsksProviderDeclaringTheCapability() throws Exception {
        IWiseAuthorityProvider plain = register("plain");
        IWiseAuthorityProvider guide = register("guide", WiseBus.FETCH_GUIDANCE);
        GuidanceContext context = new GuidanceContext("thought-1", "task-1", "Is this allowed?", Map.of());
        when(guide.fetchGuidance(context)).thenReturn(Optional.of("Yes, within limits."));

        assertEquals(Optional.of("Yes, within limits."), wiseBus.fetchGuidance(context, "handler"));
        verify(plain, never()).fetchGuidance(any());
    }

    @Test
    void fetchGuidanceWithoutProviderIsEmpty() throws Exception {
        GuidanceContext context = new GuidanceContext("thought-1", "task-1", "Anyone?", null);

        assertEquals(Optional.empty(), wiseBus.fetchGuidance(context, "handler"));
    }
}
