package com.example.realty.service.followup;

import com.example.realty.config.EngineProperties;
import com.example.realty.dto.InboundEvent;
import com.example.realty.dto.LeadKey;
import com.example.realty.model.Channel;
import com.example.realty.model.ConversationState;
import com.example.realty.model.EventKind;
import com.example.realty.model.Lead;
import com.example.realty.service.dispatch.LeadSequencer;
import com.example.realty.service.dispatch.TurnResult;
import com.example.realty.service.exception.LeadNotFoundException;
import com.example.realty.service.manager.MultiTenantBotManager;
import com.example.realty.service.session.LeadSessionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FollowupSchedulerTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 2, 10, 0);

    private LeadSessionStore sessionStore;
    private FollowupLedger ledger;
    private MultiTenantBotManager botManager;
    private FollowupScheduler scheduler;

    @BeforeEach
    void setUp() {
        sessionStore = mock(LeadSessionStore.class);
        ledger = mock(FollowupLedger.class);
        botManager = mock(MultiTenantBotManager.class);
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        scheduler = new FollowupScheduler(sessionStore, ledger, botManager, new LeadSequencer(),
                new EngineProperties(), clock, Runnable::run);

        when(botManager.dispatch(any())).thenReturn(CompletableFuture.completedFuture(
                TurnResult.skipped(new LeadKey(7L, Channel.TELEGRAM, "100"), 1L, "claim lost")));
    }

    @Test
    void shouldDispatchDripTickPerDueLead() {
        when(sessionStore.findDueForFollowup(NOW, 100)).thenReturn(List.of(lead(1L, "100", 0), lead(2L, "200", 3)));

        scheduler.runDripPass();

        ArgumentCaptor<InboundEvent> events = ArgumentCaptor.forClass(InboundEvent.class);
        verify(botManager, times(2)).dispatch(events.capture());
        assertThat(events.getAllValues()).extracting(InboundEvent::getKind).containsOnly(EventKind.FOLLOWUP_TICK);
        assertThat(events.getAllValues()).extracting(e -> e.getTick().stage()).containsExactly(0, 3);
        assertThat(events.getAllValues()).noneMatch(e -> e.getTick().forced());
        assertThat(events.getAllValues().get(1).getChannelIdentity()).isEqualTo("200");
    }

    @Test
    void shouldLookForGhostsPastTheDelay() {
        when(sessionStore.findGhostCandidates(NOW.minusHours(2), 100)).thenReturn(List.of(lead(1L, "100", 0)));

        scheduler.runGhostPass();

        ArgumentCaptor<InboundEvent> event = ArgumentCaptor.forClass(InboundEvent.class);
        verify(botManager).dispatch(event.capture());
        assertThat(event.getValue().getKind()).isEqualTo(EventKind.GHOST_TICK);
    }

    @Test
    void shouldNotDispatchWhenNothingIsDue() {
        when(sessionStore.findDueForFollowup(any(), anyInt())).thenReturn(List.of());

        scheduler.runDripPass();

        verify(botManager, never()).dispatch(any());
    }

    @Test
    void shouldRecoverStaleClaimsInsideTheLane() {
        Lead stale = lead(1L, "100", 1);
        stale.setFollowupClaimToken("drip:abc");
        when(sessionStore.findStaleClaims(NOW.minusHours(1))).thenReturn(List.of(stale));
        when(ledger.recover(stale, NOW)).thenReturn(true);

        scheduler.recoverStaleClaims();

        verify(ledger).recover(stale, NOW);
        verify(sessionStore).evict(LeadKey.of(stale));
        verify(botManager, never()).dispatch(any());
    }

    @Test
    void shouldForceManualTrigger() {
        when(sessionStore.findById(1L)).thenReturn(Optional.of(lead(1L, "100", 2)));

        scheduler.trigger(1L);

        ArgumentCaptor<InboundEvent> event = ArgumentCaptor.forClass(InboundEvent.class);
        verify(botManager).dispatch(event.capture());
        assertThat(event.getValue().getTick().forced()).isTrue();
        assertThat(event.getValue().getTick().stage()).isEqualTo(2);
    }

    @Test
    void shouldRejectTriggerForUnknownLead() {
        when(sessionStore.findById(9L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> scheduler.trigger(9L)).isInstanceOf(LeadNotFoundException.class);
    }

    private static Lead lead(Long id, String identity, int stage) {
        return Lead.builder()
                .id(id)
                .tenantId(7L)
                .channel(Channel.TELEGRAM)
                .channelIdentity(identity)
                .conversationState(ConversationState.SLOT_FILLING)
                .followupStage(stage)
                .build();
    }
}
