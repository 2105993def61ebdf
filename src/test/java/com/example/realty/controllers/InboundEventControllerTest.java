package com.example.realty.controllers;

import com.example.realty.dto.InboundEvent;
import com.example.realty.dto.LeadKey;
import com.example.realty.model.Channel;
import com.example.realty.model.ConversationState;
import com.example.realty.model.EventKind;
import com.example.realty.service.dispatch.TurnResult;
import com.example.realty.service.exception.DispatcherNotRunningException;
import com.example.realty.service.manager.MultiTenantBotManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class InboundEventControllerTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 2, 10, 0);

    private MultiTenantBotManager botManager;
    private InboundEventController controller;

    @BeforeEach
    void setUp() {
        botManager = mock(MultiTenantBotManager.class);
        controller = new InboundEventController(botManager, Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC));
    }

    @Test
    void shouldAcceptValidEvent() {
        when(botManager.dispatch(any())).thenReturn(CompletableFuture.completedFuture(
                TurnResult.completed(new LeadKey(7L, Channel.WHATSAPP, "971501234567"), 1L, ConversationState.WARMUP)));

        ResponseEntity<Void> response = controller.receive(event(EventKind.TEXT, "971501234567", "hi"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        ArgumentCaptor<InboundEvent> dispatched = ArgumentCaptor.forClass(InboundEvent.class);
        verify(botManager).dispatch(dispatched.capture());
        assertThat(dispatched.getValue().getTimestamp()).isEqualTo(NOW);
    }

    @Test
    void shouldRejectSchedulerKinds() {
        ResponseEntity<Void> response = controller.receive(event(EventKind.FOLLOWUP_TICK, "971501234567", ""));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        verifyNoInteractions(botManager);
    }

    @Test
    void shouldRejectEventWithoutSender() {
        assertThat(controller.receive(event(EventKind.TEXT, " ", "hi")).getStatusCode())
                .isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(controller.receive(event(EventKind.TEXT, "971501234567", null)).getStatusCode())
                .isEqualTo(HttpStatus.BAD_REQUEST);
        verifyNoInteractions(botManager);
    }

    @Test
    void shouldReportUnavailableTenant() {
        when(botManager.dispatch(any())).thenReturn(CompletableFuture.failedFuture(
                new DispatcherNotRunningException("no dispatcher")));

        ResponseEntity<Void> response = controller.receive(event(EventKind.TEXT, "971501234567", "hi"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    }

    private static InboundEvent event(EventKind kind, String identity, String payload) {
        return InboundEvent.builder()
                .tenantId(7L)
                .channel(Channel.WHATSAPP)
                .channelIdentity(identity)
                .kind(kind)
                .payload(payload)
                .build();
    }
}
