package com.example.realty.controllers;

import com.example.realty.dto.AdminAddressRequest;
import com.example.realty.dto.BotStatusDTO;
import com.example.realty.dto.CloseLeadRequest;
import com.example.realty.dto.LeadKey;
import com.example.realty.dto.LeadSummaryDTO;
import com.example.realty.dto.TenantChannelKey;
import com.example.realty.dto.TurnResultDTO;
import com.example.realty.model.Channel;
import com.example.realty.model.ConversationState;
import com.example.realty.model.Lead;
import com.example.realty.service.LeadAdminService;
import com.example.realty.service.TenantSettingsService;
import com.example.realty.service.dispatch.TurnResult;
import com.example.realty.service.exception.LeadNotFoundException;
import com.example.realty.service.exception.TenantNotFoundException;
import com.example.realty.service.followup.FollowupScheduler;
import com.example.realty.service.manager.BotStatus;
import com.example.realty.service.manager.MultiTenantBotManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.LocalDateTime;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class AdminControllerTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 2, 10, 0);

    private TenantSettingsService settingsService;
    private LeadAdminService leadAdminService;
    private FollowupScheduler followupScheduler;
    private MultiTenantBotManager botManager;
    private AdminController controller;

    @BeforeEach
    void setUp() {
        settingsService = mock(TenantSettingsService.class);
        leadAdminService = mock(LeadAdminService.class);
        followupScheduler = mock(FollowupScheduler.class);
        botManager = mock(MultiTenantBotManager.class);
        controller = new AdminController(settingsService, leadAdminService, followupScheduler, botManager);
    }

    @Test
    void shouldBindAdminAddress() {
        ResponseEntity<Void> response = controller.bindAdminAddress(7L, new AdminAddressRequest(Channel.TELEGRAM, "5550001"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        verify(settingsService).bindAdminAddress(7L, Channel.TELEGRAM, "5550001");
    }

    @Test
    void shouldRejectBlankAdminAddress() {
        ResponseEntity<Void> response = controller.bindAdminAddress(7L, new AdminAddressRequest(null, " "));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        verifyNoInteractions(settingsService);
    }

    @Test
    void shouldReportUnknownTenantWhenClearing() {
        when(settingsService.bindAdminAddress(9L, null, null)).thenThrow(new TenantNotFoundException(9L));

        assertThat(controller.clearAdminAddress(9L).getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void shouldReturnLeadSummary() {
        Lead lead = Lead.builder().id(1L).tenantId(7L).channel(Channel.TELEGRAM).channelIdentity("100")
                .conversationState(ConversationState.ENGAGEMENT).build();
        when(leadAdminService.getLead(1L)).thenReturn(lead);

        ResponseEntity<LeadSummaryDTO> response = controller.getLead(1L);

        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().state()).isEqualTo("ENGAGEMENT");
    }

    @Test
    void shouldReturnNotFoundForMissingLead() {
        when(leadAdminService.getLead(9L)).thenThrow(new LeadNotFoundException(9L));

        assertThat(controller.getLead(9L).getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void shouldMapConflictingCloseTo409() {
        when(leadAdminService.close(1L, false)).thenThrow(new IllegalStateException("Lead 1 is already CLOSED_WON"));

        assertThat(controller.close(1L, new CloseLeadRequest(false)).getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    }

    @Test
    void shouldReturnTriggerOutcome() {
        when(followupScheduler.trigger(1L)).thenReturn(CompletableFuture.completedFuture(
                TurnResult.completed(new LeadKey(7L, Channel.TELEGRAM, "100"), 1L, ConversationState.SLOT_FILLING)));

        ResponseEntity<TurnResultDTO> response = controller.triggerFollowup(1L);

        assertThat(response.getBody()).isEqualTo(new TurnResultDTO(1L, "COMPLETED", "SLOT_FILLING", null));
    }

    @Test
    void shouldControlBotsByChannelName() {
        TenantChannelKey key = new TenantChannelKey(7L, Channel.WHATSAPP);
        when(botManager.restart(key)).thenReturn(BotStatus.running(key, NOW));

        ResponseEntity<BotStatusDTO> response = controller.control(7L, "whatsapp", "restart");

        assertThat(response.getBody()).isEqualTo(new BotStatusDTO(7L, "WHATSAPP", "RUNNING", null, NOW));
    }

    @Test
    void shouldRejectUnknownChannelOrAction() {
        assertThat(controller.control(7L, "fax", "start").getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(controller.control(7L, "telegram", "pause").getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        verifyNoInteractions(botManager);
    }
}
