package com.example.realty.controllers;

import com.example.realty.dto.AdminAddressRequest;
import com.example.realty.dto.BotStatusDTO;
import com.example.realty.dto.CloseLeadRequest;
import com.example.realty.dto.FollowupToggleRequest;
import com.example.realty.dto.LeadSummaryDTO;
import com.example.realty.dto.TenantChannelKey;
import com.example.realty.dto.TurnResultDTO;
import com.example.realty.model.Channel;
import com.example.realty.service.LeadAdminService;
import com.example.realty.service.TenantSettingsService;
import com.example.realty.service.exception.LeadNotFoundException;
import com.example.realty.service.exception.TenantNotFoundException;
import com.example.realty.service.followup.FollowupScheduler;
import com.example.realty.service.manager.BotStatus;
import com.example.realty.service.manager.MultiTenantBotManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Slf4j
@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
public class AdminController {

    private static final long TRIGGER_WAIT_SECONDS = 30;

    private final TenantSettingsService settingsService;
    private final LeadAdminService leadAdminService;
    private final FollowupScheduler followupScheduler;
    private final MultiTenantBotManager botManager;

    // ---- tenant admin address

    @PutMapping("/tenants/{tenantId}/admin-address")
    public ResponseEntity<Void> bindAdminAddress(@PathVariable Long tenantId, @RequestBody AdminAddressRequest request) {
        if (request == null || request.address() == null || request.address().isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        try {
            settingsService.bindAdminAddress(tenantId, request.channel(), request.address());
            return ResponseEntity.ok().build();
        } catch (TenantNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    @DeleteMapping("/tenants/{tenantId}/admin-address")
    public ResponseEntity<Void> clearAdminAddress(@PathVariable Long tenantId) {
        try {
            settingsService.bindAdminAddress(tenantId, null, null);
            return ResponseEntity.noContent().build();
        } catch (TenantNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    // ---- leads

    @GetMapping("/leads/{leadId}")
    public ResponseEntity<LeadSummaryDTO> getLead(@PathVariable Long leadId) {
        try {
            return ResponseEntity.ok(LeadSummaryDTO.of(leadAdminService.getLead(leadId)));
        } catch (LeadNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    @PutMapping("/leads/{leadId}/followup")
    public ResponseEntity<LeadSummaryDTO> toggleFollowup(@PathVariable Long leadId,
                                                         @RequestBody FollowupToggleRequest request) {
        try {
            return ResponseEntity.ok(LeadSummaryDTO.of(leadAdminService.setFollowupEnabled(leadId, request.enabled())));
        } catch (LeadNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    @PostMapping("/leads/{leadId}/followup/trigger")
    public ResponseEntity<TurnResultDTO> triggerFollowup(@PathVariable Long leadId) {
        try {
            TurnResultDTO result = TurnResultDTO.of(followupScheduler.trigger(leadId)
                    .get(TRIGGER_WAIT_SECONDS, TimeUnit.SECONDS));
            return ResponseEntity.ok(result);
        } catch (LeadNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (TimeoutException e) {
            return ResponseEntity.accepted().build();
        } catch (ExecutionException e) {
            log.warn("Manual follow-up for lead {} failed: {}", leadId, e.getCause().toString());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
    }

    @PostMapping("/leads/{leadId}/close")
    public ResponseEntity<LeadSummaryDTO> close(@PathVariable Long leadId, @RequestBody CloseLeadRequest request) {
        try {
            return ResponseEntity.ok(LeadSummaryDTO.of(leadAdminService.close(leadId, request.won())));
        } catch (LeadNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).build();
        } catch (CompletionException e) {
            log.error("Closing lead {} failed: {}", leadId, e.toString());
            return ResponseEntity.internalServerError().build();
        }
    }

    // ---- bots

    @GetMapping("/bots")
    public List<BotStatusDTO> statuses() {
        return botManager.statuses().stream().map(BotStatus::toDto).toList();
    }

    @PostMapping("/tenants/{tenantId}/channels/{channel}/{action}")
    public ResponseEntity<BotStatusDTO> control(@PathVariable Long tenantId,
                                                @PathVariable String channel,
                                                @PathVariable String action) {
        Channel parsed;
        try {
            parsed = Channel.valueOf(channel.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().build();
        }
        TenantChannelKey key = new TenantChannelKey(tenantId, parsed);
        BotStatus status = switch (action) {
            case "start" -> botManager.start(key);
            case "stop" -> botManager.stop(key);
            case "restart" -> botManager.restart(key);
            default -> null;
        };
        if (status == null) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(status.toDto());
    }
}
