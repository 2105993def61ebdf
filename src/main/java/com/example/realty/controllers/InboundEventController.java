package com.example.realty.controllers;

import com.example.realty.dto.InboundEvent;
import com.example.realty.dto.TurnResultDTO;
import com.example.realty.service.dispatch.TurnResult;
import com.example.realty.service.manager.MultiTenantBotManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.concurrent.CompletableFuture;

/**
 * Channel-neutral inbound endpoint. WhatsApp webhooks and any other adapter post normalized events here.
 */
@Slf4j
@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
public class InboundEventController {

    private final MultiTenantBotManager botManager;
    private final Clock clock;

    @PostMapping
    public ResponseEntity<Void> receive(@RequestBody InboundEvent event) {
        String problem = validate(event);
        if (problem != null) {
            log.warn("Rejected inbound event: {}", problem);
            return ResponseEntity.badRequest().build();
        }
        if (event.getTimestamp() == null) {
            event.setTimestamp(LocalDateTime.now(clock));
        }
        // ticks are scheduler-only
        event.setTick(null);

        CompletableFuture<TurnResult> future = botManager.dispatch(event);
        if (future.isCompletedExceptionally()) {
            log.warn("No dispatcher for tenant {} on {}", event.getTenantId(), event.getChannel());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
        future.whenComplete((result, error) -> {
            if (error != null) {
                log.warn("Event from {} not processed: {}", event.getChannelIdentity(), error.toString());
            } else {
                log.debug("Event from {} -> {}", event.getChannelIdentity(), TurnResultDTO.of(result));
            }
        });
        return ResponseEntity.accepted().build();
    }

    private static String validate(InboundEvent event) {
        if (event == null) {
            return "empty body";
        }
        if (event.getTenantId() == null || event.getChannel() == null || event.getKind() == null) {
            return "tenantId, channel and kind are required";
        }
        if (event.getChannelIdentity() == null || event.getChannelIdentity().isBlank()) {
            return "channelIdentity is required";
        }
        if (event.getKind().isSynthetic()) {
            return "kind " + event.getKind() + " cannot be posted";
        }
        if (event.getPayload() == null) {
            return "payload is required";
        }
        return null;
    }
}
