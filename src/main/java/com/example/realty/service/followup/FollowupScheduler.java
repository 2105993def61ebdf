package com.example.realty.service.followup;

import com.example.realty.config.EngineProperties;
import com.example.realty.dto.FollowupTick;
import com.example.realty.dto.InboundEvent;
import com.example.realty.dto.LeadKey;
import com.example.realty.model.EventKind;
import com.example.realty.model.Lead;
import com.example.realty.service.dispatch.LeadSequencer;
import com.example.realty.service.dispatch.TurnResult;
import com.example.realty.service.exception.LeadNotFoundException;
import com.example.realty.service.manager.MultiTenantBotManager;
import com.example.realty.service.session.LeadSessionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Finds leads that are due and pushes synthetic ticks through their dispatcher. The scan itself claims
 * nothing: the claim is taken inside the lead's turn, so a lead picked up twice is only handled once.
 */
@Slf4j
@Service
public class FollowupScheduler {

    private final LeadSessionStore sessionStore;
    private final FollowupLedger ledger;
    private final MultiTenantBotManager botManager;
    private final LeadSequencer sequencer;
    private final EngineProperties properties;
    private final Clock clock;
    private final Executor leadTaskExecutor;

    public FollowupScheduler(LeadSessionStore sessionStore,
                             FollowupLedger ledger,
                             MultiTenantBotManager botManager,
                             LeadSequencer sequencer,
                             EngineProperties properties,
                             Clock clock,
                             @Qualifier("leadTaskExecutor") Executor leadTaskExecutor) {
        this.sessionStore = sessionStore;
        this.ledger = ledger;
        this.botManager = botManager;
        this.sequencer = sequencer;
        this.properties = properties;
        this.clock = clock;
        this.leadTaskExecutor = leadTaskExecutor;
    }

    @Scheduled(fixedDelayString = "${engine.followup.scan-interval:PT30M}",
            initialDelayString = "${engine.followup.initial-delay:PT1M}")
    public void runDripPass() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<Lead> due = sessionStore.findDueForFollowup(now, properties.getFollowup().getBatchSize());
        if (due.isEmpty()) {
            return;
        }
        log.info("Drip pass: {} leads due", due.size());
        for (Lead lead : due) {
            submit(tick(lead, EventKind.FOLLOWUP_TICK, FollowupTick.drip(lead.getFollowupStage()), now));
        }
    }

    @Scheduled(fixedDelayString = "${engine.followup.ghost-scan-interval:PT10M}",
            initialDelayString = "${engine.followup.initial-delay:PT1M}")
    public void runGhostPass() {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime cutoff = now.minus(properties.getFollowup().getGhostDelay());
        List<Lead> silent = sessionStore.findGhostCandidates(cutoff, properties.getFollowup().getBatchSize());
        if (silent.isEmpty()) {
            return;
        }
        log.info("Ghost pass: {} silent leads", silent.size());
        for (Lead lead : silent) {
            submit(tick(lead, EventKind.GHOST_TICK, FollowupTick.ghost(), now));
        }
    }

    /** Claims left behind by a crash mid-send. */
    @Scheduled(fixedDelayString = "${engine.followup.recovery-interval:PT15M}",
            initialDelayString = "${engine.followup.initial-delay:PT1M}")
    public void recoverStaleClaims() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<Lead> stale = sessionStore.findStaleClaims(now.minus(properties.getFollowup().getClaimTimeout()));
        for (Lead lead : stale) {
            LeadKey key = LeadKey.of(lead);
            sequencer.submit(key, leadTaskExecutor, () -> {
                boolean recovered = ledger.recover(lead, now);
                sessionStore.evict(key);
                return recovered;
            }).whenComplete((recovered, error) -> {
                if (error != null) {
                    log.error("Stale claim on lead {} not recovered: {}", lead.getId(), error.toString());
                }
            });
        }
    }

    /** Sends the lead's current drip stage now, regardless of its due time. */
    public CompletableFuture<TurnResult> trigger(Long leadId) {
        Lead lead = sessionStore.findById(leadId).orElseThrow(() -> new LeadNotFoundException(leadId));
        log.info("Manual follow-up for lead {} at stage {}", leadId, lead.getFollowupStage());
        return botManager.dispatch(tick(lead, EventKind.FOLLOWUP_TICK,
                FollowupTick.manual(lead.getFollowupStage()), LocalDateTime.now(clock)));
    }

    private void submit(InboundEvent event) {
        botManager.dispatch(event).whenComplete((result, error) -> {
            if (error != null) {
                log.warn("{} for {} not dispatched: {}", event.getKind(), event.leadKey(), error.toString());
            } else if (result.status() == TurnResult.Status.SKIPPED) {
                log.debug("{} for lead {} skipped: {}", event.getKind(), result.leadId(), result.detail());
            }
        });
    }

    private static InboundEvent tick(Lead lead, EventKind kind, FollowupTick tick, LocalDateTime now) {
        return InboundEvent.builder()
                .tenantId(lead.getTenantId())
                .channel(lead.getChannel())
                .channelIdentity(lead.getChannelIdentity())
                .kind(kind)
                .tick(tick)
                .timestamp(now)
                .build();
    }
}
