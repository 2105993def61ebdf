package com.example.realty.service.dispatch;

import com.example.realty.dto.FollowupTick;
import com.example.realty.dto.InboundEvent;
import com.example.realty.dto.LeadKey;
import com.example.realty.dto.OutboundReply;
import com.example.realty.model.DeliveryStatus;
import com.example.realty.model.EventKind;
import com.example.realty.model.Language;
import com.example.realty.model.Lead;
import com.example.realty.model.Tenant;
import com.example.realty.service.TenantSettingsService;
import com.example.realty.service.brain.ConversationBrain;
import com.example.realty.service.brain.Outcome;
import com.example.realty.service.brain.ReplyCatalog;
import com.example.realty.service.channel.ChannelConnection;
import com.example.realty.service.exception.ChannelDeliveryException;
import com.example.realty.service.exception.LeadNotFoundException;
import com.example.realty.service.exception.SessionStoreException;
import com.example.realty.service.followup.ClaimKind;
import com.example.realty.service.followup.FollowupLedger;
import com.example.realty.service.followup.FollowupPolicy;
import com.example.realty.service.scoring.LeadScorer;
import com.example.realty.service.session.LeadSessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Optional;

/**
 * Runs one turn for one lead. Always called through the {@link LeadSequencer}, so nothing else touches
 * the lead while this runs. Order of effects: persist, reply, admin alerts.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TurnProcessor {

    private final LeadSessionStore sessionStore;
    private final ConversationBrain brain;
    private final FollowupLedger ledger;
    private final FollowupPolicy followupPolicy;
    private final LeadScorer scorer;
    private final ReplyCatalog replies;
    private final AdminNotifier adminNotifier;
    private final TenantSettingsService settingsService;
    private final Clock clock;

    public TurnResult process(InboundEvent event, ChannelConnection connection) {
        LeadKey key = event.leadKey();
        LocalDateTime now = LocalDateTime.now(clock);

        Optional<Tenant> tenant = settingsService.findTenant(key.tenantId());
        if (tenant.isEmpty()) {
            log.warn("Dropping {} event for unknown tenant {}", event.getKind(), key.tenantId());
            return TurnResult.aborted(key, null, "unknown tenant");
        }
        Language fallbackLanguage = tenant.get().getDefaultLanguage();

        Lead lead;
        try {
            if (event.getKind().isSynthetic()) {
                Optional<Lead> existing = sessionStore.find(key);
                if (existing.isEmpty()) {
                    log.debug("Dropping {} for {}, the lead no longer exists", event.getKind(), key);
                    return TurnResult.skipped(key, null, "lead not found");
                }
                lead = existing.get();
            } else {
                lead = sessionStore.resolve(key, event.getDisplayName(), fallbackLanguage);
            }
        } catch (SessionStoreException e) {
            log.error("Lead {} could not be loaded: {}", key, e.getMessage());
            sendFallback(connection, key, fallbackLanguage, event);
            return TurnResult.aborted(key, null, e.getMessage());
        }

        String claimToken = null;
        boolean committed = false;
        try {
            InboundEvent effective = event;
            if (event.getKind().isSynthetic()) {
                ClaimKind kind = event.getKind() == EventKind.GHOST_TICK ? ClaimKind.GHOST : ClaimKind.DRIP;
                boolean forced = event.getTick() != null && event.getTick().forced();
                Optional<String> claim = ledger.claim(lead.getId(), kind, forced, now);
                if (claim.isEmpty()) {
                    return TurnResult.skipped(key, lead.getId(), kind + " claim lost");
                }
                claimToken = claim.get();
                // the claim was written behind the cache, so the entity must carry the token before it is saved
                Long leadId = lead.getId();
                lead = sessionStore.reload(leadId).orElseThrow(() -> new LeadNotFoundException(leadId));
                if (kind == ClaimKind.DRIP) {
                    effective = event.toBuilder().tick(new FollowupTick(lead.getFollowupStage(), forced)).build();
                }
            }

            int stageBefore = lead.getFollowupStage();
            Outcome outcome = brain.process(lead, effective, now, tenant.get().getName());
            apply(lead, outcome, effective, now);

            Lead saved;
            try {
                saved = sessionStore.save(lead);
            } catch (SessionStoreException e) {
                sendFallback(connection, key, languageOf(lead, fallbackLanguage), event);
                return TurnResult.aborted(key, lead.getId(), e.getMessage());
            }

            boolean delivered = false;
            String deliveryError = null;
            if (outcome.hasReply()) {
                try {
                    connection.send(new OutboundReply(key.channelIdentity(), outcome.getReplyText(), outcome.getButtons()));
                    delivered = true;
                } catch (ChannelDeliveryException e) {
                    deliveryError = e.getMessage();
                    log.warn("Reply to lead {} not delivered: {}", saved.getId(), e.getMessage());
                    markPending(saved);
                }
            }

            if (claimToken != null && delivered) {
                committed = ledger.commit(saved.getId(), claimToken, stageBefore, now);
            }

            outcome.getAdminAlerts().forEach(adminNotifier::notify);

            log.debug("Lead {} {} -> {} ({})", saved.getId(), event.getKind(), outcome.getPath(),
                    outcome.hasReply() ? (delivered ? "replied" : "reply pending") : "silent");
            if (deliveryError != null) {
                return TurnResult.deliveryPending(key, saved.getId(), outcome.getNextState(), deliveryError);
            }
            return TurnResult.completed(key, saved.getId(), outcome.getNextState());
        } catch (RuntimeException e) {
            log.error("Turn for lead {} failed", key, e);
            sessionStore.evict(key);
            sendFallback(connection, key, languageOf(lead, fallbackLanguage), event);
            return TurnResult.aborted(key, lead.getId(), e.toString());
        } finally {
            if (claimToken != null) {
                if (!committed) {
                    releaseQuietly(lead.getId(), claimToken);
                }
                // claim columns were changed by query, the cached entity is stale either way
                sessionStore.evict(key);
            }
        }
    }

    private void apply(Lead lead, Outcome outcome, InboundEvent event, LocalDateTime now) {
        lead.setConversationState(outcome.getNextState());
        if (!outcome.getSlotUpdates().isEmpty()) {
            if (lead.getSlots() == null) {
                lead.setSlots(new LinkedHashMap<>());
            }
            outcome.getSlotUpdates().forEach(lead.getSlots()::putIfAbsent);
        }
        if (outcome.getLanguage() != null) {
            lead.setLanguage(outcome.getLanguage());
        }
        if (outcome.getPhone() != null) {
            lead.setPhone(outcome.getPhone());
        }
        if (outcome.getContactRetries() != null) {
            lead.setContactRetries(outcome.getContactRetries());
        }
        if (!event.getKind().isSynthetic()) {
            if (event.getDisplayName() != null && !event.getDisplayName().isBlank()) {
                lead.setDisplayName(event.getDisplayName());
            }
            lead.setLastInteractionAt(now);
            followupPolicy.onInbound(lead, now);
        } else if (followupPolicy.isExcluded(lead.getConversationState())) {
            lead.setNextFollowupAt(null);
        }
        if (outcome.hasReply()) {
            lead.setDeliveryStatus(DeliveryStatus.DELIVERED);
        }
        scorer.rescore(lead, now);
    }

    private void markPending(Lead lead) {
        lead.setDeliveryStatus(DeliveryStatus.PENDING);
        try {
            sessionStore.save(lead);
        } catch (SessionStoreException e) {
            log.warn("Could not flag lead {} as pending: {}", lead.getId(), e.getMessage());
        }
    }

    private void sendFallback(ChannelConnection connection, LeadKey key, Language language, InboundEvent event) {
        if (event.getKind().isSynthetic()) {
            // nobody is waiting on a scheduler tick
            return;
        }
        try {
            connection.send(OutboundReply.text(key.channelIdentity(), replies.genericError(language)));
        } catch (RuntimeException e) {
            log.warn("Fallback reply to {} failed: {}", key, e.getMessage());
        }
    }

    private void releaseQuietly(Long leadId, String token) {
        try {
            ledger.release(leadId, token);
        } catch (RuntimeException e) {
            log.warn("Could not release claim {} on lead {}, it will be recovered as stale: {}",
                    token, leadId, e.getMessage());
        }
    }

    private static Language languageOf(Lead lead, Language fallback) {
        return lead.getLanguage() != null ? lead.getLanguage() : fallback;
    }
}
