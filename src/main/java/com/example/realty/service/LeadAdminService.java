package com.example.realty.service;

import com.example.realty.dto.LeadKey;
import com.example.realty.model.ConversationState;
import com.example.realty.model.Lead;
import com.example.realty.service.dispatch.LeadSequencer;
import com.example.realty.service.exception.LeadNotFoundException;
import com.example.realty.service.followup.FollowupPolicy;
import com.example.realty.service.scoring.LeadScorer;
import com.example.realty.service.session.LeadSessionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.UnaryOperator;

/**
 * Operator actions on a single lead. They go through the same per-lead lane as conversation turns.
 */
@Slf4j
@Service
public class LeadAdminService {

    private final LeadSessionStore sessionStore;
    private final LeadSequencer sequencer;
    private final FollowupPolicy followupPolicy;
    private final LeadScorer scorer;
    private final Clock clock;
    private final Executor leadTaskExecutor;

    public LeadAdminService(LeadSessionStore sessionStore,
                            LeadSequencer sequencer,
                            FollowupPolicy followupPolicy,
                            LeadScorer scorer,
                            Clock clock,
                            @Qualifier("leadTaskExecutor") Executor leadTaskExecutor) {
        this.sessionStore = sessionStore;
        this.sequencer = sequencer;
        this.followupPolicy = followupPolicy;
        this.scorer = scorer;
        this.clock = clock;
        this.leadTaskExecutor = leadTaskExecutor;
    }

    public Lead getLead(Long leadId) {
        return sessionStore.findById(leadId).orElseThrow(() -> new LeadNotFoundException(leadId));
    }

    public Lead setFollowupEnabled(Long leadId, boolean enabled) {
        return mutate(leadId, lead -> {
            LocalDateTime now = LocalDateTime.now(clock);
            lead.setFollowupEnabled(enabled);
            if (!enabled) {
                lead.setNextFollowupAt(null);
            } else if (!followupPolicy.isExcluded(lead.getConversationState()) && lead.getNextFollowupAt() == null) {
                lead.setNextFollowupAt(now.plus(followupPolicy.delay(lead.getFollowupStage())));
            }
            log.info("Follow-up for lead {} {}", leadId, enabled ? "enabled" : "disabled");
            return lead;
        });
    }

    /**
     * @throws IllegalStateException when the lead is already closed the other way
     */
    public Lead close(Long leadId, boolean won) {
        ConversationState target = won ? ConversationState.CLOSED_WON : ConversationState.CLOSED_LOST;
        return mutate(leadId, lead -> {
            ConversationState current = lead.getConversationState();
            if (current == target) {
                return lead;
            }
            if (!current.canTransitionTo(target)) {
                throw new IllegalStateException("Lead " + leadId + " is already " + current);
            }
            lead.setConversationState(target);
            lead.setNextFollowupAt(null);
            scorer.rescore(lead, LocalDateTime.now(clock));
            log.info("Lead {} closed as {}", leadId, target);
            return lead;
        });
    }

    private Lead mutate(Long leadId, UnaryOperator<Lead> change) {
        Lead snapshot = getLead(leadId);
        LeadKey key = LeadKey.of(snapshot);
        try {
            return sequencer.submit(key, leadTaskExecutor, () -> {
                // re-read inside the lane, an earlier turn may have changed the lead
                Lead fresh = sessionStore.reload(leadId).orElseThrow(() -> new LeadNotFoundException(leadId));
                return sessionStore.save(change.apply(fresh));
            }).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
