package com.example.realty.service.followup;

import com.example.realty.config.EngineProperties;
import com.example.realty.model.ConversationState;
import com.example.realty.model.Lead;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Drip timing. Stage N is due {@code delay(N)} after the last inbound message or the previous send;
 * stage {@value #EXIT_STAGE} is the graceful exit, after which follow-ups stop for good.
 */
@Component
@RequiredArgsConstructor
public class FollowupPolicy {

    public static final int EXIT_STAGE = 4;

    private final EngineProperties properties;

    public Duration delay(int stage) {
        List<Duration> delays = properties.getFollowup().getStageDelays();
        int index = Math.max(0, Math.min(stage, delays.size() - 1));
        return delays.get(index);
    }

    /** Re-arms the drip after a real inbound turn, or clears it once the lead left the automated funnel. */
    public void onInbound(Lead lead, LocalDateTime now) {
        if (!lead.getConversationState().acceptsFollowups()) {
            lead.setNextFollowupAt(null);
            return;
        }
        if (lead.isFollowupEnabled()) {
            lead.setNextFollowupAt(now.plus(delay(lead.getFollowupStage())));
        }
    }

    public StageAdvance afterSend(int sentStage, LocalDateTime now) {
        if (sentStage >= EXIT_STAGE) {
            return new StageAdvance(EXIT_STAGE, null, false);
        }
        int next = sentStage + 1;
        return new StageAdvance(next, now.plus(delay(next)), true);
    }

    public boolean isExcluded(ConversationState state) {
        return ConversationState.FOLLOWUP_EXCLUDED.contains(state);
    }

    public record StageAdvance(int stage, LocalDateTime nextFollowupAt, boolean enabled) {}
}
