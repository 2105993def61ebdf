package com.example.realty.service.scoring;

import com.example.realty.config.EngineProperties;
import com.example.realty.model.ConversationState;
import com.example.realty.model.Lead;
import com.example.realty.model.LeadTemperature;
import com.example.realty.model.SlotNames;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.Map;

/**
 * Default lead score (0..100): funnel progress up to 40, qualification data up to 40, recency up to 20.
 * Temperature cut-offs come from {@code engine.scoring.*}.
 */
@Component
@RequiredArgsConstructor
public class LeadScorer {

    private static final Map<ConversationState, Integer> PROGRESS = new EnumMap<>(ConversationState.class);

    static {
        PROGRESS.put(ConversationState.START, 0);
        PROGRESS.put(ConversationState.LANGUAGE_SELECT, 2);
        PROGRESS.put(ConversationState.WARMUP, 5);
        PROGRESS.put(ConversationState.CAPTURE_CONTACT, 10);
        PROGRESS.put(ConversationState.SLOT_FILLING, 20);
        PROGRESS.put(ConversationState.VALUE_PROPOSITION, 25);
        PROGRESS.put(ConversationState.ENGAGEMENT, 30);
        PROGRESS.put(ConversationState.HARD_GATE, 35);
        PROGRESS.put(ConversationState.HANDOFF, 40);
        PROGRESS.put(ConversationState.CLOSED_WON, 40);
        PROGRESS.put(ConversationState.CLOSED_LOST, 0);
    }

    private final EngineProperties properties;

    public int score(Lead lead, LocalDateTime now) {
        int progress = PROGRESS.getOrDefault(lead.getConversationState(), 0);

        int qualification = 0;
        if (lead.getPhone() != null && !lead.getPhone().isBlank()) {
            qualification += 15;
        }
        if (lead.hasSlot(SlotNames.BUDGET_MIN) || lead.hasSlot(SlotNames.BUDGET_MAX)) {
            qualification += 10;
        }
        if (lead.hasSlot(SlotNames.GOAL)) {
            qualification += 5;
        }
        if (lead.hasSlot(SlotNames.PROPERTY_TYPE)) {
            qualification += 5;
        }
        if (lead.hasSlot(SlotNames.LOCATION)) {
            qualification += 5;
        }

        return Math.min(100, progress + qualification + recency(lead.getLastInteractionAt(), now));
    }

    public LeadTemperature temperature(int score) {
        EngineProperties.ScoringConfig config = properties.getScoring();
        if (score >= config.getBurningThreshold()) {
            return LeadTemperature.BURNING;
        }
        if (score >= config.getHotThreshold()) {
            return LeadTemperature.HOT;
        }
        if (score >= config.getWarmThreshold()) {
            return LeadTemperature.WARM;
        }
        return LeadTemperature.COLD;
    }

    public void rescore(Lead lead, LocalDateTime now) {
        int score = score(lead, now);
        lead.setLeadScore(score);
        lead.setTemperature(temperature(score));
    }

    private static int recency(LocalDateTime lastInteraction, LocalDateTime now) {
        if (lastInteraction == null) {
            return 0;
        }
        long hours = Duration.between(lastInteraction, now).toHours();
        if (hours < 1) {
            return 20;
        }
        if (hours < 6) {
            return 15;
        }
        if (hours < 24) {
            return 10;
        }
        if (hours < 72) {
            return 5;
        }
        return 0;
    }
}
