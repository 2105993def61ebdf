package com.example.realty.model;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static java.util.Map.entry;

/**
 * Qualification funnel. Edges outside {@link #canTransitionTo(ConversationState)} are never produced.
 */
public enum ConversationState {
    START,
    LANGUAGE_SELECT,
    WARMUP,
    CAPTURE_CONTACT,
    SLOT_FILLING,
    VALUE_PROPOSITION,
    HARD_GATE,
    ENGAGEMENT,
    HANDOFF,
    CLOSED_WON,
    CLOSED_LOST;

    private static final Map<ConversationState, Set<ConversationState>> EDGES = Map.ofEntries(
            entry(START, EnumSet.of(LANGUAGE_SELECT, WARMUP)),
            entry(LANGUAGE_SELECT, EnumSet.of(LANGUAGE_SELECT, WARMUP)),
            entry(WARMUP, EnumSet.of(WARMUP, CAPTURE_CONTACT)),
            entry(CAPTURE_CONTACT, EnumSet.of(CAPTURE_CONTACT, SLOT_FILLING)),
            entry(SLOT_FILLING, EnumSet.of(SLOT_FILLING, VALUE_PROPOSITION)),
            entry(VALUE_PROPOSITION, EnumSet.of(ENGAGEMENT)),
            entry(ENGAGEMENT, EnumSet.of(ENGAGEMENT, HARD_GATE, HANDOFF)),
            entry(HARD_GATE, EnumSet.of(HARD_GATE, HANDOFF)),
            entry(HANDOFF, EnumSet.of(HANDOFF)),
            entry(CLOSED_WON, EnumSet.of(CLOSED_WON)),
            entry(CLOSED_LOST, EnumSet.of(CLOSED_LOST))
    );

    /** States the follow-up scheduler never touches. */
    public static final Set<ConversationState> FOLLOWUP_EXCLUDED = EnumSet.of(HANDOFF, CLOSED_WON, CLOSED_LOST);

    public boolean isTerminal() {
        return this == CLOSED_WON || this == CLOSED_LOST;
    }

    public boolean canTransitionTo(ConversationState next) {
        if (next == null) {
            return false;
        }
        if (next.isTerminal() && !isTerminal()) {
            // administrative close is allowed from anywhere in the funnel
            return true;
        }
        return EDGES.get(this).contains(next);
    }

    public boolean acceptsFollowups() {
        return !FOLLOWUP_EXCLUDED.contains(this);
    }
}
