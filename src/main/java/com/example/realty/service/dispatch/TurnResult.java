package com.example.realty.service.dispatch;

import com.example.realty.dto.LeadKey;
import com.example.realty.model.ConversationState;

public record TurnResult(LeadKey key, Long leadId, Status status, ConversationState state, String detail) {

    public enum Status {
        COMPLETED,
        /** follow-up claim lost, someone else handled this window */
        SKIPPED,
        /** nothing persisted, fallback reply attempted */
        ABORTED,
        /** persisted, but the reply did not reach the transport */
        DELIVERY_PENDING
    }

    public static TurnResult completed(LeadKey key, Long leadId, ConversationState state) {
        return new TurnResult(key, leadId, Status.COMPLETED, state, null);
    }

    public static TurnResult deliveryPending(LeadKey key, Long leadId, ConversationState state, String detail) {
        return new TurnResult(key, leadId, Status.DELIVERY_PENDING, state, detail);
    }

    public static TurnResult skipped(LeadKey key, Long leadId, String detail) {
        return new TurnResult(key, leadId, Status.SKIPPED, null, detail);
    }

    public static TurnResult aborted(LeadKey key, Long leadId, String detail) {
        return new TurnResult(key, leadId, Status.ABORTED, null, detail);
    }
}
