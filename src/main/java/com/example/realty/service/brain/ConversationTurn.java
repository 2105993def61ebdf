package com.example.realty.service.brain;

import com.example.realty.dto.InboundEvent;
import com.example.realty.model.Lead;

import java.time.LocalDateTime;

/** Unit of work for one transition. Not persisted. */
public record ConversationTurn(Lead lead, InboundEvent event, LocalDateTime now, TurnFacts facts) {
}
