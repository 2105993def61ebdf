package com.example.realty.dto;

import com.example.realty.model.Lead;

import java.time.LocalDateTime;
import java.util.Map;

public record LeadSummaryDTO(Long id,
                             Long tenantId,
                             String channel,
                             String state,
                             String temperature,
                             int leadScore,
                             boolean followupEnabled,
                             int followupStage,
                             LocalDateTime nextFollowupAt,
                             Map<String, String> slots) {

    public static LeadSummaryDTO of(Lead lead) {
        return new LeadSummaryDTO(
                lead.getId(),
                lead.getTenantId(),
                lead.getChannel().name(),
                lead.getConversationState().name(),
                lead.getTemperature() == null ? null : lead.getTemperature().name(),
                lead.getLeadScore(),
                lead.isFollowupEnabled(),
                lead.getFollowupStage(),
                lead.getNextFollowupAt(),
                lead.getSlots() == null ? Map.of() : Map.copyOf(lead.getSlots()));
    }
}
