package com.example.realty.dto;

import com.example.realty.model.Channel;
import com.example.realty.model.EventKind;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class InboundEvent {

    private Long tenantId;
    private Channel channel;
    private String channelIdentity;
    private String displayName;
    private EventKind kind;
    private String payload;
    private LocalDateTime timestamp;

    /** only set on events synthesized by the follow-up scheduler */
    @JsonIgnore
    private FollowupTick tick;

    public LeadKey leadKey() {
        return new LeadKey(tenantId, channel, channelIdentity);
    }

    public String text() {
        return payload == null ? "" : payload.trim();
    }
}
