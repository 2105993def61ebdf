package com.example.realty.dto;

import com.example.realty.model.Channel;
import com.example.realty.model.Lead;

public record LeadKey(Long tenantId, Channel channel, String channelIdentity) {

    public static LeadKey of(Lead lead) {
        return new LeadKey(lead.getTenantId(), lead.getChannel(), lead.getChannelIdentity());
    }

    public TenantChannelKey tenantChannel() {
        return new TenantChannelKey(tenantId, channel);
    }
}
