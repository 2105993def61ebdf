package com.example.realty.dto;

import com.example.realty.model.Channel;

public record TenantChannelKey(Long tenantId, Channel channel) {

    @Override
    public String toString() {
        return tenantId + "/" + channel.name().toLowerCase();
    }
}
