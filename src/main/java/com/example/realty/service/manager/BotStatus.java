package com.example.realty.service.manager;

import com.example.realty.dto.BotStatusDTO;
import com.example.realty.dto.TenantChannelKey;

import java.time.LocalDateTime;

public record BotStatus(TenantChannelKey key, State state, String error, LocalDateTime since) {

    public enum State {
        RUNNING,
        STOPPED,
        FAILED
    }

    public static BotStatus running(TenantChannelKey key, LocalDateTime since) {
        return new BotStatus(key, State.RUNNING, null, since);
    }

    public static BotStatus stopped(TenantChannelKey key, LocalDateTime since) {
        return new BotStatus(key, State.STOPPED, null, since);
    }

    public static BotStatus failed(TenantChannelKey key, String error, LocalDateTime since) {
        return new BotStatus(key, State.FAILED, error, since);
    }

    public BotStatusDTO toDto() {
        return new BotStatusDTO(key.tenantId(), key.channel().name(), state.name(), error, since);
    }
}
