package com.example.realty.dto;

import java.time.LocalDateTime;

public record BotStatusDTO(Long tenantId, String channel, String state, String error, LocalDateTime since) {
}
