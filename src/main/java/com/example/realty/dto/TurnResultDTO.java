package com.example.realty.dto;

import com.example.realty.service.dispatch.TurnResult;

public record TurnResultDTO(Long leadId, String status, String state, String detail) {

    public static TurnResultDTO of(TurnResult result) {
        return new TurnResultDTO(
                result.leadId(),
                result.status().name(),
                result.state() == null ? null : result.state().name(),
                result.detail());
    }
}
