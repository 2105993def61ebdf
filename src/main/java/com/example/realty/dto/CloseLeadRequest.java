package com.example.realty.dto;

public record CloseLeadRequest(boolean won) {
}
