package com.example.realty.dto;

public record FollowupToggleRequest(boolean enabled) {
}
