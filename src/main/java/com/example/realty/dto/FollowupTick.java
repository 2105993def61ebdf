package com.example.realty.dto;

/**
 * Payload of a synthetic follow-up event. {@code forced} skips the due-time check (manual trigger).
 */
public record FollowupTick(int stage, boolean forced) {

    public static FollowupTick drip(int stage) {
        return new FollowupTick(stage, false);
    }

    public static FollowupTick manual(int stage) {
        return new FollowupTick(stage, true);
    }

    public static FollowupTick ghost() {
        return new FollowupTick(-1, false);
    }
}
