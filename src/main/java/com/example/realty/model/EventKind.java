package com.example.realty.model;

public enum EventKind {
    TEXT,
    VOICE_TEXT,
    IMAGE_DESCRIPTION,
    BUTTON,
    FOLLOWUP_TICK,
    GHOST_TICK;

    public boolean isSynthetic() {
        return this == FOLLOWUP_TICK || this == GHOST_TICK;
    }

    public boolean isFreeText() {
        return this == TEXT || this == VOICE_TEXT || this == IMAGE_DESCRIPTION;
    }
}
