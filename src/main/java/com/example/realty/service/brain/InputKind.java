package com.example.realty.service.brain;

/**
 * Result of triage, in priority order: a media request wins over a question, a question over slot data.
 */
public enum InputKind {
    MEDIA_REQUEST,
    QUESTION,
    SLOT_CANDIDATE,
    UNRECOGNIZED
}
