package com.example.realty.service.brain;

/** Declared in execution order. */
public enum DirectiveType {
    PERSIST,
    SEND_REPLY,
    NOTIFY_ADMIN
}
