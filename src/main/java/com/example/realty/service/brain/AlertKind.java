package com.example.realty.service.brain;

public enum AlertKind {
    NEW_CONTACT,
    HOT_LEAD,
    ESCALATION
}
