package com.example.realty.service.brain;

public record Triage(InputKind kind, boolean bookingIntent, boolean stronglyNegative) {

    public static Triage of(InputKind kind) {
        return new Triage(kind, false, false);
    }

    public boolean is(InputKind other) {
        return kind == other;
    }
}
