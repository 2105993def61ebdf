package com.example.realty.service.extraction;

import com.example.realty.model.SlotNames;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Candidate slot values pulled out of one message. Immutable; never contains blank values.
 */
public final class PartialSlots {

    private static final PartialSlots EMPTY = new PartialSlots(Map.of());

    private final Map<String, String> values;

    private PartialSlots(Map<String, String> values) {
        this.values = values;
    }

    public static PartialSlots empty() {
        return EMPTY;
    }

    public static PartialSlots of(Map<String, String> values) {
        Map<String, String> copy = new LinkedHashMap<>();
        values.forEach((key, value) -> {
            if (SlotNames.isKnown(key) && value != null && !value.isBlank()) {
                copy.put(key, value.trim());
            }
        });
        return copy.isEmpty() ? EMPTY : new PartialSlots(Collections.unmodifiableMap(copy));
    }

    public String get(String name) {
        return values.get(name);
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<String, String> asMap() {
        return values;
    }

    /** Keeps this result's values and adds only the keys {@code other} has that this one lacks. */
    public PartialSlots orElse(PartialSlots other) {
        if (other.isEmpty()) {
            return this;
        }
        Map<String, String> merged = new LinkedHashMap<>(values);
        other.values.forEach(merged::putIfAbsent);
        return of(merged);
    }

    /** Drops every key that already carries a non-blank value in {@code known}. */
    public PartialSlots withoutKnown(Map<String, String> known) {
        if (known == null || known.isEmpty() || isEmpty()) {
            return this;
        }
        Map<String, String> remaining = new LinkedHashMap<>(values);
        known.forEach((key, value) -> {
            if (value != null && !value.isBlank()) {
                remaining.remove(key);
            }
        });
        return of(remaining);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
