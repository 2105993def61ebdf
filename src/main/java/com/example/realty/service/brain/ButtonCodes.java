package com.example.realty.service.brain;

import com.example.realty.model.Language;
import com.example.realty.model.SlotNames;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Callback data carried by reply buttons: {@code lang:fa}, {@code slot:goal:investment},
 * {@code slot:budget:1000000-2000000}, {@code action:book}.
 */
public final class ButtonCodes {

    public static final String LANGUAGE_PREFIX = "lang:";
    public static final String SLOT_PREFIX = "slot:";
    public static final String BUDGET = "budget";
    public static final String BOOK = "action:book";
    public static final String PHOTOS = "action:photos";

    private ButtonCodes() {}

    public static String language(Language language) {
        return LANGUAGE_PREFIX + language.code();
    }

    public static String slot(String name, String value) {
        return SLOT_PREFIX + name + ":" + value;
    }

    public static String budget(Long min, Long max) {
        return SLOT_PREFIX + BUDGET + ":" + (min == null ? "" : min) + "-" + (max == null ? "" : max);
    }

    public static Optional<Language> parseLanguage(String data) {
        if (data == null || !data.startsWith(LANGUAGE_PREFIX)) {
            return Optional.empty();
        }
        return Language.fromCode(data.substring(LANGUAGE_PREFIX.length()));
    }

    /** Slot values carried by a {@code slot:} button; empty for anything else. */
    public static Map<String, String> parseSlots(String data) {
        Map<String, String> values = new LinkedHashMap<>();
        if (data == null || !data.startsWith(SLOT_PREFIX)) {
            return values;
        }
        String[] parts = data.substring(SLOT_PREFIX.length()).split(":", 2);
        if (parts.length != 2 || parts[1].isBlank()) {
            return values;
        }
        if (BUDGET.equals(parts[0])) {
            String[] bounds = parts[1].split("-", -1);
            if (bounds.length == 2) {
                putNumber(values, SlotNames.BUDGET_MIN, bounds[0]);
                putNumber(values, SlotNames.BUDGET_MAX, bounds[1]);
            }
        } else if (SlotNames.isKnown(parts[0])) {
            values.put(parts[0], parts[1]);
        }
        return values;
    }

    public static boolean is(String data, String code) {
        return data != null && data.equals(code);
    }

    private static void putNumber(Map<String, String> values, String key, String raw) {
        if (raw != null && raw.matches("\\d+")) {
            values.put(key, raw);
        }
    }
}
