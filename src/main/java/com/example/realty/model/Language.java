package com.example.realty.model;

import java.util.Locale;
import java.util.Optional;

public enum Language {
    EN("en", "English"),
    FA("fa", "فارسی"),
    AR("ar", "العربية"),
    RU("ru", "Русский");

    private final String code;
    private final String nativeName;

    Language(String code, String nativeName) {
        this.code = code;
        this.nativeName = nativeName;
    }

    public String code() {
        return code;
    }

    public String nativeName() {
        return nativeName;
    }

    public Locale locale() {
        return Locale.forLanguageTag(code);
    }

    public static Optional<Language> fromCode(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Language language : values()) {
            if (language.code.equals(normalized)
                    || language.name().equalsIgnoreCase(normalized)
                    || language.nativeName.equalsIgnoreCase(value.trim())) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }
}
