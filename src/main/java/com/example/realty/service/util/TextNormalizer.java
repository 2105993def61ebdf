package com.example.realty.service.util;

import java.util.Locale;

public final class TextNormalizer {
    private TextNormalizer() {}

    /** Maps Persian and Arabic-Indic digits and separators to ASCII. */
    public static String normalizeDigits(String text) {
        if (text == null) {
            return null;
        }
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c >= '۰' && c <= '۹') {
                sb.append((char) ('0' + (c - '۰')));
            } else if (c >= '٠' && c <= '٩') {
                sb.append((char) ('0' + (c - '٠')));
            } else if (c == '٬') {
                sb.append(',');
            } else if (c == '٫') {
                sb.append('.');
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /** Lower-cased, digit-normalized, dashes unified, whitespace collapsed. */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String cleaned = normalizeDigits(text)
                .replace('–', '-')
                .replace('—', '-')
                .replace('−', '-')
                .replace(' ', ' ')
                .replace('‌', ' ');
        return cleaned.replaceAll("\\s+", " ").trim().toLowerCase(Locale.ROOT);
    }
}
