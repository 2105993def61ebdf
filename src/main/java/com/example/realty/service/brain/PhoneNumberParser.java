package com.example.realty.service.brain;

import com.example.realty.service.util.TextNormalizer;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class PhoneNumberParser {

    private static final Pattern CANDIDATE = Pattern.compile("(?:\\+|00)?\\d[\\d\\s\\-().]{5,}\\d");
    private static final int MIN_DIGITS = 8;
    private static final int MAX_DIGITS = 15;

    /**
     * Finds a phone number in free text and returns it as digits, with a leading {@code +} when
     * the customer wrote an international prefix.
     */
    public Optional<String> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Matcher matcher = CANDIDATE.matcher(TextNormalizer.normalizeDigits(text));
        while (matcher.find()) {
            String candidate = matcher.group().trim();
            boolean international = candidate.startsWith("+") || candidate.startsWith("00");
            String digits = candidate.replaceAll("\\D", "");
            if (candidate.startsWith("00")) {
                digits = digits.substring(2);
            }
            if (digits.length() >= MIN_DIGITS && digits.length() <= MAX_DIGITS) {
                return Optional.of(international ? "+" + digits : digits);
            }
        }
        return Optional.empty();
    }
}
