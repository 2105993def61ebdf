package com.example.realty.service.brain;

import com.example.realty.service.util.TextNormalizer;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import static java.util.Map.entry;

/**
 * Weighted negative-phrase lexicon. Only a strong signal escalates a conversation.
 * Phrases match whole words; a trailing {@code *} marks a stem that may be followed by an inflection.
 */
@Component
public class SentimentAnalyzer {

    static final int STRONG_NEGATIVE_THRESHOLD = 3;

    private static final Map<String, Integer> NEGATIVE = Map.ofEntries(
            entry("scam", 3), entry("fraud", 3), entry("liar", 3), entry("stop messaging", 3),
            entry("stop texting", 3), entry("leave me alone", 3), entry("unsubscribe", 3),
            entry("complaint", 2), entry("fuck*", 3), entry("idiot", 3), entry("worst", 2),
            entry("terrible", 2), entry("angry", 2), entry("useless", 2), entry("ridiculous", 2),
            entry("disappointed", 2), entry("annoying", 2), entry("waste of time", 2),
            entry("not happy", 1), entry("bad", 1), entry("too expensive", 1), entry("spam", 2),
            entry("کلاهبردار", 3), entry("مزاحم نشو", 3), entry("پیام نده", 3), entry("شکایت", 2),
            entry("افتضاح", 2), entry("عصبانی", 2), entry("ناراضی", 2), entry("بد", 1),
            entry("احتيال", 3), entry("نصاب", 3), entry("توقف عن", 3), entry("شكوى", 2),
            entry("سيء جدا", 2), entry("غاضب", 2), entry("مزعج", 2), entry("سيء", 1),
            entry("мошенн*", 3), entry("отстаньте", 3), entry("отстань", 3), entry("жалоб*", 2),
            entry("хватит писать", 3), entry("ужасн*", 2), entry("бесит", 2), entry("разочарова*", 2),
            entry("плохо", 1)
    );

    private static final List<WeightedPhrase> PHRASES = NEGATIVE.entrySet().stream()
            .map(e -> WeightedPhrase.of(e.getKey(), e.getValue()))
            .toList();

    public int negativeScore(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        String normalized = TextNormalizer.normalize(text);
        int score = 0;
        for (WeightedPhrase phrase : PHRASES) {
            if (phrase.pattern().matcher(normalized).find()) {
                score += phrase.weight();
            }
        }
        if (text.contains("!!!")) {
            score++;
        }
        return score;
    }

    public boolean isStronglyNegative(String text) {
        return negativeScore(text) >= STRONG_NEGATIVE_THRESHOLD;
    }

    private record WeightedPhrase(Pattern pattern, int weight) {

        static WeightedPhrase of(String phrase, int weight) {
            boolean stem = phrase.endsWith("*");
            String body = Pattern.quote(stem ? phrase.substring(0, phrase.length() - 1) : phrase);
            String regex = "(?<!\\p{L})" + body + (stem ? "" : "(?!\\p{L})");
            return new WeightedPhrase(Pattern.compile(regex), weight);
        }
    }
}
