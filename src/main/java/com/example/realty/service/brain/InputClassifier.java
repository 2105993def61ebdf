package com.example.realty.service.brain;

import com.example.realty.model.EventKind;
import com.example.realty.service.extraction.PartialSlots;
import com.example.realty.service.util.TextNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Priority-ordered triage of a free-text message, run before any state commits to a single-purpose prompt.
 */
@Component
@RequiredArgsConstructor
public class InputClassifier {

    private static final Pattern MEDIA = Pattern.compile(
            "(\\bshow\\b|photo|picture|\\bpics?\\b|image|video|gallery|brochure|floor ?plan|virtual tour"
                    + "|عکس|تصویر|ویدیو|فیلم|نشون بده|نشان بده|بروشور"
                    + "|صورة|الصور|فيديو|أرني|ارني|كتيب"
                    + "|фото|видео|покажи|покажите|картинк|буклет|планировк)");

    private static final Set<String> INTERROGATIVE_OPENERS = Set.of(
            "what", "how", "where", "when", "why", "which", "who", "whose", "is", "are", "can", "could",
            "do", "does", "did", "will", "would", "should", "may", "any",
            "چی", "چه", "کجا", "کی", "چرا", "چطور", "چطوری", "آیا", "ایا", "چند", "کدام", "کدوم",
            "ما", "ماذا", "كيف", "أين", "اين", "متى", "لماذا", "هل", "كم", "أي", "اي",
            "что", "как", "где", "когда", "почему", "зачем", "сколько", "какой", "какая", "какие", "можно", "есть");

    private static final Pattern INLINE_QUESTION = Pattern.compile(
            "(\\?|؟|\\bли\\b|چیه|چنده|کجاست|چطوره)");

    private static final Pattern BOOKING = Pattern.compile(
            "(\\bbook(?:ing|ed)?\\b|\\bviewings?\\b|\\bvisit\\b|\\bappointment|\\bmeeting\\b|\\bconsultation\\b"
                    + "|\\bcall me\\b|\\bschedule\\b|\\bsite tour"
                    + "|رزرو|بازدید|وقت ملاقات|تماس بگیر|مشاوره"
                    + "|حجز|موعد|زيارة|معاينة|اتصل بي|استشارة"
                    + "|заброниру|бронь|просмотр|встреч|позвоните|консультац)");

    private static final Pattern LONG_DIGIT_RUN = Pattern.compile("\\d[\\d\\s\\-()]{6,}\\d");

    private final SentimentAnalyzer sentimentAnalyzer;

    public Triage classify(EventKind kind, String text, PartialSlots extracted) {
        if (kind == EventKind.BUTTON) {
            boolean booking = ButtonCodes.is(text, ButtonCodes.BOOK);
            InputKind inputKind = ButtonCodes.is(text, ButtonCodes.PHOTOS) ? InputKind.MEDIA_REQUEST : InputKind.SLOT_CANDIDATE;
            return new Triage(inputKind, booking, false);
        }
        if (kind == null || !kind.isFreeText() || text == null || text.isBlank()) {
            return Triage.of(InputKind.UNRECOGNIZED);
        }

        String normalized = TextNormalizer.normalize(text);
        boolean booking = BOOKING.matcher(normalized).find();
        boolean negative = sentimentAnalyzer.isStronglyNegative(text);

        InputKind inputKind;
        if (isMediaRequest(normalized)) {
            inputKind = InputKind.MEDIA_REQUEST;
        } else if (isQuestion(normalized)) {
            inputKind = InputKind.QUESTION;
        } else if ((extracted != null && !extracted.isEmpty()) || LONG_DIGIT_RUN.matcher(normalized).find()) {
            inputKind = InputKind.SLOT_CANDIDATE;
        } else {
            inputKind = InputKind.UNRECOGNIZED;
        }
        return new Triage(inputKind, booking, negative);
    }

    boolean isMediaRequest(String normalized) {
        return MEDIA.matcher(normalized).find();
    }

    boolean isQuestion(String normalized) {
        if (INLINE_QUESTION.matcher(normalized).find()) {
            return true;
        }
        String first = normalized.split("[\\s,.!]+", 2)[0];
        return INTERROGATIVE_OPENERS.contains(first);
    }
}
