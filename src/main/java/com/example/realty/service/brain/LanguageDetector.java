package com.example.realty.service.brain;

import com.example.realty.model.Language;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Script-based guess. Persian is told apart from Arabic by the letters Arabic does not use.
 */
@Component
public class LanguageDetector {

    // pe, che, zhe, gaf, keheh, farsi yeh
    private static final String PERSIAN_ONLY = "\u067E\u0686\u0698\u06AF\u06A9\u06CC";

    public Optional<Language> detect(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        int latin = 0;
        int cyrillic = 0;
        int arabicScript = 0;
        boolean persianLetters = false;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!Character.isLetter(c)) {
                continue;
            }
            Character.UnicodeBlock block = Character.UnicodeBlock.of(c);
            if (block == Character.UnicodeBlock.CYRILLIC) {
                cyrillic++;
            } else if (block == Character.UnicodeBlock.ARABIC) {
                arabicScript++;
                if (PERSIAN_ONLY.indexOf(c) >= 0) {
                    persianLetters = true;
                }
            } else if (c < 0x250) {
                latin++;
            }
        }

        if (arabicScript > 0 && arabicScript >= Math.max(latin, cyrillic)) {
            return Optional.of(persianLetters ? Language.FA : Language.AR);
        }
        if (cyrillic > 0 && cyrillic >= latin) {
            return Optional.of(Language.RU);
        }
        if (latin > 0) {
            return Optional.of(Language.EN);
        }
        return Optional.empty();
    }
}
