package com.example.realty.service.brain;

import com.example.realty.dto.PropertySummary;
import com.example.realty.dto.ReplyButton;
import com.example.realty.model.Language;
import com.example.realty.model.SlotNames;
import com.example.realty.service.extraction.SlotExtractor;
import com.example.realty.service.util.Msg;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.text.NumberFormat;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Customer-facing texts and buttons, resolved from the {@code messages} bundles.
 */
@Component
@RequiredArgsConstructor
public class ReplyCatalog {

    private static final List<String> GOALS = List.of(
            SlotExtractor.GOAL_INVESTMENT, SlotExtractor.GOAL_LIVING, SlotExtractor.GOAL_RESIDENCY);
    private static final List<String> PROPERTY_TYPES = List.of("apartment", "villa", "townhouse", "penthouse");

    private final Msg msg;

    public String languagePrompt() {
        return msg.get("lang.prompt", Language.EN);
    }

    public List<ReplyButton> languageButtons() {
        return Arrays.stream(Language.values())
                .map(language -> new ReplyButton(language.nativeName(), ButtonCodes.language(language)))
                .toList();
    }

    public String greeting(Language language, String leadName, String agentName) {
        return msg.get("warmup.greeting", language, name(language, leadName), agentName == null ? "" : agentName);
    }

    public String goalReask(Language language) {
        return msg.get("warmup.reask", language);
    }

    public List<ReplyButton> goalButtons(Language language) {
        return GOALS.stream()
                .map(goal -> new ReplyButton(msg.get("goal." + goal, language), ButtonCodes.slot(SlotNames.GOAL, goal)))
                .toList();
    }

    public String contactRequest(Language language) {
        return msg.get("contact.request", language);
    }

    public String contactRetry(Language language) {
        return msg.get("contact.retry", language);
    }

    public String contactReminder(Language language) {
        return msg.get("contact.reminder", language);
    }

    public String contactAccepted(Language language, String leadName) {
        return msg.get("contact.accepted", language, name(language, leadName));
    }

    public String mediaPreview(Language language, List<PropertySummary> matches, int limit) {
        if (matches.isEmpty()) {
            return msg.get("media.preview.generic", language);
        }
        return msg.get("media.preview", language, lines(language, matches, limit));
    }

    public String answerFallback(Language language) {
        return msg.get("answer.fallback", language);
    }

    public String askSlot(Language language, String slot) {
        return msg.get("slot.ask." + slot, language);
    }

    public String slotsComplete(Language language) {
        return msg.get("slot.ready", language);
    }

    public List<ReplyButton> slotButtons(Language language, String slot) {
        if (SlotNames.PROPERTY_TYPE.equals(slot)) {
            return PROPERTY_TYPES.stream()
                    .map(type -> new ReplyButton(msg.get("ptype." + type, language),
                            ButtonCodes.slot(SlotNames.PROPERTY_TYPE, type)))
                    .toList();
        }
        if (SlotNames.BUDGET_MIN.equals(slot) || SlotNames.BUDGET_MAX.equals(slot)) {
            return List.of(
                    new ReplyButton(msg.get("budget.option.1", language), ButtonCodes.budget(null, 1_000_000L)),
                    new ReplyButton(msg.get("budget.option.2", language), ButtonCodes.budget(1_000_000L, 2_000_000L)),
                    new ReplyButton(msg.get("budget.option.3", language), ButtonCodes.budget(2_000_000L, 5_000_000L)),
                    new ReplyButton(msg.get("budget.option.4", language), ButtonCodes.budget(5_000_000L, null)));
        }
        return List.of();
    }

    public String valueWithMatches(Language language, List<PropertySummary> matches, int limit, int unitsLeft) {
        return msg.get("value.matches", language, lines(language, matches, limit))
                + "\n\n" + msg.get("value.scarcity", language, unitsLeft)
                + "\n\n" + msg.get("value.cta", language);
    }

    public String hotMarket(Language language) {
        return msg.get("value.hot_market", language);
    }

    public List<ReplyButton> engagementButtons(Language language, boolean withPhotos) {
        List<ReplyButton> buttons = new ArrayList<>();
        buttons.add(new ReplyButton(msg.get("button.book", language), ButtonCodes.BOOK));
        if (withPhotos) {
            buttons.add(new ReplyButton(msg.get("button.photos", language), ButtonCodes.PHOTOS));
        }
        return buttons;
    }

    public String engagementNudge(Language language) {
        return msg.get("engagement.nudge", language);
    }

    public String bookingConfirmed(Language language, String phone) {
        return msg.get("engagement.booking_confirmed", language, phone);
    }

    public String hardGatePhone(Language language) {
        return msg.get("gate.phone", language);
    }

    public String escalation(Language language) {
        return msg.get("engagement.escalation", language);
    }

    public String handoffAck(Language language) {
        return msg.get("handoff.ack", language);
    }

    public String followup(Language language, int stage, String leadName) {
        return msg.get("followup.stage." + Math.max(0, Math.min(4, stage)), language, name(language, leadName));
    }

    public String ghostNudge(Language language, String leadName) {
        return msg.get("ghost.nudge", language, name(language, leadName));
    }

    public String genericError(Language language) {
        return msg.get("error.generic", language);
    }

    private String name(Language language, String leadName) {
        return leadName == null || leadName.isBlank() ? msg.get("lead.name.default", language) : leadName.trim();
    }

    private String lines(Language language, List<PropertySummary> matches, int limit) {
        StringBuilder sb = new StringBuilder();
        matches.stream().limit(Math.max(1, limit)).forEach(p -> {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(msg.get("value.match.line", language,
                    p.getTitle() == null ? "" : p.getTitle(),
                    p.getLocation() == null ? "" : p.getLocation(),
                    price(p.getPrice()),
                    p.getCurrency() == null ? "AED" : p.getCurrency()));
        });
        return sb.toString();
    }

    private static String price(BigDecimal price) {
        if (price == null) {
            return "-";
        }
        return NumberFormat.getIntegerInstance(Locale.US).format(price);
    }
}
