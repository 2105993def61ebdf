package com.example.realty.service.brain;

import com.example.realty.config.EngineProperties;
import com.example.realty.dto.InboundEvent;
import com.example.realty.dto.ReplyButton;
import com.example.realty.model.ConversationState;
import com.example.realty.model.EventKind;
import com.example.realty.model.Language;
import com.example.realty.model.Lead;
import com.example.realty.model.SlotNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static com.example.realty.model.ConversationState.*;

/**
 * The qualification state machine. {@link #transition(ConversationTurn)} reads only the turn it is given:
 * collaborator answers and matches arrive in {@link TurnFacts}, side effects leave as {@link Directive}s.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConversationEngine {

    static final int MAX_RAW_CONTACT_LENGTH = 64;

    /** asked in this order while filling slots */
    private static final List<String> SLOT_QUESTIONS = List.of(
            SlotNames.BUDGET_MIN, SlotNames.PROPERTY_TYPE, SlotNames.LOCATION);

    private final ReplyCatalog replies;
    private final PhoneNumberParser phoneParser;
    private final LanguageDetector languageDetector;
    private final EngineProperties properties;

    public Outcome transition(ConversationTurn turn) {
        ConversationState state = turn.lead().getConversationState();
        Draft draft = new Draft(turn);

        if (turn.event().getKind().isSynthetic()) {
            onTick(turn, draft);
        } else {
            switch (state) {
                case START -> onStart(turn, draft);
                case LANGUAGE_SELECT -> onLanguageSelect(turn, draft);
                case WARMUP -> onWarmup(turn, draft);
                case CAPTURE_CONTACT, HARD_GATE -> onContactGate(turn, draft);
                case SLOT_FILLING -> onSlotFilling(turn, draft);
                case VALUE_PROPOSITION -> proposeValue(turn, draft);
                case ENGAGEMENT -> onEngagement(turn, draft);
                case HANDOFF -> draft.say(replies.handoffAck(draft.language));
                case CLOSED_WON, CLOSED_LOST -> log.debug("Lead {} is closed, no reply", turn.lead().getId());
            }
        }

        Outcome outcome = draft.build();
        verifyPath(state, outcome.getPath());
        return outcome;
    }

    private void onTick(ConversationTurn turn, Draft draft) {
        Lead lead = turn.lead();
        if (!lead.getConversationState().acceptsFollowups()) {
            return;
        }
        if (turn.event().getKind() == EventKind.GHOST_TICK) {
            draft.say(replies.ghostNudge(draft.language, lead.getDisplayName()));
            return;
        }
        int stage = turn.event().getTick() != null ? turn.event().getTick().stage() : lead.getFollowupStage();
        draft.say(replies.followup(draft.language, stage, lead.getDisplayName()));
    }

    private void onStart(ConversationTurn turn, Draft draft) {
        String text = turn.event().text();
        if (text.toLowerCase(Locale.ROOT).startsWith("/start")) {
            promptLanguage(draft);
            return;
        }
        Optional<Language> chosen = chosenLanguage(turn.event());
        if (chosen.isEmpty() && turn.event().getKind() != EventKind.BUTTON) {
            chosen = languageDetector.detect(text);
        }
        chosen.ifPresentOrElse(language -> greet(turn, draft, language), () -> promptLanguage(draft));
    }

    private void onLanguageSelect(ConversationTurn turn, Draft draft) {
        chosenLanguage(turn.event())
                .ifPresentOrElse(language -> greet(turn, draft, language), () -> promptLanguage(draft));
    }

    private void promptLanguage(Draft draft) {
        draft.moveTo(LANGUAGE_SELECT);
        draft.say(replies.languagePrompt());
        draft.buttons(replies.languageButtons());
    }

    private void greet(ConversationTurn turn, Draft draft, Language language) {
        draft.switchLanguage(language);
        draft.moveTo(WARMUP);
        draft.say(replies.greeting(language, turn.lead().getDisplayName(), turn.facts().agentName()));
        draft.buttons(replies.goalButtons(language));
    }

    private void onWarmup(ConversationTurn turn, Draft draft) {
        TurnFacts facts = turn.facts();
        draft.absorbSlots();

        if (draft.hasSlot(SlotNames.GOAL)) {
            draft.moveTo(CAPTURE_CONTACT);
            draft.say(replies.contactRequest(draft.language));
            return;
        }
        if (facts.triage().is(InputKind.QUESTION)) {
            draft.say(facts.hasAnswer() ? facts.answer() : replies.answerFallback(draft.language));
        } else if (facts.triage().is(InputKind.MEDIA_REQUEST)) {
            draft.say(replies.mediaPreview(draft.language, facts.matches(), maxPreview()));
        }
        draft.say(replies.goalReask(draft.language));
        draft.buttons(replies.goalButtons(draft.language));
    }

    /**
     * Shared by CAPTURE_CONTACT and HARD_GATE. Media and question intent are served before the text is
     * ever read as a phone number.
     */
    private void onContactGate(ConversationTurn turn, Draft draft) {
        Lead lead = turn.lead();
        TurnFacts facts = turn.facts();
        InboundEvent event = turn.event();
        draft.absorbSlots();

        if (facts.triage().is(InputKind.MEDIA_REQUEST)) {
            draft.say(replies.mediaPreview(draft.language, facts.matches(), maxPreview()));
            draft.say(replies.contactReminder(draft.language));
            return;
        }
        if (facts.triage().is(InputKind.QUESTION)) {
            draft.say(facts.hasAnswer() ? facts.answer() : replies.answerFallback(draft.language));
            draft.say(replies.contactReminder(draft.language));
            return;
        }

        Optional<String> phone = event.getKind() == EventKind.BUTTON
                ? Optional.empty()
                : phoneParser.parse(event.text());

        if (phone.isEmpty() && lead.getContactRetries() < properties.getConversation().getContactRetryBudget()) {
            draft.contactRetries(lead.getContactRetries() + 1);
            draft.say(replies.contactRetry(draft.language));
            return;
        }

        String contact = phone.orElseGet(() -> rawContact(event.text()));
        if (contact.isBlank()) {
            draft.contactRetries(lead.getContactRetries() + 1);
            draft.say(replies.contactRetry(draft.language));
            return;
        }
        if (phone.isEmpty()) {
            log.info("Lead {} exhausted the contact retry budget, accepting '{}' as contact", lead.getId(), contact);
        }
        draft.phone(contact);
        draft.contactRetries(0);

        if (lead.getConversationState() == HARD_GATE) {
            draft.alert(AlertKind.HOT_LEAD, contact);
            draft.moveTo(HANDOFF);
            draft.say(replies.bookingConfirmed(draft.language, contact));
            return;
        }

        draft.alert(AlertKind.NEW_CONTACT, contact);
        draft.moveTo(SLOT_FILLING);
        draft.say(replies.contactAccepted(draft.language, lead.getDisplayName()));
        askNextSlot(draft);
    }

    private void onSlotFilling(ConversationTurn turn, Draft draft) {
        TurnFacts facts = turn.facts();
        draft.absorbSlots();

        if (facts.triage().is(InputKind.QUESTION)) {
            draft.say(facts.hasAnswer() ? facts.answer() : replies.answerFallback(draft.language));
        } else if (facts.triage().is(InputKind.MEDIA_REQUEST) && !draft.hasBudget()) {
            draft.say(replies.mediaPreview(draft.language, facts.matches(), maxPreview()));
        }

        if (draft.hasBudget()) {
            proposeValue(turn, draft);
            return;
        }
        askNextSlot(draft);
    }

    private void askNextSlot(Draft draft) {
        for (String slot : SLOT_QUESTIONS) {
            boolean missing = SlotNames.BUDGET_MIN.equals(slot) ? !draft.hasBudget() : !draft.hasSlot(slot);
            if (missing) {
                draft.say(replies.askSlot(draft.language, slot));
                draft.buttons(replies.slotButtons(draft.language, slot));
                return;
            }
        }
        draft.say(replies.slotsComplete(draft.language));
    }

    /** Passes through VALUE_PROPOSITION and always lands in ENGAGEMENT. */
    private void proposeValue(ConversationTurn turn, Draft draft) {
        TurnFacts facts = turn.facts();
        if (draft.current != VALUE_PROPOSITION) {
            draft.moveTo(VALUE_PROPOSITION);
        }
        boolean hasMatches = !facts.matches().isEmpty();
        if (hasMatches) {
            draft.say(replies.valueWithMatches(draft.language, facts.matches(), maxPreview(), scarcity(facts)));
        } else {
            draft.say(replies.hotMarket(draft.language));
        }
        draft.buttons(replies.engagementButtons(draft.language, hasMatches));
        draft.moveTo(ENGAGEMENT);
    }

    private void onEngagement(ConversationTurn turn, Draft draft) {
        Lead lead = turn.lead();
        TurnFacts facts = turn.facts();
        draft.absorbSlots();

        if (facts.triage().stronglyNegative()) {
            draft.alert(AlertKind.ESCALATION, lead.getPhone());
            draft.moveTo(HANDOFF);
            draft.say(replies.escalation(draft.language));
            return;
        }
        if (facts.triage().bookingIntent()) {
            if (lead.getPhone() != null && !lead.getPhone().isBlank()) {
                draft.alert(AlertKind.HOT_LEAD, lead.getPhone());
                draft.moveTo(HANDOFF);
                draft.say(replies.bookingConfirmed(draft.language, lead.getPhone()));
            } else {
                draft.moveTo(HARD_GATE);
                draft.say(replies.hardGatePhone(draft.language));
            }
            return;
        }
        if (facts.triage().is(InputKind.MEDIA_REQUEST)) {
            draft.say(replies.mediaPreview(draft.language, facts.matches(), maxPreview()));
            draft.buttons(replies.engagementButtons(draft.language, false));
            return;
        }
        draft.say(facts.hasAnswer() ? facts.answer() : replies.engagementNudge(draft.language));
        draft.buttons(replies.engagementButtons(draft.language, false));
    }

    private Optional<Language> chosenLanguage(InboundEvent event) {
        if (event.getKind() == EventKind.BUTTON) {
            return ButtonCodes.parseLanguage(event.getPayload());
        }
        return Language.fromCode(event.text());
    }

    private int scarcity(TurnFacts facts) {
        EngineProperties.ConversationConfig config = properties.getConversation();
        int units = facts.scarcityUnits();
        return Math.max(config.getScarcityMinUnits(), Math.min(config.getScarcityMaxUnits(), units));
    }

    private int maxPreview() {
        return properties.getConversation().getMaxPreviewItems();
    }

    private static String rawContact(String text) {
        String trimmed = text == null ? "" : text.trim();
        return trimmed.length() > MAX_RAW_CONTACT_LENGTH ? trimmed.substring(0, MAX_RAW_CONTACT_LENGTH) : trimmed;
    }

    private static void verifyPath(ConversationState from, List<ConversationState> path) {
        ConversationState current = from;
        for (ConversationState next : path) {
            if (!current.canTransitionTo(next)) {
                throw new IllegalStateException("Illegal transition " + current + " -> " + next);
            }
            current = next;
        }
    }

    /** Mutable accumulator for one turn's outcome. */
    private final class Draft {

        private final ConversationTurn turn;
        private final Outcome.OutcomeBuilder builder = Outcome.builder();
        private final List<String> texts = new ArrayList<>();
        private final List<ReplyButton> buttons = new ArrayList<>();
        private final List<ConversationState> path = new ArrayList<>();
        private final Map<String, String> slotUpdates = new LinkedHashMap<>();
        private final Map<String, String> known;
        private final List<AdminAlert> alerts = new ArrayList<>();
        private ConversationState current;
        private Language language;

        Draft(ConversationTurn turn) {
            this.turn = turn;
            this.current = turn.lead().getConversationState();
            this.language = turn.lead().getLanguage() == null ? Language.EN : turn.lead().getLanguage();
            this.known = new HashMap<>(turn.lead().getSlots() == null ? Map.of() : turn.lead().getSlots());
        }

        void moveTo(ConversationState next) {
            path.add(next);
            current = next;
        }

        void say(String text) {
            if (text != null && !text.isBlank()) {
                texts.add(text);
            }
        }

        /** Later prompts replace the buttons of earlier ones. */
        void buttons(List<ReplyButton> replyButtons) {
            buttons.clear();
            buttons.addAll(replyButtons);
        }

        void switchLanguage(Language next) {
            language = next;
            builder.language(next);
        }

        void phone(String phone) {
            builder.phone(phone);
        }

        void contactRetries(int retries) {
            builder.contactRetries(retries);
        }

        /** Merges extracted and button-carried slots without touching keys the lead already has. */
        void absorbSlots() {
            Map<String, String> candidates = new LinkedHashMap<>(turn.facts().extracted().asMap());
            if (turn.event().getKind() == EventKind.BUTTON) {
                ButtonCodes.parseSlots(turn.event().getPayload()).forEach(candidates::putIfAbsent);
            }
            candidates.forEach((key, value) -> {
                if (!hasSlot(key)) {
                    slotUpdates.put(key, value);
                    known.put(key, value);
                }
            });
        }

        boolean hasSlot(String name) {
            String value = known.get(name);
            return value != null && !value.isBlank();
        }

        boolean hasBudget() {
            return hasSlot(SlotNames.BUDGET_MIN) || hasSlot(SlotNames.BUDGET_MAX);
        }

        void alert(AlertKind kind, String phone) {
            Lead lead = turn.lead();
            alerts.add(new AdminAlert(kind, lead.getTenantId(), lead.getId(), lead.getDisplayName(), phone,
                    known.get(SlotNames.GOAL), turn.event().text(), turn.now()));
        }

        Outcome build() {
            if (path.isEmpty()) {
                path.add(turn.lead().getConversationState());
            }
            String reply = texts.isEmpty() ? null : String.join("\n\n", texts);
            builder.replyText(reply)
                    .buttons(reply == null ? List.of() : buttons)
                    .path(path)
                    .slotUpdates(slotUpdates)
                    .directive(Directive.persist());
            if (reply != null) {
                builder.directive(Directive.sendReply());
            }
            alerts.forEach(alert -> builder.directive(Directive.notifyAdmin(alert)));
            return builder.build();
        }
    }
}
