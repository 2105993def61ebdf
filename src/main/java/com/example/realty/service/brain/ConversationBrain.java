package com.example.realty.service.brain;

import com.example.realty.config.EngineProperties;
import com.example.realty.controllers.InferenceApiClient;
import com.example.realty.controllers.PropertyMatchingClient;
import com.example.realty.dto.InboundEvent;
import com.example.realty.dto.PropertySummary;
import com.example.realty.model.ConversationState;
import com.example.realty.model.EventKind;
import com.example.realty.model.Language;
import com.example.realty.model.Lead;
import com.example.realty.model.SlotNames;
import com.example.realty.service.extraction.PartialSlots;
import com.example.realty.service.extraction.SlotExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

import static com.example.realty.model.ConversationState.*;

/**
 * Entry point of a turn: triages the message, runs the slot extractor once, asks the collaborators for
 * whatever the current state will need and hands the result to the pure {@link ConversationEngine}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationBrain {

    private static final Set<ConversationState> CONVERSATIONAL = EnumSet.of(
            WARMUP, CAPTURE_CONTACT, HARD_GATE, SLOT_FILLING, VALUE_PROPOSITION, ENGAGEMENT);

    private final InputClassifier classifier;
    private final SlotExtractor slotExtractor;
    private final InferenceApiClient inferenceApiClient;
    private final PropertyMatchingClient propertyMatchingClient;
    private final ConversationEngine engine;
    private final EngineProperties properties;

    public Outcome process(Lead lead, InboundEvent event, LocalDateTime now, String agentName) {
        if (event.getKind().isSynthetic()) {
            return engine.transition(new ConversationTurn(lead, event, now, TurnFacts.none(agentName)));
        }

        ConversationState state = lead.getConversationState();
        Language language = lead.getLanguage() == null ? Language.EN : lead.getLanguage();
        String text = event.text();

        PartialSlots extracted = PartialSlots.empty();
        if (CONVERSATIONAL.contains(state) && event.getKind().isFreeText()) {
            extracted = slotExtractor.extract(text, lead.getSlots(), language, state == SLOT_FILLING);
        }

        Triage triage = classifier.classify(event.getKind(), text, extracted);

        String answer = null;
        if (needsAnswer(state, triage)) {
            answer = inferenceApiClient.answer(lead.getTenantId(), text, language, lead.getSlots()).orElse(null);
        }

        List<PropertySummary> matches = List.of();
        Map<String, String> slots = mergedSlots(lead, extracted, event);
        if (needsMatches(state, triage, slots)) {
            matches = propertyMatchingClient.match(lead.getTenantId(), slots);
        }

        TurnFacts facts = new TurnFacts(triage, extracted, answer, matches, drawScarcity(), agentName);
        log.debug("Lead {} in {}: triage={}, extracted={}, matches={}",
                lead.getId(), state, triage.kind(), extracted, matches.size());
        return engine.transition(new ConversationTurn(lead, event, now, facts));
    }

    private boolean needsAnswer(ConversationState state, Triage triage) {
        if (!CONVERSATIONAL.contains(state)) {
            return false;
        }
        if (triage.is(InputKind.QUESTION)) {
            return true;
        }
        // engagement answers free text too, unless it escalates or books
        return state == ENGAGEMENT
                && !triage.is(InputKind.MEDIA_REQUEST)
                && !triage.bookingIntent()
                && !triage.stronglyNegative();
    }

    private boolean needsMatches(ConversationState state, Triage triage, Map<String, String> slots) {
        if (!CONVERSATIONAL.contains(state)) {
            return false;
        }
        if (triage.is(InputKind.MEDIA_REQUEST)) {
            return true;
        }
        boolean hasBudget = slots.containsKey(SlotNames.BUDGET_MIN) || slots.containsKey(SlotNames.BUDGET_MAX);
        return (state == SLOT_FILLING || state == VALUE_PROPOSITION) && hasBudget;
    }

    private Map<String, String> mergedSlots(Lead lead, PartialSlots extracted, InboundEvent event) {
        Map<String, String> merged = new HashMap<>(lead.getSlots() == null ? Map.of() : lead.getSlots());
        extracted.asMap().forEach(merged::putIfAbsent);
        if (event.getKind() == EventKind.BUTTON) {
            ButtonCodes.parseSlots(event.getPayload()).forEach(merged::putIfAbsent);
        }
        return merged;
    }

    private int drawScarcity() {
        EngineProperties.ConversationConfig config = properties.getConversation();
        int min = config.getScarcityMinUnits();
        int max = Math.max(min, config.getScarcityMaxUnits());
        return ThreadLocalRandom.current().nextInt(min, max + 1);
    }
}
