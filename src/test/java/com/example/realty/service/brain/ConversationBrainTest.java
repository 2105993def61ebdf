package com.example.realty.service.brain;

import com.example.realty.config.EngineProperties;
import com.example.realty.controllers.InferenceApiClient;
import com.example.realty.controllers.PropertyMatchingClient;
import com.example.realty.dto.FollowupTick;
import com.example.realty.dto.InboundEvent;
import com.example.realty.dto.PropertySummary;
import com.example.realty.model.Channel;
import com.example.realty.model.ConversationState;
import com.example.realty.model.EventKind;
import com.example.realty.model.Language;
import com.example.realty.model.Lead;
import com.example.realty.model.SlotNames;
import com.example.realty.service.extraction.BudgetParser;
import com.example.realty.service.extraction.PartialSlots;
import com.example.realty.service.extraction.SlotExtractor;
import com.example.realty.support.TestMessages;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ConversationBrainTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 2, 10, 0);

    private SlotExtractor slotExtractor;
    private InferenceApiClient inferenceApiClient;
    private PropertyMatchingClient matchingClient;
    private ReplyCatalog replies;
    private ConversationEngine engine;
    private EngineProperties properties;
    private ConversationBrain brain;

    @BeforeEach
    void setUp() {
        slotExtractor = mock(SlotExtractor.class);
        inferenceApiClient = mock(InferenceApiClient.class);
        matchingClient = mock(PropertyMatchingClient.class);
        properties = new EngineProperties();
        replies = new ReplyCatalog(TestMessages.msg());
        engine = new ConversationEngine(replies, new PhoneNumberParser(), new LanguageDetector(), properties);
        brain = new ConversationBrain(new InputClassifier(new SentimentAnalyzer()), slotExtractor,
                inferenceApiClient, matchingClient, engine, properties);

        when(slotExtractor.extract(anyString(), anyMap(), any(Language.class), anyBoolean()))
                .thenReturn(PartialSlots.empty());
        when(matchingClient.match(any(), anyMap())).thenReturn(List.of());
    }

    @Test
    void shouldNotCallCollaboratorsOnTicks() {
        InboundEvent tick = event(EventKind.FOLLOWUP_TICK, null).toBuilder().tick(FollowupTick.drip(0)).build();

        Outcome outcome = brain.process(lead(ConversationState.SLOT_FILLING), tick, NOW, "Acme");

        assertThat(outcome.hasReply()).isTrue();
        verifyNoInteractions(slotExtractor, inferenceApiClient, matchingClient);
    }

    @Test
    void shouldSkipExtractionBeforeWarmup() {
        brain.process(lead(ConversationState.START), event(EventKind.TEXT, "hello"), NOW, "Acme");

        verifyNoInteractions(slotExtractor, inferenceApiClient, matchingClient);
    }

    @Test
    void shouldAnswerQuestionThroughInference() {
        when(inferenceApiClient.answer(eq(7L), anyString(), eq(Language.EN), anyMap()))
                .thenReturn(Optional.of("Yes, there is covered parking."));

        Outcome outcome = brain.process(lead(ConversationState.ENGAGEMENT),
                event(EventKind.TEXT, "is there parking?"), NOW, "Acme");

        assertThat(outcome.getReplyText()).isEqualTo("Yes, there is covered parking.");
        verify(matchingClient, never()).match(any(), anyMap());
    }

    @Test
    void shouldFetchMatchesOnceBudgetIsExtracted() {
        when(slotExtractor.extract(anyString(), anyMap(), any(Language.class), eq(true)))
                .thenReturn(PartialSlots.of(Map.of(SlotNames.BUDGET_MIN, "1000000", SlotNames.BUDGET_MAX, "2000000")));
        when(matchingClient.match(eq(7L), anyMap())).thenReturn(List.of(PropertySummary.builder()
                .id(5L).title("Creek Rise").location("Creek Harbour").price(new BigDecimal("1800000")).build()));

        Outcome outcome = brain.process(lead(ConversationState.SLOT_FILLING),
                event(EventKind.TEXT, "1-2m"), NOW, "Acme");

        assertThat(outcome.getNextState()).isEqualTo(ConversationState.ENGAGEMENT);
        assertThat(outcome.getReplyText()).contains("Creek Rise");
        verify(matchingClient).match(eq(7L), anyMap());
    }

    @Test
    void shouldNotAskInferenceWhenBookingInEngagement() {
        Lead lead = lead(ConversationState.ENGAGEMENT);
        lead.setPhone("+971501234567");

        Outcome outcome = brain.process(lead, event(EventKind.TEXT, "I want to book a viewing"), NOW, "Acme");

        assertThat(outcome.getNextState()).isEqualTo(ConversationState.HANDOFF);
        verify(inferenceApiClient, never()).answer(any(), anyString(), any(), anyMap());
    }

    @Test
    void shouldNotEscalateWorstCaseQuestion() {
        Lead lead = lead(ConversationState.ENGAGEMENT);
        lead.setPhone("+971501234567");

        Outcome outcome = brain.process(lead, event(EventKind.TEXT, "what is the worst case ROI here"), NOW, "Acme");

        assertThat(outcome.getNextState()).isEqualTo(ConversationState.ENGAGEMENT);
        assertThat(outcome.getAdminAlerts()).isEmpty();
    }

    @Test
    void shouldNotGateBookletRequest() {
        Outcome outcome = brain.process(lead(ConversationState.ENGAGEMENT),
                event(EventKind.TEXT, "can I get the booklet of the project"), NOW, "Acme");

        assertThat(outcome.getPath()).doesNotContain(ConversationState.HARD_GATE);
        assertThat(outcome.getNextState()).isEqualTo(ConversationState.ENGAGEMENT);
    }

    @ParameterizedTest
    @EnumSource(value = ConversationState.class, names = {"CAPTURE_CONTACT", "HARD_GATE"})
    void shouldAnswerQuestionWithPhoneLikeTextWithoutReadingIt(ConversationState state) {
        Outcome outcome = brain.process(lead(state), event(EventKind.TEXT, "is +971 50 123 4567 ok?"), NOW, "Acme");

        assertThat(outcome.getNextState()).isEqualTo(state);
        assertThat(outcome.getPhone()).isNull();
        assertThat(outcome.getContactRetries()).isNull();
        assertThat(outcome.getAdminAlerts()).isEmpty();
        assertThat(outcome.getReplyText()).endsWith(replies.contactReminder(Language.EN));
    }

    @Test
    void shouldReachContactCaptureFromGreetingThroughTextGoal() {
        when(inferenceApiClient.extractEntities(anyString(), any())).thenReturn(Optional.of("not json"));
        SlotExtractor realExtractor = new SlotExtractor(inferenceApiClient, new BudgetParser(), new ObjectMapper(), properties);
        ConversationBrain realBrain = new ConversationBrain(new InputClassifier(new SentimentAnalyzer()), realExtractor,
                inferenceApiClient, matchingClient, engine, properties);
        Lead lead = lead(ConversationState.START);
        lead.setLanguage(null);

        Outcome greeted = realBrain.process(lead, event(EventKind.TEXT, "hi"), NOW, "Acme");

        assertThat(greeted.getNextState()).isEqualTo(ConversationState.WARMUP);
        assertThat(greeted.getLanguage()).isEqualTo(Language.EN);

        lead.setConversationState(greeted.getNextState());
        lead.setLanguage(greeted.getLanguage());
        Outcome goal = realBrain.process(lead, event(EventKind.TEXT, "investment"), NOW, "Acme");

        assertThat(goal.getNextState()).isEqualTo(ConversationState.CAPTURE_CONTACT);
        assertThat(goal.getSlotUpdates()).containsEntry(SlotNames.GOAL, "investment");
        assertThat(goal.getReplyText()).isEqualTo(replies.contactRequest(Language.EN));
    }

    private static Lead lead(ConversationState state) {
        return Lead.builder()
                .id(1L)
                .tenantId(7L)
                .channel(Channel.TELEGRAM)
                .channelIdentity("100")
                .displayName("Sara")
                .language(Language.EN)
                .conversationState(state)
                .slots(new HashMap<>())
                .build();
    }

    private static InboundEvent event(EventKind kind, String payload) {
        return InboundEvent.builder()
                .tenantId(7L)
                .channel(Channel.TELEGRAM)
                .channelIdentity("100")
                .kind(kind)
                .payload(payload)
                .timestamp(NOW)
                .build();
    }
}
